package me.golemcore.engine.domain.system.agentloop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.citation.CitationProcessor;
import me.golemcore.engine.domain.model.RetrievedDocument;
import me.golemcore.engine.domain.model.SourceCatalogEntry;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the JSON document list returned by the {@code localSearch} tool into
 * a {@code <localSearch>} context block for the model and a list of sources.
 *
 * <p>
 * The context always precedes the restated question, so the retrieved text is
 * what the model reads right before it answers.
 */
public class LocalSearchResultProcessor {

    private static final Logger log = LoggerFactory.getLogger(LocalSearchResultProcessor.class);

    static final String SEARCH_FAILED = "Search failed.";
    static final String INVALID_FORMAT = "Invalid search results format.";
    static final String NO_DOCUMENTS = "No relevant documents found.";

    private final ObjectMapper objectMapper;
    private final CitationProcessor citationProcessor;

    public LocalSearchResultProcessor(ObjectMapper objectMapper, CitationProcessor citationProcessor) {
        this.objectMapper = objectMapper;
        this.citationProcessor = citationProcessor;
    }

    public LocalSearchOutcome process(ToolExecutionResult result, String question, boolean enableCitations) {
        if (result == null || !result.isSuccess() || result.getResult() == null) {
            return new LocalSearchOutcome(List.of(), withQuestion(SEARCH_FAILED, question));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(result.getResult());
        } catch (JsonProcessingException e) {
            log.warn("[Agent] unparsable localSearch result: {}", e.getMessage());
            return new LocalSearchOutcome(List.of(), withQuestion(SEARCH_FAILED, question));
        }
        if (root == null || !root.isArray()) {
            return new LocalSearchOutcome(List.of(), withQuestion(INVALID_FORMAT, question));
        }

        List<RetrievedDocument> documents = new ArrayList<>();
        for (JsonNode node : root) {
            try {
                documents.add(objectMapper.treeToValue(node, RetrievedDocument.class));
            } catch (JsonProcessingException e) {
                log.debug("[Agent] skipping malformed search document: {}", e.getMessage());
            }
        }

        String context = buildContext(documents, enableCitations);
        return new LocalSearchOutcome(extractSources(documents), withQuestion(context, question));
    }

    /**
     * The context block for a document list: the {@code <localSearch>}
     * element plus citation guidance, or a "nothing found" line.
     */
    public String buildContext(List<RetrievedDocument> documents, boolean enableCitations) {
        List<RetrievedDocument> included = documents.stream()
                .filter(doc -> !Boolean.FALSE.equals(doc.getIncludeInContext()))
                .toList();
        if (included.isEmpty()) {
            return NO_DOCUMENTS;
        }
        List<SourceCatalogEntry> catalog = included.stream()
                .map(doc -> new SourceCatalogEntry(doc.getTitle(), doc.getPath()))
                .toList();
        return "<localSearch>\n" + formatDocuments(included) + "\n</localSearch>"
                + citationProcessor.citationGuidance(enableCitations,
                        citationProcessor.formatSourceCatalog(catalog));
    }

    public List<SourceReference> extractSources(List<RetrievedDocument> documents) {
        List<SourceReference> sources = new ArrayList<>();
        for (RetrievedDocument doc : documents) {
            String title = firstNonBlank(doc.getTitle(), doc.getPath(), "Untitled");
            String path = firstNonBlank(doc.getPath(), doc.getTitle(), "");
            sources.add(new SourceReference(title, path, doc.effectiveScore()));
        }
        return sources;
    }

    String formatDocuments(List<RetrievedDocument> documents) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < documents.size(); i++) {
            RetrievedDocument doc = documents.get(i);
            String title = firstNonBlank(doc.getTitle(), "Untitled");
            String path = doc.getPath() != null ? doc.getPath() : "";
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("<document>\n<id>").append(i + 1).append("</id>\n<title>").append(title).append("</title>");
            if (!path.isEmpty() && !path.equals(title)) {
                sb.append("\n<path>").append(path).append("</path>");
            }
            if (doc.getMtime() != null && doc.getMtime() > 0) {
                sb.append("\n<modified>").append(Instant.ofEpochMilli(doc.getMtime())).append("</modified>");
            }
            sb.append("\n<content>\n")
                    .append(citationProcessor.sanitizeContentForCitations(doc.getContent()))
                    .append("\n</content>\n</document>");
        }
        return sb.toString();
    }

    private static String withQuestion(String context, String question) {
        if (question == null || question.isBlank()) {
            return context;
        }
        return context + "\n\nQuestion: " + question;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
