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


package me.golemcore.engine.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.RetrievedDocument;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import me.golemcore.engine.domain.reasoning.ToolStepSummarizer;
import me.golemcore.engine.port.outbound.RetrievalPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Searches the local knowledge base through {@link RetrievalPort}.
 *
 * <p>
 * The result is the JSON array of matching documents; the agent loop turns it
 * into a context block and a source list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSearchTool implements ToolComponent {

    static final String PARAM_QUERY = "query";
    static final String PARAM_SALIENT_TERMS = "salientTerms";

    private final RetrievalPort retrievalPort;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(ToolStepSummarizer.LOCAL_SEARCH)
                .description("Search the user's notes and documents. Returns the most relevant passages.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "What to search for, in natural language"),
                                PARAM_SALIENT_TERMS, Map.of(
                                        "type", "array",
                                        "description", "Optional keywords that must be matched",
                                        "items", Map.of("type", "string"))),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolExecutionResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object query = parameters.get(PARAM_QUERY);
            if (!(query instanceof String text) || text.isBlank()) {
                return ToolExecutionResult.failure(ToolStepSummarizer.LOCAL_SEARCH, "Missing required parameter: query");
            }

            List<String> terms = salientTerms(parameters.get(PARAM_SALIENT_TERMS));
            List<RetrievedDocument> documents = retrievalPort.search(text, terms);
            log.debug("[LocalSearch] query='{}', terms={}, hits={}", text, terms.size(),
                    documents != null ? documents.size() : 0);
            try {
                String json = objectMapper.writeValueAsString(documents != null ? documents : List.of());
                return ToolExecutionResult.success(ToolStepSummarizer.LOCAL_SEARCH, json);
            } catch (JsonProcessingException e) {
                return ToolExecutionResult.failure(ToolStepSummarizer.LOCAL_SEARCH,
                        "Failed to serialize search results: " + e.getMessage());
            }
        });
    }

    private static List<String> salientTerms(Object value) {
        List<String> terms = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    terms.add(String.valueOf(item));
                }
            }
        } else if (value instanceof String single && !single.isBlank()) {
            terms.add(single);
        }
        return terms;
    }
}
