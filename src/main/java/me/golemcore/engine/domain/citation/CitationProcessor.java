package me.golemcore.engine.domain.citation;

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

import me.golemcore.engine.domain.model.SourceCatalogEntry;
import me.golemcore.engine.domain.model.SourceReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the citations of a finished answer.
 *
 * <p>
 * Markers are renumbered 1..N by first mention, duplicate sources are merged
 * by title and the trailing sources block is rendered as a collapsible HTML
 * list. Running the processor on its own output returns the output unchanged.
 */
public class CitationProcessor {

    private static final Logger log = LoggerFactory.getLogger(CitationProcessor.class);

    public static final int DEFAULT_MAX_FALLBACK_SOURCES = 20;

    static final String CITATION_RULES = """
            CITATION RULES:
            1. Number citations from [^1] upward in the order you first use them, without gaps.
            2. Cite only new factual claims, specific figures or direct quotes taken from a source.
            3. Do not cite general knowledge, your own reasoning or transitional sentences; one to three citations per paragraph is plenty.
            4. Put the marker right after the claim it supports: "the study found X [^1]", not "the study found X. [^1]".
            5. Ignore bracketed numbers that appear inside the source content itself.
            6. Separate chunks of the same document may be cited separately.
            7. Finish with a '#### Sources' section listing one [^n]: [[Title]] line per citation, in citation order.""";

    private static final Pattern SUMMARY_SOURCES = Pattern.compile(
            "<summary[^>]*>\\s*sources\\s*</summary>", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOOTNOTE_MARKER = Pattern.compile("\\[\\^\\d+\\]");
    private static final Pattern NUMERIC_MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)\\](?!\\()");
    private static final Pattern DEFINITION_LINE = Pattern.compile("^[ \\t]*\\[\\^\\d+\\]:.*$", Pattern.MULTILINE);
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]+)\\]\\((https?://[^)\\s]+)\\)");
    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\]]+?)\\]\\]");
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\([^()]*\\)\\s*$");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^\\s*[-*]\\s+");

    private final int maxFallbackSources;

    public CitationProcessor() {
        this(DEFAULT_MAX_FALLBACK_SOURCES);
    }

    public CitationProcessor(int maxFallbackSources) {
        this.maxFallbackSources = maxFallbackSources > 0 ? maxFallbackSources : DEFAULT_MAX_FALLBACK_SOURCES;
    }

    /**
     * Renumbers markers, merges duplicate sources and renders the sources
     * block. Text without a sources block, or with inline citations
     * disabled, is returned unchanged.
     */
    public String processInlineCitations(String content, boolean enableInline) {
        if (content == null || content.isEmpty() || !enableInline) {
            return content;
        }
        SourcesSection section = SourcesSectionParser.split(content);
        if (section == null) {
            return content;
        }

        String block = SourcesSectionParser.normalizeBlock(section.sourcesBlock());
        List<SourcesSectionParser.SourceDefinition> definitions = SourcesSectionParser.parseDefinitions(block);
        if (definitions.isEmpty()) {
            List<String> listItems = simpleListItems(block);
            if (listItems.isEmpty()) {
                return content;
            }
            return render(section.mainContent(), listItems);
        }

        Map<Integer, SourceItem> itemsByOldNumber = new HashMap<>();
        Set<Integer> definedNumbers = new LinkedHashSet<>();
        for (SourcesSectionParser.SourceDefinition definition : definitions) {
            definedNumbers.add(definition.number());
            itemsByOldNumber.putIfAbsent(definition.number(), toSourceItem(definition.text()));
        }

        String body = section.mainContent();
        boolean footnoteMode = CitationRenumberer.hasFootnoteReferences(body);
        Map<Integer, Integer> citationMap = CitationRenumberer.buildCitationMap(body, definedNumbers,
                footnoteMode);
        body = CitationRenumberer.rewrite(body, citationMap);

        List<SourceItem> ordered = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : citationMap.entrySet()) {
            SourceItem item = itemsByOldNumber.get(entry.getKey());
            if (item == null) {
                log.warn("[Citations] marker {} has no source definition, rendered as [{}] without a source row",
                        entry.getKey(), entry.getValue());
            }
            ordered.add(item);
        }

        List<SourceItem> unique = new ArrayList<>();
        Map<Integer, Integer> consolidation = consolidate(ordered, unique);
        if (consolidation.entrySet().stream().anyMatch(e -> !e.getKey().equals(e.getValue()))) {
            log.debug("[Citations] merged {} duplicate sources", ordered.size() - unique.size());
            body = CitationRenumberer.collapseRepeated(CitationRenumberer.remapNumeric(body, consolidation));
        }

        List<String> displays = new ArrayList<>();
        for (SourceItem item : unique) {
            displays.add(item != null ? item.display() : null);
        }
        return render(body, displays);
    }

    /**
     * Appends a footnote sources section listing the retrieved sources when
     * the answer carries none of its own.
     */
    public String addFallbackSources(String text, List<SourceReference> sources, boolean enableInline) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (!enableInline || sources == null || sources.isEmpty() || hasExistingCitations(text)) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text).append("\n\n#### Sources:\n\n");
        int count = Math.min(sources.size(), maxFallbackSources);
        for (int i = 0; i < count; i++) {
            SourceReference source = sources.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append("[^").append(i + 1).append("]: [[").append(displayTitle(source.title(), source.path()))
                    .append("]]");
        }
        log.debug("[Citations] appended {} fallback sources", count);
        return sb.toString();
    }

    public boolean hasExistingCitations(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return SourcesSectionParser.SOURCES_HEADING.matcher(text).find()
                || SUMMARY_SOURCES.matcher(text).find()
                || SourcesSectionParser.DEFINITION_LINE.matcher(text).find();
    }

    /**
     * Removes citation markers and footnote definitions from retrieved
     * content so their numbers cannot leak into the answer.
     */
    public String sanitizeContentForCitations(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String out = DEFINITION_LINE.matcher(text).replaceAll("");
        out = FOOTNOTE_MARKER.matcher(out).replaceAll("");
        return NUMERIC_MARKER.matcher(out).replaceAll("");
    }

    public List<String> formatSourceCatalog(List<SourceCatalogEntry> entries) {
        List<String> lines = new ArrayList<>();
        if (entries == null) {
            return lines;
        }
        for (SourceCatalogEntry entry : entries) {
            String title = displayTitle(entry.title(), entry.path());
            String path = entry.path() != null && !entry.path().isEmpty() ? entry.path() : title;
            lines.add("- [[" + title + "]] (" + path + ")");
        }
        return lines;
    }

    /**
     * Citation instructions for the model followed by the source catalog, or
     * an empty string when citations are disabled.
     */
    public String citationGuidance(boolean enableInline, List<String> sourceCatalog) {
        if (!enableInline) {
            return "";
        }
        List<String> catalog = sourceCatalog != null ? sourceCatalog : List.of();
        return "\n\n<guidance>\n" + CITATION_RULES + "\n\nSource Catalog (for reference only):\n"
                + String.join("\n", catalog) + "\n</guidance>";
    }

    private static Map<Integer, Integer> consolidate(List<SourceItem> ordered, List<SourceItem> unique) {
        Map<Integer, Integer> consolidation = new HashMap<>();
        Map<String, Integer> positionByKey = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            int number = i + 1;
            SourceItem item = ordered.get(i);
            String key = item == null || item.dedupKey().isEmpty() ? "#" + number : item.dedupKey();
            Integer position = positionByKey.get(key);
            if (position == null) {
                unique.add(item);
                position = unique.size();
                positionByKey.put(key, position);
            }
            consolidation.put(number, position);
        }
        return consolidation;
    }

    static SourceItem toSourceItem(String definition) {
        Matcher link = MARKDOWN_LINK.matcher(definition);
        if (link.find()) {
            String title = link.group(1).trim();
            return new SourceItem("[" + title + "](" + link.group(2) + ")", title);
        }
        Matcher wiki = WIKI_LINK.matcher(definition);
        if (wiki.find()) {
            String target = wiki.group(1).trim();
            return new SourceItem("[[" + target + "]]", target);
        }
        String plain = TRAILING_PARENTHETICAL.matcher(definition).replaceFirst("").trim();
        return new SourceItem(plain, plain);
    }

    private static List<String> simpleListItems(String block) {
        List<String> items = new ArrayList<>();
        for (String line : block.split("\\r?\\n")) {
            String item = BULLET_PREFIX.matcher(line).replaceFirst("").trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    private static String render(String body, List<String> displays) {
        StringBuilder sb = new StringBuilder(body)
                .append("\n\n<br/>\n<details><summary class=\"engine-sources__summary\">Sources</summary>\n")
                .append("<ul class=\"engine-sources__list\">\n");
        for (int i = 0; i < displays.size(); i++) {
            String display = displays.get(i);
            if (display == null || display.isEmpty()) {
                continue;
            }
            sb.append("<li class=\"engine-sources__item\"><span class=\"engine-sources__index\">[")
                    .append(i + 1)
                    .append("]</span><span class=\"engine-sources__text\">")
                    .append(display)
                    .append("</span></li>\n");
        }
        return sb.append("</ul>\n</details>").toString();
    }

    private static String displayTitle(String title, String path) {
        if (title != null && !title.isEmpty()) {
            return title;
        }
        if (path != null && !path.isEmpty()) {
            return path;
        }
        return "Untitled";
    }
}
