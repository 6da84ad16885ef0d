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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the trailing "Sources" block of an answer and splits it into
 * individual definition lines.
 */
final class SourcesSectionParser {

    static final Pattern SOURCES_HEADING = Pattern.compile(
            "^[ \\t]*(?:#{1,6}[ \\t]*)?sources[ \\t]*(?::|-)?[ \\t]*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    static final Pattern DEFINITION_LINE = Pattern.compile(
            "^[ \\t]*\\[\\^(\\d{1,9})\\]:[ \\t]*(.*)$", Pattern.MULTILINE);

    private static final Pattern DEFINITION_LINE_WITH_BREAK = Pattern.compile(
            "^[ \\t]*\\[\\^\\d+\\]:.*(?:\\r?\\n|$)", Pattern.MULTILINE);
    private static final Pattern INLINE_DEFINITION_START = Pattern.compile("\\s*(\\[\\^\\d+\\]:)");
    private static final Pattern INLINE_WIKI_BULLET_START = Pattern.compile("\\s+(- \\[\\[)");

    private SourcesSectionParser() {
    }

    /**
     * Splits the content at the first sources heading. Footnote definitions
     * found in the body are moved into the sources block. Without a heading,
     * bare footnote definition lines form the block on their own.
     *
     * @return the split, or {@code null} when the content carries no sources
     */
    static SourcesSection split(String content) {
        Matcher heading = SOURCES_HEADING.matcher(content);
        if (heading.find()) {
            String body = content.substring(0, heading.start());
            String block = content.substring(heading.end()).trim();
            List<String> bodyDefinitions = definitionLines(body);
            body = removeDefinitionLines(body);
            if (definitionLines(block).isEmpty() && !bodyDefinitions.isEmpty()) {
                block = String.join("\n", bodyDefinitions) + (block.isEmpty() ? "" : "\n" + block);
            }
            return new SourcesSection(body.stripTrailing(), block);
        }

        List<String> definitions = definitionLines(content);
        if (definitions.isEmpty()) {
            return null;
        }
        return new SourcesSection(removeDefinitionLines(content).stripTrailing(), String.join("\n", definitions));
    }

    /**
     * A sources block that arrived on a single line is broken before every
     * footnote definition and wiki bullet.
     */
    static String normalizeBlock(String block) {
        if (block == null || block.isEmpty() || block.contains("\n")) {
            return block == null ? "" : block;
        }
        String result = INLINE_DEFINITION_START.matcher(block).replaceAll("\n$1");
        result = INLINE_WIKI_BULLET_START.matcher(result).replaceAll("\n$1");
        return result.trim();
    }

    /**
     * Parses footnote definitions in order of appearance.
     */
    static List<SourceDefinition> parseDefinitions(String block) {
        List<SourceDefinition> definitions = new ArrayList<>();
        Matcher matcher = DEFINITION_LINE.matcher(block);
        while (matcher.find()) {
            definitions.add(new SourceDefinition(Integer.parseInt(matcher.group(1)), matcher.group(2).trim()));
        }
        return definitions;
    }

    private static List<String> definitionLines(String text) {
        List<String> lines = new ArrayList<>();
        Matcher matcher = DEFINITION_LINE.matcher(text);
        while (matcher.find()) {
            lines.add(matcher.group().trim());
        }
        return lines;
    }

    private static String removeDefinitionLines(String text) {
        return DEFINITION_LINE_WITH_BREAK.matcher(text).replaceAll("");
    }

    record SourceDefinition(int number, String text) {
    }
}
