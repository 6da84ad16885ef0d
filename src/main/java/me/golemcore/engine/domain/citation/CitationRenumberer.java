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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renumbers inline citation markers by order of first mention.
 *
 * <p>
 * A marker group is either footnote style ({@code [^3]}, {@code [^2, ^4]}) or
 * numeric ({@code [3]}, {@code [2, 4]}). Groups followed by {@code (} are
 * markdown links and are never touched. Every group is rewritten in one pass
 * over the original text, so a number produced by the rewrite is never mapped
 * a second time.
 */
final class CitationRenumberer {

    static final Pattern MARKER_GROUP = Pattern.compile("\\[(\\^?\\d{1,9}(?:\\s*,\\s*\\^?\\d{1,9})*)\\](?!\\()");

    private static final Pattern FOOTNOTE_REFERENCE = Pattern.compile("\\[\\^\\d+");
    private static final Pattern GROUP_SEPARATOR = Pattern.compile("\\s*,\\s*");
    private static final Pattern REPEATED_GROUP = Pattern.compile("(\\[\\d+(?:, \\d+)*\\])(?:[ \\t]*\\1)+(?!\\()");
    private static final int MAX_PASSES = 5;

    private CitationRenumberer() {
    }

    static boolean hasFootnoteReferences(String text) {
        return FOOTNOTE_REFERENCE.matcher(text).find();
    }

    /**
     * Assigns 1..N to referenced source numbers in order of first mention.
     *
     * <p>
     * In footnote mode only {@code [^n]} groups count as mentions. Otherwise
     * numeric groups count, but only when every number in the group has a
     * definition, so that stray bracketed numbers are left alone. When the
     * body mentions nothing, the definitions are numbered in their own order.
     */
    static Map<Integer, Integer> buildCitationMap(String body, Collection<Integer> definedNumbers,
            boolean footnoteMode) {
        Map<Integer, Integer> map = new LinkedHashMap<>();
        Matcher matcher = MARKER_GROUP.matcher(body);
        while (matcher.find()) {
            List<String> parts = splitGroup(matcher.group(1));
            if (footnoteMode != isFootnoteGroup(parts)) {
                continue;
            }
            List<Integer> numbers = numbers(parts);
            if (!footnoteMode && !definedNumbers.containsAll(numbers)) {
                continue;
            }
            for (Integer number : numbers) {
                map.putIfAbsent(number, map.size() + 1);
            }
        }
        if (map.isEmpty()) {
            for (Integer number : definedNumbers) {
                map.putIfAbsent(number, map.size() + 1);
            }
        }
        return map;
    }

    /**
     * Rewrites marker groups through the map. Footnote groups always become
     * numeric; numeric groups are rewritten only when every member is mapped
     * and no footnote references are present. Output groups are sorted,
     * de-duplicated and lose a directly following period.
     */
    static String rewrite(String text, Map<Integer, Integer> citationMap) {
        boolean footnoteMode = hasFootnoteReferences(text);
        String current = rewritePass(text, citationMap, footnoteMode);
        int passes = 1;
        // Only footnote references can survive a pass; numeric output is final
        while (footnoteMode && hasFootnoteReferences(current) && passes < MAX_PASSES) {
            String next = rewritePass(current, citationMap, true);
            if (next.equals(current)) {
                break;
            }
            current = next;
            passes++;
        }
        return current;
    }

    /**
     * Applies a numeric-to-numeric remap, used after duplicate sources have
     * been merged. Groups with unmapped members keep those members as-is.
     */
    static String remapNumeric(String text, Map<Integer, Integer> remap) {
        Matcher matcher = MARKER_GROUP.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            List<String> parts = splitGroup(matcher.group(1));
            if (isFootnoteGroup(parts)) {
                continue;
            }
            Set<Integer> mapped = new TreeSet<>();
            for (Integer number : numbers(parts)) {
                mapped.add(remap.getOrDefault(number, number));
            }
            sb.append(text, last, matcher.start()).append(render(mapped));
            last = matcher.end();
        }
        return sb.append(text.substring(last)).toString();
    }

    /**
     * Collapses directly repeated identical groups, as left behind when two
     * adjacent markers were merged into one source: {@code [1][1]} becomes
     * {@code [1]}.
     */
    static String collapseRepeated(String text) {
        return REPEATED_GROUP.matcher(text).replaceAll("$1");
    }

    private static String rewritePass(String text, Map<Integer, Integer> citationMap, boolean footnoteMode) {
        Matcher matcher = MARKER_GROUP.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            List<String> parts = splitGroup(matcher.group(1));
            boolean footnoteGroup = isFootnoteGroup(parts);
            if (footnoteMode && !footnoteGroup) {
                continue;
            }
            List<Integer> numbers = numbers(parts);
            if (!footnoteGroup && !citationMap.keySet().containsAll(numbers)) {
                continue;
            }
            Set<Integer> mapped = new TreeSet<>();
            for (Integer number : numbers) {
                mapped.add(citationMap.getOrDefault(number, number));
            }
            sb.append(text, last, matcher.start()).append(render(mapped));
            last = matcher.end();
            if (last < text.length() && text.charAt(last) == '.') {
                last++;
            }
        }
        return sb.append(text.substring(last)).toString();
    }

    private static String render(Set<Integer> numbers) {
        return numbers.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static List<String> splitGroup(String group) {
        List<String> parts = new ArrayList<>();
        for (String part : GROUP_SEPARATOR.split(group.trim())) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static boolean isFootnoteGroup(List<String> parts) {
        return parts.stream().anyMatch(part -> part.startsWith("^"));
    }

    private static List<Integer> numbers(List<String> parts) {
        List<Integer> numbers = new ArrayList<>(parts.size());
        for (String part : parts) {
            numbers.add(Integer.parseInt(part.startsWith("^") ? part.substring(1) : part));
        }
        return numbers;
    }
}
