package me.golemcore.engine.domain.reasoning;

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

import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.domain.model.ToolExecutionResult;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the one-line reasoning summaries shown while tools run: one when a
 * call is issued, one when it completes and one when it fails.
 */
public final class ToolStepSummarizer {

    public static final String LOCAL_SEARCH = "localSearch";
    public static final String WEB_SEARCH = "webSearch";
    public static final String READ_NOTE = "readNote";

    private static final int MAX_RECALL_TERMS = 6;
    private static final int MAX_LOCAL_QUERY_LENGTH = 50;
    private static final int MAX_WEB_QUERY_LENGTH = 30;
    private static final int MAX_LISTED_TITLES = 3;

    private ToolStepSummarizer() {
    }

    public static String summarizeCall(NativeToolCall call, List<String> recallTerms) {
        String toolName = call.name();
        return switch (toolName) {
        case LOCAL_SEARCH -> summarizeLocalSearchCall(call, recallTerms);
        case WEB_SEARCH -> {
            String query = call.stringArgument("query");
            yield query != null && !query.isBlank()
                    ? "Searching web for \"" + truncate(query, MAX_WEB_QUERY_LENGTH) + "\""
                    : "Searching the web";
        }
        case READ_NOTE -> {
            String notePath = call.stringArgument("notePath");
            yield notePath != null && !notePath.isBlank()
                    ? "Reading \"" + noteTitle(notePath) + "\""
                    : "Reading note";
        }
        default -> "Calling " + toolName;
        };
    }

    public static String summarizeResult(NativeToolCall call, ToolExecutionResult result,
            List<SourceReference> sources) {
        String toolName = call.name();
        if (result == null || !result.isSuccess()) {
            return summarizeFailure(toolName);
        }
        return switch (toolName) {
        case LOCAL_SEARCH -> summarizeLocalSearchResult(sources);
        case WEB_SEARCH -> "Retrieved web search results";
        case READ_NOTE -> {
            String notePath = call.stringArgument("notePath");
            yield notePath != null && !notePath.isBlank()
                    ? "Read \"" + noteTitle(notePath) + "\""
                    : "Read note content";
        }
        default -> "Completed " + toolName;
        };
    }

    public static String summarizeFailure(String toolName) {
        return toolName + " failed";
    }

    private static String summarizeLocalSearchCall(NativeToolCall call, List<String> recallTerms) {
        List<String> validTerms = recallTerms == null ? List.of()
                : recallTerms.stream()
                        .filter(term -> term != null && !term.isBlank())
                        .collect(Collectors.toList());
        if (!validTerms.isEmpty()) {
            String terms = validTerms.stream()
                    .limit(MAX_RECALL_TERMS)
                    .map(term -> "\"" + term + "\"")
                    .collect(Collectors.joining(", "));
            int more = validTerms.size() - MAX_RECALL_TERMS;
            return "Searching notes for " + terms + (more > 0 ? " +" + more + " more" : "");
        }
        String query = call.stringArgument("query");
        if (query != null && !query.isBlank()) {
            return "Searching notes for \"" + truncate(query, MAX_LOCAL_QUERY_LENGTH) + "\"";
        }
        return "Searching notes";
    }

    private static String summarizeLocalSearchResult(List<SourceReference> sources) {
        if (sources == null || sources.isEmpty()) {
            return "No matching notes found";
        }
        int count = sources.size();
        List<String> titles = sources.stream()
                .limit(MAX_LISTED_TITLES)
                .map(SourceReference::title)
                .collect(Collectors.toList());
        StringBuilder sb = new StringBuilder()
                .append("Found ").append(count).append(count == 1 ? " note: " : " notes: ")
                .append(String.join(", ", titles));
        int remaining = count - titles.size();
        if (remaining > 0) {
            sb.append(" +").append(remaining).append(" more");
        }
        return sb.toString();
    }

    private static String noteTitle(String notePath) {
        String name = notePath.substring(notePath.lastIndexOf('/') + 1);
        if (name.toLowerCase(Locale.ROOT).endsWith(".md")) {
            name = name.substring(0, name.length() - 3);
        }
        return name.isEmpty() ? notePath : name;
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
