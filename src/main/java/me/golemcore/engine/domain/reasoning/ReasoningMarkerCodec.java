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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.ReasoningStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes the reasoning display state as a single-line HTML comment that
 * travels inline with the answer text:
 *
 * <pre>
 * &lt;!--AGENT_REASONING:status:elapsedSeconds:["step 1","step 2"]--&gt;
 * </pre>
 *
 * Display code parses the marker only through {@link #parse(String)}.
 */
public class ReasoningMarkerCodec {

    private static final Logger log = LoggerFactory.getLogger(ReasoningMarkerCodec.class);

    private static final String PREFIX = "<!--AGENT_REASONING:";
    private static final String SUFFIX = "-->";
    private static final Pattern MARKER = Pattern.compile("<!--AGENT_REASONING:(\\w+):(\\d+):(.+?)-->");
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ReasoningMarkerCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReasoningMarkerCodec() {
        this(new ObjectMapper());
    }

    /**
     * Serializes a marker. The idle status has no marker and yields an empty
     * string.
     */
    public String serialize(ReasoningStatus status, long elapsedSeconds, List<String> steps) {
        if (status == null || status == ReasoningStatus.IDLE) {
            return "";
        }
        return PREFIX + status.wireName() + ":" + Math.max(0, elapsedSeconds) + ":" + toJson(steps) + SUFFIX;
    }

    /**
     * Finds the first marker in {@code content}. Malformed step JSON degrades
     * to an empty step list.
     */
    public Optional<ReasoningMarker> parse(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        ReasoningStatus status = ReasoningStatus.fromWireName(matcher.group(1));
        long elapsed = parseElapsed(matcher.group(2));
        List<String> steps = parseSteps(matcher.group(3));
        String contentAfter = (content.substring(0, matcher.start()) + content.substring(matcher.end())).trim();
        return Optional.of(new ReasoningMarker(status, elapsed, steps, contentAfter));
    }

    /**
     * Removes every marker from {@code content}.
     */
    public String strip(String content) {
        if (content == null) {
            return "";
        }
        return MARKER.matcher(content).replaceAll("").trim();
    }

    private String toJson(List<String> steps) {
        try {
            String json = objectMapper.writeValueAsString(steps != null ? steps : List.of());
            // "-->" inside a summary would terminate the comment early
            return json.replace(SUFFIX, "--\\u003e");
        } catch (JsonProcessingException e) {
            log.warn("[Reasoning] failed to serialize steps: {}", e.getMessage());
            return "[]";
        }
    }

    private List<String> parseSteps(String json) {
        try {
            List<String> steps = objectMapper.readValue(json, STRING_LIST);
            return steps != null ? steps : List.of();
        } catch (JsonProcessingException e) {
            log.debug("[Reasoning] malformed step list in marker: {}", e.getMessage());
            return List.of();
        }
    }

    private static long parseElapsed(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
