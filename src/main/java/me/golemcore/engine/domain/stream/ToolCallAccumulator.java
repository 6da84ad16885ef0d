package me.golemcore.engine.domain.stream;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.ToolCallChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges tool-call fragments of one streaming turn into complete calls.
 *
 * <p>
 * One cell exists per call index. Name and argument fragments are appended in
 * arrival order and the first non-empty id wins. Arguments are parsed only in
 * {@link #finalizeCalls()}; malformed JSON degrades to an empty argument map
 * with a recorded warning and never fails the turn.
 */
public class ToolCallAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ToolCallAccumulator.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final String EMPTY_OBJECT = "{}";

    private final ObjectMapper objectMapper;
    private final TreeMap<Integer, ToolCallChunk> cells = new TreeMap<>();
    private final List<String> warnings = new ArrayList<>();

    public ToolCallAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ToolCallAccumulator() {
        this(new ObjectMapper());
    }

    public synchronized void ingest(ToolCallChunk fragment) {
        if (fragment == null) {
            return;
        }
        int index = resolveIndex(fragment);
        ToolCallChunk cell = cells.computeIfAbsent(index, i -> ToolCallChunk.builder()
                .index(i)
                .name("")
                .args("")
                .build());

        if (isBlank(cell.getId()) && !isBlank(fragment.getId())) {
            cell.setId(fragment.getId());
        }
        if (fragment.getName() != null) {
            cell.setName(cell.getName() + fragment.getName());
        }
        if (fragment.getArgs() != null) {
            cell.setArgs(cell.getArgs() + fragment.getArgs());
        }
        log.trace("[ToolCalls] ingested fragment for index {}", index);
    }

    /**
     * Parses every accumulated cell into a {@link NativeToolCall}, in index
     * order. Cells without a tool name are dropped with a warning.
     */
    public synchronized List<NativeToolCall> finalizeCalls() {
        List<NativeToolCall> calls = new ArrayList<>();
        for (ToolCallChunk cell : cells.values()) {
            String name = cell.getName() != null ? cell.getName().trim() : "";
            if (name.isEmpty()) {
                warn("Dropping tool call at index " + cell.getIndex() + " without a name");
                continue;
            }
            String id = !isBlank(cell.getId()) ? cell.getId() : "call_" + cell.getIndex();
            calls.add(new NativeToolCall(id, name, parseArguments(name, cell.getArgs())));
        }
        return calls;
    }

    /**
     * Removes cells whose argument text is not yet a complete JSON document.
     * Used when the stream is cut early so a half-delivered call is never
     * executed.
     *
     * @return number of discarded cells
     */
    public synchronized int discardIncomplete() {
        int discarded = 0;
        Iterator<Map.Entry<Integer, ToolCallChunk>> iterator = cells.entrySet().iterator();
        while (iterator.hasNext()) {
            ToolCallChunk cell = iterator.next().getValue();
            if (!isCompleteJson(cell.getArgs())) {
                iterator.remove();
                discarded++;
                warn("Discarded incomplete tool call '" + cell.getName() + "' at index " + cell.getIndex());
            }
        }
        return discarded;
    }

    public synchronized boolean isEmpty() {
        return cells.isEmpty();
    }

    public synchronized List<String> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    private int resolveIndex(ToolCallChunk fragment) {
        if (fragment.getIndex() != null) {
            return fragment.getIndex();
        }
        if (!isBlank(fragment.getId())) {
            for (ToolCallChunk cell : cells.values()) {
                if (fragment.getId().equals(cell.getId())) {
                    return cell.getIndex();
                }
            }
            return cells.isEmpty() ? 0 : cells.lastKey() + 1;
        }
        // Fragment without index or id continues the most recent call
        return cells.isEmpty() ? 0 : cells.lastKey();
    }

    private Map<String, Object> parseArguments(String toolName, String rawArgs) {
        String json = sanitize(rawArgs);
        if (json.isEmpty() || EMPTY_OBJECT.equals(json)) {
            return Collections.emptyMap();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                warn("Arguments of tool '" + toolName + "' are not a JSON object, using empty arguments");
                return Collections.emptyMap();
            }
            Map<String, Object> parsed = objectMapper.convertValue(node, MAP_TYPE_REF);
            return parsed != null ? new LinkedHashMap<>(parsed) : Collections.emptyMap();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            warn("Malformed arguments for tool '" + toolName + "', using empty arguments: " + e.getMessage());
            return Collections.emptyMap();
        }
    }

    // Some providers emit an empty object before the real arguments: "{}{"q":1}"
    private static String sanitize(String rawArgs) {
        if (rawArgs == null) {
            return "";
        }
        String json = rawArgs.trim();
        while (json.startsWith(EMPTY_OBJECT) && json.length() > EMPTY_OBJECT.length()) {
            json = json.substring(EMPTY_OBJECT.length()).trim();
        }
        return json;
    }

    private boolean isCompleteJson(String rawArgs) {
        String json = sanitize(rawArgs);
        if (json.isEmpty()) {
            return true;
        }
        try {
            objectMapper.readTree(json);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private void warn(String message) {
        warnings.add(message);
        log.warn("[ToolCalls] {}", message);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
