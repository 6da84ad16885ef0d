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

import me.golemcore.engine.domain.model.LlmChunk;
import me.golemcore.engine.domain.model.TokenUsage;

import java.util.List;
import java.util.Map;

/**
 * Reads token counters from a chunk, either from the typed usage field or
 * from provider metadata maps.
 */
public final class TokenUsageExtractor {

    private static final List<String> USAGE_KEYS = List.of("usage", "tokenUsage", "usage_metadata");
    private static final List<String> INPUT_KEYS = List.of("input_tokens", "prompt_tokens", "inputTokens",
            "promptTokens");
    private static final List<String> OUTPUT_KEYS = List.of("output_tokens", "completion_tokens", "outputTokens",
            "completionTokens");
    private static final List<String> TOTAL_KEYS = List.of("total_tokens", "totalTokens");

    private TokenUsageExtractor() {
    }

    /**
     * Returns the usage carried by the chunk, or {@code null} when it has none.
     */
    public static TokenUsage extract(LlmChunk chunk) {
        if (chunk == null) {
            return null;
        }
        if (chunk.getUsage() != null) {
            return chunk.getUsage();
        }
        Map<String, Object> metadata = chunk.getResponseMetadata();
        if (metadata == null) {
            return null;
        }
        for (String key : USAGE_KEYS) {
            Object value = metadata.get(key);
            if (value instanceof Map<?, ?> usageMap) {
                TokenUsage usage = fromMap(usageMap);
                if (usage != null) {
                    return usage;
                }
            }
        }
        return null;
    }

    private static TokenUsage fromMap(Map<?, ?> usageMap) {
        Integer input = firstInt(usageMap, INPUT_KEYS);
        Integer output = firstInt(usageMap, OUTPUT_KEYS);
        Integer total = firstInt(usageMap, TOTAL_KEYS);
        if (input == null && output == null && total == null) {
            return null;
        }
        int in = input != null ? input : 0;
        int out = output != null ? output : 0;
        return TokenUsage.builder()
                .inputTokens(in)
                .outputTokens(out)
                .totalTokens(total != null ? total : in + out)
                .build();
    }

    private static Integer firstInt(Map<?, ?> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof Number number) {
                return number.intValue();
            }
        }
        return null;
    }
}
