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

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Provider-agnostic detection of output cut off by a token limit.
 */
public final class TruncationDetector {

    private static final Set<String> LENGTH_REASONS = Set.of("length", "max_tokens", "max_output_tokens");
    private static final List<String> METADATA_KEYS = List.of("finish_reason", "finishReason", "stop_reason",
            "stopReason", "done_reason");

    private TruncationDetector() {
    }

    public static boolean isTruncated(LlmChunk chunk) {
        if (chunk == null) {
            return false;
        }
        if (isLengthReason(chunk.getFinishReason())) {
            return true;
        }
        Map<String, Object> metadata = chunk.getResponseMetadata();
        if (metadata == null || metadata.isEmpty()) {
            return false;
        }
        for (String key : METADATA_KEYS) {
            if (isLengthReason(metadata.get(key))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isLengthReason(Object value) {
        if (!(value instanceof String)) {
            return false;
        }
        return LENGTH_REASONS.contains(((String) value).toLowerCase(Locale.ROOT));
    }
}
