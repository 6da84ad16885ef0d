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

/**
 * Shape of a streaming chunk, resolved once per chunk so the decoder can
 * dispatch on it instead of probing fields ad hoc.
 */
public enum ChunkKind {

    /**
     * Content delivered as a list of typed text/thinking parts.
     */
    CLAUDE_STYLE,

    /**
     * Reasoning delivered in a side-channel field next to plain text.
     */
    DEEPSEEK_STYLE,

    /**
     * Incremental reasoning deltas, optionally followed by a full reasoning
     * transcript.
     */
    OPENROUTER_STYLE,

    /**
     * Reasoning attached to the message object of a local model server.
     */
    OLLAMA_STYLE,

    /**
     * Plain text only.
     */
    PLAIN;

    public static ChunkKind of(LlmChunk chunk) {
        if (chunk == null) {
            return PLAIN;
        }
        if (chunk.getContentParts() != null && !chunk.getContentParts().isEmpty()) {
            return CLAUDE_STYLE;
        }
        if (chunk.getDeltaReasoning() != null
                || (chunk.getReasoningDetails() != null && !chunk.getReasoningDetails().isEmpty())) {
            return OPENROUTER_STYLE;
        }
        if (chunk.getReasoningContent() != null) {
            return DEEPSEEK_STYLE;
        }
        if (chunk.getMessageThinking() != null) {
            return OLLAMA_STYLE;
        }
        return PLAIN;
    }
}
