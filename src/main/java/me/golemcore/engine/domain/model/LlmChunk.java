package me.golemcore.engine.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A single unit of a streaming chat completion.
 *
 * <p>
 * Providers deliver reasoning in different places, so a chunk carries every
 * shape the engine understands:
 * <ul>
 * <li>{@code contentParts} - content as a list of typed text/thinking
 * parts</li>
 * <li>{@code reasoningContent} - reasoning in a side-channel field next to
 * plain text</li>
 * <li>{@code deltaReasoning} / {@code reasoningDetails} - incremental reasoning
 * plus a full reasoning transcript</li>
 * <li>{@code messageThinking} - reasoning attached to the message object</li>
 * </ul>
 * The shape of a chunk is resolved once with
 * {@link me.golemcore.engine.domain.stream.ChunkKind#of(LlmChunk)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmChunk {

    private String text;
    private List<ContentPart> contentParts;
    private String reasoningContent;
    private String deltaReasoning;
    private List<String> reasoningDetails;
    private String messageThinking;
    private List<ToolCallChunk> toolCallChunks;
    private String finishReason;
    private Map<String, Object> responseMetadata;
    private TokenUsage usage;
    private boolean done;

    public boolean hasToolCallChunks() {
        return toolCallChunks != null && !toolCallChunks.isEmpty();
    }

    public static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }
}
