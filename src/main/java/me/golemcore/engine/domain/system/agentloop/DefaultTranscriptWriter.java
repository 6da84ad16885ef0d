package me.golemcore.engine.domain.system.agentloop;

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

import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.NativeToolCall;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes assistant and tool messages with timestamps from the injected clock.
 */
public class DefaultTranscriptWriter implements TranscriptWriter {

    private final Clock clock;

    public DefaultTranscriptWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> transcript, String content,
            List<NativeToolCall> toolCalls) {
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content != null ? content : "")
                .toolCalls(List.copyOf(toolCalls))
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> transcript, NativeToolCall call, String content) {
        transcript.add(Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(call.id())
                .toolName(call.name())
                .content(content)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> transcript, String finalText) {
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
