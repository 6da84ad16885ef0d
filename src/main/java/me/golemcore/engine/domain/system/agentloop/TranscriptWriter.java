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

import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.Message;

import java.util.List;

/**
 * Appends loop events to the transcript of a run. The transcript is only ever
 * appended to.
 */
public interface TranscriptWriter {

    void appendAssistantToolCalls(List<Message> transcript, String content, List<NativeToolCall> toolCalls);

    void appendToolResult(List<Message> transcript, NativeToolCall call, String content);

    void appendFinalAssistantAnswer(List<Message> transcript, String finalText);
}
