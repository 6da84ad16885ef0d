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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the running transcript of an agent run. Roles are
 * {@code system}, {@code user}, {@code assistant} and {@code tool}; tool
 * messages carry the id of the call they answer.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;
    private String content;

    private List<NativeToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName;

    private Instant timestamp;

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }
}
