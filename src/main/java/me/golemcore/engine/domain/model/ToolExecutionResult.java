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

/**
 * Outcome of one tool invocation. {@code result} is the text sent back to the
 * model; {@code displayResult}, when present, is the shorter text shown to the
 * user. Tool-level failures are encoded with {@code success=false} rather
 * than thrown.
 */
@Data
@Builder(toBuilder = true)
public class ToolExecutionResult {

    private String toolName;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String result;
    private String displayResult;

    public static ToolExecutionResult success(String toolName, String result) {
        return ToolExecutionResult.builder()
                .toolName(toolName)
                .success(true)
                .result(result)
                .build();
    }

    public static ToolExecutionResult failure(String toolName, String error) {
        return ToolExecutionResult.builder()
                .toolName(toolName)
                .success(false)
                .result(error)
                .build();
    }

    /**
     * Returns the text meant for the user, falling back to the model-facing
     * result.
     */
    public String displayText() {
        return displayResult != null ? displayResult : result;
    }
}
