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

import me.golemcore.engine.domain.model.ToolExecutionResult;

/**
 * Renders tool results for the two audiences that see them: the model gets
 * the full text, long-term memory gets a bounded excerpt.
 */
public class ToolResultFormatter {

    private static final String ERROR_PREFIX = "Error: ";

    private final int memoryMaxLength;

    public ToolResultFormatter(int memoryMaxLength) {
        this.memoryMaxLength = memoryMaxLength > 0 ? memoryMaxLength : 2000;
    }

    public String forModel(ToolExecutionResult result) {
        String text = result.getResult() != null ? result.getResult() : "";
        if (result.isSuccess() || text.startsWith(ERROR_PREFIX)) {
            return text;
        }
        return ERROR_PREFIX + text;
    }

    public String forMemory(ToolExecutionResult result) {
        String text = forModel(result);
        if (text.length() > memoryMaxLength) {
            text = text.substring(0, memoryMaxLength) + "... (truncated, " + text.length() + " chars total)";
        }
        return "Tool '" + result.getToolName() + "' result: " + text;
    }
}
