package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;

import java.util.List;
import java.util.Map;

/**
 * Port for executing tools by name.
 *
 * <p>
 * Ordinary tool failures (unknown tool, timeout, tool error) are returned as
 * {@link ToolExecutionResult} with {@code success=false}; only catastrophic
 * dispatch problems are thrown.
 */
public interface ToolDispatchPort {

    ToolExecutionResult dispatch(String toolName, Map<String, Object> arguments);

    /**
     * Returns the schemas of all tools currently callable by the model.
     */
    List<ToolDefinition> availableTools();
}
