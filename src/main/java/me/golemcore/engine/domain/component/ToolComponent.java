package me.golemcore.engine.domain.component;

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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the model.
 * Tools expose their JSON Schema definition for function calling and implement
 * the execution logic. All tool beans together form the read-only tool
 * registry of the engine.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with the specified parameters.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result, may complete with
     *         {@code null} when the tool has nothing to report
     */
    CompletableFuture<ToolExecutionResult> execute(Map<String, Object> parameters);

    /**
     * Per-tool timeout override in milliseconds, or {@code null} to use the
     * configured default. Zero or a negative value disables the timeout.
     */
    default Long getTimeoutMs() {
        return null;
    }

    default String getToolName() {
        return getDefinition().getName();
    }
}
