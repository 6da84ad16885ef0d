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


package me.golemcore.engine.adapter.outbound.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.ToolDispatchPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches tool calls to the {@link ToolComponent} beans of the application.
 *
 * <p>
 * The registry is built once at construction and never changes afterwards.
 * Every ordinary problem (unknown or disabled tool, timeout, tool exception) is
 * reported as a failed {@link ToolExecutionResult}.
 */
@Component
@Slf4j
public class RegistryToolDispatcher implements ToolDispatchPort {

    static final String EMPTY_RESULT = "{\"message\":\"Tool executed but returned no result\",\"status\":\"empty\"}";

    private final Map<String, ToolComponent> registry;
    private final long defaultTimeoutMs;

    public RegistryToolDispatcher(List<ToolComponent> tools, EngineProperties properties) {
        Map<String, ToolComponent> byName = new LinkedHashMap<>();
        for (ToolComponent tool : tools) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                log.warn("[Tools] Skipping tool without a name: {}", tool.getClass().getSimpleName());
                continue;
            }
            if (byName.putIfAbsent(name, tool) != null) {
                log.warn("[Tools] Duplicate tool name '{}', keeping the first registration", name);
            }
        }
        this.registry = Collections.unmodifiableMap(byName);
        this.defaultTimeoutMs = properties.getTools().getDefaultTimeoutMs();
        log.info("[Tools] Registered {} tools: {}", registry.size(), registry.keySet());
    }

    @Override
    public ToolExecutionResult dispatch(String toolName, Map<String, Object> arguments) {
        String name = sanitizeToolName(toolName);
        ToolComponent tool = name != null ? registry.get(name) : null;
        if (tool == null) {
            return ToolExecutionResult.failure(toolName, "Tool '" + toolName + "' not found. Available tools: "
                    + String.join(", ", registry.keySet()));
        }
        if (!tool.isEnabled()) {
            return ToolExecutionResult.failure(name, "Tool '" + name + "' is disabled");
        }

        long timeoutMs = tool.getTimeoutMs() != null ? tool.getTimeoutMs() : defaultTimeoutMs;
        CompletableFuture<ToolExecutionResult> future = null;
        try {
            future = tool.execute(arguments != null ? arguments : Map.of());
            ToolExecutionResult result = timeoutMs > 0
                    ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                    : future.get();
            if (result == null) {
                return ToolExecutionResult.success(name, EMPTY_RESULT);
            }
            return result.getToolName() != null ? result : result.toBuilder().toolName(name).build();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] '{}' timed out after {} ms", name, timeoutMs);
            return ToolExecutionResult.failure(name, "Tool '" + name + "' timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolExecutionResult.failure(name, "Tool '" + name + "' was interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", name, e);
            return ToolExecutionResult.failure(name, "Tool execution failed: " + rootCauseMessage(e));
        }
    }

    @Override
    public List<ToolDefinition> availableTools() {
        return registry.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }

    private static String rootCauseMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message == null || message.isBlank() ? cursor.getClass().getSimpleName() : message;
    }

    /**
     * Some models leak special tokens like {@code <|channel|>} into tool names.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
