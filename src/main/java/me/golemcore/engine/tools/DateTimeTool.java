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


package me.golemcore.engine.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current date and time, optionally in a given timezone
 * such as {@code "Europe/London"} or {@code "UTC"}.
 */
@Component
public class DateTimeTool implements ToolComponent {

    static final String TOOL_NAME = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'UTC'). Default is the server timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolExecutionResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone instanceof String id && !id.isBlank()) {
            try {
                zoneId = ZoneId.of(id);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(
                        ToolExecutionResult.failure(TOOL_NAME, "Invalid timezone: " + id));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String text = now.format(FORMATTER) + " (" + now.getDayOfWeek().name() + ")";
        return CompletableFuture.completedFuture(ToolExecutionResult.success(TOOL_NAME, text));
    }
}
