package me.golemcore.engine.domain.system.agentloop;

import me.golemcore.engine.domain.model.ToolExecutionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ToolResultFormatterTest {

    private final ToolResultFormatter formatter = new ToolResultFormatter(10);

    @Test
    void shouldPassSuccessfulResultToModelUnchanged() {
        assertEquals("12:00", formatter.forModel(ToolExecutionResult.success("datetime", "12:00")));
    }

    @Test
    void shouldPrefixFailuresOnlyOnce() {
        assertEquals("Error: boom", formatter.forModel(ToolExecutionResult.failure("datetime", "boom")));
        assertEquals("Error: boom", formatter.forModel(ToolExecutionResult.failure("datetime", "Error: boom")));
    }

    @Test
    void shouldTruncateLongResultsForMemory() {
        String memory = formatter.forMemory(ToolExecutionResult.success("datetime", "0123456789abcdef"));

        assertEquals("Tool 'datetime' result: 0123456789... (truncated, 16 chars total)", memory);
    }

    @Test
    void shouldKeepShortResultsForMemory() {
        assertEquals("Tool 'datetime' result: noon",
                formatter.forMemory(ToolExecutionResult.success("datetime", "noon")));
    }
}
