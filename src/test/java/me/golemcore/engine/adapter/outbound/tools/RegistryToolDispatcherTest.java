package me.golemcore.engine.adapter.outbound.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegistryToolDispatcherTest {

    private EngineProperties properties;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getTools().setDefaultTimeoutMs(1_000L);
    }

    private static ToolComponent tool(String name, Function<Map<String, Object>, CompletableFuture<ToolExecutionResult>> body) {
        return new StubTool(name, true, null, body);
    }

    @Test
    void shouldExecuteRegisteredTool() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("echo", args -> CompletableFuture.completedFuture(
                        ToolExecutionResult.success("echo", String.valueOf(args.get("text")))))), properties);

        ToolExecutionResult result = dispatcher.dispatch("echo", Map.of("text", "hello"));

        assertTrue(result.isSuccess());
        assertEquals("hello", result.getResult());
    }

    @Test
    void shouldListAvailableToolsForUnknownName() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("alpha", args -> CompletableFuture.completedFuture(null)),
                tool("beta", args -> CompletableFuture.completedFuture(null))), properties);

        ToolExecutionResult result = dispatcher.dispatch("gamma", Map.of());

        assertFalse(result.isSuccess());
        assertEquals("Tool 'gamma' not found. Available tools: alpha, beta", result.getResult());
    }

    @Test
    void shouldSanitizeLeakedTokensInToolName() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("datetime", args -> CompletableFuture.completedFuture(
                        ToolExecutionResult.success("datetime", "noon")))), properties);

        ToolExecutionResult result = dispatcher.dispatch("datetime<|channel|>commentary", Map.of());

        assertTrue(result.isSuccess());
        assertEquals("noon", result.getResult());
    }

    @Test
    void shouldReplaceNullResultWithEmptyPayload() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("quiet", args -> CompletableFuture.completedFuture(null))), properties);

        ToolExecutionResult result = dispatcher.dispatch("quiet", null);

        assertTrue(result.isSuccess());
        assertEquals("quiet", result.getToolName());
        assertEquals(RegistryToolDispatcher.EMPTY_RESULT, result.getResult());
    }

    @Test
    void shouldFillMissingToolName() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("anon", args -> CompletableFuture.completedFuture(ToolExecutionResult.builder()
                        .success(true)
                        .result("ok")
                        .build()))), properties);

        assertEquals("anon", dispatcher.dispatch("anon", Map.of()).getToolName());
    }

    @Test
    void shouldFailWhenToolTimesOut() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                new StubTool("slow", true, 50L, args -> new CompletableFuture<>())), properties);

        ToolExecutionResult result = dispatcher.dispatch("slow", Map.of());

        assertFalse(result.isSuccess());
        assertEquals("Tool 'slow' timed out after 50 ms", result.getResult());
    }

    @Test
    void shouldReportRootCauseOfFailedExecution() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("broken", args -> CompletableFuture.failedFuture(
                        new IllegalStateException("wrapper", new IllegalArgumentException("bad input"))))),
                properties);

        ToolExecutionResult result = dispatcher.dispatch("broken", Map.of());

        assertFalse(result.isSuccess());
        assertEquals("Tool execution failed: bad input", result.getResult());
    }

    @Test
    void shouldCatchSynchronousExceptions() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("throws", args -> {
                    throw new IllegalStateException("exploded");
                })), properties);

        assertEquals("Tool execution failed: exploded", dispatcher.dispatch("throws", Map.of()).getResult());
    }

    @Test
    void shouldRejectDisabledToolsAndHideThemFromModel() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                new StubTool("off", false, null, args -> CompletableFuture.completedFuture(null)),
                tool("on", args -> CompletableFuture.completedFuture(null))), properties);

        assertEquals("Tool 'off' is disabled", dispatcher.dispatch("off", Map.of()).getResult());
        assertEquals(List.of("on"), dispatcher.availableTools().stream().map(ToolDefinition::getName).toList());
    }

    @Test
    void shouldKeepFirstRegistrationForDuplicateNames() {
        RegistryToolDispatcher dispatcher = new RegistryToolDispatcher(List.of(
                tool("dup", args -> CompletableFuture.completedFuture(ToolExecutionResult.success("dup", "first"))),
                tool("dup", args -> CompletableFuture.completedFuture(ToolExecutionResult.success("dup", "second")))),
                properties);

        assertEquals("first", dispatcher.dispatch("dup", Map.of()).getResult());
        assertEquals(1, dispatcher.availableTools().size());
    }

    private static final class StubTool implements ToolComponent {

        private final String name;
        private final boolean enabled;
        private final Long timeoutMs;
        private final Function<Map<String, Object>, CompletableFuture<ToolExecutionResult>> body;

        private StubTool(String name, boolean enabled, Long timeoutMs,
                Function<Map<String, Object>, CompletableFuture<ToolExecutionResult>> body) {
            this.name = name;
            this.enabled = enabled;
            this.timeoutMs = timeoutMs;
            this.body = body;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.simple(name, "Stub " + name);
        }

        @Override
        public CompletableFuture<ToolExecutionResult> execute(Map<String, Object> parameters) {
            return body.apply(parameters);
        }

        @Override
        public Long getTimeoutMs() {
            return timeoutMs;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
