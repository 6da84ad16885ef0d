package me.golemcore.engine.domain.system.agentloop;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentErrorMessagesTest {

    @Test
    void shouldUseRootCauseMessage() {
        RuntimeException error = new RuntimeException("wrapper", new IllegalStateException("socket closed"));

        assertEquals("socket closed", AgentErrorMessages.describe(error));
    }

    @Test
    void shouldAddGuidanceForAuthenticationFailures() {
        String message = AgentErrorMessages.describe(new RuntimeException("Invalid API key provided"));

        assertTrue(message.startsWith(AgentErrorMessages.AUTHENTICATION_GUIDANCE));
        assertTrue(message.endsWith("Invalid API key provided"));
    }

    @Test
    void shouldCutTroubleshootingUrl() {
        assertEquals("Bad request.",
                AgentErrorMessages.stripTroubleshootingUrl("Bad request. Troubleshooting URL: https://x"));
    }

    @Test
    void shouldFallBackToExceptionTypeWithoutMessage() {
        assertEquals("IllegalStateException", AgentErrorMessages.describe(new IllegalStateException()));
    }

    @Test
    void shouldCombineAgentAndFallbackErrors() {
        String message = AgentErrorMessages.combined(new RuntimeException("first"), new RuntimeException("second"));

        assertEquals("Error: the agent failed and the fallback answer failed too."
                + "\n\nAgent error: first\n\nFallback error: second", message);
    }
}
