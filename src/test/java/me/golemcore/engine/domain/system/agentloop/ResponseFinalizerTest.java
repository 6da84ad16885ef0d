package me.golemcore.engine.domain.system.agentloop;

import me.golemcore.engine.domain.citation.CitationProcessor;
import me.golemcore.engine.domain.model.AbortReason;
import me.golemcore.engine.domain.model.CancellationSignal;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.domain.reasoning.ReasoningMarkerCodec;
import me.golemcore.engine.port.outbound.MemoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ResponseFinalizerTest {

    private static final List<SourceReference> SOURCES = List.of(new SourceReference("Cats", "cats.md", 0.9));

    private MemoryPort memoryPort;
    private ResponseFinalizer finalizer;

    @BeforeEach
    void setUp() {
        memoryPort = mock(MemoryPort.class);
        finalizer = new ResponseFinalizer(new CitationProcessor(), new ReasoningMarkerCodec(), memoryPort, true);
    }

    @Test
    void shouldReturnPlaceholderForEmptyTruncatedAnswer() {
        assertEquals(ResponseFinalizer.TRUNCATED_PLACEHOLDER, finalizer.finalizeAnswer("", true, SOURCES));
        assertEquals(ResponseFinalizer.TRUNCATED_PLACEHOLDER, finalizer.finalizeAnswer(null, true, List.of()));
    }

    @Test
    void shouldKeepPartialTruncatedAnswer() {
        assertEquals("Half an answer", finalizer.finalizeAnswer("Half an answer", true, List.of()));
    }

    @Test
    void shouldAppendRetrievedSourcesWhenAnswerHasNone() {
        String text = finalizer.finalizeAnswer("Cats purr.", false, SOURCES);

        assertTrue(text.startsWith("Cats purr."));
        assertTrue(text.contains("<details><summary class=\"engine-sources__summary\">Sources</summary>"));
        assertTrue(text.contains("[[Cats]]"));
    }

    @Test
    void shouldLeaveTextAloneWhenCitationsDisabled() {
        ResponseFinalizer plain = new ResponseFinalizer(new CitationProcessor(), new ReasoningMarkerCodec(),
                memoryPort, false);

        assertEquals("Cats purr [^1]", plain.finalizeAnswer("Cats purr [^1]", false, SOURCES));
    }

    @Test
    void shouldPersistExchange() {
        finalizer.persist("q", "answer", new CancellationSignal());

        verify(memoryPort).saveContext("q", "answer");
    }

    @Test
    void shouldSkipPersistenceForNewChat() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.abort(AbortReason.NEW_CHAT);

        finalizer.persist("q", "answer", cancellation);

        verify(memoryPort, never()).saveContext(anyString(), anyString());
    }

    @Test
    void shouldPersistWhenUserStopped() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.abort(AbortReason.USER_STOPPED);

        finalizer.persist("q", "partial", cancellation);

        verify(memoryPort).saveContext("q", "partial");
    }

    @Test
    void shouldNotFailWhenMemoryThrows() {
        doThrow(new IllegalStateException("disk full")).when(memoryPort).saveContext(anyString(), anyString());

        assertDoesNotThrow(() -> finalizer.persist("q", "answer", new CancellationSignal()));
    }
}
