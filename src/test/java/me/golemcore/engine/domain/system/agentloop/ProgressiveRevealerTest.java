package me.golemcore.engine.domain.system.agentloop;

import me.golemcore.engine.domain.model.AbortReason;
import me.golemcore.engine.domain.model.CancellationSignal;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProgressiveRevealerTest {

    @Test
    void shouldRevealInSlicesEndingWithFullText() {
        List<String> updates = new ArrayList<>();

        new ProgressiveRevealer(4, 0).reveal("M:", "abcdefghij", updates::add, new CancellationSignal());

        assertEquals(List.of("M:abcd", "M:abcdefgh", "M:abcdefghij"), updates);
    }

    @Test
    void shouldEmitSingleUpdateForShortText() {
        List<String> updates = new ArrayList<>();

        new ProgressiveRevealer(20, 0).reveal("", "short", updates::add, null);

        assertEquals(List.of("short"), updates);
    }

    @Test
    void shouldThrowWhenCancelled() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.abort(AbortReason.USER_STOPPED);
        List<String> updates = new ArrayList<>();
        ProgressiveRevealer revealer = new ProgressiveRevealer(2, 0);

        assertThrows(AgentAbortedException.class,
                () -> revealer.reveal("", "abcdef", updates::add, cancellation));

        assertEquals(List.of(), updates);
    }
}
