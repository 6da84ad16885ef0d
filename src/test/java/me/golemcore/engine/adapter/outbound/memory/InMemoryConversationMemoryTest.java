package me.golemcore.engine.adapter.outbound.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryConversationMemoryTest {

    @Test
    void shouldStoreExchangesInOrder() {
        InMemoryConversationMemory memory = new InMemoryConversationMemory();

        memory.saveContext("q1", "a1");
        memory.saveContext("q2", null);

        assertEquals(List.of(new InMemoryConversationMemory.Exchange("q1", "a1"),
                new InMemoryConversationMemory.Exchange("q2", "")), memory.getExchanges());
    }

    @Test
    void shouldEvictOldestBeyondCapacity() {
        InMemoryConversationMemory memory = new InMemoryConversationMemory(2);

        memory.saveContext("q1", "a1");
        memory.saveContext("q2", "a2");
        memory.saveContext("q3", "a3");

        assertEquals(List.of("q2", "q3"), memory.getExchanges().stream()
                .map(InMemoryConversationMemory.Exchange::input)
                .toList());
    }

    @Test
    void shouldClear() {
        InMemoryConversationMemory memory = new InMemoryConversationMemory();
        memory.saveContext("q", "a");

        memory.clear();

        assertTrue(memory.getExchanges().isEmpty());
    }
}
