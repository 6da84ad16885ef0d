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


package me.golemcore.engine.adapter.outbound.memory;

import me.golemcore.engine.port.outbound.MemoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-local {@link MemoryPort}: keeps the finalized input/output pairs in
 * insertion order, dropping the oldest once {@link #DEFAULT_CAPACITY} is
 * exceeded.
 */
@Component
@Slf4j
public class InMemoryConversationMemory implements MemoryPort {

    static final int DEFAULT_CAPACITY = 200;

    private final List<Exchange> exchanges = new ArrayList<>();
    private final int capacity;

    public InMemoryConversationMemory() {
        this(DEFAULT_CAPACITY);
    }

    InMemoryConversationMemory(int capacity) {
        this.capacity = capacity > 0 ? capacity : DEFAULT_CAPACITY;
    }

    @Override
    public synchronized void saveContext(String input, String output) {
        exchanges.add(new Exchange(input != null ? input : "", output != null ? output : ""));
        while (exchanges.size() > capacity) {
            exchanges.remove(0);
        }
        log.debug("[Memory] saved exchange, {} stored", exchanges.size());
    }

    public synchronized List<Exchange> getExchanges() {
        return List.copyOf(exchanges);
    }

    public synchronized void clear() {
        exchanges.clear();
    }

    /**
     * One persisted turn.
     */
    public record Exchange(String input, String output) {
    }
}
