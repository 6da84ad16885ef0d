package me.golemcore.engine.domain.system.agentloop;

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

import me.golemcore.engine.domain.model.CancellationSignal;

import java.util.function.Consumer;

/**
 * Replays an already complete answer to the display in fixed-size steps so
 * the final response still appears to stream.
 */
public class ProgressiveRevealer {

    private final int chunkSize;
    private final long delayMs;

    public ProgressiveRevealer(int chunkSize, long delayMs) {
        this.chunkSize = chunkSize > 0 ? chunkSize : 20;
        this.delayMs = Math.max(0, delayMs);
    }

    /**
     * Pushes {@code prefix} followed by a growing slice of {@code text}. The
     * last update is always the full text.
     *
     * @throws AgentAbortedException
     *             when the run is cancelled before the full text was shown
     */
    public void reveal(String prefix, String text, Consumer<String> updates, CancellationSignal cancellation) {
        String head = prefix != null ? prefix : "";
        String body = text != null ? text : "";
        for (int end = Math.min(chunkSize, body.length()); end < body.length(); end += chunkSize) {
            if (cancellation != null && cancellation.isAborted()) {
                throw new AgentAbortedException("Run cancelled while revealing the answer");
            }
            updates.accept(head + body.substring(0, end));
            pause();
        }
        updates.accept(head + body);
    }

    private void pause() {
        if (delayMs == 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentAbortedException("Interrupted while revealing the answer", e);
        }
    }
}
