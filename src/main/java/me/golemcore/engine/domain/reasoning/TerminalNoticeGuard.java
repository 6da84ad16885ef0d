package me.golemcore.engine.domain.reasoning;

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

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-assignment claim on the right to emit the terminal "interrupted"
 * notice of a run. The loop and the display timer both race for it; exactly
 * one wins.
 */
public final class TerminalNoticeGuard {

    public static final String LOOP = "loop";
    public static final String TIMER = "timer";

    private final AtomicReference<String> claimedBy = new AtomicReference<>();

    /**
     * @return true if the caller won the claim and must emit the notice
     */
    public boolean claim(String claimant) {
        return claimedBy.compareAndSet(null, claimant);
    }

    public boolean isClaimed() {
        return claimedBy.get() != null;
    }

    public String claimedBy() {
        return claimedBy.get();
    }
}
