package me.golemcore.engine.domain.model;

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
 * Shared cancellation flag of one agent run. May be set by the caller from any
 * thread at any time; only the first reason is kept.
 */
public final class CancellationSignal {

    private final AtomicReference<AbortReason> reason = new AtomicReference<>();

    public void abort(AbortReason abortReason) {
        reason.compareAndSet(null, abortReason != null ? abortReason : AbortReason.USER_STOPPED);
    }

    public boolean isAborted() {
        return reason.get() != null;
    }

    public AbortReason getReason() {
        return reason.get();
    }

    public static CancellationSignal none() {
        return new CancellationSignal();
    }
}
