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

import me.golemcore.engine.domain.model.AgentRunRequest;
import me.golemcore.engine.domain.model.AgentRunResult;
import me.golemcore.engine.domain.model.CancellationSignal;

import java.util.function.Consumer;

/**
 * Executes one agent run end to end.
 */
public interface AgentRunner {

    /**
     * @param request
     *            question, history and system prompt
     * @param cancellation
     *            signal the caller may set at any time
     * @param updates
     *            receives the full display text every time it changes
     * @return the finalized answer; never {@code null}
     */
    AgentRunResult run(AgentRunRequest request, CancellationSignal cancellation, Consumer<String> updates);
}
