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

import java.util.List;

/**
 * Output of one agent run: the finalized text (possibly embedding the
 * reasoning marker), response metadata, deduplicated sources and the terminal
 * state the loop ended in.
 */
public record AgentRunResult(String text, ResponseMetadata metadata, List<SourceReference> sources,
        AgentRunState state, int iterations) {

    public AgentRunResult {
        sources = sources != null ? List.copyOf(sources) : List.of();
        metadata = metadata != null ? metadata : ResponseMetadata.empty();
    }
}
