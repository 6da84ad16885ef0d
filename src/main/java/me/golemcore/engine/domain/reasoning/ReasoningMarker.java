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

import me.golemcore.engine.domain.model.ReasoningStatus;

import java.util.List;

/**
 * Parsed reasoning marker together with the message content that surrounds
 * it.
 */
public record ReasoningMarker(ReasoningStatus status, long elapsedSeconds, List<String> steps,
        String contentAfter) {

    public ReasoningMarker {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }
}
