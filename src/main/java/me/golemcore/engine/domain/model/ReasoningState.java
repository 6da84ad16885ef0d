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

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of the reasoning display. {@code steps} is the bounded rolling
 * window shown while reasoning; {@code allSteps} is the full history used by
 * the completed view.
 */
@Data
@Builder
public class ReasoningState {

    @Builder.Default
    private ReasoningStatus status = ReasoningStatus.IDLE;
    private long startTime;
    private long elapsedSeconds;

    @Builder.Default
    private List<ReasoningStep> steps = new ArrayList<>();

    @Builder.Default
    private List<ReasoningStep> allSteps = new ArrayList<>();

    public static ReasoningState idle() {
        return ReasoningState.builder().build();
    }
}
