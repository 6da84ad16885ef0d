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

import me.golemcore.engine.domain.model.SourceReference;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses sources collected across iterations: one entry per path (title
 * when the path is missing) keeping the highest score, best first.
 */
public final class SourceDeduplicator {

    private SourceDeduplicator() {
    }

    public static List<SourceReference> deduplicate(List<SourceReference> sources) {
        if (sources == null || sources.isEmpty()) {
            return List.of();
        }
        Map<String, SourceReference> unique = new LinkedHashMap<>();
        for (SourceReference source : sources) {
            if (source == null) {
                continue;
            }
            unique.merge(source.dedupKey() != null ? source.dedupKey() : "", source,
                    (existing, candidate) -> candidate.score() > existing.score() ? candidate : existing);
        }
        List<SourceReference> result = new ArrayList<>(unique.values());
        result.sort(Comparator.comparingDouble(SourceReference::score).reversed());
        return result;
    }
}
