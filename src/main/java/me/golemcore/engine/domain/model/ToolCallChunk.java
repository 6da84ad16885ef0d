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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial tool call delivered by a streaming provider. The same type is used
 * as the accumulator cell: fragments sharing an {@code index} are merged into
 * one cell whose {@code name} and {@code args} grow by concatenation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallChunk {

    private Integer index;
    private String id;
    private String name;
    private String args;

    public static ToolCallChunk of(int index, String id, String name, String args) {
        return new ToolCallChunk(index, id, name, args);
    }
}
