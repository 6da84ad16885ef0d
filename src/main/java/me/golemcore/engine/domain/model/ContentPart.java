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
 * Typed content part of a chunk delivered as a list of parts. Only
 * {@code text} and {@code thinking} parts are meaningful to the decoder; any
 * other type is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentPart {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_THINKING = "thinking";

    private String type;
    private String text;
    private String thinking;

    public static ContentPart text(String text) {
        return new ContentPart(TYPE_TEXT, text, null);
    }

    public static ContentPart thinking(String thinking) {
        return new ContentPart(TYPE_THINKING, null, thinking);
    }

    public boolean isText() {
        return TYPE_TEXT.equals(type);
    }

    public boolean isThinking() {
        return TYPE_THINKING.equals(type);
    }
}
