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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete tool invocation requested by the model, produced when the
 * fragments of one streaming turn are finalized.
 */
public record NativeToolCall(String id, String name, Map<String, Object> arguments) {

    public NativeToolCall {
        arguments = arguments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Returns a copy of this call with replaced arguments.
     */
    public NativeToolCall withArguments(Map<String, Object> newArguments) {
        return new NativeToolCall(id, name, newArguments);
    }

    public String stringArgument(String key) {
        Object value = arguments.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
