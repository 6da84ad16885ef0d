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

import java.util.Locale;

/**
 * Display status of the agent reasoning block.
 */
public enum ReasoningStatus {

    IDLE, REASONING, COLLAPSED, COMPLETE;

    /**
     * Wire name used inside the reasoning marker.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReasoningStatus fromWireName(String value) {
        if (value == null) {
            return IDLE;
        }
        for (ReasoningStatus status : values()) {
            if (status.wireName().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return IDLE;
    }
}
