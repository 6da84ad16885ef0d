package me.golemcore.engine.domain.stream;

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

/**
 * Trips when more than {@code threshold} characters of non-reasoning text
 * follow the last tool call.
 */
public class TrailingTextTruncationPolicy implements EarlyTruncationPolicy {

    private final int threshold;

    public TrailingTextTruncationPolicy(int threshold) {
        this.threshold = threshold;
    }

    @Override
    public boolean shouldTruncate(String textAfterToolBoundary) {
        if (textAfterToolBoundary == null || textAfterToolBoundary.isEmpty()) {
            return false;
        }
        return StreamingDecoder.stripThinking(textAfterToolBoundary).length() > threshold;
    }
}
