package me.golemcore.engine.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties of the agent engine, bound from
 * {@code application.properties} under the {@code engine.*} prefix.
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private AgentProperties agent = new AgentProperties();
    private ReasoningProperties reasoning = new ReasoningProperties();
    private StreamingProperties streaming = new StreamingProperties();
    private CitationProperties citations = new CitationProperties();
    private ToolsProperties tools = new ToolsProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class AgentProperties {
        private int maxIterations = 4;
        private long loopTimeoutMs = 300_000L;
        private int revealChunkSize = 20;
        private long revealDelayMs = 0L;
        private RetryProperties retry = new RetryProperties();

        /**
         * Iteration cap used by the loop; non-positive values fall back to the
         * default.
         */
        public int effectiveMaxIterations() {
            return maxIterations > 0 ? maxIterations : 4;
        }
    }

    @Data
    public static class RetryProperties {
        private int maxOverloadRetries = 2;
        private long backoffStepMs = 1000L;
    }

    @Data
    public static class ReasoningProperties {
        private long tickIntervalMs = 100L;
        private int rollingWindow = 4;
    }

    @Data
    public static class StreamingProperties {
        private boolean excludeThinking = false;
        private boolean earlyTruncationEnabled = false;
        private int earlyTruncationThreshold = 50;
    }

    @Data
    public static class CitationProperties {
        private boolean enableInline = true;
        private int maxFallbackSources = 20;
    }

    @Data
    public static class ToolsProperties {
        private long defaultTimeoutMs = 30_000L;
        private int memoryResultMaxLength = 2000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private String apiType = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 120_000L;
        private int maxTokens = 4096;
        private Double temperature;
    }
}
