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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.citation.CitationProcessor;
import me.golemcore.engine.domain.reasoning.ReasoningMarkerCodec;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.port.outbound.MemoryPort;
import me.golemcore.engine.port.outbound.QueryExpansionPort;
import me.golemcore.engine.port.outbound.RetrievalPort;
import me.golemcore.engine.port.outbound.ToolDispatchPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the agent loop (domain orchestrator + ports). */
@Configuration
public class AgentEngineConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService reasoningTickScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reasoning-tick-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ReasoningMarkerCodec reasoningMarkerCodec(ObjectMapper objectMapper) {
        return new ReasoningMarkerCodec(objectMapper);
    }

    @Bean
    public CitationProcessor citationProcessor(EngineProperties properties) {
        return new CitationProcessor(properties.getCitations().getMaxFallbackSources());
    }

    @Bean
    public LocalSearchResultProcessor localSearchResultProcessor(ObjectMapper objectMapper,
            CitationProcessor citationProcessor) {
        return new LocalSearchResultProcessor(objectMapper, citationProcessor);
    }

    @Bean
    public ToolResultFormatter toolResultFormatter(EngineProperties properties) {
        return new ToolResultFormatter(properties.getTools().getMemoryResultMaxLength());
    }

    @Bean
    public TranscriptWriter transcriptWriter(Clock clock) {
        return new DefaultTranscriptWriter(clock);
    }

    @Bean
    public ModelTurnStreamer modelTurnStreamer(LlmPort llmPort, ObjectMapper objectMapper,
            EngineProperties properties) {
        return new ModelTurnStreamer(llmPort, objectMapper, properties.getStreaming(),
                properties.getAgent().getRetry());
    }

    @Bean
    public ResponseFinalizer responseFinalizer(CitationProcessor citationProcessor,
            ReasoningMarkerCodec reasoningMarkerCodec, MemoryPort memoryPort, EngineProperties properties) {
        return new ResponseFinalizer(citationProcessor, reasoningMarkerCodec, memoryPort,
                properties.getCitations().isEnableInline());
    }

    @Bean
    public FallbackAnswerRunner fallbackAnswerRunner(ModelTurnStreamer modelTurnStreamer, RetrievalPort retrievalPort,
            LocalSearchResultProcessor localSearchResultProcessor, ResponseFinalizer responseFinalizer,
            EngineProperties properties) {
        return new FallbackAnswerRunner(modelTurnStreamer, retrievalPort, localSearchResultProcessor,
                responseFinalizer, properties.getLlm().getModel());
    }

    @Bean
    public ProgressiveRevealer progressiveRevealer(EngineProperties properties) {
        return new ProgressiveRevealer(properties.getAgent().getRevealChunkSize(),
                properties.getAgent().getRevealDelayMs());
    }

    @Bean
    public AgentRunner agentRunner(ModelTurnStreamer modelTurnStreamer, ToolDispatchPort toolDispatchPort,
            ObjectProvider<QueryExpansionPort> queryExpansionPort,
            LocalSearchResultProcessor localSearchResultProcessor, ToolResultFormatter toolResultFormatter,
            TranscriptWriter transcriptWriter, ResponseFinalizer responseFinalizer,
            FallbackAnswerRunner fallbackAnswerRunner, ProgressiveRevealer progressiveRevealer,
            ReasoningMarkerCodec reasoningMarkerCodec, EngineProperties properties,
            ScheduledExecutorService reasoningTickScheduler, Clock clock) {
        return new AutonomousAgentRunner(modelTurnStreamer, toolDispatchPort, queryExpansionPort.getIfAvailable(),
                localSearchResultProcessor, toolResultFormatter, transcriptWriter, responseFinalizer,
                fallbackAnswerRunner, progressiveRevealer, reasoningMarkerCodec, properties,
                reasoningTickScheduler, clock);
    }
}
