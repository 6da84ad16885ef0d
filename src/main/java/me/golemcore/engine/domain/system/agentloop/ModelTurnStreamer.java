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
import me.golemcore.engine.domain.model.CancellationSignal;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.StreamingResult;
import me.golemcore.engine.domain.stream.EarlyTruncationPolicy;
import me.golemcore.engine.domain.stream.StreamingDecoder;
import me.golemcore.engine.domain.stream.ToolCallAccumulator;
import me.golemcore.engine.domain.stream.TrailingTextTruncationPolicy;
import me.golemcore.engine.domain.system.LlmErrorClassifier;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Streams one model turn through a fresh decoder and tool-call accumulator.
 *
 * <p>
 * Overloaded-provider failures are retried with linear backoff; any other
 * failure propagates. The decoder is closed on every path, including
 * cancellation, so the partial content stays well formed.
 */
public class ModelTurnStreamer {

    private static final Logger log = LoggerFactory.getLogger(ModelTurnStreamer.class);

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final EngineProperties.StreamingProperties streaming;
    private final EngineProperties.RetryProperties retry;

    public ModelTurnStreamer(LlmPort llmPort, ObjectMapper objectMapper,
            EngineProperties.StreamingProperties streaming, EngineProperties.RetryProperties retry) {
        this.llmPort = llmPort;
        this.objectMapper = objectMapper;
        this.streaming = streaming != null ? streaming : new EngineProperties.StreamingProperties();
        this.retry = retry != null ? retry : new EngineProperties.RetryProperties();
    }

    public TurnResult stream(LlmRequest request, CancellationSignal cancellation, Consumer<String> onUpdate) {
        int attempt = 0;
        while (true) {
            ToolCallAccumulator accumulator = new ToolCallAccumulator(objectMapper);
            StreamingDecoder decoder = new StreamingDecoder(onUpdate, streaming.isExcludeThinking(), accumulator,
                    truncationPolicy());
            try {
                llmPort.chatStream(request)
                        .takeWhile(chunk -> !cancellation.isAborted())
                        .doOnNext(decoder::processChunk)
                        .takeUntil(chunk -> decoder.isEarlyTruncated() || cancellation.isAborted())
                        .blockLast();
                StreamingResult result = decoder.close();
                return new TurnResult(result, accumulator.finalizeCalls(), decoder.isEarlyTruncated(),
                        cancellation.isAborted());
            } catch (RuntimeException e) {
                StreamingResult partial = decoder.close();
                if (cancellation.isAborted()) {
                    log.debug("[LLM] stream ended by cancellation: {}", e.getMessage());
                    return new TurnResult(partial, List.of(), false, true);
                }
                String code = LlmErrorClassifier.classifyFromThrowable(e);
                if (!LlmErrorClassifier.isOverloadedCode(code) || attempt >= retry.getMaxOverloadRetries()) {
                    throw e;
                }
                attempt++;
                long backoffMs = retry.getBackoffStepMs() * attempt;
                log.warn("[LLM] provider overloaded, retry {}/{} in {} ms", attempt, retry.getMaxOverloadRetries(),
                        backoffMs);
                awaitRetry(backoffMs);
                if (cancellation.isAborted()) {
                    return new TurnResult(partial, List.of(), false, true);
                }
            }
        }
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    private void awaitRetry(long backoffMs) {
        try {
            sleepBeforeRetry(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentAbortedException("Interrupted while waiting to retry the model call", e);
        }
    }

    private EarlyTruncationPolicy truncationPolicy() {
        return streaming.isEarlyTruncationEnabled()
                ? new TrailingTextTruncationPolicy(streaming.getEarlyTruncationThreshold())
                : EarlyTruncationPolicy.disabled();
    }

    /**
     * Outcome of one streamed turn.
     */
    public record TurnResult(StreamingResult result, List<NativeToolCall> toolCalls, boolean earlyTruncated,
            boolean aborted) {

        public TurnResult {
            toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        }

        public boolean hasToolCalls() {
            return !toolCalls.isEmpty();
        }
    }
}
