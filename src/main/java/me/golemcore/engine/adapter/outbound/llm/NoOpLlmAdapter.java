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


package me.golemcore.engine.adapter.outbound.llm;

import me.golemcore.engine.domain.model.LlmChunk;
import me.golemcore.engine.domain.model.LlmRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Placeholder adapter used when no model provider is configured. Every
 * request streams a single fixed answer without tool calls.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return LlmAdapterFactory.PROVIDER_NONE;
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chatStream() called - no LLM configured");
        return Flux.just(LlmChunk.builder()
                .text(PLACEHOLDER)
                .finishReason("stop")
                .done(true)
                .build());
    }

    @Override
    public String getCurrentModel() {
        return LlmAdapterFactory.PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
