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
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active model adapter from {@code engine.llm.provider} and
 * delegates every {@link LlmPort} call to it:
 * <ul>
 * <li>langchain4j - OpenAI or Anthropic streaming through langchain4j
 * <li>none - placeholder adapter
 * </ul>
 * An unknown provider falls back to {@code none}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    static final String PROVIDER_NONE = "none";

    private final EngineProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = provider != null ? adaptersByProvider.get(provider) : null;
        if (activeAdapter != null) {
            log.info("Active LLM provider: {}", provider);
            return;
        }

        activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
        if (activeAdapter == null && !adapters.isEmpty()) {
            activeAdapter = adapters.get(0);
        }
        log.warn("Provider '{}' not found, using: {}",
                provider, activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        if (activeAdapter == null) {
            return Flux.error(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chatStream(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
