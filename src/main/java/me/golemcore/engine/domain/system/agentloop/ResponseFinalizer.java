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

import me.golemcore.engine.domain.citation.CitationProcessor;
import me.golemcore.engine.domain.model.AbortReason;
import me.golemcore.engine.domain.model.CancellationSignal;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.domain.reasoning.ReasoningMarkerCodec;
import me.golemcore.engine.domain.stream.StreamingDecoder;
import me.golemcore.engine.port.outbound.MemoryPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Last step shared by every answer path: placeholder for empty truncated
 * output, citation normalization and persistence to memory.
 */
public class ResponseFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseFinalizer.class);

    public static final String TRUNCATED_PLACEHOLDER = "[Response truncated - no content generated]";

    private final CitationProcessor citationProcessor;
    private final ReasoningMarkerCodec markerCodec;
    private final MemoryPort memoryPort;
    private final boolean enableInlineCitations;

    public ResponseFinalizer(CitationProcessor citationProcessor, ReasoningMarkerCodec markerCodec,
            MemoryPort memoryPort, boolean enableInlineCitations) {
        this.citationProcessor = citationProcessor;
        this.markerCodec = markerCodec;
        this.memoryPort = memoryPort;
        this.enableInlineCitations = enableInlineCitations;
    }

    public String finalizeAnswer(String content, boolean wasTruncated, List<SourceReference> sources) {
        String text = content != null ? content : "";
        if (wasTruncated && StreamingDecoder.stripThinking(text).isEmpty()) {
            log.warn("[Agent] response truncated before any visible content");
            return TRUNCATED_PLACEHOLDER;
        }
        if (!enableInlineCitations) {
            return text;
        }
        text = citationProcessor.addFallbackSources(text, sources, true);
        return citationProcessor.processInlineCitations(text, true);
    }

    /**
     * Saves the exchange unless the run was aborted to start a new chat.
     * Reasoning markers are removed before saving. Memory failures are logged
     * and never fail the run.
     */
    public void persist(String input, String output, CancellationSignal cancellation) {
        if (cancellation != null && cancellation.getReason() == AbortReason.NEW_CHAT) {
            log.debug("[Agent] skipping persistence, run aborted for a new chat");
            return;
        }
        if (memoryPort == null) {
            return;
        }
        try {
            memoryPort.saveContext(input, markerCodec.strip(output));
        } catch (RuntimeException e) {
            log.warn("[Agent] failed to persist exchange: {}", e.getMessage());
        }
    }

    public boolean isInlineCitationsEnabled() {
        return enableInlineCitations;
    }
}
