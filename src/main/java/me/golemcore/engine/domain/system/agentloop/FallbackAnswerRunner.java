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

import me.golemcore.engine.domain.model.AgentRunRequest;
import me.golemcore.engine.domain.model.AgentRunResult;
import me.golemcore.engine.domain.model.AgentRunState;
import me.golemcore.engine.domain.model.CancellationSignal;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.RetrievedDocument;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.port.outbound.RetrievalPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Non-agentic answer path used when the tool loop fails: one retrieval, one
 * streamed completion without tools.
 */
public class FallbackAnswerRunner {

    private static final Logger log = LoggerFactory.getLogger(FallbackAnswerRunner.class);

    private final ModelTurnStreamer streamer;
    private final RetrievalPort retrievalPort;
    private final LocalSearchResultProcessor searchProcessor;
    private final ResponseFinalizer finalizer;
    private final String model;

    public FallbackAnswerRunner(ModelTurnStreamer streamer, RetrievalPort retrievalPort,
            LocalSearchResultProcessor searchProcessor, ResponseFinalizer finalizer, String model) {
        this.streamer = streamer;
        this.retrievalPort = retrievalPort;
        this.searchProcessor = searchProcessor;
        this.finalizer = finalizer;
        this.model = model;
    }

    public AgentRunResult run(AgentRunRequest request, CancellationSignal cancellation, Consumer<String> updates) {
        log.info("[Fallback] answering run {} without tools", request.getRunId());
        List<RetrievedDocument> documents = retrieve(request.getUserMessage());
        List<SourceReference> sources = SourceDeduplicator.deduplicate(searchProcessor.extractSources(documents));

        String question = request.getUserMessage() != null ? request.getUserMessage() : "";
        String userContent = documents.isEmpty()
                ? question
                : searchProcessor.buildContext(documents, finalizer.isInlineCitationsEnabled())
                        + "\n\nQuestion: " + question;

        List<Message> messages = new ArrayList<>();
        if (request.getHistory() != null) {
            messages.addAll(request.getHistory());
        }
        messages.add(Message.user(userContent));

        LlmRequest llmRequest = LlmRequest.builder()
                .model(model)
                .systemPrompt(request.getSystemPrompt())
                .messages(messages)
                .runId(request.getRunId())
                .build();

        ModelTurnStreamer.TurnResult turn = streamer.stream(llmRequest, cancellation, updates);
        if (turn.aborted()) {
            throw new AgentAbortedException("Fallback answer aborted");
        }

        String text = finalizer.finalizeAnswer(turn.result().content(), turn.result().wasTruncated(), sources);
        updates.accept(text);
        finalizer.persist(question, text, cancellation);
        return new AgentRunResult(text, turn.result().toMetadata(), sources, AgentRunState.FALLBACK_RECOVERY, 1);
    }

    private List<RetrievedDocument> retrieve(String query) {
        if (retrievalPort == null || query == null || query.isBlank()) {
            return List.of();
        }
        try {
            List<RetrievedDocument> documents = retrievalPort.search(query, List.of());
            return documents != null ? documents : List.of();
        } catch (RuntimeException e) {
            log.warn("[Fallback] retrieval failed, answering without context: {}", e.getMessage());
            return List.of();
        }
    }
}
