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
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.ResponseMetadata;
import me.golemcore.engine.domain.model.SourceReference;
import me.golemcore.engine.domain.model.StreamingResult;
import me.golemcore.engine.domain.model.TokenUsage;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolExecutionResult;
import me.golemcore.engine.domain.reasoning.ReasoningMarkerCodec;
import me.golemcore.engine.domain.reasoning.ReasoningStateTracker;
import me.golemcore.engine.domain.reasoning.TerminalNoticeGuard;
import me.golemcore.engine.domain.reasoning.ToolStepSummarizer;
import me.golemcore.engine.domain.stream.StreamingDecoder;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.port.outbound.QueryExpansionPort;
import me.golemcore.engine.port.outbound.ToolDispatchPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Reason, call tools, observe, respond.
 *
 * <p>
 * Each iteration checks cancellation and the wall-clock budget, streams one
 * model turn and either returns the answer (no tool calls) or executes the
 * requested tools one after another and loops. Hitting the iteration cap or
 * the time budget yields a summary of the steps taken. A failure that is not
 * a cancellation is retried once through {@link FallbackAnswerRunner}.
 *
 * <p>
 * All mutable state belongs to a single run; the runner itself is shared.
 */
public class AutonomousAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AutonomousAgentRunner.class);

    static final String SALIENT_TERMS_ARGUMENT = "salientTerms";

    private final ModelTurnStreamer streamer;
    private final ToolDispatchPort toolDispatch;
    private final QueryExpansionPort queryExpansion;
    private final LocalSearchResultProcessor searchProcessor;
    private final ToolResultFormatter resultFormatter;
    private final TranscriptWriter transcriptWriter;
    private final ResponseFinalizer finalizer;
    private final FallbackAnswerRunner fallback;
    private final ProgressiveRevealer revealer;
    private final ReasoningMarkerCodec markerCodec;
    private final EngineProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public AutonomousAgentRunner(ModelTurnStreamer streamer, ToolDispatchPort toolDispatch,
            QueryExpansionPort queryExpansion, LocalSearchResultProcessor searchProcessor,
            ToolResultFormatter resultFormatter, TranscriptWriter transcriptWriter, ResponseFinalizer finalizer,
            FallbackAnswerRunner fallback, ProgressiveRevealer revealer, ReasoningMarkerCodec markerCodec,
            EngineProperties properties, ScheduledExecutorService scheduler, Clock clock) {
        this.streamer = streamer;
        this.toolDispatch = toolDispatch;
        this.queryExpansion = queryExpansion;
        this.searchProcessor = searchProcessor;
        this.resultFormatter = resultFormatter;
        this.transcriptWriter = transcriptWriter;
        this.finalizer = finalizer;
        this.fallback = fallback;
        this.revealer = revealer;
        this.markerCodec = markerCodec;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public AgentRunResult run(AgentRunRequest request, CancellationSignal cancellation, Consumer<String> updates) {
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();
        Consumer<String> display = updates != null ? updates : text -> {
        };
        TerminalNoticeGuard noticeGuard = new TerminalNoticeGuard();
        ReasoningStateTracker tracker = new ReasoningStateTracker(scheduler, clock,
                properties.getReasoning().getTickIntervalMs(), properties.getReasoning().getRollingWindow(),
                markerCodec, signal, noticeGuard, display);
        RunState run = new RunState(request, signal, display, noticeGuard, tracker, toolDispatch.availableTools());
        tracker.setVisibleContent(run::currentTurnContent);

        log.info("[Agent] run {} started", request.getRunId());
        try {
            return executeLoop(run);
        } catch (AgentAbortedException e) {
            return interrupted(run);
        } catch (RuntimeException e) {
            if (signal.isAborted()) {
                return interrupted(run);
            }
            return recover(run, e);
        } finally {
            if (tracker.isRunning()) {
                tracker.collapse();
            }
        }
    }

    private AgentRunResult executeLoop(RunState run) {
        run.tracker.start();
        long startedAt = clock.millis();
        int maxIterations = properties.getAgent().effectiveMaxIterations();
        long timeoutMs = properties.getAgent().getLoopTimeoutMs();

        while (run.iteration < maxIterations) {
            if (run.cancellation.isAborted()) {
                throw new AgentAbortedException("Run aborted before iteration " + (run.iteration + 1));
            }
            if (timeoutMs > 0 && clock.millis() - startedAt >= timeoutMs) {
                log.warn("[Agent] run {} hit the time limit of {} ms after {} iterations",
                        run.request.getRunId(), timeoutMs, run.iteration);
                return limitReached(run, AgentRunState.TIMED_OUT);
            }

            run.iteration++;
            log.debug("[Agent] run {} iteration {}/{}", run.request.getRunId(), run.iteration, maxIterations);
            run.setCurrentTurnContent("");
            ModelTurnStreamer.TurnResult turn = streamer.stream(buildRequest(run), run.cancellation,
                    run::setCurrentTurnContent);
            run.recordTurn(turn.result());
            if (turn.aborted() || run.cancellation.isAborted()) {
                throw new AgentAbortedException("Run aborted during model stream");
            }
            if (!turn.hasToolCalls()) {
                return finalResponse(run, turn.result());
            }
            executeTools(run, turn);
        }

        log.warn("[Agent] run {} reached the maximum of {} iterations", run.request.getRunId(), maxIterations);
        return limitReached(run, AgentRunState.MAX_ITERATIONS_REACHED);
    }

    private void executeTools(RunState run, ModelTurnStreamer.TurnResult turn) {
        String assistantText = StreamingDecoder.stripThinking(turn.result().content());
        transcriptWriter.appendAssistantToolCalls(run.transcript, assistantText, turn.toolCalls());
        if (!assistantText.isEmpty()) {
            run.memoryLines.add(assistantText);
        }
        // One at a time, in the order the model issued them
        for (NativeToolCall call : turn.toolCalls()) {
            if (run.cancellation.isAborted()) {
                throw new AgentAbortedException("Run aborted before tool " + call.name());
            }
            executeTool(run, call);
        }
    }

    private void executeTool(RunState run, NativeToolCall call) {
        boolean localSearch = ToolStepSummarizer.LOCAL_SEARCH.equals(call.name());
        List<String> recallTerms = localSearch ? recallTerms(run, call) : List.of();
        NativeToolCall effective = withRecallTerms(call, recallTerms);
        run.tracker.addStep(ToolStepSummarizer.summarizeCall(effective, recallTerms), call.name());

        ToolExecutionResult result;
        try {
            result = toolDispatch.dispatch(effective.name(), effective.arguments());
        } catch (Exception e) { // NOSONAR - dispatch errors become a failed tool result
            log.error("[Agent] dispatch of tool '{}' failed", call.name(), e);
            result = ToolExecutionResult.failure(call.name(), "Tool execution failed: " + e.getMessage());
        }
        if (result == null) {
            result = ToolExecutionResult.failure(call.name(), "Tool returned no result");
        }

        List<SourceReference> newSources = List.of();
        String modelText;
        if (localSearch) {
            LocalSearchOutcome outcome = searchProcessor.process(result, run.request.getUserMessage(),
                    finalizer.isInlineCitationsEnabled());
            newSources = outcome.sources();
            run.sources.addAll(newSources);
            modelText = outcome.modelText();
        } else {
            modelText = resultFormatter.forModel(result);
        }
        transcriptWriter.appendToolResult(run.transcript, call, modelText);
        run.memoryLines.add(resultFormatter.forMemory(result));

        String summary = result.isSuccess()
                ? ToolStepSummarizer.summarizeResult(effective, result, newSources)
                : ToolStepSummarizer.summarizeFailure(call.name());
        run.tracker.addStep(summary, call.name());
        log.debug("[Agent] tool '{}' finished, success={}", call.name(), result.isSuccess());
    }

    private List<String> recallTerms(RunState run, NativeToolCall call) {
        String query = call.stringArgument("query");
        if (queryExpansion == null || query == null || query.isBlank()) {
            return List.of();
        }
        return run.expansionCache.computeIfAbsent(query.trim(), this::expandQuery);
    }

    private List<String> expandQuery(String query) {
        try {
            List<String> terms = queryExpansion.expand(query);
            return terms != null ? List.copyOf(terms) : List.of();
        } catch (RuntimeException e) {
            log.warn("[Agent] query expansion failed for '{}': {}", query, e.getMessage());
            return List.of();
        }
    }

    private static NativeToolCall withRecallTerms(NativeToolCall call, List<String> recallTerms) {
        if (recallTerms.isEmpty() || call.arguments().containsKey(SALIENT_TERMS_ARGUMENT)) {
            return call;
        }
        Map<String, Object> arguments = new LinkedHashMap<>(call.arguments());
        arguments.put(SALIENT_TERMS_ARGUMENT, recallTerms);
        return call.withArguments(arguments);
    }

    private AgentRunResult finalResponse(RunState run, StreamingResult result) {
        String content = result.content();
        transcriptWriter.appendFinalAssistantAnswer(run.transcript, StreamingDecoder.stripThinking(content));

        String marker = run.tracker.complete();
        if (run.tracker.allSummaries().isEmpty()) {
            marker = "";
        }
        List<SourceReference> sources = SourceDeduplicator.deduplicate(run.sources);
        String answer = finalizer.finalizeAnswer(content, result.wasTruncated(), sources);
        revealer.reveal(marker, answer, run.display, run.cancellation);

        finalizer.persist(run.request.getUserMessage(), run.memoryOutput(answer), run.cancellation);
        log.info("[Agent] run {} answered after {} iterations", run.request.getRunId(), run.iteration);
        return new AgentRunResult(marker + answer, run.metadata(), sources, AgentRunState.FINAL_RESPONSE,
                run.iteration);
    }

    private AgentRunResult limitReached(RunState run, AgentRunState state) {
        String marker = run.tracker.complete();
        List<String> summaries = run.tracker.allSummaries();

        StringBuilder body = new StringBuilder();
        if (!summaries.isEmpty()) {
            body.append("Steps completed so far:\n");
            for (String summary : summaries) {
                body.append("- ").append(summary).append('\n');
            }
            body.append('\n');
        }
        body.append(state == AgentRunState.TIMED_OUT
                ? timeLimitNotice()
                : maxIterationsNotice(properties.getAgent().effectiveMaxIterations()));

        List<SourceReference> sources = SourceDeduplicator.deduplicate(run.sources);
        String answer = finalizer.finalizeAnswer(body.toString(), false, sources);
        run.display.accept(marker + answer);
        finalizer.persist(run.request.getUserMessage(), run.memoryOutput(answer), run.cancellation);
        return new AgentRunResult(marker + answer, run.metadata(), sources, state, run.iteration);
    }

    private AgentRunResult interrupted(RunState run) {
        String text;
        if (run.noticeGuard.claim(TerminalNoticeGuard.LOOP)) {
            run.tracker.collapse();
            text = run.tracker.renderInterrupted();
            run.display.accept(text);
            log.info("[Agent] run {} interrupted ({})", run.request.getRunId(), run.cancellation.getReason());
        } else {
            text = run.tracker.renderInterrupted();
            log.debug("[Agent] run {} interrupted, notice already shown by the display timer",
                    run.request.getRunId());
        }
        finalizer.persist(run.request.getUserMessage(), text, run.cancellation);
        return new AgentRunResult(text, run.metadata(), SourceDeduplicator.deduplicate(run.sources),
                AgentRunState.ABORTED, run.iteration);
    }

    private AgentRunResult recover(RunState run, RuntimeException agentError) {
        log.error("[Agent] run {} failed, falling back to a single completion", run.request.getRunId(), agentError);
        run.tracker.collapse();
        try {
            return fallback.run(run.request, run.cancellation, run.display);
        } catch (AgentAbortedException e) {
            return interrupted(run);
        } catch (RuntimeException fallbackError) {
            if (run.cancellation.isAborted()) {
                return interrupted(run);
            }
            log.error("[Fallback] run {} failed as well", run.request.getRunId(), fallbackError);
            String message = AgentErrorMessages.combined(agentError, fallbackError);
            run.display.accept(message);
            return new AgentRunResult(message, run.metadata(), List.of(), AgentRunState.ERROR_REPORTED,
                    run.iteration);
        }
    }

    private LlmRequest buildRequest(RunState run) {
        EngineProperties.LlmProperties llm = properties.getLlm();
        return LlmRequest.builder()
                .model(llm.getModel())
                .systemPrompt(run.request.getSystemPrompt())
                .messages(new ArrayList<>(run.transcript))
                .tools(run.tools)
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens() > 0 ? llm.getMaxTokens() : null)
                .runId(run.request.getRunId())
                .build();
    }

    static String maxIterationsNotice(int maxIterations) {
        return "I've reached the maximum number of iterations (" + maxIterations + ") for this task. "
                + "I gathered information with the tools above but couldn't complete the analysis within the "
                + "iteration limit. You may want to try a more specific question or break down your request into "
                + "smaller parts.";
    }

    static String timeLimitNotice() {
        return "I've reached the time limit for this task. "
                + "I gathered information with the tools above but couldn't complete the analysis in time. "
                + "You may want to try a more specific question or break down your request into smaller parts.";
    }

    /**
     * Mutable state of one run.
     */
    private static final class RunState {

        private final AgentRunRequest request;
        private final CancellationSignal cancellation;
        private final Consumer<String> display;
        private final TerminalNoticeGuard noticeGuard;
        private final ReasoningStateTracker tracker;
        private final List<ToolDefinition> tools;
        private final List<Message> transcript = new ArrayList<>();
        private final List<SourceReference> sources = new ArrayList<>();
        private final List<String> memoryLines = new ArrayList<>();
        private final Map<String, List<String>> expansionCache = new HashMap<>();

        private volatile String currentTurnContent = "";
        private int iteration;
        private boolean lastTruncated;
        private TokenUsage lastUsage;

        private RunState(AgentRunRequest request, CancellationSignal cancellation, Consumer<String> display,
                TerminalNoticeGuard noticeGuard, ReasoningStateTracker tracker, List<ToolDefinition> tools) {
            this.request = request;
            this.cancellation = cancellation;
            this.display = display;
            this.noticeGuard = noticeGuard;
            this.tracker = tracker;
            this.tools = tools != null ? List.copyOf(tools) : List.of();
            if (request.getHistory() != null) {
                transcript.addAll(request.getHistory());
            }
            transcript.add(Message.user(request.getUserMessage() != null ? request.getUserMessage() : ""));
        }

        private String currentTurnContent() {
            return currentTurnContent;
        }

        private void setCurrentTurnContent(String content) {
            currentTurnContent = content != null ? content : "";
        }

        private void recordTurn(StreamingResult result) {
            if (result == null) {
                return;
            }
            lastTruncated = result.wasTruncated();
            if (result.tokenUsage() != null) {
                lastUsage = result.tokenUsage();
            }
        }

        private ResponseMetadata metadata() {
            return new ResponseMetadata(lastTruncated, lastUsage);
        }

        private String memoryOutput(String answer) {
            List<String> parts = new ArrayList<>(memoryLines);
            parts.add(StreamingDecoder.stripThinking(answer));
            return String.join("\n\n", parts);
        }
    }
}
