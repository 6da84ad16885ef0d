package me.golemcore.engine.domain.reasoning;

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

import me.golemcore.engine.domain.model.CancellationSignal;
import me.golemcore.engine.domain.model.ReasoningState;
import me.golemcore.engine.domain.model.ReasoningStatus;
import me.golemcore.engine.domain.model.ReasoningStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Timer-driven reasoning display of one agent run.
 *
 * <p>
 * While the status is {@code reasoning} a tick re-renders the marker (status,
 * elapsed seconds, rolling step window) followed by the visible content
 * streamed so far and pushes it to the display listener. The tick doubles as
 * the abort watchdog: when it observes the cancellation signal first it wins
 * the {@link TerminalNoticeGuard} and emits the interrupted notice itself.
 *
 * <p>
 * All state is guarded by the instance monitor; the stream thread and the
 * timer thread never write it concurrently. Display frames are published
 * under the same monitor.
 */
public class ReasoningStateTracker {

    private static final Logger log = LoggerFactory.getLogger(ReasoningStateTracker.class);

    public static final String INTERRUPTED_NOTICE = "The response was interrupted.";

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long tickIntervalMs;
    private final int rollingWindow;
    private final ReasoningMarkerCodec codec;
    private final CancellationSignal cancellation;
    private final TerminalNoticeGuard noticeGuard;
    private final Consumer<String> display;

    private ReasoningStatus status = ReasoningStatus.IDLE;
    private long startTime;
    private long elapsedSeconds;
    private final Deque<ReasoningStep> rollingSteps = new ArrayDeque<>();
    private final List<ReasoningStep> allSteps = new ArrayList<>();
    private Supplier<String> visibleContent = () -> "";
    private ScheduledFuture<?> tickFuture;

    public ReasoningStateTracker(ScheduledExecutorService scheduler, Clock clock, long tickIntervalMs,
            int rollingWindow, ReasoningMarkerCodec codec, CancellationSignal cancellation,
            TerminalNoticeGuard noticeGuard, Consumer<String> display) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.tickIntervalMs = tickIntervalMs > 0 ? tickIntervalMs : 100L;
        this.rollingWindow = rollingWindow > 0 ? rollingWindow : 4;
        this.codec = codec;
        this.cancellation = cancellation != null ? cancellation : CancellationSignal.none();
        this.noticeGuard = noticeGuard != null ? noticeGuard : new TerminalNoticeGuard();
        this.display = display != null ? display : text -> {
        };
    }

    /**
     * Resets all state, enters {@code reasoning} and starts the display timer.
     */
    public synchronized void start() {
        cancelTimer();
        rollingSteps.clear();
        allSteps.clear();
        status = ReasoningStatus.REASONING;
        startTime = clock.millis();
        elapsedSeconds = 0;
        if (scheduler != null) {
            tickFuture = scheduler.scheduleAtFixedRate(this::safeTick, tickIntervalMs, tickIntervalMs,
                    TimeUnit.MILLISECONDS);
        }
        log.debug("[Reasoning] started");
    }

    /**
     * Supplies the visible content rendered after the marker on every tick.
     */
    public synchronized void setVisibleContent(Supplier<String> visibleContent) {
        this.visibleContent = visibleContent != null ? visibleContent : () -> "";
    }

    public void addStep(String summary, String toolName) {
        addStep(summary, toolName, false);
    }

    /**
     * Records a step. The full history always grows; unless
     * {@code displayOnly} is set the step also enters the rolling window,
     * which keeps at most {@code rollingWindow} entries.
     */
    public synchronized void addStep(String summary, String toolName, boolean displayOnly) {
        if (summary == null || summary.isBlank()) {
            return;
        }
        ReasoningStep step = new ReasoningStep(clock.millis(), summary, toolName);
        allSteps.add(step);
        if (!displayOnly) {
            rollingSteps.addLast(step);
            while (rollingSteps.size() > rollingWindow) {
                rollingSteps.removeFirst();
            }
        }
    }

    /**
     * One timer tick. Public so tests can drive the timer deterministically.
     *
     * <p>
     * The frame is published while the monitor is held, so a live frame can
     * never reach the display after {@link #complete()} or {@link #collapse()}
     * has returned.
     */
    public synchronized void tick() {
        if (status != ReasoningStatus.REASONING) {
            return;
        }
        if (cancellation.isAborted()) {
            cancelTimer();
            status = ReasoningStatus.COLLAPSED;
            if (!noticeGuard.claim(TerminalNoticeGuard.TIMER)) {
                return;
            }
            log.debug("[Reasoning] timer observed cancellation first");
            display.accept(renderInterrupted());
            return;
        }
        updateElapsed();
        String frame = codec.serialize(status, elapsedSeconds, summaries(rollingSteps)) + visibleContent.get();
        if (noticeGuard.isClaimed()) {
            return;
        }
        display.accept(frame);
    }

    /**
     * Stops the timer and marks reasoning complete. Returns the final marker,
     * which embeds the full step history.
     */
    public synchronized String complete() {
        return finish(ReasoningStatus.COMPLETE);
    }

    /**
     * Stops the timer and collapses the block, keeping the full history.
     */
    public synchronized String collapse() {
        return finish(ReasoningStatus.COLLAPSED);
    }

    /**
     * Renders the interrupted notice: the collapsed marker, the content
     * streamed so far and the notice line.
     */
    public synchronized String renderInterrupted() {
        String marker = codec.serialize(ReasoningStatus.COLLAPSED, elapsedSeconds, summaries(allSteps));
        String content = visibleContent.get();
        StringBuilder sb = new StringBuilder(marker);
        if (content != null && !content.isBlank()) {
            sb.append(content).append("\n\n");
        }
        return sb.append(INTERRUPTED_NOTICE).toString();
    }

    public synchronized ReasoningState snapshot() {
        return ReasoningState.builder()
                .status(status)
                .startTime(startTime)
                .elapsedSeconds(elapsedSeconds)
                .steps(new ArrayList<>(rollingSteps))
                .allSteps(new ArrayList<>(allSteps))
                .build();
    }

    /**
     * Summaries of every recorded step, oldest first.
     */
    public synchronized List<String> allSummaries() {
        return summaries(allSteps);
    }

    public synchronized boolean isRunning() {
        return status == ReasoningStatus.REASONING;
    }

    private String finish(ReasoningStatus finalStatus) {
        cancelTimer();
        if (status == ReasoningStatus.IDLE) {
            return "";
        }
        if (status == ReasoningStatus.REASONING) {
            updateElapsed();
        }
        status = finalStatus;
        return codec.serialize(status, elapsedSeconds, summaries(allSteps));
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.warn("[Reasoning] display tick failed: {}", e.getMessage());
        }
    }

    private void updateElapsed() {
        elapsedSeconds = Math.max(0, (clock.millis() - startTime) / 1000);
    }

    private void cancelTimer() {
        if (tickFuture != null) {
            tickFuture.cancel(false);
            tickFuture = null;
        }
    }

    private static List<String> summaries(Iterable<ReasoningStep> steps) {
        List<String> result = new ArrayList<>();
        for (ReasoningStep step : steps) {
            result.add(step.summary());
        }
        return result;
    }
}
