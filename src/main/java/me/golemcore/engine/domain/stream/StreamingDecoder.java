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

import me.golemcore.engine.domain.model.ContentPart;
import me.golemcore.engine.domain.model.LlmChunk;
import me.golemcore.engine.domain.model.StreamingResult;
import me.golemcore.engine.domain.model.TokenUsage;
import me.golemcore.engine.domain.model.ToolCallChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Turns provider chunks into one text buffer with well-formed reasoning
 * blocks.
 *
 * <p>
 * Reasoning text is wrapped in {@value #THINK_START_TAG}...{@value #THINK_END}
 * markers: a block opens on the first reasoning delta and closes on the first
 * visible-text delta that follows, so reasoning and visible text never
 * overlap regardless of how the transport interleaves them. Every change of
 * the buffer is reported to the caller-supplied listener.
 *
 * <p>
 * Besides text the decoder tracks the sticky truncation flag, the last token
 * usage snapshot and forwards tool-call fragments to an optional
 * {@link ToolCallAccumulator}.
 *
 * <p>
 * One instance serves exactly one streamed completion.
 */
public class StreamingDecoder {

    private static final Logger log = LoggerFactory.getLogger(StreamingDecoder.class);

    public static final String THINK_START_TAG = "<think>";
    public static final String THINK_START = "\n" + THINK_START_TAG;
    public static final String THINK_END = "</think>";

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?(</think>|$)");

    private final Consumer<String> onUpdate;
    private final boolean excludeThinking;
    private final ToolCallAccumulator toolCalls;
    private final EarlyTruncationPolicy truncationPolicy;

    private final StringBuilder buffer = new StringBuilder();
    private boolean inThinkBlock;
    private boolean seenDeltaReasoning;
    private boolean wasTruncated;
    private TokenUsage tokenUsage;

    private int toolBoundary = -1;
    private boolean inThinkBlockAtBoundary;
    private boolean earlyTruncated;
    private StreamingResult closedResult;

    public StreamingDecoder(Consumer<String> onUpdate) {
        this(onUpdate, false, null, EarlyTruncationPolicy.disabled());
    }

    public StreamingDecoder(Consumer<String> onUpdate, boolean excludeThinking) {
        this(onUpdate, excludeThinking, null, EarlyTruncationPolicy.disabled());
    }

    public StreamingDecoder(Consumer<String> onUpdate, boolean excludeThinking, ToolCallAccumulator toolCalls,
            EarlyTruncationPolicy truncationPolicy) {
        this.onUpdate = onUpdate != null ? onUpdate : text -> {
        };
        this.excludeThinking = excludeThinking;
        this.toolCalls = toolCalls;
        this.truncationPolicy = truncationPolicy != null ? truncationPolicy : EarlyTruncationPolicy.disabled();
    }

    public synchronized void processChunk(LlmChunk chunk) {
        if (chunk == null) {
            return;
        }
        if (closedResult != null || earlyTruncated) {
            log.trace("[Stream] ignoring chunk after {}", closedResult != null ? "close" : "early truncation");
            return;
        }

        if (!wasTruncated && TruncationDetector.isTruncated(chunk)) {
            wasTruncated = true;
            log.debug("[Stream] provider reported output truncated by token limit");
        }
        TokenUsage usage = TokenUsageExtractor.extract(chunk);
        if (usage != null) {
            tokenUsage = usage;
        }

        int lengthBefore = buffer.length();
        switch (ChunkKind.of(chunk)) {
        case CLAUDE_STYLE -> {
            handleContentParts(chunk.getContentParts());
            handleText(chunk.getText());
        }
        case DEEPSEEK_STYLE -> {
            handleReasoning(chunk.getReasoningContent());
            handleText(chunk.getText());
        }
        case OPENROUTER_STYLE -> {
            handleOpenRouterReasoning(chunk);
            handleText(chunk.getText());
        }
        case OLLAMA_STYLE -> {
            handleReasoning(chunk.getMessageThinking());
            handleText(chunk.getText());
        }
        default -> handleText(chunk.getText());
        }

        if (chunk.hasToolCallChunks()) {
            forwardToolCalls(chunk.getToolCallChunks());
        }
        boolean trimmed = checkEarlyTruncation();

        if (trimmed || buffer.length() != lengthBefore) {
            onUpdate.accept(buffer.toString());
        }
    }

    /**
     * Finishes the stream: closes a dangling reasoning block and repairs an
     * end marker that has no start. Idempotent.
     */
    public synchronized StreamingResult close() {
        if (closedResult != null) {
            return closedResult;
        }
        if (inThinkBlock) {
            buffer.append(THINK_END);
            inThinkBlock = false;
        }
        String content = buffer.toString();
        if (content.contains(THINK_END) && !content.contains(THINK_START_TAG)) {
            log.warn("[Stream] found {} without a matching {}, prepending start marker", THINK_END,
                    THINK_START_TAG);
            content = THINK_START_TAG + content;
        }
        closedResult = new StreamingResult(content, wasTruncated, tokenUsage);
        return closedResult;
    }

    public synchronized String currentContent() {
        return closedResult != null ? closedResult.content() : buffer.toString();
    }

    public synchronized boolean isEarlyTruncated() {
        return earlyTruncated;
    }

    /**
     * Removes reasoning blocks, including one left open at the end of the
     * text, and returns the trimmed visible remainder.
     */
    public static String stripThinking(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        return THINK_BLOCK.matcher(content).replaceAll("").trim();
    }

    private void handleContentParts(List<ContentPart> parts) {
        for (ContentPart part : parts) {
            if (part == null) {
                continue;
            }
            if (part.isThinking()) {
                if (excludeThinking) {
                    continue;
                }
                // An absent thinking value still marks the start of reasoning
                openThinkBlock();
                if (part.getThinking() != null) {
                    buffer.append(part.getThinking());
                }
            } else if (part.isText()) {
                handleText(part.getText());
            }
        }
    }

    private void handleOpenRouterReasoning(LlmChunk chunk) {
        String delta = chunk.getDeltaReasoning();
        if (delta != null && !delta.isEmpty()) {
            seenDeltaReasoning = true;
            handleReasoning(delta);
            return;
        }
        // reasoning_details repeats what the deltas already streamed
        if (!seenDeltaReasoning && chunk.getReasoningDetails() != null) {
            handleReasoning(String.join("", chunk.getReasoningDetails()));
        }
    }

    private void handleReasoning(String reasoning) {
        if (excludeThinking || reasoning == null || reasoning.isEmpty()) {
            return;
        }
        openThinkBlock();
        buffer.append(reasoning);
    }

    private void handleText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (inThinkBlock) {
            buffer.append(THINK_END);
            inThinkBlock = false;
        }
        buffer.append(text);
    }

    private void openThinkBlock() {
        if (!inThinkBlock) {
            buffer.append(THINK_START);
            inThinkBlock = true;
        }
    }

    private void forwardToolCalls(List<ToolCallChunk> fragments) {
        toolBoundary = buffer.length();
        inThinkBlockAtBoundary = inThinkBlock;
        if (toolCalls == null) {
            return;
        }
        for (ToolCallChunk fragment : fragments) {
            toolCalls.ingest(fragment);
        }
    }

    private boolean checkEarlyTruncation() {
        if (toolBoundary < 0 || buffer.length() <= toolBoundary) {
            return false;
        }
        if (!truncationPolicy.shouldTruncate(buffer.substring(toolBoundary))) {
            return false;
        }
        log.info("[Stream] early truncation: dropping {} chars streamed after the last tool call",
                buffer.length() - toolBoundary);
        buffer.setLength(toolBoundary);
        inThinkBlock = inThinkBlockAtBoundary;
        earlyTruncated = true;
        if (toolCalls != null) {
            toolCalls.discardIncomplete();
        }
        return true;
    }
}
