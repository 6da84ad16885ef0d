package me.golemcore.engine.domain.stream;

import me.golemcore.engine.domain.model.ContentPart;
import me.golemcore.engine.domain.model.LlmChunk;
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.StreamingResult;
import me.golemcore.engine.domain.model.TokenUsage;
import me.golemcore.engine.domain.model.ToolCallChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamingDecoderTest {

    private List<String> updates;
    private StreamingDecoder decoder;

    @BeforeEach
    void setUp() {
        updates = new ArrayList<>();
        decoder = new StreamingDecoder(updates::add);
    }

    @Test
    void shouldConcatenatePlainText() {
        decoder.processChunk(LlmChunk.text("Hello"));
        decoder.processChunk(LlmChunk.text(", world"));

        StreamingResult result = decoder.close();

        assertEquals("Hello, world", result.content());
        assertFalse(result.wasTruncated());
        assertEquals(List.of("Hello", "Hello, world"), updates);
    }

    @Test
    void shouldWrapClaudeStyleThinkingBeforeText() {
        decoder.processChunk(LlmChunk.builder()
                .contentParts(List.of(ContentPart.thinking("Let me check"), ContentPart.text("Answer")))
                .build());

        assertEquals("\n<think>Let me check</think>Answer", decoder.close().content());
    }

    @Test
    void shouldNotAppendNullForThinkingPartWithoutValue() {
        decoder.processChunk(LlmChunk.builder()
                .contentParts(List.of(ContentPart.thinking(null)))
                .build());
        decoder.processChunk(LlmChunk.text("Done"));

        String content = decoder.close().content();

        assertEquals("\n<think></think>Done", content);
        assertFalse(content.contains("null"));
    }

    @Test
    void shouldWrapDeepSeekReasoningAcrossChunks() {
        decoder.processChunk(LlmChunk.builder().reasoningContent("step one, ").build());
        decoder.processChunk(LlmChunk.builder().reasoningContent("step two").build());
        decoder.processChunk(LlmChunk.builder().reasoningContent("").text("Result").build());

        assertEquals("\n<think>step one, step two</think>Result", decoder.close().content());
    }

    @Test
    void shouldIgnoreOpenRouterDetailsAfterDeltaReasoning() {
        decoder.processChunk(LlmChunk.builder().deltaReasoning("thinking").build());
        decoder.processChunk(LlmChunk.builder().reasoningDetails(List.of("thinking")).build());
        decoder.processChunk(LlmChunk.text("Visible"));

        assertEquals("\n<think>thinking</think>Visible", decoder.close().content());
    }

    @Test
    void shouldUseOpenRouterDetailsWhenNoDeltaWasSeen() {
        decoder.processChunk(LlmChunk.builder().reasoningDetails(List.of("a", "b")).build());
        decoder.processChunk(LlmChunk.text("Visible"));

        assertEquals("\n<think>ab</think>Visible", decoder.close().content());
    }

    @Test
    void shouldTreatEmptyReasoningDetailsAsPlainText() {
        decoder.processChunk(LlmChunk.builder().reasoningDetails(List.of()).text("Only text").build());

        assertEquals("Only text", decoder.close().content());
    }

    @Test
    void shouldWrapOllamaThinking() {
        decoder.processChunk(LlmChunk.builder().messageThinking("hmm").build());
        decoder.processChunk(LlmChunk.text("ok"));

        assertEquals("\n<think>hmm</think>ok", decoder.close().content());
    }

    @Test
    void shouldCloseDanglingThinkBlock() {
        decoder.processChunk(LlmChunk.builder().reasoningContent("unfinished").build());

        assertEquals("\n<think>unfinished</think>", decoder.close().content());
    }

    @Test
    void shouldPrependStartMarkerForOrphanEndMarker() {
        decoder.processChunk(LlmChunk.text("reasoning</think>answer"));

        assertEquals("<think>reasoning</think>answer", decoder.close().content());
    }

    @Test
    void shouldDropReasoningWhenThinkingExcluded() {
        StreamingDecoder excluding = new StreamingDecoder(updates::add, true);
        excluding.processChunk(LlmChunk.builder().reasoningContent("secret").build());
        excluding.processChunk(LlmChunk.builder()
                .contentParts(List.of(ContentPart.thinking("more"), ContentPart.text("Shown")))
                .build());

        assertEquals("Shown", excluding.close().content());
    }

    @Test
    void shouldKeepTruncationFlagSticky() {
        decoder.processChunk(LlmChunk.builder().text("partial").finishReason("length").build());
        decoder.processChunk(LlmChunk.builder().text(" more").finishReason("stop").build());

        assertTrue(decoder.close().wasTruncated());
    }

    @Test
    void shouldDetectTruncationFromMetadata() {
        decoder.processChunk(LlmChunk.builder()
                .text("x")
                .responseMetadata(Map.of("stop_reason", "max_tokens"))
                .build());

        assertTrue(decoder.close().wasTruncated());
    }

    @Test
    void shouldKeepLastTokenUsage() {
        decoder.processChunk(LlmChunk.builder().text("a").usage(TokenUsage.of(10, 1)).build());
        decoder.processChunk(LlmChunk.builder()
                .text("b")
                .responseMetadata(Map.of("usage", Map.of("prompt_tokens", 10, "completion_tokens", 2)))
                .build());

        TokenUsage usage = decoder.close().tokenUsage();

        assertEquals(10, usage.getInputTokens());
        assertEquals(2, usage.getOutputTokens());
        assertEquals(12, usage.getTotalTokens());
    }

    @Test
    void shouldReturnSameResultOnRepeatedCloseAndIgnoreLateChunks() {
        decoder.processChunk(LlmChunk.text("final"));
        StreamingResult first = decoder.close();

        decoder.processChunk(LlmChunk.text(" ignored"));

        assertSame(first, decoder.close());
        assertEquals("final", decoder.currentContent());
    }

    @Test
    void shouldNotNotifyWhenChunkAddsNothing() {
        decoder.processChunk(LlmChunk.builder().finishReason("stop").build());

        assertTrue(updates.isEmpty());
        assertNull(decoder.close().tokenUsage());
    }

    @Test
    void shouldForwardToolCallFragmentsToAccumulator() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        StreamingDecoder withTools = new StreamingDecoder(updates::add, false, accumulator,
                EarlyTruncationPolicy.disabled());

        withTools.processChunk(LlmChunk.builder()
                .toolCallChunks(List.of(ToolCallChunk.of(0, "c1", "localSearch", "{\"query\":")))
                .build());
        withTools.processChunk(LlmChunk.builder()
                .toolCallChunks(List.of(ToolCallChunk.of(0, null, null, "\"cats\"}")))
                .build());

        List<NativeToolCall> calls = accumulator.finalizeCalls();
        assertEquals(1, calls.size());
        assertEquals("c1", calls.get(0).id());
        assertEquals("cats", calls.get(0).stringArgument("query"));
    }

    @Test
    void shouldCutTextStreamedAfterToolCallsWhenPolicyTrips() {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        StreamingDecoder withPolicy = new StreamingDecoder(updates::add, false, accumulator,
                new TrailingTextTruncationPolicy(10));

        withPolicy.processChunk(LlmChunk.text("Looking it up."));
        withPolicy.processChunk(LlmChunk.builder()
                .toolCallChunks(List.of(ToolCallChunk.of(0, "c1", "localSearch", "{\"query\":\"x\"}"),
                        ToolCallChunk.of(1, "c2", "localSearch", "{\"query\":")))
                .build());
        withPolicy.processChunk(LlmChunk.text("Here are the invented results of the search"));
        withPolicy.processChunk(LlmChunk.text(" and more"));

        assertTrue(withPolicy.isEarlyTruncated());
        StreamingResult result = withPolicy.close();
        assertEquals("Looking it up.", result.content());
        assertFalse(result.wasTruncated());

        List<NativeToolCall> calls = accumulator.finalizeCalls();
        assertEquals(1, calls.size());
        assertEquals("c1", calls.get(0).id());
        assertFalse(accumulator.getWarnings().isEmpty());
    }

    @Test
    void shouldStripThinkingBlocks() {
        assertEquals("answer", StreamingDecoder.stripThinking("\n<think>why</think>answer"));
        assertEquals("before", StreamingDecoder.stripThinking("before\n<think>never closed"));
        assertEquals("", StreamingDecoder.stripThinking(null));
    }
}
