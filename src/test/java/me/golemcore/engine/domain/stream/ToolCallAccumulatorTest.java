package me.golemcore.engine.domain.stream;

import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.ToolCallChunk;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallAccumulatorTest {

    private static final String SPLIT_NAME = "localSearch";
    private static final String SPLIT_ARGS = "{\"query\":\"cats, dogs\",\"limit\":3}";

    private final ToolCallAccumulator accumulator = new ToolCallAccumulator();

    @Test
    void shouldMergeFragmentsByIndexInOrder() {
        accumulator.ingest(ToolCallChunk.of(1, "b", "datetime", "{}"));
        accumulator.ingest(ToolCallChunk.of(0, "a", "local", null));
        accumulator.ingest(ToolCallChunk.of(0, null, "Search", "{\"query\":\"q\","));
        accumulator.ingest(ToolCallChunk.of(0, "ignored", null, "\"limit\":3}"));

        List<NativeToolCall> calls = accumulator.finalizeCalls();

        assertEquals(2, calls.size());
        assertEquals(new NativeToolCall("a", "localSearch", Map.of("query", "q", "limit", 3)), calls.get(0));
        assertEquals("datetime", calls.get(1).name());
        assertTrue(calls.get(1).arguments().isEmpty());
    }

    @Test
    void shouldSynthesizeMissingIdFromIndex() {
        accumulator.ingest(ToolCallChunk.of(2, null, "datetime", "{}"));

        assertEquals("call_2", accumulator.finalizeCalls().get(0).id());
    }

    @Test
    void shouldDropCallsWithoutName() {
        accumulator.ingest(ToolCallChunk.of(0, "x", null, "{\"a\":1}"));

        assertTrue(accumulator.finalizeCalls().isEmpty());
        assertEquals(1, accumulator.getWarnings().size());
    }

    @Test
    void shouldStripLeadingEmptyObject() {
        accumulator.ingest(ToolCallChunk.of(0, "c", "localSearch", "{}{\"query\":\"cats\"}"));

        assertEquals("cats", accumulator.finalizeCalls().get(0).stringArgument("query"));
    }

    @Test
    void shouldDegradeMalformedArgumentsToEmptyMap() {
        accumulator.ingest(ToolCallChunk.of(0, "c", "localSearch", "{\"query\": broken"));

        List<NativeToolCall> calls = accumulator.finalizeCalls();

        assertEquals(1, calls.size());
        assertTrue(calls.get(0).arguments().isEmpty());
        assertEquals(1, accumulator.getWarnings().size());
    }

    @Test
    void shouldContinueLatestCallWhenFragmentHasNoIndexOrId() {
        accumulator.ingest(ToolCallChunk.builder().id("c").name("localSearch").args("{\"query\":").build());
        accumulator.ingest(ToolCallChunk.builder().args("\"dogs\"}").build());

        List<NativeToolCall> calls = accumulator.finalizeCalls();

        assertEquals(1, calls.size());
        assertEquals("dogs", calls.get(0).stringArgument("query"));
    }

    @Test
    void shouldDiscardOnlyIncompleteCells() {
        accumulator.ingest(ToolCallChunk.of(0, "a", "localSearch", "{\"query\":\"x\"}"));
        accumulator.ingest(ToolCallChunk.of(1, "b", "localSearch", "{\"query\":"));

        assertEquals(1, accumulator.discardIncomplete());
        assertEquals(1, accumulator.finalizeCalls().size());
    }

    @ParameterizedTest
    @MethodSource("splitPoints")
    void shouldProduceSameCallWhenFragmentedAtAnyBoundary(int nameSplit, int argsSplit) {
        ToolCallAccumulator whole = new ToolCallAccumulator();
        whole.ingest(ToolCallChunk.of(0, "call-1", SPLIT_NAME, SPLIT_ARGS));

        accumulator.ingest(ToolCallChunk.of(0, "call-1", SPLIT_NAME.substring(0, nameSplit),
                SPLIT_ARGS.substring(0, argsSplit)));
        accumulator.ingest(ToolCallChunk.of(0, null, SPLIT_NAME.substring(nameSplit),
                SPLIT_ARGS.substring(argsSplit)));

        assertEquals(whole.finalizeCalls(), accumulator.finalizeCalls());
    }

    private static Stream<Arguments> splitPoints() {
        return IntStream.rangeClosed(0, SPLIT_NAME.length())
                .boxed()
                .flatMap(nameSplit -> IntStream.rangeClosed(0, SPLIT_ARGS.length())
                        .mapToObj(argsSplit -> Arguments.of(nameSplit, argsSplit)));
    }
}
