package me.golemcore.engine.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.TokenUsage;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.system.LlmErrorClassifier;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class Langchain4jStreamingAdapterTest {

    private EngineProperties properties;
    private StreamingChatModel model;
    private Langchain4jStreamingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getLlm().setApiKey("sk-test");
        properties.getLlm().setModel("gpt-test");
        model = mock(StreamingChatModel.class);
        adapter = new Langchain4jStreamingAdapter(properties, new ObjectMapper()) {
            @Override
            protected StreamingChatModel getModel() {
                return model;
            }
        };
    }

    private void respondWith(Answer<Void> answer) {
        doAnswer(answer).when(model).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
    }

    private static LlmRequest userRequest(String text) {
        return LlmRequest.builder().messages(List.of(Message.user(text))).build();
    }

    @Test
    void shouldStreamPartialResponsesThenFinalChunk() {
        respondWith(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Hel");
            handler.onPartialResponse("lo");
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from("Hello"))
                    .finishReason(FinishReason.STOP)
                    .tokenUsage(new dev.langchain4j.model.output.TokenUsage(10, 5))
                    .build());
            return null;
        });

        StepVerifier.create(adapter.chatStream(userRequest("hi")))
                .assertNext(chunk -> assertEquals("Hel", chunk.getText()))
                .assertNext(chunk -> assertEquals("lo", chunk.getText()))
                .assertNext(chunk -> {
                    assertTrue(chunk.isDone());
                    assertNull(chunk.getText());
                    assertEquals("stop", chunk.getFinishReason());
                    assertEquals(15, chunk.getUsage().getTotalTokens());
                    assertFalse(chunk.hasToolCallChunks());
                })
                .verifyComplete();
    }

    @Test
    void shouldEmitToolCallsOnFinalChunk() {
        ToolExecutionRequest call = ToolExecutionRequest.builder()
                .id("call_1")
                .name("localSearch")
                .arguments("{\"query\":\"cats\"}")
                .build();
        respondWith(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onCompleteResponse(ChatResponse.builder()
                    .aiMessage(AiMessage.from(call))
                    .finishReason(FinishReason.TOOL_EXECUTION)
                    .build());
            return null;
        });

        StepVerifier.create(adapter.chatStream(userRequest("find cats")))
                .assertNext(chunk -> {
                    assertEquals("tool_calls", chunk.getFinishReason());
                    assertEquals(1, chunk.getToolCallChunks().size());
                    assertEquals(0, chunk.getToolCallChunks().get(0).getIndex());
                    assertEquals("call_1", chunk.getToolCallChunks().get(0).getId());
                    assertEquals("localSearch", chunk.getToolCallChunks().get(0).getName());
                    assertEquals("{\"query\":\"cats\"}", chunk.getToolCallChunks().get(0).getArgs());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateProviderErrors() {
        respondWith(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("partial");
            handler.onError(new RuntimeException("Overloaded"));
            return null;
        });

        StepVerifier.create(adapter.chatStream(userRequest("hi")))
                .assertNext(chunk -> assertEquals("partial", chunk.getText()))
                .verifyErrorMessage("Overloaded");
    }

    @Test
    void shouldFailWithAuthenticationCodeWhenApiKeyMissing() {
        properties.getLlm().setApiKey("");
        Langchain4jStreamingAdapter unconfigured = new Langchain4jStreamingAdapter(properties, new ObjectMapper());

        assertFalse(unconfigured.isAvailable());
        StepVerifier.create(unconfigured.chatStream(userRequest("hi")))
                .expectErrorSatisfies(error -> assertEquals(LlmErrorClassifier.AUTHENTICATION,
                        LlmErrorClassifier.classifyFromThrowable(error)))
                .verify();
    }

    @Test
    void shouldConvertTranscriptToLangchainMessages() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("Be brief.")
                .messages(List.of(
                        Message.user("What time is it?"),
                        Message.user("   "),
                        Message.builder()
                                .role(Message.ROLE_ASSISTANT)
                                .content("")
                                .toolCalls(List.of(new NativeToolCall("call_1", "datetime", Map.of())))
                                .build(),
                        Message.builder()
                                .role(Message.ROLE_TOOL)
                                .toolCallId("call_1")
                                .toolName("datetime")
                                .content("noon")
                                .build(),
                        Message.builder().content("no role").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("Be brief.", assertInstanceOf(SystemMessage.class, messages.get(0)).text());
        assertEquals("What time is it?", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
        AiMessage toolCall = assertInstanceOf(AiMessage.class, messages.get(2));
        assertEquals("datetime", toolCall.toolExecutionRequests().get(0).name());
        assertEquals("{}", toolCall.toolExecutionRequests().get(0).arguments());
        ToolExecutionResultMessage result = assertInstanceOf(ToolExecutionResultMessage.class, messages.get(3));
        assertEquals("call_1", result.id());
        assertEquals("noon", result.text());
        assertEquals("no role", assertInstanceOf(UserMessage.class, messages.get(4)).singleText());
    }

    @Test
    void shouldAttachToolSpecificationsOnlyWhenToolsPresent() {
        LlmRequest withTools = LlmRequest.builder()
                .messages(List.of(Message.user("hi")))
                .tools(List.of(ToolDefinition.simple("datetime", "Current time")))
                .build();

        assertEquals(1, adapter.buildChatRequest(withTools).toolSpecifications().size());
        List<?> none = adapter.buildChatRequest(userRequest("hi")).toolSpecifications();
        assertTrue(none == null || none.isEmpty());
    }

    @Test
    void shouldCarryPerRequestModelParameters() {
        LlmRequest request = LlmRequest.builder()
                .messages(List.of(Message.user("hi")))
                .model("gpt-4o-mini")
                .temperature(0.2)
                .maxTokens(512)
                .build();

        ChatRequest chatRequest = adapter.buildChatRequest(request);

        assertEquals("gpt-4o-mini", chatRequest.modelName());
        assertEquals(0.2, chatRequest.temperature());
        assertEquals(512, chatRequest.maxOutputTokens());
    }

    @Test
    void shouldLeaveModelDefaultsWhenRequestHasNoOverrides() {
        ChatRequest chatRequest = adapter.buildChatRequest(userRequest("hi"));

        assertNull(chatRequest.modelName());
        assertNull(chatRequest.temperature());
        assertNull(chatRequest.maxOutputTokens());
    }

    @Test
    void shouldMapFinishReasons() {
        assertEquals("stop", Langchain4jStreamingAdapter.mapFinishReason(FinishReason.STOP));
        assertEquals("length", Langchain4jStreamingAdapter.mapFinishReason(FinishReason.LENGTH));
        assertEquals("content_filter", Langchain4jStreamingAdapter.mapFinishReason(FinishReason.CONTENT_FILTER));
        assertEquals("other", Langchain4jStreamingAdapter.mapFinishReason(FinishReason.OTHER));
        assertNull(Langchain4jStreamingAdapter.mapFinishReason(null));
    }

    @Test
    void shouldMapUsageDerivingMissingTotal() {
        TokenUsage usage = Langchain4jStreamingAdapter.mapUsage(new dev.langchain4j.model.output.TokenUsage(7, 3));

        assertEquals(7, usage.getInputTokens());
        assertEquals(3, usage.getOutputTokens());
        assertEquals(10, usage.getTotalTokens());
        assertNull(Langchain4jStreamingAdapter.mapUsage(null));
    }

    @Test
    void shouldReportProviderAndModel() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals("gpt-test", adapter.getCurrentModel());
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldSkipEmptyPartialResponses() {
        respondWith(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("");
            handler.onCompleteResponse(ChatResponse.builder().aiMessage(AiMessage.from("done")).build());
            return null;
        });

        StepVerifier.create(adapter.chatStream(userRequest("hi")))
                .assertNext(chunk -> assertTrue(chunk.isDone()))
                .verifyComplete();
    }
}
