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
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.NativeToolCall;
import me.golemcore.engine.domain.model.TokenUsage;
import me.golemcore.engine.domain.model.ToolCallChunk;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import dev.langchain4j.model.output.FinishReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streaming model adapter built on langchain4j.
 *
 * <p>
 * Partial responses are emitted as text chunks. The completed response is
 * emitted as one final chunk carrying the tool calls (one fragment per call,
 * with complete arguments), the finish reason and token usage. Cancelling the
 * subscription drops every later callback.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}; the wire protocol is chosen by
 * {@code engine.llm.api-type} ({@code openai} or {@code anthropic}).
 */
@Component
@Slf4j
public class Langchain4jStreamingAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";
    private static final String API_ANTHROPIC = "anthropic";

    private final EngineProperties.LlmProperties config;
    private final ObjectMapper objectMapper;

    private volatile StreamingChatModel model;

    public Langchain4jStreamingAdapter(EngineProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getLlm();
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            AtomicBoolean cancelled = new AtomicBoolean(false);
            sink.onCancel(() -> cancelled.set(true));
            sink.onDispose(() -> cancelled.set(true));

            ChatRequest chatRequest;
            try {
                chatRequest = buildChatRequest(request);
            } catch (RuntimeException e) {
                sink.error(e);
                return;
            }
            log.debug("[LLM] streaming request: run={}, messages={}, tools={}", request.getRunId(),
                    chatRequest.messages().size(), request.hasTools() ? request.getTools().size() : 0);
            try {
                getModel().chat(chatRequest, new SinkHandler(sink, cancelled));
            } catch (RuntimeException e) {
                sink.error(e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return config.getModel();
    }

    @Override
    public boolean isAvailable() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    /**
     * Returns the underlying streaming model, building it on first use.
     */
    protected StreamingChatModel getModel() {
        StreamingChatModel current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    current = createModel();
                    model = current;
                    log.info("Langchain4j streaming adapter initialized: api={}, model={}",
                            config.getApiType(), config.getModel());
                }
            }
        }
        return current;
    }

    private StreamingChatModel createModel() {
        if (!isAvailable()) {
            throw new IllegalStateException("[llm.langchain4j.authentication] engine.llm.api-key is not set");
        }
        Duration timeout = Duration.ofMillis(config.getTimeoutMs());
        if (API_ANTHROPIC.equalsIgnoreCase(config.getApiType())) {
            var builder = AnthropicStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(config.getModel())
                    .maxTokens(config.getMaxTokens())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (config.getTemperature() != null) {
                builder.temperature(config.getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(config.getMaxTokens())
                .timeout(timeout);
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        return builder.build();
    }

    ChatRequest buildChatRequest(LlmRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request));
        // Per-request values override the defaults the model was built with
        if (request.getModel() != null && !request.getModel().isBlank()) {
            builder.modelName(request.getModel());
        }
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null && request.getMaxTokens() > 0) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        if (request.hasTools()) {
            List<ToolSpecification> specifications = request.getTools().stream()
                    .map(ToolSchemaConverter::toSpecification)
                    .toList();
            builder.toolSpecifications(specifications);
        }
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getMessages() == null) {
            return messages;
        }

        for (Message msg : request.getMessages()) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            String role = msg.getRole() != null ? msg.getRole() : Message.ROLE_USER;
            switch (role) {
            case Message.ROLE_USER -> {
                if (!content.isBlank()) {
                    messages.add(UserMessage.from(content));
                }
            }
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> calls = msg.getToolCalls().stream()
                            .map(this::toExecutionRequest)
                            .toList();
                    messages.add(content.isBlank() ? AiMessage.from(calls) : AiMessage.from(content, calls));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(
                    ToolExecutionResultMessage.from(msg.getToolCallId(), msg.getToolName(), content));
            case Message.ROLE_SYSTEM -> {
                if (!content.isBlank()) {
                    messages.add(SystemMessage.from(content));
                }
            }
            default -> {
                log.warn("Unknown message role: {}, treating as user message", role);
                if (!content.isBlank()) {
                    messages.add(UserMessage.from(content));
                }
            }
            }
        }
        return messages;
    }

    private ToolExecutionRequest toExecutionRequest(NativeToolCall call) {
        return ToolExecutionRequest.builder()
                .id(call.id())
                .name(call.name())
                .arguments(toJson(call.arguments()))
                .build();
    }

    private String toJson(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    static LlmChunk toFinalChunk(ChatResponse response) {
        AiMessage message = response.aiMessage();
        List<ToolCallChunk> toolCalls = new ArrayList<>();
        if (message != null && message.hasToolExecutionRequests()) {
            List<ToolExecutionRequest> requests = message.toolExecutionRequests();
            for (int i = 0; i < requests.size(); i++) {
                ToolExecutionRequest request = requests.get(i);
                toolCalls.add(ToolCallChunk.of(i, request.id(), request.name(), request.arguments()));
            }
        }
        return LlmChunk.builder()
                .toolCallChunks(toolCalls.isEmpty() ? null : toolCalls)
                .finishReason(mapFinishReason(response.finishReason()))
                .usage(mapUsage(response.tokenUsage()))
                .done(true)
                .build();
    }

    static String mapFinishReason(FinishReason reason) {
        if (reason == null) {
            return null;
        }
        return switch (reason) {
        case STOP -> "stop";
        case LENGTH -> "length";
        case TOOL_EXECUTION -> "tool_calls";
        case CONTENT_FILTER -> "content_filter";
        default -> "other";
        };
    }

    static TokenUsage mapUsage(dev.langchain4j.model.output.TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        int input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        int total = usage.totalTokenCount() != null ? usage.totalTokenCount() : input + output;
        return new TokenUsage(input, output, total);
    }

    private static final class SinkHandler implements StreamingChatResponseHandler {

        private final FluxSink<LlmChunk> sink;
        private final AtomicBoolean cancelled;

        private SinkHandler(FluxSink<LlmChunk> sink, AtomicBoolean cancelled) {
            this.sink = sink;
            this.cancelled = cancelled;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (!cancelled.get() && partialResponse != null && !partialResponse.isEmpty()) {
                sink.next(LlmChunk.text(partialResponse));
            }
        }

        @Override
        public void onCompleteResponse(ChatResponse completeResponse) {
            if (cancelled.get()) {
                return;
            }
            sink.next(toFinalChunk(completeResponse));
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            if (cancelled.get()) {
                log.debug("[LLM] ignoring error after cancellation: {}", error.getMessage());
                return;
            }
            sink.error(error);
        }
    }
}
