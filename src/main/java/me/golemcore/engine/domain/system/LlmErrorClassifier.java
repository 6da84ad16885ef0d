package me.golemcore.engine.domain.system;

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

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies model-call failures into stable machine-readable reason codes.
 *
 * <p>
 * The agent loop only retries {@link #PROVIDER_OVERLOADED}; every other code
 * ends the loop and hands over to the fallback path.
 */
public final class LlmErrorClassifier {

    public static final String PROVIDER_OVERLOADED = "llm.provider.overloaded";
    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String TIMEOUT = "llm.langchain4j.timeout";
    public static final String AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String CONTENT_FILTERED = "llm.langchain4j.content_filtered";
    public static final String INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String LANGCHAIN4J_ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private static final Map<String, String> CODES_BY_EXCEPTION = Map.of(
            "RateLimitException", RATE_LIMIT,
            "TimeoutException", TIMEOUT,
            "AuthenticationException", AUTHENTICATION,
            "InvalidRequestException", INVALID_REQUEST,
            "ModelNotFoundException", MODEL_NOT_FOUND,
            "ContentFilteredException", CONTENT_FILTERED,
            "InternalServerException", INTERNAL_SERVER,
            "LangChain4jException", LANGCHAIN4J_ERROR);

    private static final Pattern STATUS_IN_MESSAGE = Pattern.compile("\\b(?:status(?: code)?[:= ]*)?(401|429|529)\\b");

    private LlmErrorClassifier() {
    }

    /**
     * Walks the cause chain and returns the first code that can be derived
     * from an embedded marker, a known exception type or the message text.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (PROVIDER_OVERLOADED.equals(byMessage)) {
                return byMessage;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[llm.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        String code = message.substring(1, end);
        return code.startsWith("llm.") ? code : null;
    }

    public static boolean isOverloadedCode(String code) {
        return PROVIDER_OVERLOADED.equals(code);
    }

    public static boolean isAuthenticationCode(String code) {
        return AUTHENTICATION.equals(code);
    }

    public static boolean isAbortCode(String code) {
        return REQUEST_ABORTED.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        String simpleName = className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length());
        if ("HttpException".equals(simpleName)) {
            return classifyHttpStatus(readHttpStatusCode(throwable));
        }
        return CODES_BY_EXCEPTION.getOrDefault(simpleName, UNKNOWN);
    }

    static String classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return HTTP_ERROR;
        }
        return switch (statusCode) {
        case 529 -> PROVIDER_OVERLOADED;
        case 429 -> RATE_LIMIT;
        case 401, 403 -> AUTHENTICATION;
        case 408, 504 -> TIMEOUT;
        default -> statusCode >= 500 ? INTERNAL_SERVER : statusCode >= 400 ? INVALID_REQUEST : HTTP_ERROR;
        };
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("overloaded")) {
            return PROVIDER_OVERLOADED;
        }
        Matcher status = STATUS_IN_MESSAGE.matcher(normalized);
        if (status.find()) {
            return classifyHttpStatus(Integer.parseInt(status.group(1)));
        }
        if (normalized.contains("api key")
                || normalized.contains("apikey")
                || normalized.contains("unauthorized")
                || normalized.contains("authentication")) {
            return AUTHENTICATION;
        }
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        return UNKNOWN;
    }
}
