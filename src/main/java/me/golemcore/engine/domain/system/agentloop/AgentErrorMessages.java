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

import me.golemcore.engine.domain.system.LlmErrorClassifier;

/**
 * User-facing texts for failed runs.
 */
public final class AgentErrorMessages {

    static final String AUTHENTICATION_GUIDANCE = "Something went wrong. Please check if you have set your API key."
            + "\nSet engine.llm.api-key or check the model configuration."
            + "\nError Details: ";

    private static final String TROUBLESHOOTING_MARKER = "Troubleshooting URL";

    private AgentErrorMessages() {
    }

    /**
     * Describes one failure. Authentication problems get setup guidance; the
     * provider's troubleshooting link is cut off.
     */
    public static String describe(Throwable error) {
        String details = stripTroubleshootingUrl(rootMessage(error));
        String code = LlmErrorClassifier.classifyFromThrowable(error);
        if (LlmErrorClassifier.isAuthenticationCode(code)) {
            return AUTHENTICATION_GUIDANCE + details;
        }
        if (LlmErrorClassifier.MODEL_NOT_FOUND.equals(code)) {
            return "You do not have access to this model or the model does not exist, please check with your "
                    + "API provider.";
        }
        return details;
    }

    /**
     * Both failures of a run that fell back and failed again. The agent error
     * comes first.
     */
    public static String combined(Throwable agentError, Throwable fallbackError) {
        return "Error: the agent failed and the fallback answer failed too."
                + "\n\nAgent error: " + describe(agentError)
                + "\n\nFallback error: " + describe(fallbackError);
    }

    static String stripTroubleshootingUrl(String message) {
        int index = message.indexOf(TROUBLESHOOTING_MARKER);
        return index >= 0 ? message.substring(0, index).trim() : message;
    }

    private static String rootMessage(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        Throwable current = error;
        String message = null;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                message = current.getMessage();
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return message != null ? message : error.getClass().getSimpleName();
    }
}
