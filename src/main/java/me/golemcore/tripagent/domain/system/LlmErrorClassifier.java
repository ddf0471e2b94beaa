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

package me.golemcore.tripagent.domain.system;

import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.LlmException;
import me.golemcore.tripagent.domain.model.TripAgentException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps model-provider failures to {@link ErrorKind}s.
 *
 * <p>
 * Classification order: an already classified {@link TripAgentException} in
 * the cause chain, then known throwable types, then message heuristics.
 */
public final class LlmErrorClassifier {

    private LlmErrorClassifier() {
    }

    /**
     * Builds the error for a non-successful HTTP response.
     */
    public static LlmException fromHttpStatus(int status, String body) {
        String detail = body != null && !body.isBlank() ? abbreviate(body) : "HTTP " + status;
        ErrorKind kind = kindForStatus(status, body);
        return new LlmException(kind, "Model provider returned HTTP " + status + ": " + detail, status, null);
    }

    static ErrorKind kindForStatus(int status, String body) {
        if (status == 429) {
            return ErrorKind.RATE_LIMIT_EXCEEDED;
        }
        if (status == 401 || status == 403) {
            return ErrorKind.INVALID_CREDENTIAL;
        }
        if (status == 408) {
            return ErrorKind.TIMEOUT;
        }
        if (status >= 500) {
            return ErrorKind.SERVER_ERROR;
        }
        if (body != null && isContextLengthMessage(body.toLowerCase(Locale.ROOT))) {
            return ErrorKind.CONTEXT_TOO_LONG;
        }
        if (status >= 400) {
            return ErrorKind.INVALID_REQUEST;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Wraps any failure into an {@link LlmException}, walking the cause chain.
     */
    public static LlmException classify(Throwable throwable) {
        if (throwable instanceof LlmException llmException) {
            return llmException;
        }
        if (throwable == null) {
            return new LlmException(ErrorKind.UNKNOWN, "Unknown model error");
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof TripAgentException classified) {
                return new LlmException(classified.getKind(), classified.getMessage(), null, throwable);
            }

            ErrorKind byType = classifyKnownThrowable(current);
            if (byType != ErrorKind.UNKNOWN) {
                return new LlmException(byType, describe(current), null, throwable);
            }

            ErrorKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != ErrorKind.UNKNOWN) {
                return new LlmException(byMessage, describe(current), null, throwable);
            }

            current = current.getCause();
        }
        return new LlmException(ErrorKind.UNKNOWN, describe(throwable), null, throwable);
    }

    /**
     * Heuristic classification of free-form provider error text.
     */
    public static ErrorKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit") || lower.contains("rate_limit") || lower.contains("429")
                || lower.contains("too many requests")) {
            return ErrorKind.RATE_LIMIT_EXCEEDED;
        }
        if (lower.contains("api key") || lower.contains("api_key") || lower.contains("401")
                || lower.contains("unauthorized")) {
            return ErrorKind.INVALID_CREDENTIAL;
        }
        if (isContextLengthMessage(lower)) {
            return ErrorKind.CONTEXT_TOO_LONG;
        }
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return ErrorKind.TIMEOUT;
        }
        if (lower.contains("overloaded") || lower.contains("internal server error") || lower.contains("503")
                || lower.contains("502")) {
            return ErrorKind.SERVER_ERROR;
        }
        if (lower.contains("network") || lower.contains("connection reset") || lower.contains("failed to fetch")) {
            return ErrorKind.NETWORK_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }

    private static ErrorKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        if (throwable instanceof SocketTimeoutException || throwable instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (throwable instanceof InterruptedIOException) {
            return ErrorKind.TIMEOUT;
        }
        if (throwable instanceof IOException) {
            return ErrorKind.NETWORK_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }

    private static boolean isContextLengthMessage(String lower) {
        return lower.contains("context length") || lower.contains("context_length") || lower.contains("too many tokens")
                || lower.contains("maximum context");
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed;
    }
}
