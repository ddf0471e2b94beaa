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

package me.golemcore.tripagent.adapter.outbound.llm;

import me.golemcore.tripagent.domain.model.ChatMessage;
import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmException;
import me.golemcore.tripagent.domain.model.LlmProvider;
import me.golemcore.tripagent.domain.system.LlmErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Anthropic messages streaming ({@code POST /v1/messages}).
 *
 * <p>
 * System messages move to the top-level {@code system} field. Text arrives in
 * {@code content_block_delta} events, {@code message_stop} ends the stream and
 * an {@code error} event fails it.
 */
@Component
public class AnthropicProviderAdapter extends AbstractSseProviderAdapter {

    static final String API_VERSION = "2023-06-01";

    public AnthropicProviderAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.ANTHROPIC;
    }

    @Override
    protected Request buildRequest(List<ChatMessage> messages, LlmConfig config) throws JsonProcessingException {
        String system = messages.stream()
                .filter(ChatMessage::isSystemMessage)
                .map(ChatMessage::getContent)
                .collect(Collectors.joining("\n\n"));
        List<ChatMessage> conversation = messages.stream()
                .filter(message -> !message.isSystemMessage())
                .toList();

        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getEffectiveModel());
        body.put("max_tokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());
        body.put("stream", true);
        if (!system.isBlank()) {
            body.put("system", system);
        }
        body.set("messages", toMessagesArray(conversation));

        return new Request.Builder()
                .url(config.getEffectiveBaseUrl() + "/v1/messages")
                .header("x-api-key", config.getApiKey())
                .header("anthropic-version", API_VERSION)
                .header("Accept", "text/event-stream")
                .post(jsonBody(body))
                .build();
    }

    @Override
    protected Frame parseFrame(JsonNode frame) {
        return parseAnthropicFrame(frame);
    }

    static Frame parseAnthropicFrame(JsonNode frame) {
        String type = frame.path("type").asText("");
        switch (type) {
        case "content_block_delta":
            return Frame.text(textAt(frame.path("delta").get("text")));
        case "message_stop":
            return Frame.end(null);
        case "error":
            throw toException(frame.path("error"));
        default:
            return Frame.EMPTY;
        }
    }

    private static LlmException toException(JsonNode error) {
        String errorType = error.path("type").asText("");
        String message = error.path("message").asText("Anthropic stream error");
        ErrorKind kind = switch (errorType) {
        case "overloaded_error", "api_error" -> ErrorKind.SERVER_ERROR;
        case "rate_limit_error" -> ErrorKind.RATE_LIMIT_EXCEEDED;
        case "authentication_error", "permission_error" -> ErrorKind.INVALID_CREDENTIAL;
        case "invalid_request_error" -> ErrorKind.INVALID_REQUEST;
        default -> LlmErrorClassifier.classifyFromMessage(message);
        };
        return new LlmException(kind, message);
    }
}
