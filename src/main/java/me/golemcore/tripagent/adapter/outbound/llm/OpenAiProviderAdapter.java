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
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OpenAI chat completions streaming ({@code POST /chat/completions} with a
 * bearer token). Text arrives in {@code choices[0].delta.content}; the stream
 * ends with {@code data: [DONE]}.
 */
@Component
public class OpenAiProviderAdapter extends AbstractSseProviderAdapter {

    public OpenAiProviderAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.OPENAI;
    }

    @Override
    protected Request buildRequest(List<ChatMessage> messages, LlmConfig config) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getEffectiveModel());
        body.set("messages", toMessagesArray(messages));
        body.put("max_tokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());
        body.put("stream", true);

        return new Request.Builder()
                .url(config.getEffectiveBaseUrl() + "/chat/completions")
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("Accept", "text/event-stream")
                .post(jsonBody(body))
                .build();
    }

    @Override
    protected Frame parseFrame(JsonNode frame) {
        return Frame.text(deltaContent(frame));
    }

    static String deltaContent(JsonNode frame) {
        JsonNode choice = frame.path("choices").path(0);
        return textAt(choice.path("delta").get("content"));
    }

    static boolean hasFinishReason(JsonNode frame) {
        JsonNode finishReason = frame.path("choices").path(0).get("finish_reason");
        return finishReason != null && !finishReason.isNull();
    }
}
