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
 * Server-side proxy that holds the provider credential and passes the upstream
 * event stream through unmodified. Accepts both OpenAI-style and
 * Anthropic-style frames.
 */
@Component
public class ProxyProviderAdapter extends AbstractSseProviderAdapter {

    public ProxyProviderAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.PROXY;
    }

    @Override
    protected Request buildRequest(List<ChatMessage> messages, LlmConfig config) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        if (config.getModel() != null && !config.getModel().isBlank()) {
            body.put("model", config.getModel());
        }
        body.set("messages", toMessagesArray(messages));
        body.put("stream", true);
        body.put("maxTokens", config.getMaxTokens());
        body.put("temperature", config.getTemperature());

        return new Request.Builder()
                .url(config.getEffectiveBaseUrl())
                .header("Accept", "text/event-stream")
                .post(jsonBody(body))
                .build();
    }

    @Override
    protected Frame parseFrame(JsonNode frame) {
        if (frame.has("type")) {
            return AnthropicProviderAdapter.parseAnthropicFrame(frame);
        }
        return Frame.text(OpenAiProviderAdapter.deltaContent(frame));
    }
}
