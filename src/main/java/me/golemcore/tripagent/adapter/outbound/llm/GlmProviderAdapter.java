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

import me.golemcore.tripagent.domain.model.LlmProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Zhipu GLM streaming. Uses the OpenAI wire shape; a non-null
 * {@code finish_reason} ends the stream even without {@code [DONE]}.
 */
@Component
public class GlmProviderAdapter extends OpenAiProviderAdapter {

    public GlmProviderAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        super(okHttpClient, objectMapper);
    }

    @Override
    public LlmProvider getProvider() {
        return LlmProvider.GLM;
    }

    @Override
    protected Frame parseFrame(JsonNode frame) {
        String content = deltaContent(frame);
        return hasFinishReason(frame) ? Frame.end(content) : Frame.text(content);
    }
}
