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
import me.golemcore.tripagent.domain.model.LlmChunk;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmProvider;
import me.golemcore.tripagent.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class ProxyProviderAdapterTest {

    private static final String PROXY_URL = "http://proxy.test/api/llm";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private ProxyProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        adapter = new ProxyProviderAdapter(new OkHttpClient.Builder().addInterceptor(engine).build(), objectMapper);
    }

    private static LlmConfig config() {
        return LlmConfig.builder().provider(LlmProvider.PROXY).baseUrl(PROXY_URL).build();
    }

    @Test
    void shouldPostWithoutCredentialOrModel() throws Exception {
        engine.enqueueSse("[DONE]");

        adapter.stream(List.of(ChatMessage.user("hi")), config()).collectList().block();

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals(PROXY_URL, request.url());
        assertNull(request.header("Authorization"));
        JsonNode body = objectMapper.readTree(request.body());
        assertFalse(body.has("model"));
        assertEquals(4000, body.get("maxTokens").asInt());
    }

    @Test
    void shouldAcceptBothFrameShapes() {
        engine.enqueueSse(
                "{\"choices\":[{\"delta\":{\"content\":\"one \"}}]}",
                "{\"type\":\"content_block_delta\",\"delta\":{\"text\":\"two\"}}",
                "{\"type\":\"message_stop\"}");

        StepVerifier.create(adapter.stream(List.of(ChatMessage.user("hi")), config()))
                .expectNext(LlmChunk.delta("one "))
                .expectNext(LlmChunk.delta("two"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();
    }
}
