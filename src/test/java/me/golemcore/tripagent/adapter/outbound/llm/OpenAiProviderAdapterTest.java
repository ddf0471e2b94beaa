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

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiProviderAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine engine;
    private OpenAiProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        adapter = new OpenAiProviderAdapter(new OkHttpClient.Builder().addInterceptor(engine).build(), objectMapper);
    }

    private static LlmConfig config() {
        return LlmConfig.builder()
                .provider(LlmProvider.OPENAI)
                .apiKey("sk-test")
                .baseUrl("http://llm.test/v1/")
                .build();
    }

    @Test
    void shouldSendStreamingChatCompletionRequest() throws Exception {
        engine.enqueueSse("[DONE]");

        adapter.stream(List.of(ChatMessage.system("sys"), ChatMessage.user("hello")), config())
                .collectList()
                .block(TIMEOUT);

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("http://llm.test/v1/chat/completions", request.url());
        assertEquals("Bearer sk-test", request.header("Authorization"));

        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("gpt-4o-mini", body.get("model").asText());
        assertTrue(body.get("stream").asBoolean());
        assertEquals(4000, body.get("max_tokens").asInt());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("hello", body.get("messages").get(1).get("content").asText());
    }

    @Test
    void shouldSkipMalformedFramesAndNonDataLines() {
        engine.enqueueRawSse("""
                : keep-alive comment
                event: message
                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {not json

                data: {"choices":[{"delta":{"role":"assistant"}}]}

                data: {"choices":[{"delta":{"content":"lo"}}]}

                data: [DONE]

                """);

        StepVerifier.create(adapter.stream(List.of(ChatMessage.user("hi")), config()))
                .expectNext(LlmChunk.delta("Hel"))
                .expectNext(LlmChunk.delta("lo"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();
    }

    @Test
    void shouldEmitSingleTerminalChunkWhenBodyEndsWithoutDone() {
        engine.enqueueSse("{\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}");

        StepVerifier.create(adapter.stream(List.of(ChatMessage.user("hi")), config()))
                .expectNext(LlmChunk.delta("partial"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();
    }

    @Test
    void shouldIgnoreFramesAfterDone() {
        engine.enqueueSse("{\"choices\":[{\"delta\":{\"content\":\"a\"}}]}", "[DONE]",
                "{\"choices\":[{\"delta\":{\"content\":\"late\"}}]}");

        StepVerifier.create(adapter.stream(List.of(ChatMessage.user("hi")), config()))
                .expectNext(LlmChunk.delta("a"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();
    }
}
