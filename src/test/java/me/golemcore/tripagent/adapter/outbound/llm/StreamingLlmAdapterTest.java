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
import me.golemcore.tripagent.domain.model.LlmChunk;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmException;
import me.golemcore.tripagent.domain.model.LlmProvider;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StreamingLlmAdapterTest {

    private static final String API_KEY = "test-key";
    private static final String BASE_URL = "http://llm.test/v1";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final List<ChatMessage> MESSAGES = List.of(
            ChatMessage.system("You plan trips."),
            ChatMessage.user("Plan 3 days in Tokyo"));

    private OkHttpMockEngine engine;
    private TripAgentProperties properties;
    private StreamingLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        ObjectMapper objectMapper = new ObjectMapper();

        properties = new TripAgentProperties();
        properties.getLlm().getRetry().setInitialBackoffMs(0);

        adapter = new StreamingLlmAdapter(List.of(
                new OpenAiProviderAdapter(client, objectMapper),
                new GlmProviderAdapter(client, objectMapper),
                new AnthropicProviderAdapter(client, objectMapper),
                new ProxyProviderAdapter(client, objectMapper)), properties);
    }

    private LlmConfig openAiConfig() {
        return LlmConfig.builder()
                .provider(LlmProvider.OPENAI)
                .apiKey(API_KEY)
                .baseUrl(BASE_URL)
                .build();
    }

    private static String openAiDelta(String text) {
        return "{\"choices\":[{\"delta\":{\"content\":\"" + text + "\"}}]}";
    }

    // ==================== Retry ====================

    @Test
    void shouldRetryRateLimitAndDeliverSameContent() {
        engine.enqueueJson(429, "{\"error\":{\"message\":\"Too many requests\"}}");
        engine.enqueueSse(openAiDelta("Day 1: "), openAiDelta("Senso-ji"), "[DONE]");

        List<LlmChunk> chunks = adapter.streamChat(MESSAGES, openAiConfig())
                .collectList()
                .block(TIMEOUT);

        assertEquals(2, engine.getRequestCount());
        assertEquals("Day 1: Senso-ji", chunks.stream().map(LlmChunk::getContent).collect(Collectors.joining()));
        assertTrue(chunks.get(chunks.size() - 1).isDone());
        assertEquals(1, chunks.stream().filter(LlmChunk::isDone).count());
    }

    @Test
    void shouldFailImmediatelyOnInvalidCredential() {
        engine.enqueueJson(401, "{\"error\":{\"message\":\"Incorrect API key\"}}");

        StepVerifier.create(adapter.streamChat(MESSAGES, openAiConfig()))
                .expectErrorSatisfies(error -> {
                    LlmException exception = (LlmException) error;
                    assertEquals(ErrorKind.INVALID_CREDENTIAL, exception.getKind());
                    assertEquals(401, exception.getStatusCode());
                    assertFalse(exception.isRetryable());
                })
                .verify(TIMEOUT);

        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        engine.enqueueJson(503, "upstream overloaded");
        engine.enqueueJson(502, "bad gateway");
        engine.enqueueJson(500, "internal error");

        StepVerifier.create(adapter.streamChat(MESSAGES, openAiConfig()))
                .expectErrorSatisfies(error -> {
                    LlmException exception = (LlmException) error;
                    assertEquals(ErrorKind.SERVER_ERROR, exception.getKind());
                    assertEquals(500, exception.getStatusCode());
                    assertTrue(exception.isRetryable());
                })
                .verify(TIMEOUT);

        assertEquals(3, engine.getRequestCount());
    }

    @Test
    void shouldRetryNetworkFailure() {
        engine.enqueueFailure(new IOException("connection reset"));
        engine.enqueueSse(openAiDelta("ok"), "[DONE]");

        StepVerifier.create(adapter.streamChat(MESSAGES, openAiConfig()))
                .expectNext(LlmChunk.delta("ok"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();

        assertEquals(2, engine.getRequestCount());
    }

    @Test
    void shouldNotRetryAfterContentStarted() {
        AtomicInteger subscriptions = new AtomicInteger();
        LlmProviderAdapter failing = mock(LlmProviderAdapter.class);
        when(failing.getProvider()).thenReturn(LlmProvider.OPENAI);
        when(failing.stream(any(), any())).thenReturn(Flux.defer(() -> {
            subscriptions.incrementAndGet();
            return Flux.concat(Flux.just(LlmChunk.delta("Day 1")),
                    Flux.error(new IOException("connection reset")));
        }));
        StreamingLlmAdapter streaming = new StreamingLlmAdapter(List.of(failing), properties);

        StepVerifier.create(streaming.streamChat(MESSAGES, openAiConfig()))
                .expectNext(LlmChunk.delta("Day 1"))
                .expectErrorSatisfies(error -> assertEquals(ErrorKind.NETWORK_ERROR,
                        ((LlmException) error).getKind()))
                .verify(TIMEOUT);

        assertEquals(1, subscriptions.get());
    }

    // ==================== Configuration ====================

    @Test
    void shouldRejectMissingApiKeyWithoutRequest() {
        LlmConfig config = openAiConfig().toBuilder().apiKey(" ").build();

        StepVerifier.create(adapter.streamChat(MESSAGES, config))
                .expectErrorSatisfies(error -> assertEquals(ErrorKind.NOT_CONFIGURED,
                        ((LlmException) error).getKind()))
                .verify(TIMEOUT);

        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldRejectNullConfig() {
        StepVerifier.create(adapter.streamChat(MESSAGES, null))
                .expectError(LlmException.class)
                .verify(TIMEOUT);
    }

    @Test
    void shouldAllowProxyWithoutApiKey() {
        engine.enqueueSse(openAiDelta("via proxy"), "[DONE]");
        LlmConfig config = LlmConfig.builder()
                .provider(LlmProvider.PROXY)
                .baseUrl("http://proxy.test/api/llm")
                .build();

        StepVerifier.create(adapter.streamChat(MESSAGES, config))
                .expectNext(LlmChunk.delta("via proxy"))
                .expectNext(LlmChunk.terminal())
                .verifyComplete();
    }

    @Test
    void shouldComputeExponentialBackoff() {
        TripAgentProperties custom = new TripAgentProperties();
        custom.getLlm().getRetry().setInitialBackoffMs(1000);
        custom.getLlm().getRetry().setBackoffMultiplier(2.0);
        StreamingLlmAdapter streaming = new StreamingLlmAdapter(List.of(), custom);

        assertEquals(1000, streaming.backoffDelay(1));
        assertEquals(2000, streaming.backoffDelay(2));
        assertEquals(4000, streaming.backoffDelay(3));
    }
}
