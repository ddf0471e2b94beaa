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
import me.golemcore.tripagent.domain.system.LlmErrorClassifier;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.port.outbound.LlmPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link LlmPort} implementation that selects a {@link LlmProviderAdapter} by
 * provider and applies the retry policy.
 *
 * <p>
 * Retry policy:
 * <ul>
 * <li>retryable errors (network, timeout, rate limit, 5xx) are retried with
 * exponential backoff up to {@code trip.llm.retry.max-attempts} attempts</li>
 * <li>retries only happen before the first content chunk; a failure after
 * content has been emitted is terminal</li>
 * <li>non-retryable errors (credential, malformed request) fail at once</li>
 * </ul>
 */
@Component
@Slf4j
public class StreamingLlmAdapter implements LlmPort {

    private final Map<LlmProvider, LlmProviderAdapter> adapters = new EnumMap<>(LlmProvider.class);
    private final TripAgentProperties.RetryProperties retry;

    public StreamingLlmAdapter(List<LlmProviderAdapter> providerAdapters, TripAgentProperties properties) {
        for (LlmProviderAdapter adapter : providerAdapters) {
            adapters.put(adapter.getProvider(), adapter);
        }
        this.retry = properties.getLlm().getRetry();
    }

    @Override
    public Flux<LlmChunk> streamChat(List<ChatMessage> messages, LlmConfig config) {
        if (config == null || config.getProvider() == null) {
            return Flux.error(new LlmException(ErrorKind.NOT_CONFIGURED, "No model provider configured"));
        }
        LlmProvider provider = config.getProvider();
        if (provider.requiresApiKey() && (config.getApiKey() == null || config.getApiKey().isBlank())) {
            return Flux.error(new LlmException(ErrorKind.NOT_CONFIGURED,
                    "API key not configured for provider " + provider.getId()));
        }
        LlmProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
            return Flux.error(new LlmException(ErrorKind.NOT_CONFIGURED,
                    "No adapter registered for provider " + provider.getId()));
        }
        return attempt(adapter, messages, config, 1);
    }

    private Flux<LlmChunk> attempt(LlmProviderAdapter adapter, List<ChatMessage> messages, LlmConfig config,
            int attempt) {
        return Flux.defer(() -> {
            AtomicBoolean contentStarted = new AtomicBoolean(false);
            return adapter.stream(messages, config)
                    .doOnNext(chunk -> {
                        if (!chunk.isDone()) {
                            contentStarted.set(true);
                        }
                    })
                    .onErrorResume(error -> {
                        LlmException classified = LlmErrorClassifier.classify(error);
                        if (contentStarted.get()) {
                            log.warn("[LLM] {} stream failed after content started: {}",
                                    adapter.getProvider().getId(), classified.getMessage());
                            return Flux.error(classified);
                        }
                        if (!classified.isRetryable() || attempt >= retry.getMaxAttempts()) {
                            log.warn("[LLM] {} request failed (attempt {}/{}, code={}): {}",
                                    adapter.getProvider().getId(), attempt, retry.getMaxAttempts(),
                                    classified.getCode(), classified.getMessage());
                            return Flux.error(classified);
                        }
                        long delayMs = backoffDelay(attempt);
                        log.warn("[LLM] {} retryable error (attempt {}/{}, code={}), retrying in {}ms",
                                adapter.getProvider().getId(), attempt, retry.getMaxAttempts(),
                                classified.getCode(), delayMs);
                        return Mono.delay(Duration.ofMillis(delayMs))
                                .thenMany(attempt(adapter, messages, config, attempt + 1));
                    });
        });
    }

    long backoffDelay(int attempt) {
        return (long) (retry.getInitialBackoffMs() * Math.pow(retry.getBackoffMultiplier(), attempt - 1));
    }
}
