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

package me.golemcore.tripagent.domain.service;

import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmProvider;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the active model configuration from {@code trip.llm.*}.
 *
 * <p>
 * An explicit {@code trip.llm.provider} wins. Otherwise the first provider with
 * an API key is used in the order GLM, OpenAI, Anthropic, and finally the proxy
 * when it is enabled. An empty result means no model is available and the
 * orchestrator runs on offline fallbacks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmConfigService {

    private static final List<LlmProvider> PRIORITY = List.of(LlmProvider.GLM, LlmProvider.OPENAI,
            LlmProvider.ANTHROPIC);

    private final TripAgentProperties properties;

    public Optional<LlmConfig> resolve() {
        TripAgentProperties.LlmProperties llm = properties.getLlm();
        Optional<LlmProvider> explicit = LlmProvider.fromId(llm.getProvider());
        if (explicit.isPresent()) {
            return build(explicit.get());
        }
        if (llm.getProvider() != null && !llm.getProvider().isBlank()) {
            log.warn("[LLM] Unknown provider '{}', falling back to auto-detection", llm.getProvider());
        }

        for (LlmProvider provider : PRIORITY) {
            if (hasText(providerProperties(provider).getApiKey())) {
                return build(provider);
            }
        }
        if (llm.getProxy().isEnabled()) {
            return build(LlmProvider.PROXY);
        }
        return Optional.empty();
    }

    public boolean isConfigured() {
        return resolve().isPresent();
    }

    private Optional<LlmConfig> build(LlmProvider provider) {
        TripAgentProperties.LlmProperties llm = properties.getLlm();
        LlmConfig.LlmConfigBuilder builder = LlmConfig.builder()
                .provider(provider)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature());

        if (provider == LlmProvider.PROXY) {
            TripAgentProperties.ProxyProperties proxy = llm.getProxy();
            return Optional.of(builder.baseUrl(proxy.getUrl()).model(proxy.getModel()).build());
        }

        TripAgentProperties.ProviderProperties settings = providerProperties(provider);
        if (!hasText(settings.getApiKey())) {
            log.warn("[LLM] Provider {} selected but no API key configured", provider.getId());
            return Optional.empty();
        }
        return Optional.of(builder
                .apiKey(settings.getApiKey())
                .model(settings.getModel())
                .baseUrl(settings.getBaseUrl())
                .build());
    }

    private TripAgentProperties.ProviderProperties providerProperties(LlmProvider provider) {
        TripAgentProperties.LlmProperties llm = properties.getLlm();
        return switch (provider) {
        case GLM -> llm.getGlm();
        case OPENAI -> llm.getOpenai();
        case ANTHROPIC -> llm.getAnthropic();
        case PROXY -> new TripAgentProperties.ProviderProperties();
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
