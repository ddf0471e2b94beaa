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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmConfigServiceTest {

    private TripAgentProperties properties;
    private LlmConfigService service;

    @BeforeEach
    void setUp() {
        properties = new TripAgentProperties();
        service = new LlmConfigService(properties);
    }

    @Test
    void shouldReturnEmptyWhenNothingConfigured() {
        assertTrue(service.resolve().isEmpty());
        assertFalse(service.isConfigured());
    }

    @Test
    void shouldAutoDetectProvidersInPriorityOrder() {
        properties.getLlm().getAnthropic().setApiKey("sk-ant");
        properties.getLlm().getOpenai().setApiKey("sk-openai");

        assertEquals(LlmProvider.OPENAI, service.resolve().orElseThrow().getProvider());

        properties.getLlm().getGlm().setApiKey("glm-key");

        LlmConfig config = service.resolve().orElseThrow();
        assertEquals(LlmProvider.GLM, config.getProvider());
        assertEquals("glm-key", config.getApiKey());
        assertEquals("glm-4-flash", config.getEffectiveModel());
    }

    @Test
    void shouldHonorExplicitProvider() {
        properties.getLlm().setProvider(" Anthropic ");
        properties.getLlm().getGlm().setApiKey("glm-key");
        properties.getLlm().getAnthropic().setApiKey("sk-ant");
        properties.getLlm().getAnthropic().setModel("claude-3-haiku");
        properties.getLlm().setMaxTokens(1024);
        properties.getLlm().setTemperature(0.2);

        LlmConfig config = service.resolve().orElseThrow();

        assertEquals(LlmProvider.ANTHROPIC, config.getProvider());
        assertEquals("claude-3-haiku", config.getEffectiveModel());
        assertEquals(1024, config.getMaxTokens());
        assertEquals(0.2, config.getTemperature());
    }

    @Test
    void shouldReturnEmptyWhenExplicitProviderHasNoKey() {
        properties.getLlm().setProvider("openai");
        properties.getLlm().getGlm().setApiKey("glm-key");

        assertEquals(Optional.empty(), service.resolve());
    }

    @Test
    void shouldIgnoreUnknownExplicitProvider() {
        properties.getLlm().setProvider("mistral");
        properties.getLlm().getOpenai().setApiKey("sk-openai");

        assertEquals(LlmProvider.OPENAI, service.resolve().orElseThrow().getProvider());
    }

    @Test
    void shouldUseProxyWithoutApiKey() {
        properties.getLlm().getProxy().setEnabled(true);
        properties.getLlm().getProxy().setUrl("http://proxy.local/api/llm/");

        LlmConfig config = service.resolve().orElseThrow();

        assertEquals(LlmProvider.PROXY, config.getProvider());
        assertNull(config.getApiKey());
        assertEquals("http://proxy.local/api/llm", config.getEffectiveBaseUrl());
    }

    @Test
    void shouldPreferKeyedProviderOverProxy() {
        properties.getLlm().getProxy().setEnabled(true);
        properties.getLlm().getAnthropic().setApiKey("sk-ant");

        assertEquals(LlmProvider.ANTHROPIC, service.resolve().orElseThrow().getProvider());
    }
}
