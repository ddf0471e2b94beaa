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

package me.golemcore.tripagent.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported language-model providers with their default endpoints and models.
 */
public enum LlmProvider {

    GLM("glm", "https://open.bigmodel.cn/api/paas/v4", "glm-4-flash"),
    OPENAI("openai", "https://api.openai.com/v1", "gpt-4o-mini"),
    ANTHROPIC("anthropic", "https://api.anthropic.com", "claude-3-5-sonnet-20241022"),
    PROXY("proxy", "http://localhost:3000/api/llm", null);

    private final String id;
    private final String defaultBaseUrl;
    private final String defaultModel;

    LlmProvider(String id, String defaultBaseUrl, String defaultModel) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
    }

    public String getId() {
        return id;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return this != PROXY;
    }

    public static Optional<LlmProvider> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.id.equals(normalized))
                .findFirst();
    }
}
