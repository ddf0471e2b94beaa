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

import lombok.Builder;
import lombok.Data;

/**
 * Resolved settings for one model call. Null model or base URL fall back to the
 * provider defaults.
 */
@Data
@Builder(toBuilder = true)
public class LlmConfig {

    public static final int DEFAULT_MAX_TOKENS = 4000;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    private LlmProvider provider;
    private String apiKey;
    private String model;
    private String baseUrl;
    @Builder.Default
    private int maxTokens = DEFAULT_MAX_TOKENS;
    @Builder.Default
    private double temperature = DEFAULT_TEMPERATURE;

    public String getEffectiveModel() {
        return model != null && !model.isBlank() ? model : provider.getDefaultModel();
    }

    public String getEffectiveBaseUrl() {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl : provider.getDefaultBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "LlmConfig(provider=" + provider + ", model=" + getEffectiveModel() + ")";
    }
}
