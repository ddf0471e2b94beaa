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

package me.golemcore.tripagent.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates read-only Feign clients for the travel data APIs over the shared
 * OkHttp client.
 *
 * <p>
 * Clients never retry: a failed lookup surfaces to the calling tool, which
 * reports it as an error result and lets the agent run continue.
 *
 * <pre>{@code
 * GeocodingApi api = factory.create(GeocodingApi.class, "https://geocoding-api.open-meteo.com");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    public <T> T create(Class<T> apiType, String baseUrl) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .decoder(new JacksonDecoder(objectMapper))
                .retryer(Retryer.NEVER_RETRY)
                .requestInterceptor(template -> template.header("Accept", "application/json"))
                .target(apiType, stripTrailingSlash(baseUrl));
    }

    static String stripTrailingSlash(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL is required");
        }
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
