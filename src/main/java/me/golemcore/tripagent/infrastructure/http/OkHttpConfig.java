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

import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the streaming model adapters, the WebSocket
 * tool transport and the Feign travel clients.
 *
 * <p>
 * The read timeout bounds the gap between two SSE frames, not the whole
 * stream.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final TripAgentProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        TripAgentProperties.HttpProperties http = properties.getHttp();
        log.debug("[HTTP] connect={}ms read={}ms ping={}ms", http.getConnectTimeout(), http.getReadTimeout(),
                http.getPingInterval());

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .pingInterval(http.getPingInterval(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(userAgent(http.getUserAgent()))
                .retryOnConnectionFailure(true)
                .build();
    }

    static Interceptor userAgent(String userAgent) {
        return chain -> {
            if (chain.request().header("User-Agent") != null || userAgent == null || userAgent.isBlank()) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder().header("User-Agent", userAgent).build());
        };
    }
}
