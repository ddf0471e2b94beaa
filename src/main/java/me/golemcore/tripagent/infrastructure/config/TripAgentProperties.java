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

package me.golemcore.tripagent.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the trip agent runtime.
 *
 * <p>
 * All configuration is organized under the {@code trip.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model providers and retry policy</li>
 * <li>{@link McpProperties} - tool protocol client and remote servers</li>
 * <li>{@link QuestionsProperties} - missing-information collection</li>
 * <li>{@link StorageProperties} - trip persistence</li>
 * <li>{@link TravelProperties} - weather and places lookups</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "trip")
@Data
public class TripAgentProperties {

    private LlmProperties llm = new LlmProperties();
    private McpProperties mcp = new McpProperties();
    private QuestionsProperties questions = new QuestionsProperties();
    private StorageProperties storage = new StorageProperties();
    private TravelProperties travel = new TravelProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        private String provider;
        private int maxTokens = 4000;
        private double temperature = 0.7;
        private ProviderProperties glm = new ProviderProperties();
        private ProviderProperties openai = new ProviderProperties();
        private ProviderProperties anthropic = new ProviderProperties();
        private ProxyProperties proxy = new ProxyProperties();
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String model;
        private String baseUrl;
    }

    @Data
    public static class ProxyProperties {
        private boolean enabled = false;
        private String url;
        private String model;
    }

    @Data
    public static class RetryProperties {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private String clientName = "trip-agent";
        private String clientVersion = "1.0.0";
        private String protocolVersion = "2024-11-05";
        private long requestTimeoutSeconds = 60;
        private long startupTimeoutSeconds = 30;
        private List<RemoteServerProperties> servers = new ArrayList<>();
    }

    @Data
    public static class RemoteServerProperties {
        private String name;
        private String transport = "websocket";
        private String url;
        private String command;
        private Map<String, String> env = new HashMap<>();
    }

    // ==================== QUESTIONS ====================

    @Data
    public static class QuestionsProperties {
        private String language = "en";
        private int minDays = 1;
        private int maxDays = 30;
        private int defaultDays = 5;
        private boolean budgetRequired = false;
        private boolean startDateRequired = false;
        private boolean interestsRequired = false;
    }

    // ==================== STORAGE ====================

    @Data
    public static class StorageProperties {
        private boolean enabled = true;
        private String basePath = "${user.home}/.golemcore/trip-agent";
    }

    // ==================== TRAVEL DATA ====================

    @Data
    public static class TravelProperties {
        private String geocodingUrl = "https://geocoding-api.open-meteo.com";
        private String weatherUrl = "https://api.open-meteo.com";
        private String placesUrl = "https://maps.googleapis.com";
        private String placesApiKey;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        // WebSocket ping interval; 0 disables
        private long pingInterval = 30000;
        private String userAgent = "trip-agent/1.0";
    }
}
