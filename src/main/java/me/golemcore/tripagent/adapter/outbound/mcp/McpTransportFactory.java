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

package me.golemcore.tripagent.adapter.outbound.mcp;

import me.golemcore.tripagent.domain.model.McpServerConfig;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Creates the transport for a remote tool server configuration.
 */
@Component
@RequiredArgsConstructor
public class McpTransportFactory {

    private final OkHttpClient okHttpClient;
    private final TripAgentProperties properties;

    public McpTransport create(McpServerConfig config) {
        return switch (config.getTransport()) {
        case WEBSOCKET -> new WebSocketMcpTransport(config.getName(), config.getUrl(), config.getHeaders(),
                okHttpClient, properties.getMcp().getStartupTimeoutSeconds());
        case STDIO -> new StdioMcpTransport(config.getName(), config.getCommand(), config.getEnv());
        case INLINE -> throw new IllegalArgumentException(
                "Inline servers are registered directly, not connected: " + config.getName());
        };
    }
}
