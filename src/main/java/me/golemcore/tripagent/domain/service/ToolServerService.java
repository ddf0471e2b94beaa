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

import me.golemcore.tripagent.domain.component.InlineTool;
import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.InlineServer;
import me.golemcore.tripagent.domain.model.McpException;
import me.golemcore.tripagent.domain.model.McpServerConfig;
import me.golemcore.tripagent.domain.model.McpTransportType;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolExecutionContext;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.port.outbound.McpPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the set of tool servers: the in-process {@code builtin} server and the
 * remote servers listed under {@code trip.mcp.servers}.
 *
 * <p>
 * Remote connections are started at boot and never block startup. A server
 * that fails to connect is logged and left disconnected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolServerService {

    public static final String BUILTIN_SERVER = "builtin";

    private final McpPort mcpPort;
    private final List<InlineTool> inlineTools;
    private final TripAgentProperties properties;

    @PostConstruct
    public void init() {
        InlineServer builtin = InlineServer.builder()
                .name(BUILTIN_SERVER)
                .tools(inlineTools)
                .build();
        mcpPort.registerInlineServer(builtin);
        log.info("[Tools] Registered builtin server with {} tools", inlineTools.size());

        for (TripAgentProperties.RemoteServerProperties server : properties.getMcp().getServers()) {
            connectRemote(server);
        }
    }

    CompletableFuture<Void> connectRemote(TripAgentProperties.RemoteServerProperties server) {
        McpServerConfig config;
        try {
            config = toServerConfig(server);
        } catch (IllegalArgumentException e) {
            log.warn("[Tools] Skipping server '{}': {}", server.getName(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        long timeout = properties.getMcp().getStartupTimeoutSeconds();
        return mcpPort.connect(config)
                .orTimeout(timeout, TimeUnit.SECONDS)
                .thenAccept(info -> log.info("[Tools] Connected to '{}' ({} {})", config.getName(),
                        info.getName(), info.getVersion()))
                .exceptionally(e -> {
                    log.warn("[Tools] Failed to connect to '{}': {}", config.getName(), e.getMessage());
                    return null;
                });
    }

    static McpServerConfig toServerConfig(TripAgentProperties.RemoteServerProperties server) {
        if (server.getName() == null || server.getName().isBlank()) {
            throw new IllegalArgumentException("server name is required");
        }
        McpTransportType transport = McpTransportType
                .valueOf(server.getTransport().trim().toUpperCase(Locale.ROOT));
        return McpServerConfig.builder()
                .name(server.getName())
                .transport(transport)
                .url(server.getUrl())
                .command(server.getCommand())
                .env(server.getEnv())
                .build();
    }

    /**
     * Finds the first ready server exposing the tool. The builtin server is
     * checked first.
     */
    public Optional<String> findServerForTool(String toolName) {
        Map<String, List<ToolDefinition>> tools = mcpPort.listTools();
        List<ToolDefinition> builtin = tools.get(BUILTIN_SERVER);
        if (builtin != null && containsTool(builtin, toolName)) {
            return Optional.of(BUILTIN_SERVER);
        }
        return tools.entrySet().stream()
                .filter(entry -> containsTool(entry.getValue(), toolName))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    /**
     * Calls a tool on whichever server exposes it.
     */
    public CompletableFuture<ToolResult> callTool(String toolName, Map<String, Object> arguments,
            ToolExecutionContext context) {
        Optional<String> server = findServerForTool(toolName);
        if (server.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new McpException(ErrorKind.TOOL_NOT_FOUND, "Tool not found: " + toolName));
        }
        return mcpPort.callTool(server.get(), toolName, arguments, context);
    }

    public Map<String, List<ToolDefinition>> listTools() {
        return mcpPort.listTools();
    }

    private static boolean containsTool(List<ToolDefinition> tools, String toolName) {
        return tools.stream().anyMatch(tool -> tool.getName().equals(toolName));
    }
}
