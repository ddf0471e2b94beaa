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

import me.golemcore.tripagent.domain.component.InlineTool;
import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.InlineServer;
import me.golemcore.tripagent.domain.model.JsonRpcRequest;
import me.golemcore.tripagent.domain.model.JsonRpcResponse;
import me.golemcore.tripagent.domain.model.McpConnectionState;
import me.golemcore.tripagent.domain.model.McpEvent;
import me.golemcore.tripagent.domain.model.McpEventType;
import me.golemcore.tripagent.domain.model.McpException;
import me.golemcore.tripagent.domain.model.McpServerConfig;
import me.golemcore.tripagent.domain.model.McpServerInfo;
import me.golemcore.tripagent.domain.model.McpTransportType;
import me.golemcore.tripagent.domain.model.ToolContent;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolExecutionContext;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.domain.model.ToolSchema;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.port.outbound.McpPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * JSON-RPC 2.0 tool protocol client managing inline and remote tool servers.
 *
 * <p>
 * Lifecycle per server name:
 * <ol>
 * <li>inline servers are connected and initialized on registration
 * <li>remote servers open a transport, send {@code initialize}, and become
 * initialized after the correlated response; {@code notifications/initialized}
 * and {@code tools/list} follow; a second {@code connect} during the
 * handshake joins it instead of opening another transport
 * <li>a failed handshake or a closed transport resets the server and rejects
 * its pending requests
 * </ol>
 *
 * <p>
 * The pending-request table and the connection states are only mutated here.
 * Requests that are not answered within {@code trip.mcp.request-timeout-seconds}
 * are rejected with the same connection-closed error as a disconnect.
 */
@Component
@Slf4j
public class McpClient implements McpPort {

    static final String CONTEXT_ARGUMENT = "context";

    private final JsonRpcCodec codec;
    private final McpTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TripAgentProperties.McpProperties properties;

    private final Object stateLock = new Object();
    private final Map<String, McpConnectionState> connectionStates = new ConcurrentHashMap<>();
    private final Map<String, InlineServer> inlineServers = new ConcurrentHashMap<>();
    private final Map<String, McpTransport> transports = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<McpServerInfo>> handshakes = new ConcurrentHashMap<>();
    private final Map<String, List<ToolDefinition>> remoteTools = new ConcurrentHashMap<>();
    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final List<Consumer<McpEvent>> listeners = new CopyOnWriteArrayList<>();

    public McpClient(JsonRpcCodec codec, McpTransportFactory transportFactory, ObjectMapper objectMapper,
            Clock clock, TripAgentProperties properties) {
        this.codec = codec;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties.getMcp();
    }

    // ==================== Registration ====================

    @Override
    public void registerInlineServer(InlineServer server) {
        String name = server.getName();
        synchronized (stateLock) {
            inlineServers.put(name, server);
            connectionStates.put(name, McpConnectionState.builder()
                    .serverName(name)
                    .transport(McpTransportType.INLINE)
                    .connected(true)
                    .initialized(true)
                    .serverInfo(new McpServerInfo(name, server.getVersion()))
                    .build());
        }
        log.info("[MCP:{}] Inline server registered with tools: {}", name,
                server.getTools().stream().map(InlineTool::getToolName).toList());
        emit(McpEventType.CONNECTED, name, Map.of("transport", McpTransportType.INLINE.name()));
    }

    @Override
    public CompletableFuture<McpServerInfo> connect(McpServerConfig config) {
        String name = config.getName();
        if (isServerReady(name)) {
            return CompletableFuture.completedFuture(connectionStates.get(name).getServerInfo());
        }

        CompletableFuture<McpServerInfo> handshake = new CompletableFuture<>();
        synchronized (stateLock) {
            CompletableFuture<McpServerInfo> inFlight = handshakes.get(name);
            if (inFlight != null) {
                log.debug("[MCP:{}] Handshake already in progress, joining it", name);
                return inFlight;
            }
            handshakes.put(name, handshake);
        }

        McpTransport transport = transportFactory.create(config);
        synchronized (stateLock) {
            transports.put(name, transport);
        }
        try {
            transport.open(new TransportListener(name));
        } catch (IOException e) {
            log.error("[MCP:{}] Failed to open transport: {}", name, e.getMessage());
            resetServer(name, "Failed to open transport: " + e.getMessage());
            finishHandshake(name, handshake, null,
                    new McpException(ErrorKind.NETWORK_ERROR, "Failed to connect to server '" + name + "'", e));
            return handshake;
        }

        synchronized (stateLock) {
            connectionStates.put(name, McpConnectionState.builder()
                    .serverName(name)
                    .transport(config.getTransport())
                    .connected(true)
                    .initialized(false)
                    .build());
        }
        emit(McpEventType.CONNECTED, name, Map.of("transport", config.getTransport().name()));

        sendRequest(name, JsonRpcCodec.METHOD_INITIALIZE, codec.createInitializeParams(
                properties.getClientName(), properties.getClientVersion(), properties.getProtocolVersion()))
                .thenApply(result -> markInitialized(name, result))
                .thenCompose(info -> fetchRemoteTools(name).thenApply(tools -> info))
                .whenComplete((info, error) -> {
                    Throwable cause = error != null ? unwrap(error) : null;
                    if (cause != null) {
                        log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, cause.getMessage());
                        emit(McpEventType.ERROR, name, Map.of("error", String.valueOf(cause.getMessage())));
                        disconnect(name);
                    }
                    finishHandshake(name, handshake, info, cause);
                });
        return handshake;
    }

    private void finishHandshake(String name, CompletableFuture<McpServerInfo> handshake, McpServerInfo info,
            Throwable error) {
        synchronized (stateLock) {
            handshakes.remove(name, handshake);
        }
        if (error != null) {
            handshake.completeExceptionally(error);
        } else {
            handshake.complete(info);
        }
    }

    private McpServerInfo markInitialized(String name, JsonNode result) {
        JsonNode serverInfoNode = result != null ? result.path("serverInfo") : NullNode.getInstance();
        McpServerInfo info = new McpServerInfo(
                serverInfoNode.path("name").asText(name),
                serverInfoNode.path("version").asText("unknown"));

        synchronized (stateLock) {
            McpConnectionState state = connectionStates.get(name);
            if (state == null) {
                throw new McpException(ErrorKind.CONNECTION_CLOSED,
                        "Server '" + name + "' disconnected during initialization");
            }
            connectionStates.put(name, state.toBuilder().initialized(true).serverInfo(info).build());
        }
        log.info("[MCP:{}] Initialized: {} {}", name, info.getName(), info.getVersion());
        sendNotification(name, JsonRpcCodec.METHOD_INITIALIZED);
        return info;
    }

    private CompletableFuture<List<ToolDefinition>> fetchRemoteTools(String name) {
        return sendRequest(name, JsonRpcCodec.METHOD_TOOLS_LIST, Map.of())
                .thenApply(result -> {
                    List<ToolDefinition> tools = parseToolDefinitions(name, result);
                    remoteTools.put(name, tools);
                    log.info("[MCP:{}] Available tools: {}", name, tools.stream().map(ToolDefinition::getName).toList());
                    return tools;
                })
                .exceptionally(error -> {
                    log.warn("[MCP:{}] tools/list failed: {}", name, unwrap(error).getMessage());
                    return List.of();
                });
    }

    @Override
    public void disconnect(String serverName) {
        resetServer(serverName, "Connection to server '" + serverName + "' closed");
    }

    @Override
    public void disconnectAll() {
        for (String serverName : new ArrayList<>(connectionStates.keySet())) {
            disconnect(serverName);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("[MCP] Shutting down all tool servers");
        disconnectAll();
    }

    private void resetServer(String serverName, String reason) {
        McpTransport transport;
        McpConnectionState removed;
        synchronized (stateLock) {
            rejectPending(serverName, reason);
            transport = transports.remove(serverName);
            inlineServers.remove(serverName);
            remoteTools.remove(serverName);
            removed = connectionStates.remove(serverName);
        }
        if (transport != null) {
            transport.close();
        }
        if (removed != null) {
            log.info("[MCP:{}] Disconnected: {}", serverName, reason);
            emit(McpEventType.DISCONNECTED, serverName, Map.of("reason", reason));
        }
    }

    private void rejectPending(String serverName, String reason) {
        pendingRequests.values().removeIf(pending -> {
            if (!pending.serverName().equals(serverName)) {
                return false;
            }
            pending.future().completeExceptionally(new McpException(ErrorKind.CONNECTION_CLOSED, reason));
            return true;
        });
    }

    // ==================== Tool calls ====================

    @Override
    public CompletableFuture<ToolResult> callTool(String serverName, String toolName, Map<String, Object> arguments,
            ToolExecutionContext context) {
        Map<String, Object> safeArguments = arguments != null ? arguments : Map.of();
        emit(McpEventType.TOOL_CALLED, serverName, Map.of("tool", toolName, "arguments", safeArguments));

        if (!isServerReady(serverName)) {
            return CompletableFuture.failedFuture(new McpException(ErrorKind.SERVER_NOT_CONNECTED,
                    "Server '" + serverName + "' is not connected or not initialized"));
        }

        InlineServer inlineServer = inlineServers.get(serverName);
        if (inlineServer != null) {
            return callInlineTool(inlineServer, toolName, safeArguments, context);
        }
        return callRemoteTool(serverName, toolName, safeArguments);
    }

    private CompletableFuture<ToolResult> callInlineTool(InlineServer server, String toolName,
            Map<String, Object> arguments, ToolExecutionContext context) {
        Optional<InlineTool> tool = server.findTool(toolName);
        if (tool.isEmpty()) {
            return CompletableFuture.failedFuture(new McpException(ErrorKind.TOOL_NOT_FOUND,
                    "Tool '" + toolName + "' not found on server '" + server.getName() + "'"));
        }

        Map<String, Object> handlerArguments = new LinkedHashMap<>(arguments);
        handlerArguments.put(CONTEXT_ARGUMENT, context);

        long startedAt = clock.millis();
        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.get().execute(handlerArguments);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.completedFuture(null);
        }

        return execution.handle((result, error) -> {
            long duration = clock.millis() - startedAt;
            if (error != null) {
                Throwable cause = unwrap(error);
                log.warn("[MCP:{}] Tool '{}' failed after {}ms: {}", server.getName(), toolName, duration,
                        cause.getMessage());
                return ToolResult.failure("Tool '" + toolName + "' failed: " + describe(cause));
            }
            log.debug("[MCP:{}] Tool '{}' finished in {}ms", server.getName(), toolName, duration);
            return result != null ? result : ToolResult.failure("Tool '" + toolName + "' returned no result");
        });
    }

    private CompletableFuture<ToolResult> callRemoteTool(String serverName, String toolName,
            Map<String, Object> arguments) {
        List<ToolDefinition> known = remoteTools.getOrDefault(serverName, List.of());
        if (!known.isEmpty() && known.stream().noneMatch(tool -> tool.getName().equals(toolName))) {
            return CompletableFuture.failedFuture(new McpException(ErrorKind.TOOL_NOT_FOUND,
                    "Tool '" + toolName + "' not found on server '" + serverName + "'"));
        }
        return sendRequest(serverName, JsonRpcCodec.METHOD_TOOLS_CALL, codec.createToolCallParams(toolName, arguments))
                .thenApply(result -> parseToolCallResult(toolName, result))
                .exceptionally(error -> ToolResult.failure("MCP tool call failed: " + describe(unwrap(error))));
    }

    // ==================== JSON-RPC correlation ====================

    CompletableFuture<JsonNode> sendRequest(String serverName, String method, Object params) {
        McpTransport transport = transports.get(serverName);
        if (transport == null) {
            return CompletableFuture.failedFuture(new McpException(ErrorKind.SERVER_NOT_CONNECTED,
                    "Server '" + serverName + "' has no open transport"));
        }

        JsonRpcRequest request = codec.createRequest(method, params);
        String id = String.valueOf(request.getId());
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, new PendingRequest(id, serverName, method, future));
        future.whenComplete((result, error) -> pendingRequests.remove(id));

        CompletableFuture.delayedExecutor(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS).execute(() -> {
            PendingRequest expired = pendingRequests.remove(id);
            if (expired != null) {
                log.warn("[MCP:{}] Request {} ({}) timed out", serverName, id, method);
                expired.future().completeExceptionally(new McpException(ErrorKind.CONNECTION_CLOSED,
                        "Connection to server '" + serverName + "' closed: request " + method + " timed out"));
            }
        });

        try {
            transport.send(codec.serialize(request));
        } catch (IOException | McpException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(new McpException(ErrorKind.NETWORK_ERROR,
                    "Failed to send " + method + " to server '" + serverName + "'", e));
        }
        return future;
    }

    void sendNotification(String serverName, String method) {
        McpTransport transport = transports.get(serverName);
        if (transport == null) {
            return;
        }
        try {
            transport.send(codec.serialize(codec.createNotification(method, null)));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", serverName, method, e.getMessage());
        }
    }

    /**
     * Routes one inbound message. Responses are matched to pending requests by
     * id; unmatched or malformed responses are dropped.
     */
    void handleMessage(String serverName, String raw) {
        Optional<JsonNode> parsed = codec.parseTree(raw);
        if (parsed.isEmpty()) {
            log.warn("[MCP:{}] Dropping unparseable message", serverName);
            return;
        }
        JsonNode node = parsed.get();

        if (node.has("method")) {
            handleServerMessage(serverName, node);
            return;
        }

        Optional<JsonRpcResponse> response = codec.parseResponse(node);
        if (response.isEmpty()) {
            log.warn("[MCP:{}] Dropping invalid JSON-RPC response", serverName);
            return;
        }

        String id = String.valueOf(response.get().getId());
        PendingRequest pending = pendingRequests.get(id);
        if (pending == null || !pending.serverName().equals(serverName)) {
            log.warn("[MCP:{}] Received response for unknown id: {}", serverName, id);
            return;
        }
        pendingRequests.remove(id);

        JsonRpcResponse rpcResponse = response.get();
        if (rpcResponse.hasError()) {
            pending.future().completeExceptionally(new McpException(ErrorKind.PROTOCOL_ERROR,
                    JsonRpcCodec.getErrorMessage(rpcResponse.getError()), rpcResponse.getError().getCode(), null));
        } else {
            pending.future().complete(rpcResponse.getResult() != null ? rpcResponse.getResult()
                    : NullNode.getInstance());
        }
        emit(McpEventType.MESSAGE, serverName, Map.of("id", id, "method", pending.method()));
    }

    private void handleServerMessage(String serverName, JsonNode node) {
        String method = node.path("method").asText();
        JsonNode idNode = node.get("id");
        if (idNode == null || idNode.isNull()) {
            log.debug("[MCP:{}] Server notification: {}", serverName, method);
            emit(McpEventType.MESSAGE, serverName, Map.of("method", method));
            return;
        }

        // Server-initiated requests are not supported by this client
        McpTransport transport = transports.get(serverName);
        if (transport == null) {
            return;
        }
        Object id = idNode.isNumber() ? idNode.numberValue() : idNode.asText();
        try {
            transport.send(codec.serialize(codec.createErrorResponse(id, JsonRpcCodec.methodNotFound(method))));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to reject server request {}: {}", serverName, method, e.getMessage());
        }
    }

    // ==================== Queries ====================

    @Override
    public Map<String, List<ToolDefinition>> listTools() {
        Map<String, List<ToolDefinition>> result = new LinkedHashMap<>();
        for (McpConnectionState state : connectionStates.values()) {
            if (!state.isReady()) {
                continue;
            }
            String name = state.getServerName();
            InlineServer inline = inlineServers.get(name);
            if (inline != null) {
                result.put(name, inline.getTools().stream().map(InlineTool::getDefinition).toList());
            } else {
                result.put(name, List.copyOf(remoteTools.getOrDefault(name, List.of())));
            }
        }
        return result;
    }

    @Override
    public boolean isServerReady(String serverName) {
        McpConnectionState state = connectionStates.get(serverName);
        return state != null && state.isReady();
    }

    @Override
    public McpConnectionState getConnectionState(String serverName) {
        McpConnectionState state = connectionStates.get(serverName);
        return state != null ? state.toBuilder().build() : McpConnectionState.disconnected(serverName);
    }

    @Override
    public Optional<McpServerInfo> getServerInfo(String serverName) {
        McpConnectionState state = connectionStates.get(serverName);
        return Optional.ofNullable(state).map(McpConnectionState::getServerInfo);
    }

    @Override
    public List<String> getRegisteredServers() {
        return List.copyOf(connectionStates.keySet());
    }

    int getPendingRequestCount() {
        return pendingRequests.size();
    }

    // ==================== Events ====================

    @Override
    public Runnable onEvent(Consumer<McpEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void emit(McpEventType type, String serverName, Map<String, Object> data) {
        McpEvent event = McpEvent.builder()
                .type(type)
                .serverName(serverName)
                .timestamp(Instant.now(clock))
                .data(data)
                .build();
        for (Consumer<McpEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("[MCP:{}] Event listener failed for {}: {}", serverName, type, e.getMessage());
            }
        }
    }

    // ==================== Parsing ====================

    private List<ToolDefinition> parseToolDefinitions(String serverName, JsonNode result) {
        JsonNode toolsNode = result != null ? result.get("tools") : null;
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.path("name").asText(null);
            if (name == null) {
                continue;
            }
            ToolSchema schema = ToolSchema.builder().type("object").build();
            if (toolNode.has("inputSchema")) {
                try {
                    schema = objectMapper.treeToValue(toolNode.get("inputSchema"), ToolSchema.class);
                } catch (Exception e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", serverName, name,
                            e.getMessage());
                }
            }
            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(toolNode.path("description").asText(""))
                    .inputSchema(schema)
                    .build());
        }
        return tools;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }

        boolean isError = result.path("isError").asBoolean(false);
        List<ToolContent> content = new ArrayList<>();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                content.add(ToolContent.builder()
                        .type(item.path("type").asText(ToolContent.TYPE_TEXT))
                        .text(item.path("text").asText(null))
                        .data(item.path("data").asText(null))
                        .mimeType(item.path("mimeType").asText(null))
                        .uri(item.path("uri").asText(null))
                        .build());
            }
        }
        if (content.isEmpty()) {
            content.add(ToolContent.text(isError ? "MCP tool error" : "(no output)"));
        }
        return ToolResult.builder().content(content).error(isError).build();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private record PendingRequest(String id, String serverName, String method, CompletableFuture<JsonNode> future) {
    }

    private final class TransportListener implements McpTransport.Listener {

        private final String serverName;

        private TransportListener(String serverName) {
            this.serverName = serverName;
        }

        @Override
        public void onMessage(String message) {
            handleMessage(serverName, message);
        }

        @Override
        public void onClosed(String reason) {
            resetServer(serverName, "Connection to server '" + serverName + "' closed: " + reason);
        }
    }
}
