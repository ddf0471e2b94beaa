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

package me.golemcore.tripagent.port.outbound;

import me.golemcore.tripagent.domain.model.InlineServer;
import me.golemcore.tripagent.domain.model.McpConnectionState;
import me.golemcore.tripagent.domain.model.McpEvent;
import me.golemcore.tripagent.domain.model.McpServerConfig;
import me.golemcore.tripagent.domain.model.McpServerInfo;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolExecutionContext;
import me.golemcore.tripagent.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Port for the tool protocol layer.
 *
 * <p>
 * Server lifecycle: {@code disconnected → connected → initialized}. Tool calls
 * are only dispatched to initialized servers.
 */
public interface McpPort {

    /**
     * Registers an in-process server. It becomes connected and initialized
     * immediately.
     */
    void registerInlineServer(InlineServer server);

    /**
     * Connects to a remote server and performs the initialize handshake.
     */
    CompletableFuture<McpServerInfo> connect(McpServerConfig config);

    /**
     * Rejects all pending requests of the server, then removes its state.
     */
    void disconnect(String serverName);

    void disconnectAll();

    /**
     * Invokes a tool. Fails with
     * {@link me.golemcore.tripagent.domain.model.ErrorKind#SERVER_NOT_CONNECTED}
     * or {@link me.golemcore.tripagent.domain.model.ErrorKind#TOOL_NOT_FOUND};
     * handler failures complete normally with an error result.
     */
    CompletableFuture<ToolResult> callTool(String serverName, String toolName, Map<String, Object> arguments,
            ToolExecutionContext context);

    /**
     * Tools of all initialized servers, keyed by server name.
     */
    Map<String, List<ToolDefinition>> listTools();

    boolean isServerReady(String serverName);

    McpConnectionState getConnectionState(String serverName);

    Optional<McpServerInfo> getServerInfo(String serverName);

    List<String> getRegisteredServers();

    /**
     * Subscribes to protocol events.
     *
     * @return a handle that removes the listener
     */
    Runnable onEvent(Consumer<McpEvent> listener);
}
