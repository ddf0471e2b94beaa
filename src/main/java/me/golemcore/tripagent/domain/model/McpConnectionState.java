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
 * Connection state of one named tool server. A server may only receive tool
 * calls once it is both connected and initialized.
 */
@Data
@Builder(toBuilder = true)
public class McpConnectionState {

    private String serverName;
    private McpTransportType transport;
    private boolean connected;
    private boolean initialized;
    private McpServerInfo serverInfo;

    public static McpConnectionState disconnected(String serverName) {
        return McpConnectionState.builder().serverName(serverName).build();
    }

    public boolean isReady() {
        return connected && initialized;
    }
}
