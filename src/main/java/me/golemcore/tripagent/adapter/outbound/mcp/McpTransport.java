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

import java.io.IOException;

/**
 * Bidirectional text-message channel to one remote tool server.
 */
public interface McpTransport {

    /**
     * Opens the channel. Returns once the channel is usable or throws.
     */
    void open(Listener listener) throws IOException;

    void send(String message) throws IOException;

    void close();

    /**
     * Receives inbound messages and the end of the channel.
     */
    interface Listener {

        void onMessage(String message);

        void onClosed(String reason);
    }
}
