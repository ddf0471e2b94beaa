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

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Socket transport: one JSON-RPC message per WebSocket text frame.
 */
@Slf4j
public class WebSocketMcpTransport implements McpTransport {

    private static final int NORMAL_CLOSURE = 1000;

    private final String serverName;
    private final String url;
    private final Map<String, String> headers;
    private final OkHttpClient okHttpClient;
    private final long openTimeoutSeconds;

    private final AtomicBoolean closedNotified = new AtomicBoolean(false);
    private volatile WebSocket webSocket;

    public WebSocketMcpTransport(String serverName, String url, Map<String, String> headers,
            OkHttpClient okHttpClient, long openTimeoutSeconds) {
        this.serverName = serverName;
        this.url = url;
        this.headers = headers != null ? headers : Map.of();
        this.okHttpClient = okHttpClient;
        this.openTimeoutSeconds = openTimeoutSeconds;
    }

    @Override
    public void open(Listener listener) throws IOException {
        if (url == null || url.isBlank()) {
            throw new IOException("WebSocket URL is not configured for server " + serverName);
        }
        Request.Builder request = new Request.Builder().url(url);
        headers.forEach(request::header);

        CountDownLatch opened = new CountDownLatch(1);
        AtomicReference<Throwable> openFailure = new AtomicReference<>();

        webSocket = okHttpClient.newWebSocket(request.build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                log.info("[MCP:{}] WebSocket open: {}", serverName, url);
                opened.countDown();
            }

            @Override
            public void onMessage(WebSocket socket, String text) {
                log.debug("[MCP:{}] ← {}", serverName, text);
                listener.onMessage(text);
            }

            @Override
            public void onClosing(WebSocket socket, int code, String reason) {
                socket.close(NORMAL_CLOSURE, null);
            }

            @Override
            public void onClosed(WebSocket socket, int code, String reason) {
                notifyClosed(listener, "WebSocket closed (" + code + ")");
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                openFailure.compareAndSet(null, t);
                opened.countDown();
                notifyClosed(listener, "WebSocket failure: " + t.getMessage());
            }
        });

        try {
            if (!opened.await(openTimeoutSeconds, TimeUnit.SECONDS)) {
                close();
                throw new IOException("Timed out opening WebSocket to " + url);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new IOException("Interrupted while opening WebSocket", e);
        }
        Throwable failure = openFailure.get();
        if (failure != null) {
            throw new IOException("Failed to open WebSocket to " + url + ": " + failure.getMessage(), failure);
        }
    }

    @Override
    public void send(String message) throws IOException {
        WebSocket socket = webSocket;
        if (socket == null) {
            throw new IOException("WebSocket is not open");
        }
        log.debug("[MCP:{}] → {}", serverName, message);
        if (!socket.send(message)) {
            throw new IOException("WebSocket send queue is closed");
        }
    }

    @Override
    public void close() {
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "client closing");
        }
    }

    private void notifyClosed(Listener listener, String reason) {
        if (closedNotified.compareAndSet(false, true)) {
            listener.onClosed(reason);
        }
    }
}
