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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Process-pipe transport: newline-delimited JSON-RPC over the stdin and stdout
 * of a child process. Stderr is drained to the DEBUG log.
 */
@Slf4j
public class StdioMcpTransport implements McpTransport {

    private final String serverName;
    private final String command;
    private final Map<String, String> env;

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;

    public StdioMcpTransport(String serverName, String command, Map<String, String> env) {
        this.serverName = serverName;
        this.command = command;
        this.env = env != null ? env : Map.of();
    }

    @Override
    public void open(Listener listener) throws IOException {
        if (command == null || command.isBlank()) {
            throw new IOException("Command is not configured for server " + serverName);
        }
        log.info("[MCP:{}] Starting server: {}", serverName, command);

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(false);
        pb.environment().putAll(env);

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(() -> readLoop(listener), "mcp-reader-" + serverName);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverName);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    public void send(String message) throws IOException {
        if (!running || writer == null) {
            throw new IOException("Process for server " + serverName + " is not running");
        }
        log.debug("[MCP:{}] → {}", serverName, message);
        synchronized (writer) {
            writer.write(message);
            writer.newLine();
            writer.flush();
        }
    }

    @Override
    public void close() {
        running = false;
        Process p = process;
        if (p == null) {
            return;
        }
        try {
            if (writer != null) {
                writer.close();
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Error closing stdin: {}", serverName, e.getMessage());
        }
        p.destroy();
        try {
            if (!p.waitFor(5, TimeUnit.SECONDS)) {
                p.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
        }
    }

    private void readLoop(Listener listener) {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                log.debug("[MCP:{}] ← {}", serverName, trimmed);
                listener.onMessage(trimmed);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            running = false;
            listener.onClosed("Process exited");
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", serverName, e.getMessage());
        }
    }
}
