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

package me.golemcore.tripagent.adapter.inbound.web.controller;

import me.golemcore.tripagent.adapter.inbound.web.dto.ToolServerDto;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.port.outbound.McpPort;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Registered tool servers and the tools they expose.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final McpPort mcpPort;

    @GetMapping
    public Mono<ResponseEntity<List<ToolServerDto>>> listServers() {
        Map<String, List<ToolDefinition>> tools = mcpPort.listTools();
        List<ToolServerDto> servers = mcpPort.getRegisteredServers().stream()
                .sorted()
                .map(name -> new ToolServerDto(name, mcpPort.isServerReady(name), tools.getOrDefault(name, List.of())))
                .toList();
        return Mono.just(ResponseEntity.ok(servers));
    }
}
