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

package me.golemcore.tripagent.tools;

import me.golemcore.tripagent.domain.component.InlineTool;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.domain.model.ToolSchema;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns the current date, time and timezone.
 */
@Component
@RequiredArgsConstructor
public class CurrentDateTool implements InlineTool {

    public static final String NAME = "get_current_date";

    private final Clock clock;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time")
                .inputSchema(ToolSchema.object(Map.of(), List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("date", now.toLocalDate().toString());
        payload.put("time", now.toLocalTime().format(DateTimeFormatter.ofPattern("HH:mm:ss")));
        payload.put("timestamp", clock.millis());
        payload.put("timezone", clock.getZone().getId());
        return CompletableFuture.completedFuture(ToolSupport.json(objectMapper, payload));
    }
}
