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
import me.golemcore.tripagent.domain.model.Place;
import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.domain.model.ToolSchema;
import me.golemcore.tripagent.port.outbound.TravelDataPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Searches attractions, restaurants, hotels or shopping near a location.
 */
@Component
@RequiredArgsConstructor
public class SearchPlacesTool implements InlineTool {

    public static final String NAME = "search_places";
    static final List<String> PLACE_TYPES = List.of("attraction", "restaurant", "hotel", "shopping");
    static final String DEFAULT_TYPE = "attraction";

    private final TravelDataPort travelDataPort;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolSchema> properties = new LinkedHashMap<>();
        properties.put("query", ToolSchema.string("Search keywords, e.g. museum, sushi, luxury hotel"));
        properties.put("location", ToolSchema.string("Search location, e.g. Tokyo, Paris"));
        properties.put("type", ToolSchema.builder()
                .type("string")
                .description("Place type")
                .enumValues(PLACE_TYPES)
                .defaultValue(DEFAULT_TYPE)
                .build());
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search for places (attractions, restaurants, hotels, shopping)")
                .inputSchema(ToolSchema.object(properties, List.of("query", "location")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        String query = ToolSupport.stringArg(arguments, "query");
        String location = ToolSupport.stringArg(arguments, "location");
        if (query == null || location == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Error: query and location parameters are required"));
        }
        String requestedType = ToolSupport.stringArg(arguments, "type");
        String type = requestedType != null && PLACE_TYPES.contains(requestedType) ? requestedType : DEFAULT_TYPE;

        return CompletableFuture.supplyAsync(() -> {
            List<Place> places = travelDataPort.searchPlaces(query, location, type);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("query", query);
            payload.put("location", location);
            payload.put("type", type);
            payload.put("results", places);
            return ToolSupport.json(objectMapper, payload);
        });
    }
}
