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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Great-circle distance between two coordinates with a travel time estimate
 * per mode (driving 30 km/h, walking 5 km/h, transit 20 km/h).
 */
@Component
@RequiredArgsConstructor
public class DistanceTool implements InlineTool {

    public static final String NAME = "calculate_distance";
    static final double EARTH_RADIUS_KM = 6371.0;
    private static final Map<String, Double> SPEED_KMH = Map.of("driving", 30.0, "walking", 5.0, "transit", 20.0);
    private static final String DEFAULT_MODE = "driving";

    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolSchema> point = new LinkedHashMap<>();
        point.put("lat", ToolSchema.number("Latitude"));
        point.put("lng", ToolSchema.number("Longitude"));
        point.put("name", ToolSchema.string("Location name"));
        ToolSchema pointSchema = ToolSchema.object(point, List.of("lat", "lng", "name"));

        Map<String, ToolSchema> properties = new LinkedHashMap<>();
        properties.put("from", pointSchema.toBuilder().description("Start location").build());
        properties.put("to", pointSchema.toBuilder().description("End location").build());
        properties.put("mode", ToolSchema.builder()
                .type("string")
                .description("Travel mode")
                .enumValues(List.of("driving", "walking", "transit"))
                .defaultValue(DEFAULT_MODE)
                .build());
        return ToolDefinition.builder()
                .name(NAME)
                .description("Calculate distance and estimated travel time between two coordinates")
                .inputSchema(ToolSchema.object(properties, List.of("from", "to")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        if (!(arguments.get("from") instanceof Map<?, ?> from) || !(arguments.get("to") instanceof Map<?, ?> to)) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: from and to parameters are required"));
        }
        Double fromLat = ToolSupport.doubleArg(from, "lat");
        Double fromLng = ToolSupport.doubleArg(from, "lng");
        Double toLat = ToolSupport.doubleArg(to, "lat");
        Double toLng = ToolSupport.doubleArg(to, "lng");
        if (fromLat == null || fromLng == null || toLat == null || toLng == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Error: from and to must contain numeric lat and lng"));
        }

        String mode = ToolSupport.stringArg(arguments, "mode");
        if (mode == null || !SPEED_KMH.containsKey(mode)) {
            mode = DEFAULT_MODE;
        }
        double distance = haversineKm(fromLat, fromLng, toLat, toLng);
        long travelTime = Math.round(distance / SPEED_KMH.get(mode) * 60);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.get("name"));
        payload.put("to", to.get("name"));
        payload.put("distance", Math.round(distance));
        payload.put("distance_unit", "km");
        payload.put("mode", mode);
        payload.put("travel_time", travelTime);
        payload.put("travel_time_unit", "minutes");
        return CompletableFuture.completedFuture(ToolSupport.json(objectMapper, payload));
    }

    static double haversineKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
