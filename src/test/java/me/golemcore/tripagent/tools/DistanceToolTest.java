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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.domain.model.ToolSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceToolTest {

    private static final Map<String, Object> ORIGIN = Map.of("lat", 0.0, "lng", 0.0, "name", "Origin");
    private static final Map<String, Object> ONE_DEGREE_EAST = Map.of("lat", 0.0, "lng", 1.0, "name", "East");

    private ObjectMapper objectMapper;
    private DistanceTool tool;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        tool = new DistanceTool(objectMapper);
    }

    private JsonNode run(Map<String, Object> arguments) throws Exception {
        ToolResult result = tool.execute(arguments).join();
        assertFalse(result.isError(), result.getText());
        return objectMapper.readTree(result.getText());
    }

    @Test
    void shouldComputeHaversineDistance() {
        assertEquals(111.195, DistanceTool.haversineKm(0, 0, 0, 1), 0.001);
        assertEquals(0.0, DistanceTool.haversineKm(35.68, 139.65, 35.68, 139.65), 1e-9);
        assertEquals(DistanceTool.EARTH_RADIUS_KM * Math.PI, DistanceTool.haversineKm(0, 0, 0, 180), 0.001);
    }

    @Test
    void shouldDefaultToDrivingMode() throws Exception {
        JsonNode payload = run(Map.of("from", ORIGIN, "to", ONE_DEGREE_EAST));

        assertEquals("Origin", payload.get("from").asText());
        assertEquals("East", payload.get("to").asText());
        assertEquals(111, payload.get("distance").asLong());
        assertEquals("km", payload.get("distance_unit").asText());
        assertEquals("driving", payload.get("mode").asText());
        assertEquals(222, payload.get("travel_time").asLong());
        assertEquals("minutes", payload.get("travel_time_unit").asText());
    }

    @Test
    void shouldUseModeSpecificSpeed() throws Exception {
        assertEquals(1334, run(Map.of("from", ORIGIN, "to", ONE_DEGREE_EAST, "mode", "walking"))
                .get("travel_time").asLong());
        assertEquals(334, run(Map.of("from", ORIGIN, "to", ONE_DEGREE_EAST, "mode", "transit"))
                .get("travel_time").asLong());
    }

    @Test
    void shouldFallBackToDrivingForUnknownMode() throws Exception {
        JsonNode payload = run(Map.of("from", ORIGIN, "to", ONE_DEGREE_EAST, "mode", "teleport"));

        assertEquals("driving", payload.get("mode").asText());
    }

    @Test
    void shouldAcceptNumericStrings() throws Exception {
        Map<String, Object> from = Map.of("lat", "0", "lng", "0", "name", "A");
        Map<String, Object> to = Map.of("lat", "0", "lng", "1", "name", "B");

        assertEquals(111, run(Map.of("from", from, "to", to)).get("distance").asLong());
    }

    // ==================== Errors ====================

    @Test
    void shouldRejectMissingEndpoints() {
        ToolResult result = tool.execute(Map.of("from", ORIGIN)).join();

        assertTrue(result.isError());
        assertEquals("Error: from and to parameters are required", result.getText());
    }

    @Test
    void shouldRejectNonNumericCoordinates() {
        Map<String, Object> broken = new HashMap<>(ONE_DEGREE_EAST);
        broken.put("lat", "north");

        ToolResult result = tool.execute(Map.of("from", ORIGIN, "to", broken)).join();

        assertTrue(result.isError());
        assertTrue(result.getText().contains("numeric lat and lng"));
    }

    @Test
    void shouldDeclareRequiredEndpointsInSchema() {
        assertEquals(DistanceTool.NAME, tool.getDefinition().getName());
        assertEquals(List.of("from", "to"), tool.getDefinition().getInputSchema().getRequired());
    }

    @Test
    void shouldDescribeEachEndpointSeparately() {
        Map<String, ToolSchema> properties = tool.getDefinition().getInputSchema().getProperties();

        assertEquals("Start location", properties.get("from").getDescription());
        assertEquals("End location", properties.get("to").getDescription());
        assertEquals(List.of("lat", "lng", "name"), properties.get("from").getRequired());
        assertEquals("object", properties.get("to").getType());
    }
}
