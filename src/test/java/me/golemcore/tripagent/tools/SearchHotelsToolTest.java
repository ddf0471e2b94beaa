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
import me.golemcore.tripagent.domain.model.Place;
import me.golemcore.tripagent.domain.model.ToolResult;
import me.golemcore.tripagent.port.outbound.TravelDataPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchHotelsToolTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:30:00Z");

    private TravelDataPort travelDataPort;
    private ObjectMapper objectMapper;
    private SearchHotelsTool tool;

    @BeforeEach
    void setUp() {
        travelDataPort = mock(TravelDataPort.class);
        objectMapper = new ObjectMapper();
        tool = new SearchHotelsTool(travelDataPort, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldEstimateNightlyPriceByLevel() {
        assertEquals(200, SearchHotelsTool.estimateNightlyPrice(1));
        assertEquals(400, SearchHotelsTool.estimateNightlyPrice(2));
        assertEquals(800, SearchHotelsTool.estimateNightlyPrice(3));
        assertEquals(1500, SearchHotelsTool.estimateNightlyPrice(4));
        assertEquals(400, SearchHotelsTool.estimateNightlyPrice(0));
        assertEquals(400, SearchHotelsTool.estimateNightlyPrice(9));
    }

    @Test
    void shouldSearchHotelsAndAttachPrices() throws Exception {
        when(travelDataPort.searchPlaces("hotel", "Kyoto", "hotel")).thenReturn(List.of(
                Place.builder().id("h1").name("Ryokan").rating(4.7).priceLevel(3).source("amap").build(),
                Place.builder().id("h2").name("Hostel").build()));

        ToolResult result = tool.execute(Map.of("location", "Kyoto", "checkIn", "2026-06-01",
                "checkOut", "2026-06-04")).join();

        assertFalse(result.isError(), result.getText());
        JsonNode payload = objectMapper.readTree(result.getText());
        assertEquals("2026-06-01", payload.get("checkIn").asText());
        assertEquals("2026-06-04", payload.get("checkOut").asText());
        JsonNode hotels = payload.get("results");
        assertEquals(2, hotels.size());
        assertEquals(800, hotels.get(0).get("price_per_night").get("amount").asInt());
        assertEquals("CNY", hotels.get(0).get("price_per_night").get("currency").asText());
        assertFalse(hotels.get(1).has("price_per_night"));
        verify(travelDataPort).searchPlaces("hotel", "Kyoto", "hotel");
    }

    @Test
    void shouldDefaultStayToFiveNightsFromToday() throws Exception {
        when(travelDataPort.searchPlaces("hotel", "Kyoto", "hotel")).thenReturn(List.of());

        JsonNode payload = objectMapper.readTree(tool.execute(Map.of("location", "Kyoto")).join().getText());

        assertEquals("2026-05-01", payload.get("checkIn").asText());
        assertEquals("2026-05-06", payload.get("checkOut").asText());
    }

    @Test
    void shouldRejectMalformedDate() {
        ToolResult result = tool.execute(Map.of("location", "Kyoto", "checkIn", "01/06/2026")).join();

        assertTrue(result.isError());
        assertEquals("Error: dates must use the YYYY-MM-DD format", result.getText());
        verifyNoInteractions(travelDataPort);
    }

    @Test
    void shouldRejectMissingLocation() {
        ToolResult result = tool.execute(Map.of("location", "  ")).join();

        assertTrue(result.isError());
        verifyNoInteractions(travelDataPort);
    }
}
