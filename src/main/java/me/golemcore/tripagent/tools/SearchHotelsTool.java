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

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lodging search with a nightly price estimated from the price level.
 */
@Component
@RequiredArgsConstructor
public class SearchHotelsTool implements InlineTool {

    public static final String NAME = "search_hotels";
    private static final int DEFAULT_STAY_DAYS = 5;
    private static final int[] PRICE_BY_LEVEL_CNY = { 0, 200, 400, 800, 1500 };
    private static final int DEFAULT_PRICE_CNY = 400;

    private final TravelDataPort travelDataPort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, ToolSchema> properties = new LinkedHashMap<>();
        properties.put("location", ToolSchema.string("Search location"));
        properties.put("checkIn", ToolSchema.string("Check-in date (YYYY-MM-DD)"));
        properties.put("checkOut", ToolSchema.string("Check-out date (YYYY-MM-DD)"));
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search hotels in a location")
                .inputSchema(ToolSchema.object(properties, List.of("location")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        String location = ToolSupport.stringArg(arguments, "location");
        if (location == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: location parameter is required"));
        }
        LocalDate checkIn;
        LocalDate checkOut;
        try {
            String checkInArg = ToolSupport.stringArg(arguments, "checkIn");
            String checkOutArg = ToolSupport.stringArg(arguments, "checkOut");
            checkIn = checkInArg != null ? LocalDate.parse(checkInArg) : LocalDate.now(clock);
            checkOut = checkOutArg != null ? LocalDate.parse(checkOutArg) : checkIn.plusDays(DEFAULT_STAY_DAYS);
        } catch (DateTimeParseException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Error: dates must use the YYYY-MM-DD format"));
        }

        return CompletableFuture.supplyAsync(() -> {
            List<Map<String, Object>> hotels = travelDataPort.searchPlaces("hotel", location, "hotel").stream()
                    .map(this::toHotel)
                    .toList();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("location", location);
            payload.put("checkIn", checkIn.toString());
            payload.put("checkOut", checkOut.toString());
            payload.put("results", hotels);
            return ToolSupport.json(objectMapper, payload);
        });
    }

    private Map<String, Object> toHotel(Place place) {
        Map<String, Object> hotel = new LinkedHashMap<>();
        hotel.put("id", place.getId());
        hotel.put("name", place.getName());
        hotel.put("address", place.getAddress());
        hotel.put("rating", place.getRating());
        if (place.getPriceLevel() != null) {
            hotel.put("price_per_night", Map.of("amount", estimateNightlyPrice(place.getPriceLevel()),
                    "currency", "CNY"));
        }
        hotel.put("source", place.getSource());
        return hotel;
    }

    static int estimateNightlyPrice(int priceLevel) {
        if (priceLevel <= 0 || priceLevel >= PRICE_BY_LEVEL_CNY.length) {
            return DEFAULT_PRICE_CNY;
        }
        return PRICE_BY_LEVEL_CNY[priceLevel];
    }
}
