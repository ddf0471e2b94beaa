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
import me.golemcore.tripagent.domain.model.WeatherReport;
import me.golemcore.tripagent.port.outbound.TravelDataPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Current weather and a 3-day forecast for a city.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WeatherTool implements InlineTool {

    public static final String NAME = "get_weather";

    private final TravelDataPort travelDataPort;
    private final ObjectMapper objectMapper;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get current weather and a short forecast for a location")
                .inputSchema(ToolSchema.object(
                        Map.of("location", ToolSchema.string("City name, e.g. Tokyo, Paris, New York")),
                        List.of("location")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments) {
        String location = ToolSupport.stringArg(arguments, "location");
        if (location == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: location parameter is required"));
        }

        return CompletableFuture.supplyAsync(() -> {
            WeatherReport weather = travelDataPort.getWeather(location);
            Map<String, Object> current = new LinkedHashMap<>();
            current.put("temp", weather.getTemperature());
            current.put("condition", weather.getCondition());
            current.put("humidity", weather.getHumidity());
            current.put("wind_speed", weather.getWindSpeed());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("location", weather.getLocation());
            payload.put("country", weather.getCountry());
            payload.put("current", current);
            payload.put("forecast", weather.getForecast());
            log.debug("Weather fetched for {}", location);
            return ToolSupport.json(objectMapper, payload);
        });
    }
}
