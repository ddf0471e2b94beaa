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

package me.golemcore.tripagent.adapter.outbound.travel;

import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.Place;
import me.golemcore.tripagent.domain.model.TripAgentException;
import me.golemcore.tripagent.domain.model.WeatherReport;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.infrastructure.http.FeignClientFactory;
import me.golemcore.tripagent.port.outbound.TravelDataPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Travel data over Feign clients.
 *
 * <ul>
 * <li>weather: Open-Meteo geocoding and forecast APIs (no key required)</li>
 * <li>places: Google Places text search (requires
 * {@code trip.travel.places-api-key})</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TravelDataAdapter implements TravelDataPort {

    private static final int FORECAST_DAYS = 3;
    private static final int MAX_PLACES = 10;
    private static final Map<String, String> GOOGLE_TYPES = Map.of(
            "attraction", "tourist_attraction",
            "restaurant", "restaurant",
            "hotel", "lodging",
            "shopping", "shopping_mall");

    private final FeignClientFactory feignClientFactory;
    private final TripAgentProperties properties;

    private GeocodingApi geocodingApi;
    private WeatherApi weatherApi;
    private PlacesApi placesApi;

    @PostConstruct
    public void init() {
        TripAgentProperties.TravelProperties travel = properties.getTravel();
        this.geocodingApi = feignClientFactory.create(GeocodingApi.class, travel.getGeocodingUrl());
        this.weatherApi = feignClientFactory.create(WeatherApi.class, travel.getWeatherUrl());
        this.placesApi = feignClientFactory.create(PlacesApi.class, travel.getPlacesUrl());
    }

    @Override
    public WeatherReport getWeather(String location) {
        try {
            GeocodingResponse geocoding = geocodingApi.search(location, 1);
            if (geocoding.getResults() == null || geocoding.getResults().isEmpty()) {
                throw new TripAgentException(ErrorKind.VALIDATION_ERROR, "Location not found: " + location);
            }
            GeoResult geo = geocoding.getResults().get(0);

            ForecastResponse forecast = weatherApi.forecast(geo.getLatitude(), geo.getLongitude(),
                    "temperature_2m,relative_humidity_2m,wind_speed_10m,weather_code",
                    "temperature_2m_max,temperature_2m_min,weather_code", FORECAST_DAYS);
            if (forecast.getCurrent() == null) {
                throw new TripAgentException(ErrorKind.SERVER_ERROR, "Weather data not available");
            }

            Current current = forecast.getCurrent();
            return WeatherReport.builder()
                    .location(geo.getName())
                    .country(geo.getCountry())
                    .temperature(current.getTemperature())
                    .humidity(current.getHumidity())
                    .windSpeed(current.getWindSpeed())
                    .condition(describeWeatherCode(current.getWeatherCode()))
                    .forecast(toDailyForecast(forecast.getDaily()))
                    .build();
        } catch (FeignException e) {
            log.warn("Weather lookup failed for {}: HTTP {}", location, e.status());
            throw new TripAgentException(ErrorKind.NETWORK_ERROR, "Weather service error: HTTP " + e.status(), e);
        }
    }

    @Override
    public List<Place> searchPlaces(String query, String location, String type) {
        String apiKey = properties.getTravel().getPlacesApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new TripAgentException(ErrorKind.NOT_CONFIGURED,
                    "Places API key not configured (trip.travel.places-api-key)");
        }
        String googleType = GOOGLE_TYPES.getOrDefault(type, "establishment");
        try {
            PlacesResponse response = placesApi.textSearch((query + " " + location).trim(), googleType, apiKey);
            String status = response.getStatus();
            if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
                String detail = response.getErrorMessage() != null ? response.getErrorMessage() : status;
                throw new TripAgentException(ErrorKind.SERVER_ERROR, "Places API error: " + detail);
            }
            if (response.getResults() == null) {
                return List.of();
            }
            return response.getResults().stream()
                    .limit(MAX_PLACES)
                    .map(result -> toPlace(result, type))
                    .toList();
        } catch (FeignException e) {
            log.warn("Places search failed for '{}' in {}: HTTP {}", query, location, e.status());
            throw new TripAgentException(ErrorKind.NETWORK_ERROR, "Places service error: HTTP " + e.status(), e);
        }
    }

    private Place toPlace(PlaceResult result, String type) {
        Place.PlaceBuilder place = Place.builder()
                .id(result.getPlaceId())
                .name(result.getName())
                .type(type)
                .description(result.getTypes() != null ? String.join(", ", result.getTypes()) : null)
                .address(result.getFormattedAddress() != null ? result.getFormattedAddress() : result.getVicinity())
                .rating(result.getRating())
                .priceLevel(result.getPriceLevel())
                .source("api");
        if (result.getGeometry() != null && result.getGeometry().getLocation() != null) {
            place.latitude(result.getGeometry().getLocation().getLat());
            place.longitude(result.getGeometry().getLocation().getLng());
        }
        return place.build();
    }

    private List<WeatherReport.DailyForecast> toDailyForecast(Daily daily) {
        List<WeatherReport.DailyForecast> days = new ArrayList<>();
        if (daily == null || daily.getTime() == null) {
            return days;
        }
        int count = Math.min(FORECAST_DAYS, daily.getTime().size());
        for (int i = 0; i < count; i++) {
            days.add(WeatherReport.DailyForecast.builder()
                    .date(LocalDate.parse(daily.getTime().get(i)))
                    .tempMax(valueAt(daily.getTemperatureMax(), i))
                    .tempMin(valueAt(daily.getTemperatureMin(), i))
                    .condition(daily.getWeatherCode() != null && daily.getWeatherCode().size() > i
                            ? describeWeatherCode(daily.getWeatherCode().get(i))
                            : "Unknown")
                    .build());
        }
        return days;
    }

    private static double valueAt(List<Double> values, int index) {
        return values != null && values.size() > index && values.get(index) != null ? values.get(index) : 0.0;
    }

    static String describeWeatherCode(int code) {
        return switch (code) {
        case 0 -> "Clear sky";
        case 1, 2, 3 -> "Partly cloudy";
        case 45, 48 -> "Foggy";
        case 51, 53, 55 -> "Drizzle";
        case 61, 63, 65 -> "Rain";
        case 66, 67 -> "Freezing rain";
        case 71, 73, 75 -> "Snow";
        case 77 -> "Snow grains";
        case 80, 81, 82 -> "Rain showers";
        case 85, 86 -> "Snow showers";
        case 95 -> "Thunderstorm";
        case 96, 99 -> "Thunderstorm with hail";
        default -> "Unknown";
        };
    }

    // Feign API interfaces
    interface GeocodingApi {
        @RequestLine("GET /v1/search?name={name}&count={count}")
        GeocodingResponse search(@Param("name") String name, @Param("count") int count);
    }

    interface WeatherApi {
        @RequestLine("GET /v1/forecast?latitude={lat}&longitude={lon}&current={current}&daily={daily}&forecast_days={days}&timezone=auto")
        ForecastResponse forecast(@Param("lat") double latitude, @Param("lon") double longitude,
                @Param("current") String current, @Param("daily") String daily, @Param("days") int days);
    }

    interface PlacesApi {
        @RequestLine("GET /maps/api/place/textsearch/json?query={query}&type={type}&key={key}")
        PlacesResponse textSearch(@Param("query") String query, @Param("type") String type,
                @Param("key") String key);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeocodingResponse {
        private List<GeoResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeoResult {
        private String name;
        private String country;
        private double latitude;
        private double longitude;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ForecastResponse {
        private Current current;
        private Daily daily;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Current {
        @JsonProperty("temperature_2m")
        private double temperature;
        @JsonProperty("relative_humidity_2m")
        private double humidity;
        @JsonProperty("wind_speed_10m")
        private double windSpeed;
        @JsonProperty("weather_code")
        private int weatherCode;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Daily {
        private List<String> time;
        @JsonProperty("temperature_2m_max")
        private List<Double> temperatureMax;
        @JsonProperty("temperature_2m_min")
        private List<Double> temperatureMin;
        @JsonProperty("weather_code")
        private List<Integer> weatherCode;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PlacesResponse {
        private String status;
        @JsonProperty("error_message")
        private String errorMessage;
        private List<PlaceResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PlaceResult {
        @JsonProperty("place_id")
        private String placeId;
        private String name;
        private List<String> types;
        @JsonProperty("formatted_address")
        private String formattedAddress;
        private String vicinity;
        private Double rating;
        @JsonProperty("price_level")
        private Integer priceLevel;
        private Geometry geometry;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Geometry {
        private LatLng location;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LatLng {
        private double lat;
        private double lng;
    }
}
