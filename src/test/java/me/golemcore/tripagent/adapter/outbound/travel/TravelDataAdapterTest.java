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
import me.golemcore.tripagent.testsupport.http.OkHttpMockEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TravelDataAdapterTest {

    private static final String GEOCODING_KYOTO = """
            {"results":[{"name":"Kyoto","country":"Japan","latitude":35.02,"longitude":135.76}]}
            """;
    private static final String FORECAST = """
            {"current":{"temperature_2m":18.5,"relative_humidity_2m":72,"wind_speed_10m":4.1,"weather_code":61},
             "daily":{"time":["2026-05-01","2026-05-02"],
                      "temperature_2m_max":[22.0,24.5],
                      "temperature_2m_min":[14.0,15.5],
                      "weather_code":[0,95]}}
            """;

    private OkHttpMockEngine engine;
    private TripAgentProperties properties;
    private TravelDataAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new TripAgentProperties();
        properties.getTravel().setGeocodingUrl("http://geo.test");
        properties.getTravel().setWeatherUrl("http://weather.test");
        properties.getTravel().setPlacesUrl("http://places.test");
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new TravelDataAdapter(new FeignClientFactory(client, new ObjectMapper()), properties);
        adapter.init();
    }

    // ==================== Weather ====================

    @Test
    void shouldGeocodeThenFetchForecast() {
        engine.enqueueJson(200, GEOCODING_KYOTO);
        engine.enqueueJson(200, FORECAST);

        WeatherReport report = adapter.getWeather("Kyoto");

        assertEquals("Kyoto", report.getLocation());
        assertEquals("Japan", report.getCountry());
        assertEquals(18.5, report.getTemperature());
        assertEquals("Rain", report.getCondition());
        assertEquals(2, report.getForecast().size());
        assertEquals(LocalDate.parse("2026-05-02"), report.getForecast().get(1).getDate());
        assertEquals("Thunderstorm", report.getForecast().get(1).getCondition());
        assertEquals(24.5, report.getForecast().get(1).getTempMax());

        assertTrue(engine.takeRequest().url().startsWith("http://geo.test/v1/search?name=Kyoto"));
        assertTrue(engine.takeRequest().url().contains("latitude=35.02"));
    }

    @Test
    void shouldFailForUnknownLocation() {
        engine.enqueueJson(200, "{\"results\":[]}");

        TripAgentException error = assertThrows(TripAgentException.class, () -> adapter.getWeather("Atlantis"));

        assertEquals(ErrorKind.VALIDATION_ERROR, error.getKind());
        assertEquals("Location not found: Atlantis", error.getMessage());
    }

    @Test
    void shouldWrapHttpFailures() {
        engine.enqueueJson(503, "{}");

        TripAgentException error = assertThrows(TripAgentException.class, () -> adapter.getWeather("Kyoto"));

        assertEquals(ErrorKind.NETWORK_ERROR, error.getKind());
        assertEquals("Weather service error: HTTP 503", error.getMessage());
    }

    @Test
    void shouldDescribeWeatherCodes() {
        assertEquals("Clear sky", TravelDataAdapter.describeWeatherCode(0));
        assertEquals("Foggy", TravelDataAdapter.describeWeatherCode(48));
        assertEquals("Unknown", TravelDataAdapter.describeWeatherCode(42));
    }

    // ==================== Places ====================

    @Test
    void shouldRequirePlacesApiKey() {
        TripAgentException error = assertThrows(TripAgentException.class,
                () -> adapter.searchPlaces("temple", "Kyoto", "attraction"));

        assertEquals(ErrorKind.NOT_CONFIGURED, error.getKind());
        assertEquals(0, engine.getRequestCount());
    }

    @Test
    void shouldMapPlacesResults() {
        properties.getTravel().setPlacesApiKey("places-key");
        engine.enqueueJson(200, """
                {"status":"OK","results":[{"place_id":"p1","name":"Kinkaku-ji","types":["tourist_attraction"],
                 "formatted_address":"1 Kinkakujicho","rating":4.6,"price_level":2,
                 "geometry":{"location":{"lat":35.039,"lng":135.729}}}]}
                """);

        List<Place> places = adapter.searchPlaces("temple", "Kyoto", "attraction");

        assertEquals(1, places.size());
        Place place = places.get(0);
        assertEquals("p1", place.getId());
        assertEquals("attraction", place.getType());
        assertEquals("1 Kinkakujicho", place.getAddress());
        assertEquals(2, place.getPriceLevel());
        assertEquals(35.039, place.getLatitude());
        assertEquals("api", place.getSource());

        String url = engine.takeRequest().url();
        assertTrue(url.contains("type=tourist_attraction"));
        assertTrue(url.contains("key=places-key"));
    }

    @Test
    void shouldReportPlacesApiErrorStatus() {
        properties.getTravel().setPlacesApiKey("places-key");
        engine.enqueueJson(200, "{\"status\":\"REQUEST_DENIED\",\"error_message\":\"API key invalid\"}");

        TripAgentException error = assertThrows(TripAgentException.class,
                () -> adapter.searchPlaces("temple", "Kyoto", "attraction"));

        assertEquals(ErrorKind.SERVER_ERROR, error.getKind());
        assertEquals("Places API error: API key invalid", error.getMessage());
    }
}
