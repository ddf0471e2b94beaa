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

package me.golemcore.tripagent.port.outbound;

import me.golemcore.tripagent.domain.model.Place;
import me.golemcore.tripagent.domain.model.WeatherReport;

import java.util.List;

/**
 * Port for third-party travel data. Implementations throw
 * {@link me.golemcore.tripagent.domain.model.TripAgentException} when the
 * upstream is unavailable or not configured.
 */
public interface TravelDataPort {

    WeatherReport getWeather(String location);

    /**
     * @param type
     *            one of {@code attraction}, {@code restaurant}, {@code hotel},
     *            {@code shopping}
     */
    List<Place> searchPlaces(String query, String location, String type);
}
