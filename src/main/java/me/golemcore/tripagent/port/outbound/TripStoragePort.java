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

import me.golemcore.tripagent.domain.model.TripPlan;
import me.golemcore.tripagent.domain.model.UserPreferences;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persisting finished trips and per-user preferences.
 */
public interface TripStoragePort {

    CompletableFuture<Void> saveTrip(TripPlan trip);

    /**
     * All stored trips, newest first.
     */
    CompletableFuture<List<TripPlan>> loadTrips();

    CompletableFuture<Optional<TripPlan>> loadTrip(String tripId);

    /**
     * @return true if a trip was deleted
     */
    CompletableFuture<Boolean> deleteTrip(String tripId);

    CompletableFuture<Void> savePreferences(UserPreferences preferences);

    CompletableFuture<Optional<UserPreferences>> loadPreferences(String userId);
}
