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

package me.golemcore.tripagent.adapter.outbound.storage;

import me.golemcore.tripagent.domain.model.TripPlan;
import me.golemcore.tripagent.domain.model.UserPreferences;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.port.outbound.TripStoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link TripStoragePort}.
 *
 * <p>
 * Layout under {@code trip.storage.base-path}:
 * <ul>
 * <li>trips/{id}.json - finished trip plans
 * <li>preferences/{userId}.json - user preferences
 * </ul>
 *
 * <p>
 * Writes go to a temp file that is then moved over the target, so a crash
 * never leaves a half-written JSON file behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalTripStorageAdapter implements TripStoragePort {

    static final String TRIPS_DIR = "trips";
    static final String PREFERENCES_DIR = "preferences";
    private static final String JSON_SUFFIX = ".json";

    private final TripAgentProperties properties;
    private final ObjectMapper objectMapper;

    private Path basePath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath.resolve(TRIPS_DIR));
            Files.createDirectories(basePath.resolve(PREFERENCES_DIR));
            log.info("Trip storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("Failed to create storage directory", e);
        }
    }

    @Override
    public CompletableFuture<Void> saveTrip(TripPlan trip) {
        return CompletableFuture.runAsync(() -> writeJson(resolvePath(TRIPS_DIR, trip.getId()), trip));
    }

    @Override
    public CompletableFuture<List<TripPlan>> loadTrips() {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = basePath.resolve(TRIPS_DIR);
            if (!Files.isDirectory(dir)) {
                return List.of();
            }
            List<TripPlan> trips = new ArrayList<>();
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(file -> file.getFileName().toString().endsWith(JSON_SUFFIX))
                        .forEach(file -> readJson(file, TripPlan.class).ifPresent(trips::add));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list trips", e);
            }
            trips.sort(Comparator.comparing(TripPlan::getCreatedAt,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
            return trips;
        });
    }

    @Override
    public CompletableFuture<Optional<TripPlan>> loadTrip(String tripId) {
        return CompletableFuture.supplyAsync(() -> readJson(resolvePath(TRIPS_DIR, tripId), TripPlan.class));
    }

    @Override
    public CompletableFuture<Boolean> deleteTrip(String tripId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return Files.deleteIfExists(resolvePath(TRIPS_DIR, tripId));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete trip: " + tripId, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> savePreferences(UserPreferences preferences) {
        return CompletableFuture.runAsync(
                () -> writeJson(resolvePath(PREFERENCES_DIR, preferences.getUserId()), preferences));
    }

    @Override
    public CompletableFuture<Optional<UserPreferences>> loadPreferences(String userId) {
        return CompletableFuture.supplyAsync(
                () -> readJson(resolvePath(PREFERENCES_DIR, userId), UserPreferences.class));
    }

    private void writeJson(Path target, Object value) {
        Path tempPath = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempPath.toFile(), value);
            try {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write file: " + target.getFileName(), e);
        }
    }

    private <T> Optional<T> readJson(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Path resolvePath(String directory, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identifier is required");
        }
        Path dir = basePath.resolve(directory);
        Path resolved = dir.resolve(id + JSON_SUFFIX).normalize();
        if (!resolved.getParent().equals(dir)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + id);
        }
        return resolved;
    }
}
