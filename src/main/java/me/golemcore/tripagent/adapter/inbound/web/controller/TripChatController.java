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

package me.golemcore.tripagent.adapter.inbound.web.controller;

import me.golemcore.tripagent.domain.model.AgentEvent;
import me.golemcore.tripagent.domain.model.AgentRequest;
import me.golemcore.tripagent.domain.model.ProgressSession;
import me.golemcore.tripagent.domain.model.TripPlan;
import me.golemcore.tripagent.domain.service.AgentProgressService;
import me.golemcore.tripagent.domain.service.TripOrchestrator;
import me.golemcore.tripagent.port.outbound.TripStoragePort;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Chat turn streaming, progress snapshot and stored trips.
 */
@RestController
@RequestMapping("/api/trips")
@RequiredArgsConstructor
public class TripChatController {

    private final TripOrchestrator orchestrator;
    private final AgentProgressService progressService;
    private final TripStoragePort tripStoragePort;

    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AgentEvent>> chat(@RequestBody AgentRequest request) {
        if (request == null || request.getUserMessage() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userMessage is required");
        }
        return orchestrator.process(request)
                .map(event -> ServerSentEvent.<AgentEvent>builder()
                        .event(event.getType().name().toLowerCase(Locale.ROOT))
                        .data(event)
                        .build());
    }

    @GetMapping("/progress")
    public Mono<ResponseEntity<ProgressSession>> getProgress() {
        return Mono.just(progressService.getCurrentSession()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @GetMapping
    public Mono<ResponseEntity<List<TripPlan>>> listTrips() {
        return Mono.fromFuture(tripStoragePort::loadTrips).map(ResponseEntity::ok);
    }

    @GetMapping("/{tripId}")
    public Mono<ResponseEntity<TripPlan>> getTrip(@PathVariable String tripId) {
        return Mono.fromFuture(() -> tripStoragePort.loadTrip(tripId))
                .map(trip -> trip.orElseThrow(
                        () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Trip not found: " + tripId)))
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/{tripId}")
    public Mono<ResponseEntity<Void>> deleteTrip(@PathVariable String tripId) {
        return Mono.fromFuture(() -> tripStoragePort.deleteTrip(tripId))
                .map(deleted -> {
                    if (!deleted) {
                        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Trip not found: " + tripId);
                    }
                    return ResponseEntity.noContent().<Void>build();
                });
    }
}
