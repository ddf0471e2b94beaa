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
import me.golemcore.tripagent.domain.model.TripPlan;
import me.golemcore.tripagent.domain.service.AgentProgressService;
import me.golemcore.tripagent.domain.service.TripOrchestrator;
import me.golemcore.tripagent.port.outbound.TripStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TripChatControllerTest {

    private TripOrchestrator orchestrator;
    private AgentProgressService progressService;
    private TripStoragePort tripStoragePort;
    private TripChatController controller;

    @BeforeEach
    void setUp() {
        orchestrator = mock(TripOrchestrator.class);
        progressService = mock(AgentProgressService.class);
        tripStoragePort = mock(TripStoragePort.class);
        controller = new TripChatController(orchestrator, progressService, tripStoragePort);
    }

    @Test
    void chatShouldWrapEventsAsServerSentEvents() {
        AgentRequest request = AgentRequest.builder().userMessage("Plan 3 days in Kyoto").build();
        AgentEvent done = AgentEvent.done("session-1", Map.of("destination", "Kyoto"));
        when(orchestrator.process(request)).thenReturn(Flux.just(done));

        StepVerifier.create(controller.chat(request))
                .assertNext(sse -> {
                    assertEquals("done", sse.event());
                    assertSame(done, sse.data());
                })
                .verifyComplete();
    }

    @Test
    void chatShouldRejectMissingMessage() {
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.chat(AgentRequest.builder().build()));

        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void progressShouldReturnNoContentWithoutSession() {
        when(progressService.getCurrentSession()).thenReturn(Optional.empty());

        StepVerifier.create(controller.getProgress())
                .assertNext(resp -> assertEquals(HttpStatus.NO_CONTENT, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void listTripsShouldReturnStoredTrips() {
        TripPlan trip = TripPlan.builder().id("t1").destination("Kyoto").build();
        when(tripStoragePort.loadTrips()).thenReturn(CompletableFuture.completedFuture(List.of(trip)));

        StepVerifier.create(controller.listTrips())
                .assertNext(resp -> {
                    assertNotNull(resp.getBody());
                    assertEquals("t1", resp.getBody().get(0).getId());
                })
                .verifyComplete();
    }

    @Test
    void getTripShouldFailWithNotFound() {
        when(tripStoragePort.loadTrip("nope")).thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        StepVerifier.create(controller.getTrip("nope"))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException status = (ResponseStatusException) error;
                    assertEquals(HttpStatus.NOT_FOUND, status.getStatusCode());
                })
                .verify();
    }

    @Test
    void deleteTripShouldReturnNoContent() {
        when(tripStoragePort.deleteTrip("t1")).thenReturn(CompletableFuture.completedFuture(true));
        when(tripStoragePort.deleteTrip("t2")).thenReturn(CompletableFuture.completedFuture(false));

        StepVerifier.create(controller.deleteTrip("t1"))
                .assertNext(resp -> assertEquals(HttpStatus.NO_CONTENT, resp.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.deleteTrip("t2"))
                .expectError(ResponseStatusException.class)
                .verify();
    }
}
