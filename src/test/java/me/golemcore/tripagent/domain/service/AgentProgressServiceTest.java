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

package me.golemcore.tripagent.domain.service;

import me.golemcore.tripagent.domain.model.AgentPhase;
import me.golemcore.tripagent.domain.model.PhaseDefinition;
import me.golemcore.tripagent.domain.model.ProgressSession;
import me.golemcore.tripagent.domain.model.RuntimeEvent;
import me.golemcore.tripagent.domain.model.RuntimeEventType;
import me.golemcore.tripagent.domain.model.ToolCall;
import me.golemcore.tripagent.infrastructure.event.SpringEventBus;
import me.golemcore.tripagent.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AgentProgressServiceTest {

    private static final String SESSION_ID = "session-1";
    private static final String P1 = "planner";
    private static final String P2 = "recommender";
    private static final Instant START = Instant.parse("2026-05-01T08:00:00Z");

    private MutableClock clock;
    private SpringEventBus eventBus;
    private AgentProgressService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        eventBus = mock(SpringEventBus.class);
        service = new AgentProgressService(clock, eventBus);
    }

    private void startTwoPhaseSession() {
        service.startSession(SESSION_ID, List.of(
                new PhaseDefinition(P1, "Planning", "Build itinerary", "planner"),
                new PhaseDefinition(P2, "Recommending", "Suggest places", "recommender")));
    }

    private ProgressSession session() {
        return service.getCurrentSession().orElseThrow();
    }

    private List<RuntimeEvent> publishedEvents() {
        ArgumentCaptor<RuntimeEvent> captor = ArgumentCaptor.forClass(RuntimeEvent.class);
        verify(eventBus, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues();
    }

    // ==================== Session ====================

    @Test
    void shouldStartSessionWithPendingPhases() {
        startTwoPhaseSession();

        ProgressSession session = session();
        assertEquals(SESSION_ID, session.getSessionId());
        assertTrue(session.isRunning());
        assertEquals(0, session.getTotalProgress());
        assertEquals(START, session.getStartTime());
        assertTrue(session.getPhases().stream()
                .allMatch(phase -> phase.getStatus() == AgentPhase.PhaseStatus.PENDING && phase.getProgress() == 0));
        assertEquals(RuntimeEventType.SESSION_STARTED, publishedEvents().get(0).type());
    }

    @Test
    void shouldAverageProgressAcrossPhases() {
        startTwoPhaseSession();

        service.startPhase(P1);
        service.updatePhaseProgress(P1, 50);
        assertEquals(25, session().getTotalProgress());

        service.completePhase(P1);
        assertEquals(50, session().getTotalProgress());
        assertEquals(AgentPhase.PhaseStatus.COMPLETED, service.getPhaseById(P1).orElseThrow().getStatus());
    }

    @Test
    void shouldClampProgress() {
        startTwoPhaseSession();

        service.updatePhaseProgress(P1, 150);
        assertEquals(100, service.getPhaseById(P1).orElseThrow().getProgress());

        service.updatePhaseProgress(P1, -10);
        assertEquals(0, service.getPhaseById(P1).orElseThrow().getProgress());
    }

    @Test
    void shouldCountSkippedPhaseAsFullProgress() {
        startTwoPhaseSession();

        service.skipPhase(P2);

        assertEquals(AgentPhase.PhaseStatus.SKIPPED, service.getPhaseById(P2).orElseThrow().getStatus());
        assertEquals(50, session().getTotalProgress());
    }

    @Test
    void shouldTrackCurrentPhase() {
        startTwoPhaseSession();
        assertTrue(service.getCurrentPhase().isEmpty());

        service.startPhase(P2);

        assertEquals(P2, service.getCurrentPhase().orElseThrow().getId());
        assertEquals(P2, session().getCurrentPhaseId());
    }

    @Test
    void shouldCompleteSessionRegardlessOfFailedPhase() {
        startTwoPhaseSession();
        service.startPhase(P1);
        service.failPhase(P1, "model down");

        clock.advance(Duration.ofSeconds(30));
        service.completeSession();

        ProgressSession session = session();
        assertFalse(session.isRunning());
        assertEquals(100, session.getTotalProgress());
        assertNull(session.getCurrentPhaseId());
        assertEquals(Duration.ofSeconds(30), service.getSessionDuration());
        assertEquals(AgentPhase.PhaseStatus.FAILED, service.getPhaseById(P1).orElseThrow().getStatus());
    }

    @Test
    void shouldFailOnlyInProgressPhasesWhenSessionFails() {
        startTwoPhaseSession();
        service.startPhase(P1);
        service.completePhase(P1);
        service.startPhase(P2);

        service.failSession("boom");

        assertEquals(AgentPhase.PhaseStatus.COMPLETED, service.getPhaseById(P1).orElseThrow().getStatus());
        AgentPhase failed = service.getPhaseById(P2).orElseThrow();
        assertEquals(AgentPhase.PhaseStatus.FAILED, failed.getStatus());
        assertEquals("boom", failed.getError());
        assertFalse(session().isRunning());
        assertNull(session().getCurrentPhaseId());
    }

    @Test
    void shouldMergePhaseMetadata() {
        startTwoPhaseSession();

        service.completePhase(P1, Map.of("chars", 120));
        service.completePhase(P1, Map.of("fallback", true));

        Map<String, Object> metadata = service.getPhaseById(P1).orElseThrow().getMetadata();
        assertEquals(120, metadata.get("chars"));
        assertEquals(true, metadata.get("fallback"));
    }

    @Test
    void shouldIgnoreMutatorsWithoutSession() {
        service.startPhase(P1);
        service.updatePhaseProgress(P1, 40);
        service.completePhase(P1);
        service.failSession("nothing");
        service.completeSession();
        service.cancelPhase(P1, "user");

        assertNull(service.addToolCall("get_weather", P1, Map.of()));
        assertTrue(service.getCurrentSession().isEmpty());
        assertTrue(service.getActiveToolCalls().isEmpty());
        assertEquals(Duration.ZERO, service.getSessionDuration());
        verify(eventBus, never()).publish(any());
    }

    @Test
    void shouldIgnoreUnknownPhase() {
        startTwoPhaseSession();

        service.completePhase("unknown");

        assertEquals(0, session().getTotalProgress());
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        startTwoPhaseSession();
        ProgressSession snapshot = session();

        snapshot.getPhases().get(0).setStatus(AgentPhase.PhaseStatus.COMPLETED);
        snapshot.setTotalProgress(99);

        assertEquals(AgentPhase.PhaseStatus.PENDING, service.getPhaseById(P1).orElseThrow().getStatus());
        assertEquals(0, session().getTotalProgress());
    }

    @Test
    void shouldClearSessionOnReset() {
        startTwoPhaseSession();

        service.resetSession();

        assertTrue(service.getCurrentSession().isEmpty());
        List<RuntimeEvent> events = publishedEvents();
        assertEquals(RuntimeEventType.SESSION_RESET, events.get(events.size() - 1).type());
    }

    // ==================== Tool calls ====================

    @Test
    void shouldTrackToolCallLifecycleWithDuration() {
        startTwoPhaseSession();
        String id = service.addToolCall("get_weather", P2, Map.of("location", "Tokyo"));

        service.startToolCall(id);
        assertEquals(1, service.getActiveToolCalls().size());

        clock.advance(Duration.ofMillis(350));
        service.completeToolCall(id, "{\"temp\":21}");

        ToolCall call = session().getToolCalls().get(0);
        assertEquals(ToolCall.ToolCallStatus.COMPLETED, call.getStatus());
        assertEquals("{\"temp\":21}", call.getOutput());
        assertEquals(350L, call.getDuration());
        assertEquals("Tokyo", call.getInput().get("location"));
        assertTrue(service.getActiveToolCalls().isEmpty());
    }

    @Test
    void shouldGenerateDistinctToolCallIds() {
        startTwoPhaseSession();

        String first = service.addToolCall("get_weather", P2, null);
        String second = service.addToolCall("get_weather", P2, null);

        assertTrue(first.startsWith("tool-" + START.toEpochMilli() + "-"));
        assertNotEquals(first, second);
        assertEquals(ToolCall.ToolCallStatus.PENDING, session().getToolCalls().get(0).getStatus());
    }

    @Test
    void shouldRecordToolFailure() {
        startTwoPhaseSession();
        String id = service.addToolCall("search_hotels", P2, Map.of());
        service.startToolCall(id);

        service.failToolCall(id, "quota exceeded");

        ToolCall call = session().getToolCalls().get(0);
        assertEquals(ToolCall.ToolCallStatus.FAILED, call.getStatus());
        assertEquals("quota exceeded", call.getError());
        assertEquals(0L, call.getDuration());
    }

    @Test
    void shouldApplyPartialToolCallUpdate() {
        startTwoPhaseSession();
        String id = service.addToolCall("search_places", P1, Map.of());

        service.updateToolCall(id, ToolCall.builder().status(null).output("partial").build());

        ToolCall call = session().getToolCalls().get(0);
        assertEquals(ToolCall.ToolCallStatus.PENDING, call.getStatus());
        assertEquals("partial", call.getOutput());
    }

    @Test
    void shouldCancelPhaseAndItsOpenToolCalls() {
        startTwoPhaseSession();
        service.startPhase(P2);
        String running = service.addToolCall("get_weather", P2, Map.of());
        service.startToolCall(running);
        String done = service.addToolCall("search_places", P2, Map.of());
        service.completeToolCall(done, "[]");
        String otherPhase = service.addToolCall("get_current_date", P1, Map.of());

        clock.advance(Duration.ofMillis(80));
        service.cancelPhase(P2, "client disconnected");

        List<ToolCall> calls = session().getToolCalls();
        assertEquals(ToolCall.ToolCallStatus.CANCELLED, calls.get(0).getStatus());
        assertEquals("session.cancelled", calls.get(0).getError());
        assertEquals(80L, calls.get(0).getDuration());
        assertEquals(ToolCall.ToolCallStatus.COMPLETED, calls.get(1).getStatus());
        assertEquals(otherPhase, calls.get(2).getId());
        assertEquals(ToolCall.ToolCallStatus.PENDING, calls.get(2).getStatus());

        AgentPhase phase = service.getPhaseById(P2).orElseThrow();
        assertEquals(AgentPhase.PhaseStatus.FAILED, phase.getStatus());
        assertEquals("Cancelled: client disconnected", phase.getError());
        assertTrue(session().isRunning());
    }

    @Test
    void shouldIgnoreNullPhaseOnCancel() {
        startTwoPhaseSession();
        service.startPhase(P1);
        service.addToolCall("get_weather", P1, Map.of());

        service.cancelPhase(null, "client disconnected");

        assertEquals(AgentPhase.PhaseStatus.IN_PROGRESS, service.getPhaseById(P1).orElseThrow().getStatus());
        assertEquals(ToolCall.ToolCallStatus.PENDING, session().getToolCalls().get(0).getStatus());
    }

    @Test
    void shouldIgnoreNullToolCallPatch() {
        startTwoPhaseSession();
        String id = service.addToolCall("search_places", P1, Map.of());

        service.updateToolCall(id, null);

        assertEquals(ToolCall.ToolCallStatus.PENDING, session().getToolCalls().get(0).getStatus());
    }

    // ==================== Session scope ====================

    @Test
    void shouldDropUpdatesFromSupersededSession() {
        startTwoPhaseSession();
        AgentProgressService.SessionProgress older = service.forSession(SESSION_ID);
        older.startPhase(P1);
        String olderCall = older.addToolCall("get_weather", P1, Map.of());

        service.startSession("session-2", List.of(
                new PhaseDefinition(P1, "Planning", "Build itinerary", "planner"),
                new PhaseDefinition(P2, "Recommending", "Suggest places", "recommender")));
        AgentProgressService.SessionProgress newer = service.forSession("session-2");
        newer.startPhase(P1);

        older.completePhase(P1, Map.of("chars", 10));
        older.completeToolCall(olderCall, "sunny");
        older.cancelPhase(P1, "client disconnected");
        older.completeSession();
        assertNull(older.addToolCall("search_places", P1, Map.of()));

        ProgressSession current = session();
        assertEquals("session-2", current.getSessionId());
        assertTrue(current.isRunning());
        assertEquals(0, current.getTotalProgress());
        assertTrue(current.getToolCalls().isEmpty());
        assertEquals(AgentPhase.PhaseStatus.IN_PROGRESS, service.getPhaseById(P1).orElseThrow().getStatus());
        assertFalse(service.isCurrentSession(SESSION_ID));

        newer.completePhase(P1, null);
        newer.completeSession();

        assertFalse(session().isRunning());
        assertEquals(AgentPhase.PhaseStatus.COMPLETED, service.getPhaseById(P1).orElseThrow().getStatus());
    }

    // ==================== Events ====================

    @Test
    void shouldPublishEventPerTransition() {
        startTwoPhaseSession();
        service.startPhase(P1);
        service.updatePhaseProgress(P1, 30);
        String id = service.addToolCall("get_weather", P1, Map.of());
        service.completeToolCall(id, "ok");
        service.completePhase(P1);
        service.completeSession();

        List<RuntimeEventType> types = publishedEvents().stream().map(RuntimeEvent::type).toList();
        assertEquals(List.of(
                RuntimeEventType.SESSION_STARTED,
                RuntimeEventType.PHASE_STARTED,
                RuntimeEventType.PHASE_PROGRESS,
                RuntimeEventType.TOOL_CALL_ADDED,
                RuntimeEventType.TOOL_CALL_COMPLETED,
                RuntimeEventType.PHASE_COMPLETED,
                RuntimeEventType.SESSION_COMPLETED), types);
        RuntimeEvent progress = publishedEvents().get(2);
        assertEquals(SESSION_ID, progress.sessionId());
        assertEquals(15, progress.payload().get("totalProgress"));
    }
}
