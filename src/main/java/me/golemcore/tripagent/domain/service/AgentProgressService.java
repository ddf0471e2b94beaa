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
import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.PhaseDefinition;
import me.golemcore.tripagent.domain.model.ProgressSession;
import me.golemcore.tripagent.domain.model.RuntimeEvent;
import me.golemcore.tripagent.domain.model.RuntimeEventType;
import me.golemcore.tripagent.domain.model.ToolCall;
import me.golemcore.tripagent.infrastructure.event.SpringEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Tracks the phases and tool calls of the current orchestration session.
 *
 * <p>
 * Exactly one session is current at a time. Every mutator is a no-op when no
 * session is active, so observers may call them without checking first. Each
 * transition publishes a {@link RuntimeEvent} through {@link SpringEventBus}.
 *
 * <p>
 * Concurrent runs mutate through {@link #forSession(String)}: once a newer
 * session has started, updates from an older run are dropped instead of
 * landing in the newer session.
 *
 * <p>
 * {@code totalProgress} is the rounded mean of all phase progress values,
 * counting phases that have not started as 0.
 */
@Service
@Slf4j
public class AgentProgressService {

    private static final String CANCELLED_PREFIX = "Cancelled: ";

    private final Clock clock;
    private final SpringEventBus eventBus;

    private ProgressSession session;

    public AgentProgressService(Clock clock, SpringEventBus eventBus) {
        this.clock = clock;
        this.eventBus = eventBus;
    }

    // ==================== Session ====================

    public synchronized void startSession(String sessionId, List<PhaseDefinition> phaseDefinitions) {
        List<AgentPhase> phases = new ArrayList<>();
        for (PhaseDefinition definition : phaseDefinitions) {
            phases.add(AgentPhase.builder()
                    .id(definition.id())
                    .name(definition.name())
                    .description(definition.description())
                    .agentType(definition.agentType())
                    .status(AgentPhase.PhaseStatus.PENDING)
                    .progress(0)
                    .build());
        }
        session = ProgressSession.builder()
                .sessionId(sessionId)
                .phases(phases)
                .running(true)
                .totalProgress(0)
                .startTime(now())
                .build();
        log.info("[Progress] Session {} started with {} phases", sessionId, phases.size());
        publish(RuntimeEventType.SESSION_STARTED, Map.of("phases", phases.size()));
    }

    /**
     * Declares the run successful regardless of individual phase states.
     */
    public synchronized void completeSession() {
        if (session == null) {
            return;
        }
        session.setRunning(false);
        session.setTotalProgress(100);
        session.setCurrentPhaseId(null);
        session.setEndTime(now());
        log.info("[Progress] Session {} completed", session.getSessionId());
        publish(RuntimeEventType.SESSION_COMPLETED, Map.of());
    }

    /**
     * Halts the run. Only phases still in progress are marked failed.
     */
    public synchronized void failSession(String error) {
        if (session == null) {
            return;
        }
        Instant now = now();
        for (AgentPhase phase : session.getPhases()) {
            if (phase.getStatus() == AgentPhase.PhaseStatus.IN_PROGRESS) {
                phase.setStatus(AgentPhase.PhaseStatus.FAILED);
                phase.setError(error);
                phase.setEndTime(now);
            }
        }
        session.setRunning(false);
        session.setCurrentPhaseId(null);
        session.setEndTime(now);
        log.warn("[Progress] Session {} failed: {}", session.getSessionId(), error);
        publish(RuntimeEventType.SESSION_FAILED, errorPayload(error));
    }

    public synchronized void resetSession() {
        if (session == null) {
            return;
        }
        String sessionId = session.getSessionId();
        publish(RuntimeEventType.SESSION_RESET, Map.of());
        session = null;
        log.debug("[Progress] Session {} reset", sessionId);
    }

    // ==================== Phases ====================

    public synchronized void startPhase(String phaseId) {
        findPhase(phaseId).ifPresent(phase -> {
            phase.setStatus(AgentPhase.PhaseStatus.IN_PROGRESS);
            phase.setProgress(0);
            phase.setStartTime(now());
            session.setCurrentPhaseId(phaseId);
            recalculateTotalProgress();
            log.debug("[Progress] Phase {} started", phaseId);
            publish(RuntimeEventType.PHASE_STARTED, phasePayload(phase));
        });
    }

    public synchronized void updatePhaseProgress(String phaseId, int progress) {
        findPhase(phaseId).ifPresent(phase -> {
            phase.setProgress(clamp(progress));
            recalculateTotalProgress();
            publish(RuntimeEventType.PHASE_PROGRESS, phasePayload(phase));
        });
    }

    public synchronized void completePhase(String phaseId, Map<String, Object> metadata) {
        findPhase(phaseId).ifPresent(phase -> {
            phase.setStatus(AgentPhase.PhaseStatus.COMPLETED);
            phase.setProgress(100);
            phase.setEndTime(now());
            if (metadata != null) {
                Map<String, Object> merged = phase.getMetadata() != null
                        ? new LinkedHashMap<>(phase.getMetadata())
                        : new LinkedHashMap<>();
                merged.putAll(metadata);
                phase.setMetadata(merged);
            }
            recalculateTotalProgress();
            log.debug("[Progress] Phase {} completed", phaseId);
            publish(RuntimeEventType.PHASE_COMPLETED, phasePayload(phase));
        });
    }

    public void completePhase(String phaseId) {
        completePhase(phaseId, null);
    }

    /**
     * Marks the phase failed. The session keeps running.
     */
    public synchronized void failPhase(String phaseId, String error) {
        findPhase(phaseId).ifPresent(phase -> {
            phase.setStatus(AgentPhase.PhaseStatus.FAILED);
            phase.setError(error);
            phase.setEndTime(now());
            log.warn("[Progress] Phase {} failed: {}", phaseId, error);
            publish(RuntimeEventType.PHASE_FAILED, phasePayload(phase));
        });
    }

    public synchronized void skipPhase(String phaseId) {
        findPhase(phaseId).ifPresent(phase -> {
            phase.setStatus(AgentPhase.PhaseStatus.SKIPPED);
            phase.setProgress(100);
            phase.setEndTime(now());
            recalculateTotalProgress();
            log.debug("[Progress] Phase {} skipped", phaseId);
            publish(RuntimeEventType.PHASE_SKIPPED, phasePayload(phase));
        });
    }

    /**
     * Fails the phase with a cancellation error and cancels its running tool
     * calls.
     */
    public synchronized void cancelPhase(String phaseId, String reason) {
        if (session == null || phaseId == null) {
            return;
        }
        Instant now = now();
        for (ToolCall toolCall : session.getToolCalls()) {
            if (phaseId.equals(toolCall.getPhaseId())
                    && (toolCall.getStatus() == ToolCall.ToolCallStatus.RUNNING
                            || toolCall.getStatus() == ToolCall.ToolCallStatus.PENDING)) {
                toolCall.setStatus(ToolCall.ToolCallStatus.CANCELLED);
                toolCall.setError(ErrorKind.CANCELLED.getCode());
                finishToolCall(toolCall, now);
                publish(RuntimeEventType.TOOL_CALL_CANCELLED, toolCallPayload(toolCall));
            }
        }
        findPhase(phaseId).ifPresent(phase -> {
            if (phase.getStatus() == AgentPhase.PhaseStatus.IN_PROGRESS) {
                phase.setStatus(AgentPhase.PhaseStatus.FAILED);
                phase.setError(CANCELLED_PREFIX + reason);
                phase.setEndTime(now);
                log.info("[Progress] Phase {} cancelled: {}", phaseId, reason);
                publish(RuntimeEventType.PHASE_FAILED, phasePayload(phase));
            }
        });
    }

    // ==================== Tool calls ====================

    /**
     * Appends a pending tool call under the given phase.
     *
     * @return the generated id, or {@code null} without an active session
     */
    public synchronized String addToolCall(String name, String phaseId, Map<String, Object> input) {
        if (session == null) {
            return null;
        }
        Instant now = now();
        String id = "tool-" + now.toEpochMilli() + "-"
                + Integer.toString(ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE), 36);
        ToolCall toolCall = ToolCall.builder()
                .id(id)
                .name(name)
                .phaseId(phaseId)
                .status(ToolCall.ToolCallStatus.PENDING)
                .input(input != null ? new LinkedHashMap<>(input) : Map.of())
                .startTime(now)
                .build();
        session.getToolCalls().add(toolCall);
        publish(RuntimeEventType.TOOL_CALL_ADDED, toolCallPayload(toolCall));
        return id;
    }

    public synchronized void startToolCall(String toolCallId) {
        findToolCall(toolCallId).ifPresent(toolCall -> {
            toolCall.setStatus(ToolCall.ToolCallStatus.RUNNING);
            toolCall.setStartTime(now());
            publish(RuntimeEventType.TOOL_CALL_UPDATED, toolCallPayload(toolCall));
        });
    }

    /**
     * Applies the non-null fields of {@code patch} to the tool call.
     */
    public synchronized void updateToolCall(String toolCallId, ToolCall patch) {
        if (patch == null) {
            return;
        }
        findToolCall(toolCallId).ifPresent(toolCall -> {
            if (patch.getStatus() != null) {
                toolCall.setStatus(patch.getStatus());
            }
            if (patch.getOutput() != null) {
                toolCall.setOutput(patch.getOutput());
            }
            if (patch.getError() != null) {
                toolCall.setError(patch.getError());
            }
            if (patch.getEndTime() != null) {
                finishToolCall(toolCall, patch.getEndTime());
            }
            publish(RuntimeEventType.TOOL_CALL_UPDATED, toolCallPayload(toolCall));
        });
    }

    public synchronized void completeToolCall(String toolCallId, String output) {
        findToolCall(toolCallId).ifPresent(toolCall -> {
            toolCall.setStatus(ToolCall.ToolCallStatus.COMPLETED);
            toolCall.setOutput(output);
            finishToolCall(toolCall, now());
            publish(RuntimeEventType.TOOL_CALL_COMPLETED, toolCallPayload(toolCall));
        });
    }

    public synchronized void failToolCall(String toolCallId, String error) {
        findToolCall(toolCallId).ifPresent(toolCall -> {
            toolCall.setStatus(ToolCall.ToolCallStatus.FAILED);
            toolCall.setError(error);
            finishToolCall(toolCall, now());
            log.debug("[Progress] Tool call {} failed: {}", toolCall.getName(), error);
            publish(RuntimeEventType.TOOL_CALL_FAILED, toolCallPayload(toolCall));
        });
    }

    // ==================== Session scope ====================

    /**
     * Returns a view whose mutators apply only while {@code sessionId} is the
     * current session.
     */
    public SessionProgress forSession(String sessionId) {
        return new SessionProgress(sessionId);
    }

    public synchronized boolean isCurrentSession(String sessionId) {
        return session != null && session.getSessionId().equals(sessionId);
    }

    private synchronized void runIfCurrent(String sessionId, String action, Runnable mutation) {
        if (!isCurrentSession(sessionId)) {
            log.debug("[Progress] Ignoring {} from stale session {}", action, sessionId);
            return;
        }
        mutation.run();
    }

    public final class SessionProgress {

        private final String sessionId;

        private SessionProgress(String sessionId) {
            this.sessionId = sessionId;
        }

        public String getSessionId() {
            return sessionId;
        }

        public void completeSession() {
            runIfCurrent(sessionId, "completeSession", AgentProgressService.this::completeSession);
        }

        public void failSession(String error) {
            runIfCurrent(sessionId, "failSession", () -> AgentProgressService.this.failSession(error));
        }

        public void startPhase(String phaseId) {
            runIfCurrent(sessionId, "startPhase", () -> AgentProgressService.this.startPhase(phaseId));
        }

        public void completePhase(String phaseId, Map<String, Object> metadata) {
            runIfCurrent(sessionId, "completePhase",
                    () -> AgentProgressService.this.completePhase(phaseId, metadata));
        }

        public void failPhase(String phaseId, String error) {
            runIfCurrent(sessionId, "failPhase", () -> AgentProgressService.this.failPhase(phaseId, error));
        }

        public void skipPhase(String phaseId) {
            runIfCurrent(sessionId, "skipPhase", () -> AgentProgressService.this.skipPhase(phaseId));
        }

        public void cancelPhase(String phaseId, String reason) {
            runIfCurrent(sessionId, "cancelPhase", () -> AgentProgressService.this.cancelPhase(phaseId, reason));
        }

        /**
         * @return the generated id, or {@code null} when this session is no
         *         longer current
         */
        public String addToolCall(String name, String phaseId, Map<String, Object> input) {
            synchronized (AgentProgressService.this) {
                if (!isCurrentSession(sessionId)) {
                    log.debug("[Progress] Ignoring addToolCall from stale session {}", sessionId);
                    return null;
                }
                return AgentProgressService.this.addToolCall(name, phaseId, input);
            }
        }

        public void startToolCall(String toolCallId) {
            runIfCurrent(sessionId, "startToolCall", () -> AgentProgressService.this.startToolCall(toolCallId));
        }

        public void completeToolCall(String toolCallId, String output) {
            runIfCurrent(sessionId, "completeToolCall",
                    () -> AgentProgressService.this.completeToolCall(toolCallId, output));
        }

        public void failToolCall(String toolCallId, String error) {
            runIfCurrent(sessionId, "failToolCall",
                    () -> AgentProgressService.this.failToolCall(toolCallId, error));
        }
    }

    // ==================== Queries ====================

    /**
     * Snapshot of the current session, detached from internal state.
     */
    public synchronized Optional<ProgressSession> getCurrentSession() {
        if (session == null) {
            return Optional.empty();
        }
        List<AgentPhase> phases = session.getPhases().stream()
                .map(phase -> phase.toBuilder()
                        .metadata(phase.getMetadata() != null ? new LinkedHashMap<>(phase.getMetadata())
                                : new LinkedHashMap<>())
                        .build())
                .toList();
        List<ToolCall> toolCalls = session.getToolCalls().stream()
                .map(toolCall -> toolCall.toBuilder().build())
                .toList();
        return Optional.of(session.toBuilder()
                .phases(new ArrayList<>(phases))
                .toolCalls(new ArrayList<>(toolCalls))
                .build());
    }

    public synchronized Optional<AgentPhase> getCurrentPhase() {
        if (session == null || session.getCurrentPhaseId() == null) {
            return Optional.empty();
        }
        return findPhase(session.getCurrentPhaseId()).map(phase -> phase.toBuilder().build());
    }

    public synchronized Optional<AgentPhase> getPhaseById(String phaseId) {
        return findPhase(phaseId).map(phase -> phase.toBuilder().build());
    }

    public synchronized List<ToolCall> getActiveToolCalls() {
        if (session == null) {
            return List.of();
        }
        return session.getToolCalls().stream()
                .filter(toolCall -> toolCall.getStatus() == ToolCall.ToolCallStatus.RUNNING)
                .map(toolCall -> toolCall.toBuilder().build())
                .toList();
    }

    public synchronized List<AgentPhase> getCompletedPhases() {
        if (session == null) {
            return List.of();
        }
        return session.getPhases().stream()
                .filter(phase -> phase.getStatus() == AgentPhase.PhaseStatus.COMPLETED)
                .map(phase -> phase.toBuilder().build())
                .toList();
    }

    /**
     * Elapsed time from session start to its end, or to now while running.
     */
    public synchronized Duration getSessionDuration() {
        if (session == null || session.getStartTime() == null) {
            return Duration.ZERO;
        }
        Instant end = session.getEndTime() != null ? session.getEndTime() : now();
        return Duration.between(session.getStartTime(), end);
    }

    // ==================== Internals ====================

    private Optional<AgentPhase> findPhase(String phaseId) {
        if (session == null || phaseId == null) {
            return Optional.empty();
        }
        return session.getPhases().stream()
                .filter(phase -> phaseId.equals(phase.getId()))
                .findFirst();
    }

    private Optional<ToolCall> findToolCall(String toolCallId) {
        if (session == null || toolCallId == null) {
            return Optional.empty();
        }
        return session.getToolCalls().stream()
                .filter(toolCall -> toolCallId.equals(toolCall.getId()))
                .findFirst();
    }

    private void finishToolCall(ToolCall toolCall, Instant endTime) {
        toolCall.setEndTime(endTime);
        if (toolCall.getStartTime() != null) {
            toolCall.setDuration(Duration.between(toolCall.getStartTime(), endTime).toMillis());
        }
    }

    private void recalculateTotalProgress() {
        List<AgentPhase> phases = session.getPhases();
        if (phases.isEmpty()) {
            session.setTotalProgress(0);
            return;
        }
        double sum = 0;
        for (AgentPhase phase : phases) {
            sum += phase.getProgress();
        }
        session.setTotalProgress((int) Math.round(sum / phases.size()));
    }

    private static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private Map<String, Object> phasePayload(AgentPhase phase) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phaseId", phase.getId());
        payload.put("status", phase.getStatus().name());
        payload.put("progress", phase.getProgress());
        payload.put("totalProgress", session.getTotalProgress());
        if (phase.getError() != null) {
            payload.put("error", phase.getError());
        }
        return payload;
    }

    private static Map<String, Object> toolCallPayload(ToolCall toolCall) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolCallId", toolCall.getId());
        payload.put("name", toolCall.getName());
        payload.put("phaseId", toolCall.getPhaseId());
        payload.put("status", toolCall.getStatus().name());
        if (toolCall.getDuration() != null) {
            payload.put("duration", toolCall.getDuration());
        }
        if (toolCall.getError() != null) {
            payload.put("error", toolCall.getError());
        }
        return payload;
    }

    private static Map<String, Object> errorPayload(String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", error);
        return payload;
    }

    private void publish(RuntimeEventType type, Map<String, Object> payload) {
        eventBus.publish(RuntimeEvent.builder()
                .type(type)
                .timestamp(now())
                .sessionId(session.getSessionId())
                .payload(payload)
                .build());
    }
}
