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

import me.golemcore.tripagent.domain.model.AgentEvent;
import me.golemcore.tripagent.domain.model.AgentMessage;
import me.golemcore.tripagent.domain.model.AgentRequest;
import me.golemcore.tripagent.domain.model.AgentRole;
import me.golemcore.tripagent.domain.model.ChatMessage;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.PhaseDefinition;
import me.golemcore.tripagent.domain.model.QuestionSequence;
import me.golemcore.tripagent.domain.model.ToolExecutionContext;
import me.golemcore.tripagent.domain.model.TripAgentException;
import me.golemcore.tripagent.domain.model.TripContextKeys;
import me.golemcore.tripagent.domain.model.TripPlan;
import me.golemcore.tripagent.domain.model.ValidationResult;
import me.golemcore.tripagent.domain.system.LlmErrorClassifier;
import me.golemcore.tripagent.domain.system.TripContextValues;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import me.golemcore.tripagent.port.outbound.LlmPort;
import me.golemcore.tripagent.port.outbound.TripStoragePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one user turn through the agent roles.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Validate the accumulated context. If a required field is missing, emit a
 * single {@code NEED_MORE_INFO} event and stop.
 * <li>Open a progress session with one phase per {@link AgentRole}. Roles the
 * intent does not select are skipped.
 * <li>For each selected role: run its tool plan, then stream the model output
 * as {@code DELTA} messages.
 * <li>Complete the session, save the trip and emit {@code DONE}.
 * </ol>
 *
 * <p>
 * Without a model, or when the model fails before producing content, a role
 * emits a labeled offline fallback. A failure after content has streamed fails
 * only that phase. Cancelling the subscription cancels the current phase.
 */
@Service
@Slf4j
public class TripOrchestrator {

    static final String CONTEXT_TRIP_ID = "tripId";
    private static final String CANCELLED_BY_SUBSCRIBER = "subscriber cancelled the stream";
    private static final AtomicLong SESSION_SEQUENCE = new AtomicLong();

    private final ContextValidator contextValidator;
    private final QuestionGenerator questionGenerator;
    private final AgentProgressService progressService;
    private final IntentAnalyzer intentAnalyzer;
    private final PromptBuilder promptBuilder;
    private final FallbackResponseGenerator fallbackGenerator;
    private final ToolServerService toolServerService;
    private final LlmConfigService llmConfigService;
    private final LlmPort llmPort;
    private final TripStoragePort tripStoragePort;
    private final TripAgentProperties properties;
    private final Clock clock;

    public TripOrchestrator(ContextValidator contextValidator, QuestionGenerator questionGenerator,
            AgentProgressService progressService, IntentAnalyzer intentAnalyzer, PromptBuilder promptBuilder,
            FallbackResponseGenerator fallbackGenerator, ToolServerService toolServerService,
            LlmConfigService llmConfigService, LlmPort llmPort, TripStoragePort tripStoragePort,
            TripAgentProperties properties, Clock clock) {
        this.contextValidator = contextValidator;
        this.questionGenerator = questionGenerator;
        this.progressService = progressService;
        this.intentAnalyzer = intentAnalyzer;
        this.promptBuilder = promptBuilder;
        this.fallbackGenerator = fallbackGenerator;
        this.toolServerService = toolServerService;
        this.llmConfigService = llmConfigService;
        this.llmPort = llmPort;
        this.tripStoragePort = tripStoragePort;
        this.properties = properties;
        this.clock = clock;
    }

    public Flux<AgentEvent> process(AgentRequest request) {
        return Flux.defer(() -> {
            ValidationResult validation = contextValidator.validate(request.getUserMessage(),
                    request.getExistingContext(), request.getPreferences());
            if (!validation.complete()) {
                QuestionSequence questions = questionGenerator.generate(validation.missingInfo());
                log.info("[Orchestrator] Context incomplete, asking {} questions", questions.getQuestions().size());
                return Flux.just(AgentEvent.needMoreInfo(questions.getQuestions(), validation.mergedContext()));
            }
            return runPipeline(request, validation.mergedContext());
        });
    }

    // ==================== Pipeline ====================

    private Flux<AgentEvent> runPipeline(AgentRequest request, Map<String, Object> context) {
        String sessionId = "session-" + clock.millis() + "-" + SESSION_SEQUENCE.incrementAndGet();
        RunState state = new RunState(progressService.forSession(sessionId), request, context,
                intentAnalyzer.analyze(request.getUserMessage()), llmConfigService.resolve());
        List<PhaseDefinition> phases = Arrays.stream(AgentRole.values())
                .map(AgentRole::toPhaseDefinition)
                .toList();
        progressService.startSession(sessionId, phases);
        log.info("[Orchestrator] Session {} started, intent={}, roles={}", state.sessionId,
                state.intent.label(), state.intent.roles());

        Flux<AgentEvent> roles = Flux.fromArray(AgentRole.values())
                .concatMap(role -> state.intent.includes(role) ? runRole(role, state) : skipRole(role, state));

        return roles
                .concatWith(Flux.defer(() -> finish(state)))
                .doOnCancel(() -> cancel(state))
                .onErrorResume(error -> {
                    TripAgentException classified = LlmErrorClassifier.classify(error);
                    log.error("[Orchestrator] Session {} failed: {}", state.sessionId, classified.getMessage(),
                            error);
                    state.progress.failSession(classified.getMessage());
                    return Flux.just(event(roleOrSupervisor(state), AgentMessage.MessageType.ERROR,
                            "Planning failed: " + classified.getMessage()));
                });
    }

    private Flux<AgentEvent> skipRole(AgentRole role, RunState state) {
        return Flux.defer(() -> {
            state.progress.skipPhase(role.getId());
            return Flux.empty();
        });
    }

    private Flux<AgentEvent> runRole(AgentRole role, RunState state) {
        return Flux.defer(() -> {
            state.currentRole.set(role);
            state.progress.startPhase(role.getId());
            if (role == AgentRole.SUPERVISOR) {
                return runSupervisor(state);
            }
            Flux<AgentEvent> tools = Flux.fromIterable(toolPlan(role, state.context))
                    .concatMap(invocation -> runTool(role, invocation, state));
            return Flux.just(event(role, AgentMessage.MessageType.THOUGHT, role.getPhaseDescription() + "..."))
                    .concatWith(tools)
                    .concatWith(Flux.defer(() -> streamRole(role, state)));
        });
    }

    private Flux<AgentEvent> runSupervisor(RunState state) {
        AgentRole role = AgentRole.SUPERVISOR;
        String destination = TripContextValues.toText(state.context.get(TripContextKeys.DESTINATION));
        int days = TripContextValues.toDays(state.context.get(TripContextKeys.DAYS));
        List<String> delegated = state.intent.roles().stream()
                .filter(selected -> selected != AgentRole.SUPERVISOR)
                .map(AgentRole::getId)
                .toList();
        String summary = "Destination: " + destination + ", days: " + days;
        state.outputs.put(role, summary);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("intent", state.intent.label());
        metadata.put("delegated", delegated);
        state.progress.completePhase(role.getId(), metadata);
        return Flux.just(
                event(role, AgentMessage.MessageType.RESULT, "Intent: " + state.intent.label()),
                event(role, AgentMessage.MessageType.RESULT, summary),
                event(role, AgentMessage.MessageType.ACTION, "Delegating to: " + String.join(", ", delegated)));
    }

    // ==================== Tools ====================

    record ToolInvocation(String name, Map<String, Object> arguments) {
    }

    List<ToolInvocation> toolPlan(AgentRole role, Map<String, Object> context) {
        String destination = TripContextValues.toText(context.get(TripContextKeys.DESTINATION));
        if (destination == null) {
            return List.of();
        }
        return switch (role) {
        case PLANNER -> List.of(
                new ToolInvocation("get_current_date", Map.of()),
                new ToolInvocation("search_places", Map.of(
                        "query", attractionQuery(context),
                        "location", destination,
                        "type", "attraction")));
        case RECOMMENDER -> {
            Map<String, Object> hotelArgs = new LinkedHashMap<>();
            hotelArgs.put("location", destination);
            String startDate = TripContextValues.toText(context.get(TripContextKeys.START_DATE));
            if (startDate != null) {
                hotelArgs.put("checkIn", startDate);
            }
            yield List.of(
                    new ToolInvocation("get_weather", Map.of("location", destination)),
                    new ToolInvocation("search_hotels", hotelArgs),
                    new ToolInvocation("search_places", Map.of(
                            "query", "restaurant",
                            "location", destination,
                            "type", "restaurant")));
        }
        case SUPERVISOR, BOOKING, DOCUMENT -> List.of();
        };
    }

    private static String attractionQuery(Map<String, Object> context) {
        List<String> interests = TripContextValues.toStringList(context.get(TripContextKeys.INTERESTS));
        return interests.isEmpty() ? "top attractions" : String.join(" ", interests) + " attractions";
    }

    private Flux<AgentEvent> runTool(AgentRole role, ToolInvocation invocation, RunState state) {
        return Flux.defer(() -> {
            String toolCallId = state.progress.addToolCall(invocation.name(), role.getId(),
                    invocation.arguments());
            state.progress.startToolCall(toolCallId);
            ToolExecutionContext executionContext = ToolExecutionContext.builder()
                    .sessionId(state.sessionId)
                    .phaseId(role.getId())
                    .userId(state.request.getUserId())
                    .build();

            AgentEvent action = event(role, AgentMessage.MessageType.ACTION,
                    "Calling tool: " + invocation.name() + invocation.arguments());
            Mono<AgentEvent> outcome = Mono
                    .fromFuture(() -> toolServerService.callTool(invocation.name(),
                            new LinkedHashMap<>(invocation.arguments()), executionContext))
                    .map(result -> {
                        String text = result.getText();
                        if (result.isError()) {
                            state.progress.failToolCall(toolCallId, text);
                            return event(role, AgentMessage.MessageType.ERROR, invocation.name() + ": " + text);
                        }
                        state.progress.completeToolCall(toolCallId, text);
                        state.toolOutputs(role).add(invocation.name() + ": " + text);
                        return event(role, AgentMessage.MessageType.RESULT, invocation.name() + " completed");
                    })
                    .onErrorResume(error -> {
                        TripAgentException classified = LlmErrorClassifier.classify(error);
                        state.progress.failToolCall(toolCallId, classified.getMessage());
                        log.warn("[Orchestrator] Tool {} failed: {}", invocation.name(), classified.getMessage());
                        return Mono.just(event(role, AgentMessage.MessageType.ERROR,
                                invocation.name() + " unavailable: " + classified.getMessage()));
                    });
            return Flux.just(action).concatWith(outcome);
        });
    }

    // ==================== Model ====================

    private Flux<AgentEvent> streamRole(AgentRole role, RunState state) {
        if (state.llmConfig.isEmpty()) {
            return fallback(role, state, "model is not configured");
        }
        List<ChatMessage> messages = promptBuilder.build(role, state.context, state.priorOutputs(),
                state.toolOutputs(role), state.request.getConversationHistory());
        StringBuilder output = new StringBuilder();
        AtomicBoolean contentStarted = new AtomicBoolean(false);

        Flux<AgentEvent> deltas = llmPort.streamChat(messages, state.llmConfig.get())
                .filter(chunk -> !chunk.isDone() && chunk.getContent() != null && !chunk.getContent().isEmpty())
                .map(chunk -> {
                    contentStarted.set(true);
                    output.append(chunk.getContent());
                    return event(role, AgentMessage.MessageType.DELTA, chunk.getContent());
                });

        return deltas
                .concatWith(Flux.defer(() -> {
                    state.outputs.put(role, output.toString());
                    state.progress.completePhase(role.getId(), Map.of("chars", output.length()));
                    return Flux.just(event(role, AgentMessage.MessageType.RESULT, role.getPhaseName() + " done"));
                }))
                .onErrorResume(error -> {
                    TripAgentException classified = LlmErrorClassifier.classify(error);
                    if (!contentStarted.get()) {
                        log.warn("[Orchestrator] Model failed for {} before content: {}", role.getId(),
                                classified.getMessage());
                        return fallback(role, state, classified.getMessage());
                    }
                    log.warn("[Orchestrator] Model failed mid-stream for {}: {}", role.getId(),
                            classified.getMessage());
                    state.outputs.put(role, output.toString());
                    state.progress.failPhase(role.getId(), classified.getMessage());
                    return Flux.just(event(role, AgentMessage.MessageType.ERROR,
                            "Model stream interrupted: " + classified.getMessage()));
                });
    }

    private Flux<AgentEvent> fallback(AgentRole role, RunState state, String reason) {
        return Flux.defer(() -> {
            String text = fallbackGenerator.generate(role, state.context, state.toolOutputs(role));
            state.outputs.put(role, text);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("fallback", true);
            metadata.put("reason", reason);
            state.progress.completePhase(role.getId(), metadata);
            return Flux.just(
                    event(role, AgentMessage.MessageType.THOUGHT, "Model unavailable (" + reason + ")"),
                    event(role, AgentMessage.MessageType.RESULT, text));
        });
    }

    // ==================== Completion ====================

    private Flux<AgentEvent> finish(RunState state) {
        state.progress.completeSession();
        state.currentRole.set(null);
        log.info("[Orchestrator] Session {} completed", state.sessionId);
        if (!properties.getStorage().isEnabled()) {
            return Flux.just(AgentEvent.done(state.sessionId, state.context));
        }

        TripPlan plan = toTripPlan(state);
        Map<String, Object> finalContext = new LinkedHashMap<>(state.context);
        return Mono.fromFuture(() -> tripStoragePort.saveTrip(plan))
                .then(Mono.fromCallable(() -> {
                    finalContext.put(CONTEXT_TRIP_ID, plan.getId());
                    return AgentEvent.done(state.sessionId, finalContext);
                }))
                .onErrorResume(error -> {
                    log.warn("[Orchestrator] Failed to save trip {}: {}", plan.getId(), error.getMessage());
                    return Mono.just(AgentEvent.done(state.sessionId, state.context));
                })
                .flux();
    }

    private TripPlan toTripPlan(RunState state) {
        Map<String, String> agentOutputs = new LinkedHashMap<>();
        state.outputs.forEach((role, output) -> agentOutputs.put(role.getId(), output));
        return TripPlan.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(state.sessionId)
                .userId(state.request.getUserId())
                .destination(TripContextValues.toText(state.context.get(TripContextKeys.DESTINATION)))
                .days(TripContextValues.toDays(state.context.get(TripContextKeys.DAYS)))
                .context(new LinkedHashMap<>(state.context))
                .agentOutputs(agentOutputs)
                .createdAt(Instant.now(clock))
                .build();
    }

    private void cancel(RunState state) {
        AgentRole role = state.currentRole.get();
        if (role == null) {
            return;
        }
        log.info("[Orchestrator] Session {} cancelled during {}", state.sessionId, role.getId());
        state.progress.cancelPhase(role.getId(), CANCELLED_BY_SUBSCRIBER);
    }

    private static AgentRole roleOrSupervisor(RunState state) {
        AgentRole role = state.currentRole.get();
        return role != null ? role : AgentRole.SUPERVISOR;
    }

    private AgentEvent event(AgentRole role, AgentMessage.MessageType type, String content) {
        return AgentEvent.message(AgentMessage.builder()
                .role(role)
                .type(type)
                .content(content)
                .timestamp(Instant.now(clock))
                .build());
    }

    private static final class RunState {

        private final AgentProgressService.SessionProgress progress;
        private final String sessionId;
        private final AgentRequest request;
        private final Map<String, Object> context;
        private final IntentAnalyzer.Intent intent;
        private final Optional<LlmConfig> llmConfig;
        private final Map<AgentRole, String> outputs = Collections.synchronizedMap(new EnumMap<>(AgentRole.class));
        private final Map<AgentRole, List<String>> toolOutputs = Collections
                .synchronizedMap(new EnumMap<>(AgentRole.class));
        private final AtomicReference<AgentRole> currentRole = new AtomicReference<>();

        private RunState(AgentProgressService.SessionProgress progress, AgentRequest request,
                Map<String, Object> context, IntentAnalyzer.Intent intent, Optional<LlmConfig> llmConfig) {
            this.progress = progress;
            this.sessionId = progress.getSessionId();
            this.request = request;
            this.context = context;
            this.intent = intent;
            this.llmConfig = llmConfig;
        }

        private List<String> toolOutputs(AgentRole role) {
            return toolOutputs.computeIfAbsent(role, key -> Collections.synchronizedList(new ArrayList<>()));
        }

        private Map<AgentRole, String> priorOutputs() {
            Map<AgentRole, String> copy = new EnumMap<>(AgentRole.class);
            synchronized (outputs) {
                copy.putAll(outputs);
            }
            return copy;
        }
    }
}
