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

import me.golemcore.tripagent.adapter.inbound.web.dto.AnswerRequest;
import me.golemcore.tripagent.adapter.inbound.web.dto.QuestionStateResponse;
import me.golemcore.tripagent.domain.model.Question;
import me.golemcore.tripagent.domain.model.QuestionSequence;
import me.golemcore.tripagent.domain.model.ValidationResult;
import me.golemcore.tripagent.domain.service.ContextValidator;
import me.golemcore.tripagent.domain.service.QuestionCollectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Step-by-step collection of missing trip details.
 */
@RestController
@RequestMapping("/api/questions")
@RequiredArgsConstructor
public class QuestionsController {

    private final ContextValidator contextValidator;
    private final QuestionCollectionService questionCollectionService;

    /**
     * Validates the given context and starts collecting whatever is missing.
     */
    @PostMapping("/start")
    public Mono<ResponseEntity<QuestionStateResponse>> start(
            @RequestBody(required = false) Map<String, Object> context) {
        ValidationResult validation = contextValidator.validate(context != null ? context : Map.of());
        questionCollectionService.startCollection(validation.missingInfo());
        return Mono.just(ResponseEntity.ok(buildState()));
    }

    @GetMapping("/current")
    public Mono<ResponseEntity<Question>> current() {
        return Mono.just(questionCollectionService.getCurrentQuestion()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build()));
    }

    @PostMapping("/{questionId}/answer")
    public Mono<ResponseEntity<QuestionStateResponse>> answer(@PathVariable String questionId,
            @RequestBody AnswerRequest request) {
        if (!questionCollectionService.answerQuestion(questionId, request.answer())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Question not found: " + questionId);
        }
        questionCollectionService.nextQuestion();
        return Mono.just(ResponseEntity.ok(buildState()));
    }

    @PostMapping("/{questionId}/skip")
    public Mono<ResponseEntity<QuestionStateResponse>> skip(@PathVariable String questionId) {
        if (!questionCollectionService.skipQuestion(questionId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Question cannot be skipped: " + questionId);
        }
        questionCollectionService.nextQuestion();
        return Mono.just(ResponseEntity.ok(buildState()));
    }

    @GetMapping("/context")
    public Mono<ResponseEntity<Map<String, Object>>> context() {
        return Mono.just(ResponseEntity.ok(questionCollectionService.getCompletedContext()));
    }

    private QuestionStateResponse buildState() {
        QuestionSequence sequence = questionCollectionService.snapshot();
        return new QuestionStateResponse(sequence.getQuestions(), sequence.getCurrentIndex(),
                sequence.isComplete(), questionCollectionService.getCompletedContext());
    }
}
