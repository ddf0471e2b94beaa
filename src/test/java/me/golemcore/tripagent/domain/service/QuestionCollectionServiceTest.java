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

import me.golemcore.tripagent.domain.model.BudgetRange;
import me.golemcore.tripagent.domain.model.MissingInfo;
import me.golemcore.tripagent.domain.model.Question;
import me.golemcore.tripagent.domain.model.QuestionSequence;
import me.golemcore.tripagent.domain.model.TripContextKeys;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuestionCollectionServiceTest {

    private QuestionCollectionService service;
    private QuestionSequence started;

    @BeforeEach
    void setUp() {
        QuestionGenerator generator = new QuestionGenerator(new TripAgentProperties(), new TripInfoExtractor(),
                Clock.fixed(Instant.parse("2026-05-01T00:00:00Z"), ZoneOffset.UTC));
        service = new QuestionCollectionService(generator);
        started = service.startCollection(List.of(
                MissingInfo.builder().field(TripContextKeys.DESTINATION).priority(MissingInfo.Priority.REQUIRED)
                        .build(),
                MissingInfo.builder().field(TripContextKeys.DAYS).priority(MissingInfo.Priority.REQUIRED).build(),
                MissingInfo.builder().field(TripContextKeys.BUDGET).priority(MissingInfo.Priority.RECOMMENDED)
                        .build()));
    }

    private String idOf(int index) {
        return started.getQuestions().get(index).getId();
    }

    @Test
    void shouldStartCollecting() {
        assertTrue(service.isCollecting());
        assertFalse(service.isComplete());
        assertEquals(TripContextKeys.DESTINATION, service.getCurrentQuestion().orElseThrow().getContextKey());
        assertTrue(service.getContext().isEmpty());
    }

    @Test
    void shouldParseStringAnswersIntoContext() {
        assertTrue(service.answerQuestion(idOf(0), "巴黎"));
        assertTrue(service.answerQuestion(idOf(1), "10 days"));

        assertEquals(Map.of(TripContextKeys.DESTINATION, "Paris", TripContextKeys.DAYS, 10), service.getContext());
        assertTrue(service.isComplete());
    }

    @Test
    void shouldAcceptBudgetAnswerWithOutOfRangeAmount() {
        assertDoesNotThrow(() -> service.answerQuestion(idOf(2), "about 99999999999999999999 USD"));

        assertFalse(service.getContext().containsKey(TripContextKeys.BUDGET));
        assertEquals(Question.QuestionStatus.ANSWERED, started.getQuestions().get(2).getStatus());
    }

    @Test
    void shouldStoreNonStringAnswersAsIs() {
        BudgetRange budget = new BudgetRange(100, 900, "EUR");

        service.answerQuestion(idOf(2), budget);

        assertEquals(budget, service.getContext().get(TripContextKeys.BUDGET));
    }

    @Test
    void shouldRejectUnknownQuestion() {
        assertFalse(service.answerQuestion("q-nope", "x"));
        assertFalse(service.skipQuestion("q-nope"));
    }

    @Test
    void shouldRefuseToSkipRequiredQuestion() {
        assertFalse(service.skipQuestion(idOf(0)));

        assertEquals(Question.QuestionStatus.ACTIVE, service.snapshot().getQuestions().get(0).getStatus());
    }

    @Test
    void shouldSkipOptionalQuestionWithoutWritingContext() {
        assertTrue(service.skipQuestion(idOf(2)));

        Question skipped = service.snapshot().getQuestions().get(2);
        assertEquals(Question.QuestionStatus.ANSWERED, skipped.getStatus());
        assertNull(skipped.getAnswer());
        assertFalse(service.getContext().containsKey(TripContextKeys.BUDGET));
        assertFalse(service.getCompletedContext().containsKey(TripContextKeys.BUDGET));
    }

    @Test
    void shouldNotOverwriteContextWithBlankAnswer() {
        service.updateContext(TripContextKeys.DESTINATION, "Rome");

        service.answerQuestion(idOf(0), "   ");

        assertEquals("Rome", service.getContext().get(TripContextKeys.DESTINATION));
    }

    @Test
    void shouldStepThroughQuestionsWithinBounds() {
        assertEquals(TripContextKeys.DAYS, service.nextQuestion().orElseThrow().getContextKey());
        assertEquals(TripContextKeys.BUDGET, service.nextQuestion().orElseThrow().getContextKey());
        assertEquals(TripContextKeys.BUDGET, service.nextQuestion().orElseThrow().getContextKey());

        List<Question> questions = service.snapshot().getQuestions();
        assertEquals(Question.QuestionStatus.PENDING, questions.get(0).getStatus());
        assertEquals(Question.QuestionStatus.ACTIVE, questions.get(2).getStatus());

        service.previousQuestion();
        service.previousQuestion();
        assertEquals(TripContextKeys.DESTINATION, service.previousQuestion().orElseThrow().getContextKey());
    }

    @Test
    void shouldKeepAnsweredStatusWhenNavigating() {
        service.answerQuestion(idOf(0), "Tokyo");
        service.nextQuestion();
        service.previousQuestion();

        assertEquals(Question.QuestionStatus.ANSWERED, service.getCurrentQuestion().orElseThrow().getStatus());
    }

    @Test
    void shouldCollectCompletedContextFromAnsweredQuestions() {
        service.answerQuestion(idOf(0), "Seoul");
        service.answerQuestion(idOf(2), "$2000");

        Map<String, Object> completed = service.getCompletedContext();
        assertEquals("Seoul", completed.get(TripContextKeys.DESTINATION));
        assertEquals(new BudgetRange(1600, 2400, "USD"), completed.get(TripContextKeys.BUDGET));
        assertFalse(completed.containsKey(TripContextKeys.DAYS));
    }

    @Test
    void shouldResetState() {
        service.answerQuestion(idOf(0), "Seoul");

        service.reset();

        assertFalse(service.isCollecting());
        assertTrue(service.getContext().isEmpty());
        assertTrue(service.getCurrentQuestion().isEmpty());
    }
}
