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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuestionGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:30:00Z");

    private TripAgentProperties properties;
    private QuestionGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new TripAgentProperties();
        generator = new QuestionGenerator(properties, new TripInfoExtractor(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static MissingInfo missing(String field, MissingInfo.Priority priority) {
        return MissingInfo.builder().field(field).priority(priority).build();
    }

    private static Question question(String contextKey) {
        return Question.builder().id("q").contextKey(contextKey).build();
    }

    // ==================== Generation ====================

    @Test
    void shouldOrderRequiredQuestionsFirstAndActivateFirst() {
        QuestionSequence sequence = generator.generate(List.of(
                missing(TripContextKeys.BUDGET, MissingInfo.Priority.RECOMMENDED),
                missing(TripContextKeys.DESTINATION, MissingInfo.Priority.REQUIRED),
                missing(TripContextKeys.START_DATE, MissingInfo.Priority.RECOMMENDED),
                missing(TripContextKeys.DAYS, MissingInfo.Priority.REQUIRED)));

        List<Question> questions = sequence.getQuestions();
        assertEquals(List.of(TripContextKeys.DESTINATION, TripContextKeys.DAYS, TripContextKeys.BUDGET,
                TripContextKeys.START_DATE), questions.stream().map(Question::getContextKey).toList());
        assertEquals(Question.QuestionStatus.ACTIVE, questions.get(0).getStatus());
        assertTrue(questions.stream().skip(1).allMatch(q -> q.getStatus() == Question.QuestionStatus.PENDING));
        assertEquals(0, sequence.getCurrentIndex());
        assertEquals(3, questions.get(3).getOrder());
        assertTrue(questions.get(0).isRequired());
        assertFalse(questions.get(2).isRequired());
    }

    @Test
    void shouldUseTemplateTextTypeAndOptions() {
        QuestionSequence sequence = generator.generate(List.of(
                missing(TripContextKeys.START_DATE, MissingInfo.Priority.RECOMMENDED),
                missing(TripContextKeys.INTERESTS, MissingInfo.Priority.RECOMMENDED)));

        Question date = sequence.getQuestions().get(0);
        assertEquals("When are you planning to start your trip?", date.getText());
        assertEquals(Question.QuestionType.DATE, date.getType());
        assertTrue(date.getOptions().contains("Next week"));
        assertEquals("q-startDate-" + NOW.toEpochMilli() + "-0", date.getId());
        assertEquals(Question.QuestionType.MULTI_CHOICE, sequence.getQuestions().get(1).getType());
    }

    @Test
    void shouldFallBackToGenericTextForUnknownField() {
        Question question = generator.generate(List.of(missing("travelers", MissingInfo.Priority.RECOMMENDED)))
                .getQuestions().get(0);

        assertEquals("Could you tell me more about travelers?", question.getText());
        assertEquals(Question.QuestionType.TEXT, question.getType());
    }

    @Test
    void shouldProduceEmptySequenceForNothingMissing() {
        QuestionSequence sequence = generator.generate(List.of());

        assertTrue(sequence.getQuestions().isEmpty());
        assertTrue(sequence.isComplete());
        assertTrue(sequence.getCurrent().isEmpty());
    }

    // ==================== Answer parsing ====================

    @Test
    void shouldParseDestinationAndDays() {
        assertEquals("Tokyo", generator.parseAnswer(question(TripContextKeys.DESTINATION), "东京", Map.of()));
        assertEquals("Lisbon", generator.parseAnswer(question(TripContextKeys.DESTINATION), " Lisbon ", Map.of()));
        assertEquals(7, generator.parseAnswer(question(TripContextKeys.DAYS), "7 days", Map.of()));
        assertEquals(5, generator.parseAnswer(question(TripContextKeys.DAYS), "a week or so", Map.of()));
        assertNull(generator.parseAnswer(question(TripContextKeys.DAYS), "  ", Map.of()));
    }

    @Test
    void shouldParseBudgetShapes() {
        assertEquals(new BudgetRange(1000, 3000, "USD"), generator.parseBudget("Mid-range ($1000-$3000)"));
        assertEquals(new BudgetRange(0, 1000, "USD"), generator.parseBudget("Budget (<$1000)"));
        assertEquals(new BudgetRange(3000, 6000, "USD"), generator.parseBudget("more than 3000"));
        assertEquals(new BudgetRange(0, 5000, "CNY"), generator.parseBudget("5000元以下"));
        assertEquals(new BudgetRange(8000, 12000, "CNY"), generator.parseBudget("¥10,000"));
        assertNull(generator.parseBudget("whatever works"));
    }

    @Test
    void shouldSaturateOpenEndedBudgetInsteadOfOverflowing() {
        BudgetRange range = generator.parseBudget("above 9223372036854775807");

        assertEquals(Long.MAX_VALUE, range.getMin());
        assertEquals(Long.MAX_VALUE, range.getMax());
        assertNull(generator.parseBudget("between 10 and 99999999999999999999"));
    }

    @Test
    void shouldParseRelativeAndIsoDates() {
        assertEquals("2026-05-02", generator.parseDate("Tomorrow"));
        assertEquals("2026-05-03", generator.parseDate("后天"));
        assertEquals("2026-05-01", generator.parseDate("今天"));
        assertEquals("2026-05-04", generator.parseDate("This week"));
        assertEquals("2026-05-08", generator.parseDate("下周"));
        assertEquals("2026-06-01", generator.parseDate("Next month"));
        assertEquals("2026-07-14", generator.parseDate("around 2026-07-14 I think"));
        assertNull(generator.parseDate("Not sure yet"));
        assertNull(generator.parseDate("2026-13-40"));
        assertNull(generator.parseDate("sometime"));
    }

    @Test
    void shouldMergeInterestsWithoutDuplicates() {
        Object parsed = generator.parseAnswer(question(TripContextKeys.INTERESTS), "Food, History and Art",
                Map.of(TripContextKeys.INTERESTS, List.of("History")));

        assertEquals(List.of("History", "Food", "Art"), parsed);
        assertEquals(List.of("美食体验", "历史文化", "购物"), generator.parsePreferences("美食体验、历史文化和购物", null));
    }
}
