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
import me.golemcore.tripagent.domain.system.TripContextValues;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns missing context fields into an ordered question sequence and parses
 * free-text answers back into typed context values.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QuestionGenerator {

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern PREFERENCE_SEPARATORS = Pattern.compile("[,，、/&]|\\s+and\\s+|和");

    private final TripAgentProperties properties;
    private final TripInfoExtractor extractor;
    private final Clock clock;

    /**
     * Builds one question per missing field, required fields first.
     */
    public QuestionSequence generate(List<MissingInfo> missingInfo) {
        String language = properties.getQuestions().getLanguage();
        List<MissingInfo> ordered = new ArrayList<>(missingInfo);
        ordered.sort(Comparator.comparing(MissingInfo::getPriority));

        long now = clock.millis();
        List<Question> questions = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            MissingInfo info = ordered.get(i);
            QuestionTemplates.Template template = QuestionTemplates.forField(info.getField(), language);
            List<String> options = info.getQuickReplies() != null && !info.getQuickReplies().isEmpty()
                    ? info.getQuickReplies()
                    : template.quickReplies();
            questions.add(Question.builder()
                    .id("q-" + info.getField() + "-" + now + "-" + i)
                    .text(template.text())
                    .type(QuestionTemplates.typeOf(info.getField()))
                    .options(options)
                    .required(info.isRequired())
                    .status(i == 0 ? Question.QuestionStatus.ACTIVE : Question.QuestionStatus.PENDING)
                    .contextKey(info.getField())
                    .order(i)
                    .build());
        }
        return QuestionSequence.builder()
                .questions(questions)
                .currentIndex(0)
                .build();
    }

    /**
     * Converts a raw answer into the value stored at the question's context key.
     *
     * @return the typed value, or {@code null} when the answer carries none
     */
    public Object parseAnswer(Question question, String raw, Map<String, Object> existingContext) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String answer = raw.trim();
        return switch (question.getContextKey()) {
        case TripContextKeys.DESTINATION -> extractor.normalizeDestination(answer).orElse(answer);
        case TripContextKeys.DAYS -> extractNumber(answer);
        case TripContextKeys.BUDGET -> parseBudget(answer);
        case TripContextKeys.START_DATE -> parseDate(answer);
        case TripContextKeys.INTERESTS -> parsePreferences(answer,
                existingContext != null ? existingContext.get(TripContextKeys.INTERESTS) : null);
        default -> question.getType() == Question.QuestionType.NUMBER ? extractNumber(answer) : answer;
        };
    }

    /**
     * First integer in the text, or {@code trip.questions.default-days}.
     */
    int extractNumber(String text) {
        int fallback = properties.getQuestions().getDefaultDays();
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return fallback;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    BudgetRange parseBudget(String text) {
        String currency = text.contains("¥") || text.contains("元") ? "CNY" : "USD";
        List<Long> values = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text.replace(",", ""));
        while (matcher.find()) {
            try {
                values.add(Long.parseLong(matcher.group()));
            } catch (NumberFormatException e) {
                log.debug("[Questions] Ignoring out-of-range budget amount: {}", matcher.group());
                return null;
            }
        }
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() >= 2) {
            long min = values.stream().mapToLong(Long::longValue).min().orElse(0);
            long max = values.stream().mapToLong(Long::longValue).max().orElse(0);
            return BudgetRange.builder().min(min).max(max).currency(currency).build();
        }

        long value = values.get(0);
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.contains("以下") || text.contains("<") || lower.contains("less") || lower.contains("below")
                || lower.contains("under")) {
            return BudgetRange.builder().min(0).max(value).currency(currency).build();
        }
        if (text.contains("以上") || text.contains(">") || lower.contains("more") || lower.contains("above")
                || lower.contains("over")) {
            return BudgetRange.builder().min(value).max(doubleSaturated(value)).currency(currency).build();
        }
        return BudgetRange.builder()
                .min(Math.round(value * 0.8))
                .max(Math.round(value * 1.2))
                .currency(currency)
                .build();
    }

    private static long doubleSaturated(long value) {
        try {
            return Math.multiplyExact(value, 2L);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * @return an ISO date string, or {@code null} when the answer is not a date
     */
    String parseDate(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock);
        if (lower.contains("not sure") || text.contains("暂不确定")) {
            return null;
        }
        if (text.contains("后天")) {
            return today.plusDays(2).toString();
        }
        if (lower.contains("tomorrow") || text.contains("明天")) {
            return today.plusDays(1).toString();
        }
        if (lower.contains("today") || text.contains("今天")) {
            return today.toString();
        }
        if (lower.contains("this week") || text.contains("本周")) {
            return today.plusDays(3).toString();
        }
        if (lower.contains("next week") || text.contains("下周")) {
            return today.plusWeeks(1).toString();
        }
        if (lower.contains("next month") || text.contains("下个月")) {
            return today.plusMonths(1).toString();
        }
        Matcher matcher = ISO_DATE.matcher(text);
        if (matcher.find()) {
            try {
                return LocalDate.parse(matcher.group()).toString();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    List<String> parsePreferences(String text, Object existing) {
        Set<String> combined = new LinkedHashSet<>(TripContextValues.toStringList(existing));
        for (String item : PREFERENCE_SEPARATORS.split(text)) {
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                combined.add(trimmed);
            }
        }
        return new ArrayList<>(combined);
    }
}
