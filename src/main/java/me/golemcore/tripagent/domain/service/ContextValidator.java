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
import me.golemcore.tripagent.domain.model.TripContextKeys;
import me.golemcore.tripagent.domain.model.TripInfo;
import me.golemcore.tripagent.domain.model.UserPreferences;
import me.golemcore.tripagent.domain.model.ValidationResult;
import me.golemcore.tripagent.domain.system.TripContextValues;
import me.golemcore.tripagent.infrastructure.config.TripAgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a trip context is complete enough to start planning.
 *
 * <p>
 * Precedence when merging: values already present in {@code existingContext}
 * win over values extracted from the current message. Extraction only fills
 * keys that are absent. Callers must pass back their full accumulated context.
 *
 * <p>
 * {@code destination} and a positive {@code days} are required. Budget, start
 * date and interests are recommended unless configured as required under
 * {@code trip.questions.*}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextValidator {

    private final TripInfoExtractor extractor;
    private final TripAgentProperties properties;

    public ValidationResult validate(String message, Map<String, Object> existingContext,
            UserPreferences preferences) {
        TripInfo extracted = extractor.extract(message);
        Map<String, Object> merged = merge(extracted, existingContext, preferences);
        log.debug("[Validator] extracted={}, merged keys={}", extracted, merged.keySet());
        return validate(merged);
    }

    public ValidationResult validate(Map<String, Object> context) {
        TripAgentProperties.QuestionsProperties options = properties.getQuestions();
        String language = options.getLanguage();
        Map<String, Object> safeContext = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        List<MissingInfo> missing = new ArrayList<>();

        if (TripContextValues.toText(safeContext.get(TripContextKeys.DESTINATION)) == null) {
            missing.add(missingInfo(TripContextKeys.DESTINATION, true, "destination is not set", language));
        }
        int days = TripContextValues.toDays(safeContext.get(TripContextKeys.DAYS));
        if (days <= 0) {
            missing.add(missingInfo(TripContextKeys.DAYS, true, "trip length is not set", language));
        }
        if (TripContextValues.toText(safeContext.get(TripContextKeys.START_DATE)) == null) {
            missing.add(missingInfo(TripContextKeys.START_DATE, options.isStartDateRequired(),
                    "start date is not set", language));
        }
        if (!TripContextValues.isValidBudget(TripContextValues.toBudget(safeContext.get(TripContextKeys.BUDGET)))) {
            missing.add(missingInfo(TripContextKeys.BUDGET, options.isBudgetRequired(), "budget is not set",
                    language));
        }
        if (TripContextValues.toStringList(safeContext.get(TripContextKeys.INTERESTS)).isEmpty()) {
            missing.add(missingInfo(TripContextKeys.INTERESTS, options.isInterestsRequired(),
                    "interests are not set", language));
        }

        // stable sort keeps field order within each priority
        missing.sort(Comparator.comparing(MissingInfo::getPriority));
        boolean complete = missing.stream().noneMatch(MissingInfo::isRequired);
        return ValidationResult.builder()
                .complete(complete)
                .missingInfo(missing)
                .mergedContext(safeContext)
                .build();
    }

    Map<String, Object> merge(TripInfo extracted, Map<String, Object> existingContext,
            UserPreferences preferences) {
        Map<String, Object> merged = existingContext != null ? new LinkedHashMap<>(existingContext)
                : new LinkedHashMap<>();

        if (extracted.hasDestination() && TripContextValues.toText(merged.get(TripContextKeys.DESTINATION)) == null) {
            merged.put(TripContextKeys.DESTINATION, extracted.destination());
        }
        if (extracted.hasDays() && TripContextValues.toDays(merged.get(TripContextKeys.DAYS)) <= 0) {
            merged.put(TripContextKeys.DAYS, extracted.days());
        }
        int days = TripContextValues.toDays(merged.get(TripContextKeys.DAYS));
        if (days > 0) {
            merged.put(TripContextKeys.DAYS, clampDays(days));
        }

        if (preferences != null) {
            if (TripContextValues.toStringList(merged.get(TripContextKeys.INTERESTS)).isEmpty()
                    && preferences.getInterests() != null && !preferences.getInterests().isEmpty()) {
                merged.put(TripContextKeys.INTERESTS, new ArrayList<>(preferences.getInterests()));
            }
            BudgetRange budget = preferences.getBudget();
            if (budget != null && merged.get(TripContextKeys.BUDGET) == null) {
                merged.put(TripContextKeys.BUDGET, budget);
            }
        }
        return merged;
    }

    int clampDays(int days) {
        TripAgentProperties.QuestionsProperties options = properties.getQuestions();
        return Math.max(options.getMinDays(), Math.min(options.getMaxDays(), days));
    }

    private static MissingInfo missingInfo(String field, boolean required, String reason, String language) {
        return MissingInfo.builder()
                .field(field)
                .priority(required ? MissingInfo.Priority.REQUIRED : MissingInfo.Priority.RECOMMENDED)
                .reason(reason)
                .quickReplies(QuestionTemplates.forField(field, language).quickReplies())
                .build();
    }
}
