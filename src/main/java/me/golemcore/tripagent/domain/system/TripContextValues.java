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

package me.golemcore.tripagent.domain.system;

import me.golemcore.tripagent.domain.model.BudgetRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed readers for trip context values. Context maps arrive either from
 * in-process code (typed values) or from JSON (maps, strings, longs), so every
 * reader accepts both shapes.
 */
public final class TripContextValues {

    private TripContextValues() {
    }

    public static String toText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * @return the day count, or 0 when absent or not numeric
     */
    public static int toDays(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public static BudgetRange toBudget(Object value) {
        if (value instanceof BudgetRange budget) {
            return budget;
        }
        if (value instanceof Map<?, ?> map) {
            Object min = map.get("min");
            Object max = map.get("max");
            Object currency = map.get("currency");
            if (min instanceof Number minNumber && max instanceof Number maxNumber) {
                return BudgetRange.builder()
                        .min(minNumber.longValue())
                        .max(maxNumber.longValue())
                        .currency(currency != null ? currency.toString() : null)
                        .build();
            }
        }
        return null;
    }

    public static boolean isValidBudget(BudgetRange budget) {
        return budget != null
                && budget.getMin() >= 0
                && budget.getMax() > budget.getMin()
                && budget.getCurrency() != null
                && !budget.getCurrency().isBlank();
    }

    public static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String text = toText(item);
                if (text != null) {
                    result.add(text);
                }
            }
        } else {
            String text = toText(value);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }
}
