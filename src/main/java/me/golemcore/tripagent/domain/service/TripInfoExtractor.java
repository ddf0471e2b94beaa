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

import me.golemcore.tripagent.domain.model.TripInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pattern-based extraction of a destination and a day count from free text.
 *
 * <p>
 * Destinations are matched against a fixed English/Chinese vocabulary and
 * returned as canonical English city names.
 */
@Component
public class TripInfoExtractor {

    private static final Pattern DAYS_WITH_UNIT = Pattern.compile("(\\d+)\\s*(?:天|日|days?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");
    private static final Pattern DAYS_PHRASE = Pattern.compile("(\\d+)\\s*(?:[天日][游旅]*|days?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRIP_WORDS = Pattern.compile("[游旅]计划|行程|旅游|trip|travel",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<DestinationAlias> DESTINATIONS = new ArrayList<>();

    static {
        alias("Shanghai", "上海");
        alias("Beijing", "北京");
        alias("Tokyo", "东京");
        alias("Paris", "巴黎");
        alias("New York", "纽约");
        alias("London", "伦敦");
        alias("Hong Kong", "香港");
        alias("Seoul", "首尔");
        alias("Singapore", "新加坡");
        alias("Bangkok", "曼谷");
        alias("Dubai", "迪拜");
        alias("Sydney", "悉尼");
        alias("Rome", "罗马");
        alias("Barcelona", "巴塞罗那");
        alias("Osaka", "大阪");
        alias("Kyoto", "京都");
        alias("Nice", "尼斯");
        alias("Los Angeles", "洛杉矶");
        alias("Huaqiao", "花桥");
    }

    private static void alias(String canonical, String cjkKey) {
        String words = Arrays.stream(canonical.toLowerCase(Locale.ROOT).split(" "))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s*"));
        DESTINATIONS.add(new DestinationAlias(canonical, canonical.replace(" ", "").length(),
                Pattern.compile("(?<![a-z])" + words + "(?![a-z])")));
        DESTINATIONS.add(new DestinationAlias(canonical, cjkKey.length(), Pattern.compile(Pattern.quote(cjkKey))));
    }

    private record DestinationAlias(String canonical, int keyLength, Pattern pattern) {
    }

    public TripInfo extract(String message) {
        if (message == null || message.isBlank()) {
            return new TripInfo(null, 0);
        }
        String cleaned = TRIP_WORDS.matcher(DAYS_PHRASE.matcher(message).replaceAll("")).replaceAll("").trim();
        String destination = cleaned.isEmpty() ? null : normalizeDestination(cleaned).orElse(null);
        return new TripInfo(destination, extractDays(message));
    }

    /**
     * Maps free text to a canonical city name when it mentions a known city.
     *
     * <p>
     * English names match as whole words. When several cities are mentioned,
     * the longest name wins, so "a nice trip to Los Angeles" is Los Angeles.
     */
    public Optional<String> normalizeDestination(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return DESTINATIONS.stream()
                .filter(alias -> alias.pattern().matcher(normalized).find())
                .max(Comparator.comparingInt(DestinationAlias::keyLength))
                .map(DestinationAlias::canonical);
    }

    int extractDays(String message) {
        Matcher matcher = DAYS_WITH_UNIT.matcher(message);
        if (!matcher.find()) {
            matcher = TRAILING_NUMBER.matcher(message.trim());
            if (!matcher.find()) {
                return 0;
            }
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
