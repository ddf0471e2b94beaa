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

import me.golemcore.tripagent.domain.model.AgentRole;
import me.golemcore.tripagent.domain.model.TripContextKeys;
import me.golemcore.tripagent.domain.system.TripContextValues;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Offline output for a role when no model is available. Every response is
 * labeled so it cannot be mistaken for generated content.
 */
@Component
public class FallbackResponseGenerator {

    public static final String LABEL = "[Offline fallback]";

    private static final List<String> DEFAULT_INTERESTS = List.of("sightseeing", "food", "culture");

    public String generate(AgentRole role, Map<String, Object> context, List<String> toolOutputs) {
        String destination = TripContextValues.toText(context.get(TripContextKeys.DESTINATION));
        String place = destination != null ? destination : "your destination";
        int days = Math.max(TripContextValues.toDays(context.get(TripContextKeys.DAYS)), 1);
        List<String> interests = TripContextValues.toStringList(context.get(TripContextKeys.INTERESTS));
        if (interests.isEmpty()) {
            interests = DEFAULT_INTERESTS;
        }

        StringBuilder text = new StringBuilder(LABEL).append(' ');
        switch (role) {
        case SUPERVISOR -> text.append("Planning a ").append(days).append("-day trip to ").append(place).append('.');
        case PLANNER -> {
            text.append(days).append("-day outline for ").append(place).append(":\n");
            for (int day = 1; day <= days; day++) {
                String focus = interests.get((day - 1) % interests.size());
                text.append("Day ").append(day).append(": morning ").append(focus)
                        .append(", afternoon exploring the city, evening local dinner\n");
            }
        }
        case RECOMMENDER -> text.append("Suggested focus in ").append(place).append(": ")
                .append(String.join(", ", interests)).append('.');
        case BOOKING -> text.append("Book lodging and intercity transport early; compare prices across "
                + "several providers before paying.");
        case DOCUMENT -> text.append("Itinerary for ").append(place).append(", ").append(days)
                .append(" days. Generated without a language model.");
        }
        if (toolOutputs != null && !toolOutputs.isEmpty()) {
            text.append("\n\nTool data:\n");
            toolOutputs.forEach(output -> text.append(output).append('\n'));
        }
        return text.toString().trim();
    }
}
