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
import me.golemcore.tripagent.domain.model.ChatMessage;
import me.golemcore.tripagent.domain.model.TripContextKeys;
import me.golemcore.tripagent.domain.system.TripContextValues;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the model conversation for one agent role from the trip context, the
 * outputs of earlier roles and the tool results gathered in the current phase.
 */
@Component
public class PromptBuilder {

    private static final int MAX_HISTORY = 10;

    public List<ChatMessage> build(AgentRole role, Map<String, Object> context, Map<AgentRole, String> priorOutputs,
            List<String> toolOutputs, List<ChatMessage> history) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt(role)));
        if (history != null && !history.isEmpty()) {
            int from = Math.max(0, history.size() - MAX_HISTORY);
            history.subList(from, history.size()).stream()
                    .filter(message -> !message.isSystemMessage())
                    .forEach(messages::add);
        }
        messages.add(ChatMessage.user(userPrompt(role, context, priorOutputs, toolOutputs)));
        return messages;
    }

    String systemPrompt(AgentRole role) {
        return switch (role) {
        case SUPERVISOR -> "You coordinate a team of travel agents. Summarize what the traveller wants.";
        case PLANNER -> "You are a travel planner. Produce a day-by-day itinerary with morning, afternoon "
                + "and evening activities, visit durations and sensible routes between stops.";
        case RECOMMENDER -> "You are a travel recommender. Suggest attractions, restaurants and hotels that "
                + "match the traveller's interests, weather and budget.";
        case BOOKING -> "You are a booking advisor. Compare price ranges and explain when and where to book "
                + "transport, lodging and tickets.";
        case DOCUMENT -> "You format travel plans. Combine the material you are given into one clear "
                + "Markdown itinerary document.";
        };
    }

    String userPrompt(AgentRole role, Map<String, Object> context, Map<AgentRole, String> priorOutputs,
            List<String> toolOutputs) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Trip details:\n");
        appendField(prompt, "Destination", TripContextValues.toText(context.get(TripContextKeys.DESTINATION)));
        appendField(prompt, "Days", TripContextValues.toText(context.get(TripContextKeys.DAYS)));
        appendField(prompt, "Start date", TripContextValues.toText(context.get(TripContextKeys.START_DATE)));
        Object budget = context.get(TripContextKeys.BUDGET);
        if (budget != null) {
            appendField(prompt, "Budget", String.valueOf(TripContextValues.toBudget(budget)));
        }
        List<String> interests = TripContextValues.toStringList(context.get(TripContextKeys.INTERESTS));
        if (!interests.isEmpty()) {
            appendField(prompt, "Interests", String.join(", ", interests));
        }

        if (toolOutputs != null && !toolOutputs.isEmpty()) {
            prompt.append("\nTool results:\n");
            toolOutputs.forEach(output -> prompt.append(output).append('\n'));
        }

        if (priorOutputs != null && !priorOutputs.isEmpty()) {
            prompt.append("\nWork from other agents:\n");
            priorOutputs.forEach((prior, output) -> prompt.append("## ").append(prior.getPhaseName()).append('\n')
                    .append(output).append('\n'));
        }

        prompt.append('\n').append(role.getPhaseDescription()).append('.');
        return prompt.toString();
    }

    private static void appendField(StringBuilder prompt, String label, String value) {
        if (value != null) {
            prompt.append("- ").append(label).append(": ").append(value).append('\n');
        }
    }
}
