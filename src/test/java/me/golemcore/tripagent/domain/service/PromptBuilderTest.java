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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptBuilderTest {

    private static final Map<String, Object> CONTEXT = Map.of(
            TripContextKeys.DESTINATION, "Kyoto",
            TripContextKeys.DAYS, 3,
            TripContextKeys.INTERESTS, List.of("temples", "food"));

    private final PromptBuilder builder = new PromptBuilder();

    @Test
    void shouldStartWithRoleSystemPromptAndEndWithUserPrompt() {
        List<ChatMessage> messages = builder.build(AgentRole.PLANNER, CONTEXT, Map.of(), List.of(), List.of());

        assertEquals(2, messages.size());
        assertEquals(ChatMessage.ROLE_SYSTEM, messages.get(0).getRole());
        assertTrue(messages.get(0).getContent().startsWith("You are a travel planner."));
        assertEquals(ChatMessage.ROLE_USER, messages.get(1).getRole());
    }

    @Test
    void shouldRenderTripDetailsToolResultsAndPriorWork() {
        Map<AgentRole, String> prior = new EnumMap<>(AgentRole.class);
        prior.put(AgentRole.PLANNER, "Day 1: Fushimi Inari");

        String prompt = builder.userPrompt(AgentRole.RECOMMENDER, CONTEXT, prior,
                List.of("get_weather: sunny"));

        assertTrue(prompt.contains("- Destination: Kyoto\n"));
        assertTrue(prompt.contains("- Days: 3\n"));
        assertTrue(prompt.contains("- Interests: temples, food\n"));
        assertFalse(prompt.contains("Start date"));
        assertTrue(prompt.contains("Tool results:\nget_weather: sunny\n"));
        assertTrue(prompt.contains("## Itinerary planning\nDay 1: Fushimi Inari\n"));
        assertTrue(prompt.endsWith(AgentRole.RECOMMENDER.getPhaseDescription() + "."));
    }

    @Test
    void shouldKeepOnlyRecentNonSystemHistory() {
        List<ChatMessage> history = new ArrayList<>();
        history.add(ChatMessage.system("old system prompt"));
        for (int i = 0; i < 12; i++) {
            history.add(ChatMessage.user("message " + i));
        }

        List<ChatMessage> messages = builder.build(AgentRole.SUPERVISOR, CONTEXT, Map.of(), List.of(), history);

        assertEquals(12, messages.size());
        assertEquals("message 2", messages.get(1).getContent());
        assertEquals(1, messages.stream().filter(ChatMessage::isSystemMessage).count());
    }
}
