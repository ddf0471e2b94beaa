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
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword routing from a user message to the agent roles that should run.
 *
 * <p>
 * The first matching intent wins. Supervisor and document roles always run.
 */
@Component
public class IntentAnalyzer {

    public static final String GENERAL = "general";

    public record Intent(String label, Set<AgentRole> roles) {

        public boolean includes(AgentRole role) {
            return roles.contains(role);
        }
    }

    private record Rule(String label, List<String> keywords, Set<AgentRole> roles) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule("plan", List.of("规划", "行程", "怎么玩", "旅游", "游", "plan", "itinerary", "trip", "travel",
                    "visit"), EnumSet.of(AgentRole.PLANNER, AgentRole.RECOMMENDER)),
            new Rule("recommend", List.of("推荐", "好玩", "必去", "看什么", "recommend", "suggest", "must-see",
                    "what to see"), EnumSet.of(AgentRole.RECOMMENDER)),
            new Rule("booking", List.of("预订", "买票", "酒店", "机票", "住", "book", "hotel", "flight", "ticket"),
                    EnumSet.of(AgentRole.BOOKING)),
            new Rule("document", List.of("导出", "下载", "pdf", "保存", "export", "download", "save"),
                    EnumSet.noneOf(AgentRole.class)));

    public Intent analyze(String message) {
        String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(text::contains)) {
                return new Intent(rule.label(), withFixedRoles(rule.roles()));
            }
        }
        return new Intent(GENERAL, withFixedRoles(EnumSet.of(AgentRole.PLANNER, AgentRole.RECOMMENDER)));
    }

    private static Set<AgentRole> withFixedRoles(Set<AgentRole> selected) {
        EnumSet<AgentRole> roles = EnumSet.of(AgentRole.SUPERVISOR, AgentRole.DOCUMENT);
        roles.addAll(selected);
        return roles;
    }
}
