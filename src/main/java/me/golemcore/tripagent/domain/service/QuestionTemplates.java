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

import me.golemcore.tripagent.domain.model.Question;
import me.golemcore.tripagent.domain.model.TripContextKeys;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Question wording and quick replies per context field, in English and
 * Chinese.
 */
final class QuestionTemplates {

    record Template(String text, List<String> quickReplies) {
    }

    private static final Map<String, Template> ENGLISH = Map.of(
            TripContextKeys.DESTINATION, new Template("Where would you like to travel?",
                    List.of("Tokyo", "Paris", "New York", "Shanghai", "Beijing", "Singapore", "Bangkok", "Dubai")),
            TripContextKeys.DAYS, new Template("How many days are you planning to travel?",
                    List.of("3 days", "5 days", "7 days", "10 days", "14 days")),
            TripContextKeys.BUDGET, new Template("What is your approximate budget?",
                    List.of("Budget (<$1000)", "Mid-range ($1000-$3000)", "Luxury (>$3000)")),
            TripContextKeys.START_DATE, new Template("When are you planning to start your trip?",
                    List.of("Tomorrow", "This week", "Next week", "Next month", "Not sure yet")),
            TripContextKeys.INTERESTS, new Template("What are you interested in? (Select all that apply)",
                    List.of("History", "Nature", "Food", "Shopping", "Art & Museums", "Outdoor Activities")));

    private static final Map<String, Template> CHINESE = Map.of(
            TripContextKeys.DESTINATION, new Template("请问您想去哪里旅游？",
                    List.of("东京", "巴黎", "纽约", "上海", "北京", "新加坡", "曼谷", "迪拜")),
            TripContextKeys.DAYS, new Template("您计划旅行多少天？",
                    List.of("3天", "5天", "7天", "10天", "14天")),
            TripContextKeys.BUDGET, new Template("您的预算大概是多少？",
                    List.of("经济型（<5000元）", "舒适型（5000-15000元）", "豪华型（>15000元）")),
            TripContextKeys.START_DATE, new Template("您计划什么时候出发？",
                    List.of("明天", "本周", "下周", "下个月", "暂不确定")),
            TripContextKeys.INTERESTS, new Template("您对什么类型的内容感兴趣？（可多选）",
                    List.of("历史文化", "自然风光", "美食体验", "购物娱乐", "艺术博物馆", "户外运动")));

    private static final Template GENERIC_EN = new Template("Could you tell me more about %s?", List.of());
    private static final Template GENERIC_ZH = new Template("请补充%s信息", List.of());

    private QuestionTemplates() {
    }

    static boolean isChinese(String language) {
        return language != null && language.toLowerCase(Locale.ROOT).startsWith("zh");
    }

    static Template forField(String field, String language) {
        Map<String, Template> templates = isChinese(language) ? CHINESE : ENGLISH;
        Template template = templates.get(field);
        if (template != null) {
            return template;
        }
        Template generic = isChinese(language) ? GENERIC_ZH : GENERIC_EN;
        return new Template(String.format(generic.text(), field), generic.quickReplies());
    }

    static Question.QuestionType typeOf(String field) {
        return switch (field) {
        case TripContextKeys.START_DATE -> Question.QuestionType.DATE;
        case TripContextKeys.INTERESTS -> Question.QuestionType.MULTI_CHOICE;
        case TripContextKeys.DESTINATION, TripContextKeys.DAYS, TripContextKeys.BUDGET -> Question.QuestionType.CHOICE;
        default -> Question.QuestionType.TEXT;
        };
    }
}
