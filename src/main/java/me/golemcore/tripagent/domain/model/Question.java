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

package me.golemcore.tripagent.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A clarification question whose answer lands in the trip context under
 * {@code contextKey}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Question {

    private String id;
    private String text;
    private QuestionType type;
    private List<String> options;
    private boolean required;

    @Builder.Default
    private QuestionStatus status = QuestionStatus.PENDING;

    private Object answer;
    private String contextKey;
    private int order;

    public enum QuestionType {
        TEXT, CHOICE, MULTI_CHOICE, DATE, NUMBER
    }

    public enum QuestionStatus {
        PENDING, ACTIVE, ANSWERED
    }
}
