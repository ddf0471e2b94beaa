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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, steppable list of outstanding clarification questions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuestionSequence {

    @Builder.Default
    private List<Question> questions = new ArrayList<>();

    private int currentIndex;

    public Optional<Question> getCurrent() {
        if (currentIndex < 0 || currentIndex >= questions.size()) {
            return Optional.empty();
        }
        return Optional.of(questions.get(currentIndex));
    }

    /**
     * A sequence is complete once every required question has been answered.
     */
    public boolean isComplete() {
        return questions.stream()
                .filter(Question::isRequired)
                .allMatch(question -> question.getStatus() == Question.QuestionStatus.ANSWERED);
    }
}
