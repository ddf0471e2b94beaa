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

import me.golemcore.tripagent.domain.model.MissingInfo;
import me.golemcore.tripagent.domain.model.Question;
import me.golemcore.tripagent.domain.model.QuestionSequence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the active question sequence and the answers collected so far.
 *
 * <p>
 * Skipping is only allowed for questions that are not required; a skipped
 * question counts as answered but never writes to the context.
 */
@Service
@Slf4j
public class QuestionCollectionService {

    private final QuestionGenerator questionGenerator;

    private QuestionSequence sequence = QuestionSequence.builder().build();
    private Map<String, Object> context = new LinkedHashMap<>();
    private boolean collecting;

    public QuestionCollectionService(QuestionGenerator questionGenerator) {
        this.questionGenerator = questionGenerator;
    }

    public synchronized QuestionSequence startCollection(List<MissingInfo> missingInfo) {
        return startCollection(questionGenerator.generate(missingInfo));
    }

    public synchronized QuestionSequence startCollection(QuestionSequence questions) {
        this.sequence = questions;
        this.context = new LinkedHashMap<>();
        this.collecting = true;
        log.debug("[Questions] Started collection with {} questions", questions.getQuestions().size());
        return snapshot();
    }

    /**
     * Stores the answer and writes it into the context at the question's key.
     * String answers are parsed into typed values first.
     *
     * @return false when the question is unknown
     */
    public synchronized boolean answerQuestion(String questionId, Object answer) {
        Optional<Question> found = findQuestion(questionId);
        if (found.isEmpty()) {
            return false;
        }
        Question question = found.get();
        Object value = answer instanceof String text
                ? questionGenerator.parseAnswer(question, text, context)
                : answer;
        question.setStatus(Question.QuestionStatus.ANSWERED);
        question.setAnswer(value);
        if (value != null) {
            context.put(question.getContextKey(), value);
        }
        return true;
    }

    /**
     * @return false, with no state change, for unknown or required questions
     */
    public synchronized boolean skipQuestion(String questionId) {
        Optional<Question> found = findQuestion(questionId);
        if (found.isEmpty() || found.get().isRequired()) {
            return false;
        }
        Question question = found.get();
        question.setStatus(Question.QuestionStatus.ANSWERED);
        question.setAnswer(null);
        return true;
    }

    public synchronized Optional<Question> nextQuestion() {
        int last = Math.max(sequence.getQuestions().size() - 1, 0);
        moveTo(Math.min(sequence.getCurrentIndex() + 1, last));
        return getCurrentQuestion();
    }

    public synchronized Optional<Question> previousQuestion() {
        moveTo(Math.max(sequence.getCurrentIndex() - 1, 0));
        return getCurrentQuestion();
    }

    public synchronized Optional<Question> getCurrentQuestion() {
        return sequence.getCurrent().map(question -> question.toBuilder().build());
    }

    public synchronized void updateContext(String key, Object value) {
        context.put(key, value);
    }

    /**
     * Values of answered questions that carry an answer, keyed by context key.
     */
    public synchronized Map<String, Object> getCompletedContext() {
        Map<String, Object> completed = new LinkedHashMap<>();
        for (Question question : sequence.getQuestions()) {
            if (question.getStatus() == Question.QuestionStatus.ANSWERED && question.getAnswer() != null) {
                completed.put(question.getContextKey(), question.getAnswer());
            }
        }
        return completed;
    }

    public synchronized Map<String, Object> getContext() {
        return new LinkedHashMap<>(context);
    }

    public synchronized boolean isComplete() {
        return sequence.isComplete();
    }

    public synchronized boolean isCollecting() {
        return collecting;
    }

    public synchronized QuestionSequence snapshot() {
        return QuestionSequence.builder()
                .questions(sequence.getQuestions().stream().map(question -> question.toBuilder().build()).toList())
                .currentIndex(sequence.getCurrentIndex())
                .build();
    }

    public synchronized void reset() {
        sequence = QuestionSequence.builder().build();
        context = new LinkedHashMap<>();
        collecting = false;
    }

    private void moveTo(int index) {
        List<Question> questions = sequence.getQuestions();
        if (questions.isEmpty()) {
            return;
        }
        sequence.getCurrent().ifPresent(current -> {
            if (current.getStatus() == Question.QuestionStatus.ACTIVE) {
                current.setStatus(Question.QuestionStatus.PENDING);
            }
        });
        sequence.setCurrentIndex(index);
        Question target = questions.get(index);
        if (target.getStatus() == Question.QuestionStatus.PENDING) {
            target.setStatus(Question.QuestionStatus.ACTIVE);
        }
    }

    private Optional<Question> findQuestion(String questionId) {
        return sequence.getQuestions().stream()
                .filter(question -> questionId.equals(question.getId()))
                .findFirst();
    }
}
