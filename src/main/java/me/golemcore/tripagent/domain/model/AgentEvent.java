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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One element of the orchestrator output stream.
 *
 * <ul>
 * <li>{@code MESSAGE} carries an {@link AgentMessage}</li>
 * <li>{@code NEED_MORE_INFO} carries clarification questions and the context
 * extracted so far; the turn ends after it</li>
 * <li>{@code DONE} closes a completed run</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentEvent {

    private EventType type;
    private AgentMessage message;
    private List<Question> questions;
    private Map<String, Object> context;
    private String sessionId;

    public static AgentEvent message(AgentMessage message) {
        return AgentEvent.builder().type(EventType.MESSAGE).message(message).build();
    }

    public static AgentEvent needMoreInfo(List<Question> questions, Map<String, Object> context) {
        return AgentEvent.builder()
                .type(EventType.NEED_MORE_INFO)
                .questions(questions)
                .context(context)
                .build();
    }

    public static AgentEvent done(String sessionId, Map<String, Object> context) {
        return AgentEvent.builder()
                .type(EventType.DONE)
                .sessionId(sessionId)
                .context(context)
                .build();
    }

    public enum EventType {
        MESSAGE, NEED_MORE_INFO, DONE
    }
}
