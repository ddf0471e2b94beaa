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

import java.time.Instant;
import java.util.Map;

/**
 * A single tool invocation tracked under a phase. Tool calls are appended to a
 * session and only ever updated in place.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String id;
    private String name;
    private String phaseId;

    @Builder.Default
    private ToolCallStatus status = ToolCallStatus.PENDING;

    private Map<String, Object> input;
    private String output;
    private String error;
    private Instant startTime;
    private Instant endTime;
    private Long duration; // millis, endTime - startTime

    /**
     * Tool call lifecycle states.
     */
    public enum ToolCallStatus {
        PENDING, RUNNING, COMPLETED, FAILED, CANCELLED
    }
}
