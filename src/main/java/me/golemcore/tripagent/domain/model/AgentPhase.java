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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One stage of the agent pipeline, owned by a single agent role.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentPhase {

    private String id;
    private String name;
    private String description;
    private String agentType;

    @Builder.Default
    private PhaseStatus status = PhaseStatus.PENDING;

    private int progress;
    private Instant startTime;
    private Instant endTime;
    private String error;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Phase lifecycle states.
     */
    public enum PhaseStatus {
        PENDING, IN_PROGRESS, COMPLETED, FAILED, SKIPPED
    }
}
