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
 * A completed planning run as persisted by the storage adapter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripPlan {

    private String id;
    private String sessionId;
    private String userId;
    private String destination;
    private Integer days;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> agentOutputs = new LinkedHashMap<>();

    private Instant createdAt;
}
