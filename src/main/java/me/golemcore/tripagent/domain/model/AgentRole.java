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

/**
 * Agent roles in pipeline order. Each role owns one progress phase.
 */
public enum AgentRole {

    SUPERVISOR("supervisor", "Intent recognition", "Intent recognition and task dispatch"),
    PLANNER("planner", "Itinerary planning", "Itinerary planning and route optimization"),
    RECOMMENDER("recommender", "Recommendations", "Personalized attraction, dining and hotel recommendations"),
    BOOKING("booking", "Booking advice", "Price comparison and booking guidance"),
    DOCUMENT("document", "Document generation", "Formatting the final itinerary document");

    private final String id;
    private final String phaseName;
    private final String phaseDescription;

    AgentRole(String id, String phaseName, String phaseDescription) {
        this.id = id;
        this.phaseName = phaseName;
        this.phaseDescription = phaseDescription;
    }

    public String getId() {
        return id;
    }

    public String getPhaseName() {
        return phaseName;
    }

    public String getPhaseDescription() {
        return phaseDescription;
    }

    public PhaseDefinition toPhaseDefinition() {
        return new PhaseDefinition(id, phaseName, phaseDescription, id);
    }
}
