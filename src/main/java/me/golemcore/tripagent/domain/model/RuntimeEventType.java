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
 * Stable event types published by the progress tracker.
 */
public enum RuntimeEventType {
    SESSION_STARTED, SESSION_COMPLETED, SESSION_FAILED, SESSION_RESET, PHASE_STARTED, PHASE_PROGRESS,
    PHASE_COMPLETED, PHASE_FAILED, PHASE_SKIPPED, TOOL_CALL_ADDED, TOOL_CALL_UPDATED, TOOL_CALL_COMPLETED,
    TOOL_CALL_FAILED, TOOL_CALL_CANCELLED
}
