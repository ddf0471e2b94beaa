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

/**
 * One element of a streamed model response. A stream always ends with exactly
 * one element where {@code done} is true and {@code content} is empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmChunk {

    private String content;
    private boolean done;

    public static LlmChunk delta(String content) {
        return new LlmChunk(content, false);
    }

    public static LlmChunk terminal() {
        return new LlmChunk("", true);
    }
}
