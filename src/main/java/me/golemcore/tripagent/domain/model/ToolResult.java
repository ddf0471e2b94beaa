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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalized result of a tool invocation. Handler failures are reported with
 * {@code isError = true} and a single text item describing the failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    @Builder.Default
    private List<ToolContent> content = new ArrayList<>();
    @JsonProperty("isError")
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    private boolean error;

    /**
     * Creates a successful result with a single text item.
     */
    public static ToolResult text(String text) {
        return ToolResult.builder()
                .content(new ArrayList<>(List.of(ToolContent.text(text))))
                .build();
    }

    /**
     * Creates a failed result with a single text item describing the failure.
     */
    public static ToolResult failure(String message) {
        return ToolResult.builder()
                .content(new ArrayList<>(List.of(ToolContent.text(message))))
                .error(true)
                .build();
    }

    /**
     * Joins all text items with newlines.
     */
    @JsonIgnore
    public String getText() {
        if (content == null) {
            return "";
        }
        return content.stream()
                .filter(item -> ToolContent.TYPE_TEXT.equals(item.getType()) && item.getText() != null)
                .map(ToolContent::getText)
                .collect(Collectors.joining("\n"));
    }
}
