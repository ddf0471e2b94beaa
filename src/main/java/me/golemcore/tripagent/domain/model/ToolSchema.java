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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive JSON Schema subset used for tool input descriptors.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolSchema {

    private String type; // object, string, number, boolean, array
    private String description;
    private Map<String, ToolSchema> properties;
    private List<String> required;
    private ToolSchema items;
    @JsonProperty("enum")
    private List<String> enumValues;
    @JsonProperty("default")
    private Object defaultValue;

    public static ToolSchema object(Map<String, ToolSchema> properties, List<String> required) {
        return ToolSchema.builder()
                .type("object")
                .properties(new LinkedHashMap<>(properties))
                .required(List.copyOf(required))
                .build();
    }

    public static ToolSchema string(String description) {
        return ToolSchema.builder().type("string").description(description).build();
    }

    public static ToolSchema number(String description) {
        return ToolSchema.builder().type("number").description(description).build();
    }
}
