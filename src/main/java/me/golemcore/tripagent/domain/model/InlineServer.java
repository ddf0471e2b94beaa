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

import me.golemcore.tripagent.domain.component.InlineTool;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Optional;

/**
 * A named bundle of in-process tools. Registering it needs no handshake.
 */
@Data
@Builder
public class InlineServer {

    private String name;

    @Builder.Default
    private String version = "1.0.0";

    @Singular
    private List<InlineTool> tools;

    public Optional<InlineTool> findTool(String toolName) {
        return tools.stream()
                .filter(tool -> tool.getToolName().equals(toolName))
                .findFirst();
    }
}
