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

package me.golemcore.tripagent.domain.component;

import me.golemcore.tripagent.domain.model.ToolDefinition;
import me.golemcore.tripagent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability interface for tools that run inside the process.
 *
 * <p>
 * Handlers receive the caller's arguments plus a {@code context} entry holding
 * the {@link me.golemcore.tripagent.domain.model.ToolExecutionContext}. A
 * handler may fail by throwing or by completing its future exceptionally; the
 * protocol layer turns both into an error result.
 */
public interface InlineTool {

    /**
     * Returns the tool definition with its input schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool.
     *
     * @param arguments
     *            the call arguments, including {@code context}
     * @return a future with the tool result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> arguments);

    default String getToolName() {
        return getDefinition().getName();
    }
}
