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

package me.golemcore.tripagent.adapter.outbound.llm;

import me.golemcore.tripagent.domain.model.ChatMessage;
import me.golemcore.tripagent.domain.model.LlmChunk;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmProvider;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * One upstream attempt against a single provider. Implementations own the
 * provider's request shape, auth headers and stream framing; retries are
 * handled by {@link StreamingLlmAdapter}.
 */
public interface LlmProviderAdapter {

    LlmProvider getProvider();

    Flux<LlmChunk> stream(List<ChatMessage> messages, LlmConfig config);
}
