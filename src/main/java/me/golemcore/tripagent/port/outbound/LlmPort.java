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

package me.golemcore.tripagent.port.outbound;

import me.golemcore.tripagent.domain.model.ChatMessage;
import me.golemcore.tripagent.domain.model.LlmChunk;
import me.golemcore.tripagent.domain.model.LlmConfig;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for streaming chat with a language-model provider.
 */
public interface LlmPort {

    /**
     * Streams the model answer as text deltas. The sequence always ends with
     * exactly one element where {@code done} is true and {@code content} is
     * empty. Failures surface as
     * {@link me.golemcore.tripagent.domain.model.LlmException}.
     *
     * @param messages
     *            conversation to send
     * @param config
     *            provider, model and sampling settings
     * @return lazy sequence of chunks
     */
    Flux<LlmChunk> streamChat(List<ChatMessage> messages, LlmConfig config);

    /**
     * Returns the full answer by concatenating the streamed deltas.
     */
    default CompletableFuture<String> chatCompletion(List<ChatMessage> messages, LlmConfig config) {
        return streamChat(messages, config)
                .filter(chunk -> !chunk.isDone())
                .map(chunk -> chunk.getContent() != null ? chunk.getContent() : "")
                .reduce(new StringBuilder(), StringBuilder::append)
                .map(StringBuilder::toString)
                .toFuture();
    }
}
