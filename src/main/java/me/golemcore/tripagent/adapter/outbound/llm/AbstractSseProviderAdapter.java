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
import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.LlmChunk;
import me.golemcore.tripagent.domain.model.LlmConfig;
import me.golemcore.tripagent.domain.model.LlmException;
import me.golemcore.tripagent.domain.system.LlmErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;

/**
 * Shared reader for line-delimited event streams ({@code data: ...} frames
 * terminated by {@code data: [DONE]} or a provider-specific stop frame).
 *
 * <p>
 * Lines without the {@code data:} prefix and frames that fail to parse are
 * skipped. The stream always ends with a single terminal chunk, including when
 * the body ends without a stop frame.
 */
@Slf4j
public abstract class AbstractSseProviderAdapter implements LlmProviderAdapter {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_SENTINEL = "[DONE]";

    protected final OkHttpClient okHttpClient;
    protected final ObjectMapper objectMapper;

    protected AbstractSseProviderAdapter(OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the provider HTTP request for a streaming call.
     */
    protected abstract Request buildRequest(List<ChatMessage> messages, LlmConfig config)
            throws JsonProcessingException;

    /**
     * Interprets one parsed frame.
     */
    protected abstract Frame parseFrame(JsonNode frame);

    @Override
    public Flux<LlmChunk> stream(List<ChatMessage> messages, LlmConfig config) {
        return Flux.<LlmChunk>create(sink -> execute(messages, config, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void execute(List<ChatMessage> messages, LlmConfig config, FluxSink<LlmChunk> sink) {
        Request request;
        try {
            request = buildRequest(messages, config);
        } catch (JsonProcessingException e) {
            sink.error(new LlmException(ErrorKind.INVALID_REQUEST, "Failed to serialize request", null, e));
            return;
        }

        Call call = okHttpClient.newCall(request);
        sink.onDispose(call::cancel);
        log.debug("[LLM] {} POST {}", getProvider().getId(), request.url());

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : null;
                sink.error(LlmErrorClassifier.fromHttpStatus(response.code(), errorBody));
                return;
            }
            if (body == null) {
                sink.error(new LlmException(ErrorKind.PROTOCOL_ERROR, "Empty response body from model provider"));
                return;
            }

            readFrames(body.source(), sink);
            if (!sink.isCancelled()) {
                sink.next(LlmChunk.terminal());
                sink.complete();
            }
        } catch (LlmException e) {
            sink.error(e);
        } catch (IOException | RuntimeException e) {
            if (!sink.isCancelled()) {
                sink.error(LlmErrorClassifier.classify(e));
            }
        }
    }

    private void readFrames(BufferedSource source, FluxSink<LlmChunk> sink) throws IOException {
        String line;
        while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(DATA_PREFIX)) {
                continue;
            }
            String payload = trimmed.substring(DATA_PREFIX.length()).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if (DONE_SENTINEL.equals(payload)) {
                return;
            }

            JsonNode frame;
            try {
                frame = objectMapper.readTree(payload);
            } catch (JsonProcessingException e) {
                log.debug("[LLM] Skipping malformed frame: {}", payload);
                continue;
            }

            Frame parsed = parseFrame(frame);
            if (parsed.content() != null && !parsed.content().isEmpty()) {
                sink.next(LlmChunk.delta(parsed.content()));
            }
            if (parsed.terminal()) {
                return;
            }
        }
    }

    protected ArrayNode toMessagesArray(List<ChatMessage> messages) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ChatMessage message : messages) {
            ObjectNode node = array.addObject();
            node.put("role", message.getRole());
            node.put("content", message.getContent() != null ? message.getContent() : "");
        }
        return array;
    }

    protected RequestBody jsonBody(ObjectNode body) throws JsonProcessingException {
        return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
    }

    /**
     * Text found in a frame, and whether the frame ends the stream.
     */
    protected record Frame(String content, boolean terminal) {

        static final Frame EMPTY = new Frame(null, false);

        static Frame text(String content) {
            return new Frame(content, false);
        }

        static Frame end(String content) {
            return new Frame(content, true);
        }
    }

    static String textAt(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
