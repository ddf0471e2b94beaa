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

package me.golemcore.tripagent.adapter.outbound.mcp;

import me.golemcore.tripagent.domain.model.ErrorKind;
import me.golemcore.tripagent.domain.model.JsonRpcError;
import me.golemcore.tripagent.domain.model.JsonRpcErrorCode;
import me.golemcore.tripagent.domain.model.JsonRpcRequest;
import me.golemcore.tripagent.domain.model.JsonRpcResponse;
import me.golemcore.tripagent.domain.model.McpException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC 2.0 message construction, validation and parsing for the tool
 * protocol.
 *
 * <p>
 * Request ids have the form {@code mcp_<epochMillis>_<counter>} and are unique
 * within the process.
 */
@Component
@Slf4j
public class JsonRpcCodec {

    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_INITIALIZED = "notifications/initialized";
    public static final String METHOD_TOOLS_LIST = "tools/list";
    public static final String METHOD_TOOLS_CALL = "tools/call";

    private static final String FIELD_JSONRPC = "jsonrpc";
    private static final String FIELD_ID = "id";
    private static final String FIELD_METHOD = "method";
    private static final String FIELD_RESULT = "result";
    private static final String FIELD_ERROR = "error";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();

    public JsonRpcCodec(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String nextId() {
        return "mcp_" + clock.millis() + "_" + counter.incrementAndGet();
    }

    public JsonRpcRequest createRequest(String method, Object params) {
        return JsonRpcRequest.builder()
                .id(nextId())
                .method(method)
                .params(toNode(params))
                .build();
    }

    public JsonRpcRequest createNotification(String method, Object params) {
        return JsonRpcRequest.builder()
                .method(method)
                .params(toNode(params))
                .build();
    }

    public JsonRpcResponse createResponse(Object id, Object result) {
        return JsonRpcResponse.builder()
                .id(id)
                .result(objectMapper.valueToTree(result))
                .build();
    }

    public JsonRpcResponse createErrorResponse(Object id, JsonRpcError error) {
        return JsonRpcResponse.builder()
                .id(id)
                .error(error)
                .build();
    }

    public String serialize(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new McpException(ErrorKind.PROTOCOL_ERROR, "Failed to serialize MCP message", e);
        }
    }

    public Optional<JsonNode> parseTree(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(raw));
        } catch (JsonProcessingException e) {
            log.debug("Unparseable MCP message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses a response, returning empty for malformed JSON or anything that is
     * not a valid JSON-RPC 2.0 response.
     */
    public Optional<JsonRpcResponse> parseResponse(String raw) {
        return parseTree(raw).flatMap(this::parseResponse);
    }

    public Optional<JsonRpcResponse> parseResponse(JsonNode node) {
        if (!isValidResponse(node)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(node, JsonRpcResponse.class));
        } catch (JsonProcessingException e) {
            log.debug("Invalid MCP response: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<JsonRpcRequest> parseRequest(String raw) {
        return parseTree(raw).filter(this::isValidRequest).flatMap(node -> {
            try {
                return Optional.of(objectMapper.treeToValue(node, JsonRpcRequest.class));
            } catch (JsonProcessingException e) {
                log.debug("Invalid MCP request: {}", e.getMessage());
                return Optional.empty();
            }
        });
    }

    public boolean isValidRequest(JsonNode node) {
        if (!hasVersion(node)) {
            return false;
        }
        JsonNode method = node.get(FIELD_METHOD);
        if (method == null || !method.isTextual() || method.asText().isEmpty()) {
            return false;
        }
        JsonNode id = node.get(FIELD_ID);
        return id == null || isValidId(id);
    }

    public boolean isValidResponse(JsonNode node) {
        if (!hasVersion(node)) {
            return false;
        }
        JsonNode id = node.get(FIELD_ID);
        if (id == null || !isValidId(id)) {
            return false;
        }
        boolean hasResult = node.has(FIELD_RESULT);
        boolean hasError = node.hasNonNull(FIELD_ERROR);
        return hasResult != hasError;
    }

    /**
     * Human-readable message of an error object: a textual {@code data} field
     * wins over {@code message}.
     */
    public static String getErrorMessage(JsonRpcError error) {
        if (error == null) {
            return "Unknown MCP error";
        }
        if (error.getData() instanceof String data && !data.isBlank()) {
            return data;
        }
        return error.getMessage() != null ? error.getMessage() : "Unknown MCP error";
    }

    public ObjectNode createInitializeParams(String clientName, String clientVersion, String protocolVersion) {
        return createInitializeParams(clientName, clientVersion, protocolVersion, true, false, false);
    }

    public ObjectNode createInitializeParams(String clientName, String clientVersion, String protocolVersion,
            boolean tools, boolean resources, boolean prompts) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", protocolVersion);
        ObjectNode capabilities = params.putObject("capabilities");
        capabilities.put("tools", tools);
        capabilities.put("resources", resources);
        capabilities.put("prompts", prompts);
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", clientName);
        clientInfo.put("version", clientVersion);
        return params;
    }

    public ObjectNode createToolCallParams(String toolName, Map<String, Object> arguments) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", toolName);
        params.set("arguments", objectMapper.valueToTree(arguments != null ? arguments : Map.of()));
        return params;
    }

    // ==================== Standard errors ====================

    public static JsonRpcError parseError(String details) {
        return error(JsonRpcErrorCode.PARSE_ERROR, "Failed to parse MCP message", details);
    }

    public static JsonRpcError invalidRequest(String details) {
        return error(JsonRpcErrorCode.INVALID_REQUEST, "Invalid MCP request", details);
    }

    public static JsonRpcError methodNotFound(String method) {
        return error(JsonRpcErrorCode.METHOD_NOT_FOUND, "MCP method not found: " + method, null);
    }

    public static JsonRpcError invalidParams(String details) {
        return error(JsonRpcErrorCode.INVALID_PARAMS, "Invalid parameters", details);
    }

    public static JsonRpcError internalError(String details) {
        return error(JsonRpcErrorCode.INTERNAL_ERROR, "Internal MCP error", details);
    }

    private static JsonRpcError error(JsonRpcErrorCode code, String message, String details) {
        return JsonRpcError.builder()
                .code(code.getCode())
                .message(message)
                .data(details)
                .build();
    }

    private JsonNode toNode(Object params) {
        if (params == null) {
            return null;
        }
        return params instanceof JsonNode node ? node : objectMapper.valueToTree(params);
    }

    private static boolean hasVersion(JsonNode node) {
        return node != null && node.isObject() && JsonRpcRequest.VERSION.equals(node.path(FIELD_JSONRPC).asText(null));
    }

    private static boolean isValidId(JsonNode id) {
        return id.isTextual() || id.isNumber();
    }
}
