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
 * Machine-readable error taxonomy shared by the model client, the tool
 * protocol layer and the orchestrator.
 *
 * <p>
 * Each kind carries a stable code (for API responses and logs) and a default
 * retryable flag. Only transient transport conditions are retryable.
 */
public enum ErrorKind {

    NETWORK_ERROR("network.error", true),
    TIMEOUT("network.timeout", true),
    RATE_LIMIT_EXCEEDED("llm.rate_limit", true),
    SERVER_ERROR("llm.server_error", true),
    INVALID_CREDENTIAL("llm.invalid_credential", false),
    INVALID_REQUEST("llm.invalid_request", false),
    CONTEXT_TOO_LONG("llm.context_too_long", false),
    NOT_CONFIGURED("llm.not_configured", false),
    PROTOCOL_ERROR("mcp.protocol_error", false),
    TOOL_NOT_FOUND("mcp.tool_not_found", false),
    SERVER_NOT_CONNECTED("mcp.server_not_connected", false),
    CONNECTION_CLOSED("mcp.connection_closed", false),
    VALIDATION_ERROR("context.validation_error", false),
    CANCELLED("session.cancelled", false),
    UNKNOWN("unknown", false);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
