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
 * Error raised by the tool protocol layer. When the failure originates from a
 * JSON-RPC error response, {@link #getRpcCode()} holds the wire error code.
 */
public class McpException extends TripAgentException {

    private static final long serialVersionUID = 1L;

    private final Integer rpcCode;

    public McpException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public McpException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public McpException(ErrorKind kind, String message, Integer rpcCode, Throwable cause) {
        super(kind, message, cause);
        this.rpcCode = rpcCode;
    }

    public Integer getRpcCode() {
        return rpcCode;
    }
}
