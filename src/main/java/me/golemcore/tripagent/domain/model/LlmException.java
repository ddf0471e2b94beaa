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
 * Error raised by the streaming model client after classification.
 */
public class LlmException extends TripAgentException {

    private static final long serialVersionUID = 1L;

    private final Integer statusCode;

    public LlmException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public LlmException(ErrorKind kind, String message, Integer statusCode, Throwable cause) {
        super(kind, message, kind.isRetryable(), cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
