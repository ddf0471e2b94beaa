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
 * Base unchecked exception carrying an {@link ErrorKind} and an explicit
 * retryable flag.
 */
public class TripAgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final boolean retryable;

    public TripAgentException(ErrorKind kind, String message) {
        this(kind, message, kind.isRetryable(), null);
    }

    public TripAgentException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.isRetryable(), cause);
    }

    public TripAgentException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return kind.getCode();
    }

    public boolean isRetryable() {
        return retryable;
    }
}
