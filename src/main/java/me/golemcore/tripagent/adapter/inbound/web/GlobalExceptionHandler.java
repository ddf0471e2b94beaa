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

package me.golemcore.tripagent.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tripagent.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.tripagent.domain.model.TripAgentException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.tripagent.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(TripAgentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTripAgent(TripAgentException ex) {
        HttpStatus status = statusFor(ex);
        log.warn("[API] {} ({}): {}", status, ex.getCode(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getMessage())
                .code(ex.getCode())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusFor(TripAgentException ex) {
        return switch (ex.getKind()) {
        case VALIDATION_ERROR, INVALID_REQUEST, CONTEXT_TOO_LONG -> HttpStatus.BAD_REQUEST;
        case TOOL_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case INVALID_CREDENTIAL -> HttpStatus.UNAUTHORIZED;
        case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
        case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        case NETWORK_ERROR, SERVER_ERROR, PROTOCOL_ERROR -> HttpStatus.BAD_GATEWAY;
        case NOT_CONFIGURED, SERVER_NOT_CONNECTED, CONNECTION_CLOSED -> HttpStatus.SERVICE_UNAVAILABLE;
        case CANCELLED, UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
