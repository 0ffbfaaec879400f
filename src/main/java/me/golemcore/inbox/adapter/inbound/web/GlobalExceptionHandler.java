package me.golemcore.inbox.adapter.inbound.web;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.inbox.domain.model.AgentRuntimeException;
import me.golemcore.inbox.domain.model.RunFailureException;
import me.golemcore.inbox.domain.model.RunFailureKind;
import me.golemcore.inbox.domain.model.ThreadNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.inbox.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(ThreadNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleThreadNotFound(ThreadNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Thread not found");
    }

    @ExceptionHandler(RunFailureException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRunFailure(RunFailureException ex) {
        HttpStatus status = ex.getKind() == RunFailureKind.TIMED_OUT
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        log.warn("[API] Run {} on thread {} ended with {}: {}", ex.getRunId(), ex.getThreadId(), ex.getKind(),
                ex.getMessage());
        return respond(status, ex.getMessage());
    }

    @ExceptionHandler(AgentRuntimeException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleAgentRuntime(AgentRuntimeException ex) {
        log.error("[API] Agent runtime unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Agent runtime unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
