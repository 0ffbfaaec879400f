package me.golemcore.inbox.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.inbox.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.inbox.adapter.inbound.web.dto.MessageDto;
import me.golemcore.inbox.adapter.inbound.web.dto.ThreadResponse;
import me.golemcore.inbox.domain.model.ThreadHistory;
import me.golemcore.inbox.domain.service.ConversationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Conversation endpoints: thread creation, history and chat turns.
 *
 * <p>
 * A chat turn blocks until the agent answers, so it runs on the bounded elastic
 * scheduler.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ThreadsController {

    private final ConversationService conversationService;

    @PostMapping("/threads")
    public Mono<ResponseEntity<ThreadResponse>> createThread() {
        return Mono.fromCallable(() -> ResponseEntity.ok(toResponse(conversationService.createThread())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/threads/{threadId}")
    public Mono<ResponseEntity<ThreadResponse>> getThread(@PathVariable String threadId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toResponse(conversationService.getThread(threadId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (request.getThreadId() == null || request.getThreadId().isBlank()) {
            return Mono.error(new IllegalArgumentException("thread_id is required"));
        }
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.error(new IllegalArgumentException("message is required"));
        }
        log.debug("[API] Chat turn on thread {}", request.getThreadId());
        return Mono.fromCallable(() -> conversationService.chat(request.getThreadId(), request.getMessage()))
                .map(answer -> ResponseEntity.ok(ChatResponse.builder().response(answer).build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static ThreadResponse toResponse(ThreadHistory history) {
        return ThreadResponse.builder()
                .threadId(history.threadId())
                .messages(history.messages().stream()
                        .map(message -> MessageDto.builder()
                                .role(message.getRole())
                                .content(message.getContent())
                                .build())
                        .toList())
                .build();
    }
}
