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
import me.golemcore.inbox.adapter.inbound.web.dto.DeadLetterDto;
import me.golemcore.inbox.adapter.inbound.web.dto.EventAcceptedResponse;
import me.golemcore.inbox.adapter.inbound.web.dto.ProcessDto;
import me.golemcore.inbox.domain.model.DeadLetter;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.service.ConversationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Process inbox endpoints and the status callback for external workflow
 * engines.
 */
@RestController
@RequestMapping("/processes")
@RequiredArgsConstructor
public class ProcessesController {

    private final ConversationService conversationService;

    @GetMapping
    public Mono<ResponseEntity<List<ProcessDto>>> listProcesses() {
        List<ProcessDto> dtos = conversationService.listProcesses().stream()
                .map(ProcessesController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/dead-letters")
    public Mono<ResponseEntity<List<DeadLetterDto>>> listDeadLetters() {
        List<DeadLetterDto> dtos = conversationService.listDeadLetters().stream()
                .map(ProcessesController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{processId}")
    public Mono<ResponseEntity<ProcessDto>> getProcess(@PathVariable String processId) {
        LongRunningProcess process = conversationService.getProcess(processId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Process not found"));
        return Mono.just(ResponseEntity.ok(toDto(process)));
    }

    /**
     * Accepts a status event and queues it; the registry changes once the
     * reconciler applies it.
     */
    @PostMapping("/events")
    public Mono<ResponseEntity<EventAcceptedResponse>> publishEvent(@RequestBody(required = false) String body) {
        ProcessStatusEvent event = conversationService.publishStatusEvent(body);
        EventAcceptedResponse response = EventAcceptedResponse.builder()
                .processId(event.processId())
                .status(event.status().getWireValue())
                .queued(true)
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(response));
    }

    private static DeadLetterDto toDto(DeadLetter deadLetter) {
        return DeadLetterDto.builder()
                .messageId(deadLetter.message().messageId())
                .body(deadLetter.message().body())
                .deliveryCount(deadLetter.message().deliveryCount())
                .reason(deadLetter.reason())
                .deadLetteredAt(deadLetter.deadLetteredAt() != null ? deadLetter.deadLetteredAt().toString() : null)
                .build();
    }

    private static ProcessDto toDto(LongRunningProcess process) {
        return ProcessDto.builder()
                .processId(process.getProcessId())
                .status(process.getStatus().getWireValue())
                .message(process.getMessage())
                .createdAt(process.getCreatedAt() != null ? process.getCreatedAt().toString() : null)
                .updatedAt(process.getUpdatedAt() != null ? process.getUpdatedAt().toString() : null)
                .build();
    }
}
