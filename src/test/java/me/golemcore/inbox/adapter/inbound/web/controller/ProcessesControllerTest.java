package me.golemcore.inbox.adapter.inbound.web.controller;

import me.golemcore.inbox.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.inbox.domain.model.DeadLetter;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.MalformedStatusEventException;
import me.golemcore.inbox.domain.model.ProcessStatus;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.model.QueueMessage;
import me.golemcore.inbox.domain.service.ConversationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProcessesControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");

    private ConversationService conversationService;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        client = WebTestClient.bindToController(new ProcessesController(conversationService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static LongRunningProcess process(String id, ProcessStatus status, Map<String, Object> message) {
        return LongRunningProcess.builder()
                .processId(id)
                .status(status)
                .message(message)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .build();
    }

    @Test
    void shouldListProcesses() {
        when(conversationService.listProcesses()).thenReturn(List.of(
                process("p-1", ProcessStatus.RUNNING, Map.of()),
                process("p-2", ProcessStatus.REQUIRES_ACTION, Map.of("action", "USA or UK?"))));

        client.get().uri("/processes")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[1].process_id").isEqualTo("p-2")
                .jsonPath("$[1].status").isEqualTo("requires_action")
                .jsonPath("$[1].message.action").isEqualTo("USA or UK?")
                .jsonPath("$[0].created_at").isEqualTo("2026-03-01T12:00:00Z");
    }

    @Test
    void shouldReturnProcess() {
        when(conversationService.getProcess("p-1"))
                .thenReturn(Optional.of(process("p-1", ProcessStatus.COMPLETED, Map.of("decision", "Approve"))));

        client.get().uri("/processes/p-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("completed")
                .jsonPath("$.message.decision").isEqualTo("Approve");
    }

    @Test
    void shouldReturnNotFoundForUnknownProcess() {
        when(conversationService.getProcess("missing")).thenReturn(Optional.empty());

        client.get().uri("/processes/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Process not found");
    }

    @Test
    void shouldAcceptStatusEvent() {
        String body = "{\"process_id\":\"p-1\",\"status\":\"Completed\",\"message\":{\"decision\":\"Approve\"}}";
        when(conversationService.publishStatusEvent(body)).thenReturn(
                new ProcessStatusEvent("p-1", ProcessStatus.COMPLETED, Map.of("decision", "Approve")));

        client.post().uri("/processes/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.process_id").isEqualTo("p-1")
                .jsonPath("$.status").isEqualTo("completed")
                .jsonPath("$.queued").isEqualTo(true);
    }

    @Test
    void shouldRejectMalformedStatusEvent() {
        when(conversationService.publishStatusEvent(any()))
                .thenThrow(new MalformedStatusEventException("Unknown status: paused"));

        client.post().uri("/processes/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"process_id\":\"p-1\",\"status\":\"paused\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Unknown status: paused");
    }

    @Test
    void shouldListDeadLetters() {
        when(conversationService.listDeadLetters()).thenReturn(List.of(new DeadLetter(
                new QueueMessage("m-1", "not json", 2, CREATED), "Malformed status event", CREATED)));

        client.get().uri("/processes/dead-letters")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].message_id").isEqualTo("m-1")
                .jsonPath("$[0].body").isEqualTo("not json")
                .jsonPath("$[0].delivery_count").isEqualTo(2)
                .jsonPath("$[0].reason").isEqualTo("Malformed status event")
                .jsonPath("$[0].dead_lettered_at").isEqualTo("2026-03-01T12:00:00Z");
    }
}
