package me.golemcore.inbox.domain.service;

import me.golemcore.inbox.domain.model.ConversationRun;
import me.golemcore.inbox.domain.model.RunFailureException;
import me.golemcore.inbox.domain.model.RunFailureKind;
import me.golemcore.inbox.domain.model.RunStatus;
import me.golemcore.inbox.domain.model.ThreadMessage;
import me.golemcore.inbox.domain.model.ToolCallOutput;
import me.golemcore.inbox.domain.model.ToolCallRequest;
import me.golemcore.inbox.domain.model.ToolDispatchException;
import me.golemcore.inbox.domain.model.ToolFailureKind;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.AgentRuntimePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunDriverTest {

    private static final String THREAD_ID = "thread-1";
    private static final String RUN_ID = "run-1";

    private AgentRuntimePort agentRuntime;
    private ToolDispatcher toolDispatcher;
    private InboxProperties properties;
    private RunDriver runDriver;

    @BeforeEach
    void setUp() {
        agentRuntime = mock(AgentRuntimePort.class);
        toolDispatcher = mock(ToolDispatcher.class);
        properties = new InboxProperties();
        properties.getRun().setInitialPollInterval(Duration.ofMillis(1));
        properties.getRun().setMaxPollInterval(Duration.ofMillis(5));
        properties.getRun().setTimeout(Duration.ofSeconds(5));
        runDriver = new RunDriver(agentRuntime, toolDispatcher, properties, Clock.systemUTC());

        when(toolDispatcher.getToolDefinitions()).thenReturn(List.of());
        when(agentRuntime.createRun(eq(THREAD_ID), anyList())).thenReturn(run(RunStatus.QUEUED));
    }

    // ==================== completion ====================

    @Test
    void shouldReturnLatestAssistantMessage() {
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(run(RunStatus.IN_PROGRESS))
                .thenReturn(run(RunStatus.COMPLETED));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(
                message(ThreadMessage.ROLE_USER, "hello"),
                message(ThreadMessage.ROLE_ASSISTANT, "first answer"),
                message(ThreadMessage.ROLE_USER, "more"),
                message(ThreadMessage.ROLE_ASSISTANT, "second answer")));

        String answer = runDriver.runTurn(THREAD_ID, "more");

        assertEquals("second answer", answer);
        verify(agentRuntime).createMessage(THREAD_ID, ThreadMessage.ROLE_USER, "more");
    }

    @Test
    void shouldReturnEmptyTextWhenNoAssistantMessage() {
        assertEquals("", RunDriver.lastAssistantText(List.of(message(ThreadMessage.ROLE_USER, "hi"))));
        assertEquals("", RunDriver.lastAssistantText(List.of()));
    }

    @Test
    void shouldFailWhenRunFails() {
        when(agentRuntime.getRun(THREAD_ID, RUN_ID)).thenReturn(run(RunStatus.FAILED).toBuilder()
                .lastError("rate limited")
                .build());

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "hi"));

        assertEquals(RunFailureKind.FAILED, error.getKind());
        assertEquals("rate limited", error.getMessage());
        assertEquals(RUN_ID, error.getRunId());
    }

    @Test
    void shouldFailWhenRunExpires() {
        when(agentRuntime.getRun(THREAD_ID, RUN_ID)).thenReturn(run(RunStatus.EXPIRED));

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "hi"));

        assertEquals(RunFailureKind.EXPIRED, error.getKind());
    }

    // ==================== tool calls ====================

    @Test
    void shouldSubmitAllOutputsInOneBatch() {
        ToolCallRequest first = call("call-1", "check_process_inbox");
        ToolCallRequest second = call("call-2", "start_long_running_process");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(first, second))
                .thenReturn(run(RunStatus.COMPLETED));
        when(toolDispatcher.dispatch(first)).thenReturn(new ToolCallOutput("call-1", "[]"));
        when(toolDispatcher.dispatch(second)).thenReturn(new ToolCallOutput("call-2", "Started"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList()))
                .thenReturn(run(RunStatus.QUEUED));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(message(ThreadMessage.ROLE_ASSISTANT, "ok")));

        assertEquals("ok", runDriver.runTurn(THREAD_ID, "go"));

        verify(agentRuntime).submitToolOutputs(THREAD_ID, RUN_ID, List.of(
                new ToolCallOutput("call-1", "[]"),
                new ToolCallOutput("call-2", "Started")));
    }

    @Test
    void shouldOmitFailedToolOutputByDefault() {
        ToolCallRequest failing = call("call-1", "broken");
        ToolCallRequest working = call("call-2", "check_process_inbox");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(failing, working))
                .thenReturn(run(RunStatus.COMPLETED));
        when(toolDispatcher.dispatch(failing))
                .thenThrow(new ToolDispatchException(ToolFailureKind.UNKNOWN_TOOL, "broken", "Unknown tool"));
        when(toolDispatcher.dispatch(working)).thenReturn(new ToolCallOutput("call-2", "[]"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList())).thenReturn(run(RunStatus.QUEUED));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(message(ThreadMessage.ROLE_ASSISTANT, "ok")));

        runDriver.runTurn(THREAD_ID, "go");

        verify(agentRuntime).submitToolOutputs(THREAD_ID, RUN_ID, List.of(new ToolCallOutput("call-2", "[]")));
    }

    @Test
    void shouldReportFailedToolOutputWhenConfigured() {
        properties.getRun().setToolErrorPolicy(InboxProperties.ToolErrorPolicy.REPORT);
        ToolCallRequest failing = call("call-1", "broken");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(failing))
                .thenReturn(run(RunStatus.COMPLETED));
        when(toolDispatcher.dispatch(failing))
                .thenThrow(new ToolDispatchException(ToolFailureKind.UNKNOWN_TOOL, "broken", "Unknown tool"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList())).thenReturn(run(RunStatus.QUEUED));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(message(ThreadMessage.ROLE_ASSISTANT, "ok")));

        runDriver.runTurn(THREAD_ID, "go");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ToolCallOutput>> captor = ArgumentCaptor.forClass(List.class);
        verify(agentRuntime).submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), captor.capture());
        ToolCallOutput output = captor.getValue().get(0);
        assertEquals("call-1", output.toolCallId());
        assertTrue(output.output().startsWith("Error: UNKNOWN_TOOL"));
    }

    @Test
    void shouldReportOmittedCallWhenRuntimeAsksAgain() {
        ToolCallRequest working = call("call-1", "check_process_inbox");
        ToolCallRequest failing = call("call-2", "hallucinated_tool");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(working, failing))
                .thenReturn(requiresAction(working, failing))
                .thenReturn(run(RunStatus.COMPLETED));
        when(toolDispatcher.dispatch(working)).thenReturn(new ToolCallOutput("call-1", "[]"));
        when(toolDispatcher.dispatch(failing))
                .thenThrow(new ToolDispatchException(ToolFailureKind.UNKNOWN_TOOL, "hallucinated_tool", "Unknown tool"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList()))
                .thenReturn(requiresAction(working, failing))
                .thenReturn(run(RunStatus.QUEUED));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(message(ThreadMessage.ROLE_ASSISTANT, "ok")));

        assertEquals("ok", runDriver.runTurn(THREAD_ID, "go"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ToolCallOutput>> captor = ArgumentCaptor.forClass(List.class);
        verify(agentRuntime, times(2)).submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), captor.capture());
        assertEquals(List.of(new ToolCallOutput("call-1", "[]")), captor.getAllValues().get(0));
        List<ToolCallOutput> retry = captor.getAllValues().get(1);
        assertEquals(1, retry.size());
        assertEquals("call-2", retry.get(0).toolCallId());
        assertTrue(retry.get(0).output().startsWith("Error: UNKNOWN_TOOL"));
        verify(toolDispatcher, times(1)).dispatch(working);
        verify(toolDispatcher, times(1)).dispatch(failing);
    }

    @Test
    void shouldNotDispatchSameCallTwice() {
        ToolCallRequest working = call("call-1", "check_process_inbox");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(working))
                .thenReturn(requiresAction(working))
                .thenReturn(run(RunStatus.COMPLETED));
        when(toolDispatcher.dispatch(working)).thenReturn(new ToolCallOutput("call-1", "[]"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList()))
                .thenReturn(requiresAction(working));
        when(agentRuntime.listMessages(THREAD_ID)).thenReturn(List.of(message(ThreadMessage.ROLE_ASSISTANT, "ok")));

        runDriver.runTurn(THREAD_ID, "go");

        verify(toolDispatcher, times(1)).dispatch(working);
        verify(agentRuntime, times(1)).submitToolOutputs(anyString(), anyString(), anyList());
    }

    @Test
    void shouldEndWithRunOutcomeWhenSubmissionIsRejected() {
        ToolCallRequest working = call("call-1", "check_process_inbox");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(working))
                .thenReturn(run(RunStatus.EXPIRED));
        when(toolDispatcher.dispatch(working)).thenReturn(new ToolCallOutput("call-1", "[]"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList()))
                .thenThrow(new IllegalStateException("Run run-1 does not accept tool outputs in status EXPIRED"));

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "go"));

        assertEquals(RunFailureKind.EXPIRED, error.getKind());
    }

    @Test
    void shouldFailTurnWhenSubmissionIsRejectedForLiveRun() {
        ToolCallRequest working = call("call-1", "check_process_inbox");
        when(agentRuntime.getRun(THREAD_ID, RUN_ID))
                .thenReturn(requiresAction(working))
                .thenReturn(run(RunStatus.IN_PROGRESS));
        when(toolDispatcher.dispatch(working)).thenReturn(new ToolCallOutput("call-1", "[]"));
        when(agentRuntime.submitToolOutputs(eq(THREAD_ID), eq(RUN_ID), anyList()))
                .thenThrow(new IllegalStateException("rejected"));

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "go"));

        assertEquals(RunFailureKind.FAILED, error.getKind());
        assertEquals("Tool outputs rejected: rejected", error.getMessage());
    }

    // ==================== abnormal endings ====================

    @Test
    void shouldCancelStalledRun() {
        when(agentRuntime.getRun(THREAD_ID, RUN_ID)).thenReturn(requiresAction());

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "hi"));

        assertEquals(RunFailureKind.STALLED, error.getKind());
        verify(agentRuntime).cancelRun(THREAD_ID, RUN_ID);
        verify(toolDispatcher, never()).dispatch(any());
    }

    @Test
    void shouldCancelRunThatOutlivesTimeout() {
        properties.getRun().setTimeout(Duration.ofMillis(30));
        when(agentRuntime.getRun(THREAD_ID, RUN_ID)).thenReturn(run(RunStatus.IN_PROGRESS));

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "hi"));

        assertEquals(RunFailureKind.TIMED_OUT, error.getKind());
        verify(agentRuntime).cancelRun(THREAD_ID, RUN_ID);
    }

    @Test
    void shouldStillFailWhenCancelFails() {
        when(agentRuntime.getRun(THREAD_ID, RUN_ID)).thenReturn(requiresAction());
        when(agentRuntime.cancelRun(THREAD_ID, RUN_ID)).thenThrow(new IllegalStateException("gone"));

        RunFailureException error = assertThrows(RunFailureException.class,
                () -> runDriver.runTurn(THREAD_ID, "hi"));

        assertEquals(RunFailureKind.STALLED, error.getKind());
    }

    private static ConversationRun run(RunStatus status) {
        return ConversationRun.builder()
                .id(RUN_ID)
                .threadId(THREAD_ID)
                .status(status)
                .build();
    }

    private static ConversationRun requiresAction(ToolCallRequest... calls) {
        return run(RunStatus.REQUIRES_ACTION).toBuilder()
                .requiredToolCalls(List.of(calls))
                .build();
    }

    private static ToolCallRequest call(String id, String name) {
        return ToolCallRequest.builder()
                .id(id)
                .name(name)
                .arguments(Map.of())
                .build();
    }

    private static ThreadMessage message(String role, String content) {
        return ThreadMessage.builder()
                .threadId(THREAD_ID)
                .role(role)
                .content(content)
                .build();
    }
}
