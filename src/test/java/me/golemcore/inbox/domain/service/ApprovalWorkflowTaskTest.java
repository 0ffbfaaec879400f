package me.golemcore.inbox.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.inbox.domain.model.ProcessStatus;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.model.WorkflowInvocation;
import me.golemcore.inbox.domain.model.WorkflowInvocationException;
import me.golemcore.inbox.domain.model.WorkflowRunStatus;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.StatusQueuePort;
import me.golemcore.inbox.port.outbound.WorkflowInvokerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApprovalWorkflowTaskTest {

    private static final WorkflowInvocation INVOCATION = new WorkflowInvocation("approval-workflow", "run-42");
    private static final Map<String, Object> ACTION = Map.of(
            "step_name", "Legal department approval",
            "action", "USA or UK?");

    private WorkflowInvokerPort workflowInvoker;
    private StatusQueuePort statusQueue;
    private StatusEventCodec codec;
    private InboxProperties properties;
    private ApprovalWorkflowTask task;

    @BeforeEach
    void setUp() {
        workflowInvoker = mock(WorkflowInvokerPort.class);
        statusQueue = mock(StatusQueuePort.class);
        codec = new StatusEventCodec(new ObjectMapper());
        properties = new InboxProperties();
        properties.getWorkflow().setInitialPollInterval(Duration.ofMillis(1));
        properties.getWorkflow().setMaxPollInterval(Duration.ofMillis(2));
        properties.getWorkflow().setTimeout(Duration.ofSeconds(5));
        task = new ApprovalWorkflowTask(workflowInvoker, statusQueue, codec, properties, Clock.systemUTC());

        when(workflowInvoker.invoke(eq("approval-workflow"), anyMap())).thenReturn(INVOCATION);
    }

    @Test
    void shouldPublishActionOnceThenCompletion() {
        when(workflowInvoker.getRunStatus(INVOCATION))
                .thenReturn(WorkflowRunStatus.running())
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.WAITING, ACTION))
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.WAITING, ACTION))
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.SUCCEEDED, Map.of("decision", "Approve")));

        task.run("p-1", Map.of("feature_name", "Dark mode"));

        List<ProcessStatusEvent> events = publishedEvents(2);
        assertEquals(ProcessStatus.REQUIRES_ACTION, events.get(0).status());
        assertEquals("USA or UK?", events.get(0).message().get("action"));
        assertEquals(ProcessStatus.COMPLETED, events.get(1).status());
        assertEquals("Your request was Approve by approver", events.get(1).message().get("result"));
        assertEquals("p-1", events.get(1).processId());
    }

    @Test
    void shouldSendProcessIdAndFeatureSpecInPayload() {
        when(workflowInvoker.getRunStatus(INVOCATION))
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.SUCCEEDED, Map.of()));

        task.run("p-1", "spec-json");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(workflowInvoker).invoke(eq("approval-workflow"), payload.capture());
        assertEquals("p-1", payload.getValue().get("process_id"));
        assertEquals("spec-json", payload.getValue().get("feature_spec"));
    }

    @Test
    void shouldPublishFailureWhenWorkflowFails() {
        when(workflowInvoker.getRunStatus(INVOCATION))
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.FAILED, Map.of("workflow_status", "Failed")));

        task.run("p-1", "spec");

        ProcessStatusEvent event = publishedEvents(1).get(0);
        assertEquals(ProcessStatus.FAILED, event.status());
        assertEquals("Failed", event.message().get("workflow_status"));
        assertTrue(event.message().containsKey("error"));
    }

    @Test
    void shouldPublishFailureWhenTriggerFails() {
        when(workflowInvoker.invoke(anyString(), anyMap()))
                .thenThrow(new WorkflowInvocationException("Workflow not registered: approval-workflow"));

        task.run("p-1", "spec");

        ProcessStatusEvent event = publishedEvents(1).get(0);
        assertEquals(ProcessStatus.FAILED, event.status());
        assertEquals("Workflow not registered: approval-workflow", event.message().get("error"));
    }

    @Test
    void shouldToleratePollFailuresUpToLimit() {
        when(workflowInvoker.getRunStatus(INVOCATION))
                .thenThrow(new WorkflowInvocationException("HTTP 502"))
                .thenThrow(new WorkflowInvocationException("HTTP 502"))
                .thenReturn(new WorkflowRunStatus(WorkflowRunStatus.State.SUCCEEDED, Map.of("decision", "Reject")));

        task.run("p-1", "spec");

        ProcessStatusEvent event = publishedEvents(1).get(0);
        assertEquals(ProcessStatus.COMPLETED, event.status());
        assertEquals("Your request was Reject by approver", event.message().get("result"));
    }

    @Test
    void shouldFailAfterRepeatedPollFailures() {
        when(workflowInvoker.getRunStatus(INVOCATION)).thenThrow(new WorkflowInvocationException("HTTP 502"));

        task.run("p-1", "spec");

        ProcessStatusEvent event = publishedEvents(1).get(0);
        assertEquals(ProcessStatus.FAILED, event.status());
        verify(workflowInvoker, times(5)).getRunStatus(INVOCATION);
    }

    @Test
    void shouldFailWhenWorkflowOutlivesTimeout() {
        properties.getWorkflow().setTimeout(Duration.ofMillis(20));
        when(workflowInvoker.getRunStatus(INVOCATION)).thenReturn(WorkflowRunStatus.running());

        task.run("p-1", "spec");

        ProcessStatusEvent event = publishedEvents(1).get(0);
        assertEquals(ProcessStatus.FAILED, event.status());
        assertTrue(event.message().get("error").toString().contains("did not finish"));
    }

    @Test
    void shouldRetryPublishWhenQueueRejectsSend() {
        doThrow(new IllegalStateException("queue busy")).doNothing().when(statusQueue).send(anyString());

        task.publish("p-1", ProcessStatus.RUNNING, Map.of());

        verify(statusQueue, times(2)).send(anyString());
    }

    @Test
    void shouldNotPollWhenTriggerFails() {
        when(workflowInvoker.invoke(anyString(), anyMap())).thenThrow(new WorkflowInvocationException("down"));

        task.run("p-1", "spec");

        verify(workflowInvoker, never()).getRunStatus(any());
    }

    private List<ProcessStatusEvent> publishedEvents(int expected) {
        ArgumentCaptor<String> bodies = ArgumentCaptor.forClass(String.class);
        verify(statusQueue, times(expected)).send(bodies.capture());
        return bodies.getAllValues().stream().map(codec::decode).toList();
    }
}
