package me.golemcore.inbox.domain.service;

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
import me.golemcore.inbox.domain.model.ProcessStatus;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.model.WorkflowInvocation;
import me.golemcore.inbox.domain.model.WorkflowInvocationException;
import me.golemcore.inbox.domain.model.WorkflowRunStatus;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.StatusQueuePort;
import me.golemcore.inbox.port.outbound.WorkflowInvokerPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Delegated work behind a long-running process: triggers the approval workflow,
 * follows its run and reports every status change as an event on the status
 * queue.
 *
 * <p>
 * Runs detached from the chat turn that started it. Nothing is returned to the
 * caller and no exception escapes; the queue is the only way back, so the
 * reconciler stays the single writer of updates.
 */
@Component
@Slf4j
public class ApprovalWorkflowTask {

    private static final int MAX_PUBLISH_ATTEMPTS = 3;
    private static final long PUBLISH_BACKOFF_MS = 500;
    private static final int MAX_CONSECUTIVE_POLL_FAILURES = 5;

    private final WorkflowInvokerPort workflowInvoker;
    private final StatusQueuePort statusQueue;
    private final StatusEventCodec codec;
    private final InboxProperties properties;
    private final Clock clock;

    public ApprovalWorkflowTask(WorkflowInvokerPort workflowInvoker, StatusQueuePort statusQueue,
            StatusEventCodec codec, InboxProperties properties, Clock clock) {
        this.workflowInvoker = workflowInvoker;
        this.statusQueue = statusQueue;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    public void run(String processId, Object featureSpec) {
        InboxProperties.WorkflowProperties config = properties.getWorkflow();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("process_id", processId);
        payload.put("feature_spec", featureSpec);

        try {
            WorkflowInvocation invocation = workflowInvoker.invoke(config.getName(), payload);
            log.info("[Workflow] Process {} triggered workflow '{}' (runId={})",
                    processId, invocation.workflowName(), invocation.runId());
            follow(processId, invocation, config);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Workflow] Process {} interrupted while following workflow", processId);
            publish(processId, ProcessStatus.FAILED, Map.of("error", "Workflow tracking interrupted"));
        } catch (Exception e) { // NOSONAR - detached work must report, not throw
            log.error("[Workflow] Process {} failed: {}", processId, e.getMessage(), e);
            publish(processId, ProcessStatus.FAILED, Map.of("error", describe(e)));
        }
    }

    private void follow(String processId, WorkflowInvocation invocation,
            InboxProperties.WorkflowProperties config) throws InterruptedException {
        Instant deadline = clock.instant().plus(config.getTimeout());
        Duration interval = config.getInitialPollInterval();
        Map<String, Object> lastPublishedAction = null;
        int consecutiveFailures = 0;

        while (true) {
            WorkflowRunStatus status;
            try {
                status = workflowInvoker.getRunStatus(invocation);
                consecutiveFailures = 0;
            } catch (WorkflowInvocationException e) {
                consecutiveFailures++;
                if (consecutiveFailures >= MAX_CONSECUTIVE_POLL_FAILURES) {
                    throw e;
                }
                log.warn("[Workflow] Status check {} failed for process {} ({}/{}): {}",
                        invocation.runId(), processId, consecutiveFailures, MAX_CONSECUTIVE_POLL_FAILURES,
                        e.getMessage());
                status = WorkflowRunStatus.running();
            }

            switch (status.state()) {
            case SUCCEEDED -> {
                publish(processId, ProcessStatus.COMPLETED, completionMessage(status.detail()));
                return;
            }
            case FAILED -> {
                Map<String, Object> message = new LinkedHashMap<>(status.detail());
                message.putIfAbsent("error", "Workflow '" + invocation.workflowName() + "' failed");
                publish(processId, ProcessStatus.FAILED, message);
                return;
            }
            case WAITING -> {
                if (!Objects.equals(lastPublishedAction, status.detail())) {
                    publish(processId, ProcessStatus.REQUIRES_ACTION, status.detail());
                    lastPublishedAction = status.detail();
                }
            }
            case RUNNING -> log.trace("[Workflow] Process {} still running", processId);
            }

            if (!clock.instant().isBefore(deadline)) {
                publish(processId, ProcessStatus.FAILED,
                        Map.of("error", "Workflow did not finish within " + config.getTimeout()));
                return;
            }
            Thread.sleep(interval.toMillis());
            interval = nextInterval(interval, config);
        }
    }

    private static Map<String, Object> completionMessage(Map<String, Object> detail) {
        Map<String, Object> message = new LinkedHashMap<>(detail);
        Object decision = detail.get("decision");
        if (decision != null) {
            message.putIfAbsent("result", "Your request was " + decision + " by approver");
        }
        return message;
    }

    private static Duration nextInterval(Duration current, InboxProperties.WorkflowProperties config) {
        long next = (long) (current.toMillis() * config.getPollMultiplier());
        return Duration.ofMillis(Math.min(Math.max(next, 1), config.getMaxPollInterval().toMillis()));
    }

    void publish(String processId, ProcessStatus status, Map<String, Object> message) {
        String body = codec.encode(new ProcessStatusEvent(processId, status, message));
        for (int attempt = 1; attempt <= MAX_PUBLISH_ATTEMPTS; attempt++) {
            try {
                statusQueue.send(body);
                log.info("[Workflow] Published {} for process {}", status.getWireValue(), processId);
                return;
            } catch (RuntimeException e) {
                log.warn("[Workflow] Publish attempt {}/{} for process {} failed: {}",
                        attempt, MAX_PUBLISH_ATTEMPTS, processId, e.getMessage());
                if (attempt < MAX_PUBLISH_ATTEMPTS && !sleepQuietly(PUBLISH_BACKOFF_MS * attempt)) {
                    break;
                }
            }
        }
        log.error("[Workflow] Status {} for process {} could not be published", status.getWireValue(), processId);
    }

    private static boolean sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
