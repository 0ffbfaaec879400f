package me.golemcore.inbox.adapter.outbound.workflow;

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
import me.golemcore.inbox.domain.model.WorkflowInvocation;
import me.golemcore.inbox.domain.model.WorkflowInvocationException;
import me.golemcore.inbox.domain.model.WorkflowRunStatus;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.WorkflowInvokerPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local stand-in for the approval workflow engine. A run asks for user input
 * after {@code action-delay} and succeeds with the configured decision after
 * {@code completion-delay}, both measured from the trigger.
 */
@Component
@ConditionalOnProperty(name = "inbox.workflow.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedWorkflowInvokerAdapter implements WorkflowInvokerPort {

    private final InboxProperties.SimulatedWorkflowProperties settings;
    private final Clock clock;
    private final Map<String, Instant> startedRuns = new ConcurrentHashMap<>();

    public SimulatedWorkflowInvokerAdapter(InboxProperties properties, Clock clock) {
        this.settings = properties.getWorkflow().getSimulated();
        this.clock = clock;
    }

    @Override
    public WorkflowInvocation invoke(String workflowName, Map<String, Object> payload) {
        String runId = UUID.randomUUID().toString();
        startedRuns.put(runId, clock.instant());
        log.info("[Workflow] Simulated run {} of {} started", runId, workflowName);
        return new WorkflowInvocation(workflowName, runId);
    }

    @Override
    public WorkflowRunStatus getRunStatus(WorkflowInvocation invocation) {
        Instant startedAt = startedRuns.get(invocation.runId());
        if (startedAt == null) {
            throw new WorkflowInvocationException("Unknown workflow run: " + invocation.runId());
        }
        Duration elapsed = Duration.between(startedAt, clock.instant());
        if (elapsed.compareTo(settings.getActionDelay()) < 0) {
            return WorkflowRunStatus.running();
        }
        if (elapsed.compareTo(settings.getCompletionDelay()) < 0) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("step_name", settings.getStepName());
            detail.put("send_to", settings.getSendTo());
            detail.put("action", settings.getAction());
            return new WorkflowRunStatus(WorkflowRunStatus.State.WAITING, detail);
        }
        startedRuns.remove(invocation.runId());
        return new WorkflowRunStatus(WorkflowRunStatus.State.SUCCEEDED, Map.of("decision", settings.getDecision()));
    }
}
