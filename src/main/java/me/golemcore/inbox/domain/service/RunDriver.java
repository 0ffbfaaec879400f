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
import me.golemcore.inbox.domain.model.ConversationRun;
import me.golemcore.inbox.domain.model.RunFailureException;
import me.golemcore.inbox.domain.model.RunFailureKind;
import me.golemcore.inbox.domain.model.RunStatus;
import me.golemcore.inbox.domain.model.ThreadMessage;
import me.golemcore.inbox.domain.model.ToolCallOutput;
import me.golemcore.inbox.domain.model.ToolCallRequest;
import me.golemcore.inbox.domain.model.ToolDispatchException;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.AgentRuntimePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;

/**
 * Drives one conversation turn from the submitted user message to the
 * assistant's answer.
 *
 * <p>
 * The run is polled with a bounded backoff. Whenever the runtime asks for
 * action, every tool call not yet dispatched in this run is routed through the
 * {@link ToolDispatcher} in the order reported, and the outputs are submitted
 * as one batch. A failing call never aborts the turn: depending on
 * {@code inbox.run.tool-error-policy} its output is left out or replaced with
 * an error text. A left-out call that the runtime asks for again is answered
 * with its error text, so the run can move on.
 *
 * <p>
 * The turn ends with the latest assistant message, or a
 * {@link RunFailureException} when the run fails, is cancelled, expires,
 * stalls, or outlives the polling budget.
 */
@Service
@Slf4j
public class RunDriver {

    private final AgentRuntimePort agentRuntime;
    private final ToolDispatcher toolDispatcher;
    private final InboxProperties properties;
    private final Clock clock;

    public RunDriver(AgentRuntimePort agentRuntime, ToolDispatcher toolDispatcher,
            InboxProperties properties, Clock clock) {
        this.agentRuntime = agentRuntime;
        this.toolDispatcher = toolDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    public String runTurn(String threadId, String userText) {
        InboxProperties.RunProperties config = properties.getRun();

        agentRuntime.createMessage(threadId, ThreadMessage.ROLE_USER, userText);
        ConversationRun run = agentRuntime.createRun(threadId, toolDispatcher.getToolDefinitions());
        log.info("[RunDriver] Started run {} on thread {}", run.getId(), threadId);

        Instant deadline = clock.instant().plus(config.getTimeout());
        Duration interval = config.getInitialPollInterval();
        TurnCalls calls = new TurnCalls();

        while (!run.getStatus().isTerminal()) {
            if (!clock.instant().isBefore(deadline)) {
                cancelQuietly(run);
                throw new RunFailureException(RunFailureKind.TIMED_OUT, threadId, run.getId(),
                        "Run did not finish within " + config.getTimeout());
            }

            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelQuietly(run);
                throw new RunFailureException(RunFailureKind.INTERRUPTED, threadId, run.getId(),
                        "Turn interrupted while waiting for the run");
            }

            run = agentRuntime.getRun(threadId, run.getId());
            log.debug("[RunDriver] Run {} status: {}", run.getId(), run.getStatus());

            if (run.getStatus() == RunStatus.REQUIRES_ACTION) {
                ConversationRun afterAction = handleRequiredAction(run, calls);
                if (afterAction != run) {
                    interval = config.getInitialPollInterval();
                    run = afterAction;
                    continue;
                }
            }
            interval = nextInterval(interval, config);
        }

        return finish(run);
    }

    /**
     * @return the run returned by the submission, or the same instance when
     *         nothing was submitted
     */
    private ConversationRun handleRequiredAction(ConversationRun run, TurnCalls calls) {
        if (!run.hasRequiredToolCalls()) {
            log.warn("[RunDriver] Run {} requires action but provided no tool calls, cancelling", run.getId());
            cancelQuietly(run);
            throw new RunFailureException(RunFailureKind.STALLED, run.getThreadId(), run.getId(),
                    "Run requested action without any tool calls");
        }

        List<ToolCallOutput> outputs = new ArrayList<>();
        for (ToolCallRequest toolCall : run.getRequiredToolCalls()) {
            String omittedReason = calls.omitted.remove(toolCall.getId());
            if (omittedReason != null) {
                log.info("[RunDriver] Run {} still waits for failed call {}, reporting its error",
                        run.getId(), toolCall.getId());
                outputs.add(errorOutput(toolCall, omittedReason));
                continue;
            }
            if (!calls.dispatched.add(toolCall.getId())) {
                continue;
            }
            try {
                outputs.add(toolDispatcher.dispatch(toolCall));
            } catch (ToolDispatchException e) {
                onToolFailure(run, toolCall, e.getKind() + ": " + e.getMessage(), e, outputs, calls);
            } catch (RuntimeException e) { // NOSONAR - one tool must not abort the turn
                onToolFailure(run, toolCall, e.getMessage(), e, outputs, calls);
            }
        }

        if (outputs.isEmpty()) {
            log.debug("[RunDriver] Run {} has no new tool outputs to submit", run.getId());
            return run;
        }
        log.info("[RunDriver] Submitting {} tool output(s) for run {}", outputs.size(), run.getId());
        try {
            return agentRuntime.submitToolOutputs(run.getThreadId(), run.getId(), outputs);
        } catch (IllegalStateException e) {
            // the run left REQUIRES_ACTION between the poll and the submission
            ConversationRun current = agentRuntime.getRun(run.getThreadId(), run.getId());
            log.warn("[RunDriver] Tool outputs for run {} rejected, run is now {}: {}",
                    run.getId(), current.getStatus(), e.getMessage());
            if (current.getStatus().isTerminal()) {
                return current;
            }
            throw new RunFailureException(RunFailureKind.FAILED, run.getThreadId(), run.getId(),
                    "Tool outputs rejected: " + e.getMessage());
        }
    }

    private void onToolFailure(ConversationRun run, ToolCallRequest toolCall, String reason, Exception error,
            List<ToolCallOutput> outputs, TurnCalls calls) {
        log.error("[RunDriver] Tool call {} ('{}') failed in run {}: {}",
                toolCall.getId(), toolCall.getName(), run.getId(), reason, error);
        if (properties.getRun().getToolErrorPolicy() == InboxProperties.ToolErrorPolicy.REPORT) {
            outputs.add(errorOutput(toolCall, reason));
        } else {
            calls.omitted.put(toolCall.getId(), reason);
        }
    }

    private static ToolCallOutput errorOutput(ToolCallRequest toolCall, String reason) {
        return new ToolCallOutput(toolCall.getId(), "Error: " + reason);
    }

    private String finish(ConversationRun run) {
        switch (run.getStatus()) {
        case COMPLETED -> {
            String response = lastAssistantText(agentRuntime.listMessages(run.getThreadId()));
            log.info("[RunDriver] Run {} completed", run.getId());
            return response;
        }
        case CANCELLED -> throw failure(run, RunFailureKind.CANCELLED, "Run was cancelled");
        case EXPIRED -> throw failure(run, RunFailureKind.EXPIRED, "Run expired");
        default -> throw failure(run, RunFailureKind.FAILED, "Run failed");
        }
    }

    private RunFailureException failure(ConversationRun run, RunFailureKind kind, String fallbackReason) {
        String reason = run.getLastError() != null && !run.getLastError().isBlank()
                ? run.getLastError()
                : fallbackReason;
        log.warn("[RunDriver] Run {} ended with {}: {}", run.getId(), run.getStatus(), reason);
        return new RunFailureException(kind, run.getThreadId(), run.getId(), reason);
    }

    static String lastAssistantText(List<ThreadMessage> messages) {
        if (messages == null) {
            return "";
        }
        ListIterator<ThreadMessage> iterator = messages.listIterator(messages.size());
        while (iterator.hasPrevious()) {
            ThreadMessage message = iterator.previous();
            if (message.isAssistant()) {
                return message.getContent() != null ? message.getContent() : "";
            }
        }
        return "";
    }

    private void cancelQuietly(ConversationRun run) {
        try {
            agentRuntime.cancelRun(run.getThreadId(), run.getId());
        } catch (RuntimeException e) {
            log.warn("[RunDriver] Failed to cancel run {}: {}", run.getId(), e.getMessage());
        }
    }

    /** Tool calls seen during one turn. */
    private static final class TurnCalls {

        private final Set<String> dispatched = new HashSet<>();
        // failed calls left out of a submission, with their error text
        private final Map<String, String> omitted = new LinkedHashMap<>();
    }

    private static Duration nextInterval(Duration current, InboxProperties.RunProperties config) {
        long next = (long) (current.toMillis() * config.getPollMultiplier());
        return Duration.ofMillis(Math.min(Math.max(next, 1), config.getMaxPollInterval().toMillis()));
    }
}
