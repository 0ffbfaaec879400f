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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.model.ConversationThread;
import me.golemcore.inbox.domain.model.DeadLetter;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.model.ThreadHistory;
import me.golemcore.inbox.domain.model.ThreadNotFoundException;
import me.golemcore.inbox.port.outbound.AgentRuntimePort;
import me.golemcore.inbox.port.outbound.StatusQueuePort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Conversation boundary: thread lifecycle, chat turns and read access to the
 * process inbox. Also accepts status events from external systems and puts
 * them on the status queue, so the reconciler remains the only writer of
 * updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final AgentRuntimePort agentRuntime;
    private final RunDriver runDriver;
    private final ProcessRegistry processRegistry;
    private final StatusQueuePort statusQueue;
    private final StatusEventCodec codec;

    public ThreadHistory createThread() {
        ConversationThread thread = agentRuntime.createThread();
        log.info("[Conversation] Created thread {}", thread.id());
        return new ThreadHistory(thread.id(), agentRuntime.listMessages(thread.id()));
    }

    /**
     * @throws ThreadNotFoundException
     *             if the thread does not exist
     */
    public ThreadHistory getThread(String threadId) {
        requireThread(threadId);
        return new ThreadHistory(threadId, agentRuntime.listMessages(threadId));
    }

    /**
     * Runs one chat turn and returns the assistant's answer.
     *
     * @throws ThreadNotFoundException
     *             if the thread does not exist
     * @throws me.golemcore.inbox.domain.model.RunFailureException
     *             if the turn ends without an answer
     */
    public String chat(String threadId, String message) {
        requireThread(threadId);
        return runDriver.runTurn(threadId, message);
    }

    public List<LongRunningProcess> listProcesses() {
        return processRegistry.listAll();
    }

    public Optional<LongRunningProcess> getProcess(String processId) {
        return processRegistry.get(processId);
    }

    /**
     * Status events the queue set aside: malformed bodies and messages that
     * exceeded the delivery limit.
     */
    public List<DeadLetter> listDeadLetters() {
        return statusQueue.getDeadLetters();
    }

    /**
     * Validates a raw status event and enqueues it for the reconciler.
     *
     * @throws me.golemcore.inbox.domain.model.MalformedStatusEventException
     *             if the body is not a valid status event
     */
    public ProcessStatusEvent publishStatusEvent(String body) {
        ProcessStatusEvent event = codec.decode(body);
        statusQueue.send(codec.encode(event));
        log.info("[Conversation] Queued external status event for process {} ({})",
                event.processId(), event.status().getWireValue());
        return event;
    }

    private void requireThread(String threadId) {
        if (threadId == null || threadId.isBlank() || agentRuntime.getThread(threadId).isEmpty()) {
            throw new ThreadNotFoundException(threadId);
        }
    }
}
