package me.golemcore.inbox.port.outbound;

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

import me.golemcore.inbox.domain.model.ConversationRun;
import me.golemcore.inbox.domain.model.ConversationThread;
import me.golemcore.inbox.domain.model.ThreadMessage;
import me.golemcore.inbox.domain.model.ToolCallOutput;
import me.golemcore.inbox.domain.model.ToolDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port for the agent runtime that owns threads, messages and runs, and decides
 * when a tool has to be called. Implementations throw
 * {@link me.golemcore.inbox.domain.model.AgentRuntimeException} when the runtime
 * is unreachable or rejects a request.
 */
public interface AgentRuntimePort {

    ConversationThread createThread();

    Optional<ConversationThread> getThread(String threadId);

    ThreadMessage createMessage(String threadId, String role, String content);

    /**
     * Lists the thread's messages, oldest first.
     */
    List<ThreadMessage> listMessages(String threadId);

    /**
     * Starts a run on the thread.
     *
     * @param threadId
     *            the thread to answer
     * @param tools
     *            tools the agent may call during this run
     * @return the freshly created run
     */
    ConversationRun createRun(String threadId, List<ToolDefinition> tools);

    ConversationRun getRun(String threadId, String runId);

    ConversationRun cancelRun(String threadId, String runId);

    /**
     * Submits tool outputs, keyed by call id, for a run in
     * {@code REQUIRES_ACTION}.
     */
    ConversationRun submitToolOutputs(String threadId, String runId, List<ToolCallOutput> outputs);
}
