package me.golemcore.inbox.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.model.AgentRuntimeException;
import me.golemcore.inbox.domain.model.ConversationRun;
import me.golemcore.inbox.domain.model.ConversationThread;
import me.golemcore.inbox.domain.model.RunStatus;
import me.golemcore.inbox.domain.model.ThreadMessage;
import me.golemcore.inbox.domain.model.ThreadNotFoundException;
import me.golemcore.inbox.domain.model.ToolCallOutput;
import me.golemcore.inbox.domain.model.ToolCallRequest;
import me.golemcore.inbox.domain.model.ToolDefinition;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.AgentRuntimePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Agent runtime backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * Threads, messages and runs live in memory. A run is advanced by model calls
 * on the agent executor: a response with tool execution requests moves the run
 * to {@link RunStatus#REQUIRES_ACTION}; a plain text response is appended to
 * the thread as the assistant message and completes the run. Tool outputs may
 * arrive in several submissions; the run resumes once every requested call has
 * an output.
 *
 * <p>
 * A thread has at most one active run. A run left in {@code REQUIRES_ACTION}
 * longer than {@code inbox.agent.requires-action-expiry} expires.
 */
@Component
@Slf4j
public class LlmAgentRuntimeAdapter implements AgentRuntimePort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;
    private final Duration requiresActionExpiry;
    private final String instructions;
    private final Map<String, ThreadState> threads = new ConcurrentHashMap<>();

    public LlmAgentRuntimeAdapter(ChatModel chatModel, ObjectMapper objectMapper,
            @Qualifier("agentRuntimeExecutor") Executor executor, InboxProperties properties,
            ResourceLoader resourceLoader, Clock clock) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
        this.requiresActionExpiry = properties.getAgent().getRequiresActionExpiry();
        this.instructions = loadInstructions(resourceLoader, properties.getAgent().getInstructionsLocation());
    }

    @Override
    public ConversationThread createThread() {
        ThreadState thread = new ThreadState(UUID.randomUUID().toString(), clock.instant());
        threads.put(thread.id, thread);
        return new ConversationThread(thread.id, thread.createdAt);
    }

    @Override
    public Optional<ConversationThread> getThread(String threadId) {
        if (threadId == null) {
            return Optional.empty();
        }
        ThreadState thread = threads.get(threadId);
        return thread != null ? Optional.of(new ConversationThread(thread.id, thread.createdAt)) : Optional.empty();
    }

    @Override
    public ThreadMessage createMessage(String threadId, String role, String content) {
        ThreadState thread = requireThread(threadId);
        synchronized (thread) {
            return thread.append(role, content, clock.instant());
        }
    }

    @Override
    public List<ThreadMessage> listMessages(String threadId) {
        ThreadState thread = requireThread(threadId);
        synchronized (thread) {
            return List.copyOf(thread.messages);
        }
    }

    @Override
    public ConversationRun createRun(String threadId, List<ToolDefinition> tools) {
        ThreadState thread = requireThread(threadId);
        RunState run;
        synchronized (thread) {
            RunState active = thread.activeRun;
            if (active != null) {
                expireIfStale(thread, active);
                if (!active.status.isTerminal()) {
                    throw new IllegalStateException("Thread " + threadId + " already has an active run " + active.id);
                }
            }
            run = new RunState(UUID.randomUUID().toString(), threadId,
                    ToolSpecificationMapper.toSpecifications(tools), thread.messages.size(), clock.instant());
            thread.runs.put(run.id, run);
            thread.activeRun = run;
        }
        log.debug("[Runtime] Created run {} on thread {} with {} tools", run.id, threadId, run.tools.size());
        schedule(thread, run);
        synchronized (thread) {
            return run.snapshot();
        }
    }

    @Override
    public ConversationRun getRun(String threadId, String runId) {
        ThreadState thread = requireThread(threadId);
        synchronized (thread) {
            RunState run = requireRun(thread, runId);
            expireIfStale(thread, run);
            return run.snapshot();
        }
    }

    @Override
    public ConversationRun cancelRun(String threadId, String runId) {
        ThreadState thread = requireThread(threadId);
        synchronized (thread) {
            RunState run = requireRun(thread, runId);
            expireIfStale(thread, run);
            if (run.status == RunStatus.QUEUED || run.status == RunStatus.IN_PROGRESS) {
                run.status = RunStatus.CANCELLING;
            } else if (run.status == RunStatus.REQUIRES_ACTION) {
                run.requiredCalls = List.of();
                finish(thread, run, RunStatus.CANCELLED, null);
            }
            log.debug("[Runtime] Cancel requested for run {}: {}", runId, run.status);
            return run.snapshot();
        }
    }

    @Override
    public ConversationRun submitToolOutputs(String threadId, String runId, List<ToolCallOutput> outputs) {
        ThreadState thread = requireThread(threadId);
        boolean resume;
        ConversationRun snapshot;
        synchronized (thread) {
            RunState run = requireRun(thread, runId);
            expireIfStale(thread, run);
            if (run.status != RunStatus.REQUIRES_ACTION) {
                throw new IllegalStateException("Run " + runId + " does not accept tool outputs in status "
                        + run.status);
            }
            Map<String, ToolCallRequest> pending = new LinkedHashMap<>();
            for (ToolCallRequest call : run.requiredCalls) {
                if (!run.submittedOutputs.containsKey(call.getId())) {
                    pending.put(call.getId(), call);
                }
            }
            Map<String, String> accepted = new LinkedHashMap<>();
            for (ToolCallOutput output : outputs) {
                if (!pending.containsKey(output.toolCallId()) || accepted.containsKey(output.toolCallId())) {
                    throw new IllegalArgumentException("Unexpected tool call id for run " + runId + ": "
                            + output.toolCallId());
                }
                accepted.put(output.toolCallId(), output.output() != null ? output.output() : "");
            }
            run.submittedOutputs.putAll(accepted);

            resume = run.submittedOutputs.size() == run.requiredCalls.size();
            if (resume) {
                for (ToolCallRequest call : run.requiredCalls) {
                    run.exchange.add(ToolExecutionResultMessage.from(call.getId(), call.getName(),
                            run.submittedOutputs.get(call.getId())));
                }
                run.requiredCalls = List.of();
                run.submittedOutputs.clear();
                run.requiresActionSince = null;
                run.status = RunStatus.QUEUED;
            }
            snapshot = run.snapshot();
            if (resume) {
                log.debug("[Runtime] All tool outputs received for run {}, resuming", runId);
                schedule(thread, run);
            }
        }
        return snapshot;
    }

    private void schedule(ThreadState thread, RunState run) {
        try {
            executor.execute(() -> step(thread, run));
        } catch (RejectedExecutionException e) {
            synchronized (thread) {
                finish(thread, run, RunStatus.FAILED, "Agent runtime is shutting down");
            }
            throw new AgentRuntimeException("Agent runtime rejected run " + run.id, e);
        }
    }

    /**
     * Performs one model call for the run and records its outcome.
     */
    void step(ThreadState thread, RunState run) {
        List<ChatMessage> messages;
        synchronized (thread) {
            if (run.status == RunStatus.CANCELLING) {
                finish(thread, run, RunStatus.CANCELLED, null);
                return;
            }
            if (run.status != RunStatus.QUEUED) {
                return;
            }
            run.status = RunStatus.IN_PROGRESS;
            messages = buildMessages(thread, run);
        }

        ChatResponse response;
        try {
            response = call(messages, run.tools);
        } catch (RuntimeException e) {
            log.warn("[Runtime] Model call failed for run {}: {}", run.id, e.getMessage());
            synchronized (thread) {
                if (run.status == RunStatus.CANCELLING) {
                    finish(thread, run, RunStatus.CANCELLED, null);
                } else {
                    finish(thread, run, RunStatus.FAILED, "Model call failed: " + e.getMessage());
                }
            }
            return;
        }

        synchronized (thread) {
            if (run.status == RunStatus.CANCELLING) {
                finish(thread, run, RunStatus.CANCELLED, null);
                return;
            }
            AiMessage aiMessage = response != null ? response.aiMessage() : null;
            if (aiMessage == null) {
                finish(thread, run, RunStatus.FAILED, "Model returned no message");
            } else if (aiMessage.hasToolExecutionRequests()) {
                run.exchange.add(aiMessage);
                run.requiredCalls = aiMessage.toolExecutionRequests().stream()
                        .map(request -> ToolCallRequest.builder()
                                .id(request.id())
                                .name(request.name())
                                .arguments(parseJsonArgs(request.arguments()))
                                .build())
                        .toList();
                run.requiresActionSince = clock.instant();
                run.status = RunStatus.REQUIRES_ACTION;
                log.debug("[Runtime] Run {} requires {} tool call(s)", run.id, run.requiredCalls.size());
            } else {
                String text = aiMessage.text() != null ? aiMessage.text() : "";
                thread.append(ThreadMessage.ROLE_ASSISTANT, text, clock.instant());
                finish(thread, run, RunStatus.COMPLETED, null);
            }
        }
    }

    private ChatResponse call(List<ChatMessage> messages, List<ToolSpecification> tools) {
        ChatRequest.Builder request = ChatRequest.builder().messages(messages);
        if (!tools.isEmpty()) {
            request.toolSpecifications(tools);
        }
        return chatModel.chat(request.build());
    }

    private List<ChatMessage> buildMessages(ThreadState thread, RunState run) {
        List<ChatMessage> messages = new ArrayList<>();
        if (!instructions.isBlank()) {
            messages.add(SystemMessage.from(instructions));
        }
        for (ThreadMessage message : thread.messages.subList(0, run.historySize)) {
            if (message.isAssistant()) {
                messages.add(AiMessage.from(message.getContent()));
            } else {
                messages.add(UserMessage.from(message.getContent()));
            }
        }
        messages.addAll(run.exchange);
        return messages;
    }

    private void expireIfStale(ThreadState thread, RunState run) {
        if (run.status == RunStatus.REQUIRES_ACTION && run.requiresActionSince != null
                && !clock.instant().isBefore(run.requiresActionSince.plus(requiresActionExpiry))) {
            log.info("[Runtime] Run {} expired waiting for tool outputs", run.id);
            run.requiredCalls = List.of();
            run.submittedOutputs.clear();
            finish(thread, run, RunStatus.EXPIRED, "Tool outputs were not submitted in time");
        }
    }

    private void finish(ThreadState thread, RunState run, RunStatus status, String error) {
        run.status = status;
        run.lastError = error;
        if (thread.activeRun == run) {
            thread.activeRun = null;
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (IOException e) {
            log.warn("[Runtime] Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }

    private ThreadState requireThread(String threadId) {
        ThreadState thread = threadId != null ? threads.get(threadId) : null;
        if (thread == null) {
            throw new ThreadNotFoundException(threadId);
        }
        return thread;
    }

    private static RunState requireRun(ThreadState thread, String runId) {
        RunState run = thread.runs.get(runId);
        if (run == null) {
            throw new AgentRuntimeException("Run not found: " + runId + " on thread " + thread.id);
        }
        return run;
    }

    private static String loadInstructions(ResourceLoader resourceLoader, String location) {
        if (location == null || location.isBlank()) {
            return "";
        }
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load agent instructions from " + location, e);
        }
    }

    static final class ThreadState {

        private final String id;
        private final Instant createdAt;
        private final List<ThreadMessage> messages = new ArrayList<>();
        private final Map<String, RunState> runs = new LinkedHashMap<>();
        private RunState activeRun;

        private ThreadState(String id, Instant createdAt) {
            this.id = id;
            this.createdAt = createdAt;
        }

        private ThreadMessage append(String role, String content, Instant now) {
            ThreadMessage message = ThreadMessage.builder()
                    .id(UUID.randomUUID().toString())
                    .threadId(id)
                    .role(role)
                    .content(content)
                    .createdAt(now)
                    .build();
            messages.add(message);
            return message;
        }
    }

    static final class RunState {

        private final String id;
        private final String threadId;
        private final List<ToolSpecification> tools;
        private final int historySize;
        private final Instant createdAt;
        private final List<ChatMessage> exchange = new ArrayList<>();
        private final Map<String, String> submittedOutputs = new LinkedHashMap<>();
        private RunStatus status = RunStatus.QUEUED;
        private List<ToolCallRequest> requiredCalls = List.of();
        private Instant requiresActionSince;
        private String lastError;

        private RunState(String id, String threadId, List<ToolSpecification> tools, int historySize,
                Instant createdAt) {
            this.id = id;
            this.threadId = threadId;
            this.tools = tools;
            this.historySize = historySize;
            this.createdAt = createdAt;
        }

        private ConversationRun snapshot() {
            return ConversationRun.builder()
                    .id(id)
                    .threadId(threadId)
                    .status(status)
                    .requiredToolCalls(requiredCalls)
                    .lastError(lastError)
                    .createdAt(createdAt)
                    .build();
        }
    }
}
