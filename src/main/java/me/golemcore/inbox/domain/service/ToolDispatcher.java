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
import me.golemcore.inbox.domain.component.ToolComponent;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ToolCallOutput;
import me.golemcore.inbox.domain.model.ToolCallRequest;
import me.golemcore.inbox.domain.model.ToolDefinition;
import me.golemcore.inbox.domain.model.ToolDispatchException;
import me.golemcore.inbox.domain.model.ToolFailureKind;
import me.golemcore.inbox.domain.model.ToolResult;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes tool calls requested by the agent runtime.
 *
 * <p>
 * Synchronous tools run inline and their output is returned. The long-running
 * tool never runs its work inline: it registers a process, schedules the
 * delegated work and answers with a receipt carrying the process id.
 *
 * <p>
 * The name to tool mapping is built once at startup. Failures are raised as
 * {@link ToolDispatchException} so the caller can treat them per call.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private static final String PARAM_FEATURE_SPEC = "feature_spec";

    private final Map<String, ToolComponent> toolRegistry;
    private final LongRunningProcessLauncher launcher;
    private final InboxProperties properties;

    public ToolDispatcher(List<ToolComponent> tools, LongRunningProcessLauncher launcher,
            InboxProperties properties) {
        this.launcher = launcher;
        this.properties = properties;
        this.toolRegistry = Collections.unmodifiableMap(buildRegistry(tools, properties.getTools()));
        log.info("[Tools] Registered synchronous tools: {}, long-running tool: {}",
                toolRegistry.keySet(), longRunningToolName());
    }

    /**
     * Definitions of every tool the agent may call, long-running tool included.
     */
    public List<ToolDefinition> getToolDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : toolRegistry.values()) {
            definitions.add(tool.getDefinition());
        }
        definitions.add(ToolDefinition.withStringParameter(
                longRunningToolName(),
                "Starts a long running process (for example an approval by email) for a completed feature"
                        + " specification. Returns the process ID immediately; the result arrives later in the"
                        + " process inbox.",
                PARAM_FEATURE_SPEC,
                "The feature specification to be processed, as a JSON document.",
                true));
        return definitions;
    }

    public ToolCallOutput dispatch(ToolCallRequest toolCall) {
        String toolName = toolCall.getName();
        if (longRunningToolName().equals(toolName)) {
            return startLongRunningProcess(toolCall);
        }

        ToolComponent tool = toolRegistry.get(toolName);
        if (tool == null) {
            String available = String.join(", ", toolRegistry.keySet());
            throw new ToolDispatchException(ToolFailureKind.UNKNOWN_TOOL, toolName,
                    "Unknown tool: " + toolName + ". Available tools: " + available + ", " + longRunningToolName());
        }

        log.info("[Tools] Executing '{}' (call {})", toolName, toolCall.getId());
        ToolResult result = executeTool(tool, toolCall);
        if (!result.isSuccess()) {
            ToolFailureKind kind = result.getFailureKind() != null
                    ? result.getFailureKind()
                    : ToolFailureKind.EXECUTION_FAILED;
            throw new ToolDispatchException(kind, toolName, result.getError());
        }
        return new ToolCallOutput(toolCall.getId(), truncateOutput(result.getOutput(), toolName));
    }

    private ToolCallOutput startLongRunningProcess(ToolCallRequest toolCall) {
        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        Object featureSpec = arguments.get(PARAM_FEATURE_SPEC);
        if (featureSpec == null) {
            throw new ToolDispatchException(ToolFailureKind.INVALID_ARGUMENTS, toolCall.getName(),
                    "Missing required argument: " + PARAM_FEATURE_SPEC);
        }

        LongRunningProcess process;
        try {
            process = launcher.start(featureSpec);
        } catch (RejectedExecutionException e) {
            throw new ToolDispatchException(ToolFailureKind.EXECUTION_FAILED, toolCall.getName(),
                    "Long running process could not be scheduled", e);
        }
        String receipt = "Started long running process " + process.getProcessId()
                + " (Status: " + process.getStatus().getWireValue() + ")";
        return new ToolCallOutput(toolCall.getId(), receipt);
    }

    private ToolResult executeTool(ToolComponent tool, ToolCallRequest toolCall) {
        try {
            CompletableFuture<ToolResult> future = tool.execute(
                    toolCall.getArguments() != null ? toolCall.getArguments() : Map.of());
            ToolResult result = future.get(properties.getTools().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolDispatchException(ToolFailureKind.EXECUTION_FAILED, toolCall.getName(),
                    "Tool execution interrupted", e);
        } catch (TimeoutException e) {
            throw new ToolDispatchException(ToolFailureKind.EXECUTION_FAILED, toolCall.getName(),
                    "Tool execution timed out after " + properties.getTools().getTimeout(), e);
        } catch (ExecutionException | RuntimeException e) {
            throw new ToolDispatchException(ToolFailureKind.EXECUTION_FAILED, toolCall.getName(),
                    "Tool execution failed: " + safeCauseMessage(e), e);
        }
    }

    private String longRunningToolName() {
        return properties.getTools().getLongRunningToolName();
    }

    /**
     * Truncate tool output that exceeds the configured max length.
     */
    String truncateOutput(String content, String toolName) {
        if (content == null) {
            return "";
        }
        int maxChars = properties.getTools().getMaxOutputChars();
        if (maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Tools] Truncating '{}' output: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private static Map<String, ToolComponent> buildRegistry(List<ToolComponent> tools,
            InboxProperties.ToolsProperties config) {
        Map<String, ToolComponent> registry = new LinkedHashMap<>();
        if (tools == null) {
            return registry;
        }
        List<String> enabled = config.getEnabled();
        for (ToolComponent tool : tools) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                continue;
            }
            if (enabled != null && !enabled.isEmpty() && !enabled.contains(name)) {
                log.debug("[Tools] Skipping '{}': not in inbox.tools.enabled", name);
                continue;
            }
            if (name.equals(config.getLongRunningToolName())) {
                throw new IllegalStateException("Tool name is reserved for the long-running tool: " + name);
            }
            if (registry.putIfAbsent(name, tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
        }
        return registry;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
