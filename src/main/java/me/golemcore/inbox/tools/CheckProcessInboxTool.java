package me.golemcore.inbox.tools;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.component.ToolComponent;
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ToolDefinition;
import me.golemcore.inbox.domain.model.ToolFailureKind;
import me.golemcore.inbox.domain.model.ToolResult;
import me.golemcore.inbox.domain.service.ProcessRegistry;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Inbox tool: lets the agent read what the status reconciler has recorded for
 * its long-running processes.
 *
 * <p>
 * With {@code process_id} the output is that process serialized as JSON
 * ({@code null} when the id is unknown). Without it the output is a JSON array
 * of every known process, in registry order. The registry content is returned
 * verbatim; the agent decides what to tell the user.
 *
 * <p>
 * When the full array would exceed {@code inbox.tools.max-output-chars}, the
 * output becomes an object {@code {truncated, total, shown, processes}} that
 * lists unfinished processes first, newest first, and stops before the limit.
 * The output is always valid JSON and never cut by the dispatcher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckProcessInboxTool implements ToolComponent {

    public static final String TOOL_NAME = "check_process_inbox";
    private static final String PARAM_PROCESS_ID = "process_id";

    // room for the wrapper object around the listed processes
    private static final int ENVELOPE_RESERVE = 128;

    private static final Comparator<LongRunningProcess> INBOX_PRIORITY = Comparator
            .comparing((LongRunningProcess process) -> process.getStatus().isTerminal())
            .thenComparing(LongRunningProcess::getUpdatedAt, Comparator.reverseOrder())
            .thenComparing(LongRunningProcess::getProcessId);

    private final ProcessRegistry processRegistry;
    private final ObjectMapper objectMapper;
    private final InboxProperties properties;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParameter(
                TOOL_NAME,
                "Checks the inbox of a long running process: its current status and the latest message"
                        + " reported for it. Omit process_id to list every process.",
                PARAM_PROCESS_ID,
                "The ID of the process to check.",
                false);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object rawId = parameters != null ? parameters.get(PARAM_PROCESS_ID) : null;
        try {
            if (rawId == null || rawId.toString().isBlank()) {
                return CompletableFuture.completedFuture(ToolResult.success(listInbox()));
            }
            String processId = rawId.toString().trim();
            Optional<LongRunningProcess> process = processRegistry.get(processId);
            log.debug("[Tools] Inbox check for {} (found={})", processId, process.isPresent());
            return CompletableFuture.completedFuture(
                    ToolResult.success(objectMapper.writeValueAsString(process.orElse(null))));
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Failed to read inbox: " + e.getMessage()));
        }
    }

    private String listInbox() throws JsonProcessingException {
        List<LongRunningProcess> processes = processRegistry.listAll();
        String full = objectMapper.writeValueAsString(processes);
        int maxChars = properties.getTools().getMaxOutputChars();
        if (maxChars <= 0 || full.length() <= maxChars) {
            return full;
        }

        List<LongRunningProcess> prioritized = new ArrayList<>(processes);
        prioritized.sort(INBOX_PRIORITY);
        int budget = maxChars - ENVELOPE_RESERVE;
        int used = 2;
        List<LongRunningProcess> shown = new ArrayList<>();
        for (LongRunningProcess process : prioritized) {
            int size = objectMapper.writeValueAsString(process).length() + 1;
            if (used + size > budget) {
                break;
            }
            used += size;
            shown.add(process);
        }

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("truncated", true);
        envelope.put("total", processes.size());
        envelope.put("shown", shown.size());
        envelope.put("processes", shown);
        log.warn("[Tools] Inbox listing limited to {} of {} processes ({} chars max)",
                shown.size(), processes.size(), maxChars);
        return objectMapper.writeValueAsString(envelope);
    }
}
