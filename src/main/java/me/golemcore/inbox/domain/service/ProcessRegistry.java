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
import me.golemcore.inbox.domain.model.LongRunningProcess;
import me.golemcore.inbox.domain.model.ProcessStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single source of truth for long-running process state.
 *
 * <p>
 * Written by the tool dispatcher (creation) and the status reconciler
 * (updates), read by the {@code check_process_inbox} tool and the process
 * listing endpoint. Every operation is atomic per process id; entries are
 * immutable snapshots, so concurrent readers never block and never observe a
 * partially applied update.
 *
 * <p>
 * State lives for the lifetime of the JVM only.
 */
@Service
@Slf4j
public class ProcessRegistry {

    private final ConcurrentMap<String, LongRunningProcess> processes = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProcessRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Generates a process id that has never been handed out or observed by this
     * registry.
     */
    public String newProcessId() {
        String processId = UUID.randomUUID().toString();
        while (processes.containsKey(processId)) {
            processId = UUID.randomUUID().toString();
        }
        return processId;
    }

    /**
     * Registers a new process in {@link ProcessStatus#RUNNING} with an empty
     * message.
     *
     * @throws IllegalStateException
     *             if the id is already registered
     */
    public LongRunningProcess create(String processId) {
        requireId(processId);
        Instant now = clock.instant();
        LongRunningProcess created = LongRunningProcess.builder()
                .processId(processId)
                .status(ProcessStatus.RUNNING)
                .message(Map.of())
                .createdAt(now)
                .updatedAt(now)
                .build();
        LongRunningProcess existing = processes.putIfAbsent(processId, created);
        if (existing != null) {
            throw new IllegalStateException("Process already exists: " + processId);
        }
        log.info("[Registry] Created process {} (status={})", processId, created.getStatus().getWireValue());
        return created;
    }

    /**
     * Applies a status update. Unknown ids are accepted and create the entry,
     * since an update may arrive before this instance has seen the process.
     * Updates to a process already in a terminal status are discarded.
     *
     * @return {@code true} if the update was applied
     */
    public boolean update(String processId, ProcessStatus status, Map<String, Object> message) {
        requireId(processId);
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        Map<String, Object> snapshot = copyMessage(message);
        AtomicBoolean applied = new AtomicBoolean(false);

        processes.compute(processId, (id, current) -> {
            Instant now = clock.instant();
            if (current == null) {
                applied.set(true);
                return LongRunningProcess.builder()
                        .processId(id)
                        .status(status)
                        .message(snapshot)
                        .createdAt(now)
                        .updatedAt(now)
                        .build();
            }
            if (current.getStatus().isTerminal()) {
                return current;
            }
            applied.set(true);
            return current.toBuilder()
                    .status(status)
                    .message(snapshot)
                    .updatedAt(now)
                    .build();
        });

        if (applied.get()) {
            log.info("[Registry] Process {} -> {}", processId, status.getWireValue());
        } else {
            log.debug("[Registry] Ignored update for terminal process {} (incoming={})",
                    processId, status.getWireValue());
        }
        return applied.get();
    }

    public Optional<LongRunningProcess> get(String processId) {
        if (processId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(processes.get(processId));
    }

    /**
     * Snapshot of every known process, oldest first.
     */
    public List<LongRunningProcess> listAll() {
        return processes.values().stream()
                .sorted(Comparator.comparing(LongRunningProcess::getCreatedAt)
                        .thenComparing(LongRunningProcess::getProcessId))
                .toList();
    }

    public int size() {
        return processes.size();
    }

    private static void requireId(String processId) {
        if (processId == null || processId.isBlank()) {
            throw new IllegalArgumentException("processId is required");
        }
    }

    private static Map<String, Object> copyMessage(Map<String, Object> message) {
        if (message == null || message.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(message));
    }
}
