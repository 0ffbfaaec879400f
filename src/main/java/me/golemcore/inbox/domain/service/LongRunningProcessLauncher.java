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
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts long-running processes: registers the process and hands the delegated
 * work to a detached executor. The caller gets the receipt immediately and
 * never waits on, or hears back from, the delegated work.
 */
@Service
@Slf4j
public class LongRunningProcessLauncher {

    private final ProcessRegistry processRegistry;
    private final ApprovalWorkflowTask approvalWorkflowTask;
    private final ExecutorService delegatedWorkExecutor;

    public LongRunningProcessLauncher(ProcessRegistry processRegistry,
            ApprovalWorkflowTask approvalWorkflowTask,
            @Qualifier("delegatedWorkExecutor") ExecutorService delegatedWorkExecutor) {
        this.processRegistry = processRegistry;
        this.approvalWorkflowTask = approvalWorkflowTask;
        this.delegatedWorkExecutor = delegatedWorkExecutor;
    }

    /**
     * @throws RejectedExecutionException
     *             if the delegated work could not be scheduled; a failed
     *             status event is queued for the process in that case
     */
    public LongRunningProcess start(Object featureSpec) {
        String processId = processRegistry.newProcessId();
        LongRunningProcess process = processRegistry.create(processId);

        try {
            delegatedWorkExecutor.execute(() -> approvalWorkflowTask.run(processId, featureSpec));
        } catch (RejectedExecutionException e) {
            log.error("[Launcher] Delegated work for process {} rejected: {}", processId, e.getMessage());
            approvalWorkflowTask.publish(processId, ProcessStatus.FAILED,
                    Map.of("error", "Delegated work could not be scheduled"));
            throw e;
        }

        log.info("[Launcher] Started long running process {}", processId);
        return process;
    }
}
