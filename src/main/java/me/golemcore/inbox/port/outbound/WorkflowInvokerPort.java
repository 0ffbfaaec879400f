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

import me.golemcore.inbox.domain.model.WorkflowInvocation;
import me.golemcore.inbox.domain.model.WorkflowRunStatus;

import java.util.Map;

/**
 * Port for the external workflow engine that carries out human-mediated
 * approvals. Implementations throw
 * {@link me.golemcore.inbox.domain.model.WorkflowInvocationException} on
 * failure.
 */
public interface WorkflowInvokerPort {

    /**
     * Triggers a workflow run by name.
     *
     * @param workflowName
     *            registered workflow name
     * @param payload
     *            JSON-serializable trigger payload
     * @return correlation handle for status polling
     */
    WorkflowInvocation invoke(String workflowName, Map<String, Object> payload);

    WorkflowRunStatus getRunStatus(WorkflowInvocation invocation);
}
