package me.golemcore.inbox.domain.model;

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

import java.util.Map;

/**
 * Snapshot of a delegated workflow run.
 *
 * @param state
 *            coarse run state
 * @param detail
 *            decision payload on success, action description while waiting,
 *            error on failure
 */
public record WorkflowRunStatus(State state, Map<String, Object> detail) {

    public enum State {
        RUNNING, WAITING, SUCCEEDED, FAILED;

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    public WorkflowRunStatus {
        detail = detail != null ? detail : Map.of();
    }

    public static WorkflowRunStatus running() {
        return new WorkflowRunStatus(State.RUNNING, Map.of());
    }
}
