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

import lombok.Getter;

/**
 * Typed failure of a chat turn. Carries the run identity so callers can
 * correlate it with runtime logs.
 */
@Getter
public class RunFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RunFailureKind kind;
    private final String threadId;
    private final String runId;

    public RunFailureException(RunFailureKind kind, String threadId, String runId, String reason) {
        super(reason);
        this.kind = kind;
        this.threadId = threadId;
        this.runId = runId;
    }
}
