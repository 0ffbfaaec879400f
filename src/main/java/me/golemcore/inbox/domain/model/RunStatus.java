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

/**
 * Status of a conversation run as reported by the agent runtime.
 */
public enum RunStatus {

    QUEUED,

    IN_PROGRESS,

    /**
     * The runtime waits for tool outputs before it can continue.
     */
    REQUIRES_ACTION,

    CANCELLING,

    CANCELLED,

    COMPLETED,

    FAILED,

    /**
     * Tool outputs were not submitted in time.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED || this == FAILED || this == EXPIRED;
    }
}
