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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One attempt of the agent runtime to answer a thread. Tool calls are only
 * present while the run is {@link RunStatus#REQUIRES_ACTION}.
 */
@Value
@Builder(toBuilder = true)
public class ConversationRun {

    String id;
    String threadId;
    RunStatus status;
    @Builder.Default
    List<ToolCallRequest> requiredToolCalls = List.of();
    String lastError;
    Instant createdAt;

    public boolean hasRequiredToolCalls() {
        return requiredToolCalls != null && !requiredToolCalls.isEmpty();
    }
}
