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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of delegated work whose completion is reported
 * asynchronously through the status queue. The registry replaces snapshots
 * atomically, so a reader always observes a complete entry.
 */
@Value
@Builder(toBuilder = true)
public class LongRunningProcess {

    @JsonProperty("process_id")
    String processId;

    ProcessStatus status;

    /**
     * Whatever the external system reported last (action description, decision,
     * error). Empty while the process is freshly started.
     */
    Map<String, Object> message;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;
}
