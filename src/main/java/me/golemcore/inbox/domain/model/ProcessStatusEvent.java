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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Status change reported out-of-band for a long-running process. */
public record ProcessStatusEvent(String processId, ProcessStatus status, Map<String, Object> message) {

    public ProcessStatusEvent {
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(status, "status");
        message = message != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(message))
                : Map.of();
    }
}
