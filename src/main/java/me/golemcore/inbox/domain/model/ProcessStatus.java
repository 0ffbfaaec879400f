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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle status of a long-running process.
 *
 * <p>
 * {@link #COMPLETED} and {@link #FAILED} are terminal: once a process reaches
 * one of them the registry ignores every further update.
 */
public enum ProcessStatus {

    RUNNING("running"),

    /**
     * The delegated workflow is waiting for input that only the user can give.
     */
    REQUIRES_ACTION("requires_action"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String wireValue;

    ProcessStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Parses a status reported by an external system. Case, spaces and dashes
     * are normalized, so {@code "requires action"}, {@code "Requires-Action"} and
     * {@code "REQUIRES_ACTION"} all resolve to {@link #REQUIRES_ACTION}.
     */
    public static Optional<ProcessStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace(' ', '_')
                .replace('-', '_');
        for (ProcessStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static ProcessStatus fromWire(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown process status: " + raw));
    }
}
