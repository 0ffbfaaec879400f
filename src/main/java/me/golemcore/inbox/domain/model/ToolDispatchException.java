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
 * Failure of a single tool call. Never aborts the surrounding turn.
 */
@Getter
public class ToolDispatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ToolFailureKind kind;
    private final String toolName;

    public ToolDispatchException(ToolFailureKind kind, String toolName, String message) {
        super(message);
        this.kind = kind;
        this.toolName = toolName;
    }

    public ToolDispatchException(ToolFailureKind kind, String toolName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.toolName = toolName;
    }
}
