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
 * Machine-readable classification of tool dispatch failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * No synchronous tool or long-running process is registered under the
     * requested name.
     */
    UNKNOWN_TOOL,

    /**
     * Required arguments are missing or have the wrong shape.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, rejected
     * background work).
     */
    EXECUTION_FAILED
}
