package me.golemcore.inbox.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the inbox service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code inbox.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - chat model and agent runtime behaviour</li>
 * <li>{@link RunProperties} - run polling backoff and tool error policy</li>
 * <li>{@link ToolsProperties} - enabled tools and the long-running tool</li>
 * <li>{@link WorkflowProperties} - delegated approval workflows</li>
 * <li>{@link QueueProperties} - status queue transport</li>
 * <li>{@link ReconcilerProperties} - status reconciler loop</li>
 * <li>{@link HttpProperties} - outbound HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "inbox")
@Data
public class InboxProperties {

    private AgentProperties agent = new AgentProperties();
    private RunProperties run = new RunProperties();
    private ToolsProperties tools = new ToolsProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private QueueProperties queue = new QueueProperties();
    private ReconcilerProperties reconciler = new ReconcilerProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== AGENT ====================

    @Data
    public static class AgentProperties {
        private String name = "feature-spec-agent";
        private String model = "gpt-4o";
        private String apiKey = "";
        private String baseUrl;
        private Double temperature = 0.2;
        private Duration timeout = Duration.ofSeconds(60);
        private String instructionsLocation = "classpath:prompts/agent-instructions.md";
        private Duration requiresActionExpiry = Duration.ofMinutes(10);
        private int executorThreads = 4;
    }

    // ==================== RUN DRIVER ====================

    public enum ToolErrorPolicy {
        /** Leave the failed call's output out of the submitted batch. */
        OMIT,
        /** Submit an error text as the failed call's output. */
        REPORT
    }

    @Data
    public static class RunProperties {
        private Duration initialPollInterval = Duration.ofSeconds(1);
        private double pollMultiplier = 1.5;
        private Duration maxPollInterval = Duration.ofSeconds(5);
        private Duration timeout = Duration.ofMinutes(5);
        private ToolErrorPolicy toolErrorPolicy = ToolErrorPolicy.OMIT;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /**
         * Synchronous tools exposed to the agent. Empty means every registered
         * tool.
         */
        private List<String> enabled = new ArrayList<>();
        private String longRunningToolName = "start_long_running_process";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxOutputChars = 20_000;
    }

    // ==================== WORKFLOW ====================

    public enum WorkflowMode {
        HTTP, SIMULATED
    }

    @Data
    public static class WorkflowProperties {
        private WorkflowMode mode = WorkflowMode.SIMULATED;
        private String name = "approval-workflow";
        private int executorThreads = 8;
        private Duration initialPollInterval = Duration.ofSeconds(5);
        private double pollMultiplier = 1.5;
        private Duration maxPollInterval = Duration.ofSeconds(60);
        private Duration timeout = Duration.ofHours(24);
        private Map<String, HttpWorkflowProperties> endpoints = new LinkedHashMap<>();
        private SimulatedWorkflowProperties simulated = new SimulatedWorkflowProperties();
    }

    @Data
    public static class HttpWorkflowProperties {
        private String triggerUrl;
        /**
         * Run status URL; {@code {runId}} is replaced with the workflow run id.
         */
        private String statusUrl;
        private String bearerToken;
        private String decisionField = "SelectedOption";
        /**
         * Run actions URL; {@code {runId}} is replaced with the workflow run id.
         * When set, a decision missing from the run status is read from the
         * outputs of {@link #decisionAction}.
         */
        private String actionsUrl;
        private String decisionAction = "Send_approval_email";
    }

    @Data
    public static class SimulatedWorkflowProperties {
        private Duration actionDelay = Duration.ofSeconds(10);
        private Duration completionDelay = Duration.ofSeconds(60);
        private String stepName = "Legal department approval";
        private String sendTo = "User proxy";
        private String action = "Legal department wants to know what country this feature should be deployed in,"
                + " USA or UK? Get the response from the user";
        private String decision = "Approve";
    }

    // ==================== QUEUE ====================

    @Data
    public static class QueueProperties {
        private String name = "process-status";
        private Duration lockDuration = Duration.ofSeconds(30);
        private int maxDeliveryCount = 10;
    }

    // ==================== RECONCILER ====================

    public enum MalformedEventPolicy {
        DEAD_LETTER, DROP
    }

    @Data
    public static class ReconcilerProperties {
        private boolean enabled = true;
        private int maxBatchSize = 20;
        private Duration maxWait = Duration.ofSeconds(5);
        private MalformedEventPolicy malformedEventPolicy = MalformedEventPolicy.DEAD_LETTER;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
