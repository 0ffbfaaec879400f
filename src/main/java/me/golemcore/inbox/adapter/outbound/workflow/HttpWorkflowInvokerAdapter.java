package me.golemcore.inbox.adapter.outbound.workflow;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.model.WorkflowInvocation;
import me.golemcore.inbox.domain.model.WorkflowInvocationException;
import me.golemcore.inbox.domain.model.WorkflowRunStatus;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.WorkflowInvokerPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Workflow invoker for HTTP-triggered workflow engines (for example Azure Logic
 * Apps).
 *
 * <p>
 * Each workflow is registered under {@code inbox.workflow.endpoints.<name>}
 * with a trigger URL and a run status URL. The trigger is a JSON POST; the run
 * id is read from the {@code x-ms-workflow-run-id} response header, or from a
 * {@code runId} field of the response body. The status URL is polled with an
 * optional bearer token.
 *
 * <p>
 * Engine statuses map as follows:
 * <ul>
 * <li>Running, InProgress, Waiting-for-trigger variants - {@code RUNNING}</li>
 * <li>Waiting - {@code WAITING}</li>
 * <li>Succeeded - {@code SUCCEEDED}, with the approver's decision</li>
 * <li>Failed, Cancelled, TimedOut, Aborted - {@code FAILED}</li>
 * </ul>
 *
 * <p>
 * The decision is read from the run outputs or body first. Engines that keep it
 * on an individual action instead are covered by {@code actions-url}: the
 * adapter lists the run actions, finds the one named {@code decision-action},
 * follows its outputs link and reads {@code body.<decision-field>} from there.
 */
@Component
@ConditionalOnProperty(name = "inbox.workflow.mode", havingValue = "http")
@Slf4j
public class HttpWorkflowInvokerAdapter implements WorkflowInvokerPort {

    static final String RUN_ID_HEADER = "x-ms-workflow-run-id";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final InboxProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpWorkflowInvokerAdapter(InboxProperties properties, OkHttpClient httpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkflowInvocation invoke(String workflowName, Map<String, Object> payload) {
        InboxProperties.HttpWorkflowProperties endpoint = endpoint(workflowName);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new WorkflowInvocationException("Payload for " + workflowName + " is not serializable", e);
        }

        Request request = new Request.Builder()
                .url(endpoint.getTriggerUrl())
                .post(RequestBody.create(body, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            String responseText = readBody(response);
            if (!response.isSuccessful()) {
                throw new WorkflowInvocationException("Error invoking " + workflowName + " (HTTP "
                        + response.code() + "): " + responseText);
            }
            String runId = response.header(RUN_ID_HEADER);
            if (runId == null || runId.isBlank()) {
                runId = textField(responseText, "runId");
            }
            if (runId == null || runId.isBlank()) {
                throw new WorkflowInvocationException("Workflow " + workflowName + " did not return a run id");
            }
            log.info("[Workflow] Invoked {} (run {})", workflowName, runId);
            return new WorkflowInvocation(workflowName, runId);
        } catch (IOException e) {
            throw new WorkflowInvocationException("Error invoking " + workflowName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public WorkflowRunStatus getRunStatus(WorkflowInvocation invocation) {
        InboxProperties.HttpWorkflowProperties endpoint = endpoint(invocation.workflowName());
        if (endpoint.getStatusUrl() == null || endpoint.getStatusUrl().isBlank()) {
            throw new WorkflowInvocationException("No status URL configured for " + invocation.workflowName());
        }
        Request.Builder request = authorized(endpoint, new Request.Builder()
                .url(endpoint.getStatusUrl().replace("{runId}", invocation.runId()))
                .get());

        JsonNode root = fetchJson(request.build(), "Status check for " + invocation.workflowName() + " run "
                + invocation.runId());
        return toRunStatus(root, endpoint, invocation);
    }

    private WorkflowRunStatus toRunStatus(JsonNode root, InboxProperties.HttpWorkflowProperties endpoint,
            WorkflowInvocation invocation) {
        JsonNode props = root.path("properties");
        String status = root.hasNonNull("status") ? root.get("status").asText() : props.path("status").asText("");
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("workflow_status", status);

        switch (status.toLowerCase(Locale.ROOT)) {
        case "running":
        case "inprogress":
        case "in_progress":
        case "queued":
        case "":
            return new WorkflowRunStatus(WorkflowRunStatus.State.RUNNING, detail);
        case "waiting":
            JsonNode action = firstNonMissing(root.path("action"), props.path("action"));
            if (!action.isMissingNode()) {
                detail.put("action", action.isTextual() ? action.asText() : toMap(action));
            }
            return new WorkflowRunStatus(WorkflowRunStatus.State.WAITING, detail);
        case "succeeded":
            String decision = decision(root, props, endpoint.getDecisionField());
            if (decision == null && endpoint.getActionsUrl() != null && !endpoint.getActionsUrl().isBlank()) {
                decision = actionDecision(endpoint, invocation);
            }
            if (decision != null) {
                detail.put("decision", decision);
            }
            return new WorkflowRunStatus(WorkflowRunStatus.State.SUCCEEDED, detail);
        default:
            JsonNode error = firstNonMissing(root.path("error"), props.path("error"));
            detail.put("error", error.isMissingNode()
                    ? "Workflow finished with status: " + status
                    : error.isTextual() ? error.asText() : error.toString());
            return new WorkflowRunStatus(WorkflowRunStatus.State.FAILED, detail);
        }
    }

    private static String decision(JsonNode root, JsonNode props, String field) {
        JsonNode outputs = firstNonMissing(root.path("outputs"), props.path("outputs"));
        JsonNode value = outputs.path(field);
        if (value.isMissingNode()) {
            value = root.path("body").path(field);
        }
        if (value.isObject()) {
            value = value.path("value");
        }
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private String actionDecision(InboxProperties.HttpWorkflowProperties endpoint, WorkflowInvocation invocation) {
        String context = "Action lookup for " + invocation.workflowName() + " run " + invocation.runId();
        JsonNode actions = fetchJson(authorized(endpoint, new Request.Builder()
                .url(endpoint.getActionsUrl().replace("{runId}", invocation.runId()))
                .get()).build(), context);
        JsonNode items = actions.has("value") ? actions.path("value") : actions;
        for (JsonNode action : items) {
            if (!endpoint.getDecisionAction().equals(action.path("name").asText())) {
                continue;
            }
            JsonNode props = action.path("properties");
            JsonNode link = firstNonMissing(props.path("outputsLink"), action.path("outputs_link"));
            String uri = link.path("uri").asText("");
            if (uri.isBlank()) {
                JsonNode inline = firstNonMissing(props.path("outputs"), action.path("outputs"));
                return decision(inline, inline, endpoint.getDecisionField());
            }
            // outputs links are pre-signed and take no bearer token
            JsonNode outputs = fetchJson(new Request.Builder().url(uri).get().build(), context);
            return decision(outputs, outputs, endpoint.getDecisionField());
        }
        log.warn("[Workflow] Action {} not found for run {}", endpoint.getDecisionAction(), invocation.runId());
        return null;
    }

    private static Request.Builder authorized(InboxProperties.HttpWorkflowProperties endpoint,
            Request.Builder request) {
        if (endpoint.getBearerToken() != null && !endpoint.getBearerToken().isBlank()) {
            request.header("Authorization", "Bearer " + endpoint.getBearerToken());
        }
        return request;
    }

    private JsonNode fetchJson(Request request, String context) {
        try (Response response = httpClient.newCall(request).execute()) {
            String responseText = readBody(response);
            if (!response.isSuccessful()) {
                throw new WorkflowInvocationException(context + " failed (HTTP " + response.code() + ")");
            }
            return parse(responseText);
        } catch (IOException e) {
            throw new WorkflowInvocationException(context + " failed: " + e.getMessage(), e);
        }
    }

    private static JsonNode firstNonMissing(JsonNode first, JsonNode second) {
        return first.isMissingNode() || first.isNull() ? second : first;
    }

    private InboxProperties.HttpWorkflowProperties endpoint(String workflowName) {
        InboxProperties.HttpWorkflowProperties endpoint = properties.getWorkflow().getEndpoints().get(workflowName);
        if (endpoint == null || endpoint.getTriggerUrl() == null || endpoint.getTriggerUrl().isBlank()) {
            throw new WorkflowInvocationException("Workflow not registered: " + workflowName);
        }
        return endpoint;
    }

    private JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new WorkflowInvocationException("Workflow returned a non-JSON response", e);
        }
    }

    private String textField(String text, String field) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text).path(field);
            return node.isValueNode() ? node.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("[Workflow] Trigger response is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, MAP_TYPE_REF);
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }
}
