package me.golemcore.inbox.domain.service;

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
import lombok.RequiredArgsConstructor;
import me.golemcore.inbox.domain.model.MalformedStatusEventException;
import me.golemcore.inbox.domain.model.ProcessStatus;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON wire format of status events on the queue:
 * {@code {"process_id": "...", "status": "...", "message": {...}}}.
 *
 * <p>
 * {@code process_id} and {@code status} are required. A missing or null
 * {@code message} becomes an empty map; a scalar message is wrapped as
 * {@code {"text": ...}}.
 */
@Component
@RequiredArgsConstructor
public class StatusEventCodec {

    static final String FIELD_PROCESS_ID = "process_id";
    static final String FIELD_STATUS = "status";
    static final String FIELD_MESSAGE = "message";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String encode(ProcessStatusEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(FIELD_PROCESS_ID, event.processId());
        body.put(FIELD_STATUS, event.status().getWireValue());
        body.put(FIELD_MESSAGE, event.message());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Status event is not serializable: " + e.getMessage(), e);
        }
    }

    /**
     * @throws MalformedStatusEventException
     *             if the body is not JSON or required fields are missing
     */
    public ProcessStatusEvent decode(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedStatusEventException("Empty status event");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedStatusEventException("Status event is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedStatusEventException("Status event must be a JSON object");
        }

        String processId = textOrNull(root.get(FIELD_PROCESS_ID));
        if (processId == null) {
            throw new MalformedStatusEventException("Status event is missing '" + FIELD_PROCESS_ID + "'");
        }
        String rawStatus = textOrNull(root.get(FIELD_STATUS));
        if (rawStatus == null) {
            throw new MalformedStatusEventException("Status event is missing '" + FIELD_STATUS + "'");
        }
        ProcessStatus status = ProcessStatus.parse(rawStatus)
                .orElseThrow(() -> new MalformedStatusEventException("Unknown process status: " + rawStatus));

        return new ProcessStatusEvent(processId, status, readMessage(root.get(FIELD_MESSAGE)));
    }

    private Map<String, Object> readMessage(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        if (node.isObject()) {
            return objectMapper.convertValue(node, MAP_TYPE_REF);
        }
        return Map.of("text", node.isTextual() ? node.asText() : node.toString());
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text.trim();
    }
}
