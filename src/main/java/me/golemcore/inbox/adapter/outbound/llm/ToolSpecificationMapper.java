package me.golemcore.inbox.adapter.outbound.llm;

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

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import me.golemcore.inbox.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Converts {@link ToolDefinition} JSON Schema maps to langchain4j tool
 * specifications. Unknown or missing types fall back to string.
 */
final class ToolSpecificationMapper {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";

    private ToolSpecificationMapper() {
    }

    static List<ToolSpecification> toSpecifications(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        return tools.stream()
                .map(ToolSpecificationMapper::toSpecification)
                .toList();
    }

    @SuppressWarnings("unchecked")
    static ToolSpecification toSpecification(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(KEY_PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters(toObjectSchema(schema, (List<String>) schema.get(KEY_REQUIRED)));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static JsonObjectSchema toObjectSchema(Map<String, Object> schema, List<String> required) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        String description = description(schema);
        if (description != null) {
            builder.description(description);
        }
        Map<String, Object> properties = (Map<String, Object>) schema.get(KEY_PROPERTIES);
        if (properties != null) {
            properties.forEach((name, property) -> builder.addProperty(name,
                    toElement((Map<String, Object>) property)));
        }
        if (required != null && !required.isEmpty()) {
            builder.required(required);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static JsonSchemaElement toElement(Map<String, Object> schema) {
        String description = description(schema);
        List<String> enumValues = (List<String>) schema.get("enum");
        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        String type = schema.get("type") instanceof String value ? value : "string";
        switch (type) {
        case "integer":
            return JsonIntegerSchema.builder().description(description).build();
        case "number":
            return JsonNumberSchema.builder().description(description).build();
        case "boolean":
            return JsonBooleanSchema.builder().description(description).build();
        case "array": {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (schema.get("items") instanceof Map<?, ?> items) {
                builder.items(toElement((Map<String, Object>) items));
            } else {
                builder.items(JsonStringSchema.builder().build());
            }
            return builder.build();
        }
        case "object":
            return toObjectSchema(schema, (List<String>) schema.get(KEY_REQUIRED));
        default:
            return JsonStringSchema.builder().description(description).build();
        }
    }

    private static String description(Map<String, Object> schema) {
        return schema.get("description") instanceof String value && !value.isBlank() ? value : null;
    }
}
