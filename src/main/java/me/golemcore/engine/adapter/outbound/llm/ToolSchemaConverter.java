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


package me.golemcore.engine.adapter.outbound.llm;

import me.golemcore.engine.domain.model.ToolDefinition;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.List;
import java.util.Map;

/**
 * Converts the map-based JSON schemas of {@link ToolDefinition} into
 * langchain4j tool specifications.
 */
final class ToolSchemaConverter {

    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_DESCRIPTION = "description";

    private ToolSchemaConverter() {
    }

    static ToolSpecification toSpecification(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());
        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(KEY_PROPERTIES) instanceof Map<?, ?>) {
            builder.parameters(toObjectSchema(schema));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    static JsonObjectSchema toObjectSchema(Map<String, Object> schema) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        String description = description(schema);
        if (description != null) {
            builder.description(description);
        }
        if (schema.get(KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                if (entry.getValue() instanceof Map<?, ?> property) {
                    builder.addProperty(String.valueOf(entry.getKey()), toElement((Map<String, Object>) property));
                }
            }
        }
        if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
            builder.required(required.stream().map(String::valueOf).toList());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    static JsonSchemaElement toElement(Map<String, Object> schema) {
        String description = description(schema);
        if (schema.get("enum") instanceof List<?> values && !values.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(values.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        Object type = schema.get("type");
        String typeName = type instanceof String s ? s : "string";
        return switch (typeName) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (schema.get("items") instanceof Map<?, ?> items) {
                builder.items(toElement((Map<String, Object>) items));
            } else {
                builder.items(JsonStringSchema.builder().build());
            }
            yield builder.build();
        }
        case "object" -> toObjectSchema(schema);
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private static String description(Map<String, Object> schema) {
        Object value = schema.get(KEY_DESCRIPTION);
        return value instanceof String s && !s.isBlank() ? s : null;
    }
}
