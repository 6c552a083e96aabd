package com.example.trafficservice.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Rebuilds a concrete value from a {@link SchemaNode}, using recorded examples at the leaves.
 */
public final class SchemaExamples {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SchemaExamples() {
    }

    /**
     * @return the instantiated value, or {@code null} when the schema only ever saw no body
     */
    public static JsonNode instantiate(SchemaNode schema) {
        if (schema == null || schema.isAbsentOnly()) {
            return null;
        }
        if (schema.has(SchemaKind.OBJECT)) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<String, SchemaNode> property : schema.getProperties().entrySet()) {
                JsonNode value = instantiate(property.getValue());
                if (value != null) {
                    object.set(property.getKey(), value);
                }
            }
            return object;
        }
        if (schema.has(SchemaKind.ARRAY)) {
            ArrayNode array = NODES.arrayNode();
            JsonNode item = instantiate(schema.getItems());
            if (item != null) {
                array.add(item);
            }
            return array;
        }
        if (schema.getExample() != null) {
            return schema.getExample();
        }
        if (schema.has(SchemaKind.STRING)) {
            return NODES.textNode("");
        }
        if (schema.has(SchemaKind.NUMBER)) {
            return NODES.numberNode(0);
        }
        if (schema.has(SchemaKind.BOOLEAN)) {
            return NODES.booleanNode(false);
        }
        if (schema.has(SchemaKind.NULL)) {
            return NODES.nullNode();
        }
        return null;
    }
}
