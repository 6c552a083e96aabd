package com.example.trafficservice.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link SchemaNode}s from single observed values.
 */
public final class SchemaInferrer {

    private SchemaInferrer() {
    }

    /**
     * Schema of a parsed JSON value. Array items are the join of every element's schema.
     */
    public static SchemaNode fromJson(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return SchemaNode.absent();
        }
        if (value.isNull()) {
            return SchemaNode.of(SchemaKind.NULL, null);
        }
        if (value.isBoolean()) {
            return SchemaNode.of(SchemaKind.BOOLEAN, value);
        }
        if (value.isNumber()) {
            return SchemaNode.of(SchemaKind.NUMBER, value);
        }
        if (value.isTextual()) {
            return SchemaNode.of(SchemaKind.STRING, value);
        }
        if (value.isArray()) {
            SchemaNode items = null;
            for (JsonNode element : value) {
                items = SchemaNode.merge(items, fromJson(element));
            }
            return SchemaNode.array(items);
        }
        if (value.isObject()) {
            Map<String, SchemaNode> properties = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), fromJson(field.getValue()));
            }
            return SchemaNode.object(properties);
        }
        return SchemaNode.opaque(null, TextNode.valueOf(value.asText()));
    }

    /**
     * Kind of a textual value (query parameter, form field, path segment).
     */
    public static SchemaKind kindOfText(String value) {
        if (value == null) {
            return SchemaKind.NULL;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return SchemaKind.BOOLEAN;
        }
        if (!lower.isEmpty() && isNumeric(lower)) {
            return SchemaKind.NUMBER;
        }
        return SchemaKind.STRING;
    }

    /**
     * Schema of a textual value; the example keeps the original text.
     */
    public static SchemaNode fromText(String value) {
        SchemaKind kind = kindOfText(value);
        return SchemaNode.of(kind, value == null ? null : TextNode.valueOf(value));
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value);
            // Double accepts "NaN", "Infinity" and hex-float suffixes, which are not numbers on the wire
            return value.chars().allMatch(c -> Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e');
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
