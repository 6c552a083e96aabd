package com.example.trafficservice.docs;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.model.RequestDefinition;
import com.example.trafficservice.model.ResponseDefinition;
import com.example.trafficservice.schema.SchemaExamples;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders endpoint definitions as one Markdown document. The output depends only on the
 * definitions, so the same catalogue always renders byte-identical text.
 */
@Component
public class DocumentationRenderer {

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final int maxExampleLength;

    public DocumentationRenderer(PipelineProperties properties) {
        this.maxExampleLength = properties.getMaxDocumentedExampleLength();
    }

    public String render(List<ApiDefinition> definitions) {
        StringBuilder md = new StringBuilder();
        md.append("# API Documentation\n\n");
        md.append("Generated from ").append(definitions.size())
          .append(definitions.size() == 1 ? " endpoint" : " endpoints").append(" observed in captured traffic.\n\n");

        if (definitions.isEmpty()) {
            md.append("_No endpoints were observed._\n");
            return md.toString();
        }

        md.append("## Endpoints\n\n");
        for (ApiDefinition definition : definitions) {
            md.append("- [").append(definition.getKey()).append("](#").append(anchor(definition.getKey())).append(")\n");
        }
        md.append('\n');

        for (ApiDefinition definition : definitions) {
            renderEndpoint(md, definition);
        }
        return md.toString();
    }

    private void renderEndpoint(StringBuilder md, ApiDefinition definition) {
        md.append("---\n\n");
        md.append("## ").append(definition.getKey()).append("\n\n");
        if (definition.getDescription() != null) {
            md.append(definition.getDescription()).append("\n\n");
        }
        md.append("- Hosts: ").append(definition.getHosts().isEmpty()
            ? "_none_" : definition.getHosts().stream().map(h -> "`" + h + "`").collect(Collectors.joining(", ")))
          .append('\n');
        md.append("- Samples: ").append(definition.getSampleCount()).append('\n');
        if (definition.getLastSeen() != null) {
            md.append("- Last seen: ").append(definition.getLastSeen()).append('\n');
        }
        md.append('\n');

        RequestDefinition request = definition.getRequest();
        md.append("### Request\n\n");
        fieldTable(md, "Path parameters", request.getPathParams());
        fieldTable(md, "Query parameters", request.getQueryParams());
        fieldTable(md, "Headers", request.getHeaders());
        body(md, request.getContentType(), request.getBodySchema());

        ResponseDefinition response = definition.getResponse();
        md.append("### Response\n\n");
        md.append("Status: `").append(response.getStatusCode()).append('`');
        if (response.getObservedStatusCodes().size() > 1) {
            md.append(" (observed: ").append(response.getObservedStatusCodes().stream()
                .map(String::valueOf).collect(Collectors.joining(", "))).append(')');
        }
        md.append("\n\n");
        fieldTable(md, "Headers", response.getHeaders());
        body(md, response.getContentType(), response.getBodySchema());
    }

    private void fieldTable(StringBuilder md, String title, List<FieldDefinition> fields) {
        if (fields.isEmpty()) {
            return;
        }
        md.append("#### ").append(title).append("\n\n");
        md.append("| Name | Type | Required | Example |\n");
        md.append("|------|------|----------|---------|\n");
        for (FieldDefinition field : fields) {
            md.append("| ").append(cell(field.getName()))
              .append(" | ").append(cell(typeLabel(field)))
              .append(" | ").append(field.isRequired() ? "yes" : "no")
              .append(" | ").append(field.getExample() == null ? "" : "`" + cell(truncate(field.getExample())) + "`")
              .append(" |\n");
        }
        md.append('\n');
    }

    private void body(StringBuilder md, String contentType, SchemaNode schema) {
        if (schema == null || schema.isAbsentOnly()) {
            return;
        }
        md.append("#### Body\n\n");
        if (contentType != null) {
            md.append("Content type: `").append(contentType).append("`\n\n");
        }
        if (schema.isOpaque() && !schema.has(SchemaKind.OBJECT) && !schema.has(SchemaKind.ARRAY)) {
            md.append("Opaque body");
            if (schema.getFormat() != null) {
                md.append(" (`").append(schema.getFormat()).append("`)");
            }
            md.append(".\n\n");
        } else {
            md.append("| Field | Type | Required |\n");
            md.append("|-------|------|----------|\n");
            schemaRows(md, "$", schema, true);
            md.append('\n');
        }

        JsonNode example = SchemaExamples.instantiate(schema);
        if (example != null) {
            md.append("Example:\n\n```").append(example.isContainerNode() ? "json" : "").append('\n')
              .append(truncate(print(example))).append("\n```\n\n");
        }
    }

    private void schemaRows(StringBuilder md, String path, SchemaNode schema, boolean required) {
        md.append("| `").append(cell(path)).append("` | ").append(cell(schema.typeLabel()))
          .append(" | ").append(required ? "yes" : "no").append(" |\n");
        for (Map.Entry<String, SchemaNode> property : schema.getProperties().entrySet()) {
            schemaRows(md, path + "." + property.getKey(), property.getValue(),
                schema.getRequired().contains(property.getKey()));
        }
        if (schema.getItems() != null) {
            schemaRows(md, path + "[]", schema.getItems(), true);
        }
    }

    private String print(JsonNode example) {
        if (example.isTextual()) {
            return example.asText();
        }
        try {
            return objectMapper.writeValueAsString(example);
        } catch (JsonProcessingException e) {
            return example.toString();
        }
    }

    private String truncate(String text) {
        if (maxExampleLength > 0 && text.length() > maxExampleLength) {
            return text.substring(0, maxExampleLength) + "...";
        }
        return text;
    }

    private static String typeLabel(FieldDefinition field) {
        return field.getTypes().stream().map(SchemaKind::getValue).collect(Collectors.joining("|"));
    }

    private static String cell(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }

    static String anchor(String heading) {
        return heading.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9 -]", "").replace(' ', '-');
    }
}
