package com.example.trafficservice.docs;

import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.model.RequestDefinition;
import com.example.trafficservice.model.ResponseDefinition;
import com.example.trafficservice.schema.SchemaExamples;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import com.example.trafficservice.service.TestSynthesizerService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Renders endpoint definitions as an OpenAPI 3.0 document.
 */
@Component
public class OpenApiRenderer {

    static final String OPENAPI_VERSION = "3.0.3";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode render(List<ApiDefinition> definitions, String title) {
        ObjectNode root = NODES.objectNode();
        root.put("openapi", OPENAPI_VERSION);
        root.putObject("info")
            .put("title", title)
            .put("version", "1.0.0")
            .put("description", "Generated from captured traffic");

        TreeSet<String> hosts = new TreeSet<>();
        definitions.forEach(definition -> hosts.addAll(definition.getHosts()));
        ArrayNode servers = root.putArray("servers");
        hosts.forEach(host -> servers.addObject().put("url", "https://" + host));

        ObjectNode paths = root.putObject("paths");
        for (ApiDefinition definition : definitions) {
            ObjectNode pathItem = paths.has(definition.getPathTemplate())
                ? (ObjectNode) paths.get(definition.getPathTemplate())
                : paths.putObject(definition.getPathTemplate());
            pathItem.set(definition.getMethod().toLowerCase(Locale.ROOT), operation(definition));
        }
        return root;
    }

    private ObjectNode operation(ApiDefinition definition) {
        ObjectNode operation = NODES.objectNode();
        operation.put("summary", definition.getDescription());
        operation.put("operationId", TestSynthesizerService.testCaseId(
            definition.getMethod(), definition.getPathTemplate()).substring("tc-".length()));

        RequestDefinition request = definition.getRequest();
        ArrayNode parameters = operation.putArray("parameters");
        addParameters(parameters, "path", request.getPathParams(), true);
        addParameters(parameters, "query", request.getQueryParams(), false);
        addParameters(parameters, "header", request.getHeaders(), false);
        if (parameters.isEmpty()) {
            operation.remove("parameters");
        }

        SchemaNode requestBody = request.getBodySchema();
        if (requestBody != null && !requestBody.isAbsentOnly()) {
            ObjectNode body = operation.putObject("requestBody");
            body.put("required", !requestBody.has(SchemaKind.ABSENT));
            body.set("content", content(request.getContentType(), requestBody));
        }

        ResponseDefinition response = definition.getResponse();
        ObjectNode responses = operation.putObject("responses");
        for (Integer status : response.getObservedStatusCodes()) {
            ObjectNode entry = responses.putObject(String.valueOf(status));
            HttpStatus known = HttpStatus.resolve(status);
            entry.put("description", known != null ? known.getReasonPhrase() : "Status " + status);
            SchemaNode responseBody = response.getBodySchema();
            if (status == response.getStatusCode() && responseBody != null && !responseBody.isAbsentOnly()) {
                entry.set("content", content(response.getContentType(), responseBody));
            }
        }
        return operation;
    }

    private void addParameters(ArrayNode parameters, String location, List<FieldDefinition> fields,
                               boolean alwaysRequired) {
        for (FieldDefinition field : fields) {
            ObjectNode parameter = parameters.addObject();
            parameter.put("name", field.getName());
            parameter.put("in", location);
            parameter.put("required", alwaysRequired || field.isRequired());
            parameter.set("schema", scalarSchema(field.getTypes()));
            if (field.getExample() != null) {
                parameter.put("example", field.getExample());
            }
        }
    }

    private ObjectNode content(String contentType, SchemaNode schema) {
        ObjectNode content = NODES.objectNode();
        ObjectNode media = content.putObject(contentType != null ? contentType : "application/octet-stream");
        media.set("schema", schema(schema));
        JsonNode example = SchemaExamples.instantiate(schema);
        if (example != null) {
            media.set("example", example);
        }
        return content;
    }

    /**
     * OpenAPI schema of an inferred node. Several concrete kinds become {@code oneOf}; an observed
     * {@code null} makes the schema nullable.
     */
    static ObjectNode schema(SchemaNode node) {
        List<SchemaKind> concrete = node.getTypes().stream()
            .filter(SchemaKind::isConcrete)
            .collect(Collectors.toList());

        ObjectNode schema;
        if (concrete.size() > 1) {
            schema = NODES.objectNode();
            ArrayNode oneOf = schema.putArray("oneOf");
            for (SchemaKind kind : concrete) {
                oneOf.add(single(kind, node));
            }
        } else if (concrete.size() == 1) {
            schema = single(concrete.get(0), node);
        } else {
            schema = NODES.objectNode();
        }
        if (node.has(SchemaKind.NULL)) {
            schema.put("nullable", true);
        }
        return schema;
    }

    private static ObjectNode single(SchemaKind kind, SchemaNode node) {
        ObjectNode schema = NODES.objectNode();
        switch (kind) {
            case OBJECT:
                schema.put("type", "object");
                ObjectNode properties = schema.putObject("properties");
                for (Map.Entry<String, SchemaNode> property : node.getProperties().entrySet()) {
                    properties.set(property.getKey(), schema(property.getValue()));
                }
                if (!node.getRequired().isEmpty()) {
                    ArrayNode required = schema.putArray("required");
                    node.getRequired().forEach(required::add);
                }
                break;
            case ARRAY:
                schema.put("type", "array");
                schema.set("items", node.getItems() != null ? schema(node.getItems()) : NODES.objectNode());
                break;
            case UNKNOWN:
                schema.put("type", "string");
                schema.put("format", "binary");
                break;
            default:
                schema.put("type", kind.getValue());
                break;
        }
        return schema;
    }

    private static ObjectNode scalarSchema(Set<SchemaKind> types) {
        List<SchemaKind> concrete = types.stream().filter(SchemaKind::isConcrete).collect(Collectors.toList());
        ObjectNode schema = NODES.objectNode();
        schema.put("type", concrete.size() == 1 ? concrete.get(0).getValue() : "string");
        return schema;
    }
}
