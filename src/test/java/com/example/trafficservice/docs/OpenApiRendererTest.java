package com.example.trafficservice.docs;

import com.example.trafficservice.TestCatalogues;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenApiRendererTest {

    private final OpenApiRenderer renderer = new OpenApiRenderer();

    @Test
    void shouldDescribeDocumentAndServers() {
        // When
        ObjectNode document = renderer.render(TestCatalogues.users().getApis(), "Users API");

        // Then
        assertEquals("3.0.3", document.get("openapi").asText());
        assertEquals("Users API", document.at("/info/title").asText());
        assertEquals("https://api.example.com", document.at("/servers/0/url").asText());
        assertEquals(1, document.get("servers").size());
    }

    @Test
    void shouldGroupMethodsUnderPaths() {
        // When
        ObjectNode document = renderer.render(TestCatalogues.users().getApis(), "Users API");

        // Then
        JsonNode users = document.at("/paths/~1users");
        assertTrue(users.has("options"));
        assertTrue(users.has("post"));
        assertEquals("post-users", users.at("/post/operationId").asText());
        assertTrue(users.at("/post/requestBody/required").asBoolean());
        assertEquals("boolean",
            users.at("/post/requestBody/content/application~1json/schema/properties/admin/type").asText());
        assertEquals("Created", users.at("/post/responses/201/description").asText());
    }

    @Test
    void shouldDescribeParametersAndResponseSchema() {
        // When
        JsonNode getUser = renderer.render(TestCatalogues.users().getApis(), "Users API")
            .at("/paths/~1users~1{id}/get");

        // Then
        JsonNode id = getUser.at("/parameters/0");
        assertEquals("id", id.get("name").asText());
        assertEquals("path", id.get("in").asText());
        assertTrue(id.get("required").asBoolean());
        assertEquals("number", id.at("/schema/type").asText());

        JsonNode fields = getUser.at("/parameters/1");
        assertEquals("query", fields.get("in").asText());
        assertFalse(fields.get("required").asBoolean());

        JsonNode schema = getUser.at("/responses/200/content/application~1json/schema");
        assertEquals("object", schema.get("type").asText());
        assertEquals("id", schema.at("/required/0").asText());
        assertEquals("name", schema.at("/required/1").asText());
        assertEquals("Grace", getUser.at("/responses/200/content/application~1json/example/name").asText());
    }

    @Test
    void shouldOmitBodyForOpaqueFreeResponses() {
        JsonNode options = renderer.render(TestCatalogues.users().getApis(), "Users API")
            .at("/paths/~1users/options");

        assertFalse(options.has("requestBody"));
        assertFalse(options.at("/responses/204").has("content"));
        assertEquals("No Content", options.at("/responses/204/description").asText());
    }

    @Test
    void shouldWidenConflictsToOneOf() {
        // Given
        SchemaNode price = new SchemaNode(EnumSet.of(SchemaKind.NUMBER, SchemaKind.STRING, SchemaKind.NULL),
            null, null, null, null, TextNode.valueOf("10"));

        // When
        ObjectNode schema = OpenApiRenderer.schema(price);

        // Then
        assertEquals(2, schema.get("oneOf").size());
        assertEquals("number", schema.at("/oneOf/0/type").asText());
        assertEquals("string", schema.at("/oneOf/1/type").asText());
        assertTrue(schema.get("nullable").asBoolean());
    }

    @Test
    void shouldRenderOpaqueAsBinary() {
        ObjectNode schema = OpenApiRenderer.schema(SchemaNode.opaque("image/png", null));

        assertEquals("string", schema.get("type").asText());
        assertEquals("binary", schema.get("format").asText());
    }

    @Test
    void shouldRenderEmptyCatalogue() {
        ObjectNode document = renderer.render(List.of(), "Empty");

        assertEquals(0, document.get("paths").size());
        assertEquals(0, document.get("servers").size());
    }
}
