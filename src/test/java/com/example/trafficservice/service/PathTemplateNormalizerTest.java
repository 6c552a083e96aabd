package com.example.trafficservice.service;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.schema.SchemaKind;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PathTemplateNormalizerTest {

    private final PathTemplateNormalizer normalizer = new PathTemplateNormalizer(new PipelineProperties());

    private String template(String path) {
        return normalizer.normalize(path).getTemplate();
    }

    @Test
    void shouldReplaceNumericSegment() {
        PathTemplateNormalizer.PathTemplate result = normalizer.normalize("/users/42");

        assertEquals("/users/{id}", result.getTemplate());
        FieldDefinition param = result.getParams().get(0);
        assertEquals("id", param.getName());
        assertEquals("42", param.getExample());
        assertEquals(Set.of(SchemaKind.NUMBER), param.getTypes());
        assertTrue(param.isRequired());
    }

    @Test
    void shouldNumberSuccessivePlaceholders() {
        PathTemplateNormalizer.PathTemplate result =
            normalizer.normalize("/orders/550e8400-e29b-41d4-a716-446655440000/items/3");

        assertEquals("/orders/{id}/items/{id2}", result.getTemplate());
        assertThat(result.getParams()).extracting(FieldDefinition::getExample)
            .containsExactly("550e8400-e29b-41d4-a716-446655440000", "3");
    }

    @Test
    void shouldRecogniseIdentifierShapes() {
        assertEquals("/files/{id}", template("/files/5f2b9c1e8a7d4e3f9b0c"));
        assertEquals("/sessions/{id}", template("/sessions/abc123XYZ789def456GHI0"));
        assertEquals("/accounts/{id}/balance", template("/accounts/-17/balance"));
    }

    @Test
    void shouldKeepStaticSegments() {
        assertEquals("/v1/users", template("/v1/users"));
        assertEquals("/api/search", template("/api/search"));
        assertEquals("/docs/getting-started-with-the-platform", template("/docs/getting-started-with-the-platform"));
        assertEquals("/colors/deadbeef", template("/colors/deadbeef"));
        assertEquals("/users/", template("/users/"));
        assertEquals("/", template("/"));
        assertEquals("/", template(""));
    }

    @Test
    void shouldUseConfiguredPlaceholder() {
        PipelineProperties properties = new PipelineProperties();
        properties.setPlaceholder("param");

        PathTemplateNormalizer custom = new PathTemplateNormalizer(properties);

        assertEquals("/a/{param}/b/{param2}", custom.normalize("/a/1/b/2").getTemplate());
    }
}
