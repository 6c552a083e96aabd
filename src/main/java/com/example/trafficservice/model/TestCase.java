package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial, executable test for one {@link ApiDefinition}. Later edits belong to
 * whoever consumes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "apiDefinitionRef", "name", "request", "expectedResponse", "tags"})
public class TestCase {

    private String id;

    /**
     * {@code METHOD pathTemplate} of the source definition.
     */
    private String apiDefinitionRef;

    private String name;

    private TestRequest request;

    private ExpectedResponse expectedResponse;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
