package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Concrete request instantiated from an endpoint's recorded examples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestRequest {

    private String method;

    private String host;

    /**
     * Template with every placeholder replaced by its example.
     */
    private String path;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> queryParams = new LinkedHashMap<>();

    private String contentType;

    /**
     * Structured body for JSON endpoints.
     */
    private JsonNode body;

    /**
     * Encoded form fields, or the recorded text of an opaque body.
     */
    private String rawBody;
}
