package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical description of one logical endpoint, merged from every exchange that normalises to
 * the same {@code (method, pathTemplate)} key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"method", "pathTemplate", "description", "request", "response",
                    "hosts", "sampleCount", "lastSeen"})
public class ApiDefinition {

    private String method;

    private String pathTemplate;

    private String description;

    private RequestDefinition request;

    private ResponseDefinition response;

    /**
     * Hosts the endpoint was observed on, sorted.
     */
    @Builder.Default
    private List<String> hosts = new ArrayList<>();

    private int sampleCount;

    /**
     * Timestamp of the most recent sample; decides whose examples win on merge.
     */
    private Instant lastSeen;

    @JsonIgnore
    public String getKey() {
        return keyOf(method, pathTemplate);
    }

    public static String keyOf(String method, String pathTemplate) {
        return method + " " + pathTemplate;
    }
}
