package com.example.trafficservice.model;

import com.example.trafficservice.schema.SchemaNode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseDefinition {

    /**
     * Status of the most recent sample.
     */
    private int statusCode;

    /**
     * Every status seen for the endpoint, ascending.
     */
    @Builder.Default
    private List<Integer> observedStatusCodes = new ArrayList<>();

    @Builder.Default
    private List<FieldDefinition> headers = new ArrayList<>();

    private String contentType;

    private SchemaNode bodySchema;
}
