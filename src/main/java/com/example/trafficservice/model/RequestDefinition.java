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
public class RequestDefinition {

    @Builder.Default
    private List<FieldDefinition> headers = new ArrayList<>();

    @Builder.Default
    private List<FieldDefinition> queryParams = new ArrayList<>();

    /**
     * One entry per placeholder of the path template, in path order.
     */
    @Builder.Default
    private List<FieldDefinition> pathParams = new ArrayList<>();

    private String contentType;

    private SchemaNode bodySchema;
}
