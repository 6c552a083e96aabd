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
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpectedResponse {

    private int statusCode;

    private String contentType;

    private SchemaNode schema;

    @Builder.Default
    private List<ResponseAssertion> assertions = new ArrayList<>();
}
