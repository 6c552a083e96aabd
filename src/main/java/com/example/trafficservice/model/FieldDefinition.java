package com.example.trafficservice.model;

import com.example.trafficservice.schema.SchemaKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * A header, query parameter or path parameter of an endpoint, merged over every sample.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDefinition {

    private String name;

    /**
     * Union of the kinds observed.
     */
    @Builder.Default
    private Set<SchemaKind> types = EnumSet.noneOf(SchemaKind.class);

    /**
     * Present in every merged sample.
     */
    private boolean required;

    /**
     * Value from the most recent sample.
     */
    private String example;
}
