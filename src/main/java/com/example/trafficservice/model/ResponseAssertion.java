package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One structural check of the actual response. Bodies are never compared for equality.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseAssertion {

    public enum Type {
        STATUS_CODE,
        CONTENT_TYPE,
        /**
         * Body conforms to {@link ExpectedResponse#getSchema()}.
         */
        JSON_SCHEMA,
        FIELD_PRESENT
    }

    private Type type;

    /**
     * JSON path of the checked field, for {@link Type#FIELD_PRESENT}.
     */
    private String path;

    private String expected;
}
