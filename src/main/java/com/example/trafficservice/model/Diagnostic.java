package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal issue attached to a pipeline result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Diagnostic {

    public enum Kind {
        /**
         * A capture entry was skipped.
         */
        PARTIAL_PARSE_WARNING,

        /**
         * A field was observed with irreconcilable types and was widened.
         */
        SCHEMA_CONFLICT
    }

    private Kind kind;

    private String message;

    /**
     * Capture entry index, for parse warnings.
     */
    private Integer entryIndex;

    /**
     * {@code METHOD pathTemplate}, for schema conflicts.
     */
    private String endpoint;

    public static Diagnostic skippedEntry(int entryIndex, String reason) {
        return Diagnostic.builder()
            .kind(Kind.PARTIAL_PARSE_WARNING)
            .entryIndex(entryIndex)
            .message("Entry " + entryIndex + " skipped: " + reason)
            .build();
    }

    public static Diagnostic schemaConflict(String endpoint, String message) {
        return Diagnostic.builder()
            .kind(Kind.SCHEMA_CONFLICT)
            .endpoint(endpoint)
            .message(message)
            .build();
    }
}
