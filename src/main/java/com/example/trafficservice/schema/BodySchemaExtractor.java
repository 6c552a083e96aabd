package com.example.trafficservice.schema;

/**
 * Strategy interface for turning a captured body into a schema.
 */
public interface BodySchemaExtractor {

    /**
     * Infer the schema of a body.
     * @param body Raw body bytes, never empty
     * @param mediaType Declared media type without parameters, lower-case
     * @return Inferred schema; an opaque schema when the body does not parse
     */
    SchemaNode extract(byte[] body, String mediaType);

    /**
     * Check if this extractor understands the given media type
     * @param mediaType Media type without parameters, lower-case
     * @return true if supported
     */
    boolean supports(String mediaType);
}
