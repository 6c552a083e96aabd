package com.example.trafficservice.schema;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Fallback for every media type no structured extractor claims (multipart, XML, HTML, binary...).
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class OpaqueBodySchemaExtractor implements BodySchemaExtractor {

    @Override
    public SchemaNode extract(byte[] body, String mediaType) {
        return OpaqueBodies.of(body, mediaType);
    }

    @Override
    public boolean supports(String mediaType) {
        // Catch-all
        return true;
    }
}
