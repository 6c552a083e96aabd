package com.example.trafficservice.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Infers schemas from JSON bodies ({@code application/json} and any {@code +json} suffix type).
 * A body that claims to be JSON but does not parse is kept as an opaque blob.
 */
@Component
@Order(1)
@Slf4j
public class JsonBodySchemaExtractor implements BodySchemaExtractor {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public SchemaNode extract(byte[] body, String mediaType) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || root.isMissingNode()) {
                return OpaqueBodies.of(body, mediaType);
            }
            return SchemaInferrer.fromJson(root);
        } catch (IOException e) {
            log.debug("Body declared as {} is not valid JSON, keeping it opaque: {}", mediaType, e.getMessage());
            return OpaqueBodies.of(body, mediaType);
        }
    }

    @Override
    public boolean supports(String mediaType) {
        return mediaType != null &&
               (mediaType.equals("application/json") ||
                mediaType.endsWith("+json") ||
                mediaType.equals("text/json"));
    }
}
