package com.example.trafficservice.schema;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Infers schemas from {@code application/x-www-form-urlencoded} bodies. Every field becomes an
 * object property whose kind is guessed from its text; a repeated field keeps its last value.
 */
@Component
@Order(2)
@Slf4j
public class FormBodySchemaExtractor implements BodySchemaExtractor {

    @Override
    public SchemaNode extract(byte[] body, String mediaType) {
        String content = new String(body, StandardCharsets.UTF_8);
        Map<String, SchemaNode> properties = new LinkedHashMap<>();

        try {
            for (String pair : content.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String name = UriUtils.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
                String value = eq >= 0 ? UriUtils.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
                properties.put(name, SchemaInferrer.fromText(value));
            }
        } catch (IllegalArgumentException e) {
            log.debug("Form body could not be decoded, keeping it opaque: {}", e.getMessage());
            return OpaqueBodies.of(body, mediaType);
        }

        log.debug("Extracted {} form fields", properties.size());
        return SchemaNode.object(properties);
    }

    @Override
    public boolean supports(String mediaType) {
        return "application/x-www-form-urlencoded".equals(mediaType);
    }
}
