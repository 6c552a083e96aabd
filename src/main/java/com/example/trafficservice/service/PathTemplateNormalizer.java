package com.example.trafficservice.service;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.schema.SchemaInferrer;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a concrete path into a path template by replacing identifier-shaped segments with
 * placeholders: {@code /users/42/orders/9f1c...} becomes {@code /users/{id}/orders/{id2}}.
 *
 * <p>The decision is made per segment from its shape alone, so a path always maps to the same
 * template whatever else was captured with it.</p>
 */
@Component
public class PathTemplateNormalizer {

    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+$");
    private static final Pattern UUID_SHAPED = Pattern.compile(
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern HEX_ID = Pattern.compile("^(?=.*\\d)[0-9a-fA-F]{16,}$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^(?=.*\\d)(?=.*[A-Za-z])[A-Za-z0-9_-]{20,}$");

    private final String placeholder;

    public PathTemplateNormalizer(PipelineProperties properties) {
        this.placeholder = properties.getPlaceholder();
    }

    public PathTemplate normalize(String path) {
        if (path == null || path.isEmpty()) {
            return new PathTemplate("/", List.of());
        }

        String[] segments = path.split("/", -1);
        List<FieldDefinition> params = new ArrayList<>();
        StringBuilder template = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                template.append('/');
            }
            String segment = segments[i];
            if (isVariable(segment)) {
                String name = params.isEmpty() ? placeholder : placeholder + (params.size() + 1);
                params.add(FieldDefinition.builder()
                    .name(name)
                    .types(EnumSet.of(SchemaInferrer.kindOfText(segment)))
                    .required(true)
                    .example(segment)
                    .build());
                template.append('{').append(name).append('}');
            } else {
                template.append(segment);
            }
        }
        return new PathTemplate(template.toString(), params);
    }

    static boolean isVariable(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        return NUMERIC.matcher(segment).matches()
            || UUID_SHAPED.matcher(segment).matches()
            || HEX_ID.matcher(segment).matches()
            || OPAQUE_TOKEN.matcher(segment).matches();
    }

    /**
     * Template plus the concrete value of each placeholder, in path order.
     */
    @Value
    public static class PathTemplate {
        String template;
        List<FieldDefinition> params;
    }
}
