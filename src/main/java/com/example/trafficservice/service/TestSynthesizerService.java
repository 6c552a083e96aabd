package com.example.trafficservice.service;

import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.ExpectedResponse;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.model.ResponseAssertion;
import com.example.trafficservice.model.ResponseDefinition;
import com.example.trafficservice.model.TestCase;
import com.example.trafficservice.model.TestRequest;
import com.example.trafficservice.schema.SchemaExamples;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service turning endpoint definitions into initial test cases: one per definition, with a
 * request rebuilt from recorded examples and structural response assertions.
 */
@Service
@Slf4j
public class TestSynthesizerService {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    public List<TestCase> synthesize(List<ApiDefinition> definitions) {
        return synthesize(definitions, CancellationToken.NONE);
    }

    /**
     * Test cases in definition order. Ids are derived from method and path template; a second
     * definition producing the same id gets a numeric suffix.
     */
    public List<TestCase> synthesize(List<ApiDefinition> definitions, CancellationToken cancellation) {
        List<TestCase> testCases = new ArrayList<>();
        Map<String, Integer> idUses = new HashMap<>();
        for (ApiDefinition definition : definitions) {
            cancellation.checkpoint();
            String baseId = testCaseId(definition.getMethod(), definition.getPathTemplate());
            int use = idUses.merge(baseId, 1, Integer::sum);
            testCases.add(toTestCase(definition, use == 1 ? baseId : baseId + "-" + use));
        }
        log.debug("Synthesized {} test cases", testCases.size());
        return testCases;
    }

    /**
     * {@code tc-get-users-id} for {@code GET /users/{id}}.
     */
    public static String testCaseId(String method, String pathTemplate) {
        String slug = NON_SLUG.matcher(pathTemplate.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            slug = "root";
        }
        return "tc-" + method.toLowerCase(Locale.ROOT) + "-" + slug;
    }

    private TestCase toTestCase(ApiDefinition definition, String id) {
        return TestCase.builder()
            .id(id)
            .apiDefinitionRef(definition.getKey())
            .name(definition.getDescription() != null ? definition.getDescription() : definition.getKey())
            .request(toRequest(definition))
            .expectedResponse(toExpectedResponse(definition.getResponse()))
            .tags(tags(definition))
            .build();
    }

    private TestRequest toRequest(ApiDefinition definition) {
        TestRequest.TestRequestBuilder request = TestRequest.builder()
            .method(definition.getMethod())
            .host(definition.getHosts().isEmpty() ? null : definition.getHosts().get(0))
            .path(concretePath(definition.getPathTemplate(), definition.getRequest().getPathParams()))
            .headers(examples(definition.getRequest().getHeaders()))
            .queryParams(examples(definition.getRequest().getQueryParams()));

        SchemaNode body = definition.getRequest().getBodySchema();
        if (body != null && !body.isAbsentOnly()) {
            String contentType = definition.getRequest().getContentType();
            request.contentType(contentType);
            if (isForm(contentType) && body.has(SchemaKind.OBJECT)) {
                request.rawBody(formBody(SchemaExamples.instantiate(body)));
            } else if (body.has(SchemaKind.OBJECT) || body.has(SchemaKind.ARRAY)) {
                request.body(SchemaExamples.instantiate(body));
            } else {
                JsonNode example = SchemaExamples.instantiate(body);
                if (example != null) {
                    request.rawBody(example.isTextual() ? example.asText() : example.toString());
                }
            }
        }
        return request.build();
    }

    private static boolean isForm(String contentType) {
        return contentType != null
            && contentType.toLowerCase(Locale.ROOT).startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
    }

    /**
     * {@code name=value&...} in field order, encoded the way browsers submit forms.
     */
    private static String formBody(JsonNode fields) {
        StringJoiner form = new StringJoiner("&");
        fields.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            String text = value.isNull() ? "" : value.isValueNode() ? value.asText() : value.toString();
            form.add(UriUtils.encodeQueryParam(field.getKey(), StandardCharsets.UTF_8) + "="
                + UriUtils.encodeQueryParam(text, StandardCharsets.UTF_8));
        });
        return form.toString();
    }

    private ExpectedResponse toExpectedResponse(ResponseDefinition response) {
        List<ResponseAssertion> assertions = new ArrayList<>();
        assertions.add(ResponseAssertion.builder()
            .type(ResponseAssertion.Type.STATUS_CODE)
            .expected(String.valueOf(response.getStatusCode()))
            .build());
        if (response.getContentType() != null) {
            assertions.add(ResponseAssertion.builder()
                .type(ResponseAssertion.Type.CONTENT_TYPE)
                .expected(response.getContentType())
                .build());
        }

        SchemaNode schema = response.getBodySchema();
        boolean structured = schema != null && (schema.has(SchemaKind.OBJECT) || schema.has(SchemaKind.ARRAY));
        if (structured) {
            assertions.add(ResponseAssertion.builder().type(ResponseAssertion.Type.JSON_SCHEMA).build());
            for (String field : schema.getRequired()) {
                assertions.add(ResponseAssertion.builder()
                    .type(ResponseAssertion.Type.FIELD_PRESENT)
                    .path("$." + field)
                    .build());
            }
        }

        return ExpectedResponse.builder()
            .statusCode(response.getStatusCode())
            .contentType(response.getContentType())
            .schema(structured ? schema : null)
            .assertions(assertions)
            .build();
    }

    static String concretePath(String template, List<FieldDefinition> pathParams) {
        Map<String, FieldDefinition> byName = new HashMap<>();
        pathParams.forEach(param -> byName.put(param.getName(), param));

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            FieldDefinition param = byName.get(matcher.group(1));
            matcher.appendReplacement(path, Matcher.quoteReplacement(exampleOf(param)));
        }
        matcher.appendTail(path);
        return path.toString();
    }

    private static String exampleOf(FieldDefinition param) {
        if (param == null) {
            return "1";
        }
        if (param.getExample() != null) {
            return param.getExample();
        }
        return param.getTypes().contains(SchemaKind.NUMBER) ? "1" : param.getName();
    }

    private static Map<String, String> examples(List<FieldDefinition> fields) {
        Map<String, String> values = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            if (field.getExample() != null) {
                values.put(field.getName(), field.getExample());
            }
        }
        return values;
    }

    private static List<String> tags(ApiDefinition definition) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(definition.getMethod().toLowerCase(Locale.ROOT));
        Arrays.stream(definition.getPathTemplate().split("/"))
            .filter(segment -> !segment.isEmpty() && !segment.startsWith("{"))
            .findFirst()
            .ifPresent(tags::add);
        tags.addAll(definition.getHosts());
        return new ArrayList<>(tags);
    }
}
