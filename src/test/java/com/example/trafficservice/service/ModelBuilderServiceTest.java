package com.example.trafficservice.service;

import com.example.trafficservice.TestCatalogues;
import com.example.trafficservice.TestExchanges;
import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.exception.PipelineCancelledException;
import com.example.trafficservice.model.ApiCatalogue;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.Diagnostic;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.model.NameValue;
import com.example.trafficservice.model.RawExchange;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ModelBuilderServiceTest {

    private static final String HOST = "api.example.com";

    private ModelBuilderService modelBuilder;

    @BeforeEach
    void setUp() {
        modelBuilder = TestCatalogues.modelBuilder(new PipelineProperties());
    }

    private List<RawExchange> readCapture(String resource) {
        return TestCatalogues.exchanges(resource);
    }

    private static FieldDefinition field(List<FieldDefinition> fields, String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst()
            .orElseThrow(() -> new AssertionError("no field " + name));
    }

    private static Instant at(int second) {
        return Instant.parse("2024-03-01T10:00:00Z").plusSeconds(second);
    }

    @Test
    void shouldGroupSamplesByMethodAndTemplate() {
        // Given
        List<RawExchange> exchanges = readCapture("users.har");

        // When
        ApiCatalogue catalogue = modelBuilder.build(exchanges, e -> true);

        // Then
        assertThat(catalogue.getApis()).extracting(ApiDefinition::getKey).containsExactly(
            "GET /users/{id}", "GET /favicon.ico", "OPTIONS /users", "POST /users", "GET /static/app.css");
        assertTrue(catalogue.getDiagnostics().isEmpty());
    }

    @Test
    void shouldMergeSamplesOfOneEndpoint() {
        // Given
        List<RawExchange> exchanges = readCapture("users.har");

        // When
        ApiDefinition users = modelBuilder.build(exchanges, e -> true).getApis().get(0);

        // Then
        assertEquals(2, users.getSampleCount());
        assertEquals(List.of(HOST), users.getHosts());
        assertEquals(at(5), users.getLastSeen());
        assertEquals("GET /users/{id}", users.getDescription());

        FieldDefinition id = field(users.getRequest().getPathParams(), "id");
        assertEquals("7", id.getExample());
        assertTrue(id.isRequired());

        FieldDefinition fields = field(users.getRequest().getQueryParams(), "fields");
        assertFalse(fields.isRequired());
        assertEquals("name", fields.getExample());

        assertThat(users.getRequest().getHeaders()).extracting(FieldDefinition::getName)
            .containsExactly("accept", "x-request-id");
        assertEquals("req-2", field(users.getRequest().getHeaders(), "x-request-id").getExample());
        assertTrue(field(users.getRequest().getHeaders(), "accept").isRequired());

        SchemaNode body = users.getResponse().getBodySchema();
        assertEquals(Set.of("id", "name"), body.getRequired());
        assertEquals("Grace", body.getProperties().get("name").getExample().asText());
        assertEquals("application/json", users.getResponse().getContentType());
        assertEquals(200, users.getResponse().getStatusCode());
    }

    @Test
    void shouldKeepRequestBodyAndStatus() {
        // When
        ApiDefinition create = modelBuilder.build(readCapture("users.har"), e -> true).getApis().get(3);

        // Then
        assertEquals("application/json", create.getRequest().getContentType());
        SchemaNode requestBody = create.getRequest().getBodySchema();
        assertEquals(Set.of(SchemaKind.BOOLEAN), requestBody.getProperties().get("admin").getTypes());
        assertEquals(201, create.getResponse().getStatusCode());
        assertThat(create.getResponse().getHeaders()).extracting(FieldDefinition::getName)
            .contains("location");
    }

    @Test
    void shouldDescribeBinaryBodiesAsOpaque() {
        // When
        ApiDefinition favicon = modelBuilder.build(readCapture("users.har"), e -> true).getApis().get(1);

        // Then
        SchemaNode body = favicon.getResponse().getBodySchema();
        assertTrue(body.isOpaque());
        assertEquals("image/x-icon", body.getFormat());
        assertTrue(favicon.getRequest().getBodySchema().isAbsentOnly());
    }

    @Test
    void shouldSkipExchangesRejectedByPredicate() {
        // When
        ApiCatalogue catalogue = modelBuilder.build(readCapture("users.har"),
            e -> !"OPTIONS".equals(e.getMethod()) && e.getHost().equals(HOST));

        // Then
        assertThat(catalogue.getApis()).extracting(ApiDefinition::getKey)
            .containsExactly("GET /users/{id}", "GET /favicon.ico", "POST /users");
    }

    @Test
    void shouldReturnEmptyCatalogueForNoExchanges() {
        // When
        ApiCatalogue catalogue = modelBuilder.build(List.of(), e -> true);

        // Then
        assertTrue(catalogue.isEmpty());
        assertTrue(catalogue.getDiagnostics().isEmpty());
    }

    @Test
    void shouldTakeExamplesFromMostRecentSampleRegardlessOfOrder() {
        // Given
        RawExchange newer = TestExchanges.jsonGet(HOST, "/users/2", "{\"id\":2,\"name\":\"New\"}", at(20));
        RawExchange older = TestExchanges.jsonGet(HOST, "/users/1", "{\"id\":1,\"name\":\"Old\"}", at(10));

        // When
        ApiDefinition users = modelBuilder.build(List.of(newer, older), e -> true).getApis().get(0);

        // Then
        assertEquals("2", users.getRequest().getPathParams().get(0).getExample());
        assertEquals("New", users.getResponse().getBodySchema().getProperties().get("name").getExample().asText());
        assertEquals(at(20), users.getLastSeen());
    }

    @Test
    void shouldPreferLaterSampleOnEqualTimestamps() {
        // Given
        RawExchange first = TestExchanges.jsonGet(HOST, "/users/1", "{\"name\":\"First\"}", at(10));
        RawExchange second = TestExchanges.jsonGet(HOST, "/users/2", "{\"name\":\"Second\"}", at(10));

        // When
        ApiDefinition users = modelBuilder.build(List.of(first, second), e -> true).getApis().get(0);

        // Then
        assertEquals("Second", users.getResponse().getBodySchema().getProperties().get("name").getExample().asText());
    }

    @Test
    void shouldReportConflictingFieldTypes() {
        // Given
        RawExchange numeric = TestExchanges.jsonGet(HOST, "/items/1", "{\"price\":10}", at(1));
        RawExchange textual = TestExchanges.jsonGet(HOST, "/items/2", "{\"price\":\"10\"}", at(2));

        // When
        ApiCatalogue catalogue = modelBuilder.build(List.of(numeric, textual), e -> true);

        // Then
        assertEquals(1, catalogue.getApis().size());
        SchemaNode price = catalogue.getApis().get(0).getResponse().getBodySchema().getProperties().get("price");
        assertEquals(Set.of(SchemaKind.NUMBER, SchemaKind.STRING), price.getTypes());

        assertEquals(1, catalogue.getDiagnostics().size());
        Diagnostic diagnostic = catalogue.getDiagnostics().get(0);
        assertEquals(Diagnostic.Kind.SCHEMA_CONFLICT, diagnostic.getKind());
        assertEquals("GET /items/{id}", diagnostic.getEndpoint());
        assertEquals("response body $.price observed as number|string, widened to a union", diagnostic.getMessage());
    }

    @Test
    void shouldReportConflictingQueryParameterTypes() {
        // Given
        RawExchange paged = TestExchanges.get(HOST, "/search").queryParam(new NameValue("page", "2")).build();
        RawExchange named = TestExchanges.get(HOST, "/search").queryParam(new NameValue("page", "last")).build();

        // When
        ApiCatalogue catalogue = modelBuilder.build(List.of(paged, named), e -> true);

        // Then
        assertThat(catalogue.getDiagnostics()).extracting(Diagnostic::getMessage)
            .containsExactly("query parameter page observed as number|string, widened to a union");
    }

    @Test
    void shouldDropPseudoAndIgnoredHeaders() {
        // Given
        RawExchange exchange = TestExchanges.get(HOST, "/health")
            .requestHeader(new NameValue(":authority", HOST))
            .requestHeader(new NameValue("Host", HOST))
            .requestHeader(new NameValue("Content-Length", "0"))
            .requestHeader(new NameValue("X-Trace", "abc"))
            .build();

        // When
        ApiDefinition definition = modelBuilder.toDefinition(exchange);

        // Then
        assertThat(definition.getRequest().getHeaders()).extracting(FieldDefinition::getName)
            .containsExactly("x-trace");
    }

    @Test
    void shouldCollectHostsAndStatusesAcrossSamples() {
        // Given
        RawExchange ok = TestExchanges.get("b.example.com", "/ping").build();
        RawExchange failed = TestExchanges.get("a.example.com", "/ping").statusCode(503)
            .startedAt(at(30)).build();

        // When
        ApiDefinition ping = modelBuilder.build(List.of(ok, failed), e -> true).getApis().get(0);

        // Then
        assertEquals(List.of("a.example.com", "b.example.com"), ping.getHosts());
        assertEquals(List.of(200, 503), ping.getResponse().getObservedStatusCodes());
        assertEquals(503, ping.getResponse().getStatusCode());
    }

    @Test
    void shouldGiveSameCatalogueWhenMergingHalves() {
        // Given
        List<RawExchange> exchanges = readCapture("users.har");
        RawExchange extra = TestExchanges.jsonGet(HOST, "/users/8", "{\"id\":8,\"nickname\":\"Bo\"}", at(60));
        List<RawExchange> all = new ArrayList<>(exchanges);
        all.add(extra);

        // When
        ApiCatalogue whole = modelBuilder.build(all, e -> true);
        ApiCatalogue merged = modelBuilder.merge(
            modelBuilder.build(all.subList(0, 1), e -> true),
            modelBuilder.build(all.subList(1, all.size()), e -> true));

        // Then
        assertEquals(whole, merged);
        assertEquals(Set.of("id"), whole.getApis().get(0).getResponse().getBodySchema().getRequired());
    }

    @Test
    void shouldBeDeterministic() {
        // Given
        List<RawExchange> exchanges = readCapture("users.har");

        // When / Then
        assertEquals(modelBuilder.build(exchanges, e -> true), modelBuilder.build(exchanges, e -> true));
    }

    @Test
    void shouldStopWhenCancelled() {
        // Given
        List<RawExchange> exchanges = readCapture("users.har");

        // When / Then
        assertThrows(PipelineCancelledException.class, () -> modelBuilder.build(exchanges.iterator(), e -> true,
            () -> {
                throw new PipelineCancelledException("job-1");
            }));
    }
}
