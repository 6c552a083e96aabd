package com.example.trafficservice.service;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.model.ApiCatalogue;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.Diagnostic;
import com.example.trafficservice.model.FieldDefinition;
import com.example.trafficservice.model.NameValue;
import com.example.trafficservice.model.RawExchange;
import com.example.trafficservice.model.RequestDefinition;
import com.example.trafficservice.model.ResponseDefinition;
import com.example.trafficservice.schema.BodySchemaExtractor;
import com.example.trafficservice.schema.OpaqueBodySchemaExtractor;
import com.example.trafficservice.schema.SchemaInferrer;
import com.example.trafficservice.schema.SchemaKind;
import com.example.trafficservice.schema.SchemaNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Service that folds included exchanges into one {@link ApiDefinition} per
 * {@code (method, pathTemplate)}.
 *
 * <p>Every exchange is first turned into a single-sample definition; definitions sharing a key are
 * then joined with {@link #mergeDefinitions(ApiDefinition, ApiDefinition)}. The join does not
 * depend on how samples are grouped, so building a capture in one go and merging the catalogues
 * of its halves give the same endpoints.</p>
 */
@Service
@Slf4j
public class ModelBuilderService {

    private static final BodySchemaExtractor FALLBACK_EXTRACTOR = new OpaqueBodySchemaExtractor();

    private final List<BodySchemaExtractor> extractors;
    private final PathTemplateNormalizer normalizer;
    private final Set<String> ignoredHeaders;

    public ModelBuilderService(List<BodySchemaExtractor> extractors,
                               PathTemplateNormalizer normalizer,
                               PipelineProperties properties) {
        this.extractors = new ArrayList<>(extractors);
        this.normalizer = normalizer;
        this.ignoredHeaders = properties.getIgnoredHeaders().stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(HashSet::new));
    }

    public ApiCatalogue build(Iterable<RawExchange> exchanges, Predicate<RawExchange> include) {
        return build(exchanges.iterator(), include, CancellationToken.NONE);
    }

    /**
     * Consume the exchanges once, keeping only those the predicate accepts.
     */
    public ApiCatalogue build(Iterator<RawExchange> exchanges,
                              Predicate<RawExchange> include,
                              CancellationToken cancellation) {
        Map<String, ApiDefinition> byKey = new LinkedHashMap<>();
        int modelled = 0;
        while (exchanges.hasNext()) {
            cancellation.checkpoint();
            RawExchange exchange = exchanges.next();
            if (!include.test(exchange)) {
                continue;
            }
            ApiDefinition sample = toDefinition(exchange);
            byKey.merge(sample.getKey(), sample, ModelBuilderService::mergeDefinitions);
            modelled++;
        }

        ApiCatalogue catalogue = withDiagnostics(new ArrayList<>(byKey.values()));
        log.debug("Modelled {} exchanges into {} endpoints", modelled, catalogue.getApis().size());
        return catalogue;
    }

    /**
     * Join two catalogues. Endpoints keep first-seen order: those of {@code first}, then the new
     * ones of {@code second}. Diagnostics are recomputed from the merged endpoints.
     */
    public ApiCatalogue merge(ApiCatalogue first, ApiCatalogue second) {
        Map<String, ApiDefinition> byKey = new LinkedHashMap<>();
        for (ApiCatalogue catalogue : List.of(first, second)) {
            for (ApiDefinition definition : catalogue.getApis()) {
                byKey.merge(definition.getKey(), definition, ModelBuilderService::mergeDefinitions);
            }
        }
        return withDiagnostics(new ArrayList<>(byKey.values()));
    }

    /**
     * Definition describing a single exchange: every observed field is required.
     */
    public ApiDefinition toDefinition(RawExchange exchange) {
        PathTemplateNormalizer.PathTemplate template = normalizer.normalize(exchange.getPath());
        String requestMediaType = exchange.hasRequestBody()
            ? RawExchange.mediaTypeOf(exchange.getRequestContentType()) : null;
        String responseMediaType = RawExchange.mediaTypeOf(exchange.getResponseContentType());

        RequestDefinition request = RequestDefinition.builder()
            .headers(headerFields(exchange.getRequestHeaders()))
            .queryParams(queryFields(exchange.getQueryParams()))
            .pathParams(new ArrayList<>(template.getParams()))
            .contentType(emptyToNull(requestMediaType))
            .bodySchema(exchange.hasRequestBody()
                ? extract(exchange.getRequestBody(), requestMediaType)
                : SchemaNode.absent())
            .build();

        ResponseDefinition response = ResponseDefinition.builder()
            .statusCode(exchange.getStatusCode())
            .observedStatusCodes(new ArrayList<>(List.of(exchange.getStatusCode())))
            .headers(headerFields(exchange.getResponseHeaders()))
            .contentType(emptyToNull(responseMediaType))
            .bodySchema(exchange.hasResponseBody()
                ? extract(exchange.getResponseBody(), responseMediaType)
                : SchemaNode.absent())
            .build();

        return ApiDefinition.builder()
            .method(exchange.getMethod())
            .pathTemplate(template.getTemplate())
            .description(exchange.getMethod() + " " + template.getTemplate())
            .request(request)
            .response(response)
            .hosts(new ArrayList<>(List.of(exchange.getHost())))
            .sampleCount(1)
            .lastSeen(exchange.getStartedAt())
            .build();
    }

    /**
     * Join two definitions of the same endpoint. The side with the later {@code lastSeen} supplies
     * examples, status code and content types; on a tie {@code right} does.
     */
    static ApiDefinition mergeDefinitions(ApiDefinition left, ApiDefinition right) {
        boolean rightNewer = isAtLeastAsRecent(right.getLastSeen(), left.getLastSeen());
        ApiDefinition older = rightNewer ? left : right;
        ApiDefinition newer = rightNewer ? right : left;

        RequestDefinition request = RequestDefinition.builder()
            .headers(mergeFields(left.getRequest().getHeaders(), right.getRequest().getHeaders(), rightNewer))
            .queryParams(mergeFields(left.getRequest().getQueryParams(), right.getRequest().getQueryParams(), rightNewer))
            .pathParams(mergeFields(left.getRequest().getPathParams(), right.getRequest().getPathParams(), rightNewer))
            .contentType(preferNewer(older.getRequest().getContentType(), newer.getRequest().getContentType()))
            .bodySchema(SchemaNode.merge(older.getRequest().getBodySchema(), newer.getRequest().getBodySchema()))
            .build();

        TreeSet<Integer> statuses = new TreeSet<>(left.getResponse().getObservedStatusCodes());
        statuses.addAll(right.getResponse().getObservedStatusCodes());

        ResponseDefinition response = ResponseDefinition.builder()
            .statusCode(newer.getResponse().getStatusCode())
            .observedStatusCodes(new ArrayList<>(statuses))
            .headers(mergeFields(left.getResponse().getHeaders(), right.getResponse().getHeaders(), rightNewer))
            .contentType(preferNewer(older.getResponse().getContentType(), newer.getResponse().getContentType()))
            .bodySchema(SchemaNode.merge(older.getResponse().getBodySchema(), newer.getResponse().getBodySchema()))
            .build();

        TreeSet<String> hosts = new TreeSet<>(left.getHosts());
        hosts.addAll(right.getHosts());

        return left.toBuilder()
            .request(request)
            .response(response)
            .hosts(new ArrayList<>(hosts))
            .sampleCount(left.getSampleCount() + right.getSampleCount())
            .lastSeen(newer.getLastSeen() != null ? newer.getLastSeen() : older.getLastSeen())
            .build();
    }

    private static List<FieldDefinition> mergeFields(List<FieldDefinition> left,
                                                     List<FieldDefinition> right,
                                                     boolean rightNewer) {
        Map<String, FieldDefinition> merged = new LinkedHashMap<>();
        for (FieldDefinition field : left) {
            merged.put(field.getName(), field.toBuilder().required(false).build());
        }
        Map<String, FieldDefinition> leftByName = left.stream()
            .collect(Collectors.toMap(FieldDefinition::getName, f -> f, (a, b) -> b));
        for (FieldDefinition field : right) {
            FieldDefinition leftField = leftByName.get(field.getName());
            if (leftField == null) {
                merged.put(field.getName(), field.toBuilder().required(false).build());
                continue;
            }
            EnumSet<SchemaKind> types = EnumSet.noneOf(SchemaKind.class);
            types.addAll(leftField.getTypes());
            types.addAll(field.getTypes());
            String example = rightNewer
                ? preferNewer(leftField.getExample(), field.getExample())
                : preferNewer(field.getExample(), leftField.getExample());
            merged.put(field.getName(), FieldDefinition.builder()
                .name(field.getName())
                .types(types)
                .required(leftField.isRequired() && field.isRequired())
                .example(example)
                .build());
        }
        return new ArrayList<>(merged.values());
    }

    private List<FieldDefinition> headerFields(List<NameValue> headers) {
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        for (NameValue header : headers) {
            String name = header.getName().toLowerCase(Locale.ROOT);
            if (name.startsWith(":") || ignoredHeaders.contains(name)) {
                continue;
            }
            fields.put(name, observed(name, EnumSet.of(SchemaKind.STRING), header.getValue()));
        }
        return new ArrayList<>(fields.values());
    }

    private static List<FieldDefinition> queryFields(List<NameValue> params) {
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        for (NameValue param : params) {
            fields.put(param.getName(),
                observed(param.getName(), EnumSet.of(SchemaInferrer.kindOfText(param.getValue())), param.getValue()));
        }
        return new ArrayList<>(fields.values());
    }

    private static FieldDefinition observed(String name, EnumSet<SchemaKind> types, String example) {
        return FieldDefinition.builder().name(name).types(types).required(true).example(example).build();
    }

    private SchemaNode extract(byte[] body, String mediaType) {
        return extractors.stream()
            .filter(extractor -> extractor.supports(mediaType))
            .findFirst()
            .orElse(FALLBACK_EXTRACTOR)
            .extract(body, mediaType);
    }

    private static ApiCatalogue withDiagnostics(List<ApiDefinition> apis) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ApiDefinition api : apis) {
            String endpoint = api.getKey();
            conflicts("request body", api.getRequest().getBodySchema(), endpoint, diagnostics);
            conflicts("response body", api.getResponse().getBodySchema(), endpoint, diagnostics);
            fieldConflicts("query parameter", api.getRequest().getQueryParams(), endpoint, diagnostics);
            fieldConflicts("path parameter", api.getRequest().getPathParams(), endpoint, diagnostics);
        }
        return new ApiCatalogue(apis, diagnostics);
    }

    private static void conflicts(String where, SchemaNode schema, String endpoint, List<Diagnostic> out) {
        if (schema == null) {
            return;
        }
        for (String conflict : schema.describeConflicts()) {
            out.add(Diagnostic.schemaConflict(endpoint, where + " " + conflict + ", widened to a union"));
        }
    }

    private static void fieldConflicts(String where, List<FieldDefinition> fields, String endpoint, List<Diagnostic> out) {
        for (FieldDefinition field : fields) {
            long concrete = field.getTypes().stream().filter(SchemaKind::isConcrete).count();
            if (concrete > 1) {
                String kinds = field.getTypes().stream().map(SchemaKind::getValue).collect(Collectors.joining("|"));
                out.add(Diagnostic.schemaConflict(endpoint,
                    where + " " + field.getName() + " observed as " + kinds + ", widened to a union"));
            }
        }
    }

    private static boolean isAtLeastAsRecent(Instant candidate, Instant other) {
        if (candidate == null) {
            return other == null;
        }
        return other == null || !candidate.isBefore(other);
    }

    private static String preferNewer(String older, String newer) {
        return newer != null ? newer : older;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
