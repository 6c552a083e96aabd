package com.example.trafficservice.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * One captured request/response observation. Immutable once produced by the capture parser.
 */
@Value
@Builder
public class RawExchange {

    /**
     * Position of the entry in the capture file (0-based).
     */
    int index;

    String method;
    String url;
    String scheme;
    String host;
    int port;
    String path;

    @Singular
    List<NameValue> queryParams;

    @Singular
    List<NameValue> requestHeaders;

    @Singular
    List<NameValue> responseHeaders;

    int statusCode;

    byte[] requestBody;
    String requestContentType;

    byte[] responseBody;
    String responseContentType;

    Instant startedAt;
    double timeMs;

    public byte[] getRequestBody() {
        return requestBody == null ? null : requestBody.clone();
    }

    public byte[] getResponseBody() {
        return responseBody == null ? null : responseBody.clone();
    }

    public boolean hasRequestBody() {
        return requestBody != null && requestBody.length > 0;
    }

    public boolean hasResponseBody() {
        return responseBody != null && responseBody.length > 0;
    }

    public Optional<String> requestHeader(String name) {
        return firstValue(requestHeaders, name);
    }

    public Optional<String> responseHeader(String name) {
        return firstValue(responseHeaders, name);
    }

    /**
     * Content type used by {@code content-type} filter rules: the response's declared type, or the
     * request's when the response declares none.
     */
    public String effectiveContentType() {
        if (responseContentType != null && !responseContentType.isBlank()) {
            return responseContentType;
        }
        return requestContentType != null ? requestContentType : "";
    }

    /**
     * Media type without parameters, lower-cased: {@code application/json; charset=utf-8} gives
     * {@code application/json}.
     */
    public static String mediaTypeOf(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String mediaType = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }

    private static Optional<String> firstValue(List<NameValue> entries, String name) {
        return entries.stream()
            .filter(entry -> entry.getName().equalsIgnoreCase(name))
            .map(NameValue::getValue)
            .findFirst();
    }
}
