package com.example.trafficservice.parser;

import com.example.trafficservice.model.NameValue;
import com.example.trafficservice.model.RawExchange;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Maps one HAR 1.2 entry to a {@link RawExchange}.
 *
 * <p>Required: {@code request.method}, {@code request.url} (absolute), {@code response.status}.
 * Bodies may be plain text or {@code "encoding": "base64"}. Unknown fields are ignored.</p>
 */
@Slf4j
class HarEntryMapper {

    RawExchange map(int index, JsonNode entry) throws InvalidEntryException {
        if (!entry.isObject()) {
            throw new InvalidEntryException("entry is not an object");
        }
        JsonNode request = entry.get("request");
        JsonNode response = entry.get("response");
        if (request == null || !request.isObject()) {
            throw new InvalidEntryException("missing request");
        }
        if (response == null || !response.isObject()) {
            throw new InvalidEntryException("missing response");
        }

        String method = requiredText(request, "method", "request.method");
        String url = requiredText(request, "url", "request.url");
        JsonNode status = response.get("status");
        if (status == null || !status.canConvertToInt()) {
            throw new InvalidEntryException("missing or non-numeric response.status");
        }

        UriComponents uri;
        int port;
        try {
            uri = UriComponentsBuilder.fromUriString(url).build();
            port = uri.getPort();
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException("unparsable request.url: " + url, e);
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            throw new InvalidEntryException("request.url has no host: " + url);
        }

        List<NameValue> requestHeaders = nameValues(request.get("headers"));
        List<NameValue> responseHeaders = nameValues(response.get("headers"));

        RawExchange.RawExchangeBuilder exchange = RawExchange.builder()
            .index(index)
            .method(method.toUpperCase(Locale.ROOT))
            .url(url)
            .scheme(uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT))
            .host(uri.getHost().toLowerCase(Locale.ROOT))
            .port(port)
            .path(pathOf(uri))
            .queryParams(queryParams(request.get("queryString"), uri))
            .requestHeaders(requestHeaders)
            .responseHeaders(responseHeaders)
            .statusCode(status.asInt())
            .startedAt(timestamp(entry.get("startedDateTime")))
            .timeMs(entry.path("time").asDouble(0));

        JsonNode postData = request.get("postData");
        if (postData != null && postData.isObject()) {
            exchange.requestBody(postDataBody(postData));
            exchange.requestContentType(textOr(postData, "mimeType", header(requestHeaders, "Content-Type")));
        } else {
            exchange.requestContentType(header(requestHeaders, "Content-Type"));
        }

        JsonNode content = response.get("content");
        if (content != null && content.isObject()) {
            exchange.responseBody(decode(content, "response.content"));
            exchange.responseContentType(textOr(content, "mimeType", header(responseHeaders, "Content-Type")));
        } else {
            exchange.responseContentType(header(responseHeaders, "Content-Type"));
        }

        return exchange.build();
    }

    private static String requiredText(JsonNode node, String field, String label) throws InvalidEntryException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new InvalidEntryException("missing " + label);
        }
        return value.asText();
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value != null && value.isTextual() && !value.asText().isBlank()) {
            return value.asText();
        }
        return fallback;
    }

    private static String pathOf(UriComponents uri) {
        String path = uri.getPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    private static List<NameValue> nameValues(JsonNode array) {
        List<NameValue> result = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return result;
        }
        for (JsonNode item : array) {
            JsonNode name = item.get("name");
            if (name == null || !name.isTextual()) {
                continue;
            }
            result.add(new NameValue(name.asText(), item.path("value").asText("")));
        }
        return result;
    }

    private static List<NameValue> queryParams(JsonNode queryString, UriComponents uri) throws InvalidEntryException {
        List<NameValue> fromHar = nameValues(queryString);
        if (!fromHar.isEmpty()) {
            return fromHar;
        }
        List<NameValue> fromUrl = new ArrayList<>();
        MultiValueMap<String, String> params = uri.getQueryParams();
        for (Map.Entry<String, List<String>> param : params.entrySet()) {
            for (String value : param.getValue()) {
                fromUrl.add(new NameValue(
                    queryComponent(param.getKey()),
                    value == null ? "" : queryComponent(value)));
            }
        }
        return fromUrl;
    }

    private static String queryComponent(String encoded) throws InvalidEntryException {
        try {
            return UriUtils.decode(encoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException("invalid percent-encoding in query: " + encoded, e);
        }
    }

    private static String header(List<NameValue> headers, String name) {
        return headers.stream()
            .filter(header -> header.getName().equalsIgnoreCase(name))
            .map(NameValue::getValue)
            .findFirst()
            .orElse(null);
    }

    /**
     * Request body from {@code postData.text}, or rebuilt from {@code postData.params} when a
     * form submission was recorded only as parameters.
     */
    private static byte[] postDataBody(JsonNode postData) throws InvalidEntryException {
        if (postData.has("text")) {
            return decode(postData, "request.postData");
        }
        JsonNode params = postData.get("params");
        if (params == null || !params.isArray() || params.isEmpty()) {
            return null;
        }
        StringJoiner form = new StringJoiner("&");
        for (NameValue param : nameValues(params)) {
            form.add(UriUtils.encodeQueryParam(param.getName(), StandardCharsets.UTF_8) + "="
                + UriUtils.encodeQueryParam(param.getValue(), StandardCharsets.UTF_8));
        }
        return form.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] decode(JsonNode container, String label) throws InvalidEntryException {
        JsonNode text = container.get("text");
        if (text == null || text.isNull()) {
            return null;
        }
        if (!text.isTextual()) {
            throw new InvalidEntryException(label + ".text is not a string");
        }
        String encoding = container.path("encoding").asText("");
        if (encoding.isEmpty()) {
            return text.asText().getBytes(StandardCharsets.UTF_8);
        }
        if (!encoding.equalsIgnoreCase("base64")) {
            throw new InvalidEntryException("unsupported " + label + ".encoding: " + encoding);
        }
        try {
            return Base64.getDecoder().decode(text.asText().replaceAll("\\s", ""));
        } catch (IllegalArgumentException e) {
            throw new InvalidEntryException("unparsable base64 in " + label, e);
        }
    }

    private static Instant timestamp(JsonNode startedDateTime) {
        if (startedDateTime == null || !startedDateTime.isTextual()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(startedDateTime.asText()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable startedDateTime {}", startedDateTime.asText());
            return null;
        }
    }
}
