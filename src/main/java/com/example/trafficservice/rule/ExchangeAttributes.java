package com.example.trafficservice.rule;

import com.example.trafficservice.exception.InvalidExchangeException;
import com.example.trafficservice.model.ExchangeProbe;
import com.example.trafficservice.model.NameValue;
import com.example.trafficservice.model.RawExchange;
import lombok.Value;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The fixed set of exchange attributes filter rules can look at.
 */
@Value
public class ExchangeAttributes {

    String method;
    String host;
    String url;
    String contentType;

    /**
     * Request headers rendered as {@code Name: value}.
     */
    List<String> headerLines;

    public static ExchangeAttributes of(RawExchange exchange) {
        return new ExchangeAttributes(
            nullToEmpty(exchange.getMethod()),
            nullToEmpty(exchange.getHost()),
            nullToEmpty(exchange.getUrl()),
            exchange.effectiveContentType(),
            exchange.getRequestHeaders().stream()
                .map(ExchangeAttributes::headerLine)
                .collect(Collectors.toUnmodifiableList()));
    }

    /**
     * Attributes of a dry-run probe, normalised like captured exchanges: upper-case method,
     * lower-case host.
     *
     * @throws InvalidExchangeException if the URL cannot be parsed
     */
    public static ExchangeAttributes of(ExchangeProbe probe) {
        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(probe.getUrl()).build();
            // port is parsed lazily
            uri.getPort();
        } catch (IllegalArgumentException e) {
            throw new InvalidExchangeException("unparsable url '" + probe.getUrl() + "'", e);
        }
        List<String> headerLines = probe.getHeaders() == null
            ? List.of()
            : probe.getHeaders().entrySet().stream()
                .map(header -> header.getKey() + ": " + header.getValue())
                .collect(Collectors.toUnmodifiableList());
        return new ExchangeAttributes(
            nullToEmpty(probe.getMethod()).toUpperCase(Locale.ROOT),
            nullToEmpty(uri.getHost()).toLowerCase(Locale.ROOT),
            probe.getUrl(),
            nullToEmpty(probe.getContentType()),
            headerLines);
    }

    private static String headerLine(NameValue header) {
        return header.getName() + ": " + header.getValue();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
