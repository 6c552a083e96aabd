package com.example.trafficservice.rule;

import com.example.trafficservice.model.HostRule;
import lombok.Getter;

import java.util.Locale;

/**
 * Host rule comparison: exact, case-insensitive, or any deeper label when subdomains are included.
 */
@Getter
final class HostMatcher {

    private final String id;
    private final String host;
    private final boolean includeSubdomains;

    HostMatcher(HostRule rule) {
        this.id = rule.getId();
        this.host = rule.getHost().toLowerCase(Locale.ROOT);
        this.includeSubdomains = rule.isIncludeSubdomains();
    }

    boolean matches(String exchangeHost) {
        if (exchangeHost == null || exchangeHost.isEmpty()) {
            return false;
        }
        String candidate = exchangeHost.toLowerCase(Locale.ROOT);
        if (candidate.equals(host)) {
            return true;
        }
        return includeSubdomains && candidate.endsWith("." + host);
    }
}
