package com.example.trafficservice.rule;

import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.FilterRuleType;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Filter rule with its pattern compiled once per snapshot.
 */
@Getter
final class CompiledFilterRule {

    private final String id;
    private final FilterRuleType type;
    private final Pattern pattern;

    CompiledFilterRule(FilterRule rule) {
        this.id = rule.getId();
        this.type = rule.getType();
        this.pattern = RuleValidator.compile(rule.getPattern());
    }

    boolean matches(ExchangeAttributes attributes) {
        switch (type) {
            case URL:
                return pattern.matcher(attributes.getUrl()).find();
            case HOST:
                return pattern.matcher(attributes.getHost()).find();
            case CONTENT_TYPE:
                return pattern.matcher(attributes.getContentType()).find();
            case METHOD:
                return pattern.matcher(attributes.getMethod()).find();
            case HEADER:
                return attributes.getHeaderLines().stream().anyMatch(line -> pattern.matcher(line).find());
            default:
                return false;
        }
    }
}
