package com.example.trafficservice.rule;

import com.example.trafficservice.exception.InvalidPatternException;
import com.example.trafficservice.exception.RuleValidationException;
import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.HostRule;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validation shared by the rule store, the preset loader and the snapshot compiler.
 */
public final class RuleValidator {

    private static final Pattern HOST_SYNTAX =
        Pattern.compile("^[a-zA-Z0-9][-a-zA-Z0-9]*(\\.[a-zA-Z0-9][-a-zA-Z0-9]*)*$");

    private RuleValidator() {
    }

    public static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(pattern, e);
        }
    }

    public static void validate(FilterRule rule) {
        if (rule == null) {
            throw RuleValidationException.invalid("rule body is missing");
        }
        if (rule.getType() == null) {
            throw RuleValidationException.invalid("type is required");
        }
        if (rule.getPattern() == null || rule.getPattern().isEmpty()) {
            throw RuleValidationException.invalid("pattern is required");
        }
        compile(rule.getPattern());
    }

    public static void validate(HostRule rule) {
        if (rule == null) {
            throw RuleValidationException.invalid("rule body is missing");
        }
        if (rule.getHost() == null || !HOST_SYNTAX.matcher(rule.getHost()).matches()) {
            throw RuleValidationException.invalidHost(rule.getHost());
        }
    }
}
