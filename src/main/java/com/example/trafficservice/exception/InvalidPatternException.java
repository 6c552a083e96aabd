package com.example.trafficservice.exception;

import java.util.regex.PatternSyntaxException;

/**
 * A filter rule pattern that does not compile.
 */
public class InvalidPatternException extends TrafficServiceException {

    private final String pattern;

    public InvalidPatternException(String pattern, PatternSyntaxException cause) {
        super(ErrorCode.INVALID_PATTERN,
              ErrorCode.INVALID_PATTERN.format(pattern, cause.getDescription()),
              cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
