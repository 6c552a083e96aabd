package com.example.trafficservice.exception;

/**
 * Rule rejected for a reason other than its pattern: bad host syntax, duplicate id or missing fields.
 */
public class RuleValidationException extends TrafficServiceException {

    public RuleValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static RuleValidationException invalidHost(String host) {
        return new RuleValidationException(ErrorCode.INVALID_HOST, ErrorCode.INVALID_HOST.format(host));
    }

    public static RuleValidationException duplicate(String kind, String id) {
        return new RuleValidationException(ErrorCode.DUPLICATE_RULE, ErrorCode.DUPLICATE_RULE.format(kind, id));
    }

    public static RuleValidationException invalid(String reason) {
        return new RuleValidationException(ErrorCode.INVALID_RULE, ErrorCode.INVALID_RULE.format(reason));
    }
}
