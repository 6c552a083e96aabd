package com.example.trafficservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable failure kinds surfaced by the rule store, rule engine and capture pipeline.
 */
public enum ErrorCode {

    INVALID_PATTERN("Rule pattern '%s' is not a valid regular expression: %s", HttpStatus.BAD_REQUEST),
    INVALID_HOST("'%s' is not a valid host name", HttpStatus.BAD_REQUEST),
    INVALID_RULE("Invalid rule: %s", HttpStatus.BAD_REQUEST),
    INVALID_EXCHANGE("Invalid exchange: %s", HttpStatus.BAD_REQUEST),
    DUPLICATE_RULE("%s '%s' already exists", HttpStatus.CONFLICT),
    NOT_FOUND("%s '%s' not found", HttpStatus.NOT_FOUND),
    MALFORMED_CAPTURE("Capture file is not a readable exchange archive: %s", HttpStatus.UNPROCESSABLE_ENTITY),
    PIPELINE_CANCELLED("Job '%s' was cancelled", HttpStatus.CONFLICT),
    STORAGE_FAILURE("Failed to persist %s", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String messageTemplate;
    private final HttpStatus httpStatus;

    ErrorCode(String messageTemplate, HttpStatus httpStatus) {
        this.messageTemplate = messageTemplate;
        this.httpStatus = httpStatus;
    }

    public String format(Object... args) {
        return String.format(messageTemplate, args);
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
