package com.example.trafficservice.exception;

/**
 * Base class of all structural failures. Each carries the {@link ErrorCode} that the
 * API layer maps to an HTTP status.
 */
public class TrafficServiceException extends RuntimeException {

    private final ErrorCode errorCode;

    public TrafficServiceException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public TrafficServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        String errMsg = String.format("%s[%s]: %s", getClass().getSimpleName(), errorCode, getMessage());
        Throwable cause = getCause();
        if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
            errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
        }
        return errMsg;
    }
}
