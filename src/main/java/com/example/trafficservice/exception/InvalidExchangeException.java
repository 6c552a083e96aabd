package com.example.trafficservice.exception;

/**
 * Exchange description that cannot be evaluated, such as a probe with an unparsable URL.
 */
public class InvalidExchangeException extends TrafficServiceException {

    public InvalidExchangeException(String reason, Throwable cause) {
        super(ErrorCode.INVALID_EXCHANGE, ErrorCode.INVALID_EXCHANGE.format(reason), cause);
    }
}
