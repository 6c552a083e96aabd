package com.example.trafficservice.exception;

/**
 * The capture file is not a recognisable archive of exchanges. Aborts the whole parse.
 */
public class MalformedCaptureException extends TrafficServiceException {

    public MalformedCaptureException(String reason) {
        this(reason, null);
    }

    public MalformedCaptureException(String reason, Throwable cause) {
        super(ErrorCode.MALFORMED_CAPTURE, ErrorCode.MALFORMED_CAPTURE.format(reason), cause);
    }
}
