package com.example.trafficservice.exception;

/**
 * Unknown filter rule, host rule, preset or job id.
 */
public class NotFoundException extends TrafficServiceException {

    public NotFoundException(String kind, String id) {
        super(ErrorCode.NOT_FOUND, ErrorCode.NOT_FOUND.format(kind, id));
    }

    public static NotFoundException filterRule(String id) {
        return new NotFoundException("Filter rule", id);
    }

    public static NotFoundException hostRule(String id) {
        return new NotFoundException("Host rule", id);
    }

    public static NotFoundException preset(String id) {
        return new NotFoundException("Preset", id);
    }

    public static NotFoundException job(String id) {
        return new NotFoundException("Job", id);
    }
}
