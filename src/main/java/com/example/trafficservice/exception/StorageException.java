package com.example.trafficservice.exception;

/**
 * Rule state or pipeline artifacts could not be written.
 */
public class StorageException extends TrafficServiceException {

    public StorageException(String what, Throwable cause) {
        super(ErrorCode.STORAGE_FAILURE, ErrorCode.STORAGE_FAILURE.format(what), cause);
    }
}
