package com.example.trafficservice.exception;

/**
 * Thrown between processing steps once a job has been cancelled; nothing of the job is published.
 */
public class PipelineCancelledException extends TrafficServiceException {

    public PipelineCancelledException(String jobId) {
        super(ErrorCode.PIPELINE_CANCELLED, ErrorCode.PIPELINE_CANCELLED.format(jobId));
    }
}
