package com.example.trafficservice.model;

/**
 * Lifecycle of a background capture job.
 */
public enum JobStatus {

    QUEUED("Waiting for a worker"),
    RUNNING("Parsing and modelling"),
    COMPLETED("Finished, result published"),
    FAILED("Aborted by an error, nothing published"),
    CANCELLED("Cancelled, nothing published");

    private final String description;

    JobStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return true once the job can no longer change state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @Override
    public String toString() {
        return String.format("%s: %s", name(), description);
    }
}
