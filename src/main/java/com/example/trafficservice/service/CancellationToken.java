package com.example.trafficservice.service;

import com.example.trafficservice.exception.PipelineCancelledException;

/**
 * Checked by long-running pipeline steps between exchanges and between endpoints.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> { };

    /**
     * @throws PipelineCancelledException if the surrounding job was cancelled
     */
    void checkpoint();
}
