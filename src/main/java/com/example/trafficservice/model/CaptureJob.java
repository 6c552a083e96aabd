package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Public view of a background capture job. {@link #result} is set only for completed jobs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaptureJob {

    private String jobId;

    private String captureName;

    private JobStatus status;

    private String errorMessage;

    private LocalDateTime submittedAt;

    private LocalDateTime finishedAt;

    private CaptureAnalysis result;
}
