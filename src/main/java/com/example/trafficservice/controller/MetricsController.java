package com.example.trafficservice.controller;

import com.example.trafficservice.service.PipelineMetricsService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for pipeline metrics.
 *
 * <h3>Example Response:</h3>
 * <pre>
 * {
 *   "totalCaptures": 12,
 *   "partialCaptures": 1,
 *   "failedCaptures": 0,
 *   "entriesRead": 4810,
 *   "entriesSkipped": 3,
 *   "exchangesExcluded": 3920,
 *   "exchangesIncluded": 887,
 *   "testCasesGenerated": 64,
 *   "averageProcessingTimeMs": 231.5,
 *   "minProcessingTimeMs": 12,
 *   "maxProcessingTimeMs": 1022
 * }
 * </pre>
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final PipelineMetricsService metricsService;

    @GetMapping("/pipeline")
    public ResponseEntity<PipelineMetrics> getPipelineMetrics() {
        PipelineMetrics metrics = new PipelineMetrics();
        metrics.setTotalCaptures(metricsService.getTotalCaptures());
        metrics.setPartialCaptures(metricsService.getPartialCaptures());
        metrics.setFailedCaptures(metricsService.getFailedCaptures());
        metrics.setEntriesRead(metricsService.getEntriesRead());
        metrics.setEntriesSkipped(metricsService.getEntriesSkipped());
        metrics.setExchangesExcluded(metricsService.getExchangesExcluded());
        metrics.setExchangesIncluded(metricsService.getExchangesIncluded());
        metrics.setTestCasesGenerated(metricsService.getTestCasesGenerated());
        metrics.setAverageProcessingTimeMs(metricsService.getAverageProcessingTimeMs());
        metrics.setMinProcessingTimeMs(metricsService.getMinProcessingTimeMs());
        metrics.setMaxProcessingTimeMs(metricsService.getMaxProcessingTimeMs());
        return ResponseEntity.ok(metrics);
    }

    /**
     * Pipeline metrics DTO.
     */
    @Data
    public static class PipelineMetrics {
        private long totalCaptures;
        private long partialCaptures;
        private long failedCaptures;
        private long entriesRead;
        private long entriesSkipped;
        private long exchangesExcluded;
        private long exchangesIncluded;
        private long testCasesGenerated;
        private double averageProcessingTimeMs;
        private long minProcessingTimeMs;
        private long maxProcessingTimeMs;
    }
}
