package com.example.trafficservice.service;

import com.example.trafficservice.model.AnalysisStatus;
import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service for tracking capture pipeline metrics.
 *
 * <p>Tracks:</p>
 * <ul>
 *   <li>Captures analysed, by result status</li>
 *   <li>Entries read, skipped, excluded by rules and modelled</li>
 *   <li>Processing times (min, max, average)</li>
 *   <li>Background job outcomes</li>
 * </ul>
 *
 * <p>Counters are exposed via Spring Boot Actuator at /actuator/metrics when a
 * {@link MeterRegistry} is present, and always via {@code /api/metrics/pipeline}.</p>
 */
@Service
@Slf4j
public class PipelineMetricsService {

    @Autowired(required = false)
    private MeterRegistry meterRegistry;

    private final Map<AnalysisStatus, Counter> statusCounters = new ConcurrentHashMap<>();
    private final Map<JobStatus, Counter> jobCounters = new ConcurrentHashMap<>();
    private Timer processingTimer;

    private final AtomicLong totalCaptures = new AtomicLong(0);
    private final AtomicLong partialCaptures = new AtomicLong(0);
    private final AtomicLong failedCaptures = new AtomicLong(0);
    private final AtomicLong entriesRead = new AtomicLong(0);
    private final AtomicLong entriesSkipped = new AtomicLong(0);
    private final AtomicLong exchangesExcluded = new AtomicLong(0);
    private final AtomicLong exchangesIncluded = new AtomicLong(0);
    private final AtomicLong testCasesGenerated = new AtomicLong(0);

    private final AtomicLong totalProcessingTimeMs = new AtomicLong(0);
    private final AtomicLong minProcessingTimeMs = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxProcessingTimeMs = new AtomicLong(0);

    @PostConstruct
    public void initialize() {
        if (meterRegistry != null) {
            log.info("Pipeline metrics service initialized with Micrometer registry");
            meterRegistry.gauge("pipeline.captures.total", totalCaptures);
            meterRegistry.gauge("pipeline.captures.partial", partialCaptures);
            meterRegistry.gauge("pipeline.captures.failed", failedCaptures);
            meterRegistry.gauge("pipeline.entries.skipped", entriesSkipped);
            meterRegistry.gauge("pipeline.exchanges.excluded", exchangesExcluded);
            meterRegistry.gauge("pipeline.exchanges.included", exchangesIncluded);
            meterRegistry.gauge("pipeline.avg_processing_time_ms", this, PipelineMetricsService::getAverageProcessingTimeMs);
            processingTimer = meterRegistry.timer("pipeline.processing_time");
        } else {
            log.info("Pipeline metrics service initialized without Micrometer registry");
        }
    }

    public void recordAnalysis(CaptureAnalysis analysis) {
        totalCaptures.incrementAndGet();
        if (analysis.isPartial()) {
            partialCaptures.incrementAndGet();
        }
        entriesRead.addAndGet(analysis.getTotalEntries());
        entriesSkipped.addAndGet(analysis.getSkippedEntries());
        exchangesExcluded.addAndGet(analysis.getExcludedExchanges());
        exchangesIncluded.addAndGet(analysis.getIncludedExchanges());

        long processingTimeMs = analysis.getProcessingTimeMs() == null ? 0 : analysis.getProcessingTimeMs();
        totalProcessingTimeMs.addAndGet(processingTimeMs);
        minProcessingTimeMs.updateAndGet(current -> Math.min(current, processingTimeMs));
        maxProcessingTimeMs.updateAndGet(current -> Math.max(current, processingTimeMs));

        if (meterRegistry != null) {
            statusCounters.computeIfAbsent(analysis.getStatus(), s ->
                meterRegistry.counter("pipeline.analysis", "status", s.name())).increment();
            processingTimer.record(processingTimeMs, TimeUnit.MILLISECONDS);
        }

        log.debug("Recorded analysis of {}: status={}, endpoints={}, processingTime={}ms",
            analysis.getCaptureName(), analysis.getStatus(), analysis.getApis().size(), processingTimeMs);
    }

    public void recordFailure() {
        failedCaptures.incrementAndGet();
        if (meterRegistry != null) {
            meterRegistry.counter("pipeline.failures").increment();
        }
    }

    public void recordTestCases(int count) {
        testCasesGenerated.addAndGet(count);
        if (meterRegistry != null) {
            meterRegistry.counter("pipeline.test_cases").increment(count);
        }
    }

    public void recordJob(JobStatus status) {
        if (meterRegistry != null) {
            jobCounters.computeIfAbsent(status, s ->
                meterRegistry.counter("pipeline.jobs", "status", s.name())).increment();
        }
    }

    public double getAverageProcessingTimeMs() {
        long total = totalCaptures.get();
        if (total == 0) {
            return 0.0;
        }
        return (double) totalProcessingTimeMs.get() / total;
    }

    public long getMinProcessingTimeMs() {
        long min = minProcessingTimeMs.get();
        return min == Long.MAX_VALUE ? 0 : min;
    }

    public long getMaxProcessingTimeMs() {
        return maxProcessingTimeMs.get();
    }

    public long getTotalCaptures() {
        return totalCaptures.get();
    }

    public long getPartialCaptures() {
        return partialCaptures.get();
    }

    public long getFailedCaptures() {
        return failedCaptures.get();
    }

    public long getEntriesRead() {
        return entriesRead.get();
    }

    public long getEntriesSkipped() {
        return entriesSkipped.get();
    }

    public long getExchangesExcluded() {
        return exchangesExcluded.get();
    }

    public long getExchangesIncluded() {
        return exchangesIncluded.get();
    }

    public long getTestCasesGenerated() {
        return testCasesGenerated.get();
    }

    /**
     * Reset all metrics (for testing).
     */
    public void resetMetrics() {
        totalCaptures.set(0);
        partialCaptures.set(0);
        failedCaptures.set(0);
        entriesRead.set(0);
        entriesSkipped.set(0);
        exchangesExcluded.set(0);
        exchangesIncluded.set(0);
        testCasesGenerated.set(0);
        totalProcessingTimeMs.set(0);
        minProcessingTimeMs.set(Long.MAX_VALUE);
        maxProcessingTimeMs.set(0);
    }
}
