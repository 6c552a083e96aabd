package com.example.trafficservice.service;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.docs.DocumentationRenderer;
import com.example.trafficservice.docs.OpenApiRenderer;
import com.example.trafficservice.exception.MalformedCaptureException;
import com.example.trafficservice.exception.NotFoundException;
import com.example.trafficservice.exception.PipelineCancelledException;
import com.example.trafficservice.exception.StorageException;
import com.example.trafficservice.model.ApiCatalogue;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.CaptureJob;
import com.example.trafficservice.model.JobStatus;
import com.example.trafficservice.model.RawExchange;
import com.example.trafficservice.model.TestCase;
import com.example.trafficservice.model.TestSuiteResult;
import com.example.trafficservice.parser.CaptureParser;
import com.example.trafficservice.parser.CaptureReader;
import com.example.trafficservice.rule.RuleSnapshot;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runs captures through parse, rule evaluation, model building and test synthesis, either inline
 * or as background jobs.
 *
 * <p>Each run evaluates every exchange against the rule snapshot that was active when the run
 * started, so a reload in the middle of a run does not split it across two rule sets.</p>
 */
@Service
@Slf4j
public class CapturePipelineService {

    private final CaptureParser captureParser;
    private final RuleEngineService ruleEngine;
    private final ModelBuilderService modelBuilder;
    private final TestSynthesizerService testSynthesizer;
    private final DocumentationRenderer documentationRenderer;
    private final OpenApiRenderer openApiRenderer;
    private final ArtifactStorageService artifactStorage;
    private final PipelineMetricsService metrics;
    private final PipelineProperties properties;
    private final Executor executor;

    private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
    private final AtomicLong jobSequence = new AtomicLong();

    public CapturePipelineService(CaptureParser captureParser,
                                  RuleEngineService ruleEngine,
                                  ModelBuilderService modelBuilder,
                                  TestSynthesizerService testSynthesizer,
                                  DocumentationRenderer documentationRenderer,
                                  OpenApiRenderer openApiRenderer,
                                  ArtifactStorageService artifactStorage,
                                  PipelineMetricsService metrics,
                                  PipelineProperties properties,
                                  @Qualifier("pipelineTaskExecutor") Executor executor) {
        this.captureParser = captureParser;
        this.ruleEngine = ruleEngine;
        this.modelBuilder = modelBuilder;
        this.testSynthesizer = testSynthesizer;
        this.documentationRenderer = documentationRenderer;
        this.openApiRenderer = openApiRenderer;
        this.artifactStorage = artifactStorage;
        this.metrics = metrics;
        this.properties = properties;
        this.executor = executor;
    }

    // ==================== Inline runs ====================

    public CaptureAnalysis parseCapture(Path captureFile) {
        return analyse(captureParser.parse(captureFile), CancellationToken.NONE);
    }

    public CaptureAnalysis parseCapture(InputStream in, String captureName) {
        return analyse(captureParser.parse(in, captureName), CancellationToken.NONE);
    }

    public CaptureAnalysis parseCapture(MultipartFile file) {
        try {
            return parseCapture(file.getInputStream(), captureName(file));
        } catch (IOException e) {
            throw new MalformedCaptureException("cannot read upload " + file.getOriginalFilename(), e);
        }
    }

    public TestSuiteResult generateTests(ApiCatalogue catalogue) {
        return generateTests(catalogue.getApis(), CancellationToken.NONE);
    }

    public String renderDocumentation(List<ApiDefinition> definitions) {
        return documentationRenderer.render(definitions);
    }

    public ObjectNode renderOpenApi(List<ApiDefinition> definitions, String title) {
        return openApiRenderer.render(definitions, title);
    }

    private TestSuiteResult generateTests(List<ApiDefinition> definitions, CancellationToken cancellation) {
        List<TestCase> testCases = testSynthesizer.synthesize(definitions, cancellation);
        String documentation = documentationRenderer.render(definitions);
        metrics.recordTestCases(testCases.size());
        return TestSuiteResult.builder().testCases(testCases).documentation(documentation).build();
    }

    /**
     * Consume the reader to the end against one rule snapshot. The reader is closed on return.
     */
    CaptureAnalysis analyse(CaptureReader reader, CancellationToken cancellation) {
        long startTime = System.currentTimeMillis();
        RuleSnapshot snapshot = ruleEngine.snapshot();
        int[] excluded = new int[1];
        int[] included = new int[1];
        Predicate<RawExchange> include = exchange -> {
            if (snapshot.evaluate(exchange)) {
                included[0]++;
                return true;
            }
            excluded[0]++;
            return false;
        };

        try (CaptureReader capture = reader) {
            ApiCatalogue catalogue = modelBuilder.build(capture, include, cancellation);
            CaptureAnalysis analysis = CaptureAnalysis.of(
                capture.getCaptureName(),
                catalogue,
                capture.getDiagnostics(),
                new CaptureAnalysis.Counts(capture.getEntriesRead(), capture.getSkippedEntries(),
                    excluded[0], included[0]),
                snapshot.getVersion(),
                System.currentTimeMillis() - startTime);

            metrics.recordAnalysis(analysis);
            log.info("Analysed {} against rules v{}: {} entries, {} skipped, {} excluded, {} endpoints ({})",
                analysis.getCaptureName(), snapshot.getVersion(), analysis.getTotalEntries(),
                analysis.getSkippedEntries(), analysis.getExcludedExchanges(), analysis.getApis().size(),
                analysis.getStatus());
            return analysis;
        } catch (MalformedCaptureException e) {
            metrics.recordFailure();
            throw e;
        } catch (IOException e) {
            metrics.recordFailure();
            throw new MalformedCaptureException(reader.getCaptureName() + ": " + e.getMessage(), e);
        }
    }

    // ==================== Background jobs ====================

    /**
     * Queue a capture upload. The upload is copied to a temporary file first because the request
     * stream is gone once the request completes.
     */
    public CaptureJob submitJob(MultipartFile file) {
        Path temp;
        try {
            temp = Files.createTempFile("capture-", ".har");
            file.transferTo(temp);
        } catch (IOException e) {
            throw new StorageException("upload " + file.getOriginalFilename(), e);
        }
        return submitJob(temp, captureName(file), true);
    }

    /**
     * Queue a capture file.
     *
     * @param deleteWhenDone remove the file once the job reaches a terminal state
     */
    public CaptureJob submitJob(Path captureFile, String captureName, boolean deleteWhenDone) {
        pruneFinishedJobs();
        JobState job = new JobState(UUID.randomUUID().toString(), captureName, jobSequence.incrementAndGet());
        jobs.put(job.jobId, job);
        try {
            executor.execute(() -> runJob(job, captureFile, deleteWhenDone));
        } catch (TaskRejectedException e) {
            log.error("Capture job {} rejected by executor", job.jobId, e);
            job.fail("Job queue is full");
            metrics.recordJob(JobStatus.FAILED);
            deleteQuietly(captureFile, deleteWhenDone);
        }
        log.info("Submitted capture job {} for {}", job.jobId, captureName);
        return job.view();
    }

    public CaptureJob getJob(String jobId) {
        return find(jobId).view();
    }

    /**
     * Cancel a queued or running job. Cancelling a finished job changes nothing.
     */
    public CaptureJob cancelJob(String jobId) {
        JobState job = find(jobId);
        if (job.cancel()) {
            log.info("Cancelled capture job {}", jobId);
            metrics.recordJob(JobStatus.CANCELLED);
        }
        return job.view();
    }

    public List<CaptureJob> listJobs() {
        return jobs.values().stream()
            .sorted(Comparator.comparingLong((JobState job) -> job.sequence))
            .map(JobState::view)
            .collect(Collectors.toList());
    }

    private void runJob(JobState job, Path captureFile, boolean deleteWhenDone) {
        try {
            if (!job.start()) {
                log.debug("Capture job {} was cancelled before it started", job.jobId);
                return;
            }
            CancellationToken cancellation = () -> {
                if (job.status.get() == JobStatus.CANCELLED) {
                    throw new PipelineCancelledException(job.jobId);
                }
            };

            CaptureAnalysis analysis = analyse(captureParser.parse(captureFile), cancellation);
            TestSuiteResult suite = generateTests(analysis.getApis(), cancellation);
            ObjectNode openApi = openApiRenderer.render(analysis.getApis(), job.captureName);
            cancellation.checkpoint();

            if (!job.complete(analysis)) {
                log.info("Capture job {} was cancelled, discarding its result", job.jobId);
                return;
            }
            metrics.recordJob(JobStatus.COMPLETED);
            log.info("Capture job {} completed: {} endpoints, {} test cases",
                job.jobId, analysis.getApis().size(), suite.getTestCases().size());
            storeArtifacts(job, analysis, suite, openApi);
        } catch (PipelineCancelledException e) {
            log.info("Capture job {} stopped after cancellation", job.jobId);
        } catch (RuntimeException e) {
            log.error("Capture job {} failed", job.jobId, e);
            if (job.fail(e.getMessage())) {
                metrics.recordJob(JobStatus.FAILED);
            }
        } finally {
            deleteQuietly(captureFile, deleteWhenDone);
            pruneFinishedJobs();
        }
    }

    /**
     * Drop the oldest finished jobs beyond {@code pipeline.retained-jobs}. Queued and running jobs
     * are never dropped.
     */
    private void pruneFinishedJobs() {
        List<JobState> finished = jobs.values().stream()
            .filter(job -> job.status.get().isTerminal())
            .sorted(Comparator.comparingLong((JobState job) -> job.sequence))
            .collect(Collectors.toList());
        int excess = finished.size() - Math.max(0, properties.getRetainedJobs());
        for (int i = 0; i < excess; i++) {
            JobState dropped = finished.get(i);
            if (jobs.remove(dropped.jobId, dropped)) {
                log.debug("Dropped finished capture job {}", dropped.jobId);
            }
        }
    }

    private void storeArtifacts(JobState job, CaptureAnalysis analysis, TestSuiteResult suite, ObjectNode openApi) {
        try {
            artifactStorage.store(job.captureName + "-" + job.jobId, analysis, suite, openApi);
        } catch (StorageException e) {
            job.errorMessage = e.getMessage();
        }
    }

    private JobState find(String jobId) {
        JobState job = jobs.get(jobId);
        if (job == null) {
            throw NotFoundException.job(jobId);
        }
        return job;
    }

    private static String captureName(MultipartFile file) {
        String name = file.getOriginalFilename();
        return name == null || name.isBlank() ? "upload.har" : name;
    }

    private static void deleteQuietly(Path file, boolean delete) {
        if (!delete) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary capture {}: {}", file, e.getMessage());
        }
    }

    /**
     * Mutable job record. Status changes go through compare-and-set so that a cancel racing with
     * completion has exactly one winner; the result is exposed only once the job is COMPLETED.
     */
    private static final class JobState {
        private final String jobId;
        private final String captureName;
        private final long sequence;
        private final LocalDateTime submittedAt = LocalDateTime.now();
        private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.QUEUED);
        private volatile CaptureAnalysis result;
        private volatile String errorMessage;
        private volatile LocalDateTime finishedAt;

        private JobState(String jobId, String captureName, long sequence) {
            this.jobId = jobId;
            this.captureName = captureName;
            this.sequence = sequence;
        }

        private boolean start() {
            return status.compareAndSet(JobStatus.QUEUED, JobStatus.RUNNING);
        }

        private boolean complete(CaptureAnalysis analysis) {
            result = analysis;
            if (status.compareAndSet(JobStatus.RUNNING, JobStatus.COMPLETED)) {
                finishedAt = LocalDateTime.now();
                return true;
            }
            result = null;
            return false;
        }

        private boolean fail(String message) {
            JobStatus current = status.get();
            if (!current.isTerminal() && status.compareAndSet(current, JobStatus.FAILED)) {
                errorMessage = message;
                finishedAt = LocalDateTime.now();
                return true;
            }
            return false;
        }

        private boolean cancel() {
            while (true) {
                JobStatus current = status.get();
                if (current.isTerminal()) {
                    return false;
                }
                if (status.compareAndSet(current, JobStatus.CANCELLED)) {
                    finishedAt = LocalDateTime.now();
                    return true;
                }
            }
        }

        private CaptureJob view() {
            JobStatus current = status.get();
            return CaptureJob.builder()
                .jobId(jobId)
                .captureName(captureName)
                .status(current)
                .errorMessage(errorMessage)
                .submittedAt(submittedAt)
                .finishedAt(finishedAt)
                .result(current == JobStatus.COMPLETED ? result : null)
                .build();
        }
    }
}
