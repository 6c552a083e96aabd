package com.example.trafficservice.service;

import com.example.trafficservice.TestCatalogues;
import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.config.RuleStoreProperties;
import com.example.trafficservice.docs.DocumentationRenderer;
import com.example.trafficservice.docs.OpenApiRenderer;
import com.example.trafficservice.exception.MalformedCaptureException;
import com.example.trafficservice.exception.NotFoundException;
import com.example.trafficservice.model.AnalysisStatus;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.CaptureJob;
import com.example.trafficservice.model.Diagnostic;
import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.FilterRuleType;
import com.example.trafficservice.model.HostRule;
import com.example.trafficservice.model.JobStatus;
import com.example.trafficservice.model.TestSuiteResult;
import com.example.trafficservice.parser.CaptureParser;
import com.example.trafficservice.rule.PresetCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.task.TaskRejectedException;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CapturePipelineServiceTest {

    @TempDir
    Path outputDirectory;

    private RuleStoreService ruleStore;
    private RuleEngineService ruleEngine;
    private PipelineMetricsService metrics;
    private PipelineProperties pipelineProperties;

    @BeforeEach
    void setUp() {
        RuleStoreProperties ruleProperties = new RuleStoreProperties();
        PresetCatalog presets = new PresetCatalog(ruleProperties, new DefaultResourceLoader(), new ObjectMapper());
        ruleStore = new RuleStoreService(presets, new RuleFileStorage(ruleProperties),
            mock(ApplicationEventPublisher.class));
        ruleStore.init();
        ruleEngine = new RuleEngineService(ruleStore, ruleProperties);
        ruleEngine.init();

        metrics = new PipelineMetricsService();
        metrics.initialize();

        pipelineProperties = new PipelineProperties();
        pipelineProperties.setOutputDirectory(outputDirectory.toString());
    }

    private CapturePipelineService pipeline(Executor executor) {
        return new CapturePipelineService(
            new CaptureParser(),
            ruleEngine,
            TestCatalogues.modelBuilder(pipelineProperties),
            new TestSynthesizerService(),
            new DocumentationRenderer(pipelineProperties),
            new OpenApiRenderer(),
            new ArtifactStorageService(pipelineProperties),
            metrics,
            pipelineProperties,
            executor);
    }

    private CapturePipelineService pipeline() {
        return pipeline(Runnable::run);
    }

    private InputStream fixture(String name) {
        InputStream in = getClass().getResourceAsStream("/captures/" + name);
        assertNotNull(in);
        return in;
    }

    private Path fixturePath(String name) throws Exception {
        return Paths.get(getClass().getResource("/captures/" + name).toURI());
    }

    private void excludeNoiseAndForeignHosts() {
        ruleStore.applyPreset("common-noise");
        ruleStore.addHostRule(HostRule.builder().host("api.example.com").build());
        ruleEngine.reload();
    }

    // ==================== Inline runs ====================

    @Test
    void shouldModelEveryExchangeWithoutRules() {
        // When
        CaptureAnalysis analysis = pipeline().parseCapture(fixture("users.har"), "users.har");

        // Then
        assertEquals(AnalysisStatus.COMPLETE, analysis.getStatus());
        assertEquals("users.har", analysis.getCaptureName());
        assertEquals(6, analysis.getTotalEntries());
        assertEquals(0, analysis.getExcludedExchanges());
        assertEquals(6, analysis.getIncludedExchanges());
        assertEquals(5, analysis.getApis().size());
        assertEquals(1, analysis.getRuleSnapshotVersion());
    }

    @Test
    void shouldExcludeExchangesMatchedByRules() {
        // Given
        excludeNoiseAndForeignHosts();

        // When
        CaptureAnalysis analysis = pipeline().parseCapture(fixture("users.har"), "users.har");

        // Then
        assertEquals(3, analysis.getExcludedExchanges());
        assertEquals(3, analysis.getIncludedExchanges());
        assertThat(analysis.getApis()).extracting(ApiDefinition::getKey)
            .containsExactly("GET /users/{id}", "POST /users");
        assertEquals(2, analysis.getRuleSnapshotVersion());
        assertEquals(3, metrics.getExchangesExcluded());
    }

    @Test
    void shouldReportSkippedEntriesAsPartial() {
        // When
        CaptureAnalysis analysis = pipeline().parseCapture(fixture("broken-entries.har"), "broken-entries.har");

        // Then
        assertEquals(AnalysisStatus.PARTIAL, analysis.getStatus());
        assertEquals(3, analysis.getTotalEntries());
        assertEquals(2, analysis.getSkippedEntries());
        assertThat(analysis.getDiagnostics()).extracting(Diagnostic::getEntryIndex).containsExactly(1, 2);
        assertThat(analysis.getApis()).extracting(ApiDefinition::getKey).containsExactly("GET /orders/{id}");
        assertEquals(1, metrics.getPartialCaptures());
    }

    @Test
    void shouldFailOnMalformedCapture() {
        CapturePipelineService pipeline = pipeline();

        assertThrows(MalformedCaptureException.class,
            () -> pipeline.parseCapture(fixture("truncated.har"), "truncated.har"));
        assertEquals(1, metrics.getFailedCaptures());
    }

    @Test
    void shouldEvaluateWholeRunAgainstOneSnapshot() {
        // Given
        CapturePipelineService pipeline = pipeline();
        AtomicBoolean reloaded = new AtomicBoolean();
        CancellationToken reloadMidRun = () -> {
            if (reloaded.compareAndSet(false, true)) {
                ruleStore.addFilterRule(FilterRule.builder().id("all").type(FilterRuleType.URL).pattern(".*").build());
                ruleEngine.reload();
            }
        };

        // When
        CaptureAnalysis analysis = pipeline.analyse(new CaptureParser().parse(fixture("users.har"), "users.har"),
            reloadMidRun);

        // Then
        assertTrue(reloaded.get());
        assertEquals(6, analysis.getIncludedExchanges());
        assertEquals(1, analysis.getRuleSnapshotVersion());
        assertEquals(2, ruleEngine.snapshot().getVersion());
    }

    @Test
    void shouldGenerateTestsAndDocumentation() {
        // Given
        CapturePipelineService pipeline = pipeline();
        CaptureAnalysis analysis = pipeline.parseCapture(fixture("users.har"), "users.har");

        // When
        TestSuiteResult suite = pipeline.generateTests(analysis.toCatalogue());

        // Then
        assertEquals(5, suite.getTestCases().size());
        assertThat(suite.getDocumentation()).contains("## GET /users/{id}");
        assertEquals(5, metrics.getTestCasesGenerated());
    }

    // ==================== Background jobs ====================

    @Test
    void shouldCompleteJobAndStoreArtifacts() throws Exception {
        // When
        CaptureJob job = pipeline().submitJob(fixturePath("users.har"), "users.har", false);

        // Then
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertNotNull(job.getResult());
        assertEquals(5, job.getResult().getApis().size());
        assertNotNull(job.getFinishedAt());

        Path runDirectory = outputDirectory.resolve("users.har-" + job.getJobId());
        assertTrue(Files.exists(runDirectory.resolve(ArtifactStorageService.CATALOGUE_FILE)));
        assertTrue(Files.exists(runDirectory.resolve(ArtifactStorageService.TEST_CASES_FILE)));
        assertTrue(Files.exists(runDirectory.resolve(ArtifactStorageService.DOCUMENTATION_FILE)));
        assertTrue(Files.exists(runDirectory.resolve(ArtifactStorageService.OPENAPI_FILE)));
        assertTrue(Files.exists(fixturePath("users.har")));
    }

    @Test
    void shouldFailJobOnMalformedCapture() throws Exception {
        // When
        CaptureJob job = pipeline().submitJob(fixturePath("truncated.har"), "truncated.har", false);

        // Then
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertNotNull(job.getErrorMessage());
        assertNull(job.getResult());
    }

    @Test
    void shouldNotRunJobCancelledWhileQueued() throws Exception {
        // Given
        List<Runnable> queued = new ArrayList<>();
        CapturePipelineService pipeline = pipeline(queued::add);
        CaptureJob submitted = pipeline.submitJob(fixturePath("users.har"), "users.har", false);
        assertEquals(JobStatus.QUEUED, submitted.getStatus());

        // When
        CaptureJob cancelled = pipeline.cancelJob(submitted.getJobId());
        queued.forEach(Runnable::run);

        // Then
        assertEquals(JobStatus.CANCELLED, cancelled.getStatus());
        CaptureJob after = pipeline.getJob(submitted.getJobId());
        assertEquals(JobStatus.CANCELLED, after.getStatus());
        assertNull(after.getResult());
        assertFalse(Files.exists(outputDirectory.resolve("users.har-" + submitted.getJobId())));
    }

    @Test
    void shouldKeepCompletedJobWhenCancelled() throws Exception {
        // Given
        CapturePipelineService pipeline = pipeline();
        CaptureJob job = pipeline.submitJob(fixturePath("users.har"), "users.har", false);

        // When
        CaptureJob afterCancel = pipeline.cancelJob(job.getJobId());

        // Then
        assertEquals(JobStatus.COMPLETED, afterCancel.getStatus());
        assertNotNull(afterCancel.getResult());
    }

    @Test
    void shouldFailJobRejectedByExecutor() throws Exception {
        // Given
        CapturePipelineService pipeline = pipeline(task -> {
            throw new TaskRejectedException("queue full");
        });

        // When
        CaptureJob job = pipeline.submitJob(fixturePath("users.har"), "users.har", false);

        // Then
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals("Job queue is full", job.getErrorMessage());
    }

    @Test
    void shouldListJobsAndRejectUnknownIds() throws Exception {
        // Given
        CapturePipelineService pipeline = pipeline();
        CaptureJob first = pipeline.submitJob(fixturePath("users.har"), "first.har", false);

        // When
        List<CaptureJob> jobs = pipeline.listJobs();

        // Then
        assertThat(jobs).extracting(CaptureJob::getJobId).containsExactly(first.getJobId());
        assertThrows(NotFoundException.class, () -> pipeline.getJob("missing"));
        assertThrows(NotFoundException.class, () -> pipeline.cancelJob("missing"));
    }

    @Test
    void shouldDropOldestFinishedJobsBeyondRetention() throws Exception {
        // Given
        pipelineProperties.setRetainedJobs(2);
        CapturePipelineService pipeline = pipeline();

        // When
        CaptureJob first = pipeline.submitJob(fixturePath("users.har"), "first.har", false);
        CaptureJob second = pipeline.submitJob(fixturePath("users.har"), "second.har", false);
        CaptureJob third = pipeline.submitJob(fixturePath("truncated.har"), "third.har", false);

        // Then
        assertThat(pipeline.listJobs()).extracting(CaptureJob::getJobId)
            .containsExactly(second.getJobId(), third.getJobId());
        assertThrows(NotFoundException.class, () -> pipeline.getJob(first.getJobId()));
    }

    @Test
    void shouldNeverDropUnfinishedJobs() throws Exception {
        // Given
        pipelineProperties.setRetainedJobs(0);
        List<Runnable> queued = new ArrayList<>();
        CapturePipelineService pipeline = pipeline(queued::add);

        // When
        CaptureJob first = pipeline.submitJob(fixturePath("users.har"), "first.har", false);
        CaptureJob second = pipeline.submitJob(fixturePath("users.har"), "second.har", false);

        // Then
        assertThat(pipeline.listJobs()).extracting(CaptureJob::getJobId)
            .containsExactly(first.getJobId(), second.getJobId());

        queued.forEach(Runnable::run);
        assertThat(pipeline.listJobs()).isEmpty();
    }
}
