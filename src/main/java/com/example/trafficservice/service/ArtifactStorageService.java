package com.example.trafficservice.service;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.exception.StorageException;
import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.TestSuiteResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes the artifacts of a finished run to {@code pipeline.output-directory}, one directory per
 * run. The files are staged in a hidden sibling directory that is moved into place once all of them
 * are written, so a run directory is either complete or absent.
 */
@Service
@Slf4j
public class ArtifactStorageService {

    static final String CATALOGUE_FILE = "catalogue.json";
    static final String TEST_CASES_FILE = "test-cases.json";
    static final String DOCUMENTATION_FILE = "documentation.md";
    static final String OPENAPI_FILE = "openapi.json";

    private final PipelineProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public ArtifactStorageService(PipelineProperties properties) {
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.isOutputEnabled();
    }

    /**
     * @return the run directory, or empty when output is disabled
     */
    public Optional<Path> store(String runName, CaptureAnalysis analysis, TestSuiteResult suite, JsonNode openApi) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path outputDirectory = Paths.get(properties.getOutputDirectory());
        String directoryName = safeName(runName);
        Path runDirectory = outputDirectory.resolve(directoryName);
        Path staging = outputDirectory.resolve("." + directoryName + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.createDirectories(staging);
            Files.write(staging.resolve(CATALOGUE_FILE), objectMapper.writeValueAsBytes(analysis));
            Files.write(staging.resolve(TEST_CASES_FILE), objectMapper.writeValueAsBytes(suite.getTestCases()));
            Files.write(staging.resolve(DOCUMENTATION_FILE), suite.getDocumentation().getBytes(StandardCharsets.UTF_8));
            Files.write(staging.resolve(OPENAPI_FILE), objectMapper.writeValueAsBytes(openApi));
            try {
                Files.move(staging, runDirectory, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staging, runDirectory);
            }
        } catch (IOException e) {
            log.error("Failed to write artifacts of {} to {}", runName, runDirectory, e);
            deleteRecursively(staging);
            throw new StorageException("artifacts in " + runDirectory, e);
        }
        log.info("Stored artifacts of {} in {}", runName, runDirectory);
        return Optional.of(runDirectory);
    }

    private static void deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", directory, e.getMessage());
        }
    }

    static String safeName(String runName) {
        String name = runName == null ? "" : runName.replaceAll("[^A-Za-z0-9._-]", "_");
        name = name.replaceAll("^\\.+", "");
        return name.isEmpty() ? "capture" : name;
    }
}
