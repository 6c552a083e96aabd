package com.example.trafficservice.service;

import com.example.trafficservice.config.RuleStoreProperties;
import com.example.trafficservice.exception.StorageException;
import com.example.trafficservice.model.RuleState;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Flat-file persistence of the rule store as one JSON document
 * ({@code {"filterRules": [...], "hostRules": [...]}}). Disabled when no file is configured.
 */
@Component
@Slf4j
public class RuleFileStorage {

    private final RuleStoreProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public RuleFileStorage(RuleStoreProperties properties) {
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.isPersistenceEnabled();
    }

    public Optional<RuleState> load() {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path file = file();
        if (!Files.exists(file)) {
            log.info("No rule file at {}, starting with an empty rule store", file);
            return Optional.empty();
        }
        try {
            RuleState state = objectMapper.readValue(file.toFile(), RuleState.class);
            log.info("Loaded {} filter rules and {} host rules from {}",
                state.getFilterRules().size(), state.getHostRules().size(), file);
            return Optional.of(state);
        } catch (IOException e) {
            log.error("Failed to read rule file {}", file, e);
            throw new StorageException("rule file " + file, e);
        }
    }

    /**
     * Replace the persisted state. The previous file stays intact if writing fails.
     */
    public void save(RuleState state) {
        if (!isEnabled()) {
            return;
        }
        Path file = file();
        try {
            AtomicFiles.write(file, objectMapper.writeValueAsBytes(state));
            log.debug("Saved rule state to {}", file);
        } catch (IOException e) {
            log.error("Failed to write rule file {}", file, e);
            throw new StorageException("rule file " + file, e);
        }
    }

    private Path file() {
        return Paths.get(properties.getPersistenceFile());
    }
}
