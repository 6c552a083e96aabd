package com.example.trafficservice.parser;

import com.example.trafficservice.config.PipelineProperties;
import com.example.trafficservice.exception.MalformedCaptureException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens HAR capture files as lazy exchange sequences.
 */
@Component
@Slf4j
public class CaptureParser {

    private final ObjectMapper objectMapper;
    private final HarEntryMapper entryMapper = new HarEntryMapper();

    public CaptureParser() {
        this(new PipelineProperties());
    }

    /**
     * Bodies are single JSON strings, so the longest accepted string is
     * {@code pipeline.max-capture-string-length} rather than Jackson's default.
     */
    @Autowired
    public CaptureParser(PipelineProperties properties) {
        JsonFactory factory = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(properties.getMaxCaptureStringLength())
                .build())
            .build();
        this.objectMapper = new ObjectMapper(factory);
    }

    /**
     * Open a capture file. The caller closes the returned reader.
     *
     * @throws MalformedCaptureException if the file is unreadable or not a HAR archive
     */
    public CaptureReader parse(Path captureFile) {
        InputStream in;
        try {
            in = Files.newInputStream(captureFile);
        } catch (IOException e) {
            throw new MalformedCaptureException("cannot open " + captureFile + ": " + e.getMessage(), e);
        }
        return parse(in, captureFile.getFileName().toString());
    }

    /**
     * Open a capture from a stream; the reader closes the stream.
     */
    public CaptureReader parse(InputStream in, String captureName) {
        JsonParser parser;
        try {
            parser = objectMapper.createParser(in);
        } catch (IOException e) {
            closeQuietly(in);
            throw new MalformedCaptureException(captureName + ": " + e.getMessage(), e);
        }
        log.debug("Opened capture {}", captureName);
        return new CaptureReader(captureName, parser, entryMapper);
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close capture stream: {}", e.getMessage());
        }
    }
}
