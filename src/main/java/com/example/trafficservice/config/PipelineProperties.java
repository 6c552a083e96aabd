package com.example.trafficservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for capture parsing, modelling and test synthesis.
 *
 * <h3>Configuration Example:</h3>
 * <pre>
 * pipeline:
 *   placeholder: id
 *   ignored-headers: content-length,host,connection,cookie
 *   output-directory: ./storage/reports
 *   max-capture-string-length: 2147483647
 *   retained-jobs: 100
 *   executor:
 *     core-pool-size: 2
 *     max-pool-size: 4
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    /**
     * Name used for variable path segments; the template reads {@code /users/{id}}.
     */
    private String placeholder = "id";

    /**
     * Headers left out of endpoint definitions (case-insensitive). HTTP/2 pseudo headers
     * ({@code :authority} etc.) are always dropped.
     */
    private List<String> ignoredHeaders = new ArrayList<>(List.of(
        "content-length", "host", "connection", "accept-encoding", "transfer-encoding", "date"));

    /**
     * Directory generated artifacts are written to. Empty disables writing.
     */
    private String outputDirectory;

    /**
     * Longest example value rendered into the documentation before it is cut.
     */
    private int maxDocumentedExampleLength = 2000;

    /**
     * Longest JSON string (typically a body) accepted in a capture file.
     */
    private int maxCaptureStringLength = Integer.MAX_VALUE;

    /**
     * Finished jobs kept for polling; the oldest are dropped beyond this.
     */
    private int retainedJobs = 100;

    /**
     * Pool running background capture jobs.
     */
    private Executor executor = new Executor();

    public boolean isOutputEnabled() {
        return outputDirectory != null && !outputDirectory.isBlank();
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
    }
}
