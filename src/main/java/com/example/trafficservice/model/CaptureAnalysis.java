package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of running one capture file through parse, rule evaluation and model building.
 *
 * <p>A result with warnings is never presented as complete: {@link #status} is
 * {@link AnalysisStatus#PARTIAL} whenever {@link #diagnostics} is not empty.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptureAnalysis {

    private String captureName;

    private AnalysisStatus status;

    @Builder.Default
    private List<ApiDefinition> apis = new ArrayList<>();

    /**
     * Skipped entries and widened schemas.
     */
    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();

    private int totalEntries;

    private int skippedEntries;

    private int excludedExchanges;

    private int includedExchanges;

    /**
     * Version of the rule snapshot the exchanges were evaluated against.
     */
    private long ruleSnapshotVersion;

    private Long processingTimeMs;

    @JsonIgnore
    public boolean isPartial() {
        return status == AnalysisStatus.PARTIAL;
    }

    @JsonIgnore
    public ApiCatalogue toCatalogue() {
        return new ApiCatalogue(new ArrayList<>(apis), new ArrayList<>(diagnostics));
    }

    /**
     * Assemble a result, flagging it partial when any diagnostic is present.
     */
    public static CaptureAnalysis of(String captureName,
                                     ApiCatalogue catalogue,
                                     List<Diagnostic> parseDiagnostics,
                                     Counts counts,
                                     long ruleSnapshotVersion,
                                     long processingTimeMs) {
        List<Diagnostic> diagnostics = new ArrayList<>(parseDiagnostics);
        diagnostics.addAll(catalogue.getDiagnostics());
        return CaptureAnalysis.builder()
            .captureName(captureName)
            .status(diagnostics.isEmpty() ? AnalysisStatus.COMPLETE : AnalysisStatus.PARTIAL)
            .apis(new ArrayList<>(catalogue.getApis()))
            .diagnostics(diagnostics)
            .totalEntries(counts.getTotal())
            .skippedEntries(counts.getSkipped())
            .excludedExchanges(counts.getExcluded())
            .includedExchanges(counts.getIncluded())
            .ruleSnapshotVersion(ruleSnapshotVersion)
            .processingTimeMs(processingTimeMs)
            .build();
    }

    /**
     * Entry counters of one run.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counts {
        private int total;
        private int skipped;
        private int excluded;
        private int included;
    }
}
