package com.example.trafficservice.model;

/**
 * Completeness of a capture analysis.
 */
public enum AnalysisStatus {

    /**
     * Every entry was parsed and no field needed widening.
     */
    COMPLETE("Capture analysed completely"),

    /**
     * The catalogue is usable but entries were skipped or schemas widened; see the diagnostics.
     */
    PARTIAL("Capture analysed with warnings");

    private final String description;

    AnalysisStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("%s: %s", name(), description);
    }
}
