package com.autosort.models;

/**
 * Status tag returned with every resolved path.
 */
public enum ResolutionStatus {
    /** Single oracle pass. */
    RESOLVED("AI suggested"),
    /** Suggest and refine passes both answered. */
    REFINED("AI suggested -> Refined"),
    /** Pin rule forced the destination. */
    PINNED("Pinned"),
    CACHED("Cached"),
    /** Oracle unreachable after retries; path is the guarded sentinel. */
    FAILED("Failed"),
    CANCELLED("Cancelled");

    private final String label;

    ResolutionStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
