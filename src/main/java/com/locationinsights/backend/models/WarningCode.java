package com.locationinsights.backend.models;

public enum WarningCode {
    TILE_FAILED(true),
    PAGE_FAILED(true),
    PLACE_DETAILS_UNAVAILABLE(true),
    QUOTA_EXCEEDED(true),
    RUN_CANCELLED(true),
    NO_RESULTS_IN_RADIUS(false),
    LARGE_RADIUS_PARTIAL_COVERAGE(false);

    private final boolean incompleteResults;

    WarningCode(boolean incompleteResults) {
        this.incompleteResults = incompleteResults;
    }

    /**
     * Whether a warning of this kind means some data could not be collected.
     */
    public boolean isIncompleteResults() {
        return incompleteResults;
    }
}
