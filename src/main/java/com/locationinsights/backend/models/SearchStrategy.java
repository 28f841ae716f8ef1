package com.locationinsights.backend.models;

public enum SearchStrategy {
    /** Ranked keyword text search around the center, no tiling. */
    BRAND_SEARCH,
    /** Tiled nearby search covering the whole circle. */
    GEO_COVERAGE
}
