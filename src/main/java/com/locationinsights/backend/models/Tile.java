package com.locationinsights.backend.models;

/**
 * Circular query region issued as one nearby search.
 */
public record Tile(int index, GeoPoint center, double radiusMiles) {

    public String label() {
        return "tile-" + index;
    }
}
