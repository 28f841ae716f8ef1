package com.locationinsights.backend.models;

/**
 * One discovery request: circle plus strategy selector.
 *
 * @param center       circle center
 * @param radiusMiles  circle radius, strictly positive
 * @param strategy     which discovery strategy runs
 * @param keyword      brand or category keyword, may be blank for geo coverage
 * @param locationLabel human readable center, used to phrase brand text queries
 */
public record SearchQuery(GeoPoint center, double radiusMiles, SearchStrategy strategy,
                          String keyword, String locationLabel) {

    public SearchQuery {
        if (center == null) {
            throw new IllegalArgumentException("Search center is required");
        }
        if (!(radiusMiles > 0.0) || Double.isInfinite(radiusMiles)) {
            throw new IllegalArgumentException("Radius must be a positive number of miles: " + radiusMiles);
        }
        if (strategy == null) {
            throw new IllegalArgumentException("Search strategy is required");
        }
        keyword = keyword == null ? "" : keyword.trim();
        locationLabel = locationLabel == null ? "" : locationLabel.trim();
    }

    public boolean hasKeyword() {
        return !keyword.isEmpty();
    }
}
