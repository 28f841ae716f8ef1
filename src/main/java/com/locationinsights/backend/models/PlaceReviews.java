package com.locationinsights.backend.models;

import lombok.Value;

import java.util.List;

/**
 * Outcome of collecting one place: the enriched place, its reviews and how many retries it took.
 */
@Value
public class PlaceReviews {
    Place place;
    List<Review> reviews;
    int retryAttempts;

    public static PlaceReviews unavailable(Place place, int retryAttempts) {
        return new PlaceReviews(place.toBuilder().detailsAvailable(false).build(), List.of(), retryAttempts);
    }

    public boolean isDetailsAvailable() {
        return place.isDetailsAvailable();
    }
}
