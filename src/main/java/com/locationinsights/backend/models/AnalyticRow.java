package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.SortedMap;

/**
 * Per-place aggregate: rating histogram, sentiment counts, monthly trend and the high-negative flag.
 */
@Value
@Builder
public class AnalyticRow {
    String placeId;
    String name;
    String address;
    Double latitude;
    Double longitude;
    double distanceMiles;

    int reviewCount;
    /** Keys 1..5, always present. */
    Map<Integer, Integer> ratingHistogram;
    /** Null when the place has no reviews. */
    Double meanRating;

    int positiveCount;
    int neutralCount;
    int negativeCount;
    double negativeShare;

    /** Review counts keyed by UTC month, {@code yyyy-MM}. */
    SortedMap<String, Integer> monthlyReviewCounts;

    boolean highNegative;
    boolean detailsAvailable;
}
