package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Cross-place tables for the whole run.
 */
@Value
@Builder
public class InsightSummary {
    int placeCount;
    int reviewCount;
    Double averageRating;
    int uniqueAuthors;

    Map<SentimentLabel, Integer> sentimentDistribution;
    Map<Integer, Integer> ratingDistribution;
    List<NegativePlaceCount> topNegativePlaces;

    SortedMap<LocalDate, Integer> dailyReviewVolume;
    SortedMap<Integer, Integer> hourlyReviewVolume;
    Map<ReviewIssue, Integer> issueCounts;
}
