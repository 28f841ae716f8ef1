package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One provider review, flattened with the owning store's address for BI grouping.
 * Created once per fetch and never updated; labelling returns a new instance.
 */
@Value
@Builder(toBuilder = true)
public class Review {
    String placeId;
    String placeName;

    String storeAddress;
    String storeCity;
    String storeState;
    String storeZip;

    String author;
    int rating; // 1-5
    String text;
    Instant time;

    SentimentLabel sentiment;
    @Builder.Default
    Set<ReviewIssue> issues = Set.of();

    public Review labelled(SentimentLabel label, Set<ReviewIssue> detectedIssues) {
        return toBuilder()
                .sentiment(label)
                .issues(detectedIssues == null || detectedIssues.isEmpty()
                        ? Set.of()
                        : Collections.unmodifiableSet(EnumSet.copyOf(detectedIssues)))
                .build();
    }

    public boolean hasIssue(ReviewIssue issue) {
        return issues != null && issues.contains(issue);
    }
}
