package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class InsightsRunResult {
    ResolvedAddress resolvedAddress;
    SearchQuery query;
    int tileCount;
    List<Place> places;
    List<Review> reviews;
    List<AnalyticRow> rows;
    InsightSummary summary;
    List<RunWarning> warnings;

    /**
     * False when any warning means results may be incomplete.
     */
    public boolean isCoverageComplete() {
        return warnings.stream().noneMatch(w -> w.getCode().isIncompleteResults());
    }
}
