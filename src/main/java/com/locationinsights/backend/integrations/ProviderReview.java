package com.locationinsights.backend.integrations;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderReview {
    String authorName;
    Integer rating; // 1-5
    String text;
    Long time; // epoch seconds
    String relativeTimeDescription;
}
