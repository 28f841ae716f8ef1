package com.locationinsights.backend.services.sentiment;

import com.locationinsights.backend.models.SentimentLabel;

/**
 * Labels a review. Implementations must be pure: the same rating and text always give the same label.
 */
public interface SentimentClassifier {

    SentimentLabel classify(int rating, String text);
}
