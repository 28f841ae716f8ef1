package com.locationinsights.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "insights")
public class InsightsProperties {

    /** Negative share at or above which a place is flagged. */
    private double highNegativeThreshold = 0.30;

    /** Places with fewer reviews are never flagged. */
    private int minReviewCountForFlag = 3;

    /** Fraction by which adjacent tile disks overlap. */
    private double tileOverlap = 0.15;

    private Duration runMaxDuration = Duration.ofMinutes(5);

    private double largeRadiusWarningMiles = 25.0;

    private int topNegativePlacesLimit = 10;
}
