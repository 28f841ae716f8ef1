package com.locationinsights.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Google Maps Platform settings: endpoints, per-call limits, pacing and retry policy.
 */
@Data
@ConfigurationProperties(prefix = "google.places")
public class GooglePlacesProperties {

    private String apiKey = "";

    private String geocodeUrl = "https://maps.googleapis.com/maps/api/geocode/json";
    private String nearbyUrl = "https://maps.googleapis.com/maps/api/place/nearbysearch/json";
    private String textSearchUrl = "https://maps.googleapis.com/maps/api/place/textsearch/json";
    private String detailsUrl = "https://maps.googleapis.com/maps/api/place/details/json";
    private String autocompleteUrl = "https://maps.googleapis.com/maps/api/place/autocomplete/json";

    private String detailsFields =
            "place_id,name,rating,user_ratings_total,reviews,formatted_address,address_component,geometry,types";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(20);

    // Nearby Search rejects radius above 50 km
    private int maxNearbyRadiusMeters = 50_000;
    private int tileRadiusMeters = 40_000;

    // Both searches expose at most 3 pages of 20 results
    private int maxPagesPerTile = 3;
    private int maxPagesTextSearch = 3;

    // A next_page_token is not valid until shortly after it is issued
    private Duration nextPageTokenWait = Duration.ofMillis(2200);

    private double requestsPerSecond = 6.0;

    // 0 disables the local budget
    private int dailyRequestBudget = 0;

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;

    private int concurrency = 4;
    private int queueCapacity = 200;

    public double getMaxTileRadiusMeters() {
        return Math.min(tileRadiusMeters, maxNearbyRadiusMeters);
    }
}
