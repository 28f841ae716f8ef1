package com.locationinsights.backend.models;

public record NegativePlaceCount(String placeId, String name, int negativeReviews) {
}
