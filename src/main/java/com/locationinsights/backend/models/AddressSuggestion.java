package com.locationinsights.backend.models;

public record AddressSuggestion(String description, String placeId) {
}
