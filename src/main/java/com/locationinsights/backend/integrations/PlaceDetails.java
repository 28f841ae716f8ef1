package com.locationinsights.backend.integrations;

import com.locationinsights.backend.models.GeoPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Place Details payload. Google exposes only a handful of recent reviews per place.
 */
@Value
@Builder
public class PlaceDetails {
    String placeId;
    String name;
    String formattedAddress;
    String city;
    String state;
    String zip;
    String country;
    GeoPoint location;
    Double rating;
    Integer userRatingsTotal;
    @Builder.Default
    List<String> types = List.of();
    @Builder.Default
    List<ProviderReview> reviews = List.of();
}
