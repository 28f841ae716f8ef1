package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Canonical place after deduplication, optionally enriched with place details.
 */
@Value
@Builder(toBuilder = true)
public class Place {
    String placeId;
    String name;
    String address;
    GeoPoint location;
    @Builder.Default
    List<String> types = List.of();
    double distanceMiles;
    String sourceTag;

    // Filled from place details
    String city;
    String state;
    String zip;
    String country;
    Double providerRating;
    Integer providerRatingCount;
    boolean detailsAvailable;

    public static Place fromCandidate(PlaceCandidate candidate) {
        return Place.builder()
                .placeId(candidate.getPlaceId())
                .name(candidate.getName())
                .address(candidate.getVicinity())
                .location(candidate.getLocation())
                .types(candidate.getTypes())
                .distanceMiles(candidate.getDistanceMiles())
                .sourceTag(candidate.getSourceTag())
                .build();
    }

    public PlaceCandidate asCandidate() {
        return PlaceCandidate.builder()
                .placeId(placeId)
                .name(name)
                .vicinity(address)
                .location(location)
                .types(types)
                .distanceMiles(distanceMiles)
                .sourceTag(sourceTag)
                .build();
    }

    public String getCategory() {
        return types == null || types.isEmpty() ? null : types.get(0);
    }

    public Place withDistanceMiles(double miles) {
        return toBuilder().distanceMiles(miles).build();
    }
}
