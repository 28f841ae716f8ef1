package com.locationinsights.backend.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw sighting of a place as returned by one search page.
 * The same place may be seen many times across pages, tiles and strategies.
 */
@Value
@Builder(toBuilder = true)
public class PlaceCandidate {
    String placeId;
    String name;
    String vicinity;
    GeoPoint location;
    @Builder.Default
    List<String> types = List.of();
    double distanceMiles;
    String sourceTag;
}
