package com.locationinsights.backend.integrations;

import com.locationinsights.backend.models.GeoPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of a text or nearby search page.
 */
@Value
@Builder
public class PlaceSummary {
    String placeId;
    String name;
    String vicinity;
    GeoPoint location; // null when the provider omitted geometry
    @Builder.Default
    List<String> types = List.of();
}
