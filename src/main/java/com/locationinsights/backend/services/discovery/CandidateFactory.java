package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.integrations.PlaceSummary;
import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.util.GeoMath;

import java.util.ArrayList;
import java.util.List;

final class CandidateFactory {

    private CandidateFactory() {
    }

    /**
     * Sightings without a coordinate cannot be checked against the radius and are dropped.
     */
    static List<PlaceCandidate> fromSummaries(List<PlaceSummary> summaries, GeoPoint center, String sourceTag) {
        List<PlaceCandidate> candidates = new ArrayList<>();
        for (PlaceSummary summary : summaries) {
            if (summary.getLocation() == null) {
                continue;
            }
            candidates.add(PlaceCandidate.builder()
                    .placeId(summary.getPlaceId())
                    .name(summary.getName())
                    .vicinity(summary.getVicinity())
                    .location(summary.getLocation())
                    .types(summary.getTypes())
                    .distanceMiles(GeoMath.haversineMiles(center, summary.getLocation()))
                    .sourceTag(sourceTag)
                    .build());
        }
        return candidates;
    }
}
