package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.models.PlaceCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses sightings to one place per provider id. First sighting wins and output keeps
 * first-seen order, so deduplicating an already unique list returns it unchanged.
 */
@Component
@Slf4j
public class Deduplicator {

    public List<Place> deduplicate(List<PlaceCandidate> candidates) {
        Map<String, Place> byId = new LinkedHashMap<>();
        int blank = 0;
        for (PlaceCandidate candidate : candidates) {
            String id = candidate.getPlaceId();
            if (id == null || id.isBlank()) {
                blank++;
                continue;
            }
            byId.putIfAbsent(id, Place.fromCandidate(candidate));
        }
        if (blank > 0) {
            log.debug("Dropped {} candidates without a place id", blank);
        }
        log.info("Deduplicated {} candidates into {} places", candidates.size(), byId.size());
        return new ArrayList<>(byId.values());
    }
}
