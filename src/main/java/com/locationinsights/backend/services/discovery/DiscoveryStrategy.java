package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.models.SearchQuery;
import com.locationinsights.backend.models.SearchStrategy;
import com.locationinsights.backend.services.RunContext;

import java.util.List;

/**
 * Produces raw place sightings for a query. Implementations may return places outside the
 * requested radius; the radius filter downstream is the only authority on scope.
 */
public interface DiscoveryStrategy {

    /**
     * Strategy selector this implementation serves
     */
    SearchStrategy getStrategy();

    /**
     * Discover candidates. Per-page and per-tile failures become warnings on {@code context};
     * they never abort the call.
     */
    List<PlaceCandidate> discover(SearchQuery query, RunContext context);

    /**
     * Number of independent search regions the query is split into.
     */
    default int regionCount(SearchQuery query) {
        return 1;
    }
}
