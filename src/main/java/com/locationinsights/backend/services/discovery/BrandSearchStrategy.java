package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.PlacesPage;
import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.models.SearchQuery;
import com.locationinsights.backend.models.SearchStrategy;
import com.locationinsights.backend.models.WarningCode;
import com.locationinsights.backend.services.RunContext;
import com.locationinsights.backend.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked text search for a brand or keyword around the center.
 * Cheap, but only as complete as the provider's relevance ranking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrandSearchStrategy implements DiscoveryStrategy {

    static final String UNIT = "brand-search";

    private final GooglePlacesClient placesClient;
    private final PaginatedSearchRunner paginatedSearchRunner;
    private final GooglePlacesProperties properties;

    @Override
    public SearchStrategy getStrategy() {
        return SearchStrategy.BRAND_SEARCH;
    }

    @Override
    public List<PlaceCandidate> discover(SearchQuery query, RunContext context) {
        if (!query.hasKeyword()) {
            throw new IllegalArgumentException("Brand search requires a keyword");
        }

        String text = buildQueryText(query);
        int radiusHint = (int) Math.min(
                Math.ceil(GeoMath.milesToMeters(query.radiusMiles())),
                properties.getMaxNearbyRadiusMeters());

        log.info("Brand search '{}' with radius hint {} m", text, radiusHint);

        List<PlacesPage> pages = paginatedSearchRunner.collectPages(
                UNIT,
                properties.getMaxPagesTextSearch(),
                token -> placesClient.textSearch(text, query.center(), radiusHint, token),
                context,
                WarningCode.PAGE_FAILED);

        List<PlaceCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            candidates.addAll(CandidateFactory.fromSummaries(
                    pages.get(i).getResults(), query.center(), "brand:page-" + (i + 1)));
        }

        log.info("Brand search returned {} candidates over {} pages", candidates.size(), pages.size());
        return candidates;
    }

    static String buildQueryText(SearchQuery query) {
        return query.locationLabel().isEmpty()
                ? query.keyword()
                : query.keyword() + " near " + query.locationLabel();
    }
}
