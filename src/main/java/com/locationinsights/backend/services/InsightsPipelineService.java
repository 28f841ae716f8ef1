package com.locationinsights.backend.services;

import com.locationinsights.backend.config.InsightsProperties;
import com.locationinsights.backend.dto.RunRequest;
import com.locationinsights.backend.exceptions.InvalidRunRequestException;
import com.locationinsights.backend.exceptions.ProviderUnavailableException;
import com.locationinsights.backend.models.InsightsRunResult;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.models.PlaceReviews;
import com.locationinsights.backend.models.ResolvedAddress;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.SearchQuery;
import com.locationinsights.backend.models.SearchStrategy;
import com.locationinsights.backend.models.WarningCode;
import com.locationinsights.backend.services.discovery.Deduplicator;
import com.locationinsights.backend.services.discovery.DiscoveryStrategy;
import com.locationinsights.backend.services.discovery.RadiusFilter;
import com.locationinsights.backend.services.sentiment.ReviewIssueDetector;
import com.locationinsights.backend.services.sentiment.SentimentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one insights request end to end:
 * resolve center, discover, deduplicate, enforce radius, collect reviews, label, aggregate.
 */
@Service
@Slf4j
public class InsightsPipelineService {

    private final AddressResolverService addressResolver;
    private final Map<SearchStrategy, DiscoveryStrategy> strategies;
    private final Deduplicator deduplicator;
    private final RadiusFilter radiusFilter;
    private final ReviewCollectorService reviewCollector;
    private final SentimentClassifier sentimentClassifier;
    private final ReviewIssueDetector issueDetector;
    private final AggregationService aggregationService;
    private final InsightsProperties properties;
    private final Clock clock;

    public InsightsPipelineService(AddressResolverService addressResolver,
                                   List<DiscoveryStrategy> discoveryStrategies,
                                   Deduplicator deduplicator,
                                   RadiusFilter radiusFilter,
                                   ReviewCollectorService reviewCollector,
                                   SentimentClassifier sentimentClassifier,
                                   ReviewIssueDetector issueDetector,
                                   AggregationService aggregationService,
                                   InsightsProperties properties,
                                   Clock clock) {
        this.addressResolver = addressResolver;
        this.strategies = new EnumMap<>(SearchStrategy.class);
        for (DiscoveryStrategy strategy : discoveryStrategies) {
            this.strategies.put(strategy.getStrategy(), strategy);
        }
        this.deduplicator = deduplicator;
        this.radiusFilter = radiusFilter;
        this.reviewCollector = reviewCollector;
        this.sentimentClassifier = sentimentClassifier;
        this.issueDetector = issueDetector;
        this.aggregationService = aggregationService;
        this.properties = properties;
        this.clock = clock;
    }

    public InsightsRunResult run(RunRequest request) {
        return run(request, new RunContext(clock, properties.getRunMaxDuration()));
    }

    public InsightsRunResult run(RunRequest request, RunContext context) {
        if (request.getStrategy() == SearchStrategy.BRAND_SEARCH
                && (request.getKeyword() == null || request.getKeyword().isBlank())) {
            throw new InvalidRunRequestException("Keyword is required for brand search");
        }
        if (request.getRadiusMiles() == null) {
            throw new InvalidRunRequestException("Radius is required");
        }
        DiscoveryStrategy strategy = strategies.get(request.getStrategy());
        if (strategy == null) {
            throw new InvalidRunRequestException("Unsupported strategy: " + request.getStrategy());
        }

        ResolvedAddress resolved = addressResolver.resolve(request.getAddress(), request.getPlaceId());
        String label = resolved.getFormattedAddress() != null ? resolved.getFormattedAddress() : request.getAddress();
        SearchQuery query = new SearchQuery(resolved.getCenter(), request.getRadiusMiles(),
                request.getStrategy(), request.getKeyword(), label);

        log.info("Starting {} run at {} radius {} mi", query.strategy(), resolved.getCenter(), query.radiusMiles());

        if (query.radiusMiles() > properties.getLargeRadiusWarningMiles()) {
            context.warn(WarningCode.LARGE_RADIUS_PARTIAL_COVERAGE, null,
                    "Radius above " + properties.getLargeRadiusWarningMiles()
                            + " miles; provider results are ranked subsets and coverage may be partial");
        }

        int regions = strategy.regionCount(query);
        List<PlaceCandidate> candidates = strategy.discover(query, context);

        if (context.getDiscoverySuccesses() == 0 && context.getDiscoveryFailures() > 0 && !context.isQuotaExhausted()) {
            throw new ProviderUnavailableException(
                    "All " + context.getDiscoveryFailures() + " discovery requests failed", context.getDiscoveryFailures());
        }

        List<Place> unique = deduplicator.deduplicate(candidates);
        List<Place> inRadius = radiusFilter.filter(unique, query.center(), query.radiusMiles());

        if (inRadius.isEmpty()) {
            context.warn(WarningCode.NO_RESULTS_IN_RADIUS, null,
                    "No places found within " + query.radiusMiles() + " miles");
            return buildResult(resolved, query, regions, List.of(), List.of(), context);
        }

        List<PlaceReviews> collected = reviewCollector.collectAll(inRadius, context);
        List<Place> places = new ArrayList<>(collected.size());
        List<Review> reviews = new ArrayList<>();
        for (PlaceReviews placeReviews : collected) {
            places.add(placeReviews.getPlace());
            for (Review review : placeReviews.getReviews()) {
                reviews.add(review.labelled(
                        sentimentClassifier.classify(review.getRating(), review.getText()),
                        issueDetector.detect(review.getText())));
            }
        }

        InsightsRunResult result = buildResult(resolved, query, regions, places, reviews, context);
        log.info("Run finished: {} places, {} reviews, {} warnings",
                places.size(), reviews.size(), result.getWarnings().size());
        return result;
    }

    private InsightsRunResult buildResult(ResolvedAddress resolved, SearchQuery query, int regions,
                                          List<Place> places, List<Review> reviews, RunContext context) {
        return InsightsRunResult.builder()
                .resolvedAddress(resolved)
                .query(query)
                .tileCount(regions)
                .places(List.copyOf(places))
                .reviews(List.copyOf(reviews))
                .rows(aggregationService.aggregate(places, reviews))
                .summary(aggregationService.summarize(places, reviews))
                .warnings(context.getWarnings())
                .build();
    }
}
