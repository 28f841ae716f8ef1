package com.locationinsights.backend.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.config.InsightsProperties;
import com.locationinsights.backend.dto.RunRequest;
import com.locationinsights.backend.exceptions.GeocodeFailureException;
import com.locationinsights.backend.exceptions.InvalidRunRequestException;
import com.locationinsights.backend.exceptions.ProviderUnavailableException;
import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.ProviderRequestGate;
import com.locationinsights.backend.models.AnalyticRow;
import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.InsightsRunResult;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.models.PlaceReviews;
import com.locationinsights.backend.models.ResolvedAddress;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.ReviewIssue;
import com.locationinsights.backend.models.SearchQuery;
import com.locationinsights.backend.models.SearchStrategy;
import com.locationinsights.backend.models.SentimentLabel;
import com.locationinsights.backend.models.WarningCode;
import com.locationinsights.backend.services.discovery.Deduplicator;
import com.locationinsights.backend.services.discovery.DiscoveryStrategy;
import com.locationinsights.backend.services.discovery.RadiusFilter;
import com.locationinsights.backend.services.sentiment.RatingLexiconSentimentClassifier;
import com.locationinsights.backend.services.sentiment.ReviewIssueDetector;
import com.locationinsights.backend.util.GeoMath;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InsightsPipelineServiceTest {

    private static final GeoPoint CENTER = GeoPoint.of(40.0, -74.0);

    @Mock
    private AddressResolverService addressResolver;

    @Mock
    private DiscoveryStrategy geoCoverage;

    @Mock
    private DiscoveryStrategy brandSearch;

    @Mock
    private ReviewCollectorService reviewCollector;

    @Mock
    private RestTemplate restTemplate;

    private InsightsPipelineService pipeline;

    @BeforeEach
    void setUp() {
        when(geoCoverage.getStrategy()).thenReturn(SearchStrategy.GEO_COVERAGE);
        when(brandSearch.getStrategy()).thenReturn(SearchStrategy.BRAND_SEARCH);
        when(geoCoverage.regionCount(any())).thenReturn(7);
        when(brandSearch.regionCount(any())).thenReturn(1);
        when(addressResolver.resolve(anyString(), any())).thenReturn(ResolvedAddress.builder()
                .center(CENTER)
                .formattedAddress("Somewhere, NJ, USA")
                .build());

        InsightsProperties properties = new InsightsProperties();
        RatingLexiconSentimentClassifier classifier = new RatingLexiconSentimentClassifier();
        pipeline = new InsightsPipelineService(
                addressResolver,
                List.of(geoCoverage, brandSearch),
                new Deduplicator(),
                new RadiusFilter(),
                reviewCollector,
                classifier,
                new ReviewIssueDetector(),
                new AggregationService(properties, classifier),
                properties,
                Clock.systemUTC());
    }

    @Test
    void testFullRun_DedupFilterCollectLabelAggregate() {
        // Given: P1 seen twice, FAR outside the 5 mile radius
        when(geoCoverage.discover(any(), any())).thenAnswer(inv -> {
            RunContext ctx = inv.getArgument(1);
            ctx.recordDiscoverySuccess();
            return List.of(
                    candidate("P1", 2.0, "tile-0:page-1"),
                    candidate("FAR", 9.0, "tile-1:page-1"),
                    candidate("P1", 2.0, "tile-1:page-1"),
                    candidate("P2", 4.0, "tile-2:page-1"));
        });
        when(reviewCollector.collectAll(anyList(), any())).thenAnswer(inv -> {
            List<Place> places = inv.getArgument(0);
            return places.stream()
                    .map(p -> new PlaceReviews(p.toBuilder().detailsAvailable(true).build(),
                            p.getPlaceId().equals("P1")
                                    ? List.of(review("P1", 1, "Food was cold and the staff rude"),
                                              review("P1", 5, "Great"))
                                    : List.of(),
                            0))
                    .toList();
        });

        // When
        InsightsRunResult result = pipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null));

        // Then
        assertEquals(List.of("P1", "P2"), result.getPlaces().stream().map(Place::getPlaceId).toList());
        assertEquals(7, result.getTileCount());
        assertEquals(2, result.getReviews().size());
        Review negative = result.getReviews().get(0);
        assertEquals(SentimentLabel.NEGATIVE, negative.getSentiment());
        assertTrue(negative.hasIssue(ReviewIssue.FOOD));
        assertTrue(negative.hasIssue(ReviewIssue.SERVICE));
        assertEquals(SentimentLabel.POSITIVE, result.getReviews().get(1).getSentiment());

        assertEquals(2, result.getRows().size());
        assertEquals(2, result.getRows().get(0).getReviewCount());
        assertEquals(0, result.getRows().get(1).getReviewCount());
        assertNull(result.getRows().get(1).getMeanRating());
        assertEquals(2, result.getSummary().getReviewCount());
        assertTrue(result.getWarnings().isEmpty());
        assertTrue(result.isCoverageComplete());

        for (Place place : result.getPlaces()) {
            assertTrue(GeoMath.haversineMiles(CENTER, place.getLocation()) <= 5.0);
        }
        verify(brandSearch, never()).discover(any(), any());
    }

    @Test
    void testBrandSearch_QueryCarriesKeywordAndLabel() {
        when(brandSearch.discover(any(), any())).thenAnswer(inv -> {
            SearchQuery query = inv.getArgument(0);
            assertEquals("Starbucks", query.keyword());
            assertEquals("Somewhere, NJ, USA", query.locationLabel());
            ((RunContext) inv.getArgument(1)).recordDiscoverySuccess();
            return List.of();
        });

        InsightsRunResult result = pipeline.run(request(SearchStrategy.BRAND_SEARCH, 5.0, "Starbucks"));

        assertEquals(1, result.getTileCount());
        verify(brandSearch).discover(any(), any());
    }

    @Test
    void testNoResultsInRadius_InformationalWarning() {
        when(geoCoverage.discover(any(), any())).thenAnswer(inv -> {
            ((RunContext) inv.getArgument(1)).recordDiscoverySuccess();
            return List.of(candidate("FAR", 20.0, "tile-0:page-1"));
        });

        InsightsRunResult result = pipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null));

        assertTrue(result.getPlaces().isEmpty());
        assertTrue(result.getRows().isEmpty());
        assertEquals(WarningCode.NO_RESULTS_IN_RADIUS, result.getWarnings().get(0).getCode());
        assertTrue(result.isCoverageComplete());
        verifyNoInteractions(reviewCollector);
    }

    @Test
    void testEveryDiscoveryRequestFailed_ProviderUnavailable() {
        when(geoCoverage.discover(any(), any())).thenAnswer(inv -> {
            RunContext ctx = inv.getArgument(1);
            ctx.recordDiscoveryFailure();
            ctx.recordDiscoveryFailure();
            return List.of();
        });

        ProviderUnavailableException ex = assertThrows(ProviderUnavailableException.class,
                () -> pipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null)));

        assertEquals(2, ex.getFailedUnits());
    }

    @Test
    void testQuotaExhaustedBeforeAnySuccess_PartialResultNotFatal() {
        when(geoCoverage.discover(any(), any())).thenAnswer(inv -> {
            RunContext ctx = inv.getArgument(1);
            ctx.recordDiscoveryFailure();
            ctx.quotaExceeded("tile-1/page-1", "OVER_QUERY_LIMIT");
            return List.of();
        });

        InsightsRunResult result = pipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null));

        assertFalse(result.isCoverageComplete());
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.getCode() == WarningCode.QUOTA_EXCEEDED));
    }

    @Test
    void testLargeRadiusWarning() {
        when(geoCoverage.discover(any(), any())).thenReturn(List.of());

        InsightsRunResult result = pipeline.run(request(SearchStrategy.GEO_COVERAGE, 30.0, null));

        assertEquals(WarningCode.LARGE_RADIUS_PARTIAL_COVERAGE, result.getWarnings().get(0).getCode());
    }

    @Test
    void testGeocodeFailure_NoDiscovery() {
        when(addressResolver.resolve(anyString(), any()))
                .thenThrow(new GeocodeFailureException("nowhere", "ZERO_RESULTS", "no match"));

        assertThrows(GeocodeFailureException.class,
                () -> pipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null)));
        verify(geoCoverage, never()).discover(any(), any());
    }

    @Test
    void testDetailsGeometryElsewhere_PlaceStaysWithinRadius() {
        // Given: discovery puts P1 0.69 mi north, details geometry is about 20 mi north
        when(geoCoverage.discover(any(), any())).thenAnswer(inv -> {
            RunContext ctx = inv.getArgument(1);
            ctx.recordDiscoverySuccess();
            return List.of(candidate("P1", 0.69, "tile-0:page-1"));
        });
        when(restTemplate.getForEntity(any(URI.class), eq(String.class))).thenReturn(ResponseEntity.ok("""
                {"status":"OK","result":{
                  "place_id":"P1","name":"Store P1","formatted_address":"P1 Main St, Somewhere, NJ",
                  "geometry":{"location":{"lat":40.3,"lng":-74.0}},
                  "reviews":[{"author_name":"Ann","rating":4,"text":"Fine","time":1714564800}]}}
                """));
        InsightsPipelineService realCollectorPipeline = pipelineWithCollector(realCollector());

        // When
        InsightsRunResult result = realCollectorPipeline.run(request(SearchStrategy.GEO_COVERAGE, 5.0, null));

        // Then
        assertEquals(1, result.getPlaces().size());
        Place place = result.getPlaces().get(0);
        assertTrue(place.isDetailsAvailable());
        double actual = GeoMath.haversineMiles(CENTER, place.getLocation());
        assertTrue(actual <= 5.0, "place is " + actual + " mi from center");
        assertEquals(actual, place.getDistanceMiles(), 1e-6);

        AnalyticRow row = result.getRows().get(0);
        GeoPoint rowPoint = GeoPoint.of(row.getLatitude(), row.getLongitude());
        assertEquals(row.getDistanceMiles(), GeoMath.haversineMiles(CENTER, rowPoint), 1e-6);
        assertEquals(1, row.getReviewCount());
    }

    @Test
    void testBrandSearchWithoutKeyword_Rejected() {
        assertThrows(InvalidRunRequestException.class,
                () -> pipeline.run(request(SearchStrategy.BRAND_SEARCH, 5.0, " ")));
        verifyNoInteractions(addressResolver);
    }

    private ReviewCollectorService realCollector() {
        GooglePlacesProperties placesProperties = new GooglePlacesProperties();
        placesProperties.setRequestsPerSecond(1000.0);
        placesProperties.setInitialBackoff(Duration.ofMillis(1));
        ProviderRequestGate gate = new ProviderRequestGate(placesProperties, new SimpleMeterRegistry(), Clock.systemUTC());
        GooglePlacesClient client = new GooglePlacesClient(restTemplate, new ObjectMapper(), placesProperties, gate);
        return new ReviewCollectorService(client, Runnable::run);
    }

    private InsightsPipelineService pipelineWithCollector(ReviewCollectorService collector) {
        InsightsProperties properties = new InsightsProperties();
        RatingLexiconSentimentClassifier classifier = new RatingLexiconSentimentClassifier();
        return new InsightsPipelineService(
                addressResolver,
                List.of(geoCoverage, brandSearch),
                new Deduplicator(),
                new RadiusFilter(),
                collector,
                classifier,
                new ReviewIssueDetector(),
                new AggregationService(properties, classifier),
                properties,
                Clock.systemUTC());
    }

    private static RunRequest request(SearchStrategy strategy, double radius, String keyword) {
        return RunRequest.builder()
                .address("Somewhere")
                .radiusMiles(radius)
                .strategy(strategy)
                .keyword(keyword)
                .build();
    }

    private static PlaceCandidate candidate(String id, double milesNorth, String tag) {
        GeoPoint location = GeoMath.destination(CENTER, 0.0, GeoMath.milesToMeters(milesNorth));
        return PlaceCandidate.builder()
                .placeId(id)
                .name("Store " + id)
                .vicinity(id + " Main St")
                .location(location)
                .distanceMiles(milesNorth)
                .sourceTag(tag)
                .build();
    }

    private static Review review(String placeId, int rating, String text) {
        return Review.builder()
                .placeId(placeId)
                .placeName("Store " + placeId)
                .author("someone")
                .rating(rating)
                .text(text)
                .time(Instant.parse("2024-06-01T12:00:00Z"))
                .build();
    }
}
