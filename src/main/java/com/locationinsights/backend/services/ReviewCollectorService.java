package com.locationinsights.backend.services;

import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.PlaceDetails;
import com.locationinsights.backend.integrations.PlacesProviderException;
import com.locationinsights.backend.integrations.ProviderQuotaExceededException;
import com.locationinsights.backend.integrations.ProviderResponse;
import com.locationinsights.backend.integrations.ProviderReview;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.models.PlaceReviews;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.WarningCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fetches place details and the reviews they carry.
 * A place whose details cannot be fetched is kept with zero reviews.
 */
@Service
@Slf4j
public class ReviewCollectorService {

    private final GooglePlacesClient placesClient;
    private final Executor executor;

    public ReviewCollectorService(GooglePlacesClient placesClient,
                                  @Qualifier("placesRequestExecutor") Executor executor) {
        this.placesClient = placesClient;
        this.executor = executor;
    }

    public PlaceReviews collect(Place place, RunContext context) {
        String unit = "place-" + place.getPlaceId();
        if (context.shouldStop(unit)) {
            return PlaceReviews.unavailable(place, 0);
        }

        ProviderResponse<PlaceDetails> response;
        try {
            response = placesClient.placeDetails(place.getPlaceId());
        } catch (ProviderQuotaExceededException e) {
            context.quotaExceeded(unit, e.getMessage());
            return PlaceReviews.unavailable(place, 0);
        } catch (PlacesProviderException e) {
            log.warn("Details unavailable for {} ({}): {}", place.getName(), place.getPlaceId(), e.getMessage());
            context.warn(WarningCode.PLACE_DETAILS_UNAVAILABLE, unit, e.getMessage());
            return PlaceReviews.unavailable(place, 0);
        }

        Place enriched = enrich(place, response.body());
        List<Review> reviews = new ArrayList<>();
        for (ProviderReview providerReview : response.body().getReviews()) {
            Review review = toReview(enriched, providerReview);
            if (review != null) {
                reviews.add(review);
            }
        }

        if (response.retryAttempts() > 0) {
            log.info("Details for {} succeeded after {} retries", place.getPlaceId(), response.retryAttempts());
        }
        return new PlaceReviews(enriched, List.copyOf(reviews), response.retryAttempts());
    }

    /**
     * Collect every place concurrently. Results come back in input order.
     */
    public List<PlaceReviews> collectAll(List<Place> places, RunContext context) {
        List<CompletableFuture<PlaceReviews>> futures = new ArrayList<>(places.size());
        for (Place place : places) {
            futures.add(CompletableFuture.supplyAsync(() -> collect(place, context), executor));
        }

        List<PlaceReviews> results = new ArrayList<>(places.size());
        for (int i = 0; i < futures.size(); i++) {
            Place place = places.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Collecting reviews for {} failed unexpectedly", place.getPlaceId(), cause);
                context.warn(WarningCode.PLACE_DETAILS_UNAVAILABLE, "place-" + place.getPlaceId(), cause.getMessage());
                results.add(PlaceReviews.unavailable(place, 0));
            }
        }

        int reviewCount = results.stream().mapToInt(r -> r.getReviews().size()).sum();
        log.info("Collected {} reviews for {} places", reviewCount, places.size());
        return results;
    }

    private Place enrich(Place place, PlaceDetails details) {
        Place.PlaceBuilder builder = place.toBuilder()
                .detailsAvailable(true)
                .city(details.getCity())
                .state(details.getState())
                .zip(details.getZip())
                .country(details.getCountry())
                .providerRating(details.getRating())
                .providerRatingCount(details.getUserRatingsTotal());

        if (details.getFormattedAddress() != null && !details.getFormattedAddress().isBlank()) {
            builder.address(details.getFormattedAddress());
        }
        if (place.getName() == null && details.getName() != null) {
            builder.name(details.getName());
        }
        // location and distanceMiles stay as radius-filtered; the details geometry may sit elsewhere
        return builder.build();
    }

    private Review toReview(Place place, ProviderReview source) {
        Integer rating = source.getRating();
        if (rating == null || rating < 1 || rating > 5 || source.getTime() == null) {
            log.debug("Skipping malformed review for {} by {}", place.getPlaceId(), source.getAuthorName());
            return null;
        }
        return Review.builder()
                .placeId(place.getPlaceId())
                .placeName(place.getName())
                .storeAddress(place.getAddress())
                .storeCity(place.getCity())
                .storeState(place.getState())
                .storeZip(place.getZip())
                .author(source.getAuthorName())
                .rating(rating)
                .text(source.getText() == null ? "" : source.getText())
                .time(Instant.ofEpochSecond(source.getTime()))
                .build();
    }
}
