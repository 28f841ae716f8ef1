package com.locationinsights.backend.services;

import com.locationinsights.backend.config.InsightsProperties;
import com.locationinsights.backend.models.AnalyticRow;
import com.locationinsights.backend.models.InsightSummary;
import com.locationinsights.backend.models.NegativePlaceCount;
import com.locationinsights.backend.models.Place;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.ReviewIssue;
import com.locationinsights.backend.models.SentimentLabel;
import com.locationinsights.backend.services.sentiment.SentimentClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the per-place analytic rows and the cross-place summary tables.
 * Reviews whose place is not part of the place set are ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    private static final DateTimeFormatter MONTH_BUCKET = DateTimeFormatter.ofPattern("yyyy-MM");

    private final InsightsProperties properties;
    private final SentimentClassifier sentimentClassifier;

    /**
     * One row per place, in place order. Places without reviews get an all-zero row.
     */
    public List<AnalyticRow> aggregate(List<Place> places, List<Review> reviews) {
        Map<String, List<Review>> byPlace = groupByPlace(places, reviews);

        List<AnalyticRow> rows = new ArrayList<>(places.size());
        for (Place place : places) {
            rows.add(buildRow(place, byPlace.getOrDefault(place.getPlaceId(), List.of())));
        }

        long flagged = rows.stream().filter(AnalyticRow::isHighNegative).count();
        log.info("Aggregated {} places; {} flagged high-negative", rows.size(), flagged);
        return rows;
    }

    public InsightSummary summarize(List<Place> places, List<Review> reviews) {
        Map<String, List<Review>> byPlace = groupByPlace(places, reviews);
        List<Review> inScope = byPlace.values().stream().flatMap(List::stream).toList();

        Map<SentimentLabel, Integer> sentiment = new EnumMap<>(SentimentLabel.class);
        for (SentimentLabel label : SentimentLabel.values()) {
            sentiment.put(label, 0);
        }
        Map<Integer, Integer> ratings = emptyHistogram();
        Map<ReviewIssue, Integer> issues = new EnumMap<>(ReviewIssue.class);
        for (ReviewIssue issue : ReviewIssue.values()) {
            issues.put(issue, 0);
        }
        SortedMap<LocalDate, Integer> daily = new TreeMap<>();
        SortedMap<Integer, Integer> hourly = new TreeMap<>();
        for (int hour = 0; hour < 24; hour++) {
            hourly.put(hour, 0);
        }
        Set<String> authors = new HashSet<>();
        long ratingSum = 0;

        for (Review review : inScope) {
            sentiment.merge(labelOf(review), 1, Integer::sum);
            ratings.merge(review.getRating(), 1, Integer::sum);
            ratingSum += review.getRating();
            for (ReviewIssue issue : review.getIssues()) {
                issues.merge(issue, 1, Integer::sum);
            }
            if (review.getTime() != null) {
                ZonedDateTime utc = review.getTime().atZone(ZoneOffset.UTC);
                daily.merge(utc.toLocalDate(), 1, Integer::sum);
                hourly.merge(utc.getHour(), 1, Integer::sum);
            }
            if (review.getAuthor() != null && !review.getAuthor().isBlank()) {
                authors.add(review.getAuthor());
            }
        }

        List<NegativePlaceCount> topNegative = new ArrayList<>();
        for (Place place : places) {
            int negatives = (int) byPlace.getOrDefault(place.getPlaceId(), List.of()).stream()
                    .filter(r -> labelOf(r) == SentimentLabel.NEGATIVE)
                    .count();
            if (negatives > 0) {
                topNegative.add(new NegativePlaceCount(place.getPlaceId(), place.getName(), negatives));
            }
        }
        // stable sort keeps place order among ties
        topNegative.sort(Comparator.comparingInt(NegativePlaceCount::negativeReviews).reversed());

        return InsightSummary.builder()
                .placeCount(places.size())
                .reviewCount(inScope.size())
                .averageRating(inScope.isEmpty() ? null : (double) ratingSum / inScope.size())
                .uniqueAuthors(authors.size())
                .sentimentDistribution(sentiment)
                .ratingDistribution(ratings)
                .topNegativePlaces(List.copyOf(topNegative.subList(
                        0, Math.min(topNegative.size(), properties.getTopNegativePlacesLimit()))))
                .dailyReviewVolume(daily)
                .hourlyReviewVolume(hourly)
                .issueCounts(issues)
                .build();
    }

    private AnalyticRow buildRow(Place place, List<Review> reviews) {
        Map<Integer, Integer> histogram = emptyHistogram();
        SortedMap<String, Integer> monthly = new TreeMap<>();
        int positive = 0;
        int neutral = 0;
        int negative = 0;
        long ratingSum = 0;

        for (Review review : reviews) {
            histogram.merge(review.getRating(), 1, Integer::sum);
            ratingSum += review.getRating();
            switch (labelOf(review)) {
                case POSITIVE -> positive++;
                case NEUTRAL -> neutral++;
                case NEGATIVE -> negative++;
            }
            if (review.getTime() != null) {
                monthly.merge(MONTH_BUCKET.format(review.getTime().atZone(ZoneOffset.UTC)), 1, Integer::sum);
            }
        }

        int count = reviews.size();
        double negativeShare = count == 0 ? 0.0 : (double) negative / count;
        boolean flagged = count >= properties.getMinReviewCountForFlag()
                && negativeShare >= properties.getHighNegativeThreshold();

        return AnalyticRow.builder()
                .placeId(place.getPlaceId())
                .name(place.getName())
                .address(place.getAddress())
                .latitude(place.getLocation() == null ? null : place.getLocation().latitude())
                .longitude(place.getLocation() == null ? null : place.getLocation().longitude())
                .distanceMiles(place.getDistanceMiles())
                .reviewCount(count)
                .ratingHistogram(histogram)
                .meanRating(count == 0 ? null : (double) ratingSum / count)
                .positiveCount(positive)
                .neutralCount(neutral)
                .negativeCount(negative)
                .negativeShare(negativeShare)
                .monthlyReviewCounts(monthly)
                .highNegative(flagged)
                .detailsAvailable(place.isDetailsAvailable())
                .build();
    }

    private SentimentLabel labelOf(Review review) {
        return review.getSentiment() != null
                ? review.getSentiment()
                : sentimentClassifier.classify(review.getRating(), review.getText());
    }

    private static Map<String, List<Review>> groupByPlace(List<Place> places, List<Review> reviews) {
        Map<String, List<Review>> byPlace = new LinkedHashMap<>();
        for (Place place : places) {
            byPlace.putIfAbsent(place.getPlaceId(), new ArrayList<>());
        }
        int ignored = 0;
        for (Review review : reviews) {
            List<Review> bucket = byPlace.get(review.getPlaceId());
            if (bucket == null) {
                ignored++;
            } else {
                bucket.add(review);
            }
        }
        if (ignored > 0) {
            log.debug("Ignored {} reviews for places outside the place set", ignored);
        }
        return byPlace;
    }

    private static Map<Integer, Integer> emptyHistogram() {
        Map<Integer, Integer> histogram = new TreeMap<>();
        for (int star = 1; star <= 5; star++) {
            histogram.put(star, 0);
        }
        return histogram;
    }
}
