package com.locationinsights.backend.services;

import com.locationinsights.backend.models.AnalyticRow;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.ReviewIssue;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Flat CSV tables for BI tools. One row per place or per review, UTC date parts split out.
 */
@Service
@Slf4j
public class CsvExportService {

    static final String[] PLACE_HEADERS = {
            "place_id", "name", "address", "lat", "lon", "distance_miles",
            "review_count", "mean_rating", "positive_count", "neutral_count",
            "negative_count", "high_negative_flag"
    };

    static final String[] REVIEW_HEADERS = {
            "place_id", "place_name", "store_address", "store_city", "store_state", "store_zip",
            "author", "rating", "comment", "review_time_unix", "date_utc", "hour_utc", "sentiment",
            ReviewIssue.FOOD.getColumnName(), ReviewIssue.SERVICE.getColumnName(),
            ReviewIssue.CLEANLINESS.getColumnName(), ReviewIssue.PRICE.getColumnName()
    };

    public String exportPlaces(List<AnalyticRow> rows) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(PLACE_HEADERS);
            for (AnalyticRow row : rows) {
                writer.writeNext(new String[]{
                        row.getPlaceId(),
                        nullToEmpty(row.getName()),
                        nullToEmpty(row.getAddress()),
                        row.getLatitude() == null ? "" : row.getLatitude().toString(),
                        row.getLongitude() == null ? "" : row.getLongitude().toString(),
                        String.format(Locale.ROOT, "%.3f", row.getDistanceMiles()),
                        Integer.toString(row.getReviewCount()),
                        row.getMeanRating() == null ? "" : String.format(Locale.ROOT, "%.2f", row.getMeanRating()),
                        Integer.toString(row.getPositiveCount()),
                        Integer.toString(row.getNeutralCount()),
                        Integer.toString(row.getNegativeCount()),
                        Boolean.toString(row.isHighNegative())
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write places CSV", e);
        }
        log.debug("Exported {} place rows", rows.size());
        return out.toString();
    }

    public String exportReviews(List<Review> reviews) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = newWriter(out)) {
            writer.writeNext(REVIEW_HEADERS);
            for (Review review : reviews) {
                ZonedDateTime utc = review.getTime() == null ? null : review.getTime().atZone(ZoneOffset.UTC);
                writer.writeNext(new String[]{
                        review.getPlaceId(),
                        nullToEmpty(review.getPlaceName()),
                        nullToEmpty(review.getStoreAddress()),
                        nullToEmpty(review.getStoreCity()),
                        nullToEmpty(review.getStoreState()),
                        nullToEmpty(review.getStoreZip()),
                        nullToEmpty(review.getAuthor()),
                        Integer.toString(review.getRating()),
                        nullToEmpty(review.getText()),
                        utc == null ? "" : Long.toString(review.getTime().getEpochSecond()),
                        utc == null ? "" : utc.toLocalDate().toString(),
                        utc == null ? "" : Integer.toString(utc.getHour()),
                        review.getSentiment() == null ? "" : review.getSentiment().getDisplayName(),
                        flag(review, ReviewIssue.FOOD),
                        flag(review, ReviewIssue.SERVICE),
                        flag(review, ReviewIssue.CLEANLINESS),
                        flag(review, ReviewIssue.PRICE)
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write reviews CSV", e);
        }
        log.debug("Exported {} review rows", reviews.size());
        return out.toString();
    }

    private static CSVWriter newWriter(StringWriter out) {
        return new CSVWriter(out, ICSVWriter.DEFAULT_SEPARATOR, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n");
    }

    private static String flag(Review review, ReviewIssue issue) {
        return review.hasIssue(issue) ? "1" : "0";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
