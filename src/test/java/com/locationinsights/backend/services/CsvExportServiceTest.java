package com.locationinsights.backend.services;

import com.locationinsights.backend.models.AnalyticRow;
import com.locationinsights.backend.models.Review;
import com.locationinsights.backend.models.ReviewIssue;
import com.locationinsights.backend.models.SentimentLabel;
import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class CsvExportServiceTest {

    private final CsvExportService csvExportService = new CsvExportService();

    @Test
    void testPlacesTable() throws Exception {
        // Given
        AnalyticRow flagged = AnalyticRow.builder()
                .placeId("P1").name("Joe's, the \"best\"").address("7 Carmine St")
                .latitude(40.7305).longitude(-74.0021).distanceMiles(1.23456)
                .reviewCount(4).meanRating(2.75)
                .positiveCount(1).neutralCount(1).negativeCount(2)
                .ratingHistogram(Map.of()).monthlyReviewCounts(new TreeMap<>())
                .highNegative(true)
                .build();
        AnalyticRow empty = AnalyticRow.builder()
                .placeId("P2").name("Quiet").reviewCount(0)
                .ratingHistogram(Map.of()).monthlyReviewCounts(new TreeMap<>())
                .build();

        // When
        List<String[]> lines = read(csvExportService.exportPlaces(List.of(flagged, empty)));

        // Then
        assertEquals(3, lines.size());
        assertArrayEquals(CsvExportService.PLACE_HEADERS, lines.get(0));
        assertArrayEquals(new String[]{"P1", "Joe's, the \"best\"", "7 Carmine St", "40.7305", "-74.0021",
                "1.235", "4", "2.75", "1", "1", "2", "true"}, lines.get(1));
        assertEquals("", lines.get(2)[3]);
        assertEquals("", lines.get(2)[7]);
        assertEquals("false", lines.get(2)[11]);
    }

    @Test
    void testReviewsTable() throws Exception {
        // Given
        Review review = Review.builder()
                .placeId("P1").placeName("Joe's Pizza")
                .storeAddress("7 Carmine St").storeCity("New York").storeState("NY").storeZip("10014")
                .author("Bob").rating(2).text("Cold pizza,\nrude staff")
                .time(Instant.parse("2024-05-02T17:30:00Z"))
                .build()
                .labelled(SentimentLabel.NEGATIVE, Set.of(ReviewIssue.FOOD, ReviewIssue.SERVICE));

        // When
        List<String[]> lines = read(csvExportService.exportReviews(List.of(review)));

        // Then
        assertEquals(2, lines.size());
        assertEquals(17, lines.get(0).length);
        assertEquals("issue_price", lines.get(0)[16]);
        assertArrayEquals(new String[]{"P1", "Joe's Pizza", "7 Carmine St", "New York", "NY", "10014",
                "Bob", "2", "Cold pizza,\nrude staff", "1714671000", "2024-05-02", "17", "Negative",
                "1", "1", "0", "0"}, lines.get(1));
    }

    @Test
    void testEmptyTablesHaveHeaderOnly() throws Exception {
        assertEquals(1, read(csvExportService.exportPlaces(List.of())).size());
        assertEquals(1, read(csvExportService.exportReviews(List.of())).size());
    }

    private static List<String[]> read(String csv) throws Exception {
        try (CSVReader reader = new CSVReader(new StringReader(csv))) {
            return reader.readAll();
        }
    }
}
