package com.locationinsights.backend.controllers;

import com.locationinsights.backend.dto.RunRequest;
import com.locationinsights.backend.exceptions.InvalidRunRequestException;
import com.locationinsights.backend.models.AddressSuggestion;
import com.locationinsights.backend.models.InsightsRunResult;
import com.locationinsights.backend.services.AddressResolverService;
import com.locationinsights.backend.services.CsvExportService;
import com.locationinsights.backend.services.InsightsPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Insights runs over a circular geography: JSON results, CSV downloads and address suggestions
 */
@RestController
@RequestMapping("/api/v1/insights")
@RequiredArgsConstructor
@Slf4j
public class InsightsRunController {

    private final InsightsPipelineService pipelineService;
    private final CsvExportService csvExportService;
    private final AddressResolverService addressResolverService;

    /**
     * Run discovery and analytics
     * POST /api/v1/insights/runs
     */
    @PostMapping("/runs")
    public ResponseEntity<InsightsRunResult> run(@Valid @RequestBody RunRequest request) {
        log.info("Insights run requested: strategy={}, radius={} mi", request.getStrategy(), request.getRadiusMiles());
        return ResponseEntity.ok(pipelineService.run(request));
    }

    /**
     * Run and download one flat table
     * POST /api/v1/insights/runs/export?table=places|reviews
     */
    @PostMapping("/runs/export")
    public ResponseEntity<String> export(@RequestParam(defaultValue = "places") String table,
                                         @Valid @RequestBody RunRequest request) {
        String normalized = table.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals("places") && !normalized.equals("reviews")) {
            throw new InvalidRunRequestException("Unknown export table: " + table);
        }

        InsightsRunResult result = pipelineService.run(request);
        String csv = normalized.equals("places")
                ? csvExportService.exportPlaces(result.getRows())
                : csvExportService.exportReviews(result.getReviews());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("text/csv"));
        headers.setContentDisposition(ContentDisposition.attachment().filename(normalized + ".csv").build());

        log.info("Exported {} table ({} warnings)", normalized, result.getWarnings().size());
        return ResponseEntity.ok().headers(headers).body(csv);
    }

    @GetMapping("/address-suggestions")
    public ResponseEntity<List<AddressSuggestion>> suggestAddresses(@RequestParam String input,
                                                                    @RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(addressResolverService.suggest(input, limit));
    }
}
