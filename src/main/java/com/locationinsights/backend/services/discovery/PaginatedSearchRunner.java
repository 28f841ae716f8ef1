package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.integrations.PlacesPage;
import com.locationinsights.backend.integrations.PlacesProviderException;
import com.locationinsights.backend.integrations.ProviderQuotaExceededException;
import com.locationinsights.backend.integrations.ProviderResponse;
import com.locationinsights.backend.models.WarningCode;
import com.locationinsights.backend.services.RunContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Follows next-page tokens for one search region.
 *
 * Stops on the first of: no next-page token, page cap reached, run stop requested, page failure.
 * Pages fetched before a failure are kept.
 */
@Component
@Slf4j
public class PaginatedSearchRunner {

    @FunctionalInterface
    public interface PageFetcher {
        ProviderResponse<PlacesPage> fetch(String pageToken) throws PlacesProviderException;
    }

    private final Duration nextPageTokenWait;

    public PaginatedSearchRunner(GooglePlacesProperties properties) {
        this.nextPageTokenWait = properties.getNextPageTokenWait();
    }

    /**
     * @param unit             region label used in logs and warnings, e.g. {@code tile-4}
     * @param maxPages         page safety cap
     * @param fetcher          issues one page request
     * @param context          run state
     * @param firstPageFailure warning code used when the region yields nothing at all
     * @return fetched pages in order; empty when the first page failed
     */
    public List<PlacesPage> collectPages(String unit, int maxPages, PageFetcher fetcher,
                                         RunContext context, WarningCode firstPageFailure) {
        List<PlacesPage> pages = new ArrayList<>();
        String token = null;

        while (pages.size() < maxPages) {
            String pageUnit = unit + "/page-" + (pages.size() + 1);
            if (context.shouldStop(pageUnit)) {
                break;
            }

            PlacesPage page;
            try {
                page = fetcher.fetch(token).body();
            } catch (ProviderQuotaExceededException e) {
                context.quotaExceeded(pageUnit, e.getMessage());
                break;
            } catch (PlacesProviderException e) {
                if (pages.isEmpty()) {
                    log.warn("Search {} failed on its first page: {}", unit, e.getMessage());
                    context.recordDiscoveryFailure();
                    context.warn(firstPageFailure, unit, e.getMessage());
                } else {
                    log.warn("Search {} failed; keeping {} earlier pages: {}", pageUnit, pages.size(), e.getMessage());
                    context.warn(WarningCode.PAGE_FAILED, pageUnit, e.getMessage());
                }
                break;
            }

            if (pages.isEmpty()) {
                context.recordDiscoverySuccess();
            }
            pages.add(page);

            if (!page.hasNextPage()) {
                break;
            }
            if (pages.size() >= maxPages) {
                log.debug("Search {} reached the {} page cap", unit, maxPages);
                break;
            }
            if (!waitForToken()) {
                context.cancel();
                context.shouldStop(pageUnit);
                break;
            }
            token = page.getNextPageToken();
        }

        return pages;
    }

    private boolean waitForToken() {
        if (nextPageTokenWait.isZero() || nextPageTokenWait.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(nextPageTokenWait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
