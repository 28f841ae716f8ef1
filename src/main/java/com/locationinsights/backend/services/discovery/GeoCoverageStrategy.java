package com.locationinsights.backend.services.discovery;

import com.locationinsights.backend.config.GooglePlacesProperties;
import com.locationinsights.backend.integrations.GooglePlacesClient;
import com.locationinsights.backend.integrations.PlacesPage;
import com.locationinsights.backend.models.PlaceCandidate;
import com.locationinsights.backend.models.SearchQuery;
import com.locationinsights.backend.models.SearchStrategy;
import com.locationinsights.backend.models.Tile;
import com.locationinsights.backend.models.WarningCode;
import com.locationinsights.backend.services.RunContext;
import com.locationinsights.backend.services.geo.TileGenerator;
import com.locationinsights.backend.util.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Tiles the circle and runs one nearby search per tile.
 * Tiles are fetched concurrently; results are merged in tile-index order.
 */
@Component
@Slf4j
public class GeoCoverageStrategy implements DiscoveryStrategy {

    private final GooglePlacesClient placesClient;
    private final TileGenerator tileGenerator;
    private final PaginatedSearchRunner paginatedSearchRunner;
    private final GooglePlacesProperties properties;
    private final Executor executor;

    public GeoCoverageStrategy(GooglePlacesClient placesClient,
                               TileGenerator tileGenerator,
                               PaginatedSearchRunner paginatedSearchRunner,
                               GooglePlacesProperties properties,
                               @Qualifier("placesRequestExecutor") Executor executor) {
        this.placesClient = placesClient;
        this.tileGenerator = tileGenerator;
        this.paginatedSearchRunner = paginatedSearchRunner;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public SearchStrategy getStrategy() {
        return SearchStrategy.GEO_COVERAGE;
    }

    @Override
    public int regionCount(SearchQuery query) {
        return tilesFor(query).size();
    }

    @Override
    public List<PlaceCandidate> discover(SearchQuery query, RunContext context) {
        List<Tile> tiles = tilesFor(query);
        log.info("Geo coverage over {} tiles for radius {} mi", tiles.size(), query.radiusMiles());

        List<CompletableFuture<List<PlaceCandidate>>> futures = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            futures.add(CompletableFuture.supplyAsync(() -> searchTile(tile, query, context), executor));
        }

        List<PlaceCandidate> merged = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Tile tile = tiles.get(i);
            try {
                merged.addAll(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Tile {} failed unexpectedly", tile.label(), cause);
                context.recordDiscoveryFailure();
                context.warn(WarningCode.TILE_FAILED, tile.label(), cause.getMessage());
            }
        }

        log.info("Geo coverage returned {} candidates", merged.size());
        return merged;
    }

    List<Tile> tilesFor(SearchQuery query) {
        double maxTileMiles = GeoMath.metersToMiles(properties.getMaxTileRadiusMeters());
        return tileGenerator.generate(query.center(), query.radiusMiles(), maxTileMiles);
    }

    private List<PlaceCandidate> searchTile(Tile tile, SearchQuery query, RunContext context) {
        if (context.shouldStop(tile.label())) {
            return List.of();
        }

        int radiusMeters = (int) Math.ceil(GeoMath.milesToMeters(tile.radiusMiles()));
        List<PlacesPage> pages = paginatedSearchRunner.collectPages(
                tile.label(),
                properties.getMaxPagesPerTile(),
                token -> placesClient.nearbySearch(tile.center(), radiusMeters, query.keyword(), token),
                context,
                WarningCode.TILE_FAILED);

        List<PlaceCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            candidates.addAll(CandidateFactory.fromSummaries(
                    pages.get(i).getResults(), query.center(), tile.label() + ":page-" + (i + 1)));
        }
        log.debug("{} yielded {} candidates", tile.label(), candidates.size());
        return candidates;
    }
}
