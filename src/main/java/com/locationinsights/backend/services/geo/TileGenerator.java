package com.locationinsights.backend.services.geo;

import com.locationinsights.backend.config.InsightsProperties;
import com.locationinsights.backend.models.GeoPoint;
import com.locationinsights.backend.models.Tile;
import com.locationinsights.backend.util.GeoMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Covers a search circle with overlapping nearby-search tiles no larger than the provider cap.
 *
 * Geometry: tile centers sit on a hexagonal lattice laid out in an azimuthal equidistant plane
 * around the circle center. With lattice spacing {@code d = sqrt(3) * r * (1 - overlap)} every plane
 * point is within {@code r * (1 - overlap)} of some lattice point, so a disk of radius {@code r}
 * around that point contains it with margin. Keeping every lattice point within
 * {@code R + r * (1 - overlap)} of the center therefore covers the whole circle of radius {@code R}.
 * The projection preserves distances from the center exactly and distorts the rest by far less
 * than the overlap margin at any radius this service accepts.
 */
@Component
@Slf4j
public class TileGenerator {

    private static final double SQRT3 = Math.sqrt(3.0);

    private final double overlap;

    @Autowired
    public TileGenerator(InsightsProperties properties) {
        this(properties.getTileOverlap());
    }

    public TileGenerator(double overlap) {
        // zero overlap leaves hex vertices uncovered
        if (overlap <= 0.0 || overlap >= 0.5) {
            throw new IllegalArgumentException("Tile overlap must be in (0, 0.5): " + overlap);
        }
        this.overlap = overlap;
    }

    /**
     * @param center        circle center
     * @param radiusMiles   requested radius R
     * @param maxTileMiles  provider per-call radius cap r_max
     * @return tiles ordered south to north, west to east within a row
     */
    public List<Tile> generate(GeoPoint center, double radiusMiles, double maxTileMiles) {
        if (!(radiusMiles > 0.0)) {
            throw new IllegalArgumentException("Radius must be positive: " + radiusMiles);
        }
        if (!(maxTileMiles > 0.0)) {
            throw new IllegalArgumentException("Tile radius cap must be positive: " + maxTileMiles);
        }

        if (radiusMiles <= maxTileMiles) {
            return List.of(new Tile(0, center, radiusMiles));
        }

        double r = GeoMath.milesToMeters(maxTileMiles);
        double spacing = SQRT3 * r * (1.0 - overlap);
        double rowHeight = spacing * SQRT3 / 2.0;
        double reach = GeoMath.milesToMeters(radiusMiles) + r * (1.0 - overlap);

        int rows = (int) Math.ceil(reach / rowHeight) + 1;
        int cols = (int) Math.ceil(reach / spacing) + 1;

        List<Tile> tiles = new ArrayList<>();
        for (int j = -rows; j <= rows; j++) {
            double north = j * rowHeight;
            double shift = Math.floorMod(j, 2) == 1 ? spacing / 2.0 : 0.0;
            for (int i = -cols; i <= cols; i++) {
                double east = i * spacing + shift;
                if (Math.hypot(east, north) <= reach) {
                    GeoPoint tileCenter = GeoMath.fromLocalOffset(center, east, north);
                    tiles.add(new Tile(tiles.size(), tileCenter, maxTileMiles));
                }
            }
        }

        log.debug("Generated {} tiles of {} mi for a {} mi radius around {}",
                tiles.size(), maxTileMiles, radiusMiles, center.toParam());
        return tiles;
    }
}
