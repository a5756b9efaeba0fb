package org.Aayush.featuremaps.query;

import lombok.Builder;
import lombok.Value;

/**
 * Closed axis-aligned (rt, mz) box with an optional excluded map.
 */
@Value
@Builder(toBuilder = true)
public class RegionQuery {

    /**
     * Sentinel map index meaning "exclude nothing".
     */
    public static final int NO_IGNORED_MAP = Integer.MAX_VALUE;

    double rtLow;
    double rtHigh;
    double mzLow;
    double mzHigh;

    /**
     * Map whose points are dropped; ignored unless it names a valid map.
     */
    @Builder.Default
    int ignoredMapIndex = NO_IGNORED_MAP;

    public static RegionQuery of(double rtLow, double rtHigh, double mzLow, double mzHigh) {
        return new RegionQuery(rtLow, rtHigh, mzLow, mzHigh, NO_IGNORED_MAP);
    }
}
