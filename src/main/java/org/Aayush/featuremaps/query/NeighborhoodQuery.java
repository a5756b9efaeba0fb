package org.Aayush.featuremaps.query;

import lombok.Builder;
import lombok.Value;

/**
 * Tolerance window and filters for one neighborhood lookup.
 *
 * <p>Owned by the caller; the index keeps no tolerance state between queries.</p>
 */
@Value
@Builder(toBuilder = true)
public class NeighborhoodQuery {

    /** Parts-per-million expressed as a raw fraction. */
    private static final double PPM = 1.0e-6;

    /**
     * Half-width of the rt window.
     */
    double rtTolerance;

    /**
     * Half-width of the mz window: absolute, or a raw fraction of the center mz when
     * {@link #mzRelative} is set (use {@link #ppm(double)} to convert from ppm).
     */
    double mzTolerance;

    /**
     * Interpret {@link #mzTolerance} as a fraction of the center mz.
     */
    boolean mzRelative;

    /**
     * Keep candidates from the center's own map.
     */
    @Builder.Default
    boolean includeSameMap = false;

    /**
     * Upper bound on {@code |log2(intensity ratio)|}; negative disables the filter.
     */
    @Builder.Default
    double maxLogRatio = -1.0;

    /**
     * Converts a parts-per-million tolerance into the fraction used by relative windows.
     */
    public static double ppm(double partsPerMillion) {
        return partsPerMillion * PPM;
    }

    /**
     * Absolute mz tolerance with default filters.
     */
    public static NeighborhoodQuery absolute(double rtTolerance, double mzTolerance) {
        return NeighborhoodQuery.builder()
                .rtTolerance(rtTolerance)
                .mzTolerance(mzTolerance)
                .mzRelative(false)
                .build();
    }

    /**
     * Relative mz tolerance given in ppm, with default filters.
     */
    public static NeighborhoodQuery ppmWindow(double rtTolerance, double mzTolerancePpm) {
        return NeighborhoodQuery.builder()
                .rtTolerance(rtTolerance)
                .mzTolerance(ppm(mzTolerancePpm))
                .mzRelative(true)
                .build();
    }

    public boolean intensityFilterEnabled() {
        return maxLogRatio >= 0.0;
    }
}
