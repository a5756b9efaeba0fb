package org.Aayush.featuremaps.transform;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Monotonic correction interpolating between anchor pairs {@code (observed, reference)}.
 * <p>
 * Inside the anchor range the value is linearly interpolated; outside it the first or last
 * segment is extended. A single anchor behaves as a constant shift.
 * </p>
 */
public final class PiecewiseLinearCorrectionModel implements CorrectionModel {

    private final double[] observed;
    private final double[] reference;

    @Getter
    @Accessors(fluent = true)
    private final int anchorCount;

    /**
     * @param observed strictly increasing observed retention times.
     * @param reference non-decreasing reference retention times, same length.
     */
    public PiecewiseLinearCorrectionModel(double[] observed, double[] reference) {
        Objects.requireNonNull(observed, "observed");
        Objects.requireNonNull(reference, "reference");
        if (observed.length == 0) {
            throw new IllegalArgumentException("at least one anchor is required");
        }
        if (observed.length != reference.length) {
            throw new IllegalArgumentException(
                    "anchor length mismatch: observed=" + observed.length + ", reference=" + reference.length);
        }
        for (int i = 0; i < observed.length; i++) {
            if (!Double.isFinite(observed[i]) || !Double.isFinite(reference[i])) {
                throw new IllegalArgumentException("anchor[" + i + "] must be finite");
            }
            if (i > 0 && observed[i] <= observed[i - 1]) {
                throw new IllegalArgumentException("observed anchors must be strictly increasing at index " + i);
            }
            if (i > 0 && reference[i] < reference[i - 1]) {
                throw new IllegalArgumentException("reference anchors must be non-decreasing at index " + i);
            }
        }
        this.observed = observed.clone();
        this.reference = reference.clone();
        this.anchorCount = observed.length;
    }

    @Override
    public double evaluate(double rt) {
        if (anchorCount == 1) {
            return rt + (reference[0] - observed[0]);
        }
        int segment;
        if (rt <= observed[0]) {
            segment = 0;
        } else if (rt >= observed[anchorCount - 1]) {
            segment = anchorCount - 2;
        } else {
            int pos = Arrays.binarySearch(observed, rt);
            if (pos >= 0) {
                return reference[pos];
            }
            segment = -pos - 2;
        }
        double x0 = observed[segment];
        double x1 = observed[segment + 1];
        double y0 = reference[segment];
        double y1 = reference[segment + 1];
        return y0 + (rt - x0) * (y1 - y0) / (x1 - x0);
    }

    @Override
    public String toString() {
        return "PiecewiseLinearCorrectionModel[anchors=" + anchorCount + "]";
    }
}
