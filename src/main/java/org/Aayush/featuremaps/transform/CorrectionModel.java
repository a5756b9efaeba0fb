package org.Aayush.featuremaps.transform;

/**
 * Per-map retention-time correction.
 *
 * <p>Implementations must be pure: the same input always yields the same output and
 * evaluation has no side effects visible to the index.</p>
 */
@FunctionalInterface
public interface CorrectionModel {

    /**
     * Maps an observed retention time onto the reference scale.
     */
    double evaluate(double rt);

    /**
     * Model returning its input unchanged.
     */
    static CorrectionModel identity() {
        return rt -> rt;
    }

    /**
     * Model {@code rt -> slope * rt + intercept}.
     */
    static CorrectionModel linear(double slope, double intercept) {
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)) {
            throw new IllegalArgumentException("slope and intercept must be finite");
        }
        return rt -> slope * rt + intercept;
    }
}
