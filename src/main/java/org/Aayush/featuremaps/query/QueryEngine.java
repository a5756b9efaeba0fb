package org.Aayush.featuremaps.query;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.featuremaps.core.FeatureMapIndexException;
import org.Aayush.featuremaps.spatial.KdTree2D;
import org.Aayush.featuremaps.store.PointRecordStore;

import java.util.Objects;

/**
 * Translates neighborhood and region lookups into tree windows plus record filters.
 * <p>
 * Bound to one store and the tree built from its current columns. Stateless otherwise;
 * concurrent calls are safe as long as neither the store nor the tree is replaced meanwhile.
 * </p>
 */
public final class QueryEngine {

    private static final double LN_2 = Math.log(2.0);

    private final PointRecordStore store;
    private final KdTree2D tree;

    public QueryEngine(PointRecordStore store, KdTree2D tree) {
        this.store = Objects.requireNonNull(store, "store");
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    /**
     * Ids compatible with {@code centerId} under {@code query}.
     * <p>
     * Window: {@code rt(c) +/- rtTolerance} and either {@code mz(c) +/- mzTolerance} or
     * {@code mz(c) * (1 +/- mzTolerance)} for relative tolerances, both closed. The center is
     * never returned; same-map points only with {@code includeSameMap}; with a non-negative
     * {@code maxLogRatio}, points whose {@code |log2(intensity / intensity(c))|} exceeds it are
     * dropped.
     * </p>
     *
     * @return distinct ids in unspecified order.
     */
    public IntArrayList neighborhood(int centerId, NeighborhoodQuery query) {
        Objects.requireNonNull(query, "query");
        requireCenter(centerId);
        requireTolerance(query.getRtTolerance(), "rtTolerance");
        requireTolerance(query.getMzTolerance(), "mzTolerance");
        if (Double.isNaN(query.getMaxLogRatio())) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_INVALID_TOLERANCE, "maxLogRatio must not be NaN");
        }

        double rt = store.rt(centerId);
        double mz = store.mz(centerId);
        double rtTolerance = query.getRtTolerance();
        double mzTolerance = query.getMzTolerance();

        double mzA;
        double mzB;
        if (query.isMzRelative()) {
            mzA = mz * (1.0 - mzTolerance);
            mzB = mz * (1.0 + mzTolerance);
        } else {
            mzA = mz - mzTolerance;
            mzB = mz + mzTolerance;
        }

        int centerMap = store.mapIndex(centerId);
        boolean includeSameMap = query.isIncludeSameMap();
        boolean intensityFilter = query.intensityFilterEnabled();
        double maxLogRatio = query.getMaxLogRatio();
        double centerIntensity = store.intensity(centerId);

        IntArrayList result = new IntArrayList();
        tree.rangeSearch(rt - rtTolerance, rt + rtTolerance, Math.min(mzA, mzB), Math.max(mzA, mzB), id -> {
            if (id == centerId) {
                return;
            }
            if (!includeSameMap && store.mapIndex(id) == centerMap) {
                return;
            }
            if (intensityFilter && exceedsLogRatio(store.intensity(id), centerIntensity, maxLogRatio)) {
                return;
            }
            result.add(id);
        });
        return result;
    }

    /**
     * Ids inside the closed box of {@code query}, minus the ignored map when it names a valid
     * map index.
     *
     * @return distinct ids in unspecified order.
     */
    public IntArrayList region(RegionQuery query) {
        Objects.requireNonNull(query, "query");
        if (store.size() == 0) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_OUT_OF_RANGE, "region query on an empty index");
        }
        requireBound(query.getRtLow(), "rtLow");
        requireBound(query.getRtHigh(), "rtHigh");
        requireBound(query.getMzLow(), "mzLow");
        requireBound(query.getMzHigh(), "mzHigh");

        int ignored = query.getIgnoredMapIndex();
        boolean filterMap = ignored >= 0 && ignored < store.numMaps();

        IntArrayList result = new IntArrayList();
        tree.rangeSearch(query.getRtLow(), query.getRtHigh(), query.getMzLow(), query.getMzHigh(), id -> {
            if (filterMap && store.mapIndex(id) == ignored) {
                return;
            }
            result.add(id);
        });
        return result;
    }

    static boolean exceedsLogRatio(double candidateIntensity, double centerIntensity, double maxLogRatio) {
        double ratio = candidateIntensity / centerIntensity;
        if (!(ratio > 0.0) || Double.isInfinite(ratio)) {
            return true;
        }
        return Math.abs(Math.log(ratio) / LN_2) > maxLogRatio;
    }

    private void requireCenter(int centerId) {
        if (centerId < 0 || centerId >= store.size()) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_OUT_OF_RANGE,
                    "center id out of bounds: " + centerId + " [0, " + store.size() + ")");
        }
    }

    private static void requireTolerance(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_INVALID_TOLERANCE,
                    name + " must be finite and >= 0, got " + value);
        }
    }

    private static void requireBound(double value, String name) {
        if (Double.isNaN(value)) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_INVALID_TOLERANCE, name + " must not be NaN");
        }
    }
}
