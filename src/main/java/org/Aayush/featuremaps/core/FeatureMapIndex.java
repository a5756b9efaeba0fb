package org.Aayush.featuremaps.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.featuremaps.core.feature.FeatureView;
import org.Aayush.featuremaps.core.feature.MutableFeature;
import org.Aayush.featuremaps.query.NeighborhoodQuery;
import org.Aayush.featuremaps.query.QueryEngine;
import org.Aayush.featuremaps.query.RegionQuery;
import org.Aayush.featuremaps.spatial.KdTree2D;
import org.Aayush.featuremaps.spatial.KdTreeBuilder;
import org.Aayush.featuremaps.store.OwnershipMode;
import org.Aayush.featuremaps.store.PointRecordStore;
import org.Aayush.featuremaps.transform.CorrectionModel;
import org.Aayush.featuremaps.transform.TransformationApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Features from several maps together with a 2-D tree for fast (rt, mz) lookups.
 *
 * <p>Lifecycle:</p>
 * <ul>
 * <li>Ingest one or more batches of maps; every batch triggers a full tree rebuild.</li>
 * <li>Query neighborhoods around stored features or arbitrary regions.</li>
 * <li>Optionally correct rt per map with {@link #applyTransformations(List)}, which rebuilds.</li>
 * <li>{@link #clear()} drops everything except the ownership mode.</li>
 * </ul>
 * <p>
 * Ingestion, clearing and transformation hold the write lock for their whole duration,
 * including the rebuild. Queries and accessors hold the read lock and may run concurrently.
 * </p>
 * <p>
 * The ownership mode is fixed when the index is created. {@link OwnershipMode#OWNING_MUTABLE}
 * indexes accept only {@link #addMutableMaps(List)} and hand out mutable payloads;
 * {@link OwnershipMode#BORROWING_IMMUTABLE} indexes accept only {@link #addMaps(List)} and
 * never hand out a mutable payload.
 * </p>
 */
public final class FeatureMapIndex {
    private static final Logger log = LoggerFactory.getLogger(FeatureMapIndex.class);

    /**
     * Ignored-map sentinel for {@link #region(double, double, double, double, int)}.
     */
    public static final int NO_IGNORED_MAP = RegionQuery.NO_IGNORED_MAP;

    private final PointRecordStore store;
    private final KdTreeBuilder treeBuilder;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private KdTree2D tree = KdTree2D.empty();
    private QueryEngine queryEngine;

    private FeatureMapIndex(OwnershipMode mode, FeatureIndexConfig config) {
        Objects.requireNonNull(config, "config");
        this.store = new PointRecordStore(Objects.requireNonNull(mode, "mode"));
        this.treeBuilder = config.treeBuilder();
        this.queryEngine = new QueryEngine(store, tree);
    }

    /**
     * Empty index in the given mode.
     */
    public static FeatureMapIndex create(OwnershipMode mode, FeatureIndexConfig config) {
        return new FeatureMapIndex(mode, config);
    }

    /**
     * Empty read-only index with default settings.
     */
    public static FeatureMapIndex empty() {
        return create(OwnershipMode.BORROWING_IMMUTABLE, FeatureIndexConfig.defaults());
    }

    /**
     * Owning index over mutable features.
     */
    public static FeatureMapIndex owning(List<? extends Collection<? extends MutableFeature>> maps) {
        return owning(maps, FeatureIndexConfig.defaults());
    }

    public static FeatureMapIndex owning(
            List<? extends Collection<? extends MutableFeature>> maps,
            FeatureIndexConfig config
    ) {
        FeatureMapIndex index = create(OwnershipMode.OWNING_MUTABLE, config);
        index.addMutableMaps(maps);
        return index;
    }

    /**
     * Read-only index over any feature views.
     */
    public static FeatureMapIndex borrowing(List<? extends Collection<? extends FeatureView>> maps) {
        return borrowing(maps, FeatureIndexConfig.defaults());
    }

    public static FeatureMapIndex borrowing(
            List<? extends Collection<? extends FeatureView>> maps,
            FeatureIndexConfig config
    ) {
        FeatureMapIndex index = create(OwnershipMode.BORROWING_IMMUTABLE, config);
        index.addMaps(maps);
        return index;
    }

    /**
     * Adds read-only maps and rebuilds the tree.
     *
     * @param maps one collection per source map, in map-index order.
     * @throws FeatureMapIndexException {@code KD_OWNERSHIP_CONFLICT} on an owning index.
     */
    public void addMaps(List<? extends Collection<? extends FeatureView>> maps) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int added = store.addMaps(maps);
            log.debug("Added {} read-only features from {} maps", added, maps.size());
            rebuildLocked();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Adds mutable maps and rebuilds the tree.
     *
     * @param maps one collection per source map, in map-index order.
     * @throws FeatureMapIndexException {@code KD_OWNERSHIP_CONFLICT} on a read-only index.
     */
    public void addMutableMaps(List<? extends Collection<? extends MutableFeature>> maps) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int added = store.addMutableMaps(maps);
            log.debug("Added {} mutable features from {} maps", added, maps.size());
            rebuildLocked();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops all features and the tree. The ownership mode is kept.
     */
    public void clear() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int dropped = store.size();
            store.clear();
            tree = KdTree2D.empty();
            queryEngine = new QueryEngine(store, tree);
            log.debug("Cleared {} features", dropped);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Rebuilds the tree from the current columns.
     */
    public void optimizeTree() {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            rebuildLocked();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces every feature's rt with {@code models.get(mapIndex).evaluate(rt)} and rebuilds.
     * Payload features are not touched.
     *
     * @param models one correction per map, in map-index order.
     * @throws FeatureMapIndexException {@code KD_SHAPE_MISMATCH} when the model count differs
     * from {@link #numMaps()}, {@code KD_INVALID_TRANSFORM} on a non-finite result; nothing is
     * changed in either case.
     */
    public void applyTransformations(List<? extends CorrectionModel> models) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int rewritten = TransformationApplier.apply(store, models);
            log.debug("Applied rt corrections to {} features across {} maps", rewritten, store.numMaps());
            rebuildLocked();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Ids of features compatible with {@code index} (rt, mz, map, intensity).
     *
     * @param index center feature id.
     * @param rtTolerance rt half-width.
     * @param mzTolerance mz half-width, absolute or a raw fraction of the center mz.
     * @param mzRelative treat {@code mzTolerance} as a fraction.
     * @param includeSameMap keep features from the center's map.
     * @param maxLogRatio bound on {@code |log2(intensity ratio)|}; negative disables it.
     */
    public IntArrayList neighborhood(
            int index,
            double rtTolerance,
            double mzTolerance,
            boolean mzRelative,
            boolean includeSameMap,
            double maxLogRatio
    ) {
        return neighborhood(index, NeighborhoodQuery.builder()
                .rtTolerance(rtTolerance)
                .mzTolerance(mzTolerance)
                .mzRelative(mzRelative)
                .includeSameMap(includeSameMap)
                .maxLogRatio(maxLogRatio)
                .build());
    }

    /**
     * Neighborhood without same-map features and without intensity filter.
     */
    public IntArrayList neighborhood(int index, double rtTolerance, double mzTolerance, boolean mzRelative) {
        return neighborhood(index, rtTolerance, mzTolerance, mzRelative, false, -1.0);
    }

    public IntArrayList neighborhood(int index, NeighborhoodQuery query) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return queryEngine.neighborhood(index, query);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Ids of features inside the closed box, skipping {@code ignoredMapIndex} when valid.
     */
    public IntArrayList region(double rtLow, double rtHigh, double mzLow, double mzHigh, int ignoredMapIndex) {
        return region(RegionQuery.builder()
                .rtLow(rtLow)
                .rtHigh(rtHigh)
                .mzLow(mzLow)
                .mzHigh(mzHigh)
                .ignoredMapIndex(ignoredMapIndex)
                .build());
    }

    public IntArrayList region(double rtLow, double rtHigh, double mzLow, double mzHigh) {
        return region(rtLow, rtHigh, mzLow, mzHigh, NO_IGNORED_MAP);
    }

    public IntArrayList region(RegionQuery query) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return queryEngine.region(query);
        } finally {
            readLock.unlock();
        }
    }

    public double rt(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.rt(index);
        } finally {
            readLock.unlock();
        }
    }

    public double mz(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.mz(index);
        } finally {
            readLock.unlock();
        }
    }

    public float intensity(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.intensity(index);
        } finally {
            readLock.unlock();
        }
    }

    public int charge(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.charge(index);
        } finally {
            readLock.unlock();
        }
    }

    public int mapIndex(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.mapIndex(index);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Read-only payload of feature {@code index}.
     */
    public FeatureView feature(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.feature(index);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Mutable payload of feature {@code index}.
     *
     * @throws FeatureMapIndexException {@code KD_MODE_ERROR} on a read-only index, for every id.
     */
    public MutableFeature mutableFeature(int index) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.mutableFeature(index);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of stored features.
     */
    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Number of points in the tree.
     */
    public int treeSize() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return tree.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Height of the tree.
     */
    public int treeDepth() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return tree.depth();
        } finally {
            readLock.unlock();
        }
    }

    public int numMaps() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return store.numMaps();
        } finally {
            readLock.unlock();
        }
    }

    public OwnershipMode ownershipMode() {
        return store.ownershipMode();
    }

    @Override
    public String toString() {
        return "FeatureMapIndex[mode=" + store.ownershipMode() + ", size=" + size() + ", maps=" + numMaps() + "]";
    }

    private void rebuildLocked() {
        long startNanos = System.nanoTime();
        int count = store.size();
        KdTree2D rebuilt = treeBuilder.build(store.rtSnapshot(), store.mzSnapshot(), count);
        tree = rebuilt;
        queryEngine = new QueryEngine(store, rebuilt);
        if (log.isDebugEnabled()) {
            log.debug("Rebuilt tree over {} features (depth {}) in {} ms",
                    count, rebuilt.depth(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }
}
