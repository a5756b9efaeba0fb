package org.Aayush.featuremaps.store;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.floats.FloatArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.featuremaps.core.FeatureMapIndexException;
import org.Aayush.featuremaps.core.feature.FeatureView;
import org.Aayush.featuremaps.core.feature.MutableFeature;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Columnar storage for the point records of a feature-map index.
 * <p>
 * Contract summary:
 * </p>
 * <ul>
 * <li>One row per ingested feature, ids dense in ingestion order (maps in outer order).</li>
 * <li>{@code rt} is the only column that changes after ingestion, and only through
 * {@link #replaceRt(double[])}.</li>
 * <li>Ownership mode is fixed at construction; mismatched ingestion or payload access fails
 * before any row is touched.</li>
 * <li>Not synchronized. The owning facade serializes writers against readers.</li>
 * </ul>
 */
public final class PointRecordStore {

    @Getter
    @Accessors(fluent = true)
    private final OwnershipMode ownershipMode;

    private final DoubleArrayList rt = new DoubleArrayList();
    private final DoubleArrayList mz = new DoubleArrayList();
    private final FloatArrayList intensity = new FloatArrayList();
    private final IntArrayList charge = new IntArrayList();
    private final IntArrayList mapIndex = new IntArrayList();
    private final ObjectArrayList<PayloadRef> payloads = new ObjectArrayList<>();

    private int numMaps;

    public PointRecordStore(OwnershipMode ownershipMode) {
        this.ownershipMode = Objects.requireNonNull(ownershipMode, "ownershipMode");
    }

    /**
     * Appends read-only feature maps. Requires {@link OwnershipMode#BORROWING_IMMUTABLE}.
     *
     * @param maps one collection per source map, in map-index order.
     * @return number of records appended.
     */
    public int addMaps(List<? extends Collection<? extends FeatureView>> maps) {
        requireMode(OwnershipMode.BORROWING_IMMUTABLE, "read-only maps");
        validateBatch(maps);
        int added = 0;
        for (int m = 0; m < maps.size(); m++) {
            for (FeatureView feature : maps.get(m)) {
                append(m, feature, PayloadRef.shared(feature));
                added++;
            }
        }
        numMaps = maps.size();
        return added;
    }

    /**
     * Appends mutable feature maps. Requires {@link OwnershipMode#OWNING_MUTABLE}.
     *
     * @param maps one collection per source map, in map-index order.
     * @return number of records appended.
     */
    public int addMutableMaps(List<? extends Collection<? extends MutableFeature>> maps) {
        requireMode(OwnershipMode.OWNING_MUTABLE, "mutable maps");
        validateBatch(maps);
        int added = 0;
        for (int m = 0; m < maps.size(); m++) {
            for (MutableFeature feature : maps.get(m)) {
                append(m, feature, PayloadRef.exclusive(feature));
                added++;
            }
        }
        numMaps = maps.size();
        return added;
    }

    /**
     * Drops every record and resets the map count. The ownership mode is kept.
     */
    public void clear() {
        rt.clear();
        mz.clear();
        intensity.clear();
        charge.clear();
        mapIndex.clear();
        payloads.clear();
        numMaps = 0;
    }

    public int size() {
        return rt.size();
    }

    public int numMaps() {
        return numMaps;
    }

    public double rt(int id) {
        return rt.getDouble(checkId(id));
    }

    public double mz(int id) {
        return mz.getDouble(checkId(id));
    }

    public float intensity(int id) {
        return intensity.getFloat(checkId(id));
    }

    public int charge(int id) {
        return charge.getInt(checkId(id));
    }

    public int mapIndex(int id) {
        return mapIndex.getInt(checkId(id));
    }

    /**
     * Read-only payload view, available in both ownership modes.
     */
    public FeatureView feature(int id) {
        return payloads.get(checkId(id)).view();
    }

    /**
     * Mutable payload handle.
     *
     * @throws FeatureMapIndexException with {@code KD_MODE_ERROR} unless the store owns its
     * payloads, regardless of {@code id}.
     */
    public MutableFeature mutableFeature(int id) {
        if (ownershipMode != OwnershipMode.OWNING_MUTABLE) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_MODE_ERROR,
                    "mutable feature access requires " + OwnershipMode.OWNING_MUTABLE + ", store is " + ownershipMode);
        }
        return ((PayloadRef.Exclusive) payloads.get(checkId(id))).feature();
    }

    /**
     * Copy of the current {@code rt} column.
     */
    public double[] rtSnapshot() {
        return rt.toDoubleArray();
    }

    /**
     * Copy of the {@code mz} column.
     */
    public double[] mzSnapshot() {
        return mz.toDoubleArray();
    }

    /**
     * Copy of the map-index column.
     */
    public int[] mapIndexSnapshot() {
        return mapIndex.toIntArray();
    }

    /**
     * Overwrites the whole {@code rt} column.
     *
     * @param values replacement values, one per record.
     */
    public void replaceRt(double[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != rt.size()) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_SHAPE_MISMATCH,
                    "rt column length mismatch: " + values.length + " != " + rt.size());
        }
        for (int i = 0; i < values.length; i++) {
            rt.set(i, values[i]);
        }
    }

    private void append(int map, FeatureView feature, PayloadRef payload) {
        rt.add(feature.rt());
        mz.add(feature.mz());
        intensity.add(feature.intensity());
        charge.add(feature.charge());
        mapIndex.add(map);
        payloads.add(payload);
    }

    private void requireMode(OwnershipMode required, String what) {
        if (ownershipMode != required) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_OWNERSHIP_CONFLICT,
                    "cannot add " + what + " to a store in " + ownershipMode + " mode");
        }
    }

    /**
     * Validates a whole batch before the first row is appended.
     */
    private void validateBatch(List<? extends Collection<? extends FeatureView>> maps) {
        if (maps == null) {
            throw new FeatureMapIndexException(FeatureMapIndexException.REASON_INVALID_FEATURE, "maps must be non-null");
        }
        if (numMaps != 0 && maps.size() != numMaps) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_SHAPE_MISMATCH,
                    "batch has " + maps.size() + " maps, store was populated with " + numMaps);
        }
        for (int m = 0; m < maps.size(); m++) {
            Collection<? extends FeatureView> map = maps.get(m);
            if (map == null) {
                throw new FeatureMapIndexException(
                        FeatureMapIndexException.REASON_INVALID_FEATURE, "maps[" + m + "] is null");
            }
            int position = 0;
            for (FeatureView feature : map) {
                if (feature == null) {
                    throw new FeatureMapIndexException(
                            FeatureMapIndexException.REASON_INVALID_FEATURE,
                            "maps[" + m + "][" + position + "] is null");
                }
                if (!Double.isFinite(feature.rt()) || !Double.isFinite(feature.mz())) {
                    throw new FeatureMapIndexException(
                            FeatureMapIndexException.REASON_INVALID_FEATURE,
                            "maps[" + m + "][" + position + "] has non-finite coordinates (rt="
                                    + feature.rt() + ", mz=" + feature.mz() + ")");
                }
                position++;
            }
        }
    }

    private int checkId(int id) {
        if (id < 0 || id >= rt.size()) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_OUT_OF_RANGE,
                    "feature id out of bounds: " + id + " [0, " + rt.size() + ")");
        }
        return id;
    }
}
