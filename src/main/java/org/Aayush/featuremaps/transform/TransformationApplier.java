package org.Aayush.featuremaps.transform;

import lombok.experimental.UtilityClass;
import org.Aayush.featuremaps.core.FeatureMapIndexException;
import org.Aayush.featuremaps.store.PointRecordStore;

import java.util.List;
import java.util.Objects;

/**
 * Rewrites the rt column of a store with one correction model per source map.
 * <p>
 * All-or-nothing: the new column is computed and checked in full before the store is touched.
 * Callers rebuild the spatial index afterwards; see
 * {@link org.Aayush.featuremaps.core.FeatureMapIndex#applyTransformations(List)}.
 * </p>
 */
@UtilityClass
public final class TransformationApplier {

    /**
     * Applies {@code models} to {@code store}.
     *
     * @param models correction per map, in map-index order; size must equal {@code numMaps()}.
     * @return number of rewritten records.
     */
    public static int apply(PointRecordStore store, List<? extends CorrectionModel> models) {
        double[] corrected = correctedRt(store, models);
        store.replaceRt(corrected);
        return corrected.length;
    }

    /**
     * Computes the corrected rt column without modifying the store.
     */
    public static double[] correctedRt(PointRecordStore store, List<? extends CorrectionModel> models) {
        Objects.requireNonNull(store, "store");
        CorrectionModel[] byMap = requireModels(models, store.numMaps());

        double[] rt = store.rtSnapshot();
        int[] mapIndex = store.mapIndexSnapshot();
        for (int i = 0; i < rt.length; i++) {
            double corrected = byMap[mapIndex[i]].evaluate(rt[i]);
            if (!Double.isFinite(corrected)) {
                throw new FeatureMapIndexException(
                        FeatureMapIndexException.REASON_INVALID_TRANSFORM,
                        "correction for map " + mapIndex[i] + " produced " + corrected
                                + " for feature " + i + " (rt=" + rt[i] + ")");
            }
            rt[i] = corrected;
        }
        return rt;
    }

    private static CorrectionModel[] requireModels(List<? extends CorrectionModel> models, int numMaps) {
        if (models == null) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_SHAPE_MISMATCH, "models must be non-null");
        }
        if (models.size() != numMaps) {
            throw new FeatureMapIndexException(
                    FeatureMapIndexException.REASON_SHAPE_MISMATCH,
                    "expected " + numMaps + " correction models, got " + models.size());
        }
        CorrectionModel[] byMap = new CorrectionModel[numMaps];
        for (int m = 0; m < numMaps; m++) {
            CorrectionModel model = models.get(m);
            if (model == null) {
                throw new FeatureMapIndexException(
                        FeatureMapIndexException.REASON_SHAPE_MISMATCH, "models[" + m + "] is null");
            }
            byMap[m] = model;
        }
        return byMap;
    }
}
