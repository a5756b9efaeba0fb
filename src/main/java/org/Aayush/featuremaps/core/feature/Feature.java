package org.Aayush.featuremaps.core.feature;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Default mutable feature record.
 *
 * <p>Identity is reference identity; {@code uniqueId} is carried for callers that need a
 * stable external handle and is not interpreted by the index.</p>
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Accessors(fluent = true)
public final class Feature implements MutableFeature {
    private long uniqueId;
    private double rt;
    private double mz;
    private float intensity;
    private int charge;

    /**
     * Creates a feature without an external id.
     */
    public static Feature of(double rt, double mz, float intensity, int charge) {
        return new Feature(0L, rt, mz, intensity, charge);
    }
}
