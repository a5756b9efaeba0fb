package org.Aayush.featuremaps.core.feature;

/**
 * Read-only view over one detected feature.
 *
 * <p>Only the four fields the map index copies at ingestion are required.</p>
 */
public interface FeatureView {

    /**
     * Retention time.
     */
    double rt();

    /**
     * Mass-to-charge ratio.
     */
    double mz();

    /**
     * Feature intensity.
     */
    float intensity();

    /**
     * Charge state (0 when unknown).
     */
    int charge();
}
