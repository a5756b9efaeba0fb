package org.Aayush.featuremaps.core.feature;

/**
 * Feature whose fields can be rewritten through an owning map index.
 */
public interface MutableFeature extends FeatureView {

    MutableFeature rt(double rt);

    MutableFeature mz(double mz);

    MutableFeature intensity(float intensity);

    MutableFeature charge(int charge);
}
