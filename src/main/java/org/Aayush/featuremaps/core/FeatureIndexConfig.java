package org.Aayush.featuremaps.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.featuremaps.spatial.KdTreeBuilder;

/**
 * Construction-time settings for a {@link FeatureMapIndex}.
 *
 * <p>Only build behavior lives here. Query tolerances are per-call arguments.</p>
 */
@Value
@Builder
public class FeatureIndexConfig {

    /**
     * Build large subtrees on the common fork/join pool.
     */
    @Builder.Default
    boolean parallelBuild = false;

    /**
     * Minimum subtree size forked as its own task when {@link #parallelBuild} is set.
     */
    @Builder.Default
    int parallelBuildThreshold = KdTreeBuilder.DEFAULT_PARALLEL_THRESHOLD;

    /**
     * Sequential build.
     */
    public static FeatureIndexConfig defaults() {
        return FeatureIndexConfig.builder().build();
    }

    /**
     * Fork/join build with the default threshold.
     */
    public static FeatureIndexConfig parallel() {
        return FeatureIndexConfig.builder()
                .parallelBuild(true)
                .build();
    }

    KdTreeBuilder treeBuilder() {
        return new KdTreeBuilder(parallelBuild, parallelBuildThreshold);
    }
}
