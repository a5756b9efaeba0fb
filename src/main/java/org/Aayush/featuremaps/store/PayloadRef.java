package org.Aayush.featuremaps.store;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.featuremaps.core.feature.FeatureView;
import org.Aayush.featuremaps.core.feature.MutableFeature;

import java.util.Objects;

/**
 * Reference to the original feature behind one point record.
 *
 * <p>Closed over two variants: {@link Exclusive} for {@link OwnershipMode#OWNING_MUTABLE}
 * stores and {@link Shared} for {@link OwnershipMode#BORROWING_IMMUTABLE} stores.</p>
 */
public abstract class PayloadRef {

    private PayloadRef() {
    }

    /**
     * Read-only view of the payload, available in both modes.
     */
    public abstract FeatureView view();

    /**
     * Ownership mode this variant belongs to.
     */
    public abstract OwnershipMode mode();

    public static PayloadRef exclusive(MutableFeature feature) {
        return new Exclusive(Objects.requireNonNull(feature, "feature"));
    }

    public static PayloadRef shared(FeatureView feature) {
        return new Shared(Objects.requireNonNull(feature, "feature"));
    }

    /**
     * Exclusively owned mutable payload.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Exclusive extends PayloadRef {
        private final MutableFeature feature;

        @Override
        public FeatureView view() {
            return feature;
        }

        @Override
        public OwnershipMode mode() {
            return OwnershipMode.OWNING_MUTABLE;
        }
    }

    /**
     * Shared read-only payload.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
    public static final class Shared extends PayloadRef {
        private final FeatureView feature;

        @Override
        public FeatureView view() {
            return feature;
        }

        @Override
        public OwnershipMode mode() {
            return OwnershipMode.BORROWING_IMMUTABLE;
        }
    }
}
