package org.Aayush.featuremaps.store;

/**
 * Ownership regime of the feature payloads held by one store instance.
 *
 * <p>Fixed at construction. Every ingestion path and payload accessor is checked against it.</p>
 */
public enum OwnershipMode {
    /** Payloads are mutable features the index may hand back for modification. */
    OWNING_MUTABLE,
    /** Payloads are read-only views; no mutable handle is ever returned. */
    BORROWING_IMMUTABLE
}
