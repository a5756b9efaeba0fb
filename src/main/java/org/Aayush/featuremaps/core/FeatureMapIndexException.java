package org.Aayush.featuremaps.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Feature-map index contract exception with deterministic reason codes.
 *
 * <p>All failures are raised before any index state is mutated.</p>
 */
@Getter
@Accessors(fluent = true)
public final class FeatureMapIndexException extends RuntimeException {
    public static final String REASON_OWNERSHIP_CONFLICT = "KD_OWNERSHIP_CONFLICT";
    public static final String REASON_MODE_ERROR = "KD_MODE_ERROR";
    public static final String REASON_OUT_OF_RANGE = "KD_OUT_OF_RANGE";
    public static final String REASON_SHAPE_MISMATCH = "KD_SHAPE_MISMATCH";
    public static final String REASON_INVALID_FEATURE = "KD_INVALID_FEATURE";
    public static final String REASON_INVALID_TOLERANCE = "KD_INVALID_TOLERANCE";
    public static final String REASON_INVALID_TRANSFORM = "KD_INVALID_TRANSFORM";

    private final String reasonCode;

    /**
     * Creates a reason-coded index failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public FeatureMapIndexException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded index failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public FeatureMapIndexException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
