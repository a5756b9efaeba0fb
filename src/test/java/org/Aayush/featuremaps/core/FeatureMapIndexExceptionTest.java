package org.Aayush.featuremaps.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("FeatureMapIndexException Tests")
class FeatureMapIndexExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix")
    void testMessageFormat() {
        FeatureMapIndexException ex = new FeatureMapIndexException(
                FeatureMapIndexException.REASON_OUT_OF_RANGE,
                "id 7"
        );

        assertEquals("KD_OUT_OF_RANGE", ex.reasonCode());
        assertEquals("[KD_OUT_OF_RANGE] id 7", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Three-arg constructor keeps the cause")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        FeatureMapIndexException ex = new FeatureMapIndexException("TEST_REASON", "details", cause);

        assertEquals("TEST_REASON", ex.reasonCode());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or missing reason code is rejected")
    void testReasonCodeRequired() {
        assertThrows(IllegalArgumentException.class, () -> new FeatureMapIndexException(" ", "details"));
        assertThrows(NullPointerException.class, () -> new FeatureMapIndexException(null, "details"));
        assertThrows(NullPointerException.class, () -> new FeatureMapIndexException("CODE", null));
    }
}
