package org.hourglass.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Segmentation Exception Tests")
class SegmentationExceptionTest {

    @Test
    @DisplayName("Message is prefixed with the reason code")
    void testMessage() {
        SegmentationException ex = new SegmentationException(SegmentationException.REASON_NO_SEEDS, "nothing to grow");

        assertEquals("HG_NO_SEEDS", ex.reasonCode());
        assertEquals("[HG_NO_SEEDS] nothing to grow", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        SegmentationException ex = new SegmentationException(SegmentationException.REASON_INVALID_MAP, "broken", cause);

        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank reason codes are rejected")
    void testBlankCode() {
        assertThrows(IllegalArgumentException.class, () -> new SegmentationException(" ", "message"));
        assertThrows(NullPointerException.class, () -> new SegmentationException(null, "message"));
    }
}
