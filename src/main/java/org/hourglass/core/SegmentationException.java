package org.hourglass.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Invariant violation raised by the merging, growing and path engines.
 *
 * <p>Ordinary refusals (protected edges, stale queue entries) never surface as exceptions.
 * This type is reserved for states that would otherwise leave the map corrupt. Messages are
 * prefixed with a deterministic reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SegmentationException extends RuntimeException {
    public static final String REASON_NO_COMMON_EDGE = "HG_NO_COMMON_EDGE";
    public static final String REASON_BRIDGE_REMOVAL_FAILED = "HG_BRIDGE_REMOVAL_FAILED";
    public static final String REASON_NO_SEEDS = "HG_NO_SEEDS";
    public static final String REASON_UNEXPECTED_BRIDGE = "HG_UNEXPECTED_BRIDGE";
    public static final String REASON_NODE_NOT_REACHED = "HG_NODE_NOT_REACHED";
    public static final String REASON_INVALID_MAP = "HG_INVALID_MAP";

    private final String reasonCode;

    /**
     * Creates a reason-coded invariant failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public SegmentationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded invariant failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public SegmentationException(String reasonCode, String message, Throwable cause) {
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
