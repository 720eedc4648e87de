package org.hourglass.map;

/**
 * Bit constants stored in an edge's flag word.
 * <p>
 * The low byte is reserved for protection bits. Algorithms should not test these bits directly;
 * use {@link GeoMap#isProtected(int)} and {@link GeoMap#isCurrentContour(int)}.
 * </p>
 */
public final class EdgeFlags {
    public static final int BORDER_PROTECTION = 1;
    public static final int SCISSOR_PROTECTION = 2;
    /** Set on the contour of a face flagged {@link FaceFlags#PROTECTED_FACE}. */
    public static final int CONTOUR_PROTECTION = 4;
    public static final int CUSTOM_PROTECTION = 8;
    public static final int COLUMN_PROTECTION = 16;
    public static final int ALL_PROTECTION = 0xff;

    /** Edge belongs to the live-wire contour currently being traced. */
    public static final int CURRENT_CONTOUR = 2048;

    public static final int EDGE_USER = 0x100000;

    private EdgeFlags() {
    }
}
