package org.hourglass.map;

/**
 * Bit constants stored in a face's flag word.
 */
public final class FaceFlags {
    /** Face is protected; its contour edges carry {@link EdgeFlags#CONTOUR_PROTECTION}. */
    public static final int PROTECTED_FACE = 2;
    /** Seeded region growing: face belongs to a seed region. */
    public static final int SRG_SEED = 8;
    /** Seeded region growing: face is queued as a growth candidate. */
    public static final int SRG_BORDER = 16;

    public static final int FACE_USER = 0x100000;

    private FaceFlags() {
    }
}
