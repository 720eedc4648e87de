package org.hourglass.cost;

import org.hourglass.map.CrackEdgeMaps;
import org.hourglass.map.Dart;
import org.hourglass.map.MapModificationCallback;
import org.hourglass.map.MemoryGeoMap;

import java.util.Objects;

/**
 * Per-face pixel count and mean intensity, kept current while faces merge.
 * <p>
 * Registers itself as a {@link MapModificationCallback}: the faces of a merge are captured in
 * {@link #preMergeFaces(Dart)} and their statistics combined into the survivor in
 * {@link #postMergeFaces(int)}.
 * </p>
 */
public final class FaceMeanStatistics implements MapModificationCallback {
    private final MemoryGeoMap map;
    private final long[] counts;
    private final double[] sums;
    private int pendingSurvivor = -1;
    private int pendingMerged = -1;

    private FaceMeanStatistics(MemoryGeoMap map) {
        this.map = map;
        this.counts = new long[map.maxFaceLabel() + 1];
        this.sums = new double[map.maxFaceLabel() + 1];
    }

    /**
     * Accumulates {@code image[y][x]} into the face covering each pixel and attaches to the map.
     */
    public static FaceMeanStatistics attach(MemoryGeoMap map, double[][] image) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(image, "image");
        FaceMeanStatistics statistics = new FaceMeanStatistics(map);
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[y].length; x++) {
                int face = CrackEdgeMaps.faceOfPixel(map, x, y);
                statistics.counts[face]++;
                statistics.sums[face] += image[y][x];
            }
        }
        map.addModificationCallback(statistics);
        return statistics;
    }

    public long pixelCount(int face) {
        return counts[face];
    }

    /**
     * Mean intensity of {@code face}, or {@link Double#NaN} if it covers no pixel.
     */
    public double mean(int face) {
        return counts[face] == 0 ? Double.NaN : sums[face] / counts[face];
    }

    /**
     * Merge cost: absolute difference of the two face means; bridges cost {@link DartCostFunction#NEVER}.
     */
    public DartCostFunction meanDifferenceCost() {
        return dart -> {
            int left = dart.leftFaceLabel();
            int right = dart.rightFaceLabel();
            if (left == right) {
                return DartCostFunction.NEVER;
            }
            double difference = Math.abs(mean(left) - mean(right));
            return Double.isNaN(difference) ? DartCostFunction.NEVER : difference;
        };
    }

    @Override
    public boolean preMergeFaces(Dart dart) {
        pendingSurvivor = dart.leftFaceLabel();
        pendingMerged = dart.rightFaceLabel();
        return true;
    }

    @Override
    public void postMergeFaces(int survivorFace) {
        int other = survivorFace == pendingSurvivor ? pendingMerged : pendingSurvivor;
        counts[survivorFace] += counts[other];
        sums[survivorFace] += sums[other];
        counts[other] = 0;
        sums[other] = 0.0;
        pendingSurvivor = -1;
        pendingMerged = -1;
    }

    @Override
    public String toString() {
        return "FaceMeanStatistics[faces=" + map.faceCount() + "]";
    }
}
