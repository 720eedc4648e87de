package org.hourglass.app;

import org.hourglass.cost.FaceMeanStatistics;
import org.hourglass.map.CrackEdgeMaps;
import org.hourglass.map.FaceFlags;
import org.hourglass.map.MemoryGeoMap;
import org.hourglass.merge.AutomaticRegionMerger;
import org.hourglass.srg.SeededRegionGrowing;
import org.hourglass.waterfall.Waterfall;
import org.hourglass.waterfall.WaterfallLevel;

import java.util.List;

/**
 * Smoke run: segments a synthetic two-region image with each batch algorithm.
 */
public class Main {
    static final int SIZE = 8;
    static final double MERGE_THRESHOLD = 50.0;

    /**
     * Prints face counts (including the infinite face) for each stage.
     *
     * @param args ignored.
     */
    public static void main(String[] args) {
        double[][] image = syntheticImage(SIZE);
        System.out.println("pixel faces: " + CrackEdgeMaps.pixelGrid(SIZE, SIZE).faceCount());

        MemoryGeoMap merged = CrackEdgeMaps.pixelGrid(SIZE, SIZE);
        FaceMeanStatistics mergedStats = FaceMeanStatistics.attach(merged, image);
        new AutomaticRegionMerger(merged, mergedStats.meanDifferenceCost()).mergeToCost(MERGE_THRESHOLD);
        System.out.println("region merging: " + merged.faceCount() + " faces");

        MemoryGeoMap grown = CrackEdgeMaps.pixelGrid(SIZE, SIZE);
        FaceMeanStatistics grownStats = FaceMeanStatistics.attach(grown, image);
        grown.setFaceFlags(CrackEdgeMaps.faceOfPixel(grown, 0, 0), FaceFlags.SRG_SEED, true);
        grown.setFaceFlags(CrackEdgeMaps.faceOfPixel(grown, SIZE - 1, SIZE - 1), FaceFlags.SRG_SEED, true);
        new SeededRegionGrowing(grown, grownStats.meanDifferenceCost()).grow();
        System.out.println("seeded region growing: " + grown.faceCount() + " faces");

        MemoryGeoMap flooded = CrackEdgeMaps.pixelGrid(SIZE, SIZE);
        FaceMeanStatistics floodedStats = FaceMeanStatistics.attach(flooded, image);
        List<WaterfallLevel> levels = new Waterfall(flooded, floodedStats.meanDifferenceCost()).hierarchy(SIZE);
        for (int i = 0; i < levels.size(); i++) {
            System.out.println("waterfall level " + (i + 1) + ": " + levels.get(i).merges() + " merges");
        }
        System.out.println("waterfall: " + flooded.faceCount() + " faces");
    }

    /**
     * Dark left half and bright right half with a small deterministic texture.
     */
    static double[][] syntheticImage(int size) {
        double[][] image = new double[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                double base = x < size / 2 ? 10.0 : 200.0;
                image[y][x] = base + (x + 2 * y) % 3;
            }
        }
        return image;
    }
}
