package org.hourglass.map;

import java.util.Arrays;
import java.util.Objects;

/**
 * Builds crack-edge maps from label images.
 * <p>
 * Pixel {@code (x, y)} covers the unit square {@code [x, x+1] x [y, y+1]}. Edges run along the
 * cracks between pixels of different labels and around the image border; border edges carry
 * {@link EdgeFlags#BORDER_PROTECTION}. Chains of degree-2 nodes are fused, so every edge of the
 * result runs from junction to junction (closed contours keep a single node).
 * </p>
 */
public final class CrackEdgeMaps {

    private CrackEdgeMaps() {
    }

    /**
     * Creates a map with one face per 4-connected region of equal labels.
     *
     * @param labels row-major label image, {@code labels[y][x]}.
     */
    public static MemoryGeoMap fromLabelImage(int[][] labels) {
        Objects.requireNonNull(labels, "labels");
        int height = labels.length;
        if (height == 0 || labels[0].length == 0) {
            throw new IllegalArgumentException("label image must not be empty");
        }
        int width = labels[0].length;
        for (int[] row : labels) {
            if (row.length != width) {
                throw new IllegalArgumentException("label image rows must have equal length");
            }
        }

        int columns = width + 1;
        int[] nodeOfPoint = new int[columns * (height + 1)];
        Arrays.fill(nodeOfPoint, -1);
        MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
        int edgeCount = 0;
        boolean[] border = new boolean[2 * columns * (height + 1) + 1];

        // horizontal cracks from (x, y) to (x + 1, y)
        for (int y = 0; y <= height; y++) {
            for (int x = 0; x < width; x++) {
                boolean imageBorder = y == 0 || y == height;
                if (imageBorder || labels[y - 1][x] != labels[y][x]) {
                    int start = node(builder, nodeOfPoint, columns, x, y);
                    int end = node(builder, nodeOfPoint, columns, x + 1, y);
                    edgeCount = builder.addEdge(start, end);
                    border[edgeCount] = imageBorder;
                }
            }
        }
        // vertical cracks from (x, y) to (x, y + 1)
        for (int y = 0; y < height; y++) {
            for (int x = 0; x <= width; x++) {
                boolean imageBorder = x == 0 || x == width;
                if (imageBorder || labels[y][x - 1] != labels[y][x]) {
                    int start = node(builder, nodeOfPoint, columns, x, y);
                    int end = node(builder, nodeOfPoint, columns, x, y + 1);
                    edgeCount = builder.addEdge(start, end);
                    border[edgeCount] = imageBorder;
                }
            }
        }

        MemoryGeoMap map = builder.build();
        for (int edge = 1; edge <= edgeCount; edge++) {
            if (border[edge]) {
                map.setEdgeFlags(edge, EdgeFlags.BORDER_PROTECTION, true);
            }
        }
        fuseChains(map);
        return map;
    }

    /**
     * Creates a map with one face per pixel.
     */
    public static MemoryGeoMap pixelGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid size must be positive, got " + width + "x" + height);
        }
        int[][] labels = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                labels[y][x] = y * width + x;
            }
        }
        return fromLabelImage(labels);
    }

    /**
     * Returns the face covering the center of pixel {@code (x, y)}.
     */
    public static int faceOfPixel(MemoryGeoMap map, int x, int y) {
        return map.faceAt(x + 0.5, y + 0.5);
    }

    private static int node(MemoryGeoMap.Builder builder, int[] nodeOfPoint, int columns, int x, int y) {
        int point = y * columns + x;
        if (nodeOfPoint[point] < 0) {
            nodeOfPoint[point] = builder.addNode(x, y);
        }
        return nodeOfPoint[point];
    }

    private static void fuseChains(MemoryGeoMap map) {
        for (int node : map.nodeLabels()) {
            if (map.nodeExists(node) && map.nodeDegree(node) == 2) {
                map.mergeEdges(map.dart(map.nodeAnchor(node)));
            }
        }
    }
}
