package org.hourglass.waterfall;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import org.hourglass.core.SegmentationException;
import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.GeoMap;
import org.hourglass.map.MapTopology;
import org.hourglass.merge.MergeTransaction;
import org.hourglass.srg.SeededRegionGrowing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Hierarchical watershed on the face adjacency graph.
 * <p>
 * <strong>One level:</strong>
 * <ol>
 * <li>Kruskal minimum spanning forest over faces, ties broken by edge label. Protected edges,
 * bridges and edges with a non-finite cost take no part.</li>
 * <li>Regional minima: MST edges strictly cheaper than every other MST edge on the contours of
 * both of their faces. Both faces are labelled with the edge label.</li>
 * <li>Static label propagation from the minima along MST edges only.</li>
 * <li>Commit: every unprotected edge between two faces with the same label is merged away.</li>
 * </ol>
 * Running levels on the coarsened map yields successively coarser segmentations.
 * </p>
 */
public final class Waterfall {
    private static final Logger LOGGER = LoggerFactory.getLogger(Waterfall.class);

    private final GeoMap map;
    private final DartCostFunction costFunction;
    private final WaterfallConfig config;

    public Waterfall(GeoMap map, DartCostFunction costFunction) {
        this(map, costFunction, WaterfallConfig.defaults());
    }

    public Waterfall(GeoMap map, DartCostFunction costFunction, WaterfallConfig config) {
        this.map = Objects.requireNonNull(map, "map");
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Computes the minimum spanning forest of the current map.
     *
     * @return cost per edge label for MST edges, {@link Double#NaN} for all others.
     */
    public double[] minimumSpanningForest() {
        int maxEdge = map.maxEdgeLabel();
        double[] edgeCosts = new double[maxEdge + 1];
        IntArrayList candidates = new IntArrayList();
        IntList edges = map.edgeLabels();
        for (int i = 0; i < edges.size(); i++) {
            int edge = edges.getInt(i);
            if (map.isProtected(edge) || map.isBridge(edge)) {
                continue;
            }
            double cost = costFunction.cost(map.dart(edge));
            if (DartCostFunction.isAllowed(cost)) {
                edgeCosts[edge] = cost;
                candidates.add(edge);
            }
        }

        int[] order = candidates.toIntArray();
        IntArrays.quickSort(order, (a, b) -> {
            int byCost = Double.compare(edgeCosts[a], edgeCosts[b]);
            return byCost != 0 ? byCost : Integer.compare(a, b);
        });

        double[] mstCosts = new double[maxEdge + 1];
        Arrays.fill(mstCosts, Double.NaN);
        FaceUnionFind regions = new FaceUnionFind(map.maxFaceLabel());
        for (int edge : order) {
            if (regions.union(map.leftFace(edge), map.rightFace(edge))) {
                mstCosts[edge] = edgeCosts[edge];
            }
        }
        return mstCosts;
    }

    /**
     * Returns the MST edges that are strict minima over the contours of both adjacent faces.
     */
    public IntList regionalMinima(double[] mstCosts) {
        IntArrayList minima = new IntArrayList();
        for (int edge = 1; edge < mstCosts.length; edge++) {
            if (Double.isNaN(mstCosts[edge])) {
                continue;
            }
            if (isStrictMinimum(edge, map.leftFace(edge), mstCosts)
                    && isStrictMinimum(edge, map.rightFace(edge), mstCosts)) {
                minima.add(edge);
            }
        }
        return minima;
    }

    private boolean isStrictMinimum(int edge, int face, double[] mstCosts) {
        double cost = mstCosts[edge];
        IntList darts = MapTopology.contourDarts(map, face);
        for (int i = 0; i < darts.size(); i++) {
            int other = Math.abs(darts.getInt(i));
            if (other != edge && !Double.isNaN(mstCosts[other]) && mstCosts[other] <= cost) {
                return false;
            }
        }
        return true;
    }

    /**
     * Runs one level and merges the resulting basins.
     *
     * @throws SegmentationException with {@link SegmentationException#REASON_UNEXPECTED_BRIDGE}
     *                               if an unprotected bridge is met during the commit.
     */
    public WaterfallLevel apply() {
        double[] mstCosts = minimumSpanningForest();
        IntList minima = regionalMinima(mstCosts);

        int[] faceLabels = new int[map.maxFaceLabel() + 1];
        for (int i = 0; i < minima.size(); i++) {
            int edge = minima.getInt(i);
            faceLabels[map.leftFace(edge)] = edge;
            faceLabels[map.rightFace(edge)] = edge;
        }
        DartCostFunction alongMst = dart -> {
            double cost = mstCosts[dart.edgeLabel()];
            return Double.isNaN(cost) ? DartCostFunction.NEVER : cost;
        };
        SeededRegionGrowing.propagateLabels(map, faceLabels, alongMst);
        int[] basins = faceLabels.clone();

        int merges = 0;
        IntList edges = map.edgeLabels();
        for (int i = 0; i < edges.size(); i++) {
            int edge = edges.getInt(i);
            if (!map.edgeExists(edge) || map.isProtected(edge)) {
                continue;
            }
            if (map.isBridge(edge)) {
                throw new SegmentationException(SegmentationException.REASON_UNEXPECTED_BRIDGE,
                        "edge " + edge + " is a bridge inside face " + map.leftFace(edge));
            }
            int label = faceLabels[map.leftFace(edge)];
            if (label == SeededRegionGrowing.UNLABELED || label != faceLabels[map.rightFace(edge)]) {
                continue;
            }
            int survivor = MergeTransaction.mergeFacesCompletely(map, map.dart(edge), config.isRemoveDegree2Nodes());
            if (survivor != GeoMap.NO_LABEL) {
                faceLabels[survivor] = label;
                merges++;
            }
        }
        LOGGER.info("waterfall level: {} MST minima, {} merges, {} faces left", minima.size(), merges, map.faceCount());
        return new WaterfallLevel(mstCosts, minima, basins, merges);
    }

    /**
     * Applies levels until one performs no merge or {@code maxLevels} levels have merged.
     *
     * @return the levels that performed at least one merge.
     */
    public List<WaterfallLevel> hierarchy(int maxLevels) {
        if (maxLevels < 0) {
            throw new IllegalArgumentException("maxLevels must be non-negative, got " + maxLevels);
        }
        List<WaterfallLevel> levels = new ArrayList<>();
        while (levels.size() < maxLevels) {
            WaterfallLevel level = apply();
            if (level.merges() == 0) {
                break;
            }
            levels.add(level);
        }
        return levels;
    }
}
