package org.hourglass.srg;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.hourglass.core.SegmentationException;
import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.FaceFlags;
import org.hourglass.map.GeoMap;
import org.hourglass.map.MapTopology;
import org.hourglass.merge.MergeTransaction;
import org.hourglass.search.CostQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Seeded region growing on faces.
 * <p>
 * Faces flagged {@link FaceFlags#SRG_SEED} form the initial regions. Their non-seed neighbours
 * are queued by absorption cost and flagged {@link FaceFlags#SRG_BORDER}. Each growth step
 * absorbs the cheapest candidate into its cheapest adjacent seed region via
 * {@link MergeTransaction#mergeFacesCompletely(GeoMap, org.hourglass.map.Dart, boolean)}.
 * </p>
 * <p>
 * Costs are evaluated on the dart that has the seed region on its left. Neighbours are only
 * reached across unprotected edges with a finite cost.
 * </p>
 */
public final class SeededRegionGrowing {
    private static final Logger LOGGER = LoggerFactory.getLogger(SeededRegionGrowing.class);

    /** Face label value meaning "no label yet" in {@link #propagateLabels}. */
    public static final int UNLABELED = 0;

    @Getter
    @Accessors(fluent = true)
    private final GeoMap map;
    private final DartCostFunction costFunction;
    private final SeededRegionGrowingConfig config;
    private final CostQueue queue;
    private final IntArrayList absorbedFaces = new IntArrayList();
    private final DoubleArrayList costLog = new DoubleArrayList();

    /**
     * Number of faces absorbed so far.
     */
    @Getter
    @Accessors(fluent = true)
    private int step;

    public SeededRegionGrowing(GeoMap map, DartCostFunction costFunction) {
        this(map, costFunction, SeededRegionGrowingConfig.defaults());
    }

    /**
     * Queues the neighbours of all seed faces.
     *
     * @throws SegmentationException with {@link SegmentationException#REASON_NO_SEEDS} if no face
     *                               is flagged as seed.
     */
    public SeededRegionGrowing(GeoMap map, DartCostFunction costFunction, SeededRegionGrowingConfig config) {
        this.map = Objects.requireNonNull(map, "map");
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
        this.config = Objects.requireNonNull(config, "config");
        this.queue = new CostQueue(map.maxFaceLabel());

        IntList faces = map.faceLabels();
        int seeds = 0;
        for (int i = 0; i < faces.size(); i++) {
            int face = faces.getInt(i);
            if (map.isSeed(face)) {
                seeds++;
                queueNeighbours(face);
            }
        }
        if (seeds == 0) {
            throw new SegmentationException(SegmentationException.REASON_NO_SEEDS,
                    "seeded region growing needs at least one face flagged as seed");
        }
        LOGGER.debug("SRG ({}) initialized with {} seeds and {} candidates", config.getPolicy(), seeds, queue.size());
    }

    /**
     * Absorbs the cheapest candidate face into an adjacent seed region.
     * <p>
     * Stale candidates (merged away or already seeds) are discarded. A candidate without any
     * mergeable seed neighbour loses its border flag and is skipped.
     * </p>
     *
     * @return false once the queue is exhausted.
     */
    public boolean growStep() {
        while (!queue.isEmpty()) {
            CostQueue.Entry entry = queue.pop();
            int face = entry.label();
            if (!map.faceExists(face) || map.isSeed(face)) {
                continue;
            }

            IntArrayList darts = new IntArrayList();
            DoubleArrayList costs = new DoubleArrayList();
            collectSeedDarts(face, darts, costs);

            while (!darts.isEmpty()) {
                int best = cheapest(darts, costs);
                int dart = darts.getInt(best);
                double cost = costs.getDouble(best);
                darts.removeInt(best);
                costs.removeDouble(best);

                if (!map.edgeExists(Math.abs(dart))) {
                    continue;
                }
                int seed = map.leftFace(dart);
                int survivor = MergeTransaction.mergeFacesCompletely(map, map.dart(dart), config.isRemoveDegree2Nodes());
                if (survivor == GeoMap.NO_LABEL) {
                    continue;
                }
                map.setFaceFlags(survivor, FaceFlags.SRG_SEED, true);
                map.setFaceFlags(survivor, FaceFlags.SRG_BORDER, false);
                step++;
                if (config.isRecordCosts()) {
                    absorbedFaces.add(face);
                    costLog.add(entry.cost());
                }
                LOGGER.debug("step {}: face {} absorbed by seed {} (cost {}), survivor {}", step, face, seed, cost, survivor);
                queueNeighbours(survivor);
                return true;
            }

            map.setFaceFlags(face, FaceFlags.SRG_BORDER, false);
            LOGGER.debug("face {} has no mergeable seed neighbour", face);
        }
        return false;
    }

    /**
     * Grows until the queue is exhausted.
     *
     * @return number of absorbed faces.
     */
    public int grow() {
        int before = step;
        while (growStep()) {
            // each step absorbs one face
        }
        int merges = step - before;
        LOGGER.info("SRG ({}): {} faces absorbed, {} faces left", config.getPolicy(), merges, map.faceCount());
        return merges;
    }

    /**
     * Labels of the absorbed faces in absorption order (empty unless costs are recorded).
     */
    public IntList absorbedFaces() {
        return IntLists.unmodifiable(absorbedFaces);
    }

    /**
     * Queue costs at which the faces in {@link #absorbedFaces()} were popped.
     */
    public DoubleList costLog() {
        return DoubleLists.unmodifiable(costLog);
    }

    public GrowthPolicy policy() {
        return config.getPolicy();
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private void queueNeighbours(int seed) {
        IntList darts = MapTopology.contourDarts(map, seed);
        for (int i = 0; i < darts.size(); i++) {
            int dart = darts.getInt(i);
            int neighbour = map.rightFace(dart);
            if (neighbour == seed || map.isSeed(neighbour) || map.isProtected(Math.abs(dart))) {
                continue;
            }
            if (config.getPolicy() == GrowthPolicy.DYNAMIC) {
                double cost = cheapestSeedCost(neighbour);
                if (DartCostFunction.isAllowed(cost)) {
                    queue.setCost(neighbour, cost);
                    map.setFaceFlags(neighbour, FaceFlags.SRG_BORDER, true);
                }
            } else if (!map.isBorderCandidate(neighbour)) {
                double cost = costFunction.cost(map.dart(dart));
                if (DartCostFunction.isAllowed(cost)) {
                    queue.insert(neighbour, cost);
                    map.setFaceFlags(neighbour, FaceFlags.SRG_BORDER, true);
                }
            }
        }
    }

    private double cheapestSeedCost(int face) {
        IntArrayList darts = new IntArrayList();
        DoubleArrayList costs = new DoubleArrayList();
        collectSeedDarts(face, darts, costs);
        return darts.isEmpty() ? DartCostFunction.NEVER : costs.getDouble(cheapest(darts, costs));
    }

    /**
     * Collects the seed-side darts across which {@code face} could be absorbed.
     */
    private void collectSeedDarts(int face, IntArrayList darts, DoubleArrayList costs) {
        IntList contour = MapTopology.contourDarts(map, face);
        for (int i = 0; i < contour.size(); i++) {
            int seedDart = -contour.getInt(i);
            int seed = map.leftFace(seedDart);
            if (seed == face || !map.isSeed(seed) || map.isProtected(Math.abs(seedDart))) {
                continue;
            }
            double cost = costFunction.cost(map.dart(seedDart));
            if (DartCostFunction.isAllowed(cost)) {
                darts.add(seedDart);
                costs.add(cost);
            }
        }
    }

    private static int cheapest(IntList darts, DoubleList costs) {
        int best = 0;
        for (int i = 1; i < darts.size(); i++) {
            int byCost = Double.compare(costs.getDouble(i), costs.getDouble(best));
            if (byCost < 0 || (byCost == 0 && Math.abs(darts.getInt(i)) < Math.abs(darts.getInt(best)))) {
                best = i;
            }
        }
        return best;
    }

    // ========================================================================
    // LABEL PROPAGATION
    // ========================================================================

    /**
     * Static region growing on a face label array, without touching the topology.
     * <p>
     * Faces with a label other than {@link #UNLABELED} act as seeds. Every unlabeled face
     * inherits the label of the neighbour through which it was first reached, in order of the
     * cost assigned at that moment. Protected edges and non-finite costs are never crossed.
     * </p>
     *
     * @param faceLabels label per face label, updated in place.
     * @return number of faces that received a label.
     */
    public static int propagateLabels(GeoMap map, int[] faceLabels, DartCostFunction costFunction) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(faceLabels, "faceLabels");
        Objects.requireNonNull(costFunction, "costFunction");
        if (faceLabels.length <= map.maxFaceLabel()) {
            throw new IllegalArgumentException("faceLabels must cover face labels up to " + map.maxFaceLabel());
        }

        CostQueue queue = new CostQueue(map.maxFaceLabel());
        boolean[] reached = new boolean[map.maxFaceLabel() + 1];
        int[] pendingLabel = new int[map.maxFaceLabel() + 1];

        IntList faces = map.faceLabels();
        for (int i = 0; i < faces.size(); i++) {
            int face = faces.getInt(i);
            if (faceLabels[face] != UNLABELED) {
                reached[face] = true;
            }
        }
        for (int i = 0; i < faces.size(); i++) {
            int face = faces.getInt(i);
            if (faceLabels[face] != UNLABELED) {
                reachNeighbours(map, face, faceLabels[face], costFunction, queue, reached, pendingLabel);
            }
        }

        int labelled = 0;
        while (!queue.isEmpty()) {
            int face = queue.pop().label();
            faceLabels[face] = pendingLabel[face];
            labelled++;
            reachNeighbours(map, face, faceLabels[face], costFunction, queue, reached, pendingLabel);
        }
        return labelled;
    }

    private static void reachNeighbours(GeoMap map, int face, int label, DartCostFunction costFunction,
                                        CostQueue queue, boolean[] reached, int[] pendingLabel) {
        IntList darts = MapTopology.contourDarts(map, face);
        for (int i = 0; i < darts.size(); i++) {
            int dart = darts.getInt(i);
            int neighbour = map.rightFace(dart);
            if (reached[neighbour] || map.isProtected(Math.abs(dart))) {
                continue;
            }
            double cost = costFunction.cost(map.dart(dart));
            if (DartCostFunction.isAllowed(cost)) {
                reached[neighbour] = true;
                pendingLabel[neighbour] = label;
                queue.insert(neighbour, cost);
            }
        }
    }
}
