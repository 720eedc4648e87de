package org.hourglass.merge;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.GeoMap;
import org.hourglass.map.MapTopology;
import org.hourglass.search.CostQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Greedy global region merging: always removes the cheapest remaining edge.
 * <p>
 * <strong>Algorithm Invariants:</strong>
 * <ul>
 * <li>The queue is keyed by edge label and lags behind the map. Every popped edge is re-checked
 * for existence and protection before anything is mutated.</li>
 * <li>After a merge the costs of all darts around the survivor are recomputed; edges whose cost
 * became non-finite are invalidated in the queue.</li>
 * <li>Equal costs are resolved by ascending edge label, so two runs on equal maps produce equal
 * results.</li>
 * </ul>
 * </p>
 */
public final class AutomaticRegionMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutomaticRegionMerger.class);

    @Getter
    @Accessors(fluent = true)
    private final GeoMap map;
    private final DartCostFunction costFunction;
    private final AutomaticRegionMergerConfig config;
    private final CostQueue queue;
    private final DoubleArrayList costLog = new DoubleArrayList();

    /**
     * Number of successful merge steps so far.
     */
    @Getter
    @Accessors(fluent = true)
    private int step;

    public AutomaticRegionMerger(GeoMap map, DartCostFunction costFunction) {
        this(map, costFunction, AutomaticRegionMergerConfig.defaults());
    }

    public AutomaticRegionMerger(GeoMap map, DartCostFunction costFunction, AutomaticRegionMergerConfig config) {
        this.map = Objects.requireNonNull(map, "map");
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
        this.config = Objects.requireNonNull(config, "config");
        this.queue = new CostQueue(map.maxEdgeLabel());

        IntList edges = map.edgeLabels();
        for (int i = 0; i < edges.size(); i++) {
            int edge = edges.getInt(i);
            double cost = costFunction.cost(map.dart(edge));
            if (DartCostFunction.isAllowed(cost)) {
                queue.insert(edge, cost);
            }
        }
        LOGGER.debug("AutomaticRegionMerger initialized with {} of {} edges", queue.size(), edges.size());
    }

    /**
     * Pops the cheapest edge and removes it.
     * <p>
     * Vanished and protected edges are discarded without consuming a step. A bridge is removed
     * with {@link GeoMap#removeBridge} as cleanup; this changes no face and does not count as a
     * step either.
     * </p>
     *
     * @return true if two faces were merged.
     */
    public boolean mergeStep() {
        if (queue.isEmpty()) {
            return false;
        }
        CostQueue.Entry entry = queue.pop();
        int edge = entry.label();
        if (!map.edgeExists(edge) || map.isProtected(edge)) {
            LOGGER.debug("skipping stale or protected edge {}", edge);
            return false;
        }
        if (map.isBridge(edge)) {
            int face = map.removeBridge(map.dart(edge));
            LOGGER.debug("removed bridge {} inside face {}", edge, face);
            return false;
        }

        int survivor = MergeTransaction.mergeFacesCompletely(map, map.dart(edge), config.isRemoveDegree2Nodes());
        if (survivor == GeoMap.NO_LABEL) {
            LOGGER.debug("merge across edge {} refused", edge);
            return false;
        }

        IntList darts = MapTopology.contourDarts(map, survivor);
        for (int i = 0; i < darts.size(); i++) {
            int dart = darts.getInt(i);
            int contourEdge = Math.abs(dart);
            double cost = costFunction.cost(map.dart(dart));
            if (DartCostFunction.isAllowed(cost)) {
                queue.setCost(contourEdge, cost);
            } else {
                queue.invalidate(contourEdge);
            }
        }

        step++;
        if (config.isRecordCosts()) {
            costLog.add(entry.cost());
        }
        LOGGER.debug("step {}: merged across edge {} (cost {}) into face {}", step, edge, entry.cost(), survivor);
        return true;
    }

    /**
     * Merges while the cheapest queued cost is strictly below {@code maxCost}.
     *
     * @return number of merges performed.
     */
    public int mergeToCost(double maxCost) {
        int merges = 0;
        while (!queue.isEmpty() && queue.topCost() < maxCost) {
            if (mergeStep()) {
                merges++;
            }
        }
        LOGGER.info("mergeToCost({}): {} merges, {} faces left", maxCost, merges, map.faceCount());
        return merges;
    }

    /**
     * Merges until {@link #step()} reaches {@code targetStep} or the queue runs dry.
     *
     * @return number of merges performed.
     */
    public int mergeToStep(int targetStep) {
        int merges = 0;
        while (step < targetStep && !queue.isEmpty()) {
            if (mergeStep()) {
                merges++;
            }
        }
        LOGGER.info("mergeToStep({}): {} merges, {} faces left", targetStep, merges, map.faceCount());
        return merges;
    }

    /**
     * Merges until no mergeable edge is left.
     *
     * @return number of merges performed.
     */
    public int merge() {
        int merges = 0;
        while (!queue.isEmpty()) {
            if (mergeStep()) {
                merges++;
            }
        }
        LOGGER.info("merge(): {} merges, {} faces left", merges, map.faceCount());
        return merges;
    }

    /**
     * Returns whether queued candidates remain.
     */
    public boolean hasCandidates() {
        return !queue.isEmpty();
    }

    /**
     * Cheapest queued cost, or {@link Double#POSITIVE_INFINITY} if nothing is queued.
     */
    public double nextCost() {
        return queue.topCost();
    }

    /**
     * Costs of all merge steps so far; empty unless enabled in the configuration.
     */
    public DoubleList costLog() {
        return DoubleLists.unmodifiable(costLog);
    }
}
