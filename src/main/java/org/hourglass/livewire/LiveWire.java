package org.hourglass.livewire;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.hourglass.core.SegmentationException;
import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.Dart;
import org.hourglass.map.EdgeFlags;
import org.hourglass.map.GeoMap;
import org.hourglass.search.CostQueue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Incremental single-source shortest paths over the darts of a map.
 * <p>
 * <strong>Label-setting search:</strong> the frontier is a {@link CostQueue} keyed by dart, so
 * several darts may compete for the same node. A node is settled by the first (cheapest) dart
 * that reaches it; later darts into that node are discarded. Each {@link #expandBorder()} call is
 * one bounded unit of work, so an interactive caller can interleave expansion with other work
 * and query any settled node at any time.
 * </p>
 * <p>
 * Edges flagged {@link EdgeFlags#CURRENT_CONTOUR} are never used. Edges flagged
 * {@link EdgeFlags#BORDER_PROTECTION} may leave the start node but are not expanded further.
 * Darts with a non-finite cost are not traversable.
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
public final class LiveWire {
    private static final int NO_DART = 0;

    private final GeoMap map;
    private final DartCostFunction costFunction;

    @Getter
    @Accessors(fluent = true)
    private final int startNodeLabel;

    @Getter
    @Accessors(fluent = true)
    private int endNodeLabel;

    /**
     * Cost of the most recently popped frontier entry; never decreases.
     */
    @Getter
    @Accessors(fluent = true)
    private double lastExpandedCost = 0.0;

    // Per-node best cost and incoming dart. NaN cost means "not reached".
    private final double[] nodeCosts;
    private final int[] incomingDarts;

    // Frontier indexed by dart + maxEdgeLabel
    private final CostQueue frontier;
    private final int dartOffset;

    /**
     * Starts a search at {@code startNodeLabel} and queues every usable dart leaving it.
     *
     * @throws IllegalArgumentException if the start node does not exist.
     */
    public LiveWire(GeoMap map, DartCostFunction costFunction, int startNodeLabel) {
        this.map = Objects.requireNonNull(map, "map");
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
        if (!map.nodeExists(startNodeLabel)) {
            throw new IllegalArgumentException("Start node " + startNodeLabel + " does not exist");
        }
        this.startNodeLabel = startNodeLabel;
        this.endNodeLabel = startNodeLabel;

        this.nodeCosts = new double[map.maxNodeLabel() + 1];
        Arrays.fill(nodeCosts, Double.NaN);
        this.incomingDarts = new int[map.maxNodeLabel() + 1];
        this.dartOffset = map.maxEdgeLabel();
        this.frontier = new CostQueue(2 * dartOffset);

        nodeCosts[startNodeLabel] = 0.0;
        incomingDarts[startNodeLabel] = NO_DART;
        if (map.nodeDegree(startNodeLabel) > 0) {
            for (Dart dart : map.dart(map.nodeAnchor(startNodeLabel)).sigmaOrbit()) {
                if (map.isCurrentContour(dart.edgeLabel())) {
                    continue;
                }
                push(dart, 0.0);
            }
        }
    }

    // ========================================================================
    // EXPANSION
    // ========================================================================

    /**
     * Pops the cheapest frontier dart and settles its end node if still unreached.
     *
     * @return false once the frontier is exhausted.
     */
    public boolean expandBorder() {
        if (frontier.isEmpty()) {
            return false;
        }
        CostQueue.Entry entry = frontier.pop();
        int dart = entry.label() - dartOffset;
        lastExpandedCost = entry.cost();
        int endNode = map.endNode(dart);
        if (Double.isNaN(nodeCosts[endNode])) {
            nodeCosts[endNode] = entry.cost();
            incomingDarts[endNode] = dart;
            expandNode(endNode);
        }
        return true;
    }

    /**
     * Expands until {@code node} is reached.
     *
     * @return false if the frontier ran dry first.
     */
    public boolean expandToNode(int node) {
        checkNode(node);
        while (!isReached(node)) {
            if (!expandBorder()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Expands until every path cheaper than {@code cost} is known.
     *
     * @return true if frontier entries remain.
     */
    public boolean expandToCost(double cost) {
        while (!frontier.isEmpty() && frontier.topCost() < cost) {
            expandBorder();
        }
        return !frontier.isEmpty();
    }

    /**
     * Expands until the frontier is exhausted.
     */
    public void expand() {
        while (expandBorder()) {
            // settle everything reachable
        }
    }

    private void expandNode(int node) {
        double base = nodeCosts[node];
        Iterator<Dart> orbit = map.dart(-incomingDarts[node]).sigmaOrbit().iterator();
        orbit.next(); // the dart we came along
        while (orbit.hasNext()) {
            Dart dart = orbit.next();
            int edge = dart.edgeLabel();
            if (map.isCurrentContour(edge) || map.isBorderProtected(edge)) {
                continue;
            }
            push(dart, base);
        }
    }

    private void push(Dart dart, double base) {
        double cost = costFunction.cost(dart);
        if (DartCostFunction.isAllowed(cost)) {
            frontier.insert(dart.label() + dartOffset, base + cost);
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public boolean isReached(int node) {
        checkNode(node);
        return !Double.isNaN(nodeCosts[node]);
    }

    /**
     * Returns whether frontier entries remain.
     */
    public boolean hasFrontier() {
        return !frontier.isEmpty();
    }

    /**
     * Makes {@code node} the end of the current path if it has been reached. Never expands.
     *
     * @return true if the end node was changed.
     */
    public boolean setEndNodeLabel(int node) {
        if (!isReached(node)) {
            return false;
        }
        endNodeLabel = node;
        return true;
    }

    /**
     * Darts of the optimal path from {@code node} back to the start node. Every dart points
     * towards the start. The sequence is computed lazily on iteration.
     *
     * @throws SegmentationException with {@link SegmentationException#REASON_NODE_NOT_REACHED}
     *                               if {@code node} has not been reached yet.
     */
    public Iterable<Dart> pathDarts(int node) {
        requireReached(node);
        return () -> new PathIterator(node);
    }

    public Iterable<Dart> pathDarts() {
        return pathDarts(endNodeLabel);
    }

    /**
     * If the optimal path to {@code node} passes the current end node, returns its part from
     * {@code node} back to the end node (e.g. to close a loop); otherwise an empty list.
     */
    public List<Dart> loopPath(int node) {
        List<Dart> result = new ArrayList<>();
        if (!isReached(node)) {
            return result;
        }
        for (Dart dart : pathDarts(node)) {
            result.add(dart);
            if (dart.endNodeLabel() == endNodeLabel) {
                return result;
            }
        }
        return new ArrayList<>();
    }

    /**
     * Cost of the optimal path to {@code node}.
     *
     * @throws SegmentationException if {@code node} has not been reached yet.
     */
    public double totalCost(int node) {
        requireReached(node);
        return nodeCosts[node];
    }

    public double totalCost() {
        return totalCost(endNodeLabel);
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeCosts.length) {
            throw new IllegalArgumentException("Node " + node + " out of bounds [0, " + nodeCosts.length + ")");
        }
    }

    private void requireReached(int node) {
        if (!isReached(node)) {
            throw new SegmentationException(SegmentationException.REASON_NODE_NOT_REACHED,
                    "node " + node + " has not been reached from node " + startNodeLabel);
        }
    }

    /**
     * Follows incoming darts from a settled node back to the start.
     */
    private final class PathIterator implements Iterator<Dart> {
        private int node;

        PathIterator(int node) {
            this.node = node;
        }

        @Override
        public boolean hasNext() {
            return node != startNodeLabel;
        }

        @Override
        public Dart next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Dart dart = map.dart(-incomingDarts[node]);
            node = dart.endNodeLabel();
            return dart;
        }
    }
}
