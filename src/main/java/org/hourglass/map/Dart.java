package org.hourglass.map;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Mutable handle on one oriented side of an edge.
 * <p>
 * Dart {@code +e} runs from the start node of edge {@code e} to its end node and has the edge's
 * left face on its left; {@code -e} is the opposite direction. The navigation methods move this
 * handle in place and return it, so orbits can be walked without allocation. Use {@link #copy()}
 * to keep a position.
 * </p>
 */
public final class Dart {
    private final GeoMap map;
    private int label;

    /**
     * Creates a dart handle. Prefer {@link GeoMap#dart(int)}.
     */
    public Dart(GeoMap map, int label) {
        this.map = Objects.requireNonNull(map, "map");
        if (label == 0) {
            throw new IllegalArgumentException("dart label must be non-zero");
        }
        this.label = label;
    }

    public GeoMap map() {
        return map;
    }

    public int label() {
        return label;
    }

    public int edgeLabel() {
        return Math.abs(label);
    }

    public Dart copy() {
        return new Dart(map, label);
    }

    // ========================================================================
    // NAVIGATION
    // ========================================================================

    /** Flips orientation. */
    public Dart nextAlpha() {
        label = -label;
        return this;
    }

    /** Rotates counter-clockwise to the next dart leaving the same node. */
    public Dart nextSigma() {
        return nextSigma(1);
    }

    public Dart nextSigma(int times) {
        label = map.nextSigma(label, times);
        return this;
    }

    public Dart prevSigma() {
        return nextSigma(-1);
    }

    /** Advances along the boundary of the left face. */
    public Dart nextPhi() {
        return nextAlpha().prevSigma();
    }

    public Dart prevPhi() {
        return nextSigma().nextAlpha();
    }

    // ========================================================================
    // INCIDENCE
    // ========================================================================

    public int startNodeLabel() {
        return map.startNode(label);
    }

    public int endNodeLabel() {
        return map.endNode(label);
    }

    public int leftFaceLabel() {
        return map.leftFace(label);
    }

    public int rightFaceLabel() {
        return map.rightFace(label);
    }

    public int edgeFlags() {
        return map.edgeFlags(edgeLabel());
    }

    public boolean isBridge() {
        return map.isBridge(edgeLabel());
    }

    // ========================================================================
    // ORBITS
    // ========================================================================

    /**
     * Darts leaving the start node in counter-clockwise order, beginning with this one.
     */
    public Iterable<Dart> sigmaOrbit() {
        int start = label;
        return () -> new OrbitIterator(map, start, d -> map.nextSigma(d, 1));
    }

    /**
     * Darts of the left face's contour in traversal order, beginning with this one.
     */
    public Iterable<Dart> phiOrbit() {
        int start = label;
        return () -> new OrbitIterator(map, start, map::nextPhi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dart)) return false;
        Dart other = (Dart) o;
        return label == other.label && map == other.map;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(map) + label;
    }

    @Override
    public String toString() {
        return "Dart(" + label + ")";
    }

    /**
     * Walks one orbit until the start label comes round again. Each step returns a fresh handle.
     */
    private static final class OrbitIterator implements Iterator<Dart> {
        private final GeoMap map;
        private final int start;
        private final IntUnaryOperator step;
        private int next;
        private boolean started;

        OrbitIterator(GeoMap map, int start, IntUnaryOperator step) {
            this.map = map;
            this.start = start;
            this.step = step;
            this.next = start;
        }

        @Override
        public boolean hasNext() {
            return !started || next != start;
        }

        @Override
        public Dart next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            started = true;
            int current = next;
            next = step.applyAsInt(current);
            return new Dart(map, current);
        }
    }
}
