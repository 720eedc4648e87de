package org.hourglass.map;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Planar subdivision as seen by the merging, growing and path engines.
 * <p>
 * Cells are addressed by integer labels. Node labels start at 0, edge labels at 1 (dart labels
 * are {@code +edge} and {@code -edge}), face 0 is the infinite face. Removed labels are never
 * reused.
 * </p>
 * <p>
 * The four topology primitives never throw for ordinary refusals: they return
 * {@link #NO_LABEL} (or {@code false}) and leave the map untouched.
 * </p>
 */
public interface GeoMap {

    /** Returned by primitives that refused to operate. */
    int NO_LABEL = -1;

    int maxNodeLabel();

    int maxEdgeLabel();

    int maxFaceLabel();

    int nodeCount();

    int edgeCount();

    int faceCount();

    boolean nodeExists(int node);

    boolean edgeExists(int edge);

    boolean faceExists(int face);

    /** Ascending snapshot of existing node labels. */
    IntList nodeLabels();

    /** Ascending snapshot of existing edge labels. */
    IntList edgeLabels();

    /** Ascending snapshot of existing face labels. */
    IntList faceLabels();

    // ========================================================================
    // NODES
    // ========================================================================

    double nodeX(int node);

    double nodeY(int node);

    int nodeDegree(int node);

    /**
     * Returns some dart leaving {@code node}, or 0 if the node is isolated.
     */
    int nodeAnchor(int node);

    // ========================================================================
    // DARTS
    // ========================================================================

    /**
     * Rotates {@code times} steps counter-clockwise around the dart's start node
     * (negative values rotate clockwise).
     */
    int nextSigma(int dart, int times);

    int startNode(int dart);

    int leftFace(int dart);

    default int endNode(int dart) {
        return startNode(-dart);
    }

    default int rightFace(int dart) {
        return leftFace(-dart);
    }

    default int nextPhi(int dart) {
        return nextSigma(-dart, -1);
    }

    default Dart dart(int label) {
        return new Dart(this, label);
    }

    // ========================================================================
    // FACES
    // ========================================================================

    /**
     * Anchor darts of the face's contours. For bounded faces the outer contour comes first;
     * the infinite face only has hole contours.
     */
    IntList faceContours(int face);

    /** Signed area: outer contour area plus (negative) hole areas. */
    double faceArea(int face);

    // ========================================================================
    // FLAGS
    // ========================================================================

    int nodeFlags(int node);

    void setNodeFlags(int node, int mask, boolean on);

    int edgeFlags(int edge);

    void setEdgeFlags(int edge, int mask, boolean on);

    int faceFlags(int face);

    void setFaceFlags(int face, int mask, boolean on);

    default boolean exists(Cell cell) {
        return switch (cell.kind()) {
            case NODE -> nodeExists(cell.label());
            case EDGE -> edgeExists(cell.label());
            case FACE -> faceExists(cell.label());
        };
    }

    default int flags(Cell cell) {
        return switch (cell.kind()) {
            case NODE -> nodeFlags(cell.label());
            case EDGE -> edgeFlags(cell.label());
            case FACE -> faceFlags(cell.label());
        };
    }

    default void setFlags(Cell cell, int mask, boolean on) {
        switch (cell.kind()) {
            case NODE -> setNodeFlags(cell.label(), mask, on);
            case EDGE -> setEdgeFlags(cell.label(), mask, on);
            case FACE -> setFaceFlags(cell.label(), mask, on);
        }
    }

    default boolean isProtected(int edge) {
        return (edgeFlags(edge) & EdgeFlags.ALL_PROTECTION) != 0;
    }

    default boolean isCurrentContour(int edge) {
        return (edgeFlags(edge) & EdgeFlags.CURRENT_CONTOUR) != 0;
    }

    default boolean isBorderProtected(int edge) {
        return (edgeFlags(edge) & EdgeFlags.BORDER_PROTECTION) != 0;
    }

    default boolean isBridge(int edge) {
        return leftFace(edge) == rightFace(edge);
    }

    default boolean isLoop(int edge) {
        return startNode(edge) == endNode(edge);
    }

    default boolean isSeed(int face) {
        return (faceFlags(face) & FaceFlags.SRG_SEED) != 0;
    }

    default boolean isBorderCandidate(int face) {
        return (faceFlags(face) & FaceFlags.SRG_BORDER) != 0;
    }

    default boolean isProtectedFace(int face) {
        return (faceFlags(face) & FaceFlags.PROTECTED_FACE) != 0;
    }

    // ========================================================================
    // TOPOLOGY PRIMITIVES
    // ========================================================================

    /**
     * Removes the edge of {@code dart} and unites its two faces.
     *
     * @return surviving face label, or {@link #NO_LABEL} for bridges, protected edges and
     * operations cancelled by the implementation.
     */
    int mergeFaces(Dart dart);

    /**
     * Removes a bridge edge, splitting its contour in two.
     *
     * @return the face containing the bridge, or {@link #NO_LABEL} if the dart is no bridge,
     * is a self-loop, is protected or the operation was cancelled.
     */
    int removeBridge(Dart dart);

    /**
     * Fuses the two edges meeting at the degree-2 start node of {@code dart}.
     *
     * @return surviving edge label, or {@link #NO_LABEL} if the node's degree is not two or the
     * two darts belong to one self-loop.
     */
    int mergeEdges(Dart dart);

    /**
     * Deletes a node of degree zero.
     *
     * @return true if the node was removed.
     */
    boolean removeIsolatedNode(int node);
}
