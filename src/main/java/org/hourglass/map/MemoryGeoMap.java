package org.hourglass.map;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.hourglass.core.SegmentationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Mutable in-memory planar map with polyline edges.
 * <p>
 * ARCHITECTURAL NOTE:
 * Each node keeps its darts in counter-clockwise order (sigma). Faces are not stored as edge
 * lists but as one anchor dart per contour; everything else is derived by walking phi orbits.
 * The topology primitives follow the classic Euler operations:
 * </p>
 * <ul>
 * <li>{@link #mergeFaces(Dart)} keeps the larger face (and always keeps face 0).</li>
 * <li>{@link #removeBridge(Dart)} splits one contour in two, keeping the larger one as outer contour.</li>
 * <li>{@link #mergeEdges(Dart)} concatenates the two polylines at a degree-2 node.</li>
 * <li>Nodes left without darts by the first two operations are removed on the spot.</li>
 * </ul>
 * <p>Maps are created with {@link #builder()}. Not thread-safe.</p>
 */
public final class MemoryGeoMap implements GeoMap {

    private static final class Node {
        final int label;
        final double x;
        final double y;
        final IntArrayList darts = new IntArrayList();
        int flags;

        Node(int label, double x, double y) {
            this.label = label;
            this.x = x;
            this.y = y;
        }
    }

    private static final class Edge {
        final int label;
        int startNode;
        int endNode;
        int leftFace;
        int rightFace;
        int flags;
        double[] xs;
        double[] ys;

        Edge(int label, int startNode, int endNode, double[] xs, double[] ys) {
            this.label = label;
            this.startNode = startNode;
            this.endNode = endNode;
            this.xs = xs;
            this.ys = ys;
        }
    }

    private static final class Face {
        final int label;
        final IntArrayList anchors = new IntArrayList();
        double area;
        int flags;

        Face(int label) {
            this.label = label;
        }
    }

    /**
     * Result of {@link #checkConsistency()}.
     */
    public record ValidationResult(boolean isValid, List<String> errors) {
    }

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Face> faces = new ArrayList<>();
    private final List<MapModificationCallback> callbacks = new ArrayList<>();
    private int nodeCount;
    private int edgeCount;
    private int faceCount;

    private MemoryGeoMap() {
        edges.add(null); // edge labels start at 1
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // CALLBACKS
    // ========================================================================

    public void addModificationCallback(MapModificationCallback callback) {
        callbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public boolean removeModificationCallback(MapModificationCallback callback) {
        return callbacks.remove(callback);
    }

    // ========================================================================
    // LABELS & COUNTS
    // ========================================================================

    @Override
    public int maxNodeLabel() {
        return nodes.size() - 1;
    }

    @Override
    public int maxEdgeLabel() {
        return edges.size() - 1;
    }

    @Override
    public int maxFaceLabel() {
        return faces.size() - 1;
    }

    @Override
    public int nodeCount() {
        return nodeCount;
    }

    @Override
    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public int faceCount() {
        return faceCount;
    }

    @Override
    public boolean nodeExists(int node) {
        return node >= 0 && node < nodes.size() && nodes.get(node) != null;
    }

    @Override
    public boolean edgeExists(int edge) {
        return edge > 0 && edge < edges.size() && edges.get(edge) != null;
    }

    @Override
    public boolean faceExists(int face) {
        return face >= 0 && face < faces.size() && faces.get(face) != null;
    }

    @Override
    public IntList nodeLabels() {
        IntArrayList result = new IntArrayList(nodeCount);
        for (Node node : nodes) {
            if (node != null) result.add(node.label);
        }
        return result;
    }

    @Override
    public IntList edgeLabels() {
        IntArrayList result = new IntArrayList(edgeCount);
        for (Edge edge : edges) {
            if (edge != null) result.add(edge.label);
        }
        return result;
    }

    @Override
    public IntList faceLabels() {
        IntArrayList result = new IntArrayList(faceCount);
        for (Face face : faces) {
            if (face != null) result.add(face.label);
        }
        return result;
    }

    // ========================================================================
    // NODES & DARTS
    // ========================================================================

    @Override
    public double nodeX(int node) {
        return node(node).x;
    }

    @Override
    public double nodeY(int node) {
        return node(node).y;
    }

    @Override
    public int nodeDegree(int node) {
        return node(node).darts.size();
    }

    @Override
    public int nodeAnchor(int node) {
        IntArrayList darts = node(node).darts;
        return darts.isEmpty() ? 0 : darts.getInt(0);
    }

    @Override
    public int nextSigma(int dart, int times) {
        IntArrayList darts = node(startNode(dart)).darts;
        int index = darts.indexOf(dart);
        if (index < 0) {
            throw new SegmentationException(SegmentationException.REASON_INVALID_MAP,
                    "dart " + dart + " not attached to its start node");
        }
        int size = darts.size();
        int next = (index + times) % size;
        if (next < 0) {
            next += size;
        }
        return darts.getInt(next);
    }

    @Override
    public int startNode(int dart) {
        Edge edge = edgeOfDart(dart);
        return dart > 0 ? edge.startNode : edge.endNode;
    }

    @Override
    public int leftFace(int dart) {
        Edge edge = edgeOfDart(dart);
        return dart > 0 ? edge.leftFace : edge.rightFace;
    }

    private void setLeftFace(int dart, int face) {
        Edge edge = edgeOfDart(dart);
        if (dart > 0) {
            edge.leftFace = face;
        } else {
            edge.rightFace = face;
        }
    }

    // ========================================================================
    // FACES & GEOMETRY
    // ========================================================================

    @Override
    public IntList faceContours(int face) {
        return new IntArrayList(face(face).anchors);
    }

    @Override
    public double faceArea(int face) {
        return face(face).area;
    }

    /**
     * Signed area enclosed by the phi orbit of {@code anchor} (positive for outer contours).
     */
    public double contourArea(int anchor) {
        double sum = 0.0;
        int dart = anchor;
        do {
            sum += dartArea(dart);
            dart = nextPhi(dart);
        } while (dart != anchor);
        return sum;
    }

    /**
     * Returns the innermost face containing the point, or 0 (the infinite face).
     */
    public int faceAt(double x, double y) {
        int best = 0;
        double bestArea = Double.POSITIVE_INFINITY;
        for (Face face : faces) {
            if (face == null || face.label == 0 || face.anchors.isEmpty()) {
                continue;
            }
            int outer = face.anchors.getInt(0);
            if (contourContains(outer, x, y)) {
                double area = contourArea(outer);
                if (area < bestArea) {
                    bestArea = area;
                    best = face.label;
                }
            }
        }
        return best;
    }

    private double dartArea(int dart) {
        Edge edge = edgeOfDart(dart);
        double[] xs = edge.xs;
        double[] ys = edge.ys;
        double sum = 0.0;
        for (int i = 0; i + 1 < xs.length; i++) {
            sum += xs[i] * ys[i + 1] - xs[i + 1] * ys[i];
        }
        return dart > 0 ? sum / 2.0 : -sum / 2.0;
    }

    private boolean contourContains(int anchor, double x, double y) {
        DoubleArrayList px = new DoubleArrayList();
        DoubleArrayList py = new DoubleArrayList();
        int dart = anchor;
        do {
            Edge edge = edgeOfDart(dart);
            int n = edge.xs.length;
            for (int i = 0; i < n - 1; i++) {
                int index = dart > 0 ? i : n - 1 - i;
                px.add(edge.xs[index]);
                py.add(edge.ys[index]);
            }
            dart = nextPhi(dart);
        } while (dart != anchor);
        return polygonContains(px, py, x, y);
    }

    private static boolean polygonContains(DoubleArrayList px, DoubleArrayList py, double x, double y) {
        boolean inside = false;
        int n = px.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = px.getDouble(i);
            double yi = py.getDouble(i);
            double xj = px.getDouble(j);
            double yj = py.getDouble(j);
            if ((yi > y) != (yj > y) && x < (xj - xi) * (y - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        return inside;
    }

    // ========================================================================
    // FLAGS
    // ========================================================================

    @Override
    public int nodeFlags(int node) {
        return node(node).flags;
    }

    @Override
    public void setNodeFlags(int node, int mask, boolean on) {
        Node n = node(node);
        n.flags = on ? n.flags | mask : n.flags & ~mask;
    }

    @Override
    public int edgeFlags(int edge) {
        return edge(edge).flags;
    }

    @Override
    public void setEdgeFlags(int edge, int mask, boolean on) {
        Edge e = edge(edge);
        e.flags = on ? e.flags | mask : e.flags & ~mask;
    }

    @Override
    public int faceFlags(int face) {
        return face(face).flags;
    }

    @Override
    public void setFaceFlags(int face, int mask, boolean on) {
        Face f = face(face);
        f.flags = on ? f.flags | mask : f.flags & ~mask;
    }

    // ========================================================================
    // TOPOLOGY PRIMITIVES
    // ========================================================================

    @Override
    public int mergeFaces(Dart dart) {
        int removed = requireOwnDart(dart);
        if (leftFace(removed) == rightFace(removed)) {
            return NO_LABEL;
        }
        Edge mergedEdge = edgeOfDart(removed);
        if (isProtected(mergedEdge.label)) {
            return NO_LABEL;
        }
        if (face(leftFace(removed)).area < face(rightFace(removed)).area) {
            removed = -removed;
        }
        if (rightFace(removed) == 0) { // face 0 shall stay face 0
            removed = -removed;
        }
        for (MapModificationCallback callback : callbacks) {
            if (!callback.preMergeFaces(dart(removed))) {
                return NO_LABEL;
            }
        }

        Face survivor = face(leftFace(removed));
        Face merged = face(rightFace(removed));
        int node1 = startNode(removed);
        int node2 = endNode(removed);
        int contour1 = findComponentAnchor(survivor, removed);
        int contour2 = findComponentAnchor(merged, -removed);

        // the joined contour needs an anchor that survives the edge removal
        int joined = survivor.anchors.getInt(contour1);
        if (Math.abs(joined) == mergedEdge.label) {
            joined = nextPhi(joined);
            if (Math.abs(joined) == mergedEdge.label) {
                joined = merged.anchors.getInt(contour2);
                if (Math.abs(joined) == mergedEdge.label) {
                    joined = nextPhi(joined);
                }
            }
        }
        boolean dropJoined = Math.abs(joined) == mergedEdge.label;
        if (dropJoined && node1 != node2) {
            throw new SegmentationException(SegmentationException.REASON_INVALID_MAP,
                    "contour of edge " + mergedEdge.label + " consists of that edge alone but it is no self-loop");
        }

        for (int i = 0; i < merged.anchors.size(); i++) {
            for (int contourDart : orbit(merged.anchors.getInt(i))) {
                setLeftFace(contourDart, survivor.label);
            }
        }

        // survivor inside a hole of merged: merged's outer contour becomes the outer one
        boolean swapOuter = survivor.label != 0 && contour1 == 0 && contour2 != 0;
        IntArrayList anchors = new IntArrayList();
        if (swapOuter) {
            anchors.add(merged.anchors.getInt(0));
        }
        for (int i = 0; i < survivor.anchors.size(); i++) {
            if (i != contour1) {
                anchors.add(survivor.anchors.getInt(i));
            } else if (!dropJoined) {
                anchors.add(joined);
            }
        }
        for (int i = 0; i < merged.anchors.size(); i++) {
            if (i != contour2 && !(swapOuter && i == 0)) {
                anchors.add(merged.anchors.getInt(i));
            }
        }
        survivor.anchors.clear();
        survivor.anchors.addAll(anchors);

        node(node1).darts.rem(removed);
        node(node2).darts.rem(-removed);

        survivor.area += merged.area;
        edges.set(mergedEdge.label, null);
        edgeCount--;
        faces.set(merged.label, null);
        faceCount--;

        boolean removeNode1 = nodeDegree(node1) == 0;
        if (nodeDegree(node2) == 0 && node2 != node1) {
            dropNode(node2);
        }
        if (removeNode1) {
            dropNode(node1);
        }

        for (MapModificationCallback callback : callbacks) {
            callback.postMergeFaces(survivor.label);
        }
        return survivor.label;
    }

    @Override
    public int removeBridge(Dart dart) {
        int bridge = requireOwnDart(dart);
        int faceLabel = leftFace(bridge);
        if (rightFace(bridge) != faceLabel) {
            return NO_LABEL;
        }
        int node1 = startNode(bridge);
        int node2 = endNode(bridge);
        if (node1 == node2) {
            return NO_LABEL;
        }
        Edge edge = edgeOfDart(bridge);
        if (isProtected(edge.label)) {
            return NO_LABEL;
        }
        for (MapModificationCallback callback : callbacks) {
            if (!callback.preRemoveBridge(dart(bridge))) {
                return NO_LABEL;
            }
        }

        Face face = face(faceLabel);
        int newAnchor1 = nextSigma(bridge, -1);
        int newAnchor2 = nextSigma(-bridge, -1);
        int contourIndex = findComponentAnchor(face, bridge);

        node(node1).darts.rem(bridge);
        node(node2).darts.rem(-bridge);

        if (contourIndex == 0 && face.label != 0) {
            // the larger part stays the outer contour
            if (Math.abs(newAnchor1) == edge.label
                    || (Math.abs(newAnchor2) != edge.label && contourArea(newAnchor1) < contourArea(newAnchor2))) {
                int swap = newAnchor1;
                newAnchor1 = newAnchor2;
                newAnchor2 = swap;
            }
        }

        face.anchors.set(contourIndex, newAnchor1);
        face.anchors.add(newAnchor2);

        // dangling ends leave singular nodes behind
        if (Math.abs(newAnchor1) == edge.label) {
            dropNode(startNode(newAnchor1));
            face.anchors.removeInt(contourIndex);
        }
        if (Math.abs(newAnchor2) == edge.label) {
            dropNode(startNode(newAnchor2));
            face.anchors.removeInt(face.anchors.size() - 1);
        }

        edges.set(edge.label, null);
        edgeCount--;

        for (MapModificationCallback callback : callbacks) {
            callback.postRemoveBridge(face.label);
        }
        return face.label;
    }

    @Override
    public int mergeEdges(Dart dart) {
        int d2 = requireOwnDart(dart);
        int d1 = nextSigma(d2, 1);
        if (Math.abs(d1) == Math.abs(d2)) {
            return NO_LABEL;
        }
        if (nextSigma(d1, 1) != d2) {
            return NO_LABEL;
        }
        for (MapModificationCallback callback : callbacks) {
            if (!callback.preMergeEdges(dart(d2))) {
                return NO_LABEL;
            }
        }

        Edge survivor = edgeOfDart(d1);
        Edge merged = edgeOfDart(d2);
        int mergedNode = startNode(d2);
        int changedEndNode = endNode(d2);

        int[] faceLabels = {leftFace(d2), rightFace(d2)};
        for (int faceLabel : faceLabels) {
            Face face = face(faceLabel);
            for (int i = 0; i < face.anchors.size(); i++) {
                int anchor = face.anchors.getInt(i);
                while (Math.abs(anchor) == merged.label) {
                    anchor = nextPhi(anchor);
                }
                face.anchors.set(i, anchor);
            }
        }

        // new geometry runs along -d1 into the merged node and on along d2
        DoubleArrayList xs = new DoubleArrayList();
        DoubleArrayList ys = new DoubleArrayList();
        appendPolyline(-d1, xs, ys, false);
        appendPolyline(d2, xs, ys, true);
        if (d1 > 0) {
            reverse(xs);
            reverse(ys);
            survivor.startNode = changedEndNode;
        } else {
            survivor.endNode = changedEndNode;
        }
        survivor.xs = xs.toDoubleArray();
        survivor.ys = ys.toDoubleArray();
        survivor.flags |= merged.flags;

        IntArrayList changedDarts = node(changedEndNode).darts;
        changedDarts.set(changedDarts.indexOf(-d2), d1);

        edges.set(merged.label, null);
        edgeCount--;
        node(mergedNode).darts.clear();
        dropNode(mergedNode);

        for (MapModificationCallback callback : callbacks) {
            callback.postMergeEdges(survivor.label);
        }
        return survivor.label;
    }

    @Override
    public boolean removeIsolatedNode(int node) {
        if (!nodeExists(node) || nodeDegree(node) != 0) {
            return false;
        }
        dropNode(node);
        return true;
    }

    // ========================================================================
    // DEBUG & VALIDATION
    // ========================================================================

    /**
     * Verifies dart attachment, contour face labels and anchor bookkeeping.
     */
    public ValidationResult checkConsistency() {
        List<String> errors = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge == null) continue;
            if (!nodeExists(edge.startNode) || !node(edge.startNode).darts.contains(edge.label)) {
                errors.add("Edge " + edge.label + " not attached to start node " + edge.startNode);
            }
            if (!nodeExists(edge.endNode) || !node(edge.endNode).darts.contains(-edge.label)) {
                errors.add("Edge " + edge.label + " not attached to end node " + edge.endNode);
            }
            if (!faceExists(edge.leftFace) || !faceExists(edge.rightFace)) {
                errors.add("Edge " + edge.label + " refers to removed face");
            }
        }
        if (!errors.isEmpty()) {
            return new ValidationResult(false, errors);
        }

        boolean[] covered = new boolean[2 * edges.size() + 1];
        for (Face face : faces) {
            if (face == null) continue;
            for (int i = 0; i < face.anchors.size(); i++) {
                int anchor = face.anchors.getInt(i);
                if (!edgeExists(Math.abs(anchor))) {
                    errors.add("Face " + face.label + " anchor " + anchor + " refers to removed edge");
                    continue;
                }
                for (int dart : orbit(anchor)) {
                    if (leftFace(dart) != face.label) {
                        errors.add("Dart " + dart + " on contour of face " + face.label
                                + " has left face " + leftFace(dart));
                    }
                    int slot = dart + edges.size();
                    if (covered[slot]) {
                        errors.add("Dart " + dart + " reached from two anchors");
                    }
                    covered[slot] = true;
                }
            }
        }
        for (Edge edge : edges) {
            if (edge == null) continue;
            if (!covered[edge.label + edges.size()] || !covered[-edge.label + edges.size()]) {
                errors.add("Edge " + edge.label + " not reachable from any face anchor");
            }
        }
        return new ValidationResult(errors.isEmpty(), errors);
    }

    @Override
    public String toString() {
        return String.format("MemoryGeoMap[nodes=%d, edges=%d, faces=%d]", nodeCount, edgeCount, faceCount);
    }

    // ========================================================================
    // INTERNALS
    // ========================================================================

    private Node node(int label) {
        if (!nodeExists(label)) {
            throw new IllegalArgumentException("Node " + label + " does not exist");
        }
        return nodes.get(label);
    }

    private Edge edge(int label) {
        if (!edgeExists(label)) {
            throw new IllegalArgumentException("Edge " + label + " does not exist");
        }
        return edges.get(label);
    }

    private Edge edgeOfDart(int dart) {
        return edge(Math.abs(dart));
    }

    private Face face(int label) {
        if (!faceExists(label)) {
            throw new IllegalArgumentException("Face " + label + " does not exist");
        }
        return faces.get(label);
    }

    private int requireOwnDart(Dart dart) {
        Objects.requireNonNull(dart, "dart");
        if (dart.map() != this) {
            throw new IllegalArgumentException("Dart " + dart.label() + " belongs to another map");
        }
        edgeOfDart(dart.label());
        return dart.label();
    }

    private IntArrayList orbit(int anchor) {
        IntArrayList result = new IntArrayList();
        int dart = anchor;
        do {
            result.add(dart);
            dart = nextPhi(dart);
        } while (dart != anchor);
        return result;
    }

    private int findComponentAnchor(Face face, int dart) {
        for (int i = 0; i < face.anchors.size(); i++) {
            if (face.anchors.getInt(i) == dart) {
                return i;
            }
        }
        for (int i = 0; i < face.anchors.size(); i++) {
            if (orbit(face.anchors.getInt(i)).contains(dart)) {
                return i;
            }
        }
        throw new SegmentationException(SegmentationException.REASON_INVALID_MAP,
                "dart " + dart + " not found in contours of face " + face.label);
    }

    private void dropNode(int label) {
        for (MapModificationCallback callback : callbacks) {
            callback.nodeRemoved(label);
        }
        nodes.set(label, null);
        nodeCount--;
    }

    private void appendPolyline(int dart, DoubleArrayList xs, DoubleArrayList ys, boolean skipFirst) {
        Edge edge = edgeOfDart(dart);
        int n = edge.xs.length;
        for (int i = skipFirst ? 1 : 0; i < n; i++) {
            int index = dart > 0 ? i : n - 1 - i;
            xs.add(edge.xs[index]);
            ys.add(edge.ys[index]);
        }
    }

    private static void reverse(DoubleArrayList values) {
        for (int i = 0, j = values.size() - 1; i < j; i++, j--) {
            double swap = values.getDouble(i);
            values.set(i, values.getDouble(j));
            values.set(j, swap);
        }
    }

    /**
     * Incremental construction from node positions and polyline edges.
     * <p>
     * {@link #build()} sorts the darts around every node by angle, derives one face per
     * counter-clockwise phi orbit and hands every remaining orbit as a hole to the innermost
     * face enclosing it (or to the infinite face).
     * </p>
     */
    public static final class Builder {
        private final DoubleArrayList nodeX = new DoubleArrayList();
        private final DoubleArrayList nodeY = new DoubleArrayList();
        private final IntArrayList edgeStart = new IntArrayList();
        private final IntArrayList edgeEnd = new IntArrayList();
        private final List<double[]> edgeInterior = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a node and returns its label.
         */
        public int addNode(double x, double y) {
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new IllegalArgumentException("node position must be finite, got (" + x + ", " + y + ")");
            }
            nodeX.add(x);
            nodeY.add(y);
            return nodeX.size() - 1;
        }

        /**
         * Adds an edge and returns its label.
         *
         * @param interiorXY optional interleaved x/y coordinates of intermediate polyline points.
         */
        public int addEdge(int startNode, int endNode, double... interiorXY) {
            checkNode(startNode);
            checkNode(endNode);
            if (interiorXY.length % 2 != 0) {
                throw new IllegalArgumentException("interior coordinates must come in x/y pairs");
            }
            if (startNode == endNode && interiorXY.length < 4) {
                throw new IllegalArgumentException("self-loop at node " + startNode + " needs at least two interior points");
            }
            edgeStart.add(startNode);
            edgeEnd.add(endNode);
            edgeInterior.add(interiorXY.clone());
            return edgeStart.size();
        }

        private void checkNode(int node) {
            if (node < 0 || node >= nodeX.size()) {
                throw new IllegalArgumentException("Node " + node + " out of bounds [0, " + nodeX.size() + ")");
            }
        }

        public MemoryGeoMap build() {
            MemoryGeoMap map = new MemoryGeoMap();
            for (int i = 0; i < nodeX.size(); i++) {
                map.nodes.add(new Node(i, nodeX.getDouble(i), nodeY.getDouble(i)));
            }
            map.nodeCount = nodeX.size();

            for (int i = 0; i < edgeStart.size(); i++) {
                int start = edgeStart.getInt(i);
                int end = edgeEnd.getInt(i);
                double[] interior = edgeInterior.get(i);
                int points = interior.length / 2 + 2;
                double[] xs = new double[points];
                double[] ys = new double[points];
                xs[0] = nodeX.getDouble(start);
                ys[0] = nodeY.getDouble(start);
                for (int p = 0; p < interior.length / 2; p++) {
                    xs[p + 1] = interior[2 * p];
                    ys[p + 1] = interior[2 * p + 1];
                }
                xs[points - 1] = nodeX.getDouble(end);
                ys[points - 1] = nodeY.getDouble(end);

                Edge edge = new Edge(i + 1, start, end, xs, ys);
                map.edges.add(edge);
                map.nodes.get(start).darts.add(edge.label);
                map.nodes.get(end).darts.add(-edge.label);
            }
            map.edgeCount = edgeStart.size();

            for (Node node : map.nodes) {
                sortByAngle(map, node);
            }
            assignFaces(map);
            return map;
        }

        private static void sortByAngle(MemoryGeoMap map, Node node) {
            int[] darts = node.darts.toIntArray();
            double[] angles = new double[darts.length];
            for (int i = 0; i < darts.length; i++) {
                Edge edge = map.edgeOfDart(darts[i]);
                int n = edge.xs.length;
                int from = darts[i] > 0 ? 0 : n - 1;
                int to = darts[i] > 0 ? 1 : n - 2;
                angles[i] = Math.atan2(edge.ys[to] - edge.ys[from], edge.xs[to] - edge.xs[from]);
            }
            Integer[] order = new Integer[darts.length];
            for (int i = 0; i < order.length; i++) order[i] = i;
            Arrays.sort(order, (a, b) -> {
                int byAngle = Double.compare(angles[a], angles[b]);
                return byAngle != 0 ? byAngle : Integer.compare(darts[a], darts[b]);
            });
            node.darts.clear();
            for (Integer index : order) {
                node.darts.add(darts[index]);
            }
        }

        private static void assignFaces(MemoryGeoMap map) {
            Face infinite = new Face(0);
            infinite.area = Double.POSITIVE_INFINITY;
            map.faces.add(infinite);

            int maxEdge = map.maxEdgeLabel();
            boolean[] visited = new boolean[2 * maxEdge + 1];
            IntArrayList holeAnchors = new IntArrayList();
            IntArrayList outerAnchors = new IntArrayList();
            DoubleArrayList outerAreas = new DoubleArrayList();

            for (int e = 1; e <= maxEdge; e++) {
                for (int dart : new int[]{e, -e}) {
                    if (visited[dart + maxEdge]) continue;
                    IntArrayList orbit = map.orbit(dart);
                    double area = 0.0;
                    for (int d : orbit) {
                        visited[d + maxEdge] = true;
                        area += map.dartArea(d);
                    }
                    if (area > 0.0) {
                        Face face = new Face(map.faces.size());
                        face.anchors.add(dart);
                        face.area = area;
                        map.faces.add(face);
                        for (int d : orbit) {
                            map.setLeftFace(d, face.label);
                        }
                        outerAnchors.add(dart);
                        outerAreas.add(area);
                    } else {
                        holeAnchors.add(dart);
                    }
                }
            }

            int[] component = connectedComponents(map);
            for (int hole : holeAnchors) {
                int node = map.startNode(hole);
                double x = map.nodeX(node);
                double y = map.nodeY(node);
                int enclosing = 0;
                double enclosingArea = Double.POSITIVE_INFINITY;
                for (int i = 0; i < outerAnchors.size(); i++) {
                    int outer = outerAnchors.getInt(i);
                    if (component[map.startNode(outer)] == component[node]) continue;
                    double area = outerAreas.getDouble(i);
                    if (area < enclosingArea && map.contourContains(outer, x, y)) {
                        enclosing = map.leftFace(outer);
                        enclosingArea = area;
                    }
                }
                Face face = map.faces.get(enclosing);
                face.anchors.add(hole);
                double holeArea = map.contourArea(hole);
                if (enclosing != 0) {
                    face.area += holeArea;
                }
                for (int d : map.orbit(hole)) {
                    map.setLeftFace(d, enclosing);
                }
            }
            map.faceCount = map.faces.size();
        }

        private static int[] connectedComponents(MemoryGeoMap map) {
            int[] parent = new int[map.nodes.size()];
            for (int i = 0; i < parent.length; i++) parent[i] = i;
            for (Edge edge : map.edges) {
                if (edge == null) continue;
                int a = find(parent, edge.startNode);
                int b = find(parent, edge.endNode);
                if (a != b) parent[a] = b;
            }
            for (int i = 0; i < parent.length; i++) parent[i] = find(parent, i);
            return parent;
        }

        private static int find(int[] parent, int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }
    }
}
