package org.hourglass.merge;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.hourglass.core.SegmentationException;
import org.hourglass.map.Dart;
import org.hourglass.map.GeoMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Composite topology operations built from the four {@link GeoMap} primitives.
 * <p>
 * <strong>All-or-nothing merging:</strong> {@link #mergeFacesCompletely(GeoMap, Dart, boolean)}
 * removes every edge shared by two faces. Protection is checked for all shared edges before the
 * first mutation, so a refused transaction leaves the map untouched.
 * </p>
 */
public final class MergeTransaction {
    private static final Logger LOGGER = LoggerFactory.getLogger(MergeTransaction.class);

    /** Cruft mask: remove isolated nodes. */
    public static final int CRUFT_ISOLATED_NODES = 1;
    /** Cruft mask: fuse edges at degree-2 nodes. */
    public static final int CRUFT_DEGREE2_NODES = 2;
    /** Cruft mask: remove bridges. */
    public static final int CRUFT_BRIDGES = 4;
    /** Cruft mask: remove every unprotected edge between two faces. */
    public static final int CRUFT_EDGES = 8;

    private MergeTransaction() {
    }

    public static int mergeFacesCompletely(GeoMap map, Dart dart) {
        return mergeFacesCompletely(map, dart, true);
    }

    /**
     * Unites the two faces of {@code dart} by removing all of their common edges.
     *
     * @param removeDegree2Nodes whether nodes left with two edges are fused away.
     * @return the surviving face label, or {@link GeoMap#NO_LABEL} if a common edge is protected
     * or the map refused the first merge.
     * @throws IllegalArgumentException if {@code dart} belongs to a bridge.
     * @throws SegmentationException if the map is inconsistent with the collected edges.
     */
    public static int mergeFacesCompletely(GeoMap map, Dart dart, boolean removeDegree2Nodes) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(dart, "dart");
        if (dart.isBridge()) {
            throw new IllegalArgumentException("dart " + dart.label() + " belongs to a bridge");
        }

        int rightFace = dart.rightFaceLabel();
        IntArrayList common = new IntArrayList();
        for (Dart d : dart.phiOrbit()) {
            if (d.rightFaceLabel() == rightFace) {
                if (map.isProtected(d.edgeLabel())) {
                    return GeoMap.NO_LABEL;
                }
                common.add(d.label());
            }
        }
        if (common.isEmpty()) {
            throw new SegmentationException(SegmentationException.REASON_NO_COMMON_EDGE,
                    "no common edge between faces " + dart.leftFaceLabel() + " and " + rightFace);
        }

        IntArrayList affectedNodes = new IntArrayList(2 * common.size());
        for (int d : common) {
            affectedNodes.add(map.startNode(d));
            affectedNodes.add(map.endNode(d));
        }

        int survivor = map.mergeFaces(map.dart(common.getInt(0)));
        if (survivor == GeoMap.NO_LABEL) {
            return GeoMap.NO_LABEL;
        }
        for (int i = 1; i < common.size(); i++) {
            int result = map.removeBridge(map.dart(common.getInt(i)));
            if (result != survivor) {
                throw new SegmentationException(SegmentationException.REASON_BRIDGE_REMOVAL_FAILED,
                        "removing common edge " + Math.abs(common.getInt(i)) + " returned face " + result
                                + ", expected " + survivor);
            }
        }

        for (int node : affectedNodes) {
            if (!map.nodeExists(node)) {
                continue;
            }
            if (map.nodeDegree(node) == 0) {
                map.removeIsolatedNode(node);
            } else if (removeDegree2Nodes && map.nodeDegree(node) == 2) {
                int anchor = map.nodeAnchor(node);
                if (map.endNode(anchor) != node) {
                    map.mergeEdges(map.dart(anchor));
                }
            }
        }
        return survivor;
    }

    /**
     * Finds a common edge of two faces and merges them completely.
     *
     * @return the surviving face label, or {@link GeoMap#NO_LABEL} if a face is missing, the
     * faces are not adjacent or the merge was refused.
     */
    public static int mergeFacesByLabel(GeoMap map, int face1, int face2, boolean removeDegree2Nodes) {
        if (!map.faceExists(face1)) {
            LOGGER.warn("mergeFacesByLabel: face {} does not exist", face1);
            return GeoMap.NO_LABEL;
        }
        if (!map.faceExists(face2)) {
            LOGGER.warn("mergeFacesByLabel: face {} does not exist", face2);
            return GeoMap.NO_LABEL;
        }
        if (face1 == face2) {
            LOGGER.warn("mergeFacesByLabel: cannot merge face {} with itself", face1);
            return GeoMap.NO_LABEL;
        }
        IntList contours = map.faceContours(face1);
        for (int i = 0; i < contours.size(); i++) {
            for (Dart d : map.dart(contours.getInt(i)).phiOrbit()) {
                if (d.rightFaceLabel() == face2) {
                    return mergeFacesCompletely(map, d, removeDegree2Nodes);
                }
            }
        }
        LOGGER.warn("mergeFacesByLabel: faces {} and {} have no common edge", face1, face2);
        return GeoMap.NO_LABEL;
    }

    /**
     * Removes the edge of {@code dart} with {@code removeBridge} or {@code mergeFaces}, whichever applies.
     *
     * @return the face containing the former edge, or {@link GeoMap#NO_LABEL} on refusal.
     */
    public static int removeEdge(GeoMap map, Dart dart) {
        return dart.isBridge() ? map.removeBridge(dart) : map.mergeFaces(dart);
    }

    /**
     * Cleans up the map according to a combination of the {@code CRUFT_*} masks.
     * Edge removal runs first, then bridges, degree-2 nodes and finally isolated nodes.
     *
     * @return number of successful operations.
     */
    public static int removeCruft(GeoMap map, int what) {
        int count = 0;
        if ((what & CRUFT_EDGES) != 0) {
            for (int edge : map.edgeLabels()) {
                if (map.edgeExists(edge) && !map.isBridge(edge)
                        && map.mergeFaces(map.dart(edge)) != GeoMap.NO_LABEL) {
                    count++;
                }
            }
        }
        if ((what & CRUFT_BRIDGES) != 0) {
            for (int edge : map.edgeLabels()) {
                if (map.edgeExists(edge) && map.isBridge(edge)
                        && map.removeBridge(map.dart(edge)) != GeoMap.NO_LABEL) {
                    count++;
                }
            }
        }
        if ((what & CRUFT_DEGREE2_NODES) != 0) {
            for (int node : map.nodeLabels()) {
                if (map.nodeExists(node) && map.nodeDegree(node) == 2) {
                    int anchor = map.nodeAnchor(node);
                    if (map.endNode(anchor) != node && map.mergeEdges(map.dart(anchor)) != GeoMap.NO_LABEL) {
                        count++;
                    }
                }
            }
        }
        if ((what & CRUFT_ISOLATED_NODES) != 0) {
            for (int node : map.nodeLabels()) {
                if (map.nodeExists(node) && map.removeIsolatedNode(node)) {
                    count++;
                }
            }
        }
        LOGGER.info("removeCruft({}): {} operations performed", what, count);
        return count;
    }
}
