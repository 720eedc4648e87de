package org.hourglass.map;

/**
 * Observer of topology changes on a {@link MemoryGeoMap}.
 * <p>
 * A {@code pre*} hook returning {@code false} cancels the operation; the primitive then refuses
 * with {@link GeoMap#NO_LABEL} before mutating anything. {@code post*} hooks run after the map is
 * consistent again.
 * </p>
 */
public interface MapModificationCallback {

    default boolean preMergeFaces(Dart dart) {
        return true;
    }

    default void postMergeFaces(int survivorFace) {
    }

    default boolean preRemoveBridge(Dart dart) {
        return true;
    }

    default void postRemoveBridge(int face) {
    }

    default boolean preMergeEdges(Dart dart) {
        return true;
    }

    default void postMergeEdges(int survivorEdge) {
    }

    /** Called for every node removal, including nodes left singular by other operations. */
    default void nodeRemoved(int node) {
    }
}
