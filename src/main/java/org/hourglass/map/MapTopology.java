package org.hourglass.map;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Read-mostly helpers on top of {@link GeoMap} navigation.
 */
public final class MapTopology {

    private MapTopology() {
    }

    /**
     * Returns the faces of the connected component whose hole contour contains {@code dart}.
     * <p>
     * Faces are collected with an explicit work-list crossing every outer contour, so faces
     * nested in holes of the component are not reported.
     * </p>
     *
     * @param includeExterior if true, the face the component is embedded in (the left face of
     *                        {@code dart}) is returned as first element.
     */
    public static IntList holeComponent(GeoMap map, int dart, boolean includeExterior) {
        int exterior = map.leftFace(dart);
        IntArrayList result = new IntArrayList();
        if (includeExterior) {
            result.add(exterior);
        }
        boolean[] seen = new boolean[map.maxFaceLabel() + 1];
        seen[exterior] = true;

        IntArrayList border = new IntArrayList();
        for (Dart d : map.dart(dart).phiOrbit()) {
            border.add(d.rightFaceLabel());
        }
        while (!border.isEmpty()) {
            int face = border.popInt();
            if (seen[face]) {
                continue;
            }
            seen[face] = true;
            result.add(face);
            int outer = map.faceContours(face).getInt(0);
            for (Dart d : map.dart(outer).phiOrbit()) {
                if (!seen[d.rightFaceLabel()]) {
                    border.add(d.rightFaceLabel());
                }
            }
        }
        return result;
    }

    /**
     * Sets or clears {@link FaceFlags#PROTECTED_FACE} and the matching
     * {@link EdgeFlags#CONTOUR_PROTECTION} on every contour edge. When unprotecting, edges
     * shared with another protected face keep their contour protection.
     */
    public static void protectFace(GeoMap map, int face, boolean protect) {
        map.setFaceFlags(face, FaceFlags.PROTECTED_FACE, protect);
        IntList contours = map.faceContours(face);
        for (int i = 0; i < contours.size(); i++) {
            for (Dart d : map.dart(contours.getInt(i)).phiOrbit()) {
                if (protect || !map.isProtectedFace(d.rightFaceLabel())) {
                    map.setEdgeFlags(d.edgeLabel(), EdgeFlags.CONTOUR_PROTECTION, protect);
                }
            }
        }
    }

    /**
     * Collects the darts on all contours of {@code face}, outer contour first.
     */
    public static IntList contourDarts(GeoMap map, int face) {
        IntArrayList result = new IntArrayList();
        IntList contours = map.faceContours(face);
        for (int i = 0; i < contours.size(); i++) {
            for (Dart d : map.dart(contours.getInt(i)).phiOrbit()) {
                result.add(d.label());
            }
        }
        return result;
    }
}
