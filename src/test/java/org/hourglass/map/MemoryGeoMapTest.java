package org.hourglass.map;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.hourglass.testutil.MapFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoryGeoMap Tests")
class MemoryGeoMapTest {

    /** Unit square, counter-clockwise edges 1..4 starting at the origin. */
    private static MemoryGeoMap square() {
        MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
        int n0 = builder.addNode(0, 0);
        int n1 = builder.addNode(1, 0);
        int n2 = builder.addNode(1, 1);
        int n3 = builder.addNode(0, 1);
        builder.addEdge(n0, n1);
        builder.addEdge(n1, n2);
        builder.addEdge(n2, n3);
        builder.addEdge(n3, n0);
        return builder.build();
    }

    /** 4x4 square (edges 1..4) containing a unit square island at (1,1) (edges 5..8). */
    private static MemoryGeoMap squareWithIsland() {
        MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
        builder.addNode(0, 0);
        builder.addNode(4, 0);
        builder.addNode(4, 4);
        builder.addNode(0, 4);
        builder.addNode(1, 1);
        builder.addNode(2, 1);
        builder.addNode(2, 2);
        builder.addNode(1, 2);
        builder.addEdge(0, 1);
        builder.addEdge(1, 2);
        builder.addEdge(2, 3);
        builder.addEdge(3, 0);
        builder.addEdge(4, 5);
        builder.addEdge(5, 6);
        builder.addEdge(6, 7);
        builder.addEdge(7, 4);
        return builder.build();
    }

    private static IntList phiOrbit(GeoMap map, int dart) {
        IntArrayList result = new IntArrayList();
        for (Dart d : map.dart(dart).phiOrbit()) {
            result.add(d.label());
        }
        return result;
    }

    private static void assertConsistent(MemoryGeoMap map) {
        MemoryGeoMap.ValidationResult result = map.checkConsistency();
        assertTrue(result.isValid(), () -> "map inconsistent: " + result.errors());
    }

    @Nested
    @DisplayName("1. Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Square has one bounded face and the infinite face")
        void testSquare() {
            MemoryGeoMap map = square();

            assertEquals(4, map.nodeCount());
            assertEquals(4, map.edgeCount());
            assertEquals(2, map.faceCount());
            assertEquals(1.0, map.faceArea(1), 1e-12);
            assertEquals(Double.POSITIVE_INFINITY, map.faceArea(0));
            assertEquals(IntList.of(1), map.faceContours(1));
            assertEquals(1, map.faceContours(0).size());
            assertEquals(1, map.leftFace(1));
            assertEquals(0, map.rightFace(1));
            assertConsistent(map);
        }

        @Test
        @DisplayName("Sigma is counter-clockwise, phi walks the left face")
        void testNavigation() {
            MemoryGeoMap map = square();

            assertEquals(-4, map.nextSigma(1, 1));
            assertEquals(2, map.dart(1).nextPhi().label());
            assertEquals(1, map.dart(2).prevPhi().label());
            assertEquals(-1, map.dart(1).nextAlpha().label());
            assertEquals(IntList.of(1, 2, 3, 4), phiOrbit(map, 1));
            assertEquals(IntList.of(-1, -4, -3, -2), phiOrbit(map, -1));
            assertEquals(1.0, map.contourArea(1), 1e-12);
            assertEquals(-1.0, map.contourArea(-1), 1e-12);
        }

        @Test
        @DisplayName("Island becomes a hole of the enclosing face")
        void testIsland() {
            MemoryGeoMap map = squareWithIsland();

            assertEquals(3, map.faceCount());
            int outer = map.faceAt(3, 3);
            int island = map.faceAt(1.5, 1.5);
            assertNotEquals(outer, island);
            assertEquals(0, map.faceAt(10, 10));
            assertEquals(2, map.faceContours(outer).size());
            assertEquals(15.0, map.faceArea(outer), 1e-12);
            assertEquals(1.0, map.faceArea(island), 1e-12);
            assertEquals(outer, map.rightFace(5));
            assertConsistent(map);
        }

        @Test
        @DisplayName("Grid cells and center node degree")
        void testGrid() {
            MemoryGeoMap map = MapFixtures.grid(2, 2);

            assertEquals(5, map.faceCount());
            assertEquals(12, map.edgeCount());
            assertEquals(4, map.nodeDegree(MapFixtures.node(2, 1, 1)));
            int count = 0;
            for (Dart ignored : map.dart(map.nodeAnchor(MapFixtures.node(2, 1, 1))).sigmaOrbit()) {
                count++;
            }
            assertEquals(4, count);
            assertEquals(IntList.of(0, 1, 2, 3, 4), map.faceLabels());
            assertTrue(map.isBorderProtected(MapFixtures.horizontalEdge(2, 0, 0)));
            assertFalse(map.isProtected(MapFixtures.verticalEdge(2, 2, 1, 0)));
            assertConsistent(map);
        }

        @Test
        @DisplayName("Self-loop encloses a face")
        void testSelfLoop() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int node = builder.addNode(0, 0);
            builder.addEdge(node, node, 2, 0, 2, 2, 0, 2);
            MemoryGeoMap map = builder.build();

            assertEquals(2, map.faceCount());
            assertTrue(map.isLoop(1));
            assertEquals(4.0, map.faceArea(1), 1e-12);
            assertEquals(IntList.of(1), phiOrbit(map, 1));
        }

        @Test
        @DisplayName("Builder rejects invalid input")
        void testBuilderValidation() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int node = builder.addNode(0, 0);

            assertThrows(IllegalArgumentException.class, () -> builder.addEdge(node, 5));
            assertThrows(IllegalArgumentException.class, () -> builder.addEdge(node, node));
            assertThrows(IllegalArgumentException.class, () -> builder.addEdge(node, node, 1.0));
            assertThrows(IllegalArgumentException.class, () -> builder.addNode(Double.NaN, 0));
        }
    }

    @Nested
    @DisplayName("2. Merge Faces")
    class MergeFacesTests {

        @Test
        @DisplayName("Merging two cells keeps one face with the summed area")
        void testMergeCells() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);
            int left = MapFixtures.cell(map, 0, 0);
            int interior = MapFixtures.verticalEdge(2, 1, 1, 0);

            int survivor = map.mergeFaces(map.dart(interior));

            assertEquals(left, survivor);
            assertEquals(2, map.faceCount());
            assertFalse(map.edgeExists(interior));
            assertEquals(2.0, map.faceArea(survivor), 1e-12);
            assertEquals(2, map.nodeDegree(MapFixtures.node(2, 1, 0)));
            assertConsistent(map);
        }

        @Test
        @DisplayName("Infinite face always survives")
        void testInfiniteFaceSurvives() {
            MemoryGeoMap map = square();

            assertEquals(0, map.mergeFaces(map.dart(1)));
            assertEquals(1, map.faceCount());
            assertFalse(map.faceExists(1));
            assertEquals(1, map.faceContours(0).size());
            assertConsistent(map);
        }

        @Test
        @DisplayName("Removing a self-loop removes its node")
        void testSelfLoopMerge() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int node = builder.addNode(0, 0);
            builder.addEdge(node, node, 2, 0, 2, 2, 0, 2);
            MemoryGeoMap map = builder.build();

            assertEquals(0, map.mergeFaces(map.dart(1)));
            assertEquals(0, map.nodeCount());
            assertEquals(0, map.edgeCount());
            assertTrue(map.faceContours(0).isEmpty());
        }

        @Test
        @DisplayName("Island merged into its enclosing face leaves a dangling chain")
        void testIslandMerge() {
            MemoryGeoMap map = squareWithIsland();
            int outer = map.faceAt(3, 3);

            assertEquals(outer, map.mergeFaces(map.dart(5)));
            assertEquals(2, map.faceCount());
            assertEquals(16.0, map.faceArea(outer), 1e-12);
            assertEquals(2, map.faceContours(outer).size());
            assertTrue(map.isBridge(6));
            assertConsistent(map);
        }

        @Test
        @DisplayName("Protected edges and bridges are refused")
        void testRefusals() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);

            assertEquals(GeoMap.NO_LABEL, map.mergeFaces(map.dart(MapFixtures.horizontalEdge(2, 0, 0))));
            assertEquals(3, map.faceCount());

            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            builder.addEdge(builder.addNode(0, 0), builder.addNode(1, 0));
            MemoryGeoMap single = builder.build();
            assertEquals(GeoMap.NO_LABEL, single.mergeFaces(single.dart(1)));
            assertEquals(1, single.edgeCount());
        }

        @Test
        @DisplayName("Cancelling pre-hook refuses the merge")
        void testCancellingHook() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);
            map.addModificationCallback(new MapModificationCallback() {
                @Override
                public boolean preMergeFaces(Dart dart) {
                    return false;
                }
            });

            assertEquals(GeoMap.NO_LABEL, map.mergeFaces(map.dart(MapFixtures.verticalEdge(2, 1, 1, 0))));
            assertEquals(3, map.faceCount());
        }

        @Test
        @DisplayName("Post-hook reports the survivor")
        void testPostHook() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);
            int[] reported = {-1};
            map.addModificationCallback(new MapModificationCallback() {
                @Override
                public void postMergeFaces(int survivorFace) {
                    reported[0] = survivorFace;
                }
            });

            int survivor = map.mergeFaces(map.dart(MapFixtures.verticalEdge(2, 1, 1, 0)));
            assertEquals(survivor, reported[0]);
        }

        @Test
        @DisplayName("Darts of another map are rejected")
        void testForeignDart() {
            MemoryGeoMap map = square();
            MemoryGeoMap other = square();
            assertThrows(IllegalArgumentException.class, () -> map.mergeFaces(other.dart(1)));
        }
    }

    @Nested
    @DisplayName("3. Remove Bridge, Merge Edges, Remove Node")
    class OtherPrimitiveTests {

        @Test
        @DisplayName("Isolated edge removal drops both nodes")
        void testRemoveIsolatedEdge() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            builder.addEdge(builder.addNode(0, 0), builder.addNode(1, 0));
            MemoryGeoMap map = builder.build();

            assertEquals(0, map.removeBridge(map.dart(1)));
            assertEquals(0, map.nodeCount());
            assertEquals(0, map.edgeCount());
            assertTrue(map.faceContours(0).isEmpty());
        }

        @Test
        @DisplayName("Removing a dangling chain drops its nodes")
        void testRemoveConnectingBridge() {
            MemoryGeoMap map = squareWithIsland();
            int outer = map.faceAt(3, 3);
            map.mergeFaces(map.dart(5));

            assertEquals(outer, map.removeBridge(map.dart(6)));
            assertEquals(outer, map.removeBridge(map.dart(7)));
            assertEquals(outer, map.removeBridge(map.dart(8)));
            assertEquals(4, map.nodeCount());
            assertEquals(4, map.edgeCount());
            assertEquals(1, map.faceContours(outer).size());
            assertConsistent(map);
        }

        @Test
        @DisplayName("removeBridge refuses non-bridges")
        void testRemoveBridgeRefusal() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);
            assertEquals(GeoMap.NO_LABEL, map.removeBridge(map.dart(MapFixtures.verticalEdge(2, 1, 1, 0))));
        }

        @Test
        @DisplayName("Edges at a degree-2 node are fused")
        void testMergeEdges() {
            MemoryGeoMap map = MapFixtures.grid(2, 1);
            int node = MapFixtures.node(2, 1, 0);
            assertEquals(GeoMap.NO_LABEL, map.mergeEdges(map.dart(map.nodeAnchor(node))));

            map.mergeFaces(map.dart(MapFixtures.verticalEdge(2, 1, 1, 0)));
            int survivor = map.mergeEdges(map.dart(map.nodeAnchor(node)));

            assertEquals(1, survivor);
            assertFalse(map.nodeExists(node));
            assertFalse(map.edgeExists(2));
            assertEquals(MapFixtures.node(2, 0, 0), map.startNode(1));
            assertEquals(MapFixtures.node(2, 2, 0), map.endNode(1));
            assertTrue(map.isBorderProtected(1));
            assertEquals(2.0, map.contourArea(map.faceContours(map.leftFace(1)).getInt(0)), 1e-12);
            assertConsistent(map);
        }

        @Test
        @DisplayName("mergeEdges refuses a lone self-loop")
        void testMergeEdgesLoop() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int node = builder.addNode(0, 0);
            builder.addEdge(node, node, 2, 0, 2, 2, 0, 2);
            MemoryGeoMap map = builder.build();

            assertEquals(GeoMap.NO_LABEL, map.mergeEdges(map.dart(1)));
        }

        @Test
        @DisplayName("Only degree-0 nodes can be removed")
        void testRemoveIsolatedNode() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int a = builder.addNode(0, 0);
            int b = builder.addNode(1, 0);
            int lonely = builder.addNode(5, 5);
            builder.addEdge(a, b);
            MemoryGeoMap map = builder.build();

            assertFalse(map.removeIsolatedNode(a));
            assertTrue(map.removeIsolatedNode(lonely));
            assertFalse(map.nodeExists(lonely));
            assertFalse(map.removeIsolatedNode(lonely));
            assertEquals(1, map.nodeAnchor(a));
        }
    }

    @Nested
    @DisplayName("4. Flags and Cells")
    class FlagTests {

        @Test
        @DisplayName("Flags are set and cleared through cells")
        void testCellFlags() {
            MemoryGeoMap map = square();
            Cell edge = Cell.edge(2);
            Cell face = Cell.face(1);

            map.setFlags(edge, EdgeFlags.SCISSOR_PROTECTION, true);
            map.setFlags(face, FaceFlags.SRG_SEED, true);

            assertTrue(map.isProtected(2));
            assertTrue(map.isSeed(1));
            assertEquals(EdgeFlags.SCISSOR_PROTECTION, map.flags(edge));

            map.setFlags(edge, EdgeFlags.SCISSOR_PROTECTION, false);
            assertFalse(map.isProtected(2));
            assertTrue(map.exists(Cell.node(3)));
            assertFalse(map.exists(Cell.edge(9)));
        }

        @Test
        @DisplayName("Current contour is not a protection")
        void testCurrentContour() {
            MemoryGeoMap map = square();
            map.setEdgeFlags(1, EdgeFlags.CURRENT_CONTOUR, true);

            assertTrue(map.isCurrentContour(1));
            assertFalse(map.isProtected(1));
        }

        @Test
        @DisplayName("Cell rendering and validation")
        void testCell() {
            assertEquals("Edge 3", Cell.edge(3).toString());
            assertEquals("Face 0", Cell.face(0).toString());
            assertThrows(IllegalArgumentException.class, () -> Cell.node(-1));
        }
    }
}
