package org.hourglass.map;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.hourglass.testutil.MapFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Map Topology Helper Tests")
class MapTopologyTest {

    @Nested
    @DisplayName("1. Hole Components")
    class HoleComponentTests {

        @Test
        @DisplayName("Island component is found from the hole anchor")
        void testIsland() {
            MemoryGeoMap map = CrackEdgeMaps.fromLabelImage(new int[][]{
                    {1, 1, 1},
                    {1, 2, 1},
                    {1, 1, 1}
            });
            int ring = CrackEdgeMaps.faceOfPixel(map, 0, 0);
            int island = CrackEdgeMaps.faceOfPixel(map, 1, 1);
            int hole = map.faceContours(ring).getInt(1);

            assertEquals(IntList.of(island), MapTopology.holeComponent(map, hole, false));
            assertEquals(IntList.of(ring, island), MapTopology.holeComponent(map, hole, true));
        }

        @Test
        @DisplayName("Component inside the infinite face contains every cell once")
        void testWholeGrid() {
            MemoryGeoMap map = MapFixtures.grid(2, 2);
            int hole = map.faceContours(0).getInt(0);

            IntList faces = MapTopology.holeComponent(map, hole, false);

            assertEquals(4, faces.size());
            assertEquals(4, new IntOpenHashSet(faces).size());
            assertFalse(faces.contains(0));
        }
    }

    @Nested
    @DisplayName("2. Face Protection")
    class ProtectionTests {

        @Test
        @DisplayName("Protecting a face protects its contour")
        void testProtect() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            MapTopology.protectFace(ring.map, ring.a, true);

            assertTrue(ring.map.isProtectedFace(ring.a));
            assertTrue(ring.map.isProtected(ring.edgeAB));
            assertTrue(ring.map.isProtected(ring.edgeDA));
            assertFalse(ring.map.isProtected(ring.edgeBC));
        }

        @Test
        @DisplayName("Edges shared with another protected face stay protected")
        void testUnprotectKeepsShared() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            MapTopology.protectFace(ring.map, ring.a, true);
            MapTopology.protectFace(ring.map, ring.b, true);
            MapTopology.protectFace(ring.map, ring.a, false);

            assertFalse(ring.map.isProtectedFace(ring.a));
            assertTrue(ring.map.isProtected(ring.edgeAB));
            assertFalse(ring.map.isProtected(ring.edgeDA));
        }

        @Test
        @DisplayName("Contour darts cover every edge of a cell once")
        void testContourDarts() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            IntList darts = MapTopology.contourDarts(ring.map, ring.a);

            assertEquals(4, darts.size());
            for (int i = 0; i < darts.size(); i++) {
                assertEquals(ring.a, ring.map.leftFace(darts.getInt(i)));
            }
        }
    }
}
