package org.hourglass.waterfall;

import it.unimi.dsi.fastutil.ints.IntList;
import org.hourglass.core.SegmentationException;
import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.MemoryGeoMap;
import org.hourglass.testutil.MapFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Waterfall Tests")
class WaterfallTest {

    private static Waterfall ringWaterfall(MapFixtures.Ring ring) {
        return new Waterfall(ring.map, DartCostFunction.byEdgeLabel(ring.costs));
    }

    @Nested
    @DisplayName("1. Spanning Forest")
    class SpanningForestTests {

        @Test
        @DisplayName("MST connects all cells and skips the most expensive cycle edge")
        void testMst() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            double[] mst = ringWaterfall(ring).minimumSpanningForest();

            assertEquals(1.0, mst[ring.edgeAB]);
            assertEquals(1.0, mst[ring.edgeCD]);
            assertEquals(2.0, mst[ring.edgeBC]);
            assertTrue(Double.isNaN(mst[ring.edgeDA]));
            assertTrue(Double.isNaN(mst[MapFixtures.horizontalEdge(2, 0, 0)]));
        }

        @Test
        @DisplayName("Regional minima are strictly cheaper than their MST neighbours")
        void testMinima() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            Waterfall waterfall = ringWaterfall(ring);

            IntList minima = waterfall.regionalMinima(waterfall.minimumSpanningForest());

            assertEquals(IntList.of(ring.edgeAB, ring.edgeCD), minima);
        }

        @Test
        @DisplayName("Plateaus yield no minima and no merges")
        void testPlateau() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            Waterfall waterfall = new Waterfall(ring.map, DartCostFunction.constant(1.0));

            assertTrue(waterfall.regionalMinima(waterfall.minimumSpanningForest()).isEmpty());
            assertTrue(waterfall.hierarchy(5).isEmpty());
            assertEquals(5, ring.map.faceCount());
        }
    }

    @Nested
    @DisplayName("2. Levels")
    class LevelTests {

        @Test
        @DisplayName("First level merges each basin")
        void testFirstLevel() {
            MapFixtures.Ring ring = new MapFixtures.Ring();

            WaterfallLevel level = ringWaterfall(ring).apply();

            assertEquals(2, level.merges());
            assertEquals(3, level.mstEdgeCount());
            assertTrue(level.isMstEdge(ring.edgeBC));
            assertFalse(level.isMstEdge(ring.edgeDA));
            assertEquals(ring.edgeAB, level.faceLabels()[ring.a]);
            assertEquals(ring.edgeAB, level.faceLabels()[ring.b]);
            assertEquals(ring.edgeCD, level.faceLabels()[ring.c]);
            assertEquals(ring.edgeCD, level.faceLabels()[ring.d]);
            assertEquals(3, ring.map.faceCount());
            assertTrue(ring.map.checkConsistency().isValid());
        }

        @Test
        @DisplayName("Hierarchy coarsens until a fixed point")
        void testHierarchy() {
            MapFixtures.Ring ring = new MapFixtures.Ring();
            Waterfall waterfall = ringWaterfall(ring);

            List<WaterfallLevel> levels = waterfall.hierarchy(10);

            assertEquals(2, levels.size());
            assertEquals(2, levels.get(0).merges());
            assertEquals(1, levels.get(1).merges());
            assertEquals(2, ring.map.faceCount());
            assertEquals(0, waterfall.apply().merges());
        }

        @Test
        @DisplayName("maxLevels limits the number of levels")
        void testMaxLevels() {
            MapFixtures.Ring ring = new MapFixtures.Ring();

            assertEquals(1, ringWaterfall(ring).hierarchy(1).size());
            assertEquals(3, ring.map.faceCount());
            assertThrows(IllegalArgumentException.class, () -> ringWaterfall(ring).hierarchy(-1));
        }

        @Test
        @DisplayName("An unprotected bridge aborts the commit")
        void testUnexpectedBridge() {
            MemoryGeoMap.Builder builder = MemoryGeoMap.builder();
            int a = builder.addNode(0, 0);
            int b = builder.addNode(1, 0);
            builder.addEdge(a, b);
            MemoryGeoMap map = builder.build();

            SegmentationException ex = assertThrows(SegmentationException.class,
                    () -> new Waterfall(map, DartCostFunction.constant(1.0)).apply());
            assertEquals(SegmentationException.REASON_UNEXPECTED_BRIDGE, ex.reasonCode());
        }
    }
}
