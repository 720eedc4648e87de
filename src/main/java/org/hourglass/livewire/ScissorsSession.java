package org.hourglass.livewire;

import org.hourglass.cost.DartCostFunction;
import org.hourglass.map.Dart;
import org.hourglass.map.EdgeFlags;
import org.hourglass.map.GeoMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Intelligent-scissors contour tracing driven by method calls instead of mouse events.
 * <p>
 * A contour consists of committed live-wire segments. Committed edges are flagged
 * {@link EdgeFlags#SCISSOR_PROTECTION} permanently and {@link EdgeFlags#CURRENT_CONTOUR} until
 * {@link #finish()}, which keeps the next segments from running back along the contour.
 * </p>
 */
public final class ScissorsSession {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScissorsSession.class);

    private final GeoMap map;
    private final DartCostFunction costFunction;
    private LiveWire liveWire;
    private int contourStartNode = GeoMap.NO_LABEL;
    private List<Dart> loop = new ArrayList<>();
    private final List<Dart> contour = new ArrayList<>();

    public ScissorsSession(GeoMap map, DartCostFunction costFunction) {
        this.map = Objects.requireNonNull(map, "map");
        this.costFunction = Objects.requireNonNull(costFunction, "costFunction");
    }

    /**
     * Begins a new contour at {@code node}.
     *
     * @throws IllegalStateException if a contour is already being traced.
     */
    public void start(int node) {
        if (isActive()) {
            throw new IllegalStateException("contour already started at node " + contourStartNode);
        }
        contourStartNode = node;
        liveWire = new LiveWire(map, costFunction, node);
        loop = new ArrayList<>();
    }

    public boolean isActive() {
        return liveWire != null;
    }

    /**
     * Performs one unit of live-wire expansion.
     *
     * @return false when there is nothing left to expand.
     */
    public boolean expandStep() {
        return requireLiveWire().expandBorder();
    }

    /**
     * Moves the end of the preview path to {@code node} if a path to it is already known.
     *
     * @return false if {@code node} has not been reached yet (the preview is unchanged).
     */
    public boolean moveTo(int node) {
        LiveWire wire = requireLiveWire();
        if (!wire.setEndNodeLabel(node)) {
            return false;
        }
        loop = wire.loopPath(contourStartNode);
        return true;
    }

    /**
     * Darts of the current preview path, from its end back to the segment start.
     */
    public List<Dart> previewPath() {
        List<Dart> path = new ArrayList<>();
        for (Dart dart : requireLiveWire().pathDarts()) {
            path.add(dart);
        }
        return path;
    }

    /**
     * Path from the contour start back to the preview end, if the preview closes a loop.
     */
    public List<Dart> previewLoop() {
        return Collections.unmodifiableList(loop);
    }

    /**
     * Fixes the preview path as part of the contour and restarts the live wire at its end.
     *
     * @return number of committed darts.
     */
    public int commitSegment() {
        LiveWire wire = requireLiveWire();
        List<Dart> segment = previewPath();
        protect(segment);
        liveWire = new LiveWire(map, costFunction, wire.endNodeLabel());
        loop = new ArrayList<>();
        LOGGER.debug("committed {} darts, live wire restarted at node {}", segment.size(), wire.endNodeLabel());
        return segment.size();
    }

    /**
     * Commits the current segment together with the loop back to the contour start, then
     * finishes the contour.
     *
     * @return the finished contour, or an empty list if the preview does not close a loop (the
     * session then stays active).
     */
    public List<Dart> closeLoop() {
        requireLiveWire();
        if (loop.isEmpty()) {
            return List.of();
        }
        List<Dart> closing = loop;
        commitSegment();
        protect(closing);
        return finish();
    }

    /**
     * Ends the contour: clears {@link EdgeFlags#CURRENT_CONTOUR} on its edges.
     *
     * @return the committed darts in commit order.
     */
    public List<Dart> finish() {
        requireLiveWire();
        for (Dart dart : contour) {
            if (map.edgeExists(dart.edgeLabel())) {
                map.setEdgeFlags(dart.edgeLabel(), EdgeFlags.CURRENT_CONTOUR, false);
            }
        }
        List<Dart> result = List.copyOf(contour);
        contour.clear();
        liveWire = null;
        contourStartNode = GeoMap.NO_LABEL;
        loop = new ArrayList<>();
        LOGGER.debug("contour finished with {} darts", result.size());
        return result;
    }

    public LiveWire liveWire() {
        return requireLiveWire();
    }

    private void protect(List<Dart> darts) {
        for (Dart dart : darts) {
            map.setEdgeFlags(dart.edgeLabel(), EdgeFlags.SCISSOR_PROTECTION | EdgeFlags.CURRENT_CONTOUR, true);
            contour.add(dart);
        }
    }

    private LiveWire requireLiveWire() {
        if (liveWire == null) {
            throw new IllegalStateException("no contour started");
        }
        return liveWire;
    }
}
