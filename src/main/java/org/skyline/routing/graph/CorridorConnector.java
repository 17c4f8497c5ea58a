package org.skyline.routing.graph;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.skyline.routing.error.PathfinderException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Attaches isolated critical nodes (rooms) to the corridor network.
 *
 * <p>For a room {@code C} without edges, the two nearest transit nodes {@code A} and {@code B} on
 * the same floor define a corridor segment. {@code C} is projected orthogonally onto {@code AB}
 * (clamped to the segment) as a new transit node {@code D = "T-" + C}, which is then connected to
 * {@code A}, {@code B} and {@code C} with straight-line weights:</p>
 * <pre>
 *   ( A ) - ( D ) - - ( B )
 *             |
 *             C
 * </pre>
 */
@Slf4j
@UtilityClass
public final class CorridorConnector {
    public static final String REASON_INSUFFICIENT_TRANSIT_NODES = "CONNECTOR_INSUFFICIENT_TRANSIT_NODES";
    public static final String PROJECTION_PREFIX = "T-";

    /**
     * Connects every critical node that has no edges yet.
     *
     * @param builder graph under construction.
     * @return ids of the projection nodes that were added, in processing order.
     * @throws PathfinderException when a room has fewer than two transit candidates on its floor.
     */
    public static List<String> connectIsolatedCriticalNodes(BuildingGraph.Builder builder) {
        Objects.requireNonNull(builder, "builder");
        List<String> added = new ArrayList<>();
        for (BuildingNode room : builder.nodes()) {
            if (!room.isCritical() || builder.degree(room.getId()) > 0) {
                continue;
            }
            List<BuildingNode> nearest = nearestTransitNodes(builder.nodes(), room, 2);
            BuildingNode a = nearest.get(0);
            BuildingNode b = nearest.get(1);
            BuildingNode projection = project(a, b, room);

            builder.addNode(projection);
            builder.addEuclideanEdge(a.getId(), projection.getId());
            builder.addEuclideanEdge(b.getId(), projection.getId());
            builder.addEuclideanEdge(room.getId(), projection.getId());
            added.add(projection.getId());
            log.debug("Connected {} to corridor {} - {} via {}", room.getId(), a.getId(), b.getId(), projection.getId());
        }
        return added;
    }

    /**
     * Returns the {@code k} transit nodes on the room's floor closest to it, nearest first.
     * Nodes at zero distance are ignored.
     */
    static List<BuildingNode> nearestTransitNodes(List<BuildingNode> nodes, BuildingNode room, int k) {
        List<BuildingNode> candidates = new ArrayList<>();
        for (BuildingNode node : nodes) {
            if (node.isCritical() || Double.compare(node.getZ(), room.getZ()) != 0) {
                continue;
            }
            if (GeometryDistance.euclideanDistance(node, room) == 0.0d) {
                continue;
            }
            candidates.add(node);
        }
        if (candidates.size() < k) {
            throw new PathfinderException(
                    REASON_INSUFFICIENT_TRANSIT_NODES,
                    "room " + room.getId() + " has only " + candidates.size()
                            + " transit candidates on floor " + room.getZ() + ", need " + k
            );
        }
        candidates.sort(Comparator.comparingDouble(node -> GeometryDistance.euclideanDistance(node, room)));
        return List.copyOf(candidates.subList(0, k));
    }

    /**
     * Projects {@code room} onto segment {@code pq}, clamping to the nearest segment end.
     */
    static BuildingNode project(BuildingNode p, BuildingNode q, BuildingNode room) {
        double dx = q.getX() - p.getX();
        double dy = q.getY() - p.getY();
        double dz = q.getZ() - p.getZ();
        double lengthSquared = dx * dx + dy * dy + dz * dz;

        double t = 0.0d;
        if (lengthSquared > 0.0d) {
            t = ((room.getX() - p.getX()) * dx
                    + (room.getY() - p.getY()) * dy
                    + (room.getZ() - p.getZ()) * dz) / lengthSquared;
            t = Math.max(0.0d, Math.min(1.0d, t));
        }
        return BuildingNode.transit(
                PROJECTION_PREFIX + room.getId(),
                p.getX() + t * dx,
                p.getY() + t * dy,
                p.getZ() + t * dz
        );
    }
}
