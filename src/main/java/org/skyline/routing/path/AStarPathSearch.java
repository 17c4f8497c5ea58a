package org.skyline.routing.path;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.skyline.routing.error.UnreachableException;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.heuristic.GoalBoundHeuristic;
import org.skyline.routing.heuristic.HeuristicFactory;
import org.skyline.routing.heuristic.HeuristicProvider;
import org.skyline.routing.heuristic.HeuristicType;
import org.skyline.routing.search.FrontierQueue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Informed best-first (A*) shortest-path search.
 *
 * <p>Frontier priority is {@code g + h} where {@code h} comes from the bound heuristic. Equal
 * priorities are expanded in enqueue order, which makes the returned path deterministic. A node is
 * re-opened only when a strictly cheaper {@code g} is found. The search ends when the destination is
 * polled (optimal under an admissible, consistent heuristic) or when the frontier runs dry.</p>
 *
 * <p>All bookkeeping is local to one call, so a single instance may serve concurrent searches on
 * the same graph.</p>
 */
@Slf4j
public final class AStarPathSearch implements PathSearch {
    private static final int NO_PARENT = -1;

    private final HeuristicType heuristicType;
    private volatile ProviderBinding binding;

    /**
     * Creates a search using the given heuristic mode.
     *
     * @param heuristicType heuristic to bind per graph ({@code NONE} gives Dijkstra).
     */
    public AStarPathSearch(HeuristicType heuristicType) {
        this.heuristicType = Objects.requireNonNull(heuristicType, "heuristicType");
    }

    /**
     * Creates a search for an algorithm/heuristic pair. Dijkstra ignores the heuristic.
     */
    public static AStarPathSearch of(SearchAlgorithm algorithm, HeuristicType heuristicType) {
        Objects.requireNonNull(algorithm, "algorithm");
        return switch (algorithm) {
            case DIJKSTRA -> new AStarPathSearch(HeuristicType.NONE);
            case A_STAR -> new AStarPathSearch(heuristicType);
        };
    }

    public HeuristicType heuristicType() {
        return heuristicType;
    }

    @Override
    public Path shortestPath(BuildingGraph graph, int source, int destination) {
        Objects.requireNonNull(graph, "graph");
        checkNode(graph, source, "source");
        checkNode(graph, destination, "destination");
        if (source == destination) {
            return Path.single(source);
        }

        GoalBoundHeuristic heuristic = providerFor(graph).bindGoal(destination);
        int nodeCount = graph.nodeCount();
        double[] bestG = new double[nodeCount];
        Arrays.fill(bestG, Double.POSITIVE_INFINITY);
        int[] parent = new int[nodeCount];
        Arrays.fill(parent, NO_PARENT);

        FrontierQueue frontier = new FrontierQueue(nodeCount);
        bestG[source] = 0.0d;
        frontier.offer(source, 0.0d, estimate(heuristic, source));

        BuildingGraph.NeighborIterator iterator = graph.iterator();
        int settled = 0;
        while (!frontier.isEmpty()) {
            FrontierQueue.Entry entry = frontier.poll();
            int nodeId = entry.nodeId();
            double g = entry.gScore();
            if (g > bestG[nodeId]) {
                continue;
            }
            settled++;
            if (nodeId == destination) {
                log.trace("A* {} -> {} settled {} nodes, peak frontier {}",
                        source, destination, settled, frontier.peakSize());
                return buildPath(parent, source, destination, g);
            }

            iterator.resetForNode(nodeId);
            while (iterator.hasNext()) {
                int next = iterator.next();
                double nextG = g + iterator.weight();
                if (nextG < bestG[next]) {
                    bestG[next] = nextG;
                    parent[next] = nodeId;
                    frontier.offer(next, nextG, nextG + estimate(heuristic, next));
                }
            }
        }
        throw new UnreachableException(graph.externalId(source), graph.externalId(destination));
    }

    private HeuristicProvider providerFor(BuildingGraph graph) {
        ProviderBinding current = binding;
        if (current == null || current.graph() != graph) {
            current = new ProviderBinding(graph, HeuristicFactory.create(heuristicType, graph));
            binding = current;
        }
        return current.provider();
    }

    /**
     * Invalid estimates are clamped to zero so queue ordering stays numerically safe.
     */
    private static double estimate(GoalBoundHeuristic heuristic, int nodeId) {
        double estimate = heuristic.estimateFromNode(nodeId);
        if (!Double.isFinite(estimate) || estimate < 0.0d) {
            return 0.0d;
        }
        return estimate;
    }

    private static Path buildPath(int[] parent, int source, int destination, double cost) {
        IntArrayList reversed = new IntArrayList();
        int cursor = destination;
        while (cursor != NO_PARENT) {
            reversed.add(cursor);
            if (cursor == source) {
                break;
            }
            cursor = parent[cursor];
        }
        IntArrayList forward = new IntArrayList(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            forward.add(reversed.getInt(i));
        }
        return Path.of(forward, cost);
    }

    private static void checkNode(BuildingGraph graph, int nodeId, String field) {
        if (nodeId < 0 || nodeId >= graph.nodeCount()) {
            throw new IllegalArgumentException(field + " out of bounds: " + nodeId + " [0, " + graph.nodeCount() + ")");
        }
    }

    private record ProviderBinding(BuildingGraph graph, HeuristicProvider provider) {
    }
}
