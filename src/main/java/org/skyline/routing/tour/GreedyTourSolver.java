package org.skyline.routing.tour;

import org.skyline.routing.reduce.ReducedGraph;

/**
 * Nearest-neighbour tour heuristic.
 *
 * <p>From the current anchor, moves to the closest unvisited anchor; equal weights go to the anchor
 * whose external id sorts first. No backtracking, so the result is feasible but not necessarily
 * optimal. Runs in {@code O(k^2)}.</p>
 */
public final class GreedyTourSolver implements TourSolver {

    @Override
    public TourStrategy strategy() {
        return TourStrategy.GREEDY;
    }

    @Override
    public Tour solve(ReducedGraph graph, int startNodeId, TourMode mode) {
        int startIndex = TourPreconditions.requireStartAnchor(graph, startNodeId, mode);
        int k = graph.size();
        boolean[] visited = new boolean[k];
        int[] order = new int[k];
        order[0] = startIndex;
        visited[startIndex] = true;

        int current = startIndex;
        for (int step = 1; step < k; step++) {
            int next = -1;
            double nextWeight = Double.POSITIVE_INFINITY;
            for (int candidate = 0; candidate < k; candidate++) {
                if (visited[candidate]) {
                    continue;
                }
                double w = graph.weight(current, candidate);
                if (next < 0
                        || w < nextWeight
                        || (w == nextWeight && graph.externalId(candidate).compareTo(graph.externalId(next)) < 0)) {
                    next = candidate;
                    nextWeight = w;
                }
            }
            visited[next] = true;
            order[step] = next;
            current = next;
        }
        return Tour.fromAnchorOrder(graph, order, mode);
    }
}
