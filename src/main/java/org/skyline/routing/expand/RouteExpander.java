package org.skyline.routing.expand;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.skyline.routing.cache.PathCache;
import org.skyline.routing.error.InconsistentCacheException;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.path.Path;
import org.skyline.routing.tour.Tour;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns an abstract tour into a gap-free route over the original graph.
 *
 * <p>Each tour leg is replaced by its cached shortest path. The first node of every leg after the
 * first is the last node of the previous one and is dropped, so junctions appear once. Route cost
 * is the sum of leg path costs in tour order, which is exactly the tour cost.</p>
 */
public final class RouteExpander {

    /**
     * Expands a tour.
     *
     * @param tour solved tour over anchors of {@code cache}'s graph.
     * @param cache request cache filled during reduction.
     * @return expanded route.
     * @throws InconsistentCacheException if a leg has no cached path.
     */
    public Route expand(Tour tour, PathCache cache) {
        Objects.requireNonNull(tour, "tour");
        Objects.requireNonNull(cache, "cache");
        BuildingGraph graph = cache.graph();

        IntArrayList nodes = new IntArrayList();
        nodes.add(tour.nodeAt(0));
        double cost = 0.0d;
        for (int i = 1; i < tour.length(); i++) {
            int from = tour.nodeAt(i - 1);
            int to = tour.nodeAt(i);
            Path leg = from == to
                    ? Path.single(from)
                    : cache.get(from, to).orElseThrow(() -> new InconsistentCacheException(
                            "no cached path for tour leg " + graph.externalId(from) + " -> " + graph.externalId(to)
                    ));
            for (int j = 1; j < leg.length(); j++) {
                nodes.add(leg.nodeAt(j));
            }
            cost += leg.cost();
        }

        int[] nodeIds = nodes.toIntArray();
        List<String> externalIds = new ArrayList<>(nodeIds.length);
        for (int nodeId : nodeIds) {
            externalIds.add(graph.externalId(nodeId));
        }
        return new Route(nodeIds, List.copyOf(externalIds), cost);
    }
}
