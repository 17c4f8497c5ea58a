package org.skyline.routing.cache;

import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.path.Path;
import org.skyline.routing.path.PathSearch;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request-scoped store of shortest paths keyed by unordered node pair.
 *
 * <p>One cache belongs to one route computation over one immutable graph. Entries are never
 * replaced or invalidated: the first path stored for a pair wins. Lookups return the path oriented
 * in the requested direction regardless of the orientation it was stored in.</p>
 *
 * <p>Thread-safe. {@link #getOrCompute} runs the search at most once per pair even under
 * concurrent callers; a failed search stores nothing.</p>
 */
public final class PathCache {
    private final BuildingGraph graph;
    private final ConcurrentMap<Long, Path> pathByPair = new ConcurrentHashMap<>();
    private final AtomicInteger computations = new AtomicInteger();

    /**
     * Creates an empty cache bound to one graph.
     */
    public PathCache(BuildingGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public BuildingGraph graph() {
        return graph;
    }

    /**
     * Returns the cached path from {@code a} to {@code b}, checking both orientations.
     */
    public Optional<Path> get(int a, int b) {
        Path stored = pathByPair.get(BuildingGraph.unorderedPairKey(a, b));
        return Optional.ofNullable(stored).map(path -> orient(path, a));
    }

    /**
     * Stores a path for the pair unless one is already present.
     *
     * @return true when the path was inserted, false when an entry already existed.
     */
    public boolean put(int a, int b, Path path) {
        Objects.requireNonNull(path, "path");
        checkEndpoints(a, b, path);
        return pathByPair.putIfAbsent(BuildingGraph.unorderedPairKey(a, b), path) == null;
    }

    /**
     * Returns the cached path or computes, stores and returns it.
     *
     * @param a path source.
     * @param b path destination.
     * @param search search used on a miss.
     * @return path oriented from {@code a} to {@code b}.
     */
    public Path getOrCompute(int a, int b, PathSearch search) {
        Objects.requireNonNull(search, "search");
        Path stored = pathByPair.computeIfAbsent(BuildingGraph.unorderedPairKey(a, b), key -> {
            computations.incrementAndGet();
            Path computed = search.shortestPath(graph, a, b);
            checkEndpoints(a, b, computed);
            return computed;
        });
        return orient(stored, a);
    }

    public boolean contains(int a, int b) {
        return pathByPair.containsKey(BuildingGraph.unorderedPairKey(a, b));
    }

    /**
     * @return number of cached pairs.
     */
    public int size() {
        return pathByPair.size();
    }

    /**
     * @return number of searches run through {@link #getOrCompute}.
     */
    public int computations() {
        return computations.get();
    }

    private static Path orient(Path path, int source) {
        return path.source() == source ? path : path.reversed();
    }

    private static void checkEndpoints(int a, int b, Path path) {
        boolean forward = path.source() == a && path.destination() == b;
        boolean backward = path.source() == b && path.destination() == a;
        if (!forward && !backward) {
            throw new IllegalArgumentException(
                    "path " + path.source() + " -> " + path.destination() + " does not connect " + a + " and " + b
            );
        }
    }
}
