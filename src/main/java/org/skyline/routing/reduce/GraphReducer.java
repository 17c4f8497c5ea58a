package org.skyline.routing.reduce;

import lombok.extern.slf4j.Slf4j;
import org.skyline.routing.cache.PathCache;
import org.skyline.routing.error.PathfinderException;
import org.skyline.routing.error.UnreachableException;
import org.skyline.routing.graph.BuildingGraph;
import org.skyline.routing.path.Path;
import org.skyline.routing.path.PathSearch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the complete {@link ReducedGraph} over a set of anchor nodes.
 *
 * <p>Every unordered anchor pair is resolved through the request {@link PathCache}, so each pair
 * is searched at most once and the paths stay available for route expansion. With parallelism
 * above one, pair searches run on a short-lived fixed pool; they only read the immutable graph and
 * each writes its own cache entry. The first failing pair (in pair order) aborts the reduction.</p>
 */
@Slf4j
public final class GraphReducer {
    public static final String REASON_REDUCTION_INTERRUPTED = "REDUCE_INTERRUPTED";

    private final PathSearch search;
    private final int parallelism;

    /**
     * Creates a sequential reducer.
     */
    public GraphReducer(PathSearch search) {
        this(search, 1);
    }

    /**
     * Creates a reducer.
     *
     * @param search shortest-path search used on cache misses.
     * @param parallelism worker threads for pair searches; values below 2 run sequentially.
     */
    public GraphReducer(PathSearch search, int parallelism) {
        this.search = Objects.requireNonNull(search, "search");
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Reduces the graph to its anchors.
     *
     * @param graph original graph.
     * @param anchorNodeIds internal ids of the nodes to keep; duplicates are ignored.
     * @param cache request cache bound to {@code graph}.
     * @return complete reduced graph, anchors ordered by internal id.
     * @throws UnreachableException if any anchor pair is disconnected.
     */
    public ReducedGraph reduce(BuildingGraph graph, int[] anchorNodeIds, PathCache cache) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(anchorNodeIds, "anchorNodeIds");
        Objects.requireNonNull(cache, "cache");
        if (cache.graph() != graph) {
            throw new IllegalArgumentException("cache is bound to a different graph");
        }

        int[] anchors = Arrays.stream(anchorNodeIds).distinct().sorted().toArray();
        for (int nodeId : anchors) {
            graph.node(nodeId);
        }
        int k = anchors.length;
        String[] externalIds = new String[k];
        for (int i = 0; i < k; i++) {
            externalIds[i] = graph.externalId(anchors[i]);
        }

        List<int[]> pairs = new ArrayList<>(k * (k - 1) / 2);
        for (int i = 0; i < k; i++) {
            for (int j = i + 1; j < k; j++) {
                pairs.add(new int[]{i, j});
            }
        }

        Path[] paths = parallelism > 1 && pairs.size() > 1
                ? resolveParallel(anchors, pairs, cache)
                : resolveSequential(anchors, pairs, cache);

        double[][] weights = new double[k][k];
        for (int p = 0; p < pairs.size(); p++) {
            int i = pairs.get(p)[0];
            int j = pairs.get(p)[1];
            weights[i][j] = paths[p].cost();
            weights[j][i] = paths[p].cost();
        }
        log.debug("Reduced {} to {} anchors / {} edges ({} searches, {} cached paths)",
                graph, k, pairs.size(), cache.computations(), cache.size());
        return new ReducedGraph(anchors, externalIds, weights);
    }

    private Path[] resolveSequential(int[] anchors, List<int[]> pairs, PathCache cache) {
        Path[] paths = new Path[pairs.size()];
        for (int p = 0; p < pairs.size(); p++) {
            int[] pair = pairs.get(p);
            paths[p] = cache.getOrCompute(anchors[pair[0]], anchors[pair[1]], search);
        }
        return paths;
    }

    private Path[] resolveParallel(int[] anchors, List<int[]> pairs, PathCache cache) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, pairs.size()));
        try {
            List<Future<Path>> futures = new ArrayList<>(pairs.size());
            for (int[] pair : pairs) {
                int a = anchors[pair[0]];
                int b = anchors[pair[1]];
                futures.add(executor.submit(() -> cache.getOrCompute(a, b, search)));
            }
            Path[] paths = new Path[pairs.size()];
            for (int p = 0; p < futures.size(); p++) {
                paths[p] = await(futures.get(p));
            }
            return paths;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Path await(Future<Path> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PathfinderException(REASON_REDUCTION_INTERRUPTED, "graph reduction interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("pair search failed", cause);
        }
    }
}
