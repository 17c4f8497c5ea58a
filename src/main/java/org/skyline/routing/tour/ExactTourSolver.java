package org.skyline.routing.tour;

import lombok.extern.slf4j.Slf4j;
import org.skyline.routing.error.PathfinderException;
import org.skyline.routing.reduce.ReducedGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Brute-force tour solver.
 *
 * <p>The start anchor is fixed in first position and every ordering of the remaining anchors is
 * enumerated iteratively in lexicographic order of anchor index (next-permutation, no recursion).
 * The first ordering reaching the minimum cost wins.</p>
 *
 * <p>Work is split into shards by the anchor visited right after the start. Shards may run on
 * worker threads; their partial minima are merged in shard order, so the parallel result is the
 * same tour the sequential enumeration returns.</p>
 *
 * <p>Enumeration costs {@code (k-1)!} orderings for {@code k} anchors. Requests above
 * {@link #maxAnchors()} fail fast instead of running for hours.</p>
 */
@Slf4j
public final class ExactTourSolver implements TourSolver {
    public static final String REASON_NODE_LIMIT_EXCEEDED = "EXACT_NODE_LIMIT_EXCEEDED";
    public static final String REASON_INTERRUPTED = "EXACT_INTERRUPTED";
    public static final int DEFAULT_MAX_ANCHORS = 10;

    private final int maxAnchors;
    private final int parallelism;

    /**
     * Creates a sequential solver with the default anchor ceiling.
     */
    public ExactTourSolver() {
        this(DEFAULT_MAX_ANCHORS, 1);
    }

    /**
     * @param maxAnchors largest anchor count (start included) accepted.
     * @param parallelism worker threads for shards; values below 2 run on the caller thread.
     */
    public ExactTourSolver(int maxAnchors, int parallelism) {
        if (maxAnchors < 1) {
            throw new IllegalArgumentException("maxAnchors must be positive: " + maxAnchors);
        }
        this.maxAnchors = maxAnchors;
        this.parallelism = Math.max(1, parallelism);
    }

    public int maxAnchors() {
        return maxAnchors;
    }

    @Override
    public TourStrategy strategy() {
        return TourStrategy.EXACT;
    }

    @Override
    public Tour solve(ReducedGraph graph, int startNodeId, TourMode mode) {
        int startIndex = TourPreconditions.requireStartAnchor(graph, startNodeId, mode);
        int k = graph.size();
        if (k > maxAnchors) {
            throw new PathfinderException(
                    REASON_NODE_LIMIT_EXCEEDED,
                    "exact solver accepts at most " + maxAnchors + " anchors, got " + k
            );
        }
        if (k == 1) {
            return Tour.fromAnchorOrder(graph, new int[]{startIndex}, mode);
        }

        int[] rest = new int[k - 1];
        for (int i = 0, r = 0; i < k; i++) {
            if (i != startIndex) {
                rest[r++] = i;
            }
        }

        List<ShardResult> results = parallelism > 1 && rest.length > 1
                ? solveShardsParallel(graph, startIndex, rest, mode)
                : solveShardsSequential(graph, startIndex, rest, mode);

        ShardResult best = null;
        long evaluated = 0L;
        for (ShardResult result : results) {
            evaluated += result.evaluated();
            if (best == null || result.cost() < best.cost()) {
                best = result;
            }
        }
        log.debug("Exact solver evaluated {} orderings over {} anchors, best cost {}", evaluated, k, best.cost());
        return Tour.fromAnchorOrder(graph, best.order(), mode);
    }

    private List<ShardResult> solveShardsSequential(ReducedGraph graph, int startIndex, int[] rest, TourMode mode) {
        List<ShardResult> results = new ArrayList<>(rest.length);
        for (int shard = 0; shard < rest.length; shard++) {
            results.add(solveShard(graph, startIndex, rest, shard, mode));
        }
        return results;
    }

    private List<ShardResult> solveShardsParallel(ReducedGraph graph, int startIndex, int[] rest, TourMode mode) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, rest.length));
        try {
            List<Future<ShardResult>> futures = new ArrayList<>(rest.length);
            for (int shard = 0; shard < rest.length; shard++) {
                int shardIndex = shard;
                futures.add(executor.submit(() -> solveShard(graph, startIndex, rest, shardIndex, mode)));
            }
            List<ShardResult> results = new ArrayList<>(rest.length);
            for (Future<ShardResult> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Enumerates all orderings whose first hop is {@code rest[shard]}.
     */
    private static ShardResult solveShard(ReducedGraph graph, int startIndex, int[] rest, int shard, TourMode mode) {
        int m = rest.length;
        int[] tail = new int[m - 1];
        for (int i = 0, t = 0; i < m; i++) {
            if (i != shard) {
                tail[t++] = rest[i];
            }
        }

        int[] order = new int[m + 1];
        order[0] = startIndex;
        order[1] = rest[shard];
        double bestCost = Double.POSITIVE_INFINITY;
        int[] bestOrder = null;
        long evaluated = 0L;
        do {
            System.arraycopy(tail, 0, order, 2, tail.length);
            double cost = orderCost(graph, order, mode);
            evaluated++;
            if (cost < bestCost) {
                bestCost = cost;
                bestOrder = order.clone();
            }
        } while (nextPermutation(tail));
        return new ShardResult(bestOrder, bestCost, evaluated);
    }

    private static double orderCost(ReducedGraph graph, int[] order, TourMode mode) {
        double cost = graph.sequenceCost(order);
        if (mode == TourMode.CLOSED) {
            cost += graph.weight(order[order.length - 1], order[0]);
        }
        return cost;
    }

    /**
     * Rearranges {@code values} into the next lexicographic permutation.
     *
     * @return false when {@code values} was the last permutation.
     */
    static boolean nextPermutation(int[] values) {
        int i = values.length - 2;
        while (i >= 0 && values[i] >= values[i + 1]) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        int j = values.length - 1;
        while (values[j] <= values[i]) {
            j--;
        }
        swap(values, i, j);
        for (int lo = i + 1, hi = values.length - 1; lo < hi; lo++, hi--) {
            swap(values, lo, hi);
        }
        return true;
    }

    private static void swap(int[] values, int i, int j) {
        int tmp = values[i];
        values[i] = values[j];
        values[j] = tmp;
    }

    private static ShardResult await(Future<ShardResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PathfinderException(REASON_INTERRUPTED, "exact tour search interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("exact tour shard failed", cause);
        }
    }

    private record ShardResult(int[] order, double cost, long evaluated) {
    }
}
