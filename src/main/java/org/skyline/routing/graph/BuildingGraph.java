package org.skyline.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.Long2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.skyline.core.id.NodeIdMapper;
import org.skyline.routing.error.DuplicateNodeException;
import org.skyline.routing.error.InvalidWeightException;
import org.skyline.routing.error.UnknownNodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable undirected, Euclidean-weighted building graph.
 * <p>
 * Construction happens through {@link Builder}; once {@link Builder#build()} returns, the graph
 * never changes and may be shared read-only across threads.
 * <p>
 * Layout:
 * <ul>
 * <li>Nodes get dense internal ids {@code [0, nodeCount)} in insertion order.</li>
 * <li>Adjacency is stored CSR-style: each undirected edge occupies two adjacency slots.</li>
 * <li>Edge list arrays keep one entry per undirected edge in declaration order.</li>
 * </ul>
 */
public final class BuildingGraph {
    private static final double NO_EDGE = Double.NaN;

    private final BuildingNode[] nodes;
    private final NodeIdMapper nodeIdMapper;

    // CSR adjacency: slots [firstSlot[n], firstSlot[n + 1]) belong to node n
    private final int[] firstSlot;
    private final int[] slotTarget;
    private final double[] slotWeight;

    // Undirected edge list
    private final int[] edgeFrom;
    private final int[] edgeTo;
    private final double[] edgeWeight;
    private final Long2DoubleOpenHashMap weightByPair;

    private final int[] criticalNodeIds;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private BuildingGraph(
            BuildingNode[] nodes,
            NodeIdMapper nodeIdMapper,
            int[] firstSlot,
            int[] slotTarget,
            double[] slotWeight,
            int[] edgeFrom,
            int[] edgeTo,
            double[] edgeWeight,
            Long2DoubleOpenHashMap weightByPair,
            int[] criticalNodeIds
    ) {
        this.nodes = nodes;
        this.nodeIdMapper = nodeIdMapper;
        this.firstSlot = firstSlot;
        this.slotTarget = slotTarget;
        this.slotWeight = slotWeight;
        this.edgeFrom = edgeFrom;
        this.edgeTo = edgeTo;
        this.edgeWeight = edgeWeight;
        this.weightByPair = weightByPair;
        this.criticalNodeIds = criticalNodeIds;
        this.nodeCount = nodes.length;
        this.edgeCount = edgeWeight.length;
    }

    /**
     * Creates an empty graph builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Packs an unordered internal node pair into one order-independent key.
     */
    public static long unorderedPairKey(int a, int b) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        return ((long) low << 32) | (high & 0xFFFFFFFFL);
    }

    // ========================================================================
    // NODE ACCESS
    // ========================================================================

    public BuildingNode node(int nodeId) {
        checkNode(nodeId);
        return nodes[nodeId];
    }

    /**
     * Resolves an external node id to its internal id.
     *
     * @throws UnknownNodeException if the id is not part of this graph.
     */
    public int nodeIndex(String externalId) {
        return nodeIdMapper.toInternal(externalId);
    }

    public boolean containsNode(String externalId) {
        return nodeIdMapper.containsExternal(externalId);
    }

    public String externalId(int nodeId) {
        checkNode(nodeId);
        return nodes[nodeId].getId();
    }

    public NodeIdMapper nodeIdMapper() {
        return nodeIdMapper;
    }

    /**
     * @return internal ids of all critical nodes, ascending.
     */
    public int[] criticalNodeIds() {
        return criticalNodeIds.clone();
    }

    public int degree(int nodeId) {
        checkNode(nodeId);
        return firstSlot[nodeId + 1] - firstSlot[nodeId];
    }

    // ========================================================================
    // EDGE ACCESS
    // ========================================================================

    public int edgeFrom(int edgeId) {
        checkEdge(edgeId);
        return edgeFrom[edgeId];
    }

    public int edgeTo(int edgeId) {
        checkEdge(edgeId);
        return edgeTo[edgeId];
    }

    public double edgeWeight(int edgeId) {
        checkEdge(edgeId);
        return edgeWeight[edgeId];
    }

    /**
     * Looks up the weight of the edge between two nodes, in either direction.
     */
    public OptionalDouble findEdgeWeight(int a, int b) {
        checkNode(a);
        checkNode(b);
        double weight = weightByPair.get(unorderedPairKey(a, b));
        return Double.isNaN(weight) ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    // ========================================================================
    // TRAVERSAL
    // ========================================================================

    /**
     * Returns a lazy, restartable view over {@code (neighbor, weight)} pairs of one node.
     */
    public NeighborIterator neighbors(int nodeId) {
        checkNode(nodeId);
        return new NeighborIterator(this).resetForNode(nodeId);
    }

    /**
     * Returns neighbors of a node addressed by external id.
     */
    public NeighborIterator neighbors(String externalId) {
        return neighbors(nodeIndex(externalId));
    }

    /**
     * Returns an unpositioned iterator for reuse across many nodes.
     */
    public NeighborIterator iterator() {
        return new NeighborIterator(this);
    }

    /**
     * Reusable cursor over the adjacency slots of one node.
     * Does not allocate per step.
     */
    public static final class NeighborIterator {
        private final BuildingGraph graph;
        private int start;
        private int current;
        private int end;
        private int lastSlot = -1;

        NeighborIterator(BuildingGraph graph) {
            this.graph = graph;
        }

        /**
         * Positions the iterator on the first neighbor of a node.
         */
        public NeighborIterator resetForNode(int nodeId) {
            graph.checkNode(nodeId);
            this.start = graph.firstSlot[nodeId];
            this.end = graph.firstSlot[nodeId + 1];
            this.current = start;
            this.lastSlot = -1;
            return this;
        }

        /**
         * Rewinds to the first neighbor of the current node.
         */
        public NeighborIterator restart() {
            this.current = start;
            this.lastSlot = -1;
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        /**
         * Advances and returns the next neighbor node id.
         */
        public int next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            lastSlot = current++;
            return graph.slotTarget[lastSlot];
        }

        /**
         * Returns the weight of the edge to the neighbor last returned by {@link #next()}.
         */
        public double weight() {
            if (lastSlot < 0) {
                throw new IllegalStateException("next() has not been called");
            }
            return graph.slotWeight[lastSlot];
        }
    }

    private void checkNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.length) {
            throw new IllegalArgumentException("nodeId out of bounds: " + nodeId + " [0, " + nodes.length + ")");
        }
    }

    private void checkEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeWeight.length) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + edgeWeight.length + ")");
        }
    }

    @Override
    public String toString() {
        return String.format("BuildingGraph[nodes=%d, edges=%d, critical=%d]",
                nodeCount, edgeCount, criticalNodeIds.length);
    }

    /**
     * Mutable construction phase of a {@link BuildingGraph}.
     *
     * <p>Not thread-safe. A second edge between the same unordered pair overwrites the earlier
     * weight but keeps its original declaration position.</p>
     */
    public static final class Builder {
        private final List<BuildingNode> nodes = new ArrayList<>();
        private final Object2IntOpenHashMap<String> indexById = new Object2IntOpenHashMap<>();
        private final Long2DoubleLinkedOpenHashMap weightByPair = new Long2DoubleLinkedOpenHashMap();
        private final IntArrayList degree = new IntArrayList();

        private Builder() {
            indexById.defaultReturnValue(-1);
        }

        /**
         * Adds a node.
         *
         * @throws DuplicateNodeException if a node with the same id exists.
         */
        public Builder addNode(BuildingNode node) {
            Objects.requireNonNull(node, "node");
            String id = node.getId();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("node id must be non-blank");
            }
            if (!Double.isFinite(node.getX()) || !Double.isFinite(node.getY()) || !Double.isFinite(node.getZ())) {
                throw new IllegalArgumentException("node " + id + " has non-finite coordinates");
            }
            if (indexById.containsKey(id)) {
                throw new DuplicateNodeException(id);
            }
            indexById.put(id, nodes.size());
            nodes.add(node);
            degree.add(0);
            return this;
        }

        /**
         * Adds (or overwrites) an undirected edge.
         *
         * @throws UnknownNodeException if either endpoint is absent.
         * @throws InvalidWeightException if the weight is negative or not finite.
         */
        public Builder addEdge(String a, String b, double weight) {
            int from = requireIndex(a);
            int to = requireIndex(b);
            if (!Double.isFinite(weight) || weight < 0.0d) {
                throw new InvalidWeightException(a, b, weight);
            }
            if (from == to) {
                throw new IllegalArgumentException("self-loop on node " + a + " is not allowed");
            }
            long key = unorderedPairKey(from, to);
            if (!weightByPair.containsKey(key)) {
                degree.set(from, degree.getInt(from) + 1);
                degree.set(to, degree.getInt(to) + 1);
            }
            weightByPair.put(key, weight);
            return this;
        }

        /**
         * Adds an edge weighted by the straight-line distance between its endpoints.
         */
        public Builder addEuclideanEdge(String a, String b) {
            BuildingNode from = node(a);
            BuildingNode to = node(b);
            return addEdge(a, b, GeometryDistance.euclideanDistance(from, to));
        }

        public boolean containsNode(String id) {
            return indexById.containsKey(id);
        }

        /**
         * @throws UnknownNodeException if the id is absent.
         */
        public BuildingNode node(String id) {
            return nodes.get(requireIndex(id));
        }

        /**
         * @return number of edges touching the node so far.
         */
        public int degree(String id) {
            return degree.getInt(requireIndex(id));
        }

        /**
         * @return read-only snapshot of the nodes added so far, in insertion order.
         */
        public List<BuildingNode> nodes() {
            return Collections.unmodifiableList(new ArrayList<>(nodes));
        }

        /**
         * Freezes the current state into an immutable graph.
         */
        public BuildingGraph build() {
            int nodeCount = nodes.size();
            int edgeCount = weightByPair.size();

            BuildingNode[] nodeArray = nodes.toArray(new BuildingNode[0]);
            List<String> orderedIds = new ArrayList<>(nodeCount);
            IntArrayList critical = new IntArrayList();
            for (int i = 0; i < nodeCount; i++) {
                orderedIds.add(nodeArray[i].getId());
                if (nodeArray[i].isCritical()) {
                    critical.add(i);
                }
            }

            int[] firstSlot = new int[nodeCount + 1];
            for (int i = 0; i < nodeCount; i++) {
                firstSlot[i + 1] = firstSlot[i] + degree.getInt(i);
            }
            int[] cursor = new int[nodeCount];
            System.arraycopy(firstSlot, 0, cursor, 0, nodeCount);

            int[] slotTarget = new int[edgeCount * 2];
            double[] slotWeight = new double[edgeCount * 2];
            int[] edgeFrom = new int[edgeCount];
            int[] edgeTo = new int[edgeCount];
            double[] edgeWeight = new double[edgeCount];
            Long2DoubleOpenHashMap frozenWeights = new Long2DoubleOpenHashMap(edgeCount);
            frozenWeights.defaultReturnValue(NO_EDGE);

            int edgeId = 0;
            for (Long2DoubleMap.Entry entry : weightByPair.long2DoubleEntrySet()) {
                long key = entry.getLongKey();
                double weight = entry.getDoubleValue();
                int a = (int) (key >>> 32);
                int b = (int) key;

                edgeFrom[edgeId] = a;
                edgeTo[edgeId] = b;
                edgeWeight[edgeId] = weight;
                frozenWeights.put(key, weight);

                slotTarget[cursor[a]] = b;
                slotWeight[cursor[a]++] = weight;
                slotTarget[cursor[b]] = a;
                slotWeight[cursor[b]++] = weight;
                edgeId++;
            }

            return new BuildingGraph(
                    nodeArray,
                    NodeIdMapper.createImmutable(orderedIds),
                    firstSlot,
                    slotTarget,
                    slotWeight,
                    edgeFrom,
                    edgeTo,
                    edgeWeight,
                    frozenWeights,
                    critical.toIntArray()
            );
        }

        private int requireIndex(String id) {
            int index = indexById.getInt(id);
            if (index < 0) {
                throw new UnknownNodeException(id);
            }
            return index;
        }
    }
}
