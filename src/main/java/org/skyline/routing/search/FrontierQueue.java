package org.skyline.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Min-priority queue over graph nodes for best-first search.
 * <p>
 * <strong>Key features:</strong>
 * <ul>
 * <li><strong>Decrease-key:</strong> a node is queued at most once; offering a better priority
 * for a queued node moves it up in O(log n) via a position index. A cheaper g at an equal
 * priority replaces the queued g in place.</li>
 * <li><strong>Deterministic ties:</strong> equal priorities are served in enqueue order. A
 * decrease-key counts as a fresh enqueue.</li>
 * <li><strong>Per-node entries:</strong> one {@link Entry} per node is allocated lazily and reused
 * if the node is queued again.</li>
 * </ul>
 * <p>Not thread-safe. Each search owns its own queue.</p>
 */
public final class FrontierQueue {

    // 1-based binary heap
    private final Entry[] heap;
    // positions[nodeId] = heap index, 0 when not queued
    private final int[] positions;
    private final Entry[] entries;
    private long nextSequence;

    @Getter
    @Accessors(fluent = true)
    private int size;
    @Getter
    @Accessors(fluent = true)
    private int peakSize;

    /**
     * Creates a queue able to hold every node of a graph.
     *
     * @param nodeCount number of nodes; ids must be in {@code [0, nodeCount)}.
     */
    public FrontierQueue(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new Entry[nodeCount + 1];
        this.positions = new int[nodeCount];
        this.entries = new Entry[nodeCount];
    }

    /**
     * Queues a node or improves its priority.
     *
     * @param nodeId node to queue.
     * @param gScore accumulated cost from the source.
     * @param priority ordering key ({@code g + h}).
     * @return true when the node was inserted or its queued state improved.
     */
    public boolean offer(int nodeId, double gScore, double priority) {
        if (nodeId < 0 || nodeId >= positions.length) {
            throw new IllegalArgumentException("nodeId " + nodeId + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        int existingIdx = positions[nodeId];
        if (existingIdx > 0) {
            Entry existing = heap[existingIdx];
            if (priority < existing.priority) {
                existing.set(gScore, priority, nextSequence++);
                swim(existingIdx);
                return true;
            }
            // g + h can round to the same priority for a cheaper g; keep the heap slot, take the g
            if (priority == existing.priority && gScore < existing.gScore) {
                existing.gScore = gScore;
                return true;
            }
            return false;
        }

        Entry entry = entries[nodeId];
        if (entry == null) {
            entry = new Entry(nodeId);
            entries[nodeId] = entry;
        }
        entry.set(gScore, priority, nextSequence++);

        size++;
        heap[size] = entry;
        positions[nodeId] = size;
        swim(size);
        if (size > peakSize) {
            peakSize = size;
        }
        return true;
    }

    /**
     * Removes and returns the entry with the lowest priority.
     * <p>
     * The returned entry is reused if the same node is offered again, so read its fields before
     * the next {@link #offer} for that node.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public Entry poll() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        Entry min = heap[1];
        Entry last = heap[size];
        heap[1] = last;
        heap[size] = null;
        size--;
        positions[min.nodeId] = 0;
        if (size > 0) {
            positions[last.nodeId] = 1;
            sink(1);
        }
        return min;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < positions.length && positions[nodeId] > 0;
    }

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        Entry a = heap[i];
        Entry b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a.nodeId] = j;
        positions[b.nodeId] = i;
    }

    /**
     * Queued search state of one node.
     */
    public static final class Entry implements Comparable<Entry> {
        private final int nodeId;
        private double gScore;
        private double priority;
        private long sequence;

        private Entry(int nodeId) {
            this.nodeId = nodeId;
        }

        private void set(double gScore, double priority, long sequence) {
            this.gScore = gScore;
            this.priority = priority;
            this.sequence = sequence;
        }

        public int nodeId() {
            return nodeId;
        }

        public double gScore() {
            return gScore;
        }

        public double priority() {
            return priority;
        }

        /**
         * Orders by priority, then by enqueue sequence (earlier first).
         */
        @Override
        public int compareTo(Entry other) {
            int byPriority = Double.compare(this.priority, other.priority);
            if (byPriority != 0) {
                return byPriority;
            }
            return Long.compare(this.sequence, other.sequence);
        }
    }
}
