package org.skyline.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.skyline.routing.error.UnknownNodeException;

import java.util.List;

/**
 * Immutable {@link NodeIdMapper} backed by a fastutil open hash map.
 *
 * <p>Safe for concurrent reads once constructed.</p>
 */
public final class FastUtilNodeIdMapper implements NodeIdMapper {
    private static final int MISSING = -1;

    // String -> dense index, unboxed
    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper from external ids listed in internal-index order.
     *
     * @param orderedExternalIds unique, non-blank external ids.
     * @throws IllegalArgumentException on null input, blank ids or duplicate ids.
     */
    public FastUtilNodeIdMapper(List<String> orderedExternalIds) {
        if (orderedExternalIds == null) {
            throw new IllegalArgumentException("orderedExternalIds cannot be null");
        }
        int size = orderedExternalIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String externalId = orderedExternalIds.get(i);
            if (externalId == null || externalId.isBlank()) {
                throw new IllegalArgumentException("external id at index " + i + " must be non-blank");
            }
            if (forward.putIfAbsent(externalId, i) != MISSING) {
                throw new IllegalArgumentException("duplicate external id: " + externalId);
            }
            reverse[i] = externalId;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownNodeException(externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("internal id out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
