package org.skyline.core.id;

import org.skyline.routing.error.UnknownNodeException;

import java.util.List;

/**
 * Bidirectional mapping between external node ids (building labels such as {@code "B-204"})
 * and internal dense integer ids.
 */
public interface NodeIdMapper {

    /**
     * Converts an external node id to its internal index.
     *
     * @param externalId client-facing node id.
     * @return internal index in {@code [0, size())}.
     * @throws UnknownNodeException if the id is not mapped.
     */
    int toInternal(String externalId);

    /**
     * Converts an internal index back to the external node id.
     *
     * @param internalId internal index.
     * @return client-facing node id.
     * @throws IndexOutOfBoundsException if the index is outside mapper bounds.
     */
    String toExternal(int internalId);

    /**
     * @return true when the external id is mapped.
     */
    boolean containsExternal(String externalId);

    /**
     * @return true when the internal id is within mapper bounds.
     */
    boolean containsInternal(int internalId);

    /**
     * @return number of mapped ids.
     */
    int size();

    /**
     * Creates the default immutable mapper where each id maps to its list position.
     *
     * @param orderedExternalIds external ids in internal-index order; must be unique and non-blank.
     * @return immutable mapper.
     */
    static NodeIdMapper createImmutable(List<String> orderedExternalIds) {
        return new FastUtilNodeIdMapper(orderedExternalIds);
    }
}
