package org.skyline.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.skyline.routing.error.UnknownNodeException;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilNodeIdMapperTest {

    @Test
    @DisplayName("Baseline Correctness: bidirectional mapping follows list order")
    void testSimpleMapping() {
        NodeIdMapper mapper = NodeIdMapper.createImmutable(List.of("Lobby", "B-204", "Stair-2"));

        assertEquals(0, mapper.toInternal("Lobby"));
        assertEquals(1, mapper.toInternal("B-204"));
        assertEquals("Stair-2", mapper.toExternal(2));

        assertTrue(mapper.containsExternal("B-204"));
        assertFalse(mapper.containsExternal("B-205"));
        assertTrue(mapper.containsInternal(0));
        assertFalse(mapper.containsInternal(3));
        assertFalse(mapper.containsInternal(-1));
        assertEquals(3, mapper.size());
    }

    @Test
    @DisplayName("Unknown external id raises reason-coded UnknownNodeException")
    void testUnknownExternal() {
        NodeIdMapper mapper = NodeIdMapper.createImmutable(List.of("A"));
        UnknownNodeException ex = assertThrows(UnknownNodeException.class, () -> mapper.toInternal("Z"));
        assertEquals(UnknownNodeException.REASON, ex.reasonCode());
        assertEquals("Z", ex.nodeId());
        assertTrue(ex.getMessage().startsWith("[" + UnknownNodeException.REASON + "]"));
    }

    @Test
    @DisplayName("Out-of-range internal id is rejected")
    void testInternalOutOfBounds() {
        NodeIdMapper mapper = NodeIdMapper.createImmutable(List.of("A", "B"));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(2));
        assertThrows(IndexOutOfBoundsException.class, () -> mapper.toExternal(-1));
    }

    @Test
    @DisplayName("Construction rejects null list, blank ids and duplicates")
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilNodeIdMapper(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilNodeIdMapper(List.of("A", " ")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilNodeIdMapper(Arrays.asList("A", null)));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilNodeIdMapper(List.of("A", "B", "A")));
    }

    @Test
    @DisplayName("Empty mapper is valid")
    void testEmpty() {
        NodeIdMapper mapper = NodeIdMapper.createImmutable(List.of());
        assertEquals(0, mapper.size());
        assertFalse(mapper.containsInternal(0));
    }
}
