// file: core/src/test/java/io/dectree/core/HierarchyResolverTest.java
package io.dectree.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyResolverTest {

    @Test
    void name_without_dot_is_a_root() {
        assertEquals(Optional.empty(), HierarchyResolver.parentOf("2", Set.of("2", "1")));
    }

    @Test
    void skips_missing_intermediate_addresses() {
        Set<String> known = Set.of("2", "2.01", "2.011", "2.0121");
        assertEquals(Optional.of("2.01"), HierarchyResolver.parentOf("2.0121", known));
        assertEquals(Optional.of("2.01"), HierarchyResolver.parentOf("2.011", known));
        assertEquals(Optional.of("2"), HierarchyResolver.parentOf("2.01", known));
    }

    @Test
    void no_known_prefix_means_no_parent() {
        assertEquals(Optional.empty(), HierarchyResolver.parentOf("7.1", Set.of("1", "2")));
    }

    @Test
    void parent_is_always_a_strict_prefix() {
        Set<String> known = Set.of("1", "1.1", "1.11", "1.12", "1.2", "2", "2.1", "2.12");
        for (String name : known) {
            HierarchyResolver.parentOf(name, known).ifPresent(p -> {
                assertTrue(name.startsWith(p), p + " should prefix " + name);
                assertTrue(p.length() < name.length());
            });
        }
    }

    @Test
    void depth_counts_hops_to_root() {
        Map<String, String> parents = new HashMap<>();
        parents.put("1.1", "1");
        parents.put("1.11", "1.1");
        assertEquals(1, HierarchyResolver.depthOf("1", parents::get));
        assertEquals(2, HierarchyResolver.depthOf("1.1", parents::get));
        assertEquals(3, HierarchyResolver.depthOf("1.11", parents::get));
    }

    @Test
    void depth_stops_on_cycles() {
        assertEquals(1, HierarchyResolver.depthOf("x", n -> "x"));

        Map<String, String> loop = Map.of("a", "b", "b", "a");
        assertEquals(2, HierarchyResolver.depthOf("a", loop::get));
    }
}
