// file: core/src/test/java/io/dectree/core/NaturalSortKeyTest.java
package io.dectree.core;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NaturalSortKeyTest {

    @Test
    void sorts_digit_runs_numerically() {
        List<String> names = new ArrayList<>(List.of("1.10", "2", "1.2", "1.11"));
        names.sort(NaturalSortKey.NAME_ORDER);
        assertEquals(List.of("1.2", "1.10", "1.11", "2"), names);
    }

    @Test
    void parent_sorts_before_its_children() {
        assertTrue(NaturalSortKey.NAME_ORDER.compare("1", "1.1") < 0);
        assertTrue(NaturalSortKey.NAME_ORDER.compare("1.1", "1.01") != 0);
    }

    @Test
    void tokenizes_into_numbers_and_strings() {
        var key = NaturalSortKey.of("2.0121");
        assertEquals(List.of(BigInteger.valueOf(2), ".", BigInteger.valueOf(121)), key.tokens());
        assertEquals("2.0121", key.raw());
    }

    @Test
    void very_long_digit_runs_do_not_overflow() {
        String big = "1.99999999999999999999999999";
        String bigger = "1.100000000000000000000000000";
        assertTrue(NaturalSortKey.NAME_ORDER.compare(big, bigger) < 0);
    }

    @Test
    void equal_token_sequences_fall_back_to_raw_string() {
        int c = NaturalSortKey.NAME_ORDER.compare("01", "1");
        assertTrue(c < 0, "\"01\" < \"1\" by raw comparison");
        assertNotEquals(NaturalSortKey.of("01"), NaturalSortKey.of("1"));
        assertEquals(0, NaturalSortKey.of("1.1").compareTo(NaturalSortKey.of("1.1")));
    }

    @Test
    void numbers_sort_before_text() {
        assertTrue(NaturalSortKey.NAME_ORDER.compare("1", "a") < 0);
        assertTrue(NaturalSortKey.NAME_ORDER.compare("a", "b") < 0);
    }

    @Test
    void node_order_compares_by_name() {
        var a = new Node(5, "1.10", "x", 2, 0, null);
        var b = new Node(1, "1.9", "y", 2, 1, null);
        assertTrue(NaturalSortKey.NODE_ORDER.compare(b, a) < 0);
    }
}
