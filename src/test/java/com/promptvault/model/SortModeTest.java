package com.promptvault.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SortModeTest {

    @Test
    void testExactParameterNames() {
        assertEquals(SortMode.SCORE, SortMode.fromParameter("score"));
        assertEquals(SortMode.CREATED, SortMode.fromParameter("created"));
        assertEquals(SortMode.UPDATED, SortMode.fromParameter("updated"));
    }

    @Test
    void testAnythingElseSortsByLastUpdate() {
        assertEquals(SortMode.UPDATED, SortMode.fromParameter(null));
        assertEquals(SortMode.UPDATED, SortMode.fromParameter(" score "));
        assertEquals(SortMode.UPDATED, SortMode.fromParameter("Score"));
        assertEquals(SortMode.UPDATED, SortMode.fromParameter(""));
    }
}
