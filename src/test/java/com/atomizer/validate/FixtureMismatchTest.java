/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.aol.core.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fixture Mismatch")
class FixtureMismatchTest {

    @Test
    @DisplayName("should find nothing for identical arrays")
    void shouldMatchIdentical() {
        byte[] bytes = Hex.hexToBytes("40 01 40 02");
        assertTrue(FixtureMismatch.find(bytes, bytes.clone(), 8).isEmpty());
    }

    @Test
    @DisplayName("should report the first differing byte with context on both sides")
    void shouldReportFirstDifference() {
        byte[] expected = Hex.hexToBytes("00 11 22 33 44 55 66 77 88 99 AA BB CC DD EE FF");
        byte[] actual = expected.clone();
        actual[10] = 0x00;
        actual[12] = 0x00;

        FixtureMismatch m = FixtureMismatch.find(expected, actual, 3).orElseThrow();

        assertEquals(10, m.offset());
        assertEquals(7, m.contextStart());
        assertEquals("77 88 99 AA BB CC DD", m.expectedContext());
        assertEquals("77 88 99 00 BB 00 DD", m.actualContext());
        assertFalse(m.lengthMismatch());
    }

    @Test
    @DisplayName("should clamp the context window at the array bounds")
    void shouldClampContext() {
        FixtureMismatch m = FixtureMismatch.find(Hex.hexToBytes("01 02"), Hex.hexToBytes("09 02"), 8).orElseThrow();
        assertEquals(0, m.offset());
        assertEquals(0, m.contextStart());
        assertEquals("01 02", m.expectedContext());
        assertEquals("09 02", m.actualContext());
    }

    @Test
    @DisplayName("should place the offset at the shorter length when one array is a prefix")
    void shouldHandlePrefix() {
        FixtureMismatch m = FixtureMismatch.find(Hex.hexToBytes("40 01 40 02 00"), Hex.hexToBytes("40 01 40 02"), 2)
                .orElseThrow();

        assertEquals(4, m.offset());
        assertTrue(m.lengthMismatch());
        assertEquals("40 02 00", m.expectedContext());
        assertEquals("40 02", m.actualContext());
        assertTrue(m.describe().contains("length 5 expected, 4 actual"));
    }
}
