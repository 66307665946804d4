/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.aol.core.Hex;

import java.util.Optional;

/**
 * First divergence between a reference binary and the compiler's output.
 *
 * <p>Reported as data in a {@link ValidationReport}; a mismatch never aborts a run.</p>
 *
 * @param offset          first differing byte index; the shorter length when one output is a
 *                        prefix of the other
 * @param expectedLength  reference length
 * @param actualLength    compiler output length
 * @param contextStart    index of the first byte shown in both context windows
 * @param expectedContext reference bytes around the offset, spaced hex
 * @param actualContext   output bytes around the offset, spaced hex
 */
public record FixtureMismatch(
        int offset,
        int expectedLength,
        int actualLength,
        int contextStart,
        String expectedContext,
        String actualContext) {

    /**
     * Locate the first divergence.
     *
     * @param contextBytes bytes shown on each side of the offset
     * @return empty when both arrays are identical
     */
    public static Optional<FixtureMismatch> find(byte[] expected, byte[] actual, int contextBytes) {
        int common = Math.min(expected.length, actual.length);
        int offset = -1;
        for (int i = 0; i < common; i++) {
            if (expected[i] != actual[i]) {
                offset = i;
                break;
            }
        }
        if (offset < 0) {
            if (expected.length == actual.length) {
                return Optional.empty();
            }
            offset = common;
        }
        int from = Math.max(0, offset - contextBytes);
        int to = offset + contextBytes + 1;
        return Optional.of(new FixtureMismatch(
                offset,
                expected.length,
                actual.length,
                from,
                Hex.spaced(expected, from, to),
                Hex.spaced(actual, from, to)));
    }

    public boolean lengthMismatch() {
        return expectedLength != actualLength;
    }

    /**
     * Multi-line description for console output.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("First difference at byte %d (0x%04X)", offset, offset));
        if (lengthMismatch()) {
            sb.append(String.format(", length %d expected, %d actual", expectedLength, actualLength));
        }
        sb.append(String.format("%n  Context from byte %d:", contextStart));
        sb.append(String.format("%n  Expected: %s", expectedContext));
        sb.append(String.format("%n  Actual:   %s", actualContext));
        return sb.toString();
    }
}
