/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.fdo.model.Variant;

/**
 * Comparison of one variant's output against its reference binary.
 *
 * @param variant        compared variant
 * @param exactMatch     byte-for-byte equal, lengths included
 * @param expectedLength reference length
 * @param actualLength   output length, 0 when compilation failed
 * @param matchingBytes  positions where both arrays hold the same byte
 * @param mismatch       first divergence, null on an exact match or an error
 * @param error          compilation error message, null when compilation succeeded
 */
public record VariantComparison(
        Variant variant,
        boolean exactMatch,
        int expectedLength,
        int actualLength,
        int matchingBytes,
        FixtureMismatch mismatch,
        String error) {

    /**
     * Compare an output with its reference.
     */
    public static VariantComparison compare(Variant variant, byte[] expected, byte[] actual, int contextBytes) {
        int matching = 0;
        int common = Math.min(expected.length, actual.length);
        for (int i = 0; i < common; i++) {
            if (expected[i] == actual[i]) {
                matching++;
            }
        }
        FixtureMismatch mismatch = FixtureMismatch.find(expected, actual, contextBytes).orElse(null);
        return new VariantComparison(variant, mismatch == null, expected.length, actual.length,
                matching, mismatch, null);
    }

    /**
     * Create an error result when compilation fails.
     */
    public static VariantComparison error(Variant variant, byte[] expected, String errorMessage) {
        return new VariantComparison(variant, false, expected.length, 0, 0, null, errorMessage);
    }

    /** Denominator for byte accuracy: the longer of the two lengths. */
    public int comparedBytes() {
        return Math.max(expectedLength, actualLength);
    }
}
