/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import java.util.List;

/**
 * Outcome for one fixture.
 *
 * @param name             fixture name
 * @param exactMatch       every tagged variant matched exactly
 * @param debugLength      debug output length, null when compilation failed
 * @param productionLength production output length, null when compilation failed
 * @param comparisons      one entry per variant that has a reference binary
 */
public record FixtureResult(
        String name,
        boolean exactMatch,
        Integer debugLength,
        Integer productionLength,
        List<VariantComparison> comparisons) {

    public FixtureResult {
        comparisons = List.copyOf(comparisons);
    }
}
