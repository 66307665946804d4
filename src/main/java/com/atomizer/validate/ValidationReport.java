/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.utils.JacksonConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregate result of a validation run. Results are sorted by fixture name.
 *
 * @param strategy      production strategy that produced the outputs
 * @param startedAt     run start
 * @param durationMs    wall time
 * @param cancelled     run stopped early; results hold the fixtures finished before that
 * @param totalFixtures number of fixtures validated
 * @param exactMatches  fixtures where every tagged variant matched
 * @param byteAccuracy  matching bytes over compared bytes, as a percentage
 * @param results       per-fixture outcomes
 */
public record ValidationReport(
        String strategy,
        Instant startedAt,
        long durationMs,
        boolean cancelled,
        int totalFixtures,
        int exactMatches,
        double byteAccuracy,
        List<FixtureResult> results) {

    public ValidationReport {
        results = results.stream().sorted(Comparator.comparing(FixtureResult::name)).toList();
    }

    public static ValidationReport of(String strategy, Instant startedAt, long durationMs,
                                      boolean cancelled, List<FixtureResult> results) {
        long matching = 0;
        long compared = 0;
        int exact = 0;
        for (FixtureResult result : results) {
            if (result.exactMatch()) {
                exact++;
            }
            for (VariantComparison c : result.comparisons()) {
                matching += c.matchingBytes();
                compared += c.comparedBytes();
            }
        }
        double accuracy = compared == 0 ? 0.0 : matching * 100.0 / compared;
        return new ValidationReport(strategy, startedAt, durationMs, cancelled, results.size(), exact, accuracy, results);
    }

    public boolean allMatched() {
        return !cancelled && exactMatches == totalFixtures;
    }

    public String toJson() throws IOException {
        return JacksonConfig.prettyMapper().writeValueAsString(this);
    }

    public void writeJson(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JacksonConfig.prettyMapper().writeValue(file.toFile(), this);
    }

    /**
     * Human readable summary: one line per fixture plus divergence details.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (FixtureResult result : results) {
            sb.append(String.format("%-5s %s (debug=%s, production=%s)%n",
                    result.exactMatch() ? "OK" : "FAIL", result.name(),
                    lengthOrDash(result.debugLength()), lengthOrDash(result.productionLength())));
            for (VariantComparison c : result.comparisons()) {
                if (c.error() != null) {
                    sb.append(String.format("      %s: error: %s%n", c.variant().label(), c.error()));
                } else if (c.mismatch() != null) {
                    sb.append(String.format("      %s: %d/%d bytes match%n", c.variant().label(),
                            c.matchingBytes(), c.comparedBytes()));
                    for (String line : c.mismatch().describe().split("\\R")) {
                        sb.append("      ").append(line).append(System.lineSeparator());
                    }
                }
            }
        }
        sb.append(String.format("%d/%d fixtures match exactly, byte accuracy %.2f%% [strategy=%s]%s%n",
                exactMatches, totalFixtures, byteAccuracy, strategy, cancelled ? " (cancelled)" : ""));
        return sb.toString();
    }

    private static String lengthOrDash(Integer length) {
        return length == null ? "-" : length.toString();
    }
}
