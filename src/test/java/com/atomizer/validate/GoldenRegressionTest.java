/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.spi.FdoServiceFactory;
import com.atomizer.test.TestConfig;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the bundled golden fixtures through the validator. The 32-105 reference uses
 * atom styles whose layout is not known yet, so it is expected to diverge at a fixed offset.
 */
@DisplayName("Golden Regression")
class GoldenRegressionTest {

    private static ValidationReport report;

    @BeforeAll
    static void validateGoldenCorpus() throws IOException {
        FdoCompilationService service = FdoServiceFactory.createCompilationService(TestConfig.getAllProperties());
        report = DifferentialValidator.fromProperties(service, TestConfig.getAllProperties())
                .validate(TestConfig.goldenDirectory());
    }

    private static FixtureResult result(String name) {
        return report.results().stream().filter(r -> r.name().equals(name)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("should load every golden fixture")
    void shouldLoadCorpus() throws IOException {
        FixtureCorpus corpus = FixtureCorpus.load(TestConfig.goldenDirectory());

        assertEquals(List.of("32-105", "minimal-object"), corpus.fixtures().stream().map(GoldenFixture::name).toList());
        assertTrue(corpus.skipped().isEmpty());
        assertEquals(2, report.totalFixtures());
    }

    @Test
    @DisplayName("should reproduce the minimal object in both variants")
    void shouldMatchMinimalObject() {
        FixtureResult minimal = result("minimal-object");

        assertTrue(minimal.exactMatch());
        assertEquals(List.of(Variant.DEBUG, Variant.PRODUCTION),
                minimal.comparisons().stream().map(VariantComparison::variant).toList());
        assertEquals(33, minimal.debugLength());
        assertEquals(16, minimal.productionLength());
    }

    @Test
    @DisplayName("should diverge from the 32-105 reference at byte 47")
    void shouldLocate32105Divergence() {
        FixtureResult gid = result("32-105");

        assertFalse(gid.exactMatch());
        assertEquals(1, gid.comparisons().size());
        VariantComparison production = gid.comparisons().get(0);
        assertEquals(Variant.PRODUCTION, production.variant());
        assertNull(production.error());
        assertEquals(356, production.expectedLength());
        assertEquals(346, production.actualLength());
        assertTrue(production.matchingBytes() >= 47);

        FixtureMismatch mismatch = production.mismatch();
        assertEquals(47, mismatch.offset());
        assertEquals(39, mismatch.contextStart());
        assertEquals("30 6C 20 00 69 30 28 43 E4 50 A0 42 E0 22 83 20 01", mismatch.expectedContext());
        assertEquals("30 6C 20 00 69 30 28 43 30 29 05 30 2E 01 41 00 30", mismatch.actualContext());
    }

    @Test
    @DisplayName("should diverge right after the header with the full-form strategy")
    void shouldDivergeEarlierWithFullForm() throws IOException {
        Properties props = TestConfig.getAllProperties();
        props.setProperty("fdo.production.strategy", "full");
        FdoCompilationService service = FdoServiceFactory.createCompilationService(props);

        ValidationReport full = new DifferentialValidator(service, 1, 8).validate(TestConfig.goldenDirectory());

        FixtureResult gid = full.results().stream().filter(r -> r.name().equals("32-105")).findFirst().orElseThrow();
        assertEquals(2, gid.comparisons().get(0).mismatch().offset());
        assertEquals("full", full.strategy());
    }
}
