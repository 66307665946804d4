/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.aol.core.Hex;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.ParseException;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.spi.FdoServiceFactory;
import com.atomizer.test.TestConfig;
import com.atomizer.utils.JacksonConfig;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("Differential Validator")
class DifferentialValidatorTest {

    private static final byte[] MINIMAL_PRODUCTION = Hex.hexToBytes("40 01 21 A0 01 54 65 73 74 30 6C 20 00 01 40 02");
    private static final byte[] EMPTY_PRODUCTION = Hex.hexToBytes("40 01 40 02");

    private static GoldenFixture fixture(String name) {
        return new GoldenFixture(name, "source of " + name, Map.of(Variant.PRODUCTION, EMPTY_PRODUCTION));
    }

    private static FixtureCorpus corpus(List<GoldenFixture> fixtures) {
        return new FixtureCorpus(Path.of("."), fixtures, List.of());
    }

    @Nested
    @DisplayName("Against the compiler")
    class AgainstCompiler {

        @TempDir
        Path dir;

        private ValidationReport report;

        @BeforeEach
        void runCorpus() throws IOException {
            String minimal = TestConfig.goldenText("minimal-object.txt");

            Files.writeString(dir.resolve("ok.txt"), minimal);
            Files.write(dir.resolve("ok.production.bin"), MINIMAL_PRODUCTION);

            byte[] lastByteChanged = MINIMAL_PRODUCTION.clone();
            lastByteChanged[15] = 0x03;
            Files.writeString(dir.resolve("bad.txt"), minimal);
            Files.write(dir.resolve("bad.production.bin"), lastByteChanged);

            byte[] longer = new byte[17];
            System.arraycopy(MINIMAL_PRODUCTION, 0, longer, 0, 16);
            Files.writeString(dir.resolve("long.txt"), minimal);
            Files.write(dir.resolve("long.production.bin"), longer);

            Files.writeString(dir.resolve("broken.txt"), "uni_start_stream\nfoo_bar\nuni_end_stream\n");
            Files.write(dir.resolve("broken.production.bin"), EMPTY_PRODUCTION);

            FdoCompilationService service = FdoServiceFactory.createCompilationService(TestConfig.getAllProperties());
            report = new DifferentialValidator(service, 3, 8).validate(dir);
        }

        private FixtureResult result(String name) {
            return report.results().stream().filter(r -> r.name().equals(name)).findFirst().orElseThrow();
        }

        @Test
        @DisplayName("should sort results by fixture name")
        void shouldSortResults() {
            assertEquals(List.of("bad", "broken", "long", "ok"),
                    report.results().stream().map(FixtureResult::name).toList());
            assertEquals(4, report.totalFixtures());
            assertEquals(1, report.exactMatches());
            assertFalse(report.cancelled());
            assertFalse(report.allMatched());
            assertEquals("styled", report.strategy());
        }

        @Test
        @DisplayName("should record exact matches with both output lengths")
        void shouldRecordExactMatch() {
            FixtureResult ok = result("ok");
            assertTrue(ok.exactMatch());
            assertEquals(33, ok.debugLength());
            assertEquals(16, ok.productionLength());
            assertEquals(1, ok.comparisons().size());
            assertNull(ok.comparisons().get(0).mismatch());
        }

        @Test
        @DisplayName("should locate the first differing byte with context windows")
        void shouldLocateDivergence() {
            VariantComparison bad = result("bad").comparisons().get(0);

            assertFalse(bad.exactMatch());
            assertEquals(15, bad.matchingBytes());
            FixtureMismatch mismatch = bad.mismatch();
            assertEquals(15, mismatch.offset());
            assertEquals(7, mismatch.contextStart());
            assertEquals("73 74 30 6C 20 00 01 40 03", mismatch.expectedContext());
            assertEquals("73 74 30 6C 20 00 01 40 02", mismatch.actualContext());
        }

        @Test
        @DisplayName("should report a length difference as a divergence at the shorter length")
        void shouldReportLengthDifference() {
            VariantComparison longer = result("long").comparisons().get(0);

            assertEquals(16, longer.mismatch().offset());
            assertTrue(longer.mismatch().lengthMismatch());
            assertEquals(16, longer.matchingBytes());
            assertEquals(17, longer.comparedBytes());
        }

        @Test
        @DisplayName("should record compilation errors as data")
        void shouldRecordErrors() {
            FixtureResult broken = result("broken");

            assertFalse(broken.exactMatch());
            assertNull(broken.debugLength());
            assertNull(broken.productionLength());
            VariantComparison c = broken.comparisons().get(0);
            assertEquals("[line 2] Unknown atom mnemonic: 'foo_bar'", c.error());
            assertEquals(0, c.matchingBytes());
            assertEquals(4, c.comparedBytes());
        }

        @Test
        @DisplayName("should compute byte accuracy over all compared bytes")
        void shouldComputeAccuracy() {
            assertEquals((16 + 15 + 16 + 0) * 100.0 / (16 + 16 + 17 + 4), report.byteAccuracy(), 1e-9);
        }

        @Test
        @DisplayName("should render a readable summary")
        void shouldRender() {
            String text = report.render();

            assertTrue(text.contains("FAIL  bad (debug=33, production=16)"), text);
            assertTrue(text.contains("OK    ok"), text);
            assertTrue(text.contains("First difference at byte 15 (0x000F)"), text);
            assertTrue(text.contains("error: [line 2] Unknown atom mnemonic"), text);
            assertTrue(text.contains("1/4 fixtures match exactly"), text);
        }

        @Test
        @DisplayName("should serialize the report as JSON")
        void shouldWriteJson() throws IOException {
            Path file = dir.resolve("reports/report.json");
            report.writeJson(file);

            JsonNode json = JacksonConfig.mapper().readTree(Files.readString(file));
            assertEquals(4, json.get("totalFixtures").asInt());
            assertEquals("styled", json.get("strategy").asText());
            assertTrue(json.get("startedAt").isTextual());
            assertEquals("bad", json.get("results").get(0).get("name").asText());
            assertEquals(15, json.get("results").get(0).get("comparisons").get(0).get("mismatch").get("offset").asInt());
            assertEquals("PRODUCTION", json.get("results").get(0).get("comparisons").get(0).get("variant").asText());
            assertEquals(report.toJson(), Files.readString(file));
        }
    }

    @Nested
    @DisplayName("With a shared compilation service")
    class SharedService {

        private final FdoCompilationService service =
                FdoServiceFactory.createCompilationService(TestConfig.getAllProperties());

        @Test
        @DisplayName("should produce the single-threaded bytes when compiling from many threads")
        void shouldCompileConcurrently() throws Exception {
            List<String> sources = List.of(
                    TestConfig.goldenText("32-105.txt"),
                    TestConfig.goldenText("minimal-object.txt"));
            List<Variant> variants = List.of(Variant.DEBUG, Variant.PRODUCTION);

            Map<String, byte[]> sequential = new ConcurrentHashMap<>();
            for (int s = 0; s < sources.size(); s++) {
                for (Variant v : variants) {
                    sequential.put(s + "/" + v, service.compile(sources.get(s), v).toByteArray());
                }
            }

            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    int s = i % sources.size();
                    Variant v = variants.get((i / sources.size()) % variants.size());
                    Callable<Boolean> task = () -> {
                        start.await();
                        byte[] actual = service.compile(sources.get(s), v).toByteArray();
                        return Arrays.equals(sequential.get(s + "/" + v), actual);
                    };
                    futures.add(pool.submit(task));
                }
                start.countDown();

                for (Future<Boolean> future : futures) {
                    assertTrue(future.get());
                }
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("should report the same results on one thread and on many")
        void shouldMatchSequentialValidation() throws IOException {
            FixtureCorpus golden = FixtureCorpus.load(TestConfig.goldenDirectory());
            List<GoldenFixture> fixtures = new ArrayList<>();
            for (int copy = 0; copy < 12; copy++) {
                for (GoldenFixture f : golden.fixtures()) {
                    fixtures.add(new GoldenFixture(String.format("%s-%02d", f.name(), copy), f.inputText(), f.expected()));
                }
            }

            ValidationReport sequential = new DifferentialValidator(service, 1, 8).validate(corpus(fixtures));
            ValidationReport parallel = new DifferentialValidator(service, 6, 8).validate(corpus(fixtures));

            assertEquals(fixtures.size(), parallel.totalFixtures());
            assertEquals(sequential.results(), parallel.results());
            assertEquals(sequential.exactMatches(), parallel.exactMatches());
            assertEquals(sequential.byteAccuracy(), parallel.byteAccuracy(), 1e-9);
        }
    }

    @Nested
    @DisplayName("With a stubbed service")
    class WithStubbedService {

        private final FdoCompilationService service = mock(FdoCompilationService.class);

        @BeforeEach
        void stubName() {
            when(service.getStrategyName()).thenReturn("stub");
        }

        @Test
        @DisplayName("should keep comparing the other variant when one fails")
        void shouldIsolateVariantErrors() throws FdoCompilationException {
            when(service.compile(anyString(), eq(Variant.DEBUG)))
                    .thenThrow(new ParseException("Broken line", 3, "%%"));
            when(service.compile(anyString(), eq(Variant.PRODUCTION)))
                    .thenReturn(EncodedStream.of(Variant.PRODUCTION, Hex.hexToBytes("40 02")));
            GoldenFixture fixture = new GoldenFixture("both", "src", Map.of(
                    Variant.DEBUG, Hex.hexToBytes("00 01 00 02 00 01 00"),
                    Variant.PRODUCTION, EMPTY_PRODUCTION));

            FixtureResult result = new DifferentialValidator(service, 1, 8).validateFixture(fixture);

            assertFalse(result.exactMatch());
            assertNull(result.debugLength());
            assertEquals(4, result.productionLength());
            assertEquals(Variant.DEBUG, result.comparisons().get(0).variant());
            assertEquals("[line 3] Broken line: '%%'", result.comparisons().get(0).error());
            assertTrue(result.comparisons().get(1).exactMatch());
        }

        @Test
        @DisplayName("should record unexpected runtime failures as errors")
        void shouldRecordRuntimeFailures() throws FdoCompilationException {
            when(service.compile(anyString(), any(Variant.class))).thenThrow(new IllegalStateException("boom"));

            ValidationReport report = new DifferentialValidator(service, 2, 8).validate(corpus(List.of(fixture("a"))));

            VariantComparison c = report.results().get(0).comparisons().get(0);
            assertEquals("internal error: java.lang.IllegalStateException: boom", c.error());
            assertEquals(0.0, report.byteAccuracy());
        }

        @Test
        @DisplayName("should run fixtures on named worker threads and sort the results")
        void shouldRunInParallel() throws FdoCompilationException {
            Set<String> threadNames = ConcurrentHashMap.newKeySet();
            when(service.compile(anyString(), any(Variant.class))).thenAnswer(invocation -> {
                threadNames.add(Thread.currentThread().getName());
                return EncodedStream.of(Variant.PRODUCTION, Hex.hexToBytes("40 02"));
            });
            List<GoldenFixture> fixtures = new ArrayList<>();
            for (int i = 20; i >= 1; i--) {
                fixtures.add(fixture(String.format("f%02d", i)));
            }

            ValidationReport report = new DifferentialValidator(service, 4, 8).validate(corpus(fixtures));

            assertEquals(20, report.totalFixtures());
            assertEquals(20, report.exactMatches());
            assertTrue(report.allMatched());
            assertEquals(100.0, report.byteAccuracy(), 1e-9);
            List<String> names = report.results().stream().map(FixtureResult::name).toList();
            assertEquals(names.stream().sorted().toList(), names);
            assertEquals("f01", names.get(0));
            assertFalse(threadNames.isEmpty());
            assertTrue(threadNames.stream().allMatch(n -> n.startsWith("fixture-validator-")), threadNames.toString());
            verify(service, times(40)).compile(anyString(), any(Variant.class));
        }

        @Test
        @DisplayName("should stop starting fixtures once cancellation is requested")
        void shouldCancel() throws FdoCompilationException {
            when(service.compile(anyString(), any(Variant.class)))
                    .thenReturn(EncodedStream.of(Variant.PRODUCTION, Hex.hexToBytes("40 02")));
            AtomicInteger polls = new AtomicInteger();
            List<GoldenFixture> fixtures = List.of(fixture("f1"), fixture("f2"), fixture("f3"), fixture("f4"), fixture("f5"));

            ValidationReport report = new DifferentialValidator(service, 1, 8)
                    .validate(corpus(fixtures), () -> polls.incrementAndGet() > 2);

            assertTrue(report.cancelled());
            assertFalse(report.allMatched());
            assertEquals(List.of("f1", "f2"), report.results().stream().map(FixtureResult::name).toList());
            assertEquals(2, report.totalFixtures());
            verify(service, times(4)).compile(anyString(), any(Variant.class));
        }

        @Test
        @DisplayName("should report zero accuracy for an empty corpus")
        void shouldHandleEmptyCorpus() {
            ValidationReport report = new DifferentialValidator(service).validate(corpus(List.of()));

            assertEquals(0, report.totalFixtures());
            assertEquals(0.0, report.byteAccuracy());
            assertTrue(report.results().isEmpty());
        }

        @Test
        @DisplayName("should size the pool from configuration")
        void shouldReadConfiguration() {
            Properties props = new Properties();
            props.setProperty("validator.threads", "0");
            assertEquals(Runtime.getRuntime().availableProcessors(),
                    DifferentialValidator.fromProperties(service, props).getThreads());

            props.setProperty("validator.threads", "3");
            assertEquals(3, DifferentialValidator.fromProperties(service, props).getThreads());

            assertThrows(IllegalArgumentException.class, () -> new DifferentialValidator(service, 1, -1));
        }
    }
}
