/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.config.AtomizerConfig;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.utils.LoggerUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Compiles every fixture of a corpus under both variants and compares the output with the
 * reference binaries.
 *
 * <p>Fixtures run on a fixed-size pool. Compilation errors and mismatches are recorded in
 * the report; only corpus I/O failures abort a run. The cancellation hook is polled before
 * each fixture starts; fixtures finished before that stay in the report.</p>
 */
public final class DifferentialValidator {

    public static final int DEFAULT_CONTEXT_BYTES = 8;

    private final FdoCompilationService service;
    private final int threads;
    private final int contextBytes;

    public DifferentialValidator(FdoCompilationService service) {
        this(service, 0, DEFAULT_CONTEXT_BYTES);
    }

    /**
     * @param threads      worker count; 0 or less uses the available processors
     * @param contextBytes bytes shown on each side of a divergence
     */
    public DifferentialValidator(FdoCompilationService service, int threads, int contextBytes) {
        this.service = Objects.requireNonNull(service, "service");
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        if (contextBytes < 0) {
            throw new IllegalArgumentException("Context bytes must be >= 0: " + contextBytes);
        }
        this.contextBytes = contextBytes;
    }

    public static DifferentialValidator fromProperties(FdoCompilationService service, Properties properties) {
        return new DifferentialValidator(service,
                AtomizerConfig.getInt(properties, "validator.threads", 0),
                AtomizerConfig.getInt(properties, "validator.context.bytes", DEFAULT_CONTEXT_BYTES));
    }

    public int getThreads() {
        return threads;
    }

    /**
     * Load a corpus directory and validate it.
     *
     * @throws IOException if the corpus cannot be read
     */
    public ValidationReport validate(Path corpusDirectory) throws IOException {
        return validate(FixtureCorpus.load(corpusDirectory));
    }

    public ValidationReport validate(FixtureCorpus corpus) {
        return validate(corpus, () -> false);
    }

    /**
     * Validate a corpus.
     *
     * @param cancelRequested polled before each fixture; once true, remaining fixtures are skipped
     */
    public ValidationReport validate(FixtureCorpus corpus, BooleanSupplier cancelRequested) {
        Instant startedAt = Instant.now();
        long startTime = System.currentTimeMillis();
        List<GoldenFixture> fixtures = corpus.fixtures();
        int poolSize = Math.max(1, Math.min(threads, fixtures.size()));

        LoggerUtil.info(String.format("[DifferentialValidator] Validating %d fixture(s) on %d thread(s), strategy=%s",
                fixtures.size(), poolSize, service.getStrategyName()));

        AtomicBoolean cancelled = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, workerThreads());
        List<Future<FixtureResult>> futures = new ArrayList<>(fixtures.size());
        List<FixtureResult> results = new ArrayList<>();
        try {
            for (GoldenFixture fixture : fixtures) {
                futures.add(pool.submit(() -> {
                    if (cancelled.get() || cancelRequested.getAsBoolean()) {
                        cancelled.set(true);
                        return null;
                    }
                    return validateFixture(fixture);
                }));
            }
            for (Future<FixtureResult> future : futures) {
                FixtureResult result = future.get();
                if (result != null) {
                    results.add(result);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            pool.shutdownNow();
            collectFinished(futures, results);
            LoggerUtil.warn("[DifferentialValidator] Interrupted, reporting " + results.size() + " finished fixture(s)");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Fixture validation task failed", e.getCause());
        } finally {
            pool.shutdown();
        }

        long duration = System.currentTimeMillis() - startTime;
        ValidationReport report = ValidationReport.of(service.getStrategyName(), startedAt, duration,
                cancelled.get(), results);
        LoggerUtil.info(String.format("[DifferentialValidator] %d/%d exact, byte accuracy %.2f%%, %dms%s",
                report.exactMatches(), report.totalFixtures(), report.byteAccuracy(), duration,
                report.cancelled() ? " (cancelled)" : ""));
        return report;
    }

    /**
     * Compile one fixture under both variants and compare against each reference it has.
     */
    public FixtureResult validateFixture(GoldenFixture fixture) {
        Map<Variant, byte[]> outputs = new EnumMap<>(Variant.class);
        Map<Variant, String> errors = new EnumMap<>(Variant.class);

        for (Variant variant : Variant.values()) {
            try {
                EncodedStream stream = service.compile(fixture.inputText(), variant);
                outputs.put(variant, stream.toByteArray());
            } catch (FdoCompilationException e) {
                errors.put(variant, e.getMessage());
                LoggerUtil.debug(() -> String.format("[DifferentialValidator] %s (%s): %s",
                        fixture.name(), variant.label(), e.getMessage()));
            } catch (RuntimeException e) {
                errors.put(variant, "internal error: " + e);
                LoggerUtil.error(String.format("[DifferentialValidator] %s (%s): compiler failed: %s",
                        fixture.name(), variant.label(), e));
            }
        }

        List<VariantComparison> comparisons = new ArrayList<>();
        for (Map.Entry<Variant, byte[]> entry : fixture.expected().entrySet()) {
            Variant variant = entry.getKey();
            byte[] expected = entry.getValue();
            if (errors.containsKey(variant)) {
                comparisons.add(VariantComparison.error(variant, expected, errors.get(variant)));
            } else {
                comparisons.add(VariantComparison.compare(variant, expected, outputs.get(variant), contextBytes));
            }
        }

        boolean exact = comparisons.stream().allMatch(VariantComparison::exactMatch);
        if (!exact) {
            LoggerUtil.debug(() -> "[DifferentialValidator] Mismatch: " + fixture.name());
        }
        return new FixtureResult(
                fixture.name(),
                exact,
                lengthOf(outputs.get(Variant.DEBUG)),
                lengthOf(outputs.get(Variant.PRODUCTION)),
                comparisons);
    }

    private static Integer lengthOf(byte[] output) {
        return output == null ? null : output.length;
    }

    private static void collectFinished(List<Future<FixtureResult>> futures, List<FixtureResult> results) {
        results.clear();
        for (Future<FixtureResult> future : futures) {
            if (!future.isDone() || future.isCancelled()) {
                continue;
            }
            try {
                FixtureResult result = future.get();
                if (result != null) {
                    results.add(result);
                }
            } catch (ExecutionException | InterruptedException e) {
                LoggerUtil.debug(() -> "[DifferentialValidator] Dropping unfinished fixture: " + e);
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "fixture-validator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
