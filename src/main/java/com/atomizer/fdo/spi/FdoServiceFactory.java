/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.spi;

import com.atomizer.fdo.encode.EncodingStrategy;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.parse.ParserOptions;
import com.atomizer.fdo.spi.impl.AtomizerCompilationService;
import com.atomizer.fdo.symbol.SymbolTable;
import com.atomizer.fdo.symbol.SymbolTableLoader;
import com.atomizer.utils.LoggerUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Factory for creating FDO compilation services from configuration.
 *
 * <p>Reads {@code fdo.atom.table}, the parser options, {@code fdo.production.strategy}
 * and {@code fdo.compiler.variant}.</p>
 */
public final class FdoServiceFactory {

    private static final String ATOM_TABLE_PROPERTY = "fdo.atom.table";
    private static final String STRATEGY_PROPERTY = "fdo.production.strategy";
    private static final String VARIANT_PROPERTY = "fdo.compiler.variant";
    private static final String DEFAULT_STRATEGY = "styled";
    private static final String DEFAULT_VARIANT = "production";

    private FdoServiceFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a compilation service based on configuration.
     *
     * @param properties configuration properties
     * @return configured FdoCompilationService
     * @throws IllegalArgumentException if the strategy, variant or parser options are invalid
     * @throws UncheckedIOException if an external atom table cannot be read
     */
    public static FdoCompilationService createCompilationService(Properties properties) {
        SymbolTable symbols = loadSymbolTable(properties);
        String strategyName = getConfiguredStrategy(properties);
        EncodingStrategy production = EncodingStrategy.production(strategyName);
        Variant variant = Variant.parse(properties.getProperty(VARIANT_PROPERTY, DEFAULT_VARIANT));
        ParserOptions options = ParserOptions.fromProperties(properties);

        LoggerUtil.info(String.format(
                "[FdoServiceFactory] Creating compilation service: strategy=%s, default variant=%s, tab width=%d, strict closure=%s",
                production.name(), variant.label(), options.tabWidth(), options.strictObjectClosure()));

        return new AtomizerCompilationService(symbols, options, production, variant);
    }

    /**
     * Load the symbol table named by {@code fdo.atom.table}, or the bundled one when unset.
     */
    public static SymbolTable loadSymbolTable(Properties properties) {
        String location = properties.getProperty(ATOM_TABLE_PROPERTY, "").trim();
        if (location.isEmpty()) {
            return SymbolTableLoader.bundled();
        }
        try {
            return SymbolTableLoader.loadFile(Path.of(location));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load atom table: " + location, e);
        }
    }

    /**
     * Get the configured production strategy name without creating a service.
     * Useful for logging and diagnostics.
     *
     * @param properties configuration properties
     * @return strategy name
     */
    public static String getConfiguredStrategy(Properties properties) {
        return properties.getProperty(STRATEGY_PROPERTY, DEFAULT_STRATEGY).trim().toLowerCase();
    }
}
