/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.spi.impl;

import com.atomizer.fdo.encode.ArgumentEncoder;
import com.atomizer.fdo.encode.DecodedAtom;
import com.atomizer.fdo.encode.EncodingStrategy;
import com.atomizer.fdo.encode.StreamDecoder;
import com.atomizer.fdo.encode.StreamEncoder;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.parse.AtomStreamParser;
import com.atomizer.fdo.parse.ParserOptions;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationService;
import com.atomizer.fdo.symbol.SymbolTable;
import com.atomizer.utils.LoggerUtil;

import java.util.List;
import java.util.Objects;

/**
 * In-process compilation service: parser, stream encoder and decoder sharing one symbol table.
 */
public class AtomizerCompilationService implements FdoCompilationService {

    private final AtomStreamParser parser;
    private final StreamEncoder encoder;
    private final StreamDecoder decoder;
    private final Variant defaultVariant;

    /**
     * Service with default parser options, the styled production strategy and production output.
     */
    public AtomizerCompilationService(SymbolTable symbols) {
        this(symbols, ParserOptions.DEFAULTS, EncodingStrategy.production(null), Variant.PRODUCTION);
    }

    public AtomizerCompilationService(SymbolTable symbols, ParserOptions options,
                                      EncodingStrategy productionStrategy, Variant defaultVariant) {
        Objects.requireNonNull(symbols, "symbols");
        this.parser = new AtomStreamParser(symbols, options);
        this.encoder = new StreamEncoder(new ArgumentEncoder(symbols), productionStrategy);
        this.decoder = new StreamDecoder(symbols);
        this.defaultVariant = Objects.requireNonNull(defaultVariant, "defaultVariant");
    }

    @Override
    public AtomTree parse(String fdoSource) throws FdoCompilationException {
        return parser.parse(fdoSource);
    }

    @Override
    public EncodedStream compile(String fdoSource, Variant variant) throws FdoCompilationException {
        AtomTree tree = parser.parse(fdoSource);
        return encoder.encode(tree, variant);
    }

    @Override
    public byte[] compile(String fdoSource) throws FdoCompilationException {
        try {
            return compile(fdoSource, defaultVariant).toByteArray();
        } catch (FdoCompilationException e) {
            LoggerUtil.debug(() -> "[AtomizerCompilationService] Compilation failed: " + e.getMessage());
            throw e;
        }
    }

    @Override
    public List<DecodedAtom> decompile(byte[] binary) throws FdoCompilationException {
        return decoder.decode(binary);
    }

    @Override
    public Variant getDefaultVariant() {
        return defaultVariant;
    }

    @Override
    public String getStrategyName() {
        return encoder.strategyFor(Variant.PRODUCTION).name();
    }
}
