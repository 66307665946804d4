/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.spi;

import com.atomizer.fdo.encode.DecodedAtom;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;

import java.util.List;

/**
 * Service interface for FDO compilation.
 *
 * <p>Implementations hold only immutable state (symbol table, parser options, strategies)
 * and may be called concurrently from several threads.</p>
 */
public interface FdoCompilationService {

    /**
     * Parse source text without encoding it.
     *
     * @throws FdoCompilationException on a parse, lookup or structural error
     */
    AtomTree parse(String fdoSource) throws FdoCompilationException;

    /**
     * Compile FDO source to an encoded stream of the given variant.
     *
     * @param fdoSource the FDO source text to compile
     * @param variant   debug or production layout
     * @return the encoded stream
     * @throws FdoCompilationException if compilation fails; no partial output is produced
     */
    EncodedStream compile(String fdoSource, Variant variant) throws FdoCompilationException;

    /**
     * Compile FDO source to binary data in the service's default variant.
     *
     * @param fdoSource the FDO source text to compile
     * @return header and body bytes
     * @throws FdoCompilationException if compilation fails
     */
    byte[] compile(String fdoSource) throws FdoCompilationException;

    /**
     * Decode a compiled stream (either variant) back into atoms.
     *
     * @throws FdoCompilationException if the stream cannot be decoded
     */
    List<DecodedAtom> decompile(byte[] binary) throws FdoCompilationException;

    /** Variant used by {@link #compile(String)}. */
    Variant getDefaultVariant();

    /**
     * Get the production strategy name for logging and reports.
     *
     * @return strategy identifier (e.g., "styled", "full")
     */
    String getStrategyName();
}
