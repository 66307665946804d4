/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;

/**
 * One binary layout for a parsed tree.
 *
 * <p>Implementations are stateless and deterministic: the same tree always yields the
 * same bytes. The production layout is only partially known, so alternative production
 * strategies can be swapped in and compared through the differential validator.</p>
 */
public interface EncodingStrategy {

    /** Variant this strategy produces; decides the header bytes. */
    Variant variant();

    /** Short identifier used in configuration, logs and reports. */
    String name();

    /**
     * Encode a tree, walking atoms depth-first in document order.
     *
     * @throws FdoCompilationException if an argument or a length does not fit the layout
     */
    EncodedStream encode(AtomTree tree, ArgumentEncoder arguments) throws FdoCompilationException;

    /**
     * Resolves a production strategy by configuration name.
     *
     * @param name {@code styled} (default) or {@code full}
     * @throws IllegalArgumentException if the name is unknown
     */
    static EncodingStrategy production(String name) {
        String key = name == null ? StyledCompactionStrategy.NAME : name.trim().toLowerCase();
        return switch (key) {
            case "", StyledCompactionStrategy.NAME -> new StyledCompactionStrategy();
            case FullFormCompactionStrategy.NAME -> new FullFormCompactionStrategy();
            default -> throw new IllegalArgumentException(String.format(
                    "Unknown production strategy: '%s'. Valid options: '%s', '%s'",
                    name, StyledCompactionStrategy.NAME, FullFormCompactionStrategy.NAME));
        };
    }
}
