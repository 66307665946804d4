/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.utils.LoggerUtil;

import java.util.Objects;

/**
 * Encodes parsed trees with one strategy per variant.
 *
 * <p>Pure and thread-safe: strategies hold no state and every call builds its own output.</p>
 */
public final class StreamEncoder {

    private final ArgumentEncoder arguments;
    private final EncodingStrategy debug;
    private final EncodingStrategy production;

    public StreamEncoder(ArgumentEncoder arguments) {
        this(arguments, new DebugEncodingStrategy(), new StyledCompactionStrategy());
    }

    public StreamEncoder(ArgumentEncoder arguments, EncodingStrategy production) {
        this(arguments, new DebugEncodingStrategy(), production);
    }

    public StreamEncoder(ArgumentEncoder arguments, EncodingStrategy debug, EncodingStrategy production) {
        this.arguments = Objects.requireNonNull(arguments, "arguments");
        this.debug = requireVariant(debug, Variant.DEBUG);
        this.production = requireVariant(production, Variant.PRODUCTION);
    }

    private static EncodingStrategy requireVariant(EncodingStrategy strategy, Variant expected) {
        Objects.requireNonNull(strategy, "strategy");
        if (strategy.variant() != expected) {
            throw new IllegalArgumentException(String.format(
                    "Strategy '%s' produces %s, expected %s", strategy.name(), strategy.variant(), expected));
        }
        return strategy;
    }

    /**
     * Encode a tree in the requested variant.
     *
     * @throws FdoCompilationException if an argument is malformed or does not fit the layout
     */
    public EncodedStream encode(AtomTree tree, Variant variant) throws FdoCompilationException {
        EncodingStrategy strategy = strategyFor(variant);
        EncodedStream stream = strategy.encode(tree, arguments);
        LoggerUtil.debug(() -> String.format("[StreamEncoder] %s/%s: %d atoms -> %d bytes",
                variant.label(), strategy.name(), tree.size(), stream.length()));
        return stream;
    }

    public EncodingStrategy strategyFor(Variant variant) {
        return variant == Variant.DEBUG ? debug : production;
    }

    public ArgumentEncoder arguments() {
        return arguments;
    }
}
