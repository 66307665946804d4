/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;

import java.io.ByteArrayOutputStream;

/**
 * Baseline production strategy: production header and argument widths, every atom
 * (root included) in the full style 0 form. Used to measure how much of a reference
 * corpus the styled forms account for.
 */
public final class FullFormCompactionStrategy implements EncodingStrategy {

    public static final String NAME = "full";

    @Override
    public Variant variant() {
        return Variant.PRODUCTION;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EncodedStream encode(AtomTree tree, ArgumentEncoder arguments) throws FdoCompilationException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (AtomNode node : tree.flatten()) {
            ProductionFormat.writeFull(out, node.definition(), arguments.encode(node, Variant.PRODUCTION), node);
        }
        return EncodedStream.of(Variant.PRODUCTION, out.toByteArray());
    }
}
