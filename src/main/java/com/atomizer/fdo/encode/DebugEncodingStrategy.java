/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.EncodingException;
import com.atomizer.fdo.symbol.AtomDefinition;

import java.io.ByteArrayOutputStream;

/**
 * Debug layout: header {@code 00 01}, then every atom as
 * {@code [protocol:1][atom:1][length:2 BE][data]}. Nothing is omitted or narrowed.
 */
public final class DebugEncodingStrategy implements EncodingStrategy {

    public static final String NAME = "debug";
    public static final int MAX_DATA_LENGTH = 0xFFFF;

    @Override
    public Variant variant() {
        return Variant.DEBUG;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EncodedStream encode(AtomTree tree, ArgumentEncoder arguments) throws FdoCompilationException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (AtomNode node : tree.flatten()) {
            AtomDefinition def = node.definition();
            byte[] data = arguments.encode(node, Variant.DEBUG);
            if (data.length > MAX_DATA_LENGTH) {
                throw new EncodingException(String.format("%s: data length %d exceeds %d",
                        def.mnemonic(), data.length, MAX_DATA_LENGTH), node.sourceLine(), def.mnemonic());
            }
            out.write(def.protocol());
            out.write(def.atom());
            out.write(data.length >>> 8);
            out.write(data.length & 0xFF);
            out.writeBytes(data);
        }
        return EncodedStream.of(Variant.DEBUG, out.toByteArray());
    }
}
