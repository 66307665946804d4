/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.aol.core.Hex;
import com.atomizer.fdo.symbol.AtomDefinition;

import java.util.Arrays;

/**
 * One atom recovered from a binary stream.
 *
 * @param definition symbol table entry for the decoded code
 * @param data       argument bytes
 * @param depth      structural depth, same rules as the parser
 * @param offset     offset of the atom record in the stream, -1 for an implied root
 */
public record DecodedAtom(AtomDefinition definition, byte[] data, int depth, int offset) {

    public DecodedAtom {
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String mnemonic() {
        return definition.mnemonic();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DecodedAtom other)) return false;
        return depth == other.depth
                && offset == other.offset
                && definition.equals(other.definition)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * definition.hashCode() + Arrays.hashCode(data)) + depth;
    }

    @Override
    public String toString() {
        String indent = "  ".repeat(depth);
        return data.length == 0
                ? indent + definition.mnemonic()
                : indent + definition.mnemonic() + " [" + Hex.spaced(data) + "]";
    }
}
