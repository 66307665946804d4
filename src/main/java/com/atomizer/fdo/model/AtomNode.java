/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.model;

import com.atomizer.fdo.symbol.AtomDefinition;

import java.util.List;
import java.util.Objects;

/**
 * One parsed atom.
 *
 * @param definition   resolved symbol table entry
 * @param rawArguments argument text after the mnemonic, trimmed, uninterpreted
 * @param children     atoms indented under this one, in source order
 * @param depth        number of streams and objects enclosing this atom
 * @param sourceLine   1-based line number in the source text
 */
public record AtomNode(
        AtomDefinition definition,
        String rawArguments,
        List<AtomNode> children,
        int depth,
        int sourceLine) {

    public AtomNode {
        Objects.requireNonNull(definition, "definition");
        rawArguments = rawArguments == null ? "" : rawArguments;
        children = List.copyOf(children);
    }

    public String mnemonic() {
        return definition.mnemonic();
    }

    @Override
    public String toString() {
        return rawArguments.isEmpty()
                ? definition.mnemonic()
                : definition.mnemonic() + " " + rawArguments;
    }
}
