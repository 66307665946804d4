/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one atom: mnemonic, numeric code and argument signature.
 *
 * @param mnemonic         case-sensitive source name, e.g. {@code mat_object_id}
 * @param protocol         protocol number (0..31)
 * @param atom             atom number within the protocol (0..255)
 * @param args             ordered argument signature
 * @param requiredArgs     minimum number of argument tokens
 * @param defaultArguments inner argument text used when the source gives none, or null
 * @param role             structural role
 */
public record AtomDefinition(
        String mnemonic,
        int protocol,
        int atom,
        List<ArgSpec> args,
        int requiredArgs,
        String defaultArguments,
        AtomRole role) {

    public static final int MAX_PROTOCOL = 31;
    public static final int MAX_ATOM = 255;

    public AtomDefinition {
        Objects.requireNonNull(mnemonic, "mnemonic");
        Objects.requireNonNull(role, "role");
        if (protocol < 0 || protocol > MAX_PROTOCOL) {
            throw new IllegalArgumentException(mnemonic + ": protocol out of range 0.." + MAX_PROTOCOL + ": " + protocol);
        }
        if (atom < 0 || atom > MAX_ATOM) {
            throw new IllegalArgumentException(mnemonic + ": atom out of range 0.." + MAX_ATOM + ": " + atom);
        }
        args = List.copyOf(args);
        if (requiredArgs < 0 || requiredArgs > args.size()) {
            throw new IllegalArgumentException(mnemonic + ": required argument count " + requiredArgs
                    + " exceeds signature length " + args.size());
        }
        for (int i = 0; i < args.size() - 1; i++) {
            if (args.get(i).type() == ArgType.OPAQUE) {
                throw new IllegalArgumentException(mnemonic + ": OPAQUE is only allowed as the last argument");
            }
        }
    }

    /** Combined code, {@code protocol << 8 | atom}. */
    public int code() {
        return (protocol << 8) | atom;
    }

    public boolean hasTrailingOpaque() {
        return !args.isEmpty() && args.get(args.size() - 1).type() == ArgType.OPAQUE;
    }

    public boolean hasDefaultArguments() {
        return defaultArguments != null && !defaultArguments.isBlank();
    }

    @Override
    public String toString() {
        return String.format("%s(%d:%d)", mnemonic, protocol, atom);
    }
}
