/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

import java.util.Objects;

/**
 * One entry of an atom's argument signature.
 *
 * @param type      declared type
 * @param enumTable enum table name, set only for {@link ArgType#ENUM_REF}
 */
public record ArgSpec(ArgType type, String enumTable) {

    public ArgSpec {
        Objects.requireNonNull(type, "type");
        if (type == ArgType.ENUM_REF && (enumTable == null || enumTable.isBlank())) {
            throw new IllegalArgumentException("ENUM_REF argument requires an enum table name");
        }
        if (type != ArgType.ENUM_REF && enumTable != null) {
            throw new IllegalArgumentException(type + " argument cannot name an enum table");
        }
    }

    public static ArgSpec of(ArgType type) {
        return new ArgSpec(type, null);
    }

    public static ArgSpec enumRef(String table) {
        return new ArgSpec(ArgType.ENUM_REF, table);
    }

    /**
     * Parses the table notation: {@code INTEGER}, {@code OPAQUE}, {@code ENUM_REF:object_type}.
     */
    public static ArgSpec parse(String notation) {
        String trimmed = notation.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return of(ArgType.valueOf(trimmed));
        }
        ArgType type = ArgType.valueOf(trimmed.substring(0, colon));
        return new ArgSpec(type, trimmed.substring(colon + 1));
    }

    @Override
    public String toString() {
        return enumTable == null ? type.name() : type.name() + ":" + enumTable;
    }
}
