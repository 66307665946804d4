/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

/**
 * Declared type of one argument position in an atom signature.
 */
public enum ArgType {
    /** Decimal integer; width depends on the variant. */
    INTEGER,
    /** Single byte written as {@code NNx}. */
    HEX_BYTE,
    /** Double-quoted Latin-1 text. */
    QUOTED_STRING,
    /** {@code A-B} identifier pair (a GID). */
    COORDINATE_PAIR,
    /** Identifier resolved through a named enum table. */
    ENUM_REF,
    /** Raw bytes: {@code NNx} tokens, quoted strings or bare hex. Consumes the remaining tokens. */
    OPAQUE
}
