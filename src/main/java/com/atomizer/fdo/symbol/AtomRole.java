/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

/**
 * Structural role of an atom, driving the parser's stream/object state machine.
 */
public enum AtomRole {
    START_STREAM,
    END_STREAM,
    START_OBJECT,
    /** Closes the innermost open object and opens a new one at the same depth. */
    START_SIBLING,
    END_OBJECT,
    PLAIN
}
