/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.parse;

/**
 * Structural state of a parse in progress.
 */
public enum ParserState {
    /** Nothing seen yet. */
    TOP_LEVEL,
    /** Innermost open frame is a stream. */
    IN_STREAM,
    /** Innermost open frame is an object. */
    IN_OBJECT,
    /** Root stream closed; only comments may follow. */
    ACCEPTED
}
