/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.spi;

/**
 * Unified exception for FDO compilation failures.
 *
 * <p>Each subclass names one failure class of the pipeline (parse, lookup, argument,
 * structure, encoding). Any of them aborts the compilation of a single source with no
 * partial output; the caller may continue with the next input.</p>
 */
public class FdoCompilationException extends Exception {

    /** Line number used when a failure is not tied to a source line. */
    public static final int NO_LINE = 0;

    private final int line;
    private final String excerpt;

    public FdoCompilationException(String message, int line, String excerpt) {
        super(message);
        this.line = line;
        this.excerpt = excerpt;
    }

    public FdoCompilationException(String message, int line, String excerpt, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.excerpt = excerpt;
    }

    /**
     * Get the 1-based source line the failure refers to.
     *
     * @return line number, or {@link #NO_LINE}
     */
    public int getLine() {
        return line;
    }

    /**
     * Get the offending source text (a line, a mnemonic or a single argument token).
     *
     * @return excerpt, or null when there is none
     */
    public String getExcerpt() {
        return excerpt;
    }

    /** Message without the line/excerpt decoration. */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        if (line > NO_LINE) {
            sb.append("[line ").append(line).append("] ");
        }
        sb.append(super.getMessage());
        if (excerpt != null && !excerpt.isEmpty()) {
            sb.append(": '").append(excerpt).append('\'');
        }
        return sb.toString();
    }

    /**
     * Thrown when a source line is malformed (bad indentation, missing mnemonic).
     */
    public static class ParseException extends FdoCompilationException {
        public ParseException(String message, int line, String excerpt) {
            super(message, line, excerpt);
        }
    }

    /**
     * Thrown when a mnemonic does not resolve in the symbol table.
     */
    public static class LookupException extends FdoCompilationException {
        private final String mnemonic;

        public LookupException(String mnemonic, int line) {
            super("Unknown atom mnemonic", line, mnemonic);
            this.mnemonic = mnemonic;
        }

        public String getMnemonic() {
            return mnemonic;
        }
    }

    /**
     * Thrown when an argument literal does not match the type declared for its position.
     */
    public static class ArgumentFormatException extends FdoCompilationException {
        private final String mnemonic;

        public ArgumentFormatException(String mnemonic, String message, int line, String excerpt) {
            super(String.format("%s: %s", mnemonic, message), line, excerpt);
            this.mnemonic = mnemonic;
        }

        public String getMnemonic() {
            return mnemonic;
        }
    }

    /**
     * Thrown when stream and object markers are unbalanced or out of place.
     */
    public static class StructuralException extends FdoCompilationException {
        public StructuralException(String message, int line, String excerpt) {
            super(message, line, excerpt);
        }
    }

    /**
     * Thrown when a value does not fit the layout of the selected variant,
     * or when a binary stream cannot be decoded.
     */
    public static class EncodingException extends FdoCompilationException {
        public EncodingException(String message, int line, String excerpt) {
            super(message, line, excerpt);
        }

        public EncodingException(String message) {
            super(message, NO_LINE, null);
        }
    }
}
