/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.parse;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.ParseException;
import com.atomizer.fdo.symbol.AtomDefinition;
import com.atomizer.fdo.symbol.SymbolTable;
import com.atomizer.utils.LoggerUtil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Parses atom stream source text into an {@link AtomTree}.
 *
 * <p>Each significant line is {@code <indent><mnemonic>[ <argument-text>]}. Blank lines and
 * lines whose trimmed text starts with {@code <} are comments. Indentation decides the
 * parent/child relationship; the start/end stream and object markers decide structural
 * depth and are checked by a {@link StructureTracker}.</p>
 *
 * <p>Instances are immutable and may be shared across threads.</p>
 */
public final class AtomStreamParser {

    private final SymbolTable symbols;
    private final ParserOptions options;

    public AtomStreamParser(SymbolTable symbols) {
        this(symbols, ParserOptions.DEFAULTS);
    }

    public AtomStreamParser(SymbolTable symbols, ParserOptions options) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Mutable node used while the indentation stack is still open. */
    private static final class Draft {
        final AtomDefinition definition;
        final String rawArguments;
        final int indent;
        final int depth;
        final int line;
        final List<Draft> children = new ArrayList<>();

        Draft(AtomDefinition definition, String rawArguments, int indent, int depth, int line) {
            this.definition = definition;
            this.rawArguments = rawArguments;
            this.indent = indent;
            this.depth = depth;
            this.line = line;
        }

        AtomNode freeze() {
            List<AtomNode> frozen = new ArrayList<>(children.size());
            for (Draft child : children) {
                frozen.add(child.freeze());
            }
            return new AtomNode(definition, rawArguments, frozen, depth, line);
        }
    }

    /**
     * Parse source text.
     *
     * @param source atom stream text, CRLF or LF line endings
     * @return the parsed tree
     * @throws FdoCompilationException.ParseException      on a malformed line
     * @throws FdoCompilationException.LookupException     on an unknown mnemonic
     * @throws FdoCompilationException.StructuralException on unbalanced or empty input
     */
    public AtomTree parse(String source) throws FdoCompilationException {
        String normalized = source == null ? "" : source.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);

        StructureTracker tracker = new StructureTracker(options.strictObjectClosure());
        Deque<Draft> indentStack = new ArrayDeque<>();
        List<Draft> roots = new ArrayList<>();
        int lastLine = 0;

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i];
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("<")) {
                continue;
            }

            int contentStart = indentEnd(line);
            int indent = measureIndent(line, contentStart, lineNo);
            String content = line.substring(contentStart).trim();

            int mnemonicEnd = scanMnemonic(content, lineNo);
            String mnemonic = content.substring(0, mnemonicEnd);
            String rawArguments = content.substring(mnemonicEnd).trim();

            AtomDefinition def = symbols.require(mnemonic, lineNo);
            int depth = tracker.accept(def, lineNo, trimmed);

            Draft node = new Draft(def, rawArguments, indent, depth, lineNo);
            while (!indentStack.isEmpty() && indentStack.peek().indent >= indent) {
                indentStack.pop();
            }
            if (indentStack.isEmpty()) {
                roots.add(node);
            } else {
                indentStack.peek().children.add(node);
            }
            indentStack.push(node);
            lastLine = lineNo;
        }

        tracker.finish(lastLine);

        List<AtomNode> frozen = new ArrayList<>(roots.size());
        for (Draft root : roots) {
            frozen.add(root.freeze());
        }
        AtomTree tree = new AtomTree(frozen);
        LoggerUtil.debug(() -> String.format("[AtomStreamParser] Parsed %d atoms (%d top-level) from %d lines",
                tree.size(), roots.size(), lines.length));
        return tree;
    }

    private static int indentEnd(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private int measureIndent(String line, int end, int lineNo) throws ParseException {
        int indent = 0;
        for (int i = 0; i < end; i++) {
            if (line.charAt(i) == '\t') {
                if (options.tabWidth() == 0) {
                    throw new ParseException("Tab character in indentation", lineNo, line.trim());
                }
                indent += options.tabWidth();
            } else {
                indent++;
            }
        }
        return indent;
    }

    /**
     * Returns the end index of the leading mnemonic, which must be followed by the end of the
     * line, whitespace or {@code <}.
     */
    private static int scanMnemonic(String content, int lineNo) throws ParseException {
        if (!isAsciiLetter(content.charAt(0))) {
            throw new ParseException("Expected an atom mnemonic", lineNo, content);
        }
        int i = 1;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (isAsciiLetter(c) || (c >= '0' && c <= '9') || c == '_') {
                i++;
            } else {
                break;
            }
        }
        if (i < content.length()) {
            char next = content.charAt(i);
            if (!Character.isWhitespace(next) && next != '<') {
                throw new ParseException("Malformed atom mnemonic", lineNo, content);
            }
        }
        return i;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
