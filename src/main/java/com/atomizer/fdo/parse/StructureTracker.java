/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.parse;

import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.StructuralException;
import com.atomizer.fdo.symbol.AtomDefinition;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stream/object nesting state machine. Fed one atom at a time in source order,
 * it rejects misplaced markers and reports each atom's structural depth.
 * Used by the parser on source lines and by the decoder on binary atoms.
 */
public final class StructureTracker {

    private enum Frame { STREAM, OBJECT }

    private final boolean strictObjectClosure;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private boolean rootClosed;
    private int atomCount;

    public StructureTracker(boolean strictObjectClosure) {
        this.strictObjectClosure = strictObjectClosure;
    }

    /**
     * Applies one atom.
     *
     * @return the atom's depth: open frames before a start marker, after an end marker
     */
    public int accept(AtomDefinition def, int line, String excerpt) throws StructuralException {
        if (rootClosed) {
            throw new StructuralException("Atom after the end of the root stream", line, excerpt);
        }
        int depth;
        switch (def.role()) {
            case START_STREAM -> {
                depth = frames.size();
                frames.push(Frame.STREAM);
            }
            case END_STREAM -> {
                if (!frames.contains(Frame.STREAM)) {
                    throw new StructuralException("End-stream marker without a matching start", line, excerpt);
                }
                int openObjects = 0;
                while (frames.peek() == Frame.OBJECT) {
                    frames.pop();
                    openObjects++;
                }
                if (openObjects > 0 && strictObjectClosure) {
                    throw new StructuralException(
                            String.format("Stream closed with %d object(s) still open", openObjects), line, excerpt);
                }
                frames.pop();
                depth = frames.size();
                rootClosed = frames.isEmpty();
            }
            case START_OBJECT -> {
                requireOpenStream(line, excerpt);
                depth = frames.size();
                frames.push(Frame.OBJECT);
            }
            case START_SIBLING -> {
                requireOpenObject("Sibling marker", line, excerpt);
                frames.pop();
                depth = frames.size();
                frames.push(Frame.OBJECT);
            }
            case END_OBJECT -> {
                requireOpenObject("End-object marker", line, excerpt);
                frames.pop();
                depth = frames.size();
            }
            default -> {
                requireOpenStream(line, excerpt);
                depth = frames.size();
            }
        }
        atomCount++;
        return depth;
    }

    /**
     * Checks the accepting condition at end of input.
     */
    public void finish(int lastLine) throws StructuralException {
        if (atomCount == 0) {
            throw new StructuralException("Empty atom stream", FdoCompilationException.NO_LINE, null);
        }
        if (!rootClosed) {
            long objects = frames.stream().filter(f -> f == Frame.OBJECT).count();
            long streams = frames.size() - objects;
            throw new StructuralException(String.format(
                    "Unexpected end of input: missing end-stream marker (%d stream(s), %d object(s) open)",
                    streams, objects), lastLine, null);
        }
    }

    public ParserState state() {
        if (rootClosed) {
            return ParserState.ACCEPTED;
        }
        if (frames.isEmpty()) {
            return ParserState.TOP_LEVEL;
        }
        return frames.peek() == Frame.OBJECT ? ParserState.IN_OBJECT : ParserState.IN_STREAM;
    }

    /** Number of open objects. */
    public int objectDepth() {
        return (int) frames.stream().filter(f -> f == Frame.OBJECT).count();
    }

    private void requireOpenStream(int line, String excerpt) throws StructuralException {
        if (frames.isEmpty()) {
            throw new StructuralException("Atom outside of a stream", line, excerpt);
        }
    }

    private void requireOpenObject(String what, int line, String excerpt) throws StructuralException {
        if (frames.peek() != Frame.OBJECT) {
            throw new StructuralException(what + " without an open object", line, excerpt);
        }
    }
}
