/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.aol.core.Hex;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.parse.StructureTracker;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.EncodingException;
import com.atomizer.fdo.spi.FdoCompilationException.StructuralException;
import com.atomizer.fdo.symbol.AtomDefinition;
import com.atomizer.fdo.symbol.AtomRole;
import com.atomizer.fdo.symbol.SymbolTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decodes debug and production streams back into atoms.
 *
 * <p>Understands the forms this project emits. The variant is detected from the header;
 * for production streams an implied root start-stream atom is restored. Unknown styles or
 * codes fail with an {@link EncodingException} naming the offset.</p>
 */
public final class StreamDecoder {

    private final SymbolTable symbols;
    private final ArgumentEncoder arguments;

    public StreamDecoder(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.arguments = new ArgumentEncoder(symbols);
    }

    public List<DecodedAtom> decode(EncodedStream stream) throws FdoCompilationException {
        return decode(stream.toByteArray());
    }

    /**
     * Decode a complete stream, header included.
     *
     * @throws EncodingException if the header is unknown, the data is truncated, or an atom
     *                           cannot be decoded
     */
    public List<DecodedAtom> decode(byte[] stream) throws FdoCompilationException {
        Variant variant = Variant.detect(stream)
                .orElseThrow(() -> new EncodingException("Unrecognised stream header: "
                        + (stream == null ? "null" : Hex.spaced(stream, 0, 2))));
        Cursor cursor = new Cursor(stream);
        cursor.pos = 2;
        StructureTracker tracker = new StructureTracker(false);
        List<DecodedAtom> atoms = new ArrayList<>();

        if (variant == Variant.DEBUG) {
            while (cursor.hasMore()) {
                int offset = cursor.pos;
                int protocol = cursor.next();
                int atom = cursor.next();
                int length = (cursor.next() << 8) | cursor.next();
                atoms.add(atom(tracker, resolve(protocol, atom, offset), cursor.take(length), offset, atoms.size()));
            }
        } else {
            decodeProduction(cursor, tracker, atoms);
        }

        try {
            tracker.finish(atoms.size());
        } catch (StructuralException e) {
            throw new EncodingException("Decoded stream is not well formed: " + e.getDetail());
        }
        return atoms;
    }

    private void decodeProduction(Cursor cursor, StructureTracker tracker, List<DecodedAtom> atoms)
            throws FdoCompilationException {
        int currentProtocol = 0;
        boolean first = true;
        while (cursor.hasMore()) {
            int offset = cursor.pos;
            int b0 = cursor.next();
            int style = b0 >>> 5;
            int low = b0 & 0x1F;

            int protocol;
            int atom;
            byte[] data;
            switch (style) {
                case ProductionFormat.STYLE_FULL -> {
                    protocol = low;
                    atom = cursor.next();
                    int length = cursor.next();
                    if ((length & 0x80) != 0) {
                        length = ((length & 0x7F) << 8) | cursor.next();
                    }
                    data = cursor.take(length);
                }
                case ProductionFormat.STYLE_SHORT -> {
                    protocol = low;
                    int b1 = cursor.next();
                    atom = b1 & 0x1F;
                    data = cursor.take(b1 >>> 5);
                }
                case ProductionFormat.STYLE_ZERO -> {
                    protocol = low;
                    atom = cursor.next();
                    data = new byte[]{0};
                }
                case ProductionFormat.STYLE_CURRENT -> {
                    protocol = currentProtocol;
                    atom = low;
                    data = cursor.take(cursor.next());
                }
                default -> throw new EncodingException(String.format(
                        "Unsupported production atom style %d (byte %02X) at offset %d", style, b0, offset));
            }

            AtomDefinition def = resolve(protocol, atom, offset);
            if (first && def.role() != AtomRole.START_STREAM) {
                AtomDefinition root = ProductionFormat.impliedRoot(symbols)
                        .orElseThrow(() -> new EncodingException("Atom table has no start-stream atom"));
                atoms.add(atom(tracker, root, arguments.defaultData(root, Variant.PRODUCTION), -1, 0));
            }
            first = false;
            atoms.add(atom(tracker, def, data, offset, atoms.size()));
            currentProtocol = protocol;
        }
    }

    private AtomDefinition resolve(int protocol, int atom, int offset) throws EncodingException {
        return symbols.lookup(protocol, atom)
                .orElseThrow(() -> new EncodingException(
                        String.format("Unknown atom %d:%d at offset %d", protocol, atom, offset)));
    }

    private static DecodedAtom atom(StructureTracker tracker, AtomDefinition def, byte[] data, int offset, int index)
            throws EncodingException {
        try {
            int depth = tracker.accept(def, index + 1, def.mnemonic());
            return new DecodedAtom(def, data, depth, offset);
        } catch (StructuralException e) {
            throw new EncodingException(String.format("Misplaced %s at offset %d: %s",
                    def.mnemonic(), offset, e.getDetail()));
        }
    }

    /** Read position over the raw stream. */
    private static final class Cursor {
        private final byte[] data;
        private int pos;

        Cursor(byte[] data) {
            this.data = data;
        }

        boolean hasMore() {
            return pos < data.length;
        }

        int next() throws EncodingException {
            if (pos >= data.length) {
                throw new EncodingException("Truncated stream at offset " + pos);
            }
            return data[pos++] & 0xFF;
        }

        byte[] take(int length) throws EncodingException {
            if (pos + length > data.length) {
                throw new EncodingException(String.format(
                        "Truncated atom data at offset %d: need %d bytes, %d left", pos, length, data.length - pos));
            }
            byte[] out = Arrays.copyOfRange(data, pos, pos + length);
            pos += length;
            return out;
        }
    }
}
