/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.EncodingException;
import com.atomizer.fdo.symbol.AtomDefinition;
import com.atomizer.fdo.symbol.AtomRole;
import com.atomizer.fdo.symbol.SymbolTable;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Atom record forms of the production layout. The top three bits of an atom's first
 * byte select its style:
 * <pre>
 * style 0  [000ppppp][atom][len][data]      len &lt; 0x80 in one byte, else 0x8000|len in two
 * style 1  [001ppppp][lllaaaaa][data]       len &lt;= 7, atom &lt;= 31
 * style 2  [010ppppp][atom]                 data is the single byte 00
 * style 4  [100aaaaa][len][data]            protocol of the previous atom, atom &lt;= 31, len &lt; 0x80
 * </pre>
 * Styles 3, 5, 6 and 7 occur in reference streams but their layout is unknown.
 */
final class ProductionFormat {

    static final int STYLE_FULL = 0;
    static final int STYLE_SHORT = 1;
    static final int STYLE_ZERO = 2;
    static final int STYLE_CURRENT = 4;

    static final int MAX_SHORT_LENGTH = 7;
    static final int MAX_SHORT_ATOM = 0x1F;
    static final int MAX_ONE_BYTE_LENGTH = 0x7F;
    static final int MAX_FULL_LENGTH = 0x7FFF;

    private ProductionFormat() {}

    static boolean isZeroData(byte[] data) {
        return data.length == 1 && data[0] == 0;
    }

    static void writeFull(ByteArrayOutputStream out, AtomDefinition def, byte[] data, AtomNode node)
            throws EncodingException {
        if (data.length > MAX_FULL_LENGTH) {
            throw new EncodingException(String.format("%s: data length %d exceeds production limit %d",
                    def.mnemonic(), data.length, MAX_FULL_LENGTH), node.sourceLine(), def.mnemonic());
        }
        out.write((STYLE_FULL << 5) | def.protocol());
        out.write(def.atom());
        if (data.length <= MAX_ONE_BYTE_LENGTH) {
            out.write(data.length);
        } else {
            out.write(0x80 | (data.length >>> 8));
            out.write(data.length & 0xFF);
        }
        out.writeBytes(data);
    }

    static void writeShort(ByteArrayOutputStream out, AtomDefinition def, byte[] data) {
        out.write((STYLE_SHORT << 5) | def.protocol());
        out.write((data.length << 5) | def.atom());
        out.writeBytes(data);
    }

    static void writeZero(ByteArrayOutputStream out, AtomDefinition def) {
        out.write((STYLE_ZERO << 5) | def.protocol());
        out.write(def.atom());
    }

    static void writeCurrent(ByteArrayOutputStream out, AtomDefinition def, byte[] data) {
        out.write((STYLE_CURRENT << 5) | def.atom());
        out.write(data.length);
        out.writeBytes(data);
    }

    /**
     * The start-stream atom implied by the production header: the lowest-coded atom with
     * the start-stream role.
     */
    static Optional<AtomDefinition> impliedRoot(SymbolTable symbols) {
        return symbols.definitions().stream()
                .filter(d -> d.role() == AtomRole.START_STREAM)
                .min(Comparator.comparingInt(AtomDefinition::code));
    }

    /**
     * True when the first atom is the implied root with its default data and the header
     * alone can stand for it. A stream that opens a nested stream right away keeps its
     * root so the decoder can tell the two apart.
     */
    static boolean rootIsImplied(List<AtomNode> atoms, byte[] rootData, ArgumentEncoder arguments)
            throws FdoCompilationException {
        if (atoms.isEmpty()) {
            return false;
        }
        AtomDefinition first = atoms.get(0).definition();
        Optional<AtomDefinition> implied = impliedRoot(arguments.symbols());
        if (implied.isEmpty() || !implied.get().equals(first) || !first.hasDefaultArguments()) {
            return false;
        }
        if (atoms.size() > 1 && atoms.get(1).definition().role() == AtomRole.START_STREAM) {
            return false;
        }
        return Arrays.equals(rootData, arguments.defaultData(first, Variant.PRODUCTION));
    }
}
