/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.spi.FdoCompilationException.ArgumentFormatException;
import com.atomizer.fdo.spi.FdoCompilationException.EncodingException;
import com.atomizer.fdo.symbol.ArgSpec;
import com.atomizer.fdo.symbol.AtomDefinition;
import com.atomizer.fdo.symbol.SymbolTable;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes an atom's argument text into its data bytes, driven by the declared signature.
 *
 * <p>Argument text is either empty or a single {@code <...>} group of comma separated
 * tokens. Each token is checked against the type declared for its position; nothing is
 * inferred from the token's shape alone. Integer and coordinate widths depend on the
 * variant:</p>
 * <ul>
 *   <li>{@code INTEGER}: 4 bytes big-endian in debug; smallest width of 1..3 bytes for
 *       non-negative values in production, 4 bytes otherwise.</li>
 *   <li>{@code COORDINATE_PAIR}: two 4-byte values in debug; {@code [A:1][B:2]} in production.</li>
 * </ul>
 */
public final class ArgumentEncoder {

    private static final Pattern HEX_BYTE = Pattern.compile("([0-9A-Fa-f]{1,2})[xX]");
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern COORDINATE = Pattern.compile("([0-9]+)\\s*-\\s*([0-9]+)");
    private static final Pattern BARE_HEX = Pattern.compile("(?:[0-9A-Fa-f]{2})+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final long MIN_INTEGER = Integer.MIN_VALUE;
    private static final long MAX_INTEGER = 0xFFFFFFFFL;

    private final SymbolTable symbols;

    public ArgumentEncoder(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    /**
     * Encode the arguments of one atom.
     *
     * @return data bytes, possibly empty
     * @throws ArgumentFormatException if a token does not match its declared type or the count is wrong
     * @throws EncodingException if a value does not fit the variant's field width
     */
    public byte[] encode(AtomNode node, Variant variant) throws FdoCompilationException {
        AtomDefinition def = node.definition();
        int line = node.sourceLine();

        List<String> tokens = tokenize(def, node.rawArguments(), line);
        if (tokens.isEmpty() && def.hasDefaultArguments()) {
            tokens = splitTokens(def, def.defaultArguments(), line);
        }
        checkCount(def, tokens, line, node.rawArguments());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<ArgSpec> specs = def.args();
        for (int i = 0; i < specs.size() && i < tokens.size(); i++) {
            ArgSpec spec = specs.get(i);
            switch (spec.type()) {
                case HEX_BYTE -> out.write(hexByte(def, tokens.get(i), line));
                case INTEGER -> writeInteger(out, integer(def, tokens.get(i), line), variant);
                case QUOTED_STRING -> out.writeBytes(quoted(def, tokens.get(i), line));
                case COORDINATE_PAIR -> writeCoordinate(out, def, tokens.get(i), line, variant);
                case ENUM_REF -> out.write(enumValue(def, spec.enumTable(), tokens.get(i), line));
                case OPAQUE -> {
                    for (String token : tokens.subList(i, tokens.size())) {
                        out.writeBytes(opaque(def, token, line));
                    }
                }
            }
        }
        return out.toByteArray();
    }

    /**
     * Data bytes produced by the definition's default arguments, or an empty array when it has none.
     */
    public byte[] defaultData(AtomDefinition def, Variant variant) throws FdoCompilationException {
        if (!def.hasDefaultArguments()) {
            return new byte[0];
        }
        return encode(new AtomNode(def, "", List.of(), 0, FdoCompilationException.NO_LINE), variant);
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /**
     * Splits argument text into tokens: strips the enclosing {@code <>} and splits on commas
     * outside double quotes. Quoted tokens keep their quotes.
     */
    public static List<String> tokenize(AtomDefinition def, String rawArguments, int line)
            throws ArgumentFormatException {
        String raw = rawArguments == null ? "" : rawArguments.trim();
        if (raw.isEmpty()) {
            return List.of();
        }
        if (raw.length() < 2 || raw.charAt(0) != '<' || raw.charAt(raw.length() - 1) != '>') {
            throw new ArgumentFormatException(def.mnemonic(), "arguments must be enclosed in <...>", line, raw);
        }
        return splitTokens(def, raw.substring(1, raw.length() - 1), line);
    }

    private static List<String> splitTokens(AtomDefinition def, String inner, int line)
            throws ArgumentFormatException {
        List<String> tokens = new ArrayList<>();
        if (inner.isBlank()) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (inQuote && c == '\\' && i + 1 < inner.length()) {
                current.append(c).append(inner.charAt(++i));
            } else if (c == '"') {
                inQuote = !inQuote;
                current.append(c);
            } else if (c == ',' && !inQuote) {
                tokens.add(finishToken(def, current, line, inner));
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (inQuote) {
            throw new ArgumentFormatException(def.mnemonic(), "unterminated string literal", line, inner);
        }
        tokens.add(finishToken(def, current, line, inner));
        return tokens;
    }

    private static String finishToken(AtomDefinition def, StringBuilder current, int line, String inner)
            throws ArgumentFormatException {
        String token = current.toString().trim();
        if (token.isEmpty()) {
            throw new ArgumentFormatException(def.mnemonic(), "empty argument", line, inner);
        }
        return token;
    }

    private static void checkCount(AtomDefinition def, List<String> tokens, int line, String raw)
            throws ArgumentFormatException {
        int max = def.args().size();
        if (tokens.size() < def.requiredArgs()) {
            throw new ArgumentFormatException(def.mnemonic(), String.format(
                    "expected at least %d argument(s) %s, got %d", def.requiredArgs(), def.args(), tokens.size()),
                    line, raw);
        }
        if (!def.hasTrailingOpaque() && tokens.size() > max) {
            throw new ArgumentFormatException(def.mnemonic(), String.format(
                    "expected at most %d argument(s) %s, got %d", max, def.args(), tokens.size()),
                    line, raw);
        }
    }

    private static int hexByte(AtomDefinition def, String token, int line) throws ArgumentFormatException {
        Matcher m = HEX_BYTE.matcher(token);
        if (!m.matches()) {
            throw new ArgumentFormatException(def.mnemonic(), "expected a hex byte like 0Ax", line, token);
        }
        return Integer.parseInt(m.group(1), 16);
    }

    private static long integer(AtomDefinition def, String token, int line) throws ArgumentFormatException {
        if (!INTEGER.matcher(token).matches()) {
            throw new ArgumentFormatException(def.mnemonic(), "expected a decimal integer", line, token);
        }
        long value;
        try {
            value = Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new ArgumentFormatException(def.mnemonic(), "integer out of range", line, token);
        }
        if (value < MIN_INTEGER || value > MAX_INTEGER) {
            throw new ArgumentFormatException(def.mnemonic(), "integer out of range", line, token);
        }
        return value;
    }

    private static void writeInteger(ByteArrayOutputStream out, long value, Variant variant) {
        int width = variant == Variant.DEBUG ? 4 : minimalWidth(value);
        writeBigEndian(out, value, width);
    }

    /**
     * Smallest big-endian width holding a non-negative value; negative values take 4 bytes.
     */
    static int minimalWidth(long value) {
        if (value < 0) return 4;
        if (value <= 0xFFL) return 1;
        if (value <= 0xFFFFL) return 2;
        if (value <= 0xFFFFFFL) return 3;
        return 4;
    }

    private static void writeBigEndian(ByteArrayOutputStream out, long value, int width) {
        for (int shift = (width - 1) * 8; shift >= 0; shift -= 8) {
            out.write((int) (value >>> shift) & 0xFF);
        }
    }

    private static byte[] quoted(AtomDefinition def, String token, int line) throws ArgumentFormatException {
        if (token.length() < 2 || token.charAt(0) != '"' || token.charAt(token.length() - 1) != '"') {
            throw new ArgumentFormatException(def.mnemonic(), "expected a quoted string", line, token);
        }
        String inner = token.substring(1, token.length() - 1);
        StringBuilder sb = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                sb.append(inner.charAt(++i));
            } else if (c == '"') {
                throw new ArgumentFormatException(def.mnemonic(), "unescaped quote inside string", line, token);
            } else {
                sb.append(c);
            }
        }
        String text = sb.toString();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0xFF) {
                throw new ArgumentFormatException(def.mnemonic(),
                        "character outside ISO-8859-1: U+" + String.format("%04X", (int) text.charAt(i)),
                        line, token);
            }
        }
        return text.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static void writeCoordinate(ByteArrayOutputStream out, AtomDefinition def, String token,
                                        int line, Variant variant) throws FdoCompilationException {
        Matcher m = COORDINATE.matcher(token);
        if (!m.matches()) {
            throw new ArgumentFormatException(def.mnemonic(), "expected a coordinate pair like 32-105", line, token);
        }
        long a;
        long b;
        try {
            a = Long.parseLong(m.group(1));
            b = Long.parseLong(m.group(2));
        } catch (NumberFormatException e) {
            throw new ArgumentFormatException(def.mnemonic(), "coordinate out of range", line, token);
        }
        if (a > MAX_INTEGER || b > MAX_INTEGER) {
            throw new ArgumentFormatException(def.mnemonic(), "coordinate out of range", line, token);
        }
        if (variant == Variant.DEBUG) {
            writeBigEndian(out, a, 4);
            writeBigEndian(out, b, 4);
            return;
        }
        if (a > 0xFF || b > 0xFFFF) {
            throw new EncodingException(def.mnemonic() + ": coordinate does not fit production form [A:1][B:2]",
                    line, token);
        }
        writeBigEndian(out, a, 1);
        writeBigEndian(out, b, 2);
    }

    private int enumValue(AtomDefinition def, String table, String token, int line) throws ArgumentFormatException {
        if (!IDENTIFIER.matcher(token).matches()) {
            throw new ArgumentFormatException(def.mnemonic(), "expected a " + table + " name", line, token);
        }
        return symbols.enumValue(table, token)
                .orElseThrow(() -> new ArgumentFormatException(def.mnemonic(),
                        "unknown " + table + " value", line, token));
    }

    private static byte[] opaque(AtomDefinition def, String token, int line) throws ArgumentFormatException {
        if (HEX_BYTE.matcher(token).matches()) {
            return new byte[]{(byte) hexByte(def, token, line)};
        }
        if (token.startsWith("\"")) {
            return quoted(def, token, line);
        }
        if (BARE_HEX.matcher(token).matches()) {
            byte[] out = new byte[token.length() / 2];
            for (int i = 0; i < out.length; i++) {
                out[i] = (byte) Integer.parseInt(token.substring(i * 2, i * 2 + 2), 16);
            }
            return out;
        }
        throw new ArgumentFormatException(def.mnemonic(),
                "expected hex bytes (0Ax), a quoted string or an even-length hex run", line, token);
    }
}
