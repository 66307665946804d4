/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

import com.atomizer.fdo.spi.FdoCompilationException.LookupException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mnemonic to atom definition registry, plus the secondary enum tables
 * referenced by {@link ArgType#ENUM_REF} arguments.
 *
 * <p>Built once and shared; all maps are unmodifiable so concurrent compilations may
 * read it without locking.</p>
 */
public final class SymbolTable {

    private final Map<String, AtomDefinition> byMnemonic;
    private final Map<Integer, AtomDefinition> byCode;
    private final Map<String, Map<String, Integer>> enums;

    private SymbolTable(Map<String, AtomDefinition> byMnemonic,
                        Map<Integer, AtomDefinition> byCode,
                        Map<String, Map<String, Integer>> enums) {
        this.byMnemonic = Collections.unmodifiableMap(byMnemonic);
        this.byCode = Collections.unmodifiableMap(byCode);
        this.enums = Collections.unmodifiableMap(enums);
    }

    /**
     * Builds a table, validating that mnemonics and codes are unique and that every
     * enum reference names a known table whose values fit in one byte.
     *
     * @throws IllegalStateException if the definitions are inconsistent
     */
    public static SymbolTable of(List<AtomDefinition> definitions, Map<String, Map<String, Integer>> enums) {
        Map<String, Map<String, Integer>> enumCopy = new LinkedHashMap<>();
        enums.forEach((table, values) -> {
            values.forEach((name, value) -> {
                if (value == null || value < 0 || value > 0xFF) {
                    throw new IllegalStateException(
                            String.format("Enum %s.%s value %s does not fit in one byte", table, name, value));
                }
            });
            enumCopy.put(table, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        });

        Map<String, AtomDefinition> byMnemonic = new LinkedHashMap<>();
        Map<Integer, AtomDefinition> byCode = new LinkedHashMap<>();
        for (AtomDefinition def : definitions) {
            if (byMnemonic.putIfAbsent(def.mnemonic(), def) != null) {
                throw new IllegalStateException("Duplicate mnemonic in atom table: " + def.mnemonic());
            }
            AtomDefinition clash = byCode.putIfAbsent(def.code(), def);
            if (clash != null) {
                throw new IllegalStateException(String.format("Atom code %d:%d used by both %s and %s",
                        def.protocol(), def.atom(), clash.mnemonic(), def.mnemonic()));
            }
            for (ArgSpec spec : def.args()) {
                if (spec.type() == ArgType.ENUM_REF && !enumCopy.containsKey(spec.enumTable())) {
                    throw new IllegalStateException(
                            def.mnemonic() + " references unknown enum table: " + spec.enumTable());
                }
            }
        }
        return new SymbolTable(byMnemonic, byCode, enumCopy);
    }

    /**
     * Exact, case-sensitive lookup.
     */
    public Optional<AtomDefinition> lookup(String mnemonic) {
        return Optional.ofNullable(byMnemonic.get(mnemonic));
    }

    /**
     * Reverse lookup by numeric code, used when decoding binary streams.
     */
    public Optional<AtomDefinition> lookup(int protocol, int atom) {
        return Optional.ofNullable(byCode.get((protocol << 8) | atom));
    }

    /**
     * Lookup that fails with the source line of the offending atom.
     *
     * @throws LookupException if the mnemonic is unknown
     */
    public AtomDefinition require(String mnemonic, int line) throws LookupException {
        AtomDefinition def = byMnemonic.get(mnemonic);
        if (def == null) {
            throw new LookupException(mnemonic, line);
        }
        return def;
    }

    public Optional<Integer> enumValue(String table, String name) {
        Map<String, Integer> values = enums.get(table);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(name));
    }

    /**
     * Reverse enum lookup for dumps; returns the first name mapped to {@code value}.
     */
    public Optional<String> enumName(String table, int value) {
        Map<String, Integer> values = enums.get(table);
        if (values == null) {
            return Optional.empty();
        }
        return values.entrySet().stream()
                .filter(e -> e.getValue() == value)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Collection<AtomDefinition> definitions() {
        return byMnemonic.values();
    }

    public int size() {
        return byMnemonic.size();
    }
}
