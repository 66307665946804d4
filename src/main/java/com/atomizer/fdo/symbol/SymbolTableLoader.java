/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.symbol;

import com.atomizer.utils.JacksonConfig;
import com.atomizer.utils.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link SymbolTable} from its JSON description.
 *
 * <p>The document has two members: {@code enums}, a map of table name to
 * {@code name -> byte value}, and {@code atoms}, one row per atom:</p>
 * <pre>
 * {"mnemonic": "mat_object_id", "protocol": 16, "atom": 12, "args": ["COORDINATE_PAIR"], "required": 1}
 * </pre>
 * <p>{@code required} defaults to 0, {@code role} to {@code PLAIN}; {@code defaults} is the
 * inner argument text used when a source line gives no arguments.</p>
 */
public final class SymbolTableLoader {

    /** Classpath resource holding the bundled table. */
    public static final String DEFAULT_RESOURCE = "atom-table.json";

    private static volatile SymbolTable bundled;

    private SymbolTableLoader() {}

    record TableDocument(Map<String, LinkedHashMap<String, Integer>> enums, List<AtomRow> atoms) {}

    record AtomRow(String mnemonic, int protocol, int atom, List<String> args,
                   Integer required, String defaults, AtomRole role) {}

    /**
     * Returns the bundled table, loading it on first use.
     *
     * @throws IllegalStateException if the resource is missing or inconsistent
     */
    public static SymbolTable bundled() {
        SymbolTable table = bundled;
        if (table == null) {
            synchronized (SymbolTableLoader.class) {
                table = bundled;
                if (table == null) {
                    table = loadResource(DEFAULT_RESOURCE);
                    bundled = table;
                }
            }
        }
        return table;
    }

    /**
     * Loads a table from a classpath resource.
     */
    public static SymbolTable loadResource(String resourcePath) {
        try (InputStream is = SymbolTableLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Atom table resource not found: " + resourcePath);
            }
            SymbolTable table = read(is);
            LoggerUtil.info(String.format("[SymbolTableLoader] Loaded %d atoms from classpath:%s",
                    table.size(), resourcePath));
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read atom table resource: " + resourcePath, e);
        }
    }

    /**
     * Loads a table from a file on disk.
     */
    public static SymbolTable loadFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            SymbolTable table = read(is);
            LoggerUtil.info(String.format("[SymbolTableLoader] Loaded %d atoms from %s", table.size(), path));
            return table;
        }
    }

    /**
     * Parses a table document.
     *
     * @throws IOException if the JSON is malformed
     * @throws IllegalStateException if a row is inconsistent
     */
    public static SymbolTable read(InputStream is) throws IOException {
        ObjectMapper mapper = JacksonConfig.mapper();
        TableDocument doc = mapper.readValue(is, TableDocument.class);
        if (doc.atoms() == null || doc.atoms().isEmpty()) {
            throw new IllegalStateException("Atom table has no atoms");
        }

        Map<String, Map<String, Integer>> enums = new LinkedHashMap<>();
        if (doc.enums() != null) {
            enums.putAll(doc.enums());
        }

        List<AtomDefinition> definitions = new ArrayList<>(doc.atoms().size());
        for (AtomRow row : doc.atoms()) {
            definitions.add(toDefinition(row));
        }
        return SymbolTable.of(definitions, enums);
    }

    private static AtomDefinition toDefinition(AtomRow row) {
        if (row.mnemonic() == null || row.mnemonic().isBlank()) {
            throw new IllegalStateException("Atom table row without mnemonic");
        }
        try {
            List<ArgSpec> specs = new ArrayList<>();
            if (row.args() != null) {
                for (String notation : row.args()) {
                    specs.add(ArgSpec.parse(notation));
                }
            }
            return new AtomDefinition(
                    row.mnemonic(),
                    row.protocol(),
                    row.atom(),
                    specs,
                    row.required() == null ? 0 : row.required(),
                    row.defaults(),
                    row.role() == null ? AtomRole.PLAIN : row.role());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid atom table row for " + row.mnemonic() + ": " + e.getMessage(), e);
        }
    }
}
