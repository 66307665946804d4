/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.fdo.model.Variant;
import com.atomizer.utils.LoggerUtil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * A directory of golden fixtures.
 *
 * <p>Every {@code <name>.txt} source is paired with its reference binaries:</p>
 * <ul>
 *   <li>{@code <name>.debug.bin}, {@code <name>.production.bin}: tagged explicitly;</li>
 *   <li>{@code <name>.bin}, {@code <name>.str}: variant read from the header, production when
 *       the header is not recognised.</li>
 * </ul>
 * <p>Sources without a binary and binaries without a source are skipped with a warning.
 * An explicit tag wins over an untagged file for the same variant. Sources are read as
 * UTF-8; a source that is not valid UTF-8 is read as ISO-8859-1 instead.</p>
 *
 * @param directory corpus directory
 * @param fixtures  fixtures sorted by name
 * @param skipped   file names that were not paired
 */
public record FixtureCorpus(Path directory, List<GoldenFixture> fixtures, List<String> skipped) {

    private static final String SOURCE_SUFFIX = ".txt";
    private static final String DEBUG_SUFFIX = ".debug.bin";
    private static final String PRODUCTION_SUFFIX = ".production.bin";
    private static final String[] UNTAGGED_SUFFIXES = {".bin", ".str"};

    public FixtureCorpus {
        fixtures = List.copyOf(fixtures);
        skipped = List.copyOf(skipped);
    }

    public int size() {
        return fixtures.size();
    }

    /**
     * Load and pair all fixtures in a directory (not recursive).
     *
     * @throws IOException if the directory or any fixture file cannot be read
     */
    public static FixtureCorpus load(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "fixture directory not found");
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile).sorted().toList();
        }

        Map<String, Path> sources = new TreeMap<>();
        Map<String, Map<Variant, Path>> tagged = new TreeMap<>();
        Map<String, List<Path>> untagged = new TreeMap<>();
        List<String> skipped = new ArrayList<>();

        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (fileName.endsWith(SOURCE_SUFFIX)) {
                sources.put(stem(fileName, SOURCE_SUFFIX), file);
            } else if (fileName.endsWith(DEBUG_SUFFIX)) {
                tagged.computeIfAbsent(stem(fileName, DEBUG_SUFFIX), k -> new EnumMap<>(Variant.class))
                        .put(Variant.DEBUG, file);
            } else if (fileName.endsWith(PRODUCTION_SUFFIX)) {
                tagged.computeIfAbsent(stem(fileName, PRODUCTION_SUFFIX), k -> new EnumMap<>(Variant.class))
                        .put(Variant.PRODUCTION, file);
            } else if (untaggedSuffix(fileName) != null) {
                untagged.computeIfAbsent(stem(fileName, untaggedSuffix(fileName)), k -> new ArrayList<>()).add(file);
            } else {
                LoggerUtil.debug("[FixtureCorpus] Ignoring " + fileName);
            }
        }

        List<GoldenFixture> fixtures = new ArrayList<>();
        for (Map.Entry<String, Path> entry : sources.entrySet()) {
            String name = entry.getKey();
            Map<Variant, byte[]> expected = new EnumMap<>(Variant.class);

            for (Map.Entry<Variant, Path> t : tagged.getOrDefault(name, Map.of()).entrySet()) {
                expected.put(t.getKey(), Files.readAllBytes(t.getValue()));
            }
            for (Path file : untagged.getOrDefault(name, List.of())) {
                byte[] bytes = Files.readAllBytes(file);
                Variant variant = Variant.detect(bytes).orElse(Variant.PRODUCTION);
                if (expected.containsKey(variant)) {
                    LoggerUtil.warn(String.format("[FixtureCorpus] %s: second %s reference %s ignored",
                            name, variant.label(), file.getFileName()));
                    skipped.add(file.getFileName().toString());
                } else {
                    expected.put(variant, bytes);
                }
            }

            if (expected.isEmpty()) {
                LoggerUtil.warn("[FixtureCorpus] No reference binary for " + entry.getValue().getFileName() + ", skipping");
                skipped.add(entry.getValue().getFileName().toString());
                continue;
            }
            String input = readSource(entry.getValue());
            fixtures.add(new GoldenFixture(name, input, expected));
        }

        for (String name : tagged.keySet()) {
            if (!sources.containsKey(name)) {
                tagged.get(name).values().forEach(p -> orphan(p, skipped));
            }
        }
        for (String name : untagged.keySet()) {
            if (!sources.containsKey(name)) {
                untagged.get(name).forEach(p -> orphan(p, skipped));
            }
        }

        LoggerUtil.info(String.format("[FixtureCorpus] Loaded %d fixture(s) from %s (%d file(s) skipped)",
                fixtures.size(), directory, skipped.size()));
        return new FixtureCorpus(directory, fixtures, skipped);
    }

    private static String readSource(Path source) throws IOException {
        byte[] bytes = Files.readAllBytes(source);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            LoggerUtil.warn("[FixtureCorpus] " + source.getFileName() + " is not valid UTF-8, reading as ISO-8859-1");
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static void orphan(Path binary, List<String> skipped) {
        LoggerUtil.warn("[FixtureCorpus] No source text for " + binary.getFileName() + ", skipping");
        skipped.add(binary.getFileName().toString());
    }

    private static String untaggedSuffix(String fileName) {
        for (String suffix : UNTAGGED_SUFFIXES) {
            if (fileName.endsWith(suffix)) {
                return suffix;
            }
        }
        return null;
    }

    private static String stem(String fileName, String suffix) {
        return fileName.substring(0, fileName.length() - suffix.length());
    }
}
