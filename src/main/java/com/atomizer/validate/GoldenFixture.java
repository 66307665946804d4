/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.validate;

import com.atomizer.fdo.model.Variant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A source text paired with the reference binaries it must compile to.
 *
 * @param name      fixture name, the shared file stem
 * @param inputText atom stream source
 * @param expected  reference bytes (header included) per variant; at least one entry
 */
public record GoldenFixture(String name, String inputText, Map<Variant, byte[]> expected) {

    public GoldenFixture {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(inputText, "inputText");
        if (expected == null || expected.isEmpty()) {
            throw new IllegalArgumentException("Fixture " + name + " has no expected binary");
        }
        EnumMap<Variant, byte[]> copy = new EnumMap<>(Variant.class);
        expected.forEach((variant, bytes) -> copy.put(variant, bytes.clone()));
        expected = Collections.unmodifiableMap(copy);
    }

    public Optional<byte[]> expected(Variant variant) {
        byte[] bytes = expected.get(variant);
        return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
    }
}
