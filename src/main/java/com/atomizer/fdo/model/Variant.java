/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.model;

import java.util.Optional;

/**
 * Binary layout of an encoded stream. The two header bytes identify the layout.
 */
public enum Variant {
    /** Verbose layout: fixed-width code, explicit 16-bit length, nothing omitted. */
    DEBUG(0x00, 0x01),
    /** Compact layout produced by a production encoding strategy. */
    PRODUCTION(0x40, 0x01);

    private final int header0;
    private final int header1;

    Variant(int header0, int header1) {
        this.header0 = header0;
        this.header1 = header1;
    }

    public byte[] header() {
        return new byte[]{(byte) header0, (byte) header1};
    }

    /**
     * Detects the variant from the first two bytes of a stream.
     *
     * @return the variant, or empty if the stream is shorter than two bytes or the
     *         header is not one of the known prefixes
     */
    public static Optional<Variant> detect(byte[] data) {
        if (data == null || data.length < 2) {
            return Optional.empty();
        }
        for (Variant v : values()) {
            if ((data[0] & 0xFF) == v.header0 && (data[1] & 0xFF) == v.header1) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a CLI or configuration value ({@code debug}, {@code production}), case-insensitive.
     */
    public static Variant parse(String value) {
        return switch (value.trim().toLowerCase()) {
            case "debug", "raw" -> DEBUG;
            case "production", "compact" -> PRODUCTION;
            default -> throw new IllegalArgumentException(
                    String.format("Unknown variant: '%s'. Valid options: 'debug', 'production'", value));
        };
    }

    public String label() {
        return name().toLowerCase();
    }
}
