/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of one compilation: the two header bytes identifying the variant, and the body.
 */
public record EncodedStream(Variant variant, byte[] header, byte[] body) {

    public EncodedStream {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(body, "body");
        if (header == null || header.length != 2) {
            throw new IllegalArgumentException("Header must be exactly 2 bytes");
        }
        if (!Arrays.equals(header, variant.header())) {
            throw new IllegalArgumentException("Header does not identify variant " + variant);
        }
        header = header.clone();
        body = body.clone();
    }

    public static EncodedStream of(Variant variant, byte[] body) {
        return new EncodedStream(variant, variant.header(), body);
    }

    @Override
    public byte[] header() {
        return header.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /** Header followed by body. */
    public byte[] toByteArray() {
        byte[] out = new byte[header.length + body.length];
        System.arraycopy(header, 0, out, 0, header.length);
        System.arraycopy(body, 0, out, header.length, body.length);
        return out;
    }

    public int length() {
        return header.length + body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodedStream other)) return false;
        return variant == other.variant
                && Arrays.equals(header, other.header)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * variant.hashCode() + Arrays.hashCode(header)) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return String.format("EncodedStream[%s, %d bytes]", variant, length());
    }
}
