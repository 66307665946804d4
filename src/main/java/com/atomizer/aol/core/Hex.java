/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.aol.core;

/**
 * Hex utilities (uppercase output).
 */
public final class Hex {

    private static final char[] UPPER_HEX = "0123456789ABCDEF".toCharArray();

    private Hex() {}

    /**
     * Renders {@code b[from, to)} as space separated byte pairs, e.g. {@code "40 01 21"}.
     * Bounds are clamped to the array.
     */
    public static String spaced(byte[] b, int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(b.length, to);
        StringBuilder sb = new StringBuilder(Math.max(0, end - start) * 3);
        for (int i = start; i < end; i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            int v = b[i] & 0xff;
            sb.append(UPPER_HEX[v >>> 4]).append(UPPER_HEX[v & 0xf]);
        }
        return sb.toString();
    }

    public static String spaced(byte[] b) {
        return spaced(b, 0, b.length);
    }

    /**
     * Parses a hex string to bytes. Robust to spaces and colons.
     * Throws IllegalArgumentException for invalid input.
     */
    public static byte[] hexToBytes(String s) {
        if (s == null || s.isEmpty()) {
            return new byte[0];
        }
        String cleaned = s.replaceAll("[\\s:]+", "");
        if (cleaned.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have even length: " + s);
        }
        int n = cleaned.length() / 2;
        byte[] out = new byte[n];
        for (int i = 0; i < n; i++) {
            int hi = Character.digit(cleaned.charAt(i * 2), 16);
            int lo = Character.digit(cleaned.charAt(i * 2 + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex at index " + (i * 2) + ": '" + s + "'");
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
