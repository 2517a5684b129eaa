package com.libragraph.boxes.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A BLAKE3-128 content hash (16 bytes) identifying a canonical structure.
 * Immutable value object that can be used as a map key and sorted.
 *
 * <p>Equal hashes are a strong hint, not a proof, that two structures are equal;
 * callers that need certainty compare the structures as well.
 */
public record ContentHash(byte[] bytes) implements Comparable<ContentHash> {
    public static final int HASH_LENGTH = 16; // 128 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 16 bytes (BLAKE3-128), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes a raw byte sequence.
     */
    public static ContentHash of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return ContentHasher.create().putBytes(data).finish();
    }

    /**
     * Creates ContentHash from hex string (32 characters).
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException(
                "BLAKE3-128 hex string must be 32 characters, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    /**
     * First eight hex characters, for log lines.
     */
    public String shortHex() {
        return toHex().substring(0, 8);
    }

    @Override
    public int compareTo(ContentHash other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
