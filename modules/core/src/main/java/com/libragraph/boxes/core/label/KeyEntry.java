package com.libragraph.boxes.core.label;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One netted {@code (key, count)} pair of a signed multiset. The count is never zero.
 */
public record KeyEntry(CanonicalKey key, BigInteger count) implements Comparable<KeyEntry> {

    public KeyEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(count, "count cannot be null");
        if (count.signum() == 0) {
            throw new IllegalArgumentException("KeyEntry count must be nonzero for key " + key);
        }
    }

    @Override
    public int compareTo(KeyEntry other) {
        int c = key.compareTo(other.key);
        return c != 0 ? c : count.compareTo(other.count);
    }
}
