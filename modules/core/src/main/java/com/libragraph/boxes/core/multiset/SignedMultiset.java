package com.libragraph.boxes.core.multiset;

import com.libragraph.boxes.core.label.CanonicalKey;
import com.libragraph.boxes.core.label.KeyEntry;
import com.libragraph.boxes.core.label.NestedKey;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Net signed count per canonical key, pruned of zero entries.
 *
 * <p>Inserting a delta for a key that holds the opposite count removes the entry:
 * that removal is annihilation. Not thread-safe; a box owns its multiset privately and
 * never mutates it after construction.
 */
public final class SignedMultiset {

    private final TreeMap<CanonicalKey, BigInteger> counts = new TreeMap<>();

    public SignedMultiset() {
    }

    public static SignedMultiset of(Iterable<KeyEntry> entries) {
        SignedMultiset m = new SignedMultiset();
        for (KeyEntry e : entries) {
            m.insert(e.key(), e.count());
        }
        return m;
    }

    /**
     * {@code count[key] += delta}; the entry disappears when the result is zero.
     */
    public void insert(CanonicalKey key, BigInteger delta) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(delta, "delta cannot be null");
        if (delta.signum() == 0) return;
        counts.merge(key, delta, (current, d) -> {
            BigInteger sum = current.add(d);
            return sum.signum() == 0 ? null : sum;
        });
    }

    public void merge(SignedMultiset other) {
        Objects.requireNonNull(other, "other cannot be null");
        Map<CanonicalKey, BigInteger> source = other == this ? new TreeMap<>(counts) : other.counts;
        source.forEach(this::insert);
    }

    public void negateAll() {
        counts.replaceAll((key, count) -> count.negate());
    }

    /**
     * Multiplies every count by {@code factor}; a zero factor empties the multiset.
     */
    public void scaleEachLabel(BigInteger factor) {
        Objects.requireNonNull(factor, "factor cannot be null");
        if (factor.signum() == 0) {
            counts.clear();
            return;
        }
        counts.replaceAll((key, count) -> count.multiply(factor));
    }

    /**
     * Lazy view of the entries in ascending key order. Each call to
     * {@link Iterable#iterator()} starts over.
     */
    public Iterable<KeyEntry> iterate() {
        return () -> counts.entrySet().stream()
                .map(e -> new KeyEntry(e.getKey(), e.getValue()))
                .iterator();
    }

    public List<KeyEntry> entries() {
        List<KeyEntry> out = new ArrayList<>(counts.size());
        iterate().forEach(out::add);
        return out;
    }

    public BigInteger count(CanonicalKey key) {
        return counts.getOrDefault(key, BigInteger.ZERO);
    }

    public boolean contains(CanonicalKey key) {
        return counts.containsKey(key);
    }

    public Set<CanonicalKey> keys() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    /**
     * Sum of all counts.
     */
    public BigInteger total() {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger count : counts.values()) {
            total = total.add(count);
        }
        return total;
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    public SignedMultiset copy() {
        SignedMultiset m = new SignedMultiset();
        m.counts.putAll(counts);
        return m;
    }

    /**
     * Snapshot of the current content as a canonical key.
     */
    public NestedKey toKey() {
        return counts.isEmpty() ? NestedKey.EMPTY : new NestedKey(entries());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SignedMultiset other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
