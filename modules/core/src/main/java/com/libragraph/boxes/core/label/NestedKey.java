package com.libragraph.boxes.core.label;

import com.libragraph.boxes.util.ContentHash;
import com.libragraph.boxes.util.ContentHasher;

import java.util.List;
import java.util.Objects;

/**
 * Key of a nested label, and the identity of every box: the box's netted entries in
 * ascending key order.
 *
 * <p>The content hash is derived from the children's hashes, so computing it never
 * re-walks the nested structure. Equality checks the hash first and then compares the
 * entries in full, so a hash collision cannot merge two different boxes.
 */
public final class NestedKey implements CanonicalKey {

    private static final byte TAG = 'N';

    public static final NestedKey EMPTY = new NestedKey(List.of());

    private final List<KeyEntry> entries;
    private final ContentHash hash;
    private final int hashCode;

    /**
     * @param entries strictly ascending by key, counts nonzero
     * @throws IllegalArgumentException if the entries are not in canonical order
     */
    public NestedKey(List<KeyEntry> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        this.entries = List.copyOf(entries);

        ContentHasher hasher = ContentHasher.create().putTag(TAG).putInt(this.entries.size());
        CanonicalKey previous = null;
        for (KeyEntry entry : this.entries) {
            if (previous != null && previous.compareTo(entry.key()) >= 0) {
                throw new IllegalArgumentException(
                        "Entries not in strictly ascending key order at " + entry.key());
            }
            hasher.putHash(entry.key().hash()).putBigInteger(entry.count());
            previous = entry.key();
        }
        this.hash = hasher.finish();
        this.hashCode = hash.hashCode();
    }

    public List<KeyEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public ContentHash hash() {
        return hash;
    }

    @Override
    public int compareTo(CanonicalKey other) {
        if (!(other instanceof NestedKey n)) return 1;
        if (this == n) return 0;
        int common = Math.min(entries.size(), n.entries.size());
        for (int i = 0; i < common; i++) {
            int c = entries.get(i).compareTo(n.entries.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(entries.size(), n.entries.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NestedKey other)) return false;
        if (hashCode != other.hashCode || !hash.equals(other.hash)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "NestedKey[" + hash.shortHex() + ", " + entries.size() + " entries]";
    }
}
