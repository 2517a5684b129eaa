package com.libragraph.boxes.core.label;

import com.libragraph.boxes.util.ContentHash;
import com.libragraph.boxes.util.ContentHasher;

import java.util.Objects;

/**
 * Key of a primitive label: the token itself. Equality and order use the token only; the
 * content hash is computed on first use, when a nested key is hashed over it.
 */
public final class PrimitiveKey implements CanonicalKey {

    private static final byte TAG = 'P';

    private final String token;
    private volatile ContentHash hash;

    public PrimitiveKey(String token) {
        this.token = Objects.requireNonNull(token, "token cannot be null");
    }

    public String token() {
        return token;
    }

    @Override
    public ContentHash hash() {
        ContentHash h = hash;
        if (h == null) {
            // Racing threads compute the same digest
            h = ContentHasher.create().putTag(TAG).putString(token).finish();
            hash = h;
        }
        return h;
    }

    @Override
    public int compareTo(CanonicalKey other) {
        if (!(other instanceof PrimitiveKey p)) return -1;
        return token.compareTo(p.token);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PrimitiveKey other)) return false;
        return token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return token;
    }
}
