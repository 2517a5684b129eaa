package com.libragraph.boxes.core.label;

import com.libragraph.boxes.util.ContentHash;

/**
 * Deterministic, order-independent identity of an atom label.
 *
 * <p>Keys are totally ordered: every {@link PrimitiveKey} sorts before every
 * {@link NestedKey}; primitives sort by token, nested keys lexicographically by their
 * sorted entries. Equality never relies on the hash alone.
 */
public sealed interface CanonicalKey extends Comparable<CanonicalKey> permits PrimitiveKey, NestedKey {

    /**
     * Merkle-style content hash; equal keys always have equal hashes.
     */
    ContentHash hash();
}
