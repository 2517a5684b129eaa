/**
 * Shared content-addressing utilities for all Boxes modules.
 *
 * <p>Contains {@link com.libragraph.boxes.util.ContentHash} (BLAKE3-128) and
 * {@link com.libragraph.boxes.util.ContentHasher}, the typed incremental digest used to
 * derive Merkle-style hashes for nested structures. No framework dependencies.
 */
package com.libragraph.boxes.util;
