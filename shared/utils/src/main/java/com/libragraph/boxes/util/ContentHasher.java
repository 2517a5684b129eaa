package com.libragraph.boxes.util;

import org.apache.commons.codec.digest.Blake3;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Incremental BLAKE3 digest over typed fields.
 *
 * <p>Every variable-length field is length-prefixed, so two different field
 * sequences never feed the digest the same bytes. A hasher produces exactly one
 * {@link ContentHash}; it cannot be reused after {@link #finish()}.
 */
public final class ContentHasher {

    private final Blake3 digest = Blake3.initHash();
    private boolean finished = false;

    private ContentHasher() {
    }

    public static ContentHasher create() {
        return new ContentHasher();
    }

    /**
     * Single-byte discriminator separating kinds of hashed structures.
     */
    public ContentHasher putTag(byte tag) {
        return update(new byte[]{tag});
    }

    public ContentHasher putInt(int value) {
        return update(ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
    }

    public ContentHasher putBytes(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        putInt(data.length);
        return update(data);
    }

    public ContentHasher putString(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return putBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Two's-complement encoding, length-prefixed.
     */
    public ContentHasher putBigInteger(BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        return putBytes(value.toByteArray());
    }

    /**
     * Feeds a child hash; fixed width, so no length prefix.
     */
    public ContentHasher putHash(ContentHash hash) {
        Objects.requireNonNull(hash, "hash cannot be null");
        return update(hash.bytes());
    }

    public ContentHash finish() {
        checkOpen();
        finished = true;
        return new ContentHash(digest.doFinalize(ContentHash.HASH_LENGTH));
    }

    private ContentHasher update(byte[] bytes) {
        checkOpen();
        digest.update(bytes);
        return this;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("ContentHasher already finished");
        }
    }
}
