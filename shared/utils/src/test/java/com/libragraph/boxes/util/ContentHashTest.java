package com.libragraph.boxes.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    @Test
    void shouldConstructFromValidBytes() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0xAB;
        bytes[15] = (byte) 0xCD;

        ContentHash hash = new ContentHash(bytes);
        assertThat(hash.bytes()).hasSize(16);
        assertThat(hash.bytes()[15]).isEqualTo((byte) 0xCD);
    }

    @Test
    void shouldNotExposeInternalArray() {
        ContentHash hash = ContentHash.fromHex("0123456789abcdef0123456789abcdef");

        hash.bytes()[0] = (byte) 0xFF;
        assertThat(hash.toHex()).startsWith("01");
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[32]))
                .withMessageContaining("16 bytes");
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentHash(null));
    }

    @Test
    void shouldRoundTripHex() {
        String hex = "fedcba9876543210fedcba9876543210";
        assertThat(ContentHash.fromHex(hex).toHex()).isEqualTo(hex);
        assertThat(ContentHash.fromHex(hex).shortHex()).isEqualTo("fedcba98");
    }

    @Test
    void shouldRejectBadHex() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("abcd"))
                .withMessageContaining("32 characters");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("zzzzzzzzzzzzzzzzzzzzzzzzzzzzzzzz"));
    }

    @Test
    void shouldHashDeterministically() {
        byte[] data = "unit".getBytes(StandardCharsets.UTF_8);

        assertThat(ContentHash.of(data)).isEqualTo(ContentHash.of(data.clone()));
        assertThat(ContentHash.of(data)).isNotEqualTo(ContentHash.of(new byte[0]));
    }

    @Test
    void shouldOrderAsUnsignedBytes() {
        ContentHash low = ContentHash.fromHex("7f000000000000000000000000000000");
        ContentHash high = ContentHash.fromHex("80000000000000000000000000000000");

        assertThat(low).isLessThan(high);
        assertThat(high.compareTo(low)).isPositive();
        assertThat(low.compareTo(ContentHash.fromHex(low.toHex()))).isZero();
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.fromHex("0123456789abcdef0123456789abcdef");
        ContentHash b = ContentHash.fromHex("0123456789abcdef0123456789abcdef");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.toString()).isEqualTo(a.toHex());
    }
}
