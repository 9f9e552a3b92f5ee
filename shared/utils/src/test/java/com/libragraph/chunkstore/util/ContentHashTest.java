package com.libragraph.chunkstore.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    private static final String HEX_A = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";
    private static final String HEX_B = "fedcba9876543210fedcba9876543210fedcba9876543210fedcba9876543210";

    @Test
    void shouldConstructFromValidBytes() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xAB;
        bytes[31] = (byte) 0xCD;

        ContentHash hash = new ContentHash(bytes);
        assertThat(hash.bytes()).hasSize(32);
        assertThat(hash.bytes()[31]).isEqualTo((byte) 0xCD);
    }

    @Test
    void shouldCopyBytesOnConstruction() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0x01;
        ContentHash hash = new ContentHash(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(hash.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectNullBytes() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentHash(null));
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentHash(new byte[16]))
                .withMessageContaining("32 bytes");
    }

    @Test
    void shouldRoundTripHex() {
        assertThat(ContentHash.fromHex(HEX_A).toHex()).isEqualTo(HEX_A);
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("abcd"))
                .withMessageContaining("64 characters");
    }

    @Test
    void shouldRejectInvalidHexCharacters() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentHash.fromHex("z".repeat(64)));
    }

    @Test
    void isHexAcceptsOnlyLowercaseDigests() {
        assertThat(ContentHash.isHex(HEX_A)).isTrue();
        assertThat(ContentHash.isHex(HEX_A.toUpperCase())).isFalse();
        assertThat(ContentHash.isHex("abcd")).isFalse();
        assertThat(ContentHash.isHex(null)).isFalse();
    }

    @Test
    void ofComputesBlake3Digest() {
        // Reference vector: BLAKE3 of the empty input
        assertThat(ContentHash.of(new byte[0]).toHex())
                .isEqualTo("af1349b9f5f9a1a6a0404dea36dcc9499bcb25c9adc112b7cc9a93cae41f3262");
    }

    @Test
    void matchesOnlyTheHashedContent() {
        byte[] content = "chunk payload".getBytes(StandardCharsets.UTF_8);
        ContentHash hash = ContentHash.of(content);

        assertThat(hash.matches(content)).isTrue();
        assertThat(hash.matches("other payload".getBytes(StandardCharsets.UTF_8))).isFalse();
    }

    @Test
    void compareToFollowsHexOrder() {
        List<ContentHash> hashes = new ArrayList<>(List.of(
                ContentHash.fromHex(HEX_B),
                ContentHash.fromHex(HEX_A),
                ContentHash.fromHex("8" + "0".repeat(63))));
        hashes.sort(null);

        assertThat(hashes).extracting(ContentHash::toHex)
                .isSorted()
                .first().isEqualTo(HEX_A);
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.fromHex(HEX_A);
        ContentHash b = ContentHash.fromHex(HEX_A);
        ContentHash c = ContentHash.fromHex(HEX_B);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }

    @Test
    void shouldReturnHexFromToString() {
        assertThat(ContentHash.fromHex(HEX_A).toString()).isEqualTo(HEX_A);
    }
}
