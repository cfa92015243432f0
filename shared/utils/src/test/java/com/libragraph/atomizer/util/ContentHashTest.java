package com.libragraph.atomizer.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ContentHashTest {

    // SHA-256("abc")
    private static final String ABC_HEX = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void shouldHashKnownVector() {
        ContentHash hash = ContentHash.of("abc".getBytes(StandardCharsets.UTF_8));

        assertThat(hash.toHex()).isEqualTo(ABC_HEX);
        assertThat(hash.bytes()).hasSize(32);
    }

    @Test
    void shouldBeDeterministic() {
        byte[] data = "same bytes, same hash".getBytes(StandardCharsets.UTF_8);

        assertThat(ContentHash.of(data)).isEqualTo(ContentHash.of(data.clone()));
    }

    @Test
    void shouldHashSliceLikeCopy() {
        byte[] data = "xxabcxx".getBytes(StandardCharsets.UTF_8);

        assertThat(ContentHash.of(data, 2, 3).toHex()).isEqualTo(ABC_HEX);
    }

    @Test
    void shouldSeparateTaggedHashFromPlainHash() throws Exception {
        byte[] data = "abc".getBytes(StandardCharsets.UTF_8);

        ContentHash tagged = ContentHash.ofTagged("file-metadata:", new ByteArrayInputStream(data));

        assertThat(tagged).isNotEqualTo(ContentHash.of(data));
        assertThat(tagged).isEqualTo(ContentHash.ofUtf8("file-metadata:abc"));
    }

    @Test
    void shouldDefensiveCopyOnConstruction() {
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
        ContentHash hash = ContentHash.fromHex(ABC_HEX);

        assertThat(hash.toHex()).isEqualTo(ABC_HEX);
        assertThat(hash.toString()).isEqualTo(ABC_HEX);
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
    void shouldImplementEqualsAndHashCode() {
        ContentHash a = ContentHash.fromHex(ABC_HEX);
        ContentHash b = ContentHash.fromHex(ABC_HEX);
        ContentHash c = ContentHash.ofUtf8("abd");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }
}
