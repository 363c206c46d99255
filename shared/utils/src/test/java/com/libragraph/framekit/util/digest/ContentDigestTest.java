package com.libragraph.framekit.util.digest;

import com.libragraph.framekit.types.DigestAlgorithm;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ContentDigestTest {

    private static final String MD5_HEX = "0123456789abcdef0123456789abcdef";

    @Test
    void shouldConstructFromValidBytes() {
        byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xAB;
        bytes[31] = (byte) 0xCD;

        ContentDigest digest = new ContentDigest(DigestAlgorithm.SHA_256, bytes);
        assertThat(digest.bytes()).hasSize(32);
        assertThat(digest.bytes()[0]).isEqualTo((byte) 0xAB);
        assertThat(digest.toHex()).startsWith("ab").endsWith("cd").hasSize(64);
    }

    @Test
    void shouldDefensiveCopyBytes() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0x01;
        ContentDigest digest = new ContentDigest(DigestAlgorithm.MD5, bytes);

        bytes[0] = (byte) 0xFF;
        digest.bytes()[0] = (byte) 0xFF;

        assertThat(digest.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectNullArguments() {
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentDigest(DigestAlgorithm.MD5, null));
        assertThatNullPointerException()
                .isThrownBy(() -> new ContentDigest(null, new byte[16]));
    }

    @Test
    void shouldRejectLengthNotMatchingAlgorithm() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentDigest(DigestAlgorithm.SHA_256, new byte[16]))
                .withMessageContaining("32 bytes");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new ContentDigest(DigestAlgorithm.MD5, new byte[32]))
                .withMessageContaining("16 bytes");
    }

    @Test
    void shouldRoundTripHex() {
        ContentDigest digest = ContentDigest.fromHex(DigestAlgorithm.MD5, MD5_HEX);

        assertThat(digest.toHex()).isEqualTo(MD5_HEX);
        assertThat(digest).hasToString(MD5_HEX);
    }

    @Test
    void shouldRenderUpperCaseInputAsLowerCase() {
        ContentDigest digest = ContentDigest.fromHex(DigestAlgorithm.MD5, MD5_HEX.toUpperCase());

        assertThat(digest.toHex()).isEqualTo(MD5_HEX);
    }

    @Test
    void shouldRejectInvalidHex() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentDigest.fromHex(DigestAlgorithm.SHA_256, MD5_HEX))
                .withMessageContaining("64 characters");
        assertThatIllegalArgumentException()
                .isThrownBy(() -> ContentDigest.fromHex(DigestAlgorithm.MD5, "zz".repeat(16)))
                .withMessageContaining("Invalid hex");
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        ContentDigest a = ContentDigest.fromHex(DigestAlgorithm.MD5, MD5_HEX);
        ContentDigest b = ContentDigest.fromHex(DigestAlgorithm.MD5, MD5_HEX);
        ContentDigest c = ContentDigest.fromHex(DigestAlgorithm.MD5, "fedcba9876543210fedcba9876543210");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
    }
}
