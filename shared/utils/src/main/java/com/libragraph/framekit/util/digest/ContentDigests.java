package com.libragraph.framekit.util.digest;

import com.libragraph.framekit.types.DigestAlgorithm;
import com.libragraph.framekit.util.config.FramekitSettings;
import org.apache.commons.codec.digest.DigestUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * SHA-256 and MD5 digests over channels and text.
 *
 * <p>Channel digests rewind the channel to position 0, read it to the end and
 * rewind it again before returning, so the channel must be a
 * {@link SeekableByteChannel}. Anything else fails with
 * {@link NonSeekableStreamException}.
 *
 * <p>Text is digested as UTF-8 without a byte-order mark. Unpaired surrogates
 * are encoded as U+FFFD ({@code EF BF BD}), never as {@code '?'}.
 *
 * <p>Each call builds its own {@link MessageDigest}; nothing is shared between calls.
 */
public final class ContentDigests {

    private static final Logger log = Logger.getLogger(ContentDigests.class);

    private static final byte[] REPLACEMENT_CHARACTER = {(byte) 0xEF, (byte) 0xBF, (byte) 0xBD};

    private ContentDigests() {
    }

    public static ContentDigest sha256(ReadableByteChannel channel) throws IOException {
        return digest(channel, DigestAlgorithm.SHA_256);
    }

    /**
     * SHA-256 of the whole channel as 64 lowercase hex characters.
     */
    public static String sha256Hex(ReadableByteChannel channel) throws IOException {
        return sha256(channel).toHex();
    }

    public static ContentDigest md5(ReadableByteChannel channel) throws IOException {
        return digest(channel, DigestAlgorithm.MD5);
    }

    /**
     * MD5 of the whole channel as 32 lowercase hex characters.
     */
    public static String md5Hex(ReadableByteChannel channel) throws IOException {
        return md5(channel).toHex();
    }

    public static ContentDigest sha256(String text) {
        return digest(text, DigestAlgorithm.SHA_256);
    }

    public static String sha256Hex(String text) {
        return sha256(text).toHex();
    }

    public static ContentDigest md5(String text) {
        return digest(text, DigestAlgorithm.MD5);
    }

    public static String md5Hex(String text) {
        return md5(text).toHex();
    }

    private static ContentDigest digest(String text, DigestAlgorithm algorithm) {
        Objects.requireNonNull(text, "text cannot be null");
        MessageDigest md = DigestUtils.getDigest(algorithm.jcaName());
        md.update(encodeUtf8(text));
        return new ContentDigest(algorithm, md.digest());
    }

    static ByteBuffer encodeUtf8(String text) {
        CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .replaceWith(REPLACEMENT_CHARACTER);
        try {
            return encoder.encode(CharBuffer.wrap(text));
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE on both error kinds
            throw new UncheckedIOException("Failed to encode text as UTF-8", e);
        }
    }

    private static ContentDigest digest(ReadableByteChannel channel, DigestAlgorithm algorithm)
            throws IOException {
        Objects.requireNonNull(channel, "channel cannot be null");
        if (!(channel instanceof SeekableByteChannel seekable)) {
            throw new NonSeekableStreamException(
                "Cannot rewind " + channel.getClass().getName() + " for " + algorithm.label() + " digest"
            );
        }

        rewind(seekable);

        MessageDigest md = DigestUtils.getDigest(algorithm.jcaName());
        ByteBuffer buffer = ByteBuffer.allocate(FramekitSettings.readChunkBytes());
        long total = 0;

        while (seekable.read(buffer) != -1) {
            buffer.flip();
            total += buffer.remaining();
            md.update(buffer);
            buffer.clear();
        }

        rewind(seekable);

        log.debugf("Computed %s digest over %d bytes", algorithm.label(), total);
        return new ContentDigest(algorithm, md.digest());
    }

    private static void rewind(SeekableByteChannel channel) throws IOException {
        try {
            channel.position(0);
        } catch (UnsupportedOperationException e) {
            throw new NonSeekableStreamException(
                "Channel does not support repositioning: " + channel.getClass().getName(), e
            );
        }
    }
}
