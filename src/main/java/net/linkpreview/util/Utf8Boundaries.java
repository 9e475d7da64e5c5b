package net.linkpreview.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Byte-level helpers for cutting UTF-8 data without splitting a character.
 */
public final class Utf8Boundaries {

    private static final int MAX_CONTINUATION_BYTES = 3;

    private Utf8Boundaries() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Returns the largest {@code n <= length} such that {@code bytes[0, n)} does not end
     * inside an incomplete multi-byte sequence.
     *
     * <p>Only the tail is inspected: a trailing lead byte whose continuation bytes were cut
     * off is dropped together with them. Bytes that are invalid UTF-8 on their own are left
     * in place so strict decoding can still report them.</p>
     *
     * @param bytes buffer holding UTF-8 data
     * @param length number of leading bytes of {@code bytes} to consider
     * @return length of the boundary-safe prefix
     */
    public static int safePrefixLength(byte[] bytes, int length) {
        if (bytes == null || length <= 0) {
            return 0;
        }
        int end = Math.min(length, bytes.length);
        int lead = end - 1;
        int continuation = 0;
        while (lead >= 0 && continuation < MAX_CONTINUATION_BYTES && isContinuation(bytes[lead])) {
            lead--;
            continuation++;
        }
        if (lead < 0) {
            return end;
        }
        int expected = sequenceLength(bytes[lead]);
        if (expected > 1 && lead + expected > end) {
            return lead;
        }
        return end;
    }

    /**
     * Returns the number of leading bytes that decode as well-formed UTF-8, stopping at the
     * first malformed or incomplete sequence.
     *
     * @param bytes buffer holding UTF-8 data
     * @param length number of leading bytes of {@code bytes} to consider
     * @return length of the longest valid prefix
     */
    public static int validPrefixLength(byte[] bytes, int length) {
        if (bytes == null || length <= 0) {
            return 0;
        }
        int end = Math.min(length, bytes.length);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, end);
        // UTF-8 never yields more chars than bytes
        decoder.decode(in, CharBuffer.allocate(end), true);
        return in.position();
    }

    static boolean isContinuation(byte b) {
        return (b & 0xC0) == 0x80;
    }

    /**
     * @return encoded length announced by a lead byte, or 1 for ASCII and invalid lead bytes
     */
    static int sequenceLength(byte lead) {
        if ((lead & 0x80) == 0) {
            return 1;
        }
        if ((lead & 0xE0) == 0xC0) {
            return 2;
        }
        if ((lead & 0xF0) == 0xE0) {
            return 3;
        }
        if ((lead & 0xF8) == 0xF0) {
            return 4;
        }
        return 1;
    }
}
