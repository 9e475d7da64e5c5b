package net.linkpreview.service.fetch;

import net.linkpreview.util.ApplicationConstants;
import net.linkpreview.util.Utf8Boundaries;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Collects body chunks against a fixed byte budget.
 *
 * <p>Chunks are kept as raw bytes so a character split across two chunks still decodes.
 * The chunk that would cross the budget contributes only its longest well-formed UTF-8
 * prefix; after that the accumulator refuses further input. Not thread-safe: one instance per fetch.</p>
 */
public final class BoundedTextAccumulator {

    private final int maxBytes;
    private byte[] buffer;
    private int size;
    private boolean truncated;
    private boolean closed;

    public BoundedTextAccumulator(int maxBytes) {
        this(maxBytes, ApplicationConstants.Fetch.INITIAL_BUFFER_SIZE);
    }

    public BoundedTextAccumulator(int maxBytes, int initialCapacity) {
        if (maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must not be negative: " + maxBytes);
        }
        this.maxBytes = maxBytes;
        this.buffer = new byte[Math.max(0, Math.min(initialCapacity, maxBytes))];
    }

    /**
     * Offers the next chunk of the body.
     *
     * @param chunk raw bytes as received
     * @return {@code true} when more chunks may be offered, {@code false} once the budget is spent
     */
    public boolean append(byte[] chunk) {
        if (closed) {
            return false;
        }
        if (chunk == null || chunk.length == 0) {
            return true;
        }
        int remaining = maxBytes - size;
        if (chunk.length <= remaining) {
            write(chunk, chunk.length);
            return true;
        }
        truncated = true;
        closed = true;
        if (remaining == 0) {
            return false;
        }
        int chunkStart = size;
        write(chunk, remaining);
        int valid = Utf8Boundaries.validPrefixLength(buffer, size);
        // Bad bytes inside this chunk are cut off; bad bytes from earlier chunks stay for finish() to report
        size = valid >= chunkStart ? valid : Utf8Boundaries.safePrefixLength(buffer, size);
        return false;
    }

    /**
     * Strictly decodes everything accepted so far.
     *
     * @return the accumulated text with its byte count and truncation flag
     * @throws CharacterCodingException if the accepted bytes are not valid UTF-8
     */
    public FetchedText finish() throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text = decoder.decode(ByteBuffer.wrap(buffer, 0, size)).toString();
        return new FetchedText(text, size, truncated);
    }

    private void write(byte[] chunk, int length) {
        int required = size + length;
        if (required > buffer.length) {
            int grown = Math.max(required, Math.min(maxBytes, Math.max(16, buffer.length * 2)));
            buffer = Arrays.copyOf(buffer, grown);
        }
        System.arraycopy(chunk, 0, buffer, size, length);
        size = required;
    }
}
