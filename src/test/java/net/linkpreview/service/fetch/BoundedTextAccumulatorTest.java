package net.linkpreview.service.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedTextAccumulatorTest {

    @Test
    @DisplayName("The chunk crossing the budget contributes only the bytes that fit")
    void append_takesFittingPrefixOfCrossingChunk() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(12);

        assertThat(accumulator.append(utf8("<p>héllo"))).isTrue();
        assertThat(accumulator.append(utf8("</p>"))).isFalse();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("<p>héllo</p");
        assertThat(fetched.bytesRead()).isEqualTo(12);
        assertThat(fetched.truncated()).isTrue();
    }

    @Test
    @DisplayName("Bodies under the budget are returned byte-for-byte")
    void append_keepsWholeBodyWithinBudget() throws CharacterCodingException {
        String body = "<html><title>Ünïcödé</title></html>";
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(1024);

        assertThat(accumulator.append(utf8(body))).isTrue();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo(body);
        assertThat(fetched.bytesRead()).isEqualTo(utf8(body).length);
        assertThat(fetched.truncated()).isFalse();
    }

    @Test
    @DisplayName("A body exactly the size of the budget is not marked truncated until more data arrives")
    void append_exactBudgetIsComplete() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(8);

        assertThat(accumulator.append(utf8("abcd"))).isTrue();
        assertThat(accumulator.append(utf8("efgh"))).isTrue();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("abcdefgh");
        assertThat(fetched.bytesRead()).isEqualTo(8);
        assertThat(fetched.truncated()).isFalse();
    }

    @Test
    @DisplayName("Zero remaining budget stops without taking anything from the next chunk")
    void append_stopsWhenBudgetAlreadySpent() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(4);
        accumulator.append(utf8("abcd"));

        assertThat(accumulator.append(utf8("e"))).isFalse();
        assertThat(accumulator.append(utf8("f"))).isFalse();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("abcd");
        assertThat(fetched.truncated()).isTrue();
    }

    @Test
    @DisplayName("Truncation never splits a multi-byte character")
    void append_truncatesOnCharacterBoundary() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(7);

        assertThat(accumulator.append(utf8("ab€€"))).isFalse(); // 2 + 3 + 3 bytes

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("ab€");
        assertThat(fetched.bytesRead()).isEqualTo(5);
        assertThat(fetched.text().getBytes(StandardCharsets.UTF_8).length).isLessThanOrEqualTo(7);
    }

    @Test
    @DisplayName("A character split across two chunks decodes correctly")
    void append_joinsCharacterSplitAcrossChunks() throws CharacterCodingException {
        byte[] euro = utf8("€");
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(64);

        accumulator.append(concat(utf8("price "), Arrays.copyOfRange(euro, 0, 1)));
        accumulator.append(Arrays.copyOfRange(euro, 1, 3));

        assertThat(accumulator.finish().text()).isEqualTo("price €");
    }

    @Test
    @DisplayName("Truncation inside a character that started in an earlier chunk drops the whole character")
    void append_dropsCharacterStartedInEarlierChunk() throws CharacterCodingException {
        byte[] euro = utf8("€");
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(5);

        accumulator.append(concat(utf8("abc"), Arrays.copyOfRange(euro, 0, 1)));
        assertThat(accumulator.append(concat(Arrays.copyOfRange(euro, 1, 3), utf8("zz")))).isFalse();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("abc");
        assertThat(fetched.bytesRead()).isEqualTo(3);
    }

    @Test
    @DisplayName("Bytes that are not UTF-8 are reported rather than replaced")
    void finish_rejectsInvalidUtf8() {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(16);
        accumulator.append(new byte[] {(byte) 0xFF, (byte) 0xFE, 0x3C});

        assertThatThrownBy(accumulator::finish).isInstanceOf(CharacterCodingException.class);
    }

    @Test
    @DisplayName("An invalid byte in the chunk crossing the budget ends the text there")
    void append_cutsCrossingChunkAtInvalidByte() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(4);

        assertThat(accumulator.append(new byte[] {'a', 'b', (byte) 0xFF, 'c', 'd'})).isFalse();

        FetchedText fetched = accumulator.finish();
        assertThat(fetched.text()).isEqualTo("ab");
        assertThat(fetched.bytesRead()).isEqualTo(2);
        assertThat(fetched.truncated()).isTrue();
    }

    @Test
    @DisplayName("An invalid byte from an earlier full chunk is still reported after truncation")
    void finish_rejectsInvalidByteBeforeCrossingChunk() {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(6);

        assertThat(accumulator.append(new byte[] {'a', (byte) 0xFF, 'b'})).isTrue();
        assertThat(accumulator.append(utf8("cdefgh"))).isFalse();

        assertThatThrownBy(accumulator::finish).isInstanceOf(CharacterCodingException.class);
    }

    @Test
    @DisplayName("Empty chunks are ignored")
    void append_ignoresEmptyChunks() throws CharacterCodingException {
        BoundedTextAccumulator accumulator = new BoundedTextAccumulator(4);

        assertThat(accumulator.append(new byte[0])).isTrue();
        assertThat(accumulator.finish().text()).isEmpty();
    }

    @Test
    @DisplayName("Negative budgets are rejected")
    void constructor_rejectsNegativeBudget() {
        assertThatThrownBy(() -> new BoundedTextAccumulator(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] joined = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, joined, first.length, second.length);
        return joined;
    }
}
