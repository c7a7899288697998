package club.ppmc.remote.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class Utf8ChunkDecoderTest {

    @Test
    void joinsCharacterSplitAcrossChunks() {
        byte[] bytes = "终端".getBytes(StandardCharsets.UTF_8);
        var decoder = new Utf8ChunkDecoder();

        String first = decoder.decode(Arrays.copyOfRange(bytes, 0, 2));
        String second = decoder.decode(Arrays.copyOfRange(bytes, 2, bytes.length));

        assertThat(first).isEmpty();
        assertThat(second).isEqualTo("终端");
        assertThat(decoder.flush()).isEmpty();
    }

    @Test
    void flushReplacesIncompleteTrailingBytes() {
        byte[] bytes = "é".getBytes(StandardCharsets.UTF_8);
        var decoder = new Utf8ChunkDecoder();

        assertThat(decoder.decode(new byte[] {'a', bytes[0]})).isEqualTo("a");
        assertThat(decoder.flush()).isEqualTo("�");
    }
}
