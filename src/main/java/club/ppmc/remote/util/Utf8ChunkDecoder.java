/**
 * Utf8ChunkDecoder.java
 *
 * 将按字节切分的输出流增量解码为文本。
 * 一个多字节字符可能被拆分到两个数据块中，未完成的字节会保留到下一次调用。
 */
package club.ppmc.remote.util;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public class Utf8ChunkDecoder {

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private byte[] pending = new byte[0];

    public String decode(byte[] chunk) {
        byte[] input = new byte[pending.length + chunk.length];
        System.arraycopy(pending, 0, input, 0, pending.length);
        System.arraycopy(chunk, 0, input, pending.length, chunk.length);

        ByteBuffer in = ByteBuffer.wrap(input);
        CharBuffer out = CharBuffer.allocate(input.length);
        decoder.decode(in, out, false);
        pending = new byte[in.remaining()];
        in.get(pending);
        out.flip();
        return out.toString();
    }

    /** 流结束时调用，输出残留的不完整字节（以替换字符表示）。 */
    public String flush() {
        if (pending.length == 0) {
            return "";
        }
        ByteBuffer in = ByteBuffer.wrap(pending);
        CharBuffer out = CharBuffer.allocate(pending.length * 2);
        decoder.decode(in, out, true);
        decoder.flush(out);
        decoder.reset();
        pending = new byte[0];
        out.flip();
        return out.toString();
    }
}
