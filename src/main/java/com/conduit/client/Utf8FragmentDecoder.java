package com.conduit.client;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Stateful UTF-8 decoder for network fragments. A multi-byte character split across two
 * fragments is held back until the rest of its bytes arrive.
 */
public class Utf8FragmentDecoder {

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private byte[] pending = new byte[0];

    public synchronized String decode(byte[] fragment) {
        byte[] input = new byte[pending.length + fragment.length];
        System.arraycopy(pending, 0, input, 0, pending.length);
        System.arraycopy(fragment, 0, input, pending.length, fragment.length);

        ByteBuffer in = ByteBuffer.wrap(input);
        CharBuffer out = CharBuffer.allocate(input.length + 1);
        decoder.decode(in, out, false);
        out.flip();

        pending = new byte[in.remaining()];
        in.get(pending);
        return out.toString();
    }

    /**
     * Decode whatever is still held back at end of stream.
     */
    public synchronized String flush() {
        if (pending.length == 0) {
            return "";
        }
        ByteBuffer in = ByteBuffer.wrap(pending);
        CharBuffer out = CharBuffer.allocate(pending.length + 1);
        decoder.decode(in, out, true);
        decoder.flush(out);
        decoder.reset();
        out.flip();
        pending = new byte[0];
        return out.toString();
    }
}
