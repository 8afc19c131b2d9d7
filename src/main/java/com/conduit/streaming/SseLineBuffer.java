package com.conduit.streaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles arbitrarily split text fragments into complete lines. A trailing partial
 * line stays buffered until the fragment that completes it arrives.
 */
public class SseLineBuffer {

    private final StringBuilder buffer = new StringBuilder();

    /**
     * Append a fragment and return every line it completed, without line terminators.
     */
    public List<String> append(String fragment) {
        buffer.append(fragment);
        List<String> lines = new ArrayList<>();
        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            lines.add(stripCarriageReturn(buffer.substring(0, newline)));
            buffer.delete(0, newline + 1);
        }
        return lines;
    }

    /**
     * Return the unterminated remainder at end of stream, if any.
     */
    public List<String> drain() {
        if (buffer.length() == 0) {
            return List.of();
        }
        String rest = stripCarriageReturn(buffer.toString());
        buffer.setLength(0);
        return List.of(rest);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
