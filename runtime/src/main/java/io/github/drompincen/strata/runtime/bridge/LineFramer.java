package io.github.drompincen.strata.runtime.bridge;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a byte stream into newline-terminated lines. Splitting happens before decoding,
 * so a multi-byte character spread over two reads is reassembled. Lines are trimmed and
 * empty lines are skipped; an unterminated tail waits for the next chunk.
 */
public class LineFramer {

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    public List<String> feed(byte[] chunk, int offset, int length) {
        List<String> lines = new ArrayList<>();
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (chunk[i] == '\n') {
                pending.write(chunk, start, i - start);
                emit(lines);
                start = i + 1;
            }
        }
        pending.write(chunk, start, end - start);
        return lines;
    }

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /** Bytes received after the last newline. */
    public int pendingBytes() {
        return pending.size();
    }

    private void emit(List<String> lines) {
        String line = pending.toString(StandardCharsets.UTF_8).strip();
        pending.reset();
        if (!line.isEmpty()) lines.add(line);
    }
}
