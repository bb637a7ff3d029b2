package com.marketpipe.core.wire;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Incremental frame decoder. Buffers partial input across {@link #feed} calls and
 * returns each complete frame (bytes before a delimiter) in arrival order.
 * Not thread-safe; one decoder per stream.
 */
public class FrameDecoder {

    private static final int INITIAL_CAPACITY = 4096;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length = 0;
    // bytes [0, scanned) are known to hold no delimiter
    private int scanned = 0;

    public List<byte[]> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Append a chunk and drain every complete frame now in the buffer.
     */
    public List<byte[]> feed(byte[] chunk, int offset, int count) {
        ensureCapacity(length + count);
        System.arraycopy(chunk, offset, buffer, length, count);
        length += count;

        List<byte[]> frames = new ArrayList<>();
        int start = 0;
        for (int i = scanned; i < length; i++) {
            if (buffer[i] == FrameCodec.DELIMITER) {
                frames.add(Arrays.copyOfRange(buffer, start, i));
                start = i + 1;
            }
        }

        if (start > 0) {
            System.arraycopy(buffer, start, buffer, 0, length - start);
            length -= start;
        }
        scanned = length;
        return frames;
    }

    /**
     * Number of buffered bytes that do not yet form a complete frame.
     */
    public int pendingBytes() {
        return length;
    }

    public byte[] pending() {
        return Arrays.copyOf(buffer, length);
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
