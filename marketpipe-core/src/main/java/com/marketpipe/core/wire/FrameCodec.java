package com.marketpipe.core.wire;

import java.util.Objects;

/**
 * Delimiter framing shared by every stream in the pipeline.
 * A frame is an arbitrary payload followed by a single {@link #DELIMITER} byte.
 * Payloads containing the delimiter are not escaped and will be split by the reader.
 */
public final class FrameCodec {

    /** Frame terminator, ASCII '*'. */
    public static final byte DELIMITER = (byte) '*';

    private FrameCodec() {}

    /**
     * Append the delimiter to a payload.
     *
     * @throws NullPointerException if payload is null
     */
    public static byte[] encode(byte[] payload) {
        Objects.requireNonNull(payload, "payload must be a byte array");
        byte[] framed = new byte[payload.length + 1];
        System.arraycopy(payload, 0, framed, 0, payload.length);
        framed[payload.length] = DELIMITER;
        return framed;
    }

    /**
     * Encode several payloads back to back, as they would appear on the wire.
     */
    public static byte[] encodeAll(Iterable<byte[]> payloads) {
        int size = 0;
        for (byte[] payload : payloads) {
            size += Objects.requireNonNull(payload, "payload must be a byte array").length + 1;
        }
        byte[] out = new byte[size];
        int pos = 0;
        for (byte[] payload : payloads) {
            System.arraycopy(payload, 0, out, pos, payload.length);
            pos += payload.length;
            out[pos++] = DELIMITER;
        }
        return out;
    }

    public static boolean containsDelimiter(byte[] payload) {
        for (byte b : payload) {
            if (b == DELIMITER) return true;
        }
        return false;
    }
}
