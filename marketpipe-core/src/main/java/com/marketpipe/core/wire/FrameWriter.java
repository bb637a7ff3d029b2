package com.marketpipe.core.wire;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes delimiter-terminated frames to an output stream.
 * Sends are serialized so concurrent callers never interleave frames.
 */
public class FrameWriter {

    private final OutputStream out;

    public FrameWriter(OutputStream out) {
        this.out = out;
    }

    public synchronized void send(byte[] payload) throws IOException {
        out.write(FrameCodec.encode(payload));
        out.flush();
    }

    /**
     * Write bytes that are already framed (e.g. a whole tick batch) in one call.
     */
    public synchronized void sendRaw(byte[] framedBytes) throws IOException {
        out.write(framedBytes);
        out.flush();
    }
}
