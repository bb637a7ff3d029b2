package com.marketpipe.core.wire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy frame sequence over a byte stream.
 * <p>
 * Reads raw chunks, buffers partial data and yields one frame per delimiter.
 * The sequence ends when the stream closes or fails; it cannot be restarted.
 * A stream that closes with a partial frame buffered yields nothing further and
 * reports {@link #isIncomplete()}. An I/O failure is logged and exposed through
 * {@link #getFailure()} rather than thrown from the iterator.
 */
public class FrameReader implements Iterator<byte[]>, Iterable<byte[]>, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FrameReader.class);

    public static final int DEFAULT_CHUNK_SIZE = 4096;

    private final InputStream in;
    private final String source;
    private final byte[] chunk;
    private final FrameDecoder decoder = new FrameDecoder();
    private final Deque<byte[]> ready = new ArrayDeque<>();

    private volatile boolean finished = false;
    private boolean incomplete = false;
    private IOException failure;

    public FrameReader(InputStream in, String source) {
        this(in, source, DEFAULT_CHUNK_SIZE);
    }

    public FrameReader(InputStream in, String source, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.in = in;
        this.source = source;
        this.chunk = new byte[chunkSize];
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !finished) {
            readChunk();
        }
        return !ready.isEmpty();
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Frame stream from " + source + " has ended");
        }
        return ready.poll();
    }

    @Override
    public Iterator<byte[]> iterator() {
        return this;
    }

    /**
     * True once the stream ended with bytes that never saw a delimiter.
     */
    public boolean isIncomplete() {
        return incomplete;
    }

    /**
     * The I/O error that ended the sequence, or null if it ended cleanly (or has not ended).
     */
    public IOException getFailure() {
        return failure;
    }

    public boolean isFinished() {
        return finished && ready.isEmpty();
    }

    @Override
    public void close() throws IOException {
        finished = true;
        in.close();
    }

    private void readChunk() {
        int n;
        try {
            n = in.read(chunk);
        } catch (IOException e) {
            if (!finished) {
                LOG.warn("Error receiving from {}: {}", source, e.getMessage());
                failure = e;
            }
            finished = true;
            return;
        }

        if (n < 0) {
            if (decoder.pendingBytes() > 0) {
                incomplete = true;
                LOG.warn("Incomplete frame from {} (stream closed): {}", source,
                    new String(decoder.pending(), StandardCharsets.UTF_8));
            }
            LOG.debug("Frame stream from {} closed", source);
            finished = true;
            return;
        }

        ready.addAll(decoder.feed(chunk, 0, n));
    }
}
