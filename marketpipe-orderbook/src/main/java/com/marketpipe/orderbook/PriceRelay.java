package com.marketpipe.orderbook;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.model.PriceTick;
import com.marketpipe.core.shm.SharedPriceTable;
import com.marketpipe.core.shm.SharedSegmentException;
import com.marketpipe.core.wire.FrameReader;
import com.marketpipe.core.wire.MalformedFrameException;
import com.marketpipe.core.wire.PriceTickCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Order book process core: subscribes to the gateway's price channel and mirrors every
 * price into the shared price table, which it creates and owns.
 * <p>
 * Connection handling follows a fixed-delay retry: refused connects, resets and a
 * closed stream all lead to a pause of {@code reconnectDelayMs} and a fresh connect.
 * The loop only ends through {@link #stop()}.
 */
public class PriceRelay implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(PriceRelay.class);

    private final PipelineConfig config;
    private final String source;
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch runFinished = new CountDownLatch(1);
    private final AtomicBoolean released = new AtomicBoolean(false);

    private final AtomicLong connects = new AtomicLong();
    private final AtomicLong updates = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();

    private volatile boolean running = true;
    private volatile Socket currentSocket;
    private SharedPriceTable table;

    public PriceRelay(PipelineConfig config) {
        this.config = config;
        this.source = "gateway " + config.getHost() + ":" + config.getPricePort();
    }

    /**
     * Create the shared price table. Must happen before {@link #run()} so readers can
     * attach while the gateway is still unreachable.
     */
    public synchronized SharedPriceTable open() throws SharedSegmentException {
        if (table == null) {
            table = SharedPriceTable.create(config.getSegmentDir(), config.getSharedMemoryName(), config.getSymbols());
            LOG.info("Shared price table '{}' created at {}", table.getName(), table.getPath());
        }
        return table;
    }

    /**
     * Connect, relay and reconnect until stopped. Blocks the calling thread.
     */
    public void run() {
        if (table == null) {
            throw new IllegalStateException("open() must be called before run()");
        }
        try {
            while (running) {
                relayOnce();
                if (running && !pause()) {
                    break;
                }
            }
        } finally {
            runFinished.countDown();
            LOG.info("Price relay stopped ({} updates, {} malformed records)", updates.get(), malformed.get());
        }
    }

    private void relayOnce() {
        Socket socket = new Socket();
        currentSocket = socket;
        try {
            if (!running) return;
            LOG.info("Attempting to connect to {}...", source);
            socket.connect(new InetSocketAddress(config.getHost(), config.getPricePort()));
            connects.incrementAndGet();
            LOG.info("Connected to {} price feed", source);

            FrameReader reader = new FrameReader(socket.getInputStream(), source);
            for (byte[] frame : reader) {
                handleFrame(frame);
            }
            if (running) {
                LOG.warn("Gateway disconnected. Retrying in {}ms...", config.getReconnectDelayMs());
            }
        } catch (IOException e) {
            if (running) {
                LOG.warn("Connection to {} failed ({}). Retrying in {}ms...", source, e.getMessage(),
                    config.getReconnectDelayMs());
            }
        } finally {
            currentSocket = null;
            closeQuietly(socket);
        }
    }

    /**
     * Apply every {@code SYMBOL,PRICE} record in a frame. Bad records are skipped individually.
     */
    void handleFrame(byte[] frame) {
        for (String record : PriceTickCodec.splitRecords(frame)) {
            try {
                PriceTick tick = PriceTick.parse(record);
                table.update(tick.symbol(), tick.price());
                updates.incrementAndGet();
                LOG.debug("Updated {} -> {}", tick.symbol(), tick.price());
            } catch (MalformedFrameException e) {
                malformed.incrementAndGet();
                LOG.warn("Error parsing price record '{}': {}", e.getRawPayload(), e.getMessage());
            }
        }
    }

    /**
     * @return false if stopped while waiting
     */
    private boolean pause() {
        try {
            return !stopSignal.await(config.getReconnectDelayMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Ask the loop to end: wakes a pending backoff and aborts a blocked connect or read.
     */
    public void stop() {
        running = false;
        stopSignal.countDown();
        Socket socket = currentSocket;
        if (socket != null) {
            closeQuietly(socket);
        }
    }

    /**
     * Wait for {@link #run()} to return.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return runFinished.await(timeout, unit);
    }

    /**
     * Destroy and detach the shared table. Only the first call has an effect.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) return;
        SharedPriceTable t;
        synchronized (this) {
            t = table;
        }
        if (t != null) {
            LOG.info("Unlinking shared price table '{}'...", t.getName());
            t.unlink();
            t.close();
        }
    }

    @Override
    public void close() {
        stop();
        release();
    }

    public boolean isReleased() {
        return released.get();
    }

    public long getConnectCount() {
        return connects.get();
    }

    public long getUpdateCount() {
        return updates.get();
    }

    public long getMalformedCount() {
        return malformed.get();
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
