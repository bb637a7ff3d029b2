package com.marketpipe.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * One connected subscriber on a broadcast channel.
 */
class Subscriber implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Subscriber.class);

    private final Socket socket;
    private final OutputStream out;
    private final String address;

    Subscriber(Socket socket) throws IOException {
        this.socket = socket;
        this.socket.setTcpNoDelay(true);
        this.out = socket.getOutputStream();
        this.address = String.valueOf(socket.getRemoteSocketAddress());
    }

    /**
     * Write already-framed bytes. Fails once the peer has gone away.
     */
    void send(byte[] framedBytes) throws IOException {
        out.write(framedBytes);
        out.flush();
    }

    /**
     * Start a daemon thread that drains (and discards) anything the peer sends and runs
     * {@code onClosed} once the peer hangs up or the socket fails.
     */
    void watchForClose(String threadName, Runnable onClosed) {
        Thread watcher = new Thread(() -> {
            byte[] sink = new byte[256];
            try (InputStream in = socket.getInputStream()) {
                while (in.read(sink) >= 0) {
                    // push-only protocol; inbound bytes are ignored
                }
            } catch (IOException e) {
                LOG.debug("Subscriber {} read ended: {}", address, e.getMessage());
            }
            onClosed.run();
        }, threadName);
        watcher.setDaemon(true);
        watcher.start();
    }

    String getAddress() {
        return address;
    }

    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error closing subscriber {}: {}", address, e.getMessage());
        }
    }
}
