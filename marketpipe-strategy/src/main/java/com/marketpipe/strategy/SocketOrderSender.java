package com.marketpipe.strategy;

import com.marketpipe.core.model.OrderIntent;
import com.marketpipe.core.wire.FrameWriter;
import com.marketpipe.core.wire.OrderIntentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Sends each order as one framed JSON object over a single long-lived TCP connection.
 */
public class SocketOrderSender implements OrderSender {

    private static final Logger log = LoggerFactory.getLogger(SocketOrderSender.class);

    private final String host;
    private final int port;
    private Socket socket;
    private FrameWriter writer;

    public SocketOrderSender(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Open the connection to the order sink.
     */
    public synchronized void connect() throws IOException {
        if (socket != null) return;
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(host, port));
        } catch (IOException e) {
            s.close();
            throw e;
        }
        socket = s;
        writer = new FrameWriter(s.getOutputStream());
        log.info("Connected to order manager at {}:{}", host, port);
    }

    public synchronized boolean isConnected() {
        return socket != null;
    }

    @Override
    public synchronized void send(OrderIntent intent) throws OrderTransmitException {
        if (writer == null) {
            throw new OrderTransmitException("Not connected to order manager at " + host + ":" + port);
        }
        try {
            writer.send(OrderIntentCodec.encode(intent));
        } catch (IOException e) {
            throw new OrderTransmitException("Error sending order to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (socket == null) return;
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing order connection: {}", e.getMessage());
        }
        socket = null;
        writer = null;
    }
}
