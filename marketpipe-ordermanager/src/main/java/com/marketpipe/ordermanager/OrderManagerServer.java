package com.marketpipe.ordermanager;

import com.marketpipe.core.model.OrderIntent;
import com.marketpipe.core.wire.FrameReader;
import com.marketpipe.core.wire.OrderIntentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Order sink. Accepts any number of strategy connections and logs every order received.
 * <p>
 * Each client is served by its own handler thread. A frame that is not a valid order is
 * logged and skipped; the connection stays open.
 */
public class OrderManagerServer implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(OrderManagerServer.class);

    private static final int BACKLOG = 5;

    private final String host;
    private final int port;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();
    private final AtomicInteger clientSeq = new AtomicInteger();

    private volatile Consumer<OrderIntent> listener = order -> { };
    private volatile boolean running = false;
    private volatile int boundPort = -1;
    private ServerSocket serverSocket;
    private ExecutorService handlers;
    private Thread acceptor;

    public OrderManagerServer(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Receives every successfully decoded order, on the client's handler thread.
     */
    public void setListener(Consumer<OrderIntent> listener) {
        this.listener = listener;
    }

    /**
     * Bind and start accepting.
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void start() throws IOException {
        if (running) return;

        ServerSocket server = new ServerSocket();
        try {
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(InetAddress.getByName(host), port), BACKLOG);
        } catch (IOException e) {
            server.close();
            throw new IOException("Failed to bind order manager on " + host + ":" + port + ": " + e.getMessage(), e);
        }
        serverSocket = server;
        boundPort = server.getLocalPort();
        handlers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "order-client-" + clientSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;

        acceptor = new Thread(this::acceptLoop, "order-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Order manager listening on {}:{}", host, server.getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            Socket client;
            try {
                client = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    log.error("Order manager accept failed: {}", e.getMessage(), e);
                    running = false;
                }
                return;
            }
            clients.add(client);
            handlers.execute(() -> handleClient(client));
        }
    }

    private void handleClient(Socket client) {
        SocketAddress peer = client.getRemoteSocketAddress();
        log.info("Client connected from {}", peer);
        try (FrameReader reader = new FrameReader(client.getInputStream(), String.valueOf(peer))) {
            for (byte[] frame : reader) {
                try {
                    handleFrame(frame, peer);
                } catch (RuntimeException e) {
                    malformed.incrementAndGet();
                    log.error("Error processing frame from {}: '{}'", peer,
                        new String(frame, StandardCharsets.UTF_8), e);
                }
            }
        } catch (IOException e) {
            log.warn("Error reading from {}: {}", peer, e.getMessage());
        } finally {
            clients.remove(client);
            closeQuietly(client);
            log.info("Client {} disconnected", peer);
        }
    }

    void handleFrame(byte[] frame, SocketAddress peer) {
        OrderIntent order;
        try {
            order = OrderIntentCodec.decode(frame);
        } catch (IOException e) {
            malformed.incrementAndGet();
            log.warn("Received malformed data from {}: '{}' ({})", peer,
                new String(frame, StandardCharsets.UTF_8), e.getMessage());
            return;
        }

        received.incrementAndGet();
        log.info("Received trade: symbol={} side={} price={} qty={} reason={}",
            order.symbol(), order.side(), String.format("%.2f", order.price()), order.quantity(), order.reason());
        try {
            listener.accept(order);
        } catch (RuntimeException e) {
            log.error("Order listener failed for {}: {}", order.summary(), e.getMessage(), e);
        }
    }

    /**
     * The bound port (useful when started on port 0), or -1 before {@link #start()}.
     */
    public int getPort() {
        return boundPort;
    }

    public boolean isRunning() {
        return running;
    }

    public int getClientCount() {
        return clients.size();
    }

    public long getReceivedCount() {
        return received.get();
    }

    public long getMalformedCount() {
        return malformed.get();
    }

    @Override
    public synchronized void close() {
        if (serverSocket == null) return;
        log.info("Closing order manager...");
        running = false;
        closeQuietly(serverSocket);
        clients.forEach(OrderManagerServer::closeQuietly);
        clients.clear();
        handlers.shutdownNow();
        serverSocket = null;
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            log.debug("Error closing {}: {}", c, e.getMessage());
        }
    }
}
