package com.marketpipe.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A push-only TCP channel: accepts subscribers and fans frames out to all of them.
 * <p>
 * The subscriber set is guarded by a private lock. A broadcast takes a snapshot under
 * the lock and writes outside it, so the acceptor never waits on a slow peer. A failed
 * write removes and closes only that subscriber; the rest still receive the frame.
 * Peers that hang up between broadcasts are noticed by a per-subscriber watcher thread.
 */
public class BroadcastChannel implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(BroadcastChannel.class);
    private static final int BACKLOG = 50;

    private final String name;
    private final ServerSocket serverSocket;
    private final Object lock = new Object();
    private final Set<Subscriber> subscribers = new LinkedHashSet<>();
    private final Consumer<Throwable> failureHandler;

    private Thread acceptor;
    private volatile boolean running = false;

    private BroadcastChannel(String name, ServerSocket serverSocket, Consumer<Throwable> failureHandler) {
        this.name = name;
        this.serverSocket = serverSocket;
        this.failureHandler = failureHandler;
    }

    /**
     * Bind the listening socket. A bind failure is fatal for the channel.
     *
     * @param port 0 picks an ephemeral port
     * @param failureHandler called if the acceptor loop dies after startup
     */
    public static BroadcastChannel bind(String name, String host, int port,
                                        Consumer<Throwable> failureHandler) throws IOException {
        ServerSocket server = new ServerSocket();
        try {
            server.setReuseAddress(true);
            server.bind(new InetSocketAddress(InetAddress.getByName(host), port), BACKLOG);
        } catch (IOException e) {
            server.close();
            throw new IOException("[" + name + "] Failed to bind " + host + ":" + port + ": " + e.getMessage(), e);
        }
        LOG.info("[{}] Listening on {}:{}", name, host, server.getLocalPort());
        return new BroadcastChannel(name, server, failureHandler);
    }

    /**
     * Start the acceptor thread.
     */
    public synchronized void start() {
        if (running) return;
        running = true;
        acceptor = new Thread(this::acceptLoop, name + "-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    /**
     * Send already-framed bytes to every current subscriber.
     *
     * @return the number of subscribers the frame reached
     */
    public int broadcast(byte[] framedBytes) {
        List<Subscriber> current;
        synchronized (lock) {
            current = new ArrayList<>(subscribers);
        }

        int delivered = 0;
        for (Subscriber subscriber : current) {
            try {
                subscriber.send(framedBytes);
                delivered++;
            } catch (IOException e) {
                LOG.info("[{}] Client {} disconnected ({}). Removing.", name, subscriber.getAddress(), e.getMessage());
                remove(subscriber);
            }
        }
        return delivered;
    }

    public int getSubscriberCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public boolean hasSubscribers() {
        return getSubscriberCount() > 0;
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public String getName() {
        return name;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stop accepting and disconnect every subscriber.
     */
    @Override
    public void close() {
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOG.warn("[{}] Error closing server socket: {}", name, e.getMessage());
        }

        List<Subscriber> current;
        synchronized (lock) {
            current = new ArrayList<>(subscribers);
            subscribers.clear();
        }
        current.forEach(Subscriber::close);
        LOG.info("[{}] Closed ({} subscribers disconnected)", name, current.size());
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    running = false;
                    LOG.error("[{}] Acceptor failed: {}", name, e.getMessage(), e);
                    failureHandler.accept(e);
                }
                return;
            }

            try {
                Subscriber subscriber = new Subscriber(socket);
                int total;
                synchronized (lock) {
                    subscribers.add(subscriber);
                    total = subscribers.size();
                }
                LOG.info("[{}] Client connected from {}. Total clients: {}", name, subscriber.getAddress(), total);
                subscriber.watchForClose(name + "-watch-" + subscriber.getAddress(), () -> {
                    if (running) {
                        LOG.info("[{}] Client {} closed the connection. Removing.", name, subscriber.getAddress());
                    }
                    remove(subscriber);
                });
            } catch (IOException e) {
                LOG.warn("[{}] Could not set up client {}: {}", name, socket.getRemoteSocketAddress(), e.getMessage());
                closeSocket(socket);
            }
        }
    }

    private void remove(Subscriber subscriber) {
        boolean removed;
        synchronized (lock) {
            removed = subscribers.remove(subscriber);
        }
        if (removed) {
            subscriber.close();
        }
    }

    private void closeSocket(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("[{}] Error closing socket: {}", name, e.getMessage());
        }
    }
}
