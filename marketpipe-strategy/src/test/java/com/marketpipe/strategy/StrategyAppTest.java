package com.marketpipe.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StrategyAppTest {

    private static int closedPort() throws Exception {
        try (ServerSocket free = new ServerSocket(0)) {
            return free.getLocalPort();
        }
    }

    @Test
    @DisplayName("Shutdown ends the order manager retry loop during its backoff")
    void shutdownInterruptsRetry() throws Exception {
        // Given an unreachable order manager and a long retry delay
        SocketOrderSender sender = new SocketOrderSender("127.0.0.1", closedPort());
        CountDownLatch stop = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> connected = executor.submit(() -> StrategyApp.connectWithRetry(sender, 60_000, stop));
            Thread.sleep(200);

            // When shutdown is signalled
            stop.countDown();

            // Then the loop gives up promptly
            assertFalse(connected.get(5, TimeUnit.SECONDS));
            assertFalse(sender.isConnected());
        } finally {
            executor.shutdownNow();
            sender.close();
        }
    }

    @Test
    @DisplayName("Connects on the first attempt when the order manager is up")
    void connectsWhenAvailable() throws Exception {
        try (ServerSocket orderManager = new ServerSocket(0)) {
            SocketOrderSender sender = new SocketOrderSender("127.0.0.1", orderManager.getLocalPort());
            try {
                assertTrue(StrategyApp.connectWithRetry(sender, 60_000, new CountDownLatch(1)));
                assertTrue(sender.isConnected());
            } finally {
                sender.close();
            }
        }
    }

    @Test
    @DisplayName("An already signalled shutdown skips connecting")
    void alreadyStopped() throws Exception {
        SocketOrderSender sender = new SocketOrderSender("127.0.0.1", closedPort());
        CountDownLatch stop = new CountDownLatch(1);
        stop.countDown();

        assertFalse(StrategyApp.connectWithRetry(sender, 60_000, stop));
    }
}
