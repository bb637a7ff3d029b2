package com.marketpipe.strategy;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.shm.SegmentNotFoundException;
import com.marketpipe.core.shm.SharedPriceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Strategy process: attaches to the order book's price table and trades on news ticks.
 */
public class StrategyApp {
    private static final Logger LOG = LoggerFactory.getLogger(StrategyApp.class);

    private static final CountDownLatch shutdownSignal = new CountDownLatch(1);

    public static void main(String[] args) {
        LOG.info("Starting strategy...");
        System.exit(run());
    }

    static int run() {
        PipelineConfig config;
        SharedPriceTable table;
        try {
            config = PipelineConfig.load();
            table = SharedPriceTable.attach(config.getSegmentDir(), config.getSharedMemoryName());
        } catch (SegmentNotFoundException e) {
            LOG.error("Shared price table not found. Is the order book running? ({})", e.getMessage());
            return 1;
        } catch (Exception e) {
            LOG.error("Failed to start strategy", e);
            return 1;
        }

        SocketOrderSender sender = new SocketOrderSender(config.getHost(), config.getOrderPort());
        DecisionEngine engine = new DecisionEngine(config, table, sender);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down strategy...");
            shutdownSignal.countDown();
            engine.stop();
        }, "strategy-shutdown"));

        try {
            if (!connectWithRetry(sender, config.getReconnectDelayMs(), shutdownSignal)) {
                return 0;
            }
            engine.run();
            return 0;
        } catch (OrderTransmitException e) {
            LOG.error("Order transmission failed, stopping: {}", e.getMessage(), e);
            return 1;
        } finally {
            sender.close();
            table.close();
            LOG.info("Closed connections and detached from shared memory.");
        }
    }

    /**
     * Connect to the order manager, retrying every {@code delayMs} until connected or
     * {@code stopSignal} is released.
     *
     * @return false if stopped before a connection was made
     */
    static boolean connectWithRetry(SocketOrderSender sender, long delayMs, CountDownLatch stopSignal) {
        while (stopSignal.getCount() > 0) {
            try {
                sender.connect();
                return true;
            } catch (IOException e) {
                LOG.warn("Could not connect to order manager ({}). Retrying in {}ms...", e.getMessage(), delayMs);
            }
            try {
                if (stopSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        LOG.info("Stopped before connecting to order manager");
        return false;
    }
}
