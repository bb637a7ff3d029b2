package com.marketpipe.orderbook;

import com.marketpipe.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Order book process: owns the shared price table and keeps it current from the price feed.
 */
public class OrderBookApp {
    private static final Logger LOG = LoggerFactory.getLogger(OrderBookApp.class);

    private static final long SHUTDOWN_WAIT_MS = 2000;

    public static void main(String[] args) {
        LOG.info("Starting order book...");

        PriceRelay relay;
        try {
            PipelineConfig config = PipelineConfig.load();
            relay = new PriceRelay(config);
            relay.open();
        } catch (Exception e) {
            LOG.error("Failed to start order book", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down order book...");
            relay.stop();
            try {
                relay.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            relay.release();
        }, "orderbook-shutdown"));

        try {
            relay.run();
        } catch (Exception e) {
            LOG.error("Order book failed", e);
            relay.release();
            System.exit(1);
        }
        relay.release();
        System.exit(0);
    }
}
