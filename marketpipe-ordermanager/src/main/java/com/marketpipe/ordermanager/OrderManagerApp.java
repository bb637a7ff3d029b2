package com.marketpipe.ordermanager;

import com.marketpipe.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Order manager process: receives and logs orders until terminated.
 */
public class OrderManagerApp {
    private static final Logger LOG = LoggerFactory.getLogger(OrderManagerApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        LOG.info("Starting order manager...");

        OrderManagerServer server = null;
        int exitCode = 0;
        try {
            PipelineConfig config = PipelineConfig.load();
            server = new OrderManagerServer(config.getHost(), config.getOrderPort());

            OrderManagerServer running = server;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down order manager...");
                running.close();
                shutdownLatch.countDown();
            }, "ordermanager-shutdown"));

            server.start();
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.error("Failed to start order manager", e);
            exitCode = 1;
        }

        if (server != null) {
            server.close();
        }
        System.exit(exitCode);
    }
}
