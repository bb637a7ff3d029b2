package com.marketpipe.gateway;

import com.marketpipe.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway process: serves the price and news channels until terminated.
 */
public class GatewayApp {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayApp.class);

    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private static final AtomicInteger exitCode = new AtomicInteger(0);

    public static void main(String[] args) {
        LOG.info("Starting gateway...");

        BroadcastHub hub = null;
        try {
            PipelineConfig config = PipelineConfig.load();
            Random random = new Random();
            hub = new BroadcastHub(config, new PriceWalk(config.getSymbols(), random), new SentimentSource(random));
            hub.setFailureHandler(e -> {
                exitCode.set(1);
                shutdownLatch.countDown();
            });

            BroadcastHub running = hub;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOG.info("Shutting down gateway...");
                running.close();
            }, "gateway-shutdown"));

            hub.start();
            LOG.info("Gateway started on price port {} and news port {}", hub.getPricePort(), hub.getNewsPort());

            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.error("Failed to start gateway", e);
            exitCode.set(1);
        }

        if (hub != null) {
            hub.close();
        }
        System.exit(exitCode.get());
    }
}
