package com.marketpipe.gateway;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.model.PriceTick;
import com.marketpipe.core.wire.FrameCodec;
import com.marketpipe.core.wire.PriceTickCodec;
import com.marketpipe.core.wire.SentimentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Data gateway: streams random-walk prices and random sentiment to every subscriber
 * of the price and news channels.
 * <p>
 * Each channel has its own acceptor thread; both tickers share one scheduler and run
 * at fixed rates (price: short interval, news: longer interval).
 */
public class BroadcastHub implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(BroadcastHub.class);

    private final PipelineConfig config;
    private final PriceWalk priceWalk;
    private final SentimentSource sentimentSource;
    private final AtomicLong priceTicks = new AtomicLong();
    private final AtomicLong newsTicks = new AtomicLong();

    private volatile Consumer<Throwable> failureHandler = e -> { };
    private BroadcastChannel priceChannel;
    private BroadcastChannel newsChannel;
    private ScheduledExecutorService scheduler;
    private long startNanos;

    public BroadcastHub(PipelineConfig config, PriceWalk priceWalk, SentimentSource sentimentSource) {
        this.config = config;
        this.priceWalk = priceWalk;
        this.sentimentSource = sentimentSource;
    }

    /**
     * Called when an acceptor dies after startup; the hub can no longer take subscribers.
     */
    public void setFailureHandler(Consumer<Throwable> failureHandler) {
        this.failureHandler = failureHandler;
    }

    /**
     * Bind both channels and start accepting and broadcasting.
     *
     * @throws IOException if either listening socket cannot be bound
     */
    public synchronized void start() throws IOException {
        if (scheduler != null) {
            LOG.warn("Broadcast hub already running");
            return;
        }
        LOG.info("Starting broadcast hub...");

        priceChannel = BroadcastChannel.bind("Gateway-Price", config.getHost(), config.getPricePort(), this::onAcceptorFailure);
        try {
            newsChannel = BroadcastChannel.bind("Gateway-News", config.getHost(), config.getNewsPort(), this::onAcceptorFailure);
        } catch (IOException e) {
            priceChannel.close();
            throw e;
        }

        priceChannel.start();
        newsChannel.start();

        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "gateway-ticker");
            t.setDaemon(true);
            return t;
        });
        startNanos = System.nanoTime();
        scheduler.scheduleAtFixedRate(this::priceTick, config.getPriceIntervalMs(),
            config.getPriceIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::newsTick, config.getNewsIntervalMs(),
            config.getNewsIntervalMs(), TimeUnit.MILLISECONDS);

        LOG.info("Broadcast hub running (price every {}ms on {}, news every {}ms on {})",
            config.getPriceIntervalMs(), priceChannel.getPort(), config.getNewsIntervalMs(), newsChannel.getPort());
    }

    /**
     * Generate one price batch and send it to every price subscriber.
     */
    void priceTick() {
        try {
            List<PriceTick> ticks = priceWalk.next();
            if (!priceChannel.hasSubscribers()) {
                LOG.debug("[Gateway-Price] No price clients connected. Skipping broadcast.");
                return;
            }

            long tick = priceTicks.incrementAndGet();
            double elapsedSec = (System.nanoTime() - startNanos) / 1e9;
            int delivered = priceChannel.broadcast(PriceTickCodec.encodeBatch(ticks));

            if (LOG.isDebugEnabled()) {
                LOG.debug("[Gateway-Price] tick={} clients={} throughput_est={} ticks/sec msg={}",
                    tick, delivered, String.format("%.2f", elapsedSec > 0 ? tick / elapsedSec : 0.0),
                    ticks.stream().map(PriceTick::format).collect(Collectors.joining(" ")));
            }
        } catch (Exception e) {
            LOG.error("[Gateway-Price] Error in broadcast: {}", e.getMessage(), e);
        }
    }

    /**
     * Generate one sentiment score and send it to every news subscriber.
     */
    void newsTick() {
        try {
            int sentiment = sentimentSource.next();
            if (!newsChannel.hasSubscribers()) {
                LOG.debug("[Gateway-News] No news clients connected. Skipping broadcast.");
                return;
            }

            newsTicks.incrementAndGet();
            int delivered = newsChannel.broadcast(FrameCodec.encode(SentimentCodec.encode(sentiment)));
            LOG.info("[Gateway-News] Broadcast sentiment {} to {} client(s)", sentiment, delivered);
        } catch (Exception e) {
            LOG.error("[Gateway-News] Error in broadcast: {}", e.getMessage(), e);
        }
    }

    public int getPricePort() {
        return priceChannel.getPort();
    }

    public int getNewsPort() {
        return newsChannel.getPort();
    }

    public BroadcastChannel getPriceChannel() {
        return priceChannel;
    }

    public BroadcastChannel getNewsChannel() {
        return newsChannel;
    }

    public long getPriceTickCount() {
        return priceTicks.get();
    }

    public long getNewsTickCount() {
        return newsTicks.get();
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) return;
        LOG.info("Shutting down broadcast hub...");
        scheduler.shutdownNow();
        scheduler = null;
        priceChannel.close();
        newsChannel.close();
    }

    private void onAcceptorFailure(Throwable e) {
        failureHandler.accept(e);
    }
}
