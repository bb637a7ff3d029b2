package com.marketpipe.strategy;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.model.OrderIntent;
import com.marketpipe.core.model.Position;
import com.marketpipe.core.shm.SharedPriceTable;
import com.marketpipe.core.wire.FrameReader;
import com.marketpipe.core.wire.MalformedFrameException;
import com.marketpipe.core.wire.SentimentCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Strategy process core: on every news tick, samples the traded symbol's price from the
 * shared table, feeds the strategy and sends an order when it asks for one.
 * <p>
 * The position moves only after the order has been handed to the sink; a failed send
 * ends the run with {@link OrderTransmitException}.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final PipelineConfig config;
    private final SharedPriceTable table;
    private final OrderSender sender;
    private final MaNewsStrategy strategy;
    private final Clock clock;
    private final String symbol;
    private final PriceHistory history;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile Position position = Position.FLAT;
    private volatile boolean running = true;
    private volatile Socket newsSocket;
    private volatile long ordersSent;
    private volatile long ticksEvaluated;

    public DecisionEngine(PipelineConfig config, SharedPriceTable table, OrderSender sender) {
        this(config, table, sender, new MaNewsStrategy(config), Clock.systemUTC());
    }

    public DecisionEngine(PipelineConfig config, SharedPriceTable table, OrderSender sender,
                          MaNewsStrategy strategy, Clock clock) {
        this.config = config;
        this.table = table;
        this.sender = sender;
        this.strategy = strategy;
        this.clock = clock;
        this.symbol = config.getTradeSymbol();
        this.history = new PriceHistory(strategy.getLongWindow());
    }

    /**
     * Subscribe to the news channel and process ticks until stopped. A lost or refused
     * news connection is retried after {@code reconnectDelayMs}.
     *
     * @throws OrderTransmitException if an order could not be sent
     */
    public void run() throws OrderTransmitException {
        String source = "news feed " + config.getHost() + ":" + config.getNewsPort();
        log.info("Trading symbol: {}", symbol);
        while (running) {
            Socket socket = new Socket();
            newsSocket = socket;
            try {
                if (!running) break;
                socket.connect(new InetSocketAddress(config.getHost(), config.getNewsPort()));
                log.info("Connected to {}", source);

                for (byte[] frame : new FrameReader(socket.getInputStream(), source)) {
                    onNewsFrame(frame);
                }
                if (running) {
                    log.warn("News feed disconnected. Retrying in {}ms...", config.getReconnectDelayMs());
                }
            } catch (IOException e) {
                if (running) {
                    log.warn("Could not connect to {} ({}). Retrying in {}ms...", source, e.getMessage(),
                        config.getReconnectDelayMs());
                }
            } finally {
                newsSocket = null;
                closeQuietly(socket);
            }

            if (running && !pause()) {
                break;
            }
        }
        log.info("Decision engine stopped ({} orders sent, position {})", ordersSent, position);
    }

    /**
     * Handle one news frame.
     *
     * @return the order that was sent, if any
     * @throws OrderTransmitException if the strategy asked for an order and sending it failed
     */
    public Optional<OrderIntent> onNewsFrame(byte[] frame) throws OrderTransmitException {
        int sentiment;
        try {
            sentiment = SentimentCodec.parse(frame);
        } catch (MalformedFrameException e) {
            log.warn("Could not parse sentiment from message '{}': {}", e.getRawPayload(), e.getMessage());
            return Optional.empty();
        }

        // A fresh table holds 0.0 until the relay writes the first price
        OptionalDouble latest = table.read(symbol);
        if (latest.isEmpty() || latest.getAsDouble() <= 0) {
            log.warn("No price available for {}. Skipping tick.", symbol);
            return Optional.empty();
        }
        double price = latest.getAsDouble();
        history.add(price);
        ticksEvaluated++;

        Optional<StrategyDecision> decision = strategy.evaluate(history, price, sentiment, position);
        if (decision.isEmpty()) {
            return Optional.empty();
        }

        StrategyDecision d = decision.get();
        OrderIntent order = new OrderIntent(symbol, d.side(), config.getTradeQuantity(), price, sentiment,
            d.shortMa(), d.longMa(), position, d.desiredPosition(), d.reason(), clock.millis() / 1000.0);

        sender.send(order);
        ordersSent++;
        position = d.desiredPosition();
        log.info("Sent order: {}", order.summary());
        return Optional.of(order);
    }

    /**
     * Stop after the current tick; aborts a blocked news read or a pending retry.
     */
    public void stop() {
        running = false;
        stopSignal.countDown();
        Socket socket = newsSocket;
        if (socket != null) {
            closeQuietly(socket);
        }
    }

    public Position getPosition() {
        return position;
    }

    public PriceHistory getHistory() {
        return history;
    }

    /**
     * News ticks that had a usable sentiment and price.
     */
    public long getTicksEvaluated() {
        return ticksEvaluated;
    }

    public long getOrdersSent() {
        return ordersSent;
    }

    private boolean pause() {
        try {
            return !stopSignal.await(config.getReconnectDelayMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing news socket: {}", e.getMessage());
        }
    }
}
