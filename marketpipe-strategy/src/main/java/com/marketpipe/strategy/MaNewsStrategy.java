package com.marketpipe.strategy;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.model.OrderSide;
import com.marketpipe.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Moving-average crossover confirmed by news sentiment.
 * <p>
 * An order is only wanted when the price trend and the news agree, and only when it
 * would change the current position. Holds no state of its own.
 */
public class MaNewsStrategy {

    private static final Logger log = LoggerFactory.getLogger(MaNewsStrategy.class);

    private final int shortWindow;
    private final int longWindow;
    private final int bullishThreshold;
    private final int bearishThreshold;

    public MaNewsStrategy(int shortWindow, int longWindow, int bullishThreshold, int bearishThreshold) {
        if (shortWindow <= 0 || longWindow <= 0 || shortWindow > longWindow) {
            throw new IllegalArgumentException("Invalid windows: short=" + shortWindow + ", long=" + longWindow);
        }
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
        this.bullishThreshold = bullishThreshold;
        this.bearishThreshold = bearishThreshold;
    }

    public MaNewsStrategy(PipelineConfig config) {
        this(config.getShortWindow(), config.getLongWindow(),
            config.getBullishThreshold(), config.getBearishThreshold());
    }

    /**
     * Evaluate the rule against the current history (which already includes {@code price}).
     *
     * @return the order to place, or empty when the history is too short, the signals
     *         disagree or are neutral, or the position already matches
     */
    public Optional<StrategyDecision> evaluate(PriceHistory history, double price, int sentiment, Position position) {
        if (history.size() < longWindow) {
            return Optional.empty();
        }

        double shortMa = history.mean(shortWindow);
        double longMa = history.mean(longWindow);
        Signal priceSignal = Signal.fromMovingAverages(shortMa, longMa);
        Signal newsSignal = Signal.fromSentiment(sentiment, bullishThreshold, bearishThreshold);

        log.info("price={} short_ma={} long_ma={} sentiment={} price_signal={} news_signal={} position={}",
            fmt(price), fmt(shortMa), fmt(longMa), sentiment, priceSignal, newsSignal, position);

        OrderSide side;
        Position desired;
        if (priceSignal == Signal.BUY && newsSignal == Signal.BUY) {
            side = OrderSide.BUY;
            desired = Position.LONG;
        } else if (priceSignal == Signal.SELL && newsSignal == Signal.SELL) {
            side = OrderSide.SELL;
            desired = Position.SHORT;
        } else {
            return Optional.empty();
        }

        if (position == desired) {
            log.info("Desired position {} matches current position. No new order.", desired);
            return Optional.empty();
        }

        String reason = "Both price and news signals indicate " + side;
        return Optional.of(new StrategyDecision(side, desired, reason, shortMa, longMa));
    }

    public int getShortWindow() {
        return shortWindow;
    }

    public int getLongWindow() {
        return longWindow;
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
