package com.marketpipe.gateway;

import com.marketpipe.core.model.PriceTick;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PriceWalkTest {

    @Test
    @DisplayName("Initial prices fall in [100, 300)")
    void initialRange() {
        PriceWalk walk = new PriceWalk(List.of("AAPL", "MSFT", "GOOGL", "AMZN"), new Random(1));

        for (String symbol : List.of("AAPL", "MSFT", "GOOGL", "AMZN")) {
            double price = walk.current(symbol);
            assertTrue(price >= 100.0 && price < 300.0, symbol + "=" + price);
        }
    }

    @Test
    @DisplayName("Each step moves a price by at most 0.5, in symbol order")
    void boundedSteps() {
        PriceWalk walk = new PriceWalk(List.of("AAPL", "MSFT"), new Random(42));

        for (int i = 0; i < 500; i++) {
            double aapl = walk.current("AAPL");
            double msft = walk.current("MSFT");
            List<PriceTick> ticks = walk.next();

            assertEquals("AAPL", ticks.get(0).symbol());
            assertEquals("MSFT", ticks.get(1).symbol());
            assertTrue(Math.abs(ticks.get(0).price() - aapl) <= PriceWalk.MAX_STEP + 1e-9);
            assertTrue(Math.abs(ticks.get(1).price() - msft) <= PriceWalk.MAX_STEP + 1e-9);
        }
    }

    @Test
    @DisplayName("Prices never drop below the floor")
    void flooredAtMinimum() {
        PriceWalk walk = new PriceWalk(Map.of("PENNY", 0.02), new Random(3));

        for (int i = 0; i < 1_000; i++) {
            assertTrue(walk.next().get(0).price() >= PriceWalk.MIN_PRICE);
        }
    }

    @Test
    @DisplayName("Sentiment stays within [0, 100] and covers both ends")
    void sentimentRange() {
        SentimentSource source = new SentimentSource(new Random(5));
        boolean sawLow = false;
        boolean sawHigh = false;

        for (int i = 0; i < 20_000; i++) {
            int s = source.next();
            assertTrue(s >= 0 && s <= 100);
            sawLow |= s == 0;
            sawHigh |= s == 100;
        }
        assertTrue(sawLow && sawHigh);
    }
}
