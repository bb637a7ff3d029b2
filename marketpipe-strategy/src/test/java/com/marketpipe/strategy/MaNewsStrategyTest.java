package com.marketpipe.strategy;

import com.marketpipe.core.model.OrderSide;
import com.marketpipe.core.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MaNewsStrategyTest {

    private final MaNewsStrategy strategy = new MaNewsStrategy(2, 3, 70, 30);

    private static PriceHistory historyOf(double... prices) {
        PriceHistory history = new PriceHistory(3);
        for (double p : prices) {
            history.add(p);
        }
        return history;
    }

    @Nested
    @DisplayName("Agreeing signals")
    class Agreement {

        @Test
        @DisplayName("Rising prices and bullish news open a long from flat")
        void buyFromFlat() {
            // Given short_ma = 11.5 and long_ma = 11.0
            PriceHistory history = historyOf(10, 11, 12);

            // When
            Optional<StrategyDecision> decision = strategy.evaluate(history, 12, 80, Position.FLAT);

            // Then
            assertTrue(decision.isPresent());
            assertEquals(OrderSide.BUY, decision.get().side());
            assertEquals(Position.LONG, decision.get().desiredPosition());
            assertEquals(11.5, decision.get().shortMa(), 1e-12);
            assertEquals(11.0, decision.get().longMa(), 1e-12);
        }

        @Test
        @DisplayName("The same tick while already long sends nothing")
        void noRepeatWhenAlreadyLong() {
            Optional<StrategyDecision> decision = strategy.evaluate(historyOf(10, 11, 12), 12, 80, Position.LONG);

            assertTrue(decision.isEmpty());
        }

        @Test
        @DisplayName("Falling prices and bearish news reverse a long into a short")
        void sellFromLong() {
            Optional<StrategyDecision> decision = strategy.evaluate(historyOf(12, 11, 10), 10, 10, Position.LONG);

            assertTrue(decision.isPresent());
            assertEquals(OrderSide.SELL, decision.get().side());
            assertEquals(Position.SHORT, decision.get().desiredPosition());
            assertEquals("Both price and news signals indicate SELL", decision.get().reason());
        }
    }

    @Nested
    @DisplayName("No decision")
    class NoDecision {

        @Test
        void historyTooShort() {
            assertTrue(strategy.evaluate(historyOf(10, 11), 11, 90, Position.FLAT).isEmpty());
        }

        @Test
        void signalsDisagree() {
            assertTrue(strategy.evaluate(historyOf(10, 11, 12), 12, 10, Position.FLAT).isEmpty());
        }

        @Test
        void flatPricesHold() {
            assertTrue(strategy.evaluate(historyOf(5, 5, 5), 5, 99, Position.FLAT).isEmpty());
        }

        @Test
        @DisplayName("Thresholds are exclusive")
        void thresholdsAreExclusive() {
            assertTrue(strategy.evaluate(historyOf(10, 11, 12), 12, 70, Position.FLAT).isEmpty());
            assertTrue(strategy.evaluate(historyOf(12, 11, 10), 10, 30, Position.FLAT).isEmpty());
        }
    }

    @Test
    void rejectsShortWindowLongerThanLong() {
        assertThrows(IllegalArgumentException.class, () -> new MaNewsStrategy(5, 3, 70, 30));
    }

    @Test
    void sentimentSignalBoundaries() {
        assertEquals(Signal.BUY, Signal.fromSentiment(71, 70, 30));
        assertEquals(Signal.HOLD, Signal.fromSentiment(70, 70, 30));
        assertEquals(Signal.HOLD, Signal.fromSentiment(30, 70, 30));
        assertEquals(Signal.SELL, Signal.fromSentiment(29, 70, 30));
    }
}
