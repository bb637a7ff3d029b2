package com.marketpipe.strategy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriceHistoryTest {

    @Test
    void dropsOldestBeyondCapacity() {
        PriceHistory history = new PriceHistory(3);
        for (double p : new double[]{1, 2, 3, 4, 5}) {
            history.add(p);
        }

        assertEquals(List.of(3.0, 4.0, 5.0), history.toList());
        assertTrue(history.isFull());
    }

    @Test
    void meanUsesNewestPrices() {
        PriceHistory history = new PriceHistory(3);
        history.add(10);
        history.add(11);
        history.add(12);

        assertEquals(11.5, history.mean(2), 1e-12);
        assertEquals(11.0, history.mean(3), 1e-12);
    }

    @Test
    void meanNeedsEnoughPrices() {
        PriceHistory history = new PriceHistory(5);
        history.add(1);

        assertFalse(history.isFull());
        assertThrows(IllegalArgumentException.class, () -> history.mean(2));
        assertThrows(IllegalArgumentException.class, () -> history.mean(0));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new PriceHistory(0));
    }
}
