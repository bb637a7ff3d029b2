package com.marketpipe.strategy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Most recent prices of the traded symbol, oldest first. Holds at most {@code capacity}
 * entries; adding beyond that drops the oldest.
 */
public class PriceHistory {

    private final int capacity;
    private final Deque<Double> prices;

    public PriceHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.prices = new ArrayDeque<>(capacity);
    }

    public void add(double price) {
        prices.addLast(price);
        if (prices.size() > capacity) {
            prices.removeFirst();
        }
    }

    public int size() {
        return prices.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isFull() {
        return prices.size() >= capacity;
    }

    /**
     * Arithmetic mean of the newest {@code count} prices.
     *
     * @throws IllegalArgumentException if fewer than {@code count} prices are held
     */
    public double mean(int count) {
        if (count <= 0 || count > prices.size()) {
            throw new IllegalArgumentException("Cannot average last " + count + " of " + prices.size() + " prices");
        }
        double sum = 0;
        Iterator<Double> newestFirst = prices.descendingIterator();
        for (int i = 0; i < count; i++) {
            sum += newestFirst.next();
        }
        return sum / count;
    }

    public List<Double> toList() {
        return new ArrayList<>(prices);
    }

    public void clear() {
        prices.clear();
    }
}
