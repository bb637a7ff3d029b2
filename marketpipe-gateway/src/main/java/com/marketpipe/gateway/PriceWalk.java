package com.marketpipe.gateway;

import com.marketpipe.core.model.PriceTick;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Random-walk price generator for the tracked symbols.
 * Each step moves every price by a uniform delta in [-0.5, 0.5), floored at 0.01.
 */
public class PriceWalk {

    public static final double MAX_STEP = 0.5;
    public static final double MIN_PRICE = 0.01;
    private static final double INITIAL_LOW = 100.0;
    private static final double INITIAL_HIGH = 300.0;

    private final Map<String, Double> prices = new LinkedHashMap<>();
    private final Random random;

    public PriceWalk(List<String> symbols, Random random) {
        this.random = random;
        for (String symbol : symbols) {
            prices.put(symbol, INITIAL_LOW + random.nextDouble() * (INITIAL_HIGH - INITIAL_LOW));
        }
    }

    /**
     * Start from explicit prices instead of random ones.
     */
    public PriceWalk(Map<String, Double> startPrices, Random random) {
        this.random = random;
        this.prices.putAll(startPrices);
    }

    /**
     * Advance every symbol one step and return the new prices in symbol order.
     */
    public synchronized List<PriceTick> next() {
        List<PriceTick> ticks = new ArrayList<>(prices.size());
        for (Map.Entry<String, Double> entry : prices.entrySet()) {
            double change = (random.nextDouble() * 2.0 - 1.0) * MAX_STEP;
            double price = Math.max(MIN_PRICE, entry.getValue() + change);
            entry.setValue(price);
            ticks.add(new PriceTick(entry.getKey(), price));
        }
        return ticks;
    }

    public synchronized double current(String symbol) {
        Double price = prices.get(symbol);
        if (price == null) {
            throw new IllegalArgumentException("Unknown symbol: " + symbol);
        }
        return price;
    }
}
