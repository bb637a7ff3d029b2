package com.marketpipe.strategy;

/**
 * Directional vote of a single input (price trend or news sentiment).
 */
public enum Signal {
    BUY,
    SELL,
    HOLD;

    /**
     * Short average above long average is bullish, below is bearish, equal is neutral.
     */
    public static Signal fromMovingAverages(double shortMa, double longMa) {
        if (shortMa > longMa) return BUY;
        if (shortMa < longMa) return SELL;
        return HOLD;
    }

    /**
     * Thresholds are exclusive: a score equal to either threshold is neutral.
     */
    public static Signal fromSentiment(int sentiment, int bullishThreshold, int bearishThreshold) {
        if (sentiment > bullishThreshold) return BUY;
        if (sentiment < bearishThreshold) return SELL;
        return HOLD;
    }
}
