package com.marketpipe.gateway;

import com.marketpipe.core.wire.SentimentCodec;

import java.util.Random;

/**
 * Uniform random sentiment scores in [0, 100].
 */
public class SentimentSource {

    private final Random random;

    public SentimentSource(Random random) {
        this.random = random;
    }

    public int next() {
        return SentimentCodec.MIN_SCORE + random.nextInt(SentimentCodec.MAX_SCORE - SentimentCodec.MIN_SCORE + 1);
    }
}
