package com.marketpipe.core.wire;

import java.nio.charset.StandardCharsets;

/**
 * News channel payloads: a decimal sentiment score in [0, 100].
 */
public final class SentimentCodec {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    private SentimentCodec() {}

    public static byte[] encode(int sentiment) {
        checkRange(sentiment, String.valueOf(sentiment));
        return String.valueOf(sentiment).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws MalformedFrameException if the frame is not an integer in range
     */
    public static int parse(byte[] frame) {
        String text = new String(frame, StandardCharsets.UTF_8).strip();
        int sentiment;
        try {
            sentiment = Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new MalformedFrameException("Could not parse sentiment", frame, e);
        }
        checkRange(sentiment, text);
        return sentiment;
    }

    private static void checkRange(int sentiment, String raw) {
        if (sentiment < MIN_SCORE || sentiment > MAX_SCORE) {
            throw new MalformedFrameException("Sentiment out of range [" + MIN_SCORE + "," + MAX_SCORE + "]", raw);
        }
    }
}
