package com.marketpipe.core.wire;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SentimentCodecTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parsesDecimalScore() {
        assertEquals(80, SentimentCodec.parse(bytes("80")));
        assertEquals(0, SentimentCodec.parse(bytes(" 0\n")));
        assertEquals(100, SentimentCodec.parse(bytes("100")));
    }

    @Test
    void rejectsNonNumericAndOutOfRange() {
        MalformedFrameException e = assertThrows(MalformedFrameException.class,
            () -> SentimentCodec.parse(bytes("bullish")));
        assertEquals("bullish", e.getRawPayload());

        assertThrows(MalformedFrameException.class, () -> SentimentCodec.parse(bytes("")));
        assertThrows(MalformedFrameException.class, () -> SentimentCodec.parse(bytes("101")));
        assertThrows(MalformedFrameException.class, () -> SentimentCodec.parse(bytes("-1")));
    }

    @Test
    void encodesAsAsciiDigits() {
        assertArrayEquals(bytes("7"), SentimentCodec.encode(7));
        assertThrows(MalformedFrameException.class, () -> SentimentCodec.encode(250));
    }
}
