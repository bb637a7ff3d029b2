package com.marketpipe.core.shm;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Fixed byte layout of a shared price segment.
 * <pre>
 *   entry i at offset i * 18
 *   [0..10)  symbol, ASCII, NUL padded
 *   [10..18) price, IEEE-754 double, little-endian
 * </pre>
 * There is no header; the entry count is the segment size divided by {@link #ENTRY_BYTES}.
 */
public final class SegmentLayout {

    public static final int SYMBOL_BYTES = 10;
    public static final int PRICE_BYTES = Double.BYTES;
    public static final int ENTRY_BYTES = SYMBOL_BYTES + PRICE_BYTES;
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private SegmentLayout() {}

    public static long segmentSize(int entries) {
        return (long) entries * ENTRY_BYTES;
    }

    public static int symbolOffset(int index) {
        return index * ENTRY_BYTES;
    }

    public static int priceOffset(int index) {
        return index * ENTRY_BYTES + SYMBOL_BYTES;
    }

    /**
     * @throws IllegalArgumentException if the symbol is empty, not ASCII, or longer than the field
     */
    public static void checkSymbol(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("Symbol must not be empty");
        }
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(symbol)) {
            throw new IllegalArgumentException("Symbol must be ASCII: " + symbol);
        }
        if (symbol.length() > SYMBOL_BYTES) {
            throw new IllegalArgumentException(
                "Symbol '" + symbol + "' exceeds " + SYMBOL_BYTES + " bytes");
        }
        if (symbol.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Symbol must not contain NUL");
        }
    }

    static void writeEntry(ByteBuffer buffer, int index, String symbol, double price) {
        byte[] field = new byte[SYMBOL_BYTES];
        byte[] ascii = symbol.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(ascii, 0, field, 0, ascii.length);
        buffer.put(symbolOffset(index), field);
        buffer.putDouble(priceOffset(index), price);
    }

    static String readSymbol(ByteBuffer buffer, int index) {
        byte[] field = new byte[SYMBOL_BYTES];
        buffer.get(symbolOffset(index), field);
        int len = 0;
        while (len < SYMBOL_BYTES && field[len] != 0) {
            len++;
        }
        return new String(field, 0, len, StandardCharsets.US_ASCII);
    }
}
