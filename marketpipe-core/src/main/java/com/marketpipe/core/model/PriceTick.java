package com.marketpipe.core.model;

import com.marketpipe.core.wire.MalformedFrameException;

import java.util.Locale;

/**
 * One price update for one symbol. Wire form: {@code SYMBOL,PRICE}.
 */
public record PriceTick(String symbol, double price) {

    public static final char FIELD_SEPARATOR = ',';

    /**
     * Parse a single {@code SYMBOL,PRICE} record.
     *
     * @throws MalformedFrameException if the record does not have exactly two fields
     *                                 or the price is not a finite number
     */
    public static PriceTick parse(String record) {
        String trimmed = record.trim();
        int comma = trimmed.indexOf(FIELD_SEPARATOR);
        if (comma <= 0 || comma != trimmed.lastIndexOf(FIELD_SEPARATOR)) {
            throw new MalformedFrameException("Expected SYMBOL,PRICE", record);
        }

        String symbol = trimmed.substring(0, comma).trim();
        String priceText = trimmed.substring(comma + 1).trim();
        if (symbol.isEmpty()) {
            throw new MalformedFrameException("Empty symbol", record);
        }

        double price;
        try {
            price = Double.parseDouble(priceText);
        } catch (NumberFormatException e) {
            throw new MalformedFrameException("Unparsable price", record);
        }
        if (!Double.isFinite(price)) {
            throw new MalformedFrameException("Price is not finite", record);
        }
        return new PriceTick(symbol, price);
    }

    /**
     * Wire form with the price rounded to two decimals.
     */
    public String format() {
        return String.format(Locale.ROOT, "%s%c%.2f", symbol, FIELD_SEPARATOR, price);
    }
}
