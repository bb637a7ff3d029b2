package com.marketpipe.core.wire;

import com.marketpipe.core.model.PriceTick;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Price channel payloads.
 * <p>
 * A tick batch goes out as one frame per symbol ({@code AAPL,150.23*MSFT,310.45*}),
 * which is byte-for-byte what older senders produced by joining records with the
 * frame delimiter. Decoded frames are still split on the delimiter so a frame that
 * was assembled by some other reader (one that kept the delimiter inside) stays usable.
 */
public final class PriceTickCodec {

    private static final String RECORD_SPLIT = Pattern.quote(String.valueOf((char) FrameCodec.DELIMITER));

    private PriceTickCodec() {}

    /**
     * Encode a batch as consecutive frames, ready for a single write.
     */
    public static byte[] encodeBatch(List<PriceTick> ticks) {
        List<byte[]> payloads = new ArrayList<>(ticks.size());
        for (PriceTick tick : ticks) {
            payloads.add(tick.format().getBytes(StandardCharsets.UTF_8));
        }
        return FrameCodec.encodeAll(payloads);
    }

    /**
     * Split a decoded frame into its {@code SYMBOL,PRICE} records. Empty records are dropped.
     */
    public static List<String> splitRecords(byte[] frame) {
        String text = new String(frame, StandardCharsets.UTF_8);
        List<String> records = new ArrayList<>();
        for (String record : text.split(RECORD_SPLIT)) {
            if (!record.isBlank()) {
                records.add(record);
            }
        }
        return records;
    }
}
