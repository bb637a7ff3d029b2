package com.marketpipe.core.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpipe.core.model.OrderIntent;

import java.io.IOException;

/**
 * JSON body of an order frame.
 */
public final class OrderIntentCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OrderIntentCodec() {}

    public static byte[] encode(OrderIntent intent) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(intent);
    }

    /**
     * @throws IOException if the frame is not a valid order JSON object (the JSON literal
     *                     {@code null} included)
     */
    public static OrderIntent decode(byte[] frame) throws IOException {
        OrderIntent intent = MAPPER.readValue(frame, OrderIntent.class);
        if (intent == null) {
            throw new IOException("Order frame holds no JSON object");
        }
        return intent;
    }
}
