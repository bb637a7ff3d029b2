package com.marketpipe.core.wire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpipe.core.model.OrderIntent;
import com.marketpipe.core.model.OrderSide;
import com.marketpipe.core.model.Position;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class OrderIntentCodecTest {

    @Test
    void writesWireFieldNames() throws IOException {
        OrderIntent intent = new OrderIntent("AAPL", OrderSide.BUY, 10, 151.25, 80,
            151.1, 150.2, Position.FLAT, Position.LONG, "Both price and news signals indicate BUY", 1.7e9);

        JsonNode json = new ObjectMapper().readTree(OrderIntentCodec.encode(intent));

        assertEquals("AAPL", json.get("symbol").asText());
        assertEquals("BUY", json.get("side").asText());
        assertEquals(10, json.get("quantity").asInt());
        assertEquals(80, json.get("sentiment").asInt());
        assertEquals(151.1, json.get("short_ma").asDouble());
        assertEquals(150.2, json.get("long_ma").asDouble());
        assertEquals("FLAT", json.get("position_before").asText());
        assertEquals("LONG", json.get("position_after").asText());
        assertTrue(json.has("timestamp"));
        assertTrue(json.has("reason"));
        assertEquals(11, json.size());
    }

    @Test
    void decodesForeignOrderJson() throws IOException {
        String json = "{\"symbol\":\"MSFT\",\"side\":\"SELL\",\"quantity\":5,\"price\":300.0,"
            + "\"sentiment\":12,\"short_ma\":299.0,\"long_ma\":301.0,\"position_before\":\"LONG\","
            + "\"position_after\":\"SHORT\",\"reason\":\"r\",\"timestamp\":1.5,\"extra\":true}";

        OrderIntent intent = OrderIntentCodec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(OrderSide.SELL, intent.side());
        assertEquals(Position.SHORT, intent.positionAfter());
        assertEquals(299.0, intent.shortMa());
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(IOException.class,
            () -> OrderIntentCodec.decode("{not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void rejectsJsonNull() {
        assertThrows(IOException.class,
            () -> OrderIntentCodec.decode("null".getBytes(StandardCharsets.UTF_8)));
    }
}
