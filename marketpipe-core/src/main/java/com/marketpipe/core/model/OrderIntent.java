package com.marketpipe.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trade intent emitted by the decision engine to the order sink.
 * Serialized as one JSON object per frame; field names are the wire contract.
 *
 * @param timestamp epoch seconds with fractional part
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderIntent(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("side") OrderSide side,
    @JsonProperty("quantity") int quantity,
    @JsonProperty("price") double price,
    @JsonProperty("sentiment") int sentiment,
    @JsonProperty("short_ma") double shortMa,
    @JsonProperty("long_ma") double longMa,
    @JsonProperty("position_before") Position positionBefore,
    @JsonProperty("position_after") Position positionAfter,
    @JsonProperty("reason") String reason,
    @JsonProperty("timestamp") double timestamp
) {
    public String summary() {
        return String.format("%s %d %s @ %.2f (%s -> %s): %s",
            side, quantity, symbol, price, positionBefore, positionAfter, reason);
    }
}
