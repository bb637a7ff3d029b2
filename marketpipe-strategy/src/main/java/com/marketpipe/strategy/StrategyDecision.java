package com.marketpipe.strategy;

import com.marketpipe.core.model.OrderSide;
import com.marketpipe.core.model.Position;

/**
 * Outcome of a strategy evaluation that calls for an order.
 */
public record StrategyDecision(
    OrderSide side,
    Position desiredPosition,
    String reason,
    double shortMa,
    double longMa
) {
}
