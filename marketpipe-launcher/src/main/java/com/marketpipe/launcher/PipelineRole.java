package com.marketpipe.launcher;

import com.marketpipe.gateway.GatewayApp;
import com.marketpipe.orderbook.OrderBookApp;
import com.marketpipe.ordermanager.OrderManagerApp;
import com.marketpipe.strategy.StrategyApp;

/**
 * The pipeline's processes, in start order.
 */
public enum PipelineRole {
    GATEWAY("gateway", GatewayApp.class),
    ORDER_MANAGER("ordermanager", OrderManagerApp.class),
    ORDER_BOOK("orderbook", OrderBookApp.class),
    STRATEGY("strategy", StrategyApp.class);

    private final String displayName;
    private final Class<?> mainClass;

    PipelineRole(String displayName, Class<?> mainClass) {
        this.displayName = displayName;
        this.mainClass = mainClass;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getMainClassName() {
        return mainClass.getName();
    }
}
