package com.marketpipe.core.model;

public enum OrderSide {
    BUY,
    SELL
}
