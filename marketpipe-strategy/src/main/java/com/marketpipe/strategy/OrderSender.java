package com.marketpipe.strategy;

import com.marketpipe.core.model.OrderIntent;

import java.io.Closeable;

/**
 * Outbound path for trade intents.
 */
public interface OrderSender extends Closeable {

    /**
     * Deliver one order. Returns only once the order has been handed to the transport.
     */
    void send(OrderIntent intent) throws OrderTransmitException;

    @Override
    void close();
}
