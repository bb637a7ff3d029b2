package com.marketpipe.strategy;

/**
 * An order could not be delivered to the order sink. Ends the engine's run.
 */
public class OrderTransmitException extends Exception {

    public OrderTransmitException(String message) {
        super(message);
    }

    public OrderTransmitException(String message, Throwable cause) {
        super(message, cause);
    }
}
