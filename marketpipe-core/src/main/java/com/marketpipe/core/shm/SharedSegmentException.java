package com.marketpipe.core.shm;

/**
 * A shared price segment could not be created, attached or interpreted.
 */
public class SharedSegmentException extends Exception {

    public SharedSegmentException(String message) {
        super(message);
    }

    public SharedSegmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
