package com.marketpipe.core.shm;

/**
 * No initialized segment exists under the requested name.
 */
public class SegmentNotFoundException extends SharedSegmentException {

    public SegmentNotFoundException(String message) {
        super(message);
    }

    public SegmentNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
