package com.marketpipe.core.wire;

import java.nio.charset.StandardCharsets;

/**
 * A frame (or a record inside one) could not be parsed.
 * Callers log and skip the offending unit; the stream continues.
 */
public class MalformedFrameException extends RuntimeException {

    private final String rawPayload;

    public MalformedFrameException(String message, String rawPayload) {
        super(message + ": '" + rawPayload + "'");
        this.rawPayload = rawPayload;
    }

    public MalformedFrameException(String message, byte[] rawPayload, Throwable cause) {
        super(message + ": '" + new String(rawPayload, StandardCharsets.UTF_8) + "'", cause);
        this.rawPayload = new String(rawPayload, StandardCharsets.UTF_8);
    }

    public String getRawPayload() {
        return rawPayload;
    }
}
