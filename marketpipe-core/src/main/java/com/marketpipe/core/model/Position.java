package com.marketpipe.core.model;

/**
 * Net position held by the decision engine for its traded symbol.
 */
public enum Position {
    FLAT,
    LONG,
    SHORT
}
