package com.vexen.authentication;

/** Purpose of a signed token. */
public enum TokenType {
    /** Short-lived, presented to authenticate requests. */
    ACCESS,
    /** Long-lived, exchanged for a new token pair. */
    REFRESH
}
