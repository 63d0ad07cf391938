package com.ybds.transport.ws;

/**
 * Connection lifecycle. CONNECTING covers authentication only; a {@link Client}
 * object is born ACTIVE and only ever moves forward.
 */
public enum ClientState {
    CONNECTING,
    ACTIVE,
    CLOSING,
    CLOSED
}
