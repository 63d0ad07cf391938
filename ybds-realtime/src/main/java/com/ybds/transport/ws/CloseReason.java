package com.ybds.transport.ws;

/**
 * Why a client left the hub. The first reason recorded wins.
 */
public enum CloseReason {
    PEER_CLOSED,
    TRANSPORT_ERROR,
    OVERSIZED_FRAME,
    READ_TIMEOUT,
    SLOW_CONSUMER,
    INACTIVE,
    REJECTED,
    SERVER_CLOSED,
    SHUTDOWN
}
