package com.ybds.transport.ws;

/**
 * Receives inbound envelopes outside the subscribe/unsubscribe vocabulary.
 * Runs on the hub loop thread, so implementations must not block; exceptions are
 * logged by the hub and never reach the connection.
 */
@FunctionalInterface
public interface FallbackHandler {

    void handle(Client client, Envelope envelope) throws Exception;

    static FallbackHandler noop() {
        return (client, envelope) -> { };
    }
}
