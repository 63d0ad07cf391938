package com.ybds.transport.ws;

/**
 * Fire-and-forget publish API for the rest of the backend.
 *
 * Every method is safe to call concurrently from any thread and never blocks on a
 * slow consumer. The return value is the number of connections whose outbound
 * queue accepted the frame; delivery beyond that point is not acknowledged.
 */
public interface RealtimePublisher {

    int publishToTopic(String topic, byte[] message);

    int publishToAll(byte[] message);

    /**
     * Deliver to every live connection of the user (all devices).
     */
    int publishToUser(String userId, byte[] message);

    int publishToRole(String role, byte[] message);
}
