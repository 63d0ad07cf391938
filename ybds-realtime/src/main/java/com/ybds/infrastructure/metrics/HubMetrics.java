package com.ybds.infrastructure.metrics;

/**
 * Hub metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend.
 *
 * Key metrics:
 * - Active connections and connection churn (by close reason)
 * - Publish fan-out per scope
 * - Slow consumer evictions
 * - Subscription grants and denials
 * - Protocol errors and authentication failures
 */
public interface HubMetrics {

    /**
     * Record a client entering the registry.
     */
    void recordConnected();

    /**
     * Record a client leaving the registry.
     *
     * @param reason Close reason name (PEER_CLOSED, SLOW_CONSUMER, INACTIVE, ...)
     */
    void recordDisconnected(String reason);

    /**
     * Record one publish call.
     *
     * @param scope TOPIC, ALL, USER or ROLE
     * @param delivered Number of outbound queues that accepted the frame
     */
    void recordPublish(String scope, int delivered);

    /**
     * Record a client evicted because its outbound queue was full.
     */
    void recordSlowConsumer();

    /**
     * Record a subscribe attempt.
     *
     * @param granted Whether the client joined the topic
     */
    void recordSubscription(boolean granted);

    /**
     * Record an inbound frame that could not be interpreted.
     *
     * @param kind MALFORMED, MISSING_TYPE, MISSING_TOPIC or OVERSIZED
     */
    void recordProtocolError(String kind);

    /**
     * Record a rejected upgrade request.
     */
    void recordAuthFailure();

    /**
     * Record a hub request dropped because the request queue was full.
     */
    void recordRequestRejected();

    HubMetrics NOOP = new HubMetrics() {
        @Override public void recordConnected() {}
        @Override public void recordDisconnected(String reason) {}
        @Override public void recordPublish(String scope, int delivered) {}
        @Override public void recordSlowConsumer() {}
        @Override public void recordSubscription(boolean granted) {}
        @Override public void recordProtocolError(String kind) {}
        @Override public void recordAuthFailure() {}
        @Override public void recordRequestRejected() {}
    };
}
