package com.ybds.transport.ws;

import com.ybds.util.Env;

import java.time.Duration;

/**
 * Tunables for the hub and its connections.
 */
public record HubConfig(
    Duration cleanupInterval,       // how often the liveness sweep runs
    Duration inactivityTimeout,     // silence after which the sweep evicts a client
    int maxFrameBytes,              // largest inbound frame accepted
    Duration heartbeatInterval,     // ping period, must be below readTimeout
    Duration readTimeout,           // max gap between inbound frames or pongs
    Duration writeTimeout,          // deadline for a single transport write
    int outboundCapacity,           // per-client outbound queue bound
    int requestQueueCapacity        // hub request queue bound
) {

    public HubConfig {
        requirePositive(cleanupInterval, "cleanupInterval");
        requirePositive(inactivityTimeout, "inactivityTimeout");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(writeTimeout, "writeTimeout");
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        if (outboundCapacity <= 0) {
            throw new IllegalArgumentException("outboundCapacity must be positive");
        }
        if (requestQueueCapacity <= 0) {
            throw new IllegalArgumentException("requestQueueCapacity must be positive");
        }
        if (heartbeatInterval.compareTo(readTimeout) >= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be shorter than readTimeout");
        }
    }

    public static HubConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults overridden by WS_* environment variables (durations in milliseconds).
     */
    public static HubConfig fromEnv() {
        HubConfig d = defaults();
        return builder()
            .cleanupInterval(Env.getMillis("WS_CLEANUP_INTERVAL_MS", d.cleanupInterval()))
            .inactivityTimeout(Env.getMillis("WS_INACTIVITY_TIMEOUT_MS", d.inactivityTimeout()))
            .maxFrameBytes(Env.getInt("WS_MAX_FRAME_BYTES", d.maxFrameBytes()))
            .heartbeatInterval(Env.getMillis("WS_HEARTBEAT_INTERVAL_MS", d.heartbeatInterval()))
            .readTimeout(Env.getMillis("WS_READ_TIMEOUT_MS", d.readTimeout()))
            .writeTimeout(Env.getMillis("WS_WRITE_TIMEOUT_MS", d.writeTimeout()))
            .outboundCapacity(Env.getInt("WS_OUTBOUND_CAPACITY", d.outboundCapacity()))
            .requestQueueCapacity(Env.getInt("WS_REQUEST_QUEUE_CAPACITY", d.requestQueueCapacity()))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public static final class Builder {
        private Duration cleanupInterval = Duration.ofMinutes(10);
        private Duration inactivityTimeout = Duration.ofMinutes(30);
        private int maxFrameBytes = 512 * 1024;
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(54);
        private Duration writeTimeout = Duration.ofSeconds(10);
        private int outboundCapacity = 256;
        private int requestQueueCapacity = 65_536;

        private Builder() {}

        public Builder cleanupInterval(Duration v) { this.cleanupInterval = v; return this; }
        public Builder inactivityTimeout(Duration v) { this.inactivityTimeout = v; return this; }
        public Builder maxFrameBytes(int v) { this.maxFrameBytes = v; return this; }
        public Builder heartbeatInterval(Duration v) { this.heartbeatInterval = v; return this; }
        public Builder readTimeout(Duration v) { this.readTimeout = v; return this; }
        public Builder writeTimeout(Duration v) { this.writeTimeout = v; return this; }
        public Builder outboundCapacity(int v) { this.outboundCapacity = v; return this; }
        public Builder requestQueueCapacity(int v) { this.requestQueueCapacity = v; return this; }

        public HubConfig build() {
            return new HubConfig(cleanupInterval, inactivityTimeout, maxFrameBytes, heartbeatInterval,
                readTimeout, writeTimeout, outboundCapacity, requestQueueCapacity);
        }
    }
}
