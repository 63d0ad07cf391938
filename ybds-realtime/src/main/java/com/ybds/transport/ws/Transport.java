package com.ybds.transport.ws;

import java.io.IOException;
import java.time.Duration;

/**
 * Outbound side of one duplex connection. Each send blocks the calling write loop
 * until the frame is written or the deadline passes.
 */
public interface Transport {

    void sendText(byte[] utf8, Duration deadline) throws IOException;

    void sendPing(Duration deadline) throws IOException;

    /**
     * Send a normal-closure close frame.
     */
    void sendClose(Duration deadline) throws IOException;

    /**
     * Release the underlying connection. Idempotent; never throws.
     */
    void close();

    String remoteAddress();
}
