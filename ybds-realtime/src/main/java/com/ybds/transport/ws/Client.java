package com.ybds.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ybds.auth.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side state of one live connection.
 *
 * The inbound side is driven by transport callbacks ({@link #onText}, {@link #onPong},
 * {@link #onTransportError}, {@link #onPeerClosed}); the outbound side is
 * {@link #pumpOutbound()}, run on its own thread. The two meet only through the
 * {@link OutboundQueue} and the activity timestamp.
 *
 * {@code topics} is written exclusively by the {@link Hub} while it holds its write lock.
 */
public final class Client {
    private static final Logger log = LoggerFactory.getLogger(Client.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();
    private static final byte NEWLINE = '\n';

    private final String id;
    private final String userId;
    private final Set<String> roles;
    private final Hub hub;
    private final Transport transport;
    private final HubConfig config;
    private final OutboundQueue outbound;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.ACTIVE);
    private final Instant connectedAt;
    private volatile Instant lastActivity;  // volatile: written by I/O threads, read by the sweep and write loop
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();

    Client(Identity identity, Hub hub, Transport transport, HubConfig config) {
        this.id = newId();
        this.userId = identity.userId();
        this.roles = identity.roles();
        this.hub = hub;
        this.transport = transport;
        this.config = config;
        this.outbound = new OutboundQueue(config.outboundCapacity());
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    static String newId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    // ═══════════════════════════════════════════════════════════════
    // INBOUND
    // ═══════════════════════════════════════════════════════════════

    /**
     * Handle one inbound text frame.
     */
    public void onText(String text) {
        touch();
        if (state.get() != ClientState.ACTIVE) {
            return;
        }

        if (exceedsFrameLimit(text)) {
            hub.metrics().recordProtocolError("OVERSIZED");
            log.warn("[WsHub] Oversized frame from client {} (user={}), limit {} bytes",
                id, userId, config.maxFrameBytes());
            close(CloseReason.OVERSIZED_FRAME);
            return;
        }

        Envelope envelope;
        try {
            envelope = Envelope.parse(text);
        } catch (JsonProcessingException e) {
            protocolError("MALFORMED", e.getOriginalMessage());
            return;
        }
        if (envelope == null || envelope.type() == null || envelope.type().isEmpty()) {
            protocolError("MISSING_TYPE", "envelope has no type");
            return;
        }

        switch (envelope.type()) {
            case Envelope.SUBSCRIBE -> handleSubscribe(envelope);
            case Envelope.UNSUBSCRIBE -> handleUnsubscribe(envelope);
            default -> hub.dispatch(this, envelope);
        }
    }

    /**
     * Liveness response from the peer.
     */
    public void onPong() {
        touch();
    }

    public void onTransportError(Throwable error) {
        if (state.get() == ClientState.ACTIVE) {
            log.warn("[WsHub] Transport error on client {} (user={}): {}", id, userId, error.toString());
        }
        close(CloseReason.TRANSPORT_ERROR);
    }

    public void onPeerClosed() {
        close(CloseReason.PEER_CLOSED);
    }

    private void handleSubscribe(Envelope envelope) {
        if (!envelope.hasTopic()) {
            protocolError("MISSING_TOPIC", "subscribe without topic");
            return;
        }
        String topic = envelope.topic();

        if (!hub.canSubscribe(this, topic)) {
            hub.metrics().recordSubscription(false);
            log.debug("[WsHub] Subscription denied: client={} user={} topic={}", id, userId, topic);
            send(ControlReplies.subscriptionStatus(topic, false));
            return;
        }

        hub.subscribe(this, topic).whenComplete((joined, error) -> {
            boolean success = error == null && Boolean.TRUE.equals(joined);
            if (error != null) {
                log.warn("[WsHub] Subscribe failed: client={} topic={}: {}", id, topic, error.toString());
            }
            hub.metrics().recordSubscription(success);
            send(ControlReplies.subscriptionStatus(topic, success));
        });
    }

    private void handleUnsubscribe(Envelope envelope) {
        if (!envelope.hasTopic()) {
            protocolError("MISSING_TOPIC", "unsubscribe without topic");
            return;
        }
        String topic = envelope.topic();

        hub.unsubscribe(this, topic).whenComplete((left, error) -> {
            if (error != null) {
                log.warn("[WsHub] Unsubscribe failed: client={} topic={}: {}", id, topic, error.toString());
            }
            send(ControlReplies.unsubscribed(topic));
        });
    }

    private void protocolError(String kind, String detail) {
        hub.metrics().recordProtocolError(kind);
        log.debug("[WsHub] Ignoring {} frame from client {}: {}", kind, id, detail);
    }

    private boolean exceedsFrameLimit(String text) {
        int limit = config.maxFrameBytes();
        if (text.length() > limit) {
            return true;
        }
        if ((long) text.length() * 3 <= limit) {
            return false;
        }
        return text.getBytes(StandardCharsets.UTF_8).length > limit;
    }

    // ═══════════════════════════════════════════════════════════════
    // OUTBOUND
    // ═══════════════════════════════════════════════════════════════

    /**
     * Enqueue a frame for this client without blocking. A full queue evicts the client.
     *
     * @return true if the frame was queued
     */
    public boolean send(byte[] frame) {
        if (outbound.offer(frame)) {
            return true;
        }
        if (!outbound.isClosed()) {
            hub.evict(this);
        }
        return false;
    }

    /**
     * Write loop: flushes the outbound queue, sends heartbeats and enforces the read
     * deadline. Returns once the queue is closed or the transport fails.
     */
    public void pumpOutbound() {
        long heartbeatNanos = config.heartbeatInterval().toNanos();
        long nextPing = System.nanoTime() + heartbeatNanos;

        try {
            while (true) {
                long now = System.nanoTime();
                if (now - nextPing >= 0) {
                    if (readDeadlineExceeded()) {
                        log.info("[WsHub] Read deadline exceeded for client {} (user={})", id, userId);
                        close(CloseReason.READ_TIMEOUT);
                        return;
                    }
                    transport.sendPing(config.writeTimeout());
                    nextPing = now + heartbeatNanos;
                }

                List<byte[]> batch = outbound.pollAll(nextPing - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (batch == null) {
                    sendCloseFrame();
                    return;
                }
                if (!batch.isEmpty()) {
                    transport.sendText(coalesce(batch), config.writeTimeout());
                }
            }
        } catch (IOException e) {
            log.debug("[WsHub] Write failed for client {}: {}", id, e.getMessage());
            close(CloseReason.TRANSPORT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close(CloseReason.SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("[WsHub] Write loop crashed for client {}", id, e);
            close(CloseReason.TRANSPORT_ERROR);
        } finally {
            transport.close();
        }
    }

    private void sendCloseFrame() {
        try {
            transport.sendClose(config.writeTimeout());
        } catch (IOException e) {
            log.debug("[WsHub] Close frame not delivered to client {}: {}", id, e.getMessage());
        }
    }

    private boolean readDeadlineExceeded() {
        return Duration.between(lastActivity, Instant.now()).compareTo(config.readTimeout()) > 0;
    }

    static byte[] coalesce(List<byte[]> batch) {
        if (batch.size() == 1) {
            return batch.get(0);
        }
        int total = batch.size() - 1;
        for (byte[] frame : batch) {
            total += frame.length;
        }
        byte[] out = new byte[total];
        int pos = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (i > 0) {
                out[pos++] = NEWLINE;
            }
            byte[] frame = batch.get(i);
            System.arraycopy(frame, 0, out, pos, frame.length);
            pos += frame.length;
        }
        return out;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Leave the hub: request unregistration and release the transport. Only the
     * first call has any effect.
     */
    public void close(CloseReason reason) {
        if (!beginClose(reason)) {
            return;
        }
        log.debug("[WsHub] Closing client {} (user={}, reason={})", id, userId, reason);
        hub.unregister(this);
        transport.close();
    }

    boolean beginClose(CloseReason reason) {
        // Reason first, so a closing client always has one
        if (!closeReason.compareAndSet(null, reason)) {
            return false;
        }
        state.compareAndSet(ClientState.ACTIVE, ClientState.CLOSING);
        return true;
    }

    void markClosed() {
        state.set(ClientState.CLOSED);
    }

    /**
     * Refresh the activity timestamp. A client that has started closing stays stale,
     * so the sweep can retry an unregistration that never reached the hub.
     */
    void touch() {
        if (!isClosing()) {
            lastActivity = Instant.now();
        }
    }

    boolean isClosing() {
        return closeReason.get() != null;
    }

    OutboundQueue outbound() {
        return outbound;
    }

    void addTopic(String topic) {
        topics.add(topic);
    }

    boolean removeTopic(String topic) {
        return topics.remove(topic);
    }

    void clearTopics() {
        topics.clear();
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCESSORS
    // ═══════════════════════════════════════════════════════════════

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(String... candidates) {
        for (String role : candidates) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Live read-only view of the client's subscriptions.
     */
    public Set<String> getTopics() {
        return Collections.unmodifiableSet(topics);
    }

    public boolean isSubscribed(String topic) {
        return topics.contains(topic);
    }

    public ClientState getState() {
        return state.get();
    }

    public CloseReason getCloseReason() {
        return closeReason.get();
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public String getRemoteAddress() {
        return transport.remoteAddress();
    }

    @Override
    public String toString() {
        return "Client{id=" + id + ", user=" + userId + ", roles=" + roles + ", state=" + state.get() + "}";
    }
}
