package com.ybds.service.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ybds.domain.common.EventType;
import com.ybds.transport.ws.RealtimePublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event Service.
 * Serializes domain events once and hands the bytes to the realtime publisher.
 * Delivery is best-effort: the return value is the number of connections reached.
 *
 * Wire shape: {@code {"type":..,"topic":..,"payload":..,"ts":..,"seq":..}}
 * ({@code topic} only for topic-scoped events).
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final RealtimePublisher publisher;
    private final AtomicLong seq = new AtomicLong(0);

    public EventService(RealtimePublisher publisher) {
        this.publisher = publisher;
    }

    // ═══════════════════════════════════════════════════════════════
    // GLOBAL EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit a GLOBAL event (broadcast to every connection).
     */
    public int emitGlobal(EventType type, Object payloadPojo) {
        int delivered = publisher.publishToAll(encode(type, null, payloadPojo));
        log.debug("Event emitted: type={}, scope=GLOBAL, delivered={}", type, delivered);
        return delivered;
    }

    // ═══════════════════════════════════════════════════════════════
    // SCOPED EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit to subscribers of one topic.
     */
    public int emitTopic(EventType type, String topic, Object payloadPojo) {
        int delivered = publisher.publishToTopic(topic, encode(type, topic, payloadPojo));
        log.debug("Event emitted: type={}, topic={}, delivered={}", type, topic, delivered);
        return delivered;
    }

    /**
     * Emit a USER-scoped event (every connection of the user).
     */
    public int emitUser(EventType type, String userId, Object payloadPojo) {
        int delivered = publisher.publishToUser(userId, encode(type, null, payloadPojo));
        log.debug("Event emitted: type={}, userId={}, delivered={}", type, userId, delivered);
        return delivered;
    }

    public int emitRole(EventType type, String role, Object payloadPojo) {
        int delivered = publisher.publishToRole(role, encode(type, null, payloadPojo));
        log.debug("Event emitted: type={}, role={}, delivered={}", type, role, delivered);
        return delivered;
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    byte[] encode(EventType type, String topic, Object payloadPojo) {
        ObjectNode event = MAPPER.createObjectNode();
        event.put("type", type.wireName());
        if (topic != null) {
            event.put("topic", topic);
        }
        event.set("payload", MAPPER.valueToTree(payloadPojo));
        event.put("ts", Instant.now().toString());
        event.put("seq", seq.incrementAndGet());
        try {
            return MAPPER.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload not serializable: " + type, e);
        }
    }

    public long lastSeq() {
        return seq.get();
    }
}
