package com.ybds.service.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ybds.transport.ws.Client;
import com.ybds.transport.ws.Envelope;
import com.ybds.transport.ws.FallbackHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Application-level handler for client messages outside subscribe/unsubscribe.
 * Answers {@code ping} with {@code pong}; everything else is logged and dropped.
 */
public final class AppMessageHandler implements FallbackHandler {
    private static final Logger log = LoggerFactory.getLogger(AppMessageHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PING = "ping";
    static final String PONG = "pong";

    @Override
    public void handle(Client client, Envelope envelope) throws JsonProcessingException {
        if (PING.equals(envelope.type())) {
            ObjectNode pong = MAPPER.createObjectNode();
            pong.put("type", PONG);
            pong.put("ts", Instant.now().toString());
            client.send(MAPPER.writeValueAsBytes(pong));
            return;
        }
        log.debug("Unhandled message type '{}' from client {} (user={})",
            envelope.type(), client.getId(), client.getUserId());
    }
}
