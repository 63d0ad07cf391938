package com.ybds.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ybds.transport.ws.Hub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * HTTP API handlers for Undertow.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Hub hub;

    public ApiHandlers(Hub hub) {
        this.hub = hub;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");

        try {
            ObjectNode health = MAPPER.createObjectNode();
            health.put("status", hub.isClosed() ? "stopping" : "ok");
            health.put("ts", Instant.now().toString());
            health.put("connections", hub.clientCount());
            health.put("topics", hub.topicCount());
            exchange.getResponseSender().send(health.toString(), StandardCharsets.UTF_8);
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send(
                "{\"status\":\"error\",\"error\":\"" + e.getClass().getSimpleName() + "\"}", StandardCharsets.UTF_8);
        }
    }
}
