package com.ybds.transport.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ybds.auth.AuthenticationException;
import com.ybds.auth.ConnectionAuthenticator;
import com.ybds.auth.Identity;
import com.ybds.infrastructure.metrics.HubMetrics;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xnio.IoUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * HTTP entry point for WebSocket connections.
 *
 * Authenticates the upgrade request before the handshake: a request that is not an
 * upgrade gets 426, a failed authentication gets 401 and never reaches the hub. On
 * success the handshake completes and the channel is attached to the {@link Hub}.
 */
public final class WsUpgradeHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(WsUpgradeHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AttachmentKey<Identity> IDENTITY = AttachmentKey.create(Identity.class);

    private final ConnectionAuthenticator authenticator;
    private final Hub hub;
    private final HubMetrics metrics;
    private final WebSocketProtocolHandshakeHandler handshake;

    public WsUpgradeHandler(ConnectionAuthenticator authenticator, Hub hub, HubMetrics metrics) {
        this.authenticator = authenticator;
        this.hub = hub;
        this.metrics = metrics != null ? metrics : HubMetrics.NOOP;
        this.handshake = new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                connect(exchange.getAttachment(IDENTITY), channel);
            }
        });
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String upgrade = exchange.getRequestHeaders().getFirst(Headers.UPGRADE);
        if (upgrade == null || !"websocket".equalsIgnoreCase(upgrade)) {
            exchange.getResponseHeaders().put(Headers.UPGRADE, "websocket");
            sendError(exchange, StatusCodes.UPGRADE_REQUIRED, "WebSocket upgrade required");
            return;
        }

        Identity identity;
        try {
            identity = authenticator.authenticate(new UndertowRequestContext(exchange));
        } catch (AuthenticationException e) {
            metrics.recordAuthFailure();
            log.warn("[WsHub] Upgrade rejected from {}: {}", exchange.getSourceAddress(), e.getMessage());
            sendError(exchange, StatusCodes.UNAUTHORIZED, e.getMessage());
            return;
        }

        exchange.putAttachment(IDENTITY, identity);
        handshake.handleRequest(exchange);
    }

    private void connect(Identity identity, WebSocketChannel channel) {
        if (identity == null) {
            log.error("[WsHub] Handshake completed without identity from {}", channel.getSourceAddress());
            IoUtils.safeClose(channel);
            return;
        }

        Client client;
        try {
            client = hub.attach(identity, new UndertowTransport(channel));
        } catch (RuntimeException e) {
            log.warn("[WsHub] Cannot attach connection from {}: {}", channel.getSourceAddress(), e.getMessage());
            IoUtils.safeClose(channel);
            return;
        }

        long textLimit = hub.getConfig().maxFrameBytes() * 4L;
        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                client.onText(message.getData());
            }

            @Override
            protected void onFullPongMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                super.onFullPongMessage(ch, message);
                client.onPong();
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                client.onPeerClosed();
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                client.onTransportError(error);
                super.onError(ch, error);
            }

            // Memory backstop only; the byte limit itself is enforced by the client
            @Override
            protected long getMaxTextBufferSize() {
                return textLimit;
            }
        });
        channel.getCloseSetter().set(ch -> client.onPeerClosed());
        channel.resumeReceives();
    }

    private static void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("success", false);
        body.put("error", message);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }
}
