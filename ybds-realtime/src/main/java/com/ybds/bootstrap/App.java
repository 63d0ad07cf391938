package com.ybds.bootstrap;

import com.ybds.auth.AnonymousAuthenticator;
import com.ybds.auth.BearerTokenAuthenticator;
import com.ybds.auth.ConnectionAuthenticator;
import com.ybds.auth.HeaderTokenAuthenticator;
import com.ybds.auth.JwtService;
import com.ybds.auth.QueryTokenAuthenticator;
import com.ybds.domain.common.EventType;
import com.ybds.infrastructure.metrics.PrometheusHubMetrics;
import com.ybds.infrastructure.metrics.PrometheusMetricsHandler;
import com.ybds.service.core.AppMessageHandler;
import com.ybds.service.core.EventService;
import com.ybds.transport.http.ApiHandlers;
import com.ybds.transport.ws.Hub;
import com.ybds.transport.ws.HubConfig;
import com.ybds.transport.ws.SubscriptionPolicy;
import com.ybds.transport.ws.WsUpgradeHandler;
import com.ybds.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * YBDS realtime server.
 *
 * Routes:
 * - GET /api/ws      WebSocket upgrade (authenticated)
 * - GET /api/health  liveness and hub counters
 * - GET /metrics     Prometheus scrape endpoint
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== YBDS Realtime Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        String jwtSecret = Env.get("JWT_SECRET", "ybds-secret-key-change-in-production");
        long jwtExpirationMs = Env.getInt("JWT_EXPIRATION_HOURS", 24) * 3600000L;
        String authMode = Env.get("WS_AUTH_MODE", "query");
        String authHeader = Env.get("WS_AUTH_HEADER", "X-Auth-Token");
        String policyName = Env.get("WS_SUBSCRIPTION_POLICY", "permit-all");

        // ═══════════════════════════════════════════════════════════════
        // Auth
        // ═══════════════════════════════════════════════════════════════
        JwtService jwtService = new JwtService(jwtSecret, jwtExpirationMs);
        ConnectionAuthenticator authenticator = authenticator(authMode, authHeader, jwtService);
        log.info("✓ WebSocket authentication: {}", authMode);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusHubMetrics metrics = new PrometheusHubMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Hub
        // ═══════════════════════════════════════════════════════════════
        HubConfig hubConfig = HubConfig.fromEnv();
        Hub hub = new Hub(hubConfig, subscriptionPolicy(policyName), new AppMessageHandler(), metrics);
        hub.start();
        log.info("✓ Hub started (policy={}, heartbeat={}, readTimeout={})",
            policyName, hubConfig.heartbeatInterval(), hubConfig.readTimeout());

        EventService eventService = new EventService(hub);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(hub);
        WsUpgradeHandler wsHandler = new WsUpgradeHandler(authenticator, hub, metrics);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(cors(routes(api, wsHandler, metricsHandler, port)))
            .build();
        server.start();
        log.info("✓ HTTP server started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            hub.close();
            log.info("✓ Shutdown complete");
        }, "shutdown-hook"));

        Map<String, Object> startupPayload = new HashMap<>();
        startupPayload.put("message", "YBDS realtime started");
        startupPayload.put("features", List.of("JWT", "topics", "fan-out", "heartbeat"));
        eventService.emitGlobal(EventType.SYSTEM_STATUS, startupPayload);
    }

    static RoutingHandler routes(ApiHandlers api, WsUpgradeHandler wsHandler,
                                 PrometheusMetricsHandler metricsHandler, int port) {
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/ws", wsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "YBDS Realtime\n\n" +
                    "API:  GET /api/health, /metrics\n" +
                    "WS:   ws://localhost:" + port + "/api/ws?token=<jwt>\n"
                );
            });
    }

    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    static ConnectionAuthenticator authenticator(String mode, String headerName, JwtService jwtService) {
        return switch (mode.toLowerCase(Locale.ROOT)) {
            case "query" -> new QueryTokenAuthenticator(jwtService);
            case "bearer" -> new BearerTokenAuthenticator(jwtService);
            case "header" -> new HeaderTokenAuthenticator(headerName, jwtService);
            case "anonymous" -> {
                log.warn("WebSocket authentication disabled: every connection is anonymous");
                yield new AnonymousAuthenticator();
            }
            default -> throw new IllegalArgumentException("Unknown WS_AUTH_MODE: " + mode);
        };
    }

    static SubscriptionPolicy subscriptionPolicy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "permit-all" -> SubscriptionPolicy.permitAll();
            case "role-prefix" -> SubscriptionPolicy.rolePrefix();
            default -> throw new IllegalArgumentException("Unknown WS_SUBSCRIPTION_POLICY: " + name);
        };
    }

    private App() {}
}
