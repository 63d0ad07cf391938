package com.ybds.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of HubMetrics.
 *
 * Metrics are exposed at the /metrics endpoint through {@link PrometheusMetricsHandler}.
 *
 * Key Metrics:
 * - ws_connections_active - Clients currently registered
 * - ws_connections_total - Clients ever registered
 * - ws_disconnections_total{reason} - Clients removed, by close reason
 * - ws_messages_published_total{scope} - Publish calls
 * - ws_frames_delivered_total{scope} - Frames accepted by outbound queues
 * - ws_slow_consumer_evictions_total - Clients dropped for a full outbound queue
 * - ws_subscriptions_total{result} - granted / denied
 * - ws_protocol_errors_total{kind} - Malformed inbound frames
 * - ws_auth_failures_total - Rejected upgrade requests
 * - ws_hub_request_rejections_total - Requests dropped on a full hub queue
 */
public class PrometheusHubMetrics implements HubMetrics {

    private final CollectorRegistry registry;

    private final Gauge activeConnections;
    private final Counter connections;
    private final Counter disconnections;
    private final Counter published;
    private final Counter delivered;
    private final Counter slowConsumers;
    private final Counter subscriptions;
    private final Counter protocolErrors;
    private final Counter authFailures;
    private final Counter requestRejections;

    public PrometheusHubMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusHubMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeConnections = Gauge.build()
            .name("ws_connections_active")
            .help("Clients currently registered with the hub")
            .register(registry);

        this.connections = Counter.build()
            .name("ws_connections_total")
            .help("Total number of clients registered")
            .register(registry);

        this.disconnections = Counter.build()
            .name("ws_disconnections_total")
            .help("Total number of clients removed from the hub")
            .labelNames("reason")
            .register(registry);

        this.published = Counter.build()
            .name("ws_messages_published_total")
            .help("Total number of publish calls")
            .labelNames("scope")
            .register(registry);

        this.delivered = Counter.build()
            .name("ws_frames_delivered_total")
            .help("Total number of frames accepted by client outbound queues")
            .labelNames("scope")
            .register(registry);

        this.slowConsumers = Counter.build()
            .name("ws_slow_consumer_evictions_total")
            .help("Total number of clients evicted for a saturated outbound queue")
            .register(registry);

        this.subscriptions = Counter.build()
            .name("ws_subscriptions_total")
            .help("Total number of subscribe attempts")
            .labelNames("result")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("ws_protocol_errors_total")
            .help("Total number of inbound frames that could not be interpreted")
            .labelNames("kind")
            .register(registry);

        this.authFailures = Counter.build()
            .name("ws_auth_failures_total")
            .help("Total number of rejected upgrade requests")
            .register(registry);

        this.requestRejections = Counter.build()
            .name("ws_hub_request_rejections_total")
            .help("Total number of hub requests dropped on a full request queue")
            .register(registry);
    }

    @Override
    public void recordConnected() {
        connections.inc();
        activeConnections.inc();
    }

    @Override
    public void recordDisconnected(String reason) {
        disconnections.labels(reason).inc();
        activeConnections.dec();
    }

    @Override
    public void recordPublish(String scope, int deliveredCount) {
        published.labels(scope).inc();
        if (deliveredCount > 0) {
            delivered.labels(scope).inc(deliveredCount);
        }
    }

    @Override
    public void recordSlowConsumer() {
        slowConsumers.inc();
    }

    @Override
    public void recordSubscription(boolean granted) {
        subscriptions.labels(granted ? "granted" : "denied").inc();
    }

    @Override
    public void recordProtocolError(String kind) {
        protocolErrors.labels(kind).inc();
    }

    @Override
    public void recordAuthFailure() {
        authFailures.inc();
    }

    @Override
    public void recordRequestRejected() {
        requestRejections.inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
