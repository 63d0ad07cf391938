package com.ybds.infrastructure.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves the hub's registry at {@code GET /metrics}.
 *
 * The exposition format follows the {@code Accept} header (Prometheus text 0.0.4 by
 * default, OpenMetrics when asked for). Repeated {@code name[]} query parameters
 * restrict the output to those sample names, e.g.
 * {@code /metrics?name[]=ws_connections_active}.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);
    private static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);
        Enumeration<Collector.MetricFamilySamples> samples = names.isEmpty()
            ? registry.metricFamilySamples()
            : registry.filteredMetricFamilySamples(names);

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, samples);
        } catch (IOException e) {
            log.error("[Metrics] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("metrics export failed", StandardCharsets.UTF_8);
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
        log.debug("[Metrics] Scrape served ({} chars, filter={})", body.getBuffer().length(), names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        Set<String> names = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (!value.isBlank()) {
                    names.add(value.trim());
                }
            }
        }
        return names;
    }
}
