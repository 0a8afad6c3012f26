package jp.tradelog.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves {@code GET /metrics} in Prometheus text format 0.0.4.
 *
 * Repeated {@code name[]} query parameters restrict the output to those
 * sample names, as the Prometheus exporters do.
 *
 * <pre>
 * # HELP tradelog_imports_total Total number of CSV import attempts
 * # TYPE tradelog_imports_total counter
 * tradelog_imports_total{layout="DOMESTIC",outcome="success"} 3.0
 * tradelog_imports_total{layout="UNKNOWN",outcome="FORMAT_UNDETECTED"} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter writer = new StringWriter();
        try {
            if (names.isEmpty()) {
                TextFormat.write004(writer, registry.metricFamilySamples());
            } else {
                TextFormat.write004(writer, registry.filteredMetricFamilySamples(names));
            }
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.setStatusCode(200);
        exchange.getResponseSender().send(body);
        log.debug("[METRICS] Served {} bytes ({} name filters)", body.length(), names.size());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
