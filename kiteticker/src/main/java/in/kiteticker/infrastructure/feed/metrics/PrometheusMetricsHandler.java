package in.kiteticker.infrastructure.feed.metrics;

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
 * Undertow handler serving a collector registry for Prometheus scrapes.
 *
 * The format follows the request's Accept header (text 0.0.4 or OpenMetrics).
 * Repeated {@code name[]} query parameters restrict the output to those families:
 * <pre>
 * GET /metrics?name[]=feed_ticks_total&amp;name[]=feed_connection_status
 *
 * # HELP feed_ticks_total Total number of ticks decoded
 * # TYPE feed_ticks_total counter
 * feed_ticks_total{mode="full",} 1234.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[FeedMetrics] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.setStatusCode(200);
        exchange.getResponseSender().send(body);
        log.debug("[FeedMetrics] Served {} metrics ({} bytes)", names.isEmpty() ? "all" : names, body.length());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Set<String> names = new HashSet<>();
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        if (values != null) {
            names.addAll(values);
        }
        return names;
    }
}
