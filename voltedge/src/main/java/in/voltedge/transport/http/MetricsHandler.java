package in.voltedge.transport.http;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;

/**
 * GET /metrics in Prometheus text format.
 *
 * <pre>
 * # HELP engine_broker_calls_total Broker calls by operation and outcome
 * # TYPE engine_broker_calls_total counter
 * engine_broker_calls_total{operation="submit_order",outcome="success"} 12.0
 * engine_broker_calls_total{operation="get_recent_bars",outcome="RATE_LIMITED"} 1.0
 * </pre>
 */
public class MetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final CollectorRegistry registry;

    public MetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            String body = writer.toString();
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(body);
            log.debug("[MetricsHandler] Served metrics ({} bytes)", body.length());
        } catch (IOException e) {
            log.error("[MetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
