package in.voltedge.transport.http;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow server for /metrics, /health and /events.
 */
public final class MonitoringServer {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final Undertow server;
    private final int port;

    public MonitoringServer(int port, CollectorRegistry registry, MonitoringHandlers handlers) {
        this.port = port;
        MetricsHandler metrics = new MetricsHandler(registry);
        RoutingHandler routes = new RoutingHandler()
            .get("/metrics", metrics)
            .get("/health", handlers::health)
            .get("/events", handlers::events)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("VoltEdge monitoring\n\nGET /metrics, /health, /events\n");
            });
        this.server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("✓ Monitoring server started on port {}", port);
    }

    public void stop() {
        server.stop();
        log.info("[MonitoringServer] Stopped");
    }
}
