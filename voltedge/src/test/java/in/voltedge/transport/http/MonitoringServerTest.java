package in.voltedge.transport.http;

import in.voltedge.domain.common.EventType;
import in.voltedge.infrastructure.metrics.PrometheusEngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.core.RecentEventBuffer;
import in.voltedge.service.engine.EngineStatus;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the monitoring endpoints.
 *
 * Tests:
 * - /metrics serves Prometheus text format
 * - /health reflects running and halted state
 * - /events returns recent events as JSON
 * - Unknown paths return 404
 */
class MonitoringServerTest {

    private static final int TEST_PORT = 19091;

    private MonitoringServer server;
    private PrometheusEngineMetrics metrics;
    private EventService events;
    private final AtomicReference<EngineStatus> status = new AtomicReference<>(status(true, false, null));
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        metrics = new PrometheusEngineMetrics(new CollectorRegistry());
        RecentEventBuffer recent = new RecentEventBuffer(10);
        events = new EventService(List.of(recent));
        server = new MonitoringServer(TEST_PORT, metrics.getRegistry(), new MonitoringHandlers(status::get, recent));
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        metrics.recordBrokerCall("get_account", null, Duration.ofMillis(40));

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        assertTrue(response.body().contains("# TYPE engine_broker_calls_total counter"));
        assertTrue(response.body().contains("operation=\"get_account\""));
    }

    @Test
    void testHealthFollowsEngineState() throws Exception {
        HttpResponse<String> healthy = get("/health");
        assertEquals(200, healthy.statusCode());
        assertTrue(healthy.body().contains("\"running\":true"));

        status.set(status(true, true, "OrderExecutor: connection lost"));
        HttpResponse<String> halted = get("/health");
        assertEquals(503, halted.statusCode());
        assertTrue(halted.body().contains("connection lost"));

        status.set(status(false, false, null));
        assertEquals(503, get("/health").statusCode());
    }

    @Test
    void testEventsEndpoint() throws Exception {
        events.emit(EventType.SCAN_COMPLETED, "BTCUSD", "Scanner", Map.of("emitted", 3));

        HttpResponse<String> response = get("/events");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        assertTrue(response.body().startsWith("["));
        assertTrue(response.body().contains("\"SCAN_COMPLETED\""));
        assertTrue(response.body().contains("\"BTCUSD\""));
    }

    @Test
    void testUnknownPathReturns404() throws Exception {
        assertEquals(404, get("/positions").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static EngineStatus status(boolean running, boolean halted, String haltReason) {
        return new EngineStatus(running, halted, haltReason, true, Instant.parse("2024-03-01T10:00:00Z"),
            null, 0, List.of(), null, null, 0.0, 0);
    }
}
