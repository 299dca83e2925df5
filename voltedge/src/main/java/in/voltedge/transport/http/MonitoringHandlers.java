package in.voltedge.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.voltedge.service.core.RecentEventBuffer;
import in.voltedge.service.engine.EngineStatus;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

/**
 * JSON endpoints for operators.
 */
public final class MonitoringHandlers {
    private static final Logger log = LoggerFactory.getLogger(MonitoringHandlers.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Supplier<EngineStatus> status;
    private final RecentEventBuffer recentEvents;

    public MonitoringHandlers(Supplier<EngineStatus> status, RecentEventBuffer recentEvents) {
        this.status = status;
        this.recentEvents = recentEvents;
    }

    /**
     * GET /health
     *
     * 200 while running, 503 once stopped or halted.
     */
    public void health(HttpServerExchange exchange) {
        EngineStatus current = status.get();
        int code = current.running() && !current.halted() ? 200 : 503;
        sendJson(exchange, code, current);
    }

    /**
     * GET /events
     */
    public void events(HttpServerExchange exchange) {
        sendJson(exchange, 200, recentEvents.snapshot());
    }

    private static void sendJson(HttpServerExchange exchange, int code, Object body) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            String json = MAPPER.writeValueAsString(body);
            exchange.setStatusCode(code);
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            log.error("[MonitoringHandlers] Serialization failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"error\":\"serialization failed\"}", StandardCharsets.UTF_8);
        }
    }
}
