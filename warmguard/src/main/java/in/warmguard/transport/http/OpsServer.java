package in.warmguard.transport.http;

import in.warmguard.infrastructure.metrics.PrometheusMetricsHandler;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow listener for the ops endpoints: {@code /metrics} and {@code /health}.
 */
public final class OpsServer {
    private static final Logger log = LoggerFactory.getLogger(OpsServer.class);

    private final Undertow server;
    private final int port;

    public OpsServer(int port, OpsHandlers handlers, CollectorRegistry registry) {
        this.port = port;
        RoutingHandler routes = Handlers.routing()
            .get("/health", handlers::health)
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("WarmGuard ops: GET /health, GET /metrics\n");
            });

        this.server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("[OPS] ✓ Ops server started on port {}", port);
    }

    public void stop() {
        server.stop();
        log.info("[OPS] Ops server stopped");
    }
}
