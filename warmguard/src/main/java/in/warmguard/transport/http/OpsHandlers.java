package in.warmguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.warmguard.bootstrap.SafetyCore;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Operational endpoints of the safety core.
 */
public final class OpsHandlers {
    private static final Logger log = LoggerFactory.getLogger(OpsHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SafetyCore core;
    private final Clock clock;

    public OpsHandlers(SafetyCore core, Clock clock) {
        this.core = core;
        this.clock = clock;
    }

    /**
     * GET /health
     * Liveness plus supervisor and session pool state.
     */
    public void health(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        try {
            exchange.getResponseSender().send(healthJson().toString(), StandardCharsets.UTF_8);
        } catch (RuntimeException e) {
            log.error("[OPS] Health check error", e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send(
                "{\"status\":\"error\",\"ts\":\"" + clock.instant() + "\"}",
                StandardCharsets.UTF_8);
        }
    }

    ObjectNode healthJson() {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());
        health.put("supervisorRunning", core.supervisor().isStarted());
        health.put("healthCycleInProgress", core.healthMonitor().isRunning());

        ObjectNode pool = health.putObject("sessionPool");
        core.sessionPool().ifPresentOrElse(p -> {
            pool.put("enabled", true);
            pool.put("activeSessions", p.size());
            pool.put("maxConcurrent", core.config().pool().maxConcurrent());
        }, () -> pool.put("enabled", false));
        return health;
    }
}
