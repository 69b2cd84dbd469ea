package agents.gateway.directory;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Publishes audit events on {@code mcp.audit} for whatever consumer persists them.
 */
public class EventBusAuditSink implements AuditSink {

    public static final String AUDIT_ADDRESS = "mcp.audit";

    private final Vertx vertx;

    public EventBusAuditSink(Vertx vertx) {
        this.vertx = vertx;
    }

    @Override
    public void emit(JsonObject event) {
        JsonObject copy = event.copy();
        if (!copy.containsKey("timestamp")) {
            copy.put("timestamp", System.currentTimeMillis());
        }
        vertx.eventBus().publish(AUDIT_ADDRESS, copy);
    }
}
