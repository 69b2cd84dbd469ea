package agents.gateway.directory;

import io.vertx.core.json.JsonObject;

/**
 * Receives gateway events worth keeping: discovery failures, connection changes.
 */
public interface AuditSink {

    void emit(JsonObject event);
}
