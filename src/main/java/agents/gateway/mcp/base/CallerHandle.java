package agents.gateway.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * An internal consumer of the gateway: a WebSocket client, an event bus address,
 * or anything else that can receive pushed messages (stream chunks, broadcasts,
 * status snapshots).
 */
public interface CallerHandle {

    String id();

    void deliver(JsonObject message);

    default boolean isOpen() {
        return true;
    }
}
