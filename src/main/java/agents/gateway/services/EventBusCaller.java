package agents.gateway.services;

import agents.gateway.mcp.base.CallerHandle;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Caller reached through an event bus address. Pushed messages (status snapshots,
 * stream chunks, broadcasts) are published to that address.
 */
public class EventBusCaller implements CallerHandle {

    private final Vertx vertx;
    private final String id;
    private final String address;
    private volatile boolean open = true;

    public EventBusCaller(Vertx vertx, String id, String address) {
        this.vertx = vertx;
        this.id = id;
        this.address = address;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void deliver(JsonObject message) {
        vertx.eventBus().publish(address, message);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    public String getAddress() {
        return address;
    }
}
