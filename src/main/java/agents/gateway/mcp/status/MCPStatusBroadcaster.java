package agents.gateway.mcp.status;

import agents.gateway.config.GatewayConfig;
import agents.gateway.mcp.base.CallerHandle;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.discovery.MCPToolDiscoveryService;
import agents.gateway.mcp.metrics.MCPMetricsRegistry;
import agents.gateway.mcp.resilience.CircuitBreaker;
import agents.gateway.mcp.resilience.CircuitBreakerRegistry;
import agents.gateway.mcp.routing.SubscriberRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static agents.gateway.Driver.logLevel;

/**
 * Pushes per-server status snapshots to subscribers whenever something they show changes,
 * and on a periodic telemetry tick.
 */
public class MCPStatusBroadcaster {

    public static final String SNAPSHOT_ADDRESS = "mcp.status.snapshot";

    private final Vertx vertx;
    private final MCPConnectionManager connections;
    private final CircuitBreakerRegistry breakers;
    private final MCPMetricsRegistry metrics;
    private final SubscriberRegistry subscribers;
    private final GatewayConfig config;

    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();
    private long tickTimerId = -1;

    public MCPStatusBroadcaster(Vertx vertx, MCPConnectionManager connections, CircuitBreakerRegistry breakers,
                                MCPMetricsRegistry metrics, SubscriberRegistry subscribers, GatewayConfig config) {
        this.vertx = vertx;
        this.connections = connections;
        this.breakers = breakers;
        this.metrics = metrics;
        this.subscribers = subscribers;
        this.config = config;
    }

    public void start() {
        consumers.add(vertx.eventBus().consumer(MCPConnectionManager.STATE_ADDRESS, msg -> push()));
        consumers.add(vertx.eventBus().consumer(MCPToolDiscoveryService.TOOLS_UPDATED_ADDRESS, msg -> push()));
        consumers.add(vertx.eventBus().consumer(CircuitBreaker.STATE_ADDRESS, msg -> push()));
        consumers.add(vertx.eventBus().consumer(MCPMetricsRegistry.UPDATED_ADDRESS, msg -> push()));
        if (config.getStatusIntervalMs() > 0) {
            tickTimerId = vertx.setPeriodic(config.getStatusIntervalMs(), id -> push());
        }
    }

    public void stop() {
        consumers.forEach(MessageConsumer::unregister);
        consumers.clear();
        if (tickTimerId >= 0) {
            vertx.cancelTimer(tickTimerId);
            tickTimerId = -1;
        }
    }

    /**
     * Subscribe and immediately send the current snapshot.
     */
    public void subscribe(CallerHandle subscriber) {
        subscribers.subscribe(subscriber);
        subscribers.deliver(subscriber, statusMessage());
    }

    public void unsubscribe(String subscriberId) {
        subscribers.unsubscribe(subscriberId);
    }

    public JsonArray snapshot() {
        JsonArray servers = new JsonArray();
        for (String serverId : new TreeSet<>(connections.serverIds())) {
            JsonObject status = serverStatus(serverId);
            if (status != null) {
                servers.add(status);
            }
        }
        return servers;
    }

    public JsonObject serverStatus(String serverId) {
        JsonObject status = connections.describe(serverId);
        if (status == null) {
            return null;
        }
        return status
            .put("circuit", breakers.serverState(serverId))
            .put("metrics", metrics.getServerMetrics(serverId));
    }

    public JsonObject statusMessage() {
        return new JsonObject()
            .put("type", "serverStatus")
            .put("servers", snapshot())
            .put("timestamp", System.currentTimeMillis());
    }

    public void push() {
        JsonObject message = statusMessage();
        int reached = subscribers.broadcast(message);
        vertx.eventBus().publish(SNAPSHOT_ADDRESS, message);
        if (logLevel >= 4) vertx.eventBus().publish("log", "Status pushed to " + reached + " subscribers,4,MCPStatusBroadcaster,Push,Status");
    }
}
