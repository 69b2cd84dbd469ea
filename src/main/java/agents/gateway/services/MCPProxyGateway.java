package agents.gateway.services;

import agents.gateway.config.CredentialResolver;
import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.AuditSink;
import agents.gateway.directory.ServerDirectory;
import agents.gateway.directory.ToolCatalog;
import agents.gateway.mcp.base.CallerHandle;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPRequest;
import agents.gateway.mcp.base.MCPTool;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.connection.MCPUpstreamConnection;
import agents.gateway.mcp.connection.UpstreamServer;
import agents.gateway.mcp.discovery.MCPToolDiscoveryService;
import agents.gateway.mcp.metrics.MCPMetricsRegistry;
import agents.gateway.mcp.resilience.CircuitBreakerRegistry;
import agents.gateway.mcp.routing.MCPRequestRouter;
import agents.gateway.mcp.routing.SubscriberRegistry;
import agents.gateway.mcp.status.MCPStatusBroadcaster;
import agents.gateway.mcp.transport.MCPHttpUpstreamClient;
import agents.gateway.mcp.transport.SimulatedTransportFactory;
import agents.gateway.mcp.transport.TransportFactory;
import agents.gateway.mcp.transport.WebSocketTransportFactory;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

import static agents.gateway.Driver.logLevel;

/**
 * The gateway as internal callers see it.
 *
 * <p>Wires the connection manager, router, discovery, metrics, breakers and status
 * broadcaster together and exposes the operations the event bus API and the HTTP /
 * WebSocket front door are built on. Every operation returns a {@link Future} that
 * fails with {@link MCPGatewayException} on gateway-side errors.</p>
 */
public class MCPProxyGateway {

    private final Vertx vertx;
    private final GatewayConfig config;
    private final ToolCatalog catalog;
    private final LongSupplier clock;

    private final CircuitBreakerRegistry breakers;
    private final MCPMetricsRegistry metrics;
    private final SubscriberRegistry subscribers;
    private final MCPConnectionManager connections;
    private final MCPRequestRouter router;
    private final MCPToolDiscoveryService discovery;
    private final MCPStatusBroadcaster broadcaster;
    private final MCPHttpUpstreamClient httpClient;

    private MessageConsumer<JsonObject> removalConsumer;

    public MCPProxyGateway(Vertx vertx, GatewayConfig config, ServerDirectory directory,
                           ToolCatalog catalog, AuditSink audit) {
        this(vertx, config, directory, catalog, audit, transportFor(config), System::currentTimeMillis);
    }

    public MCPProxyGateway(Vertx vertx, GatewayConfig config, ServerDirectory directory, ToolCatalog catalog,
                           AuditSink audit, TransportFactory transportFactory, LongSupplier clock) {
        this.vertx = vertx;
        this.config = config;
        this.catalog = catalog;
        this.clock = clock;

        boolean countApplicationErrors = config.isCountApplicationErrors();
        this.breakers = new CircuitBreakerRegistry(vertx, config.getBreakerOptions(), clock,
            error -> countApplicationErrors || !MCPGatewayException.is(error, MCPGatewayException.Kind.UPSTREAM_ERROR));
        this.metrics = new MCPMetricsRegistry(vertx, config.getMetricsReportEvery());
        this.subscribers = new SubscriberRegistry(vertx);
        this.connections = new MCPConnectionManager(vertx, directory, transportFactory, config);
        this.router = new MCPRequestRouter(vertx, connections, breakers, metrics, subscribers, config, clock);
        this.discovery = new MCPToolDiscoveryService(vertx, connections, router, catalog, audit, config);
        this.broadcaster = new MCPStatusBroadcaster(vertx, connections, breakers, metrics, subscribers, config);
        this.httpClient = new MCPHttpUpstreamClient(vertx, config.getUpstreamPath(),
            config.getConnectTimeoutMs(), config.getHttpUpstreamTimeoutMs());
    }

    public static TransportFactory transportFor(GatewayConfig config) {
        if (GatewayConfig.TRANSPORT_SIMULATED.equals(config.getTransportMode())) {
            return new SimulatedTransportFactory();
        }
        return new WebSocketTransportFactory(config.getUpstreamPath(), config.getConnectTimeoutMs(), config.getMaxMessageSize());
    }

    /**
     * Start listening before connecting so the first {@code connected} events are seen.
     */
    public Future<Void> start() {
        router.start();
        discovery.start();
        broadcaster.start();
        removalConsumer = vertx.eventBus().consumer(MCPConnectionManager.STATE_ADDRESS, msg -> {
            if (MCPConnectionManager.STATE_REMOVED.equals(msg.body().getString("state"))) {
                String serverId = msg.body().getString("serverId");
                breakers.remove(serverId);
                metrics.remove(serverId);
            }
        });

        return connections.start().onSuccess(v -> {
            if (logLevel >= 1) vertx.eventBus().publish("log", "Gateway started with " + connections.serverIds().size() + " servers using " + config.getTransportMode() + " transport,1,MCPProxyGateway,Start,Gateway");
        });
    }

    public Future<Void> stop() {
        broadcaster.stop();
        discovery.stop();
        if (removalConsumer != null) {
            removalConsumer.unregister();
            removalConsumer = null;
        }
        return connections.stop().onComplete(ar -> {
            router.stop();
            httpClient.close();
        });
    }

    /* ---------- request forwarding ---------- */

    public Future<JsonObject> forwardRequest(String serverId, JsonObject request, CallerHandle caller) {
        return router.forward(serverId, request, caller);
    }

    public Future<JsonObject> forwardRequest(String serverId, JsonObject request, CallerHandle caller,
                                             Handler<JsonObject> chunkHandler) {
        return router.forward(serverId, request, caller, chunkHandler);
    }

    /**
     * Forward over the upstream's HTTP endpoint instead of its live connection.
     * Fails with {@link MCPHttpUpstreamClient.UpstreamHttpException} on a non-2xx status and
     * {@link MCPHttpUpstreamClient.NoResponseException} when nothing usable came back.
     */
    public Future<JsonObject> forwardHttp(String serverId, JsonObject request) {
        UpstreamServer server = connections.getServer(serverId);
        if (server == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId));
        }
        if (connections.getConnection(serverId) == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.NOT_CONNECTED, "Server " + serverId + " not connected"));
        }

        JsonObject outbound = request.copy();
        if (!outbound.containsKey("jsonrpc")) {
            outbound.put("jsonrpc", "2.0");
        }
        String toolName = MCPRequest.fromJson(outbound).toolName();
        String credential = CredentialResolver.resolve(server.getCredentialRef());
        long start = clock.getAsLong();

        // A little longer than the client's own timeout so its "no response" wins
        long breakerTimeout = config.getHttpUpstreamTimeoutMs() + 1000;
        return breakers.forHttpServer(serverId).execute(() -> {
            metrics.recordRequest(serverId, toolName);
            return httpClient.post(server, credential, outbound)
                .andThen(ar -> metrics.recordOutcome(serverId, toolName, ar.succeeded(), clock.getAsLong() - start));
        }, breakerTimeout);
    }

    /**
     * Id the HTTP front door assigns to requests that arrive without one.
     */
    public String nextHttpRequestId() {
        return "http_" + clock.getAsLong() + "_" + Integer.toString(ThreadLocalRandom.current().nextInt(Integer.MAX_VALUE), 36);
    }

    public void registerStreamHandler(Object requestId, Handler<JsonObject> handler) {
        router.registerStreamHandler(requestId, handler);
    }

    public void unregisterStreamHandler(Object requestId) {
        router.unregisterStreamHandler(requestId);
    }

    /* ---------- status ---------- */

    public void subscribeStatus(CallerHandle subscriber) {
        broadcaster.subscribe(subscriber);
    }

    public void unsubscribeStatus(String subscriberId) {
        broadcaster.unsubscribe(subscriberId);
    }

    public JsonArray getServerStatuses() {
        return broadcaster.snapshot();
    }

    /**
     * @return the server's status, null when the server is unknown
     */
    public JsonObject getServerStatus(String serverId) {
        return broadcaster.serverStatus(serverId);
    }

    public JsonObject getCircuitHealth() {
        return breakers.getHealth();
    }

    /**
     * Live tool list of the current connection, falling back to the catalog when the
     * server is down or discovery has not finished.
     */
    public Future<JsonArray> getTools(String serverId) {
        if (!connections.isManaged(serverId)) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId));
        }
        MCPUpstreamConnection connection = connections.getConnection(serverId);
        if (connection != null && !connection.getTools().isEmpty()) {
            return Future.succeededFuture(toJson(connection.getTools()));
        }
        return catalog.listTools(serverId).map(MCPProxyGateway::toJson);
    }

    private static JsonArray toJson(List<MCPTool> tools) {
        JsonArray array = new JsonArray();
        tools.forEach(tool -> array.add(tool.toJson()));
        return array;
    }

    /* ---------- metrics ---------- */

    public JsonObject getServerMetrics(String serverId) {
        return metrics.getServerMetrics(serverId);
    }

    public JsonObject getAllMetrics() {
        return metrics.getAllMetrics();
    }

    /**
     * Reset one server's counters, or every server's when {@code serverId} is null.
     */
    public void resetMetrics(String serverId) {
        if (serverId == null) {
            metrics.resetAll();
        } else {
            metrics.reset(serverId);
        }
    }

    /* ---------- connection control ---------- */

    public Future<Boolean> connectServer(String serverId) {
        return connections.connect(serverId);
    }

    public Future<Void> disconnectServer(String serverId) {
        return connections.disconnect(serverId);
    }

    public Future<JsonObject> pingServer(String serverId) {
        return router.ping(serverId);
    }

    /* ---------- components ---------- */

    public MCPConnectionManager getConnections() {
        return connections;
    }

    public MCPRequestRouter getRouter() {
        return router;
    }

    public MCPToolDiscoveryService getDiscovery() {
        return discovery;
    }

    public MCPStatusBroadcaster getBroadcaster() {
        return broadcaster;
    }

    public CircuitBreakerRegistry getBreakers() {
        return breakers;
    }

    public MCPMetricsRegistry getMetrics() {
        return metrics;
    }

    public GatewayConfig getConfig() {
        return config;
    }
}
