package agents.gateway.mcp.routing;

import agents.gateway.config.GatewayConfig;
import agents.gateway.mcp.base.CallerHandle;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPRequest;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.connection.MCPUpstreamConnection;
import agents.gateway.mcp.connection.PendingRequest;
import agents.gateway.mcp.connection.PendingRequests;
import agents.gateway.mcp.metrics.MCPMetricsRegistry;
import agents.gateway.mcp.resilience.CircuitBreaker;
import agents.gateway.mcp.resilience.CircuitBreakerRegistry;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import static agents.gateway.Driver.logLevel;

/**
 * Forwards JSON-RPC requests to upstream connections and routes everything that
 * comes back.
 *
 * <p>A request with an id is registered in its connection's correlation table,
 * written, and awaited, all inside the server's circuit breaker whose timer is the
 * request deadline. A notification is only written, through the same breaker.
 * Inbound traffic is demultiplexed from {@link MCPUpstreamConnection#INBOUND_ADDRESS}:
 * replies complete their pending request, {@code mcp.chunk} notifications go to the
 * request's chunk handler, and anything unmatched is broadcast to subscribers.</p>
 */
public class MCPRequestRouter {

    private final Vertx vertx;
    private final MCPConnectionManager connections;
    private final CircuitBreakerRegistry breakers;
    private final MCPMetricsRegistry metrics;
    private final SubscriberRegistry subscribers;
    private final GatewayConfig config;
    private final LongSupplier clock;

    private final Map<String, Handler<JsonObject>> streamHandlers = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(0);
    private MessageConsumer<JsonObject> inboundConsumer;

    public MCPRequestRouter(Vertx vertx, MCPConnectionManager connections, CircuitBreakerRegistry breakers,
                            MCPMetricsRegistry metrics, SubscriberRegistry subscribers, GatewayConfig config) {
        this(vertx, connections, breakers, metrics, subscribers, config, System::currentTimeMillis);
    }

    public MCPRequestRouter(Vertx vertx, MCPConnectionManager connections, CircuitBreakerRegistry breakers,
                            MCPMetricsRegistry metrics, SubscriberRegistry subscribers, GatewayConfig config,
                            LongSupplier clock) {
        this.vertx = vertx;
        this.connections = connections;
        this.breakers = breakers;
        this.metrics = metrics;
        this.subscribers = subscribers;
        this.config = config;
        this.clock = clock;
    }

    public void start() {
        inboundConsumer = vertx.eventBus().consumer(MCPUpstreamConnection.INBOUND_ADDRESS, msg -> onInbound(msg.body()));
        if (logLevel >= 2) vertx.eventBus().publish("log", "Request router listening on " + MCPUpstreamConnection.INBOUND_ADDRESS + ",2,MCPRequestRouter,Start,Routing");
    }

    public void stop() {
        if (inboundConsumer != null) {
            inboundConsumer.unregister();
            inboundConsumer = null;
        }
        streamHandlers.clear();
    }

    public Future<JsonObject> forward(String serverId, JsonObject request, CallerHandle caller) {
        return forward(serverId, request, caller, null);
    }

    /**
     * Forward one JSON-RPC message to the server.
     *
     * @param chunkHandler receives {@code mcpStreamChunk} messages for this request, may be null
     * @return the upstream's response envelope; null for a notification once written
     */
    public Future<JsonObject> forward(String serverId, JsonObject request, CallerHandle caller, Handler<JsonObject> chunkHandler) {
        long deadline = request != null && MCPRequest.PING.equals(request.getValue("method"))
            ? config.getPingTimeoutMs()
            : config.getRequestTimeoutMs();
        return forward(serverId, request, caller, chunkHandler, deadline);
    }

    private Future<JsonObject> forward(String serverId, JsonObject request, CallerHandle caller,
                                       Handler<JsonObject> chunkHandler, long timeoutMs) {
        if (request == null || !(request.getValue("method") instanceof String) || request.getString("method").isEmpty()) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.INVALID_REQUEST, "Invalid request: missing method"));
        }
        Object rawId = request.getValue("id");
        if (rawId != null && !(rawId instanceof String) && !(rawId instanceof Number)) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.INVALID_REQUEST, "Invalid request: id must be a string or a number"));
        }
        if (serverId == null || !connections.isManaged(serverId)) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId));
        }
        MCPUpstreamConnection connection = connections.getConnection(serverId);
        if (connection == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.NOT_CONNECTED, "Server " + serverId + " not connected"));
        }

        JsonObject outbound = request.copy();
        if (!outbound.containsKey("jsonrpc")) {
            outbound.put("jsonrpc", "2.0");
        }
        MCPRequest parsed = MCPRequest.fromJson(outbound);

        String toolName = parsed.toolName();
        CircuitBreaker breaker = breakers.forServer(serverId);
        AtomicBoolean admitted = new AtomicBoolean(false);

        if (parsed.isNotification()) {
            if (logLevel >= 3) vertx.eventBus().publish("log", "Notification " + parsed.getMethod() + " to " + serverId + ",3,MCPRequestRouter,Forward,Routing");
            return breaker.<Void>execute(() -> {
                admitted.set(true);
                return connection.send(outbound.encode());
            }, timeoutMs).transform(ar -> {
                if (!admitted.get()) {
                    metrics.recordRejected(serverId, toolName);
                }
                if (ar.failed()) {
                    return Future.<JsonObject>failedFuture(ar.cause());
                }
                return Future.<JsonObject>succeededFuture(null);
            });
        }

        long start = clock.getAsLong();
        PendingRequest pending = new PendingRequest(parsed.getId(), caller, start, toolName, chunkHandler);
        PendingRequests table = connection.getPending();
        try {
            table.register(pending);
        } catch (MCPGatewayException e) {
            return Future.failedFuture(e);
        }

        if (logLevel >= 3) vertx.eventBus().publish("log", "Forwarding " + parsed.getMethod() + (toolName != null ? " (" + toolName + ")" : "") + " to " + serverId + " id " + pending.getRequestId() + ",3,MCPRequestRouter,Forward,Routing");

        Future<JsonObject> exchange = breaker.execute(() -> {
            admitted.set(true);
            metrics.recordRequest(serverId, toolName);
            return connection.send(outbound.encode())
                .onFailure(pending::fail)
                .compose(v -> pending.future());
        }, timeoutMs);

        return exchange.transform(ar -> {
            table.remove(pending);
            streamHandlers.remove(pending.getKey());
            if (!admitted.get()) {
                metrics.recordRejected(serverId, toolName);
                return Future.failedFuture(ar.cause());
            }
            long latency = clock.getAsLong() - start;
            metrics.recordOutcome(serverId, toolName, ar.succeeded(), latency);
            if (ar.succeeded()) {
                return Future.succeededFuture(ar.result());
            }
            if (MCPGatewayException.is(ar.cause(), MCPGatewayException.Kind.TIMEOUT)) {
                if (logLevel >= 1) vertx.eventBus().publish("log", "Request " + pending.getRequestId() + " to " + serverId + " timed out after " + timeoutMs + "ms,1,MCPRequestRouter,Timeout,Routing");
            }
            return Future.failedFuture(ar.cause());
        });
    }

    /**
     * Gateway-originated request with a generated id and an explicit deadline.
     */
    public Future<JsonObject> call(String serverId, String method, JsonObject params, long timeoutMs) {
        JsonObject request = new MCPRequest(nextRequestId(serverId), method, params != null ? params : new JsonObject()).toJson();
        return forward(serverId, request, null, null, timeoutMs);
    }

    /**
     * @return {@code {success, latency}} or {@code {success:false, error}}; never fails
     */
    public Future<JsonObject> ping(String serverId) {
        long start = clock.getAsLong();
        return call(serverId, MCPRequest.PING, new JsonObject(), config.getPingTimeoutMs())
            .map(response -> new JsonObject()
                .put("success", true)
                .put("latency", clock.getAsLong() - start))
            .otherwise(err -> new JsonObject()
                .put("success", false)
                .put("error", err.getMessage()));
    }

    public String nextRequestId(String serverId) {
        return "gw_" + serverId + "_" + idSequence.incrementAndGet();
    }

    /**
     * Chunk handler for a request forwarded without one. Dropped when that request completes.
     */
    public void registerStreamHandler(Object requestId, Handler<JsonObject> handler) {
        String key = PendingRequest.keyOf(requestId);
        if (key != null) {
            streamHandlers.put(key, handler);
        }
    }

    public void unregisterStreamHandler(Object requestId) {
        String key = PendingRequest.keyOf(requestId);
        if (key != null) {
            streamHandlers.remove(key);
        }
    }

    int streamHandlerCount() {
        return streamHandlers.size();
    }

    void onInbound(JsonObject envelope) {
        String serverId = envelope.getString("serverId");
        String connectionId = envelope.getString("connectionId");
        JsonObject message = envelope.getJsonObject("message");
        if (message == null) {
            return;
        }

        // Traffic from a replaced connection never matches: its table was closed with it
        MCPUpstreamConnection connection = connections.getConnection(serverId);
        PendingRequests table = connection != null && connection.getConnectionId().equals(connectionId)
            ? connection.getPending()
            : null;

        if (MCPResponse.isResponse(message)) {
            Object id = message.getValue("id");
            PendingRequest pending = table != null ? table.removeById(id) : null;
            if (pending != null) {
                if (message.getValue("error") != null) {
                    pending.fail(MCPGatewayException.upstreamError(MCPResponse.fromJson(message)));
                } else {
                    pending.complete(message);
                }
                return;
            }
            if (logLevel >= 3) vertx.eventBus().publish("log", "Unsolicited response id " + id + " from " + serverId + " broadcast,3,MCPRequestRouter,Demux,Routing");
            subscribers.broadcast(new JsonObject()
                .put("type", "mcpResponse")
                .put("serverId", serverId)
                .put("data", message)
                .put("latency", 0));
            return;
        }

        if (MCPRequest.CHUNK.equals(message.getValue("method"))) {
            Object rawParams = message.getValue("params");
            JsonObject params = rawParams instanceof JsonObject ? (JsonObject) rawParams : new JsonObject();
            Object requestId = params.getValue("request_id");
            PendingRequest pending = table != null && requestId != null ? table.get(requestId) : null;
            if (pending != null) {
                deliverChunk(serverId, pending, params.getValue("chunk"));
                return;
            }
        }

        subscribers.broadcast(new JsonObject()
            .put("type", "mcpNotification")
            .put("serverId", serverId)
            .put("data", message));
    }

    private void deliverChunk(String serverId, PendingRequest pending, Object chunk) {
        JsonObject chunkMessage = new JsonObject()
            .put("type", "mcpStreamChunk")
            .put("serverId", serverId)
            .put("requestId", pending.getRequestId())
            .put("chunk", chunk);

        Handler<JsonObject> handler = pending.getChunkHandler();
        if (handler == null) {
            handler = streamHandlers.get(pending.getKey());
        }
        try {
            if (handler != null) {
                handler.handle(chunkMessage);
            } else if (pending.getCaller() != null && pending.getCaller().isOpen()) {
                pending.getCaller().deliver(chunkMessage);
            }
        } catch (RuntimeException e) {
            vertx.eventBus().publish("log", "Chunk delivery for " + pending.getRequestId() + " failed: " + e.getMessage() + ",0,MCPRequestRouter,Chunk,Routing");
        }
    }
}
