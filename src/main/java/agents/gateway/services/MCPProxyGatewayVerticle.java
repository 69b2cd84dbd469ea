package agents.gateway.services;

import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPResponse;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static agents.gateway.Driver.logLevel;

/**
 * Event bus face of the gateway. Every {@code mcp.proxy.*} address takes a JSON body
 * and replies with JSON; failures reply with {@code message.fail(jsonRpcCode, text)}.
 * An upstream application error is not a failure here: the upstream's JSON-RPC
 * error envelope is the reply.
 */
public class MCPProxyGatewayVerticle extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.gateway.ready";

    public static final String FORWARD = "mcp.proxy.forward";
    public static final String STATUS = "mcp.proxy.status";
    public static final String TOOLS = "mcp.proxy.tools";
    public static final String METRICS = "mcp.proxy.metrics";
    public static final String METRICS_RESET = "mcp.proxy.metrics.reset";
    public static final String SUBSCRIBE = "mcp.proxy.subscribe";
    public static final String UNSUBSCRIBE = "mcp.proxy.unsubscribe";
    public static final String CONNECT = "mcp.proxy.connect";
    public static final String DISCONNECT = "mcp.proxy.disconnect";
    public static final String PING = "mcp.proxy.ping";

    private final MCPProxyGateway gateway;
    private final Map<String, EventBusCaller> subscribers = new ConcurrentHashMap<>();

    public MCPProxyGatewayVerticle(MCPProxyGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        vertx.eventBus().<JsonObject>consumer(FORWARD, this::handleForward);
        vertx.eventBus().<JsonObject>consumer(STATUS, this::handleStatus);
        vertx.eventBus().<JsonObject>consumer(TOOLS, this::handleTools);
        vertx.eventBus().<JsonObject>consumer(METRICS, this::handleMetrics);
        vertx.eventBus().<JsonObject>consumer(METRICS_RESET, this::handleMetricsReset);
        vertx.eventBus().<JsonObject>consumer(SUBSCRIBE, this::handleSubscribe);
        vertx.eventBus().<JsonObject>consumer(UNSUBSCRIBE, this::handleUnsubscribe);
        vertx.eventBus().<JsonObject>consumer(CONNECT, this::handleConnect);
        vertx.eventBus().<JsonObject>consumer(DISCONNECT, this::handleDisconnect);
        vertx.eventBus().<JsonObject>consumer(PING, this::handlePing);

        gateway.start().onComplete(ar -> {
            if (ar.succeeded()) {
                vertx.eventBus().publish("log", "MCPProxyGatewayVerticle started,2,MCPProxyGatewayVerticle,Start,Gateway");
                vertx.eventBus().publish(READY_ADDRESS, new JsonObject().put("timestamp", System.currentTimeMillis()));
                startPromise.complete();
            } else {
                vertx.eventBus().publish("log", "Gateway failed to start: " + ar.cause().getMessage() + ",0,MCPProxyGatewayVerticle,Start,Gateway");
                startPromise.fail(ar.cause());
            }
        });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        subscribers.values().forEach(EventBusCaller::close);
        subscribers.clear();
        gateway.stop().onComplete(ar -> stopPromise.complete());
    }

    /**
     * Body: {@code {serverId, request, replyAddress?}}. Stream chunks for the request are
     * published to {@code replyAddress} when one is given.
     */
    private void handleForward(Message<JsonObject> message) {
        JsonObject body = message.body();
        if (body == null || body.getString("serverId") == null || body.getJsonObject("request") == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId and request are required");
            return;
        }
        String serverId = body.getString("serverId");
        String replyAddress = body.getString("replyAddress");
        EventBusCaller caller = replyAddress != null
            ? new EventBusCaller(vertx, "eventbus-" + UUID.randomUUID(), replyAddress)
            : null;

        gateway.forwardRequest(serverId, body.getJsonObject("request"), caller)
            .onSuccess(response -> message.reply(response != null ? response : new JsonObject().put("accepted", true)))
            .onFailure(err -> fail(message, err));
    }

    /**
     * Body: {@code {serverId?}}. Without a server id the reply holds every server and the circuit health.
     */
    private void handleStatus(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.reply(new JsonObject()
                .put("servers", gateway.getServerStatuses())
                .put("circuitHealth", gateway.getCircuitHealth())
                .put("timestamp", System.currentTimeMillis()));
            return;
        }
        JsonObject status = gateway.getServerStatus(serverId);
        if (status == null) {
            message.fail(MCPResponse.ErrorCodes.UNKNOWN_SERVER, "Unknown server " + serverId);
        } else {
            message.reply(status);
        }
    }

    private void handleTools(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId is required");
            return;
        }
        gateway.getTools(serverId)
            .onSuccess(tools -> message.reply(new JsonObject()
                .put("serverId", serverId)
                .put("tools", tools)))
            .onFailure(err -> fail(message, err));
    }

    private void handleMetrics(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.reply(gateway.getAllMetrics());
        } else if (!gateway.getConnections().isManaged(serverId)) {
            message.fail(MCPResponse.ErrorCodes.UNKNOWN_SERVER, "Unknown server " + serverId);
        } else {
            message.reply(gateway.getServerMetrics(serverId));
        }
    }

    private void handleMetricsReset(Message<JsonObject> message) {
        String serverId = serverId(message);
        gateway.resetMetrics(serverId);
        message.reply(new JsonObject().put("reset", true).put("serverId", serverId));
    }

    /**
     * Body: {@code {subscriberId?, address}}. Snapshots are published to {@code address}.
     */
    private void handleSubscribe(Message<JsonObject> message) {
        JsonObject body = message.body();
        String address = body != null ? body.getString("address") : null;
        if (address == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "address is required");
            return;
        }
        String subscriberId = body.getString("subscriberId", "eventbus-" + UUID.randomUUID());
        EventBusCaller caller = new EventBusCaller(vertx, subscriberId, address);
        EventBusCaller previous = subscribers.put(subscriberId, caller);
        if (previous != null) {
            previous.close();
        }
        gateway.subscribeStatus(caller);
        if (logLevel >= 2) vertx.eventBus().publish("log", "Status subscriber " + subscriberId + " at " + address + ",2,MCPProxyGatewayVerticle,Subscribe,Status");
        message.reply(new JsonObject().put("subscriberId", subscriberId).put("subscribed", true));
    }

    private void handleUnsubscribe(Message<JsonObject> message) {
        JsonObject body = message.body();
        String subscriberId = body != null ? body.getString("subscriberId") : null;
        if (subscriberId == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "subscriberId is required");
            return;
        }
        EventBusCaller caller = subscribers.remove(subscriberId);
        if (caller != null) {
            caller.close();
        }
        gateway.unsubscribeStatus(subscriberId);
        message.reply(new JsonObject().put("subscriberId", subscriberId).put("subscribed", false));
    }

    private void handleConnect(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId is required");
            return;
        }
        gateway.connectServer(serverId)
            .onSuccess(connected -> message.reply(new JsonObject()
                .put("serverId", serverId)
                .put("success", connected)))
            .onFailure(err -> fail(message, err));
    }

    private void handleDisconnect(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId is required");
            return;
        }
        gateway.disconnectServer(serverId)
            .onSuccess(v -> message.reply(new JsonObject()
                .put("serverId", serverId)
                .put("success", true)))
            .onFailure(err -> fail(message, err));
    }

    private void handlePing(Message<JsonObject> message) {
        String serverId = serverId(message);
        if (serverId == null) {
            message.fail(MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId is required");
            return;
        }
        gateway.pingServer(serverId).onSuccess(result -> message.reply(result.put("serverId", serverId)));
    }

    private static String serverId(Message<JsonObject> message) {
        return message.body() != null ? message.body().getString("serverId") : null;
    }

    private void fail(Message<JsonObject> message, Throwable err) {
        if (err instanceof MCPGatewayException) {
            MCPGatewayException gatewayError = (MCPGatewayException) err;
            if (gatewayError.getUpstreamResponse() != null) {
                message.reply(gatewayError.getUpstreamResponse().toJson());
                return;
            }
            message.fail(gatewayError.getCode(), gatewayError.getMessage());
            return;
        }
        vertx.eventBus().publish("log", "Unexpected gateway failure: " + err.getMessage() + ",0,MCPProxyGatewayVerticle,Reply,Gateway");
        message.fail(MCPResponse.ErrorCodes.INTERNAL_ERROR, String.valueOf(err.getMessage()));
    }
}
