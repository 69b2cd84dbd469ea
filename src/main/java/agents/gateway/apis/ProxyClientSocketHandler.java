package agents.gateway.apis;

import agents.gateway.mcp.base.CallerHandle;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.services.LogUtil;
import agents.gateway.services.MCPProxyGateway;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import java.util.Set;
import java.util.UUID;

/**
 * Internal clients on {@code /ws/mcp-proxy}.
 *
 * <p>Each socket is a {@link CallerHandle}: it is subscribed to status pushes on connect
 * (and gets a snapshot straight away), receives stream chunks and unsolicited upstream
 * traffic, and is unsubscribed when it closes. Client messages are JSON objects
 * dispatched on {@code type}.</p>
 */
public class ProxyClientSocketHandler implements Handler<ServerWebSocket> {

  private static final Set<String> SERVER_MESSAGES =
    Set.of("connectServer", "disconnectServer", "getServerTools", "mcpRequest", "pingServer");

  private final Vertx vertx;
  private final MCPProxyGateway gateway;

  public ProxyClientSocketHandler(Vertx vertx, MCPProxyGateway gateway) {
    this.vertx = vertx;
    this.gateway = gateway;
  }

  @Override
  public void handle(ServerWebSocket ws) {
    SocketCaller caller = new SocketCaller("ws-" + UUID.randomUUID(), ws);
    LogUtil.logDetail(vertx, "Proxy client connected " + caller.id() + " from " + ws.remoteAddress(), "ProxyClientSocketHandler", "Connect", "WebSocket");

    ws.closeHandler(v -> {
      gateway.unsubscribeStatus(caller.id());
      LogUtil.logDetail(vertx, "Proxy client closed " + caller.id(), "ProxyClientSocketHandler", "Close", "WebSocket");
    });
    ws.exceptionHandler(err ->
      LogUtil.logError(vertx, "Proxy client socket error on " + caller.id(), err, "ProxyClientSocketHandler", "Socket", "WebSocket"));
    ws.textMessageHandler(text -> onMessage(caller, text));

    gateway.subscribeStatus(caller);
  }

  private void onMessage(SocketCaller caller, String text) {
    JsonObject message;
    try {
      message = new JsonObject(text);
    } catch (DecodeException e) {
      caller.deliver(error(null, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Malformed message"));
      return;
    }

    String type = message.getValue("type") instanceof String ? message.getString("type") : "";
    String serverId = message.getValue("serverId") instanceof String ? message.getString("serverId") : null;
    if (SERVER_MESSAGES.contains(type) && (serverId == null || serverId.isEmpty())) {
      caller.deliver(error(null, message.getValue("requestId"), MCPResponse.ErrorCodes.INVALID_REQUEST, "serverId is required"));
      return;
    }
    switch (type) {
      case "getServerStatus":
        caller.deliver(gateway.getBroadcaster().statusMessage());
        break;
      case "connectServer":
        gateway.connectServer(serverId)
          .onSuccess(connected -> caller.deliver(new JsonObject()
            .put("type", "connectServerResult")
            .put("serverId", serverId)
            .put("success", connected)))
          .onFailure(err -> caller.deliver(new JsonObject()
            .put("type", "connectServerResult")
            .put("serverId", serverId)
            .put("success", false)
            .put("error", err.getMessage())));
        break;
      case "disconnectServer":
        gateway.disconnectServer(serverId)
          .onSuccess(v -> caller.deliver(new JsonObject()
            .put("type", "disconnectServerResult")
            .put("serverId", serverId)
            .put("success", true)))
          .onFailure(err -> caller.deliver(new JsonObject()
            .put("type", "disconnectServerResult")
            .put("serverId", serverId)
            .put("success", false)
            .put("error", err.getMessage())));
        break;
      case "getServerTools":
        gateway.getTools(serverId)
          .onSuccess(tools -> caller.deliver(new JsonObject()
            .put("type", "serverTools")
            .put("serverId", serverId)
            .put("tools", tools)))
          .onFailure(err -> caller.deliver(error(serverId, null, codeOf(err), err.getMessage())));
        break;
      case "mcpRequest":
        forward(caller, serverId, message);
        break;
      case "pingServer":
        gateway.pingServer(serverId).onSuccess(result -> caller.deliver(result
          .put("type", "pingServerResult")
          .put("serverId", serverId)));
        break;
      default:
        caller.deliver(error(serverId, message.getValue("requestId"), MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Unknown message type " + type));
    }
  }

  private void forward(SocketCaller caller, String serverId, JsonObject message) {
    Object requestId = message.getValue("requestId");
    JsonObject request = message.getValue("request") instanceof JsonObject ? message.getJsonObject("request") : null;
    if (request == null) {
      caller.deliver(error(serverId, requestId, MCPResponse.ErrorCodes.INVALID_REQUEST, "request is required"));
      return;
    }
    Object clientRequestId = requestId != null ? requestId : request.getValue("id");
    long start = System.currentTimeMillis();

    // Chunks carry the client's own request id
    Handler<JsonObject> chunks = chunk -> caller.deliver(chunk.put("requestId", clientRequestId));

    gateway.forwardRequest(serverId, request, caller, chunks)
      .onSuccess(response -> caller.deliver(response(serverId, clientRequestId, response, start)))
      .onFailure(err -> {
        if (err instanceof MCPGatewayException && ((MCPGatewayException) err).getUpstreamResponse() != null) {
          caller.deliver(response(serverId, clientRequestId, ((MCPGatewayException) err).getUpstreamResponse().toJson(), start));
        } else {
          caller.deliver(error(serverId, clientRequestId, codeOf(err), err.getMessage()));
        }
      });
  }

  private static JsonObject response(String serverId, Object requestId, JsonObject data, long start) {
    return new JsonObject()
      .put("type", "mcpResponse")
      .put("serverId", serverId)
      .put("requestId", requestId)
      .put("data", data)
      .put("latency", System.currentTimeMillis() - start);
  }

  private static JsonObject error(String serverId, Object requestId, int code, String message) {
    return new JsonObject()
      .put("type", "error")
      .put("serverId", serverId)
      .put("requestId", requestId)
      .put("error", new JsonObject()
        .put("code", code)
        .put("message", message));
  }

  private static int codeOf(Throwable err) {
    return err instanceof MCPGatewayException
      ? ((MCPGatewayException) err).getCode()
      : MCPResponse.ErrorCodes.INTERNAL_ERROR;
  }

  private static class SocketCaller implements CallerHandle {
    private final String id;
    private final ServerWebSocket ws;

    SocketCaller(String id, ServerWebSocket ws) {
      this.id = id;
      this.ws = ws;
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public void deliver(JsonObject message) {
      if (!ws.isClosed()) {
        ws.writeTextMessage(message.encode());
      }
    }

    @Override
    public boolean isOpen() {
      return !ws.isClosed();
    }
  }
}
