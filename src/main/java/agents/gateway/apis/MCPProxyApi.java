package agents.gateway.apis;

import agents.gateway.config.GatewayConfig;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.mcp.transport.MCPHttpUpstreamClient;
import agents.gateway.services.LogUtil;
import agents.gateway.services.MCPProxyGateway;
import io.vertx.core.Future;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * HTTP proxy endpoint and connection controls.
 *
 * <p>{@code POST /mcp/proxy/:serverId} takes a JSON-RPC request and answers with the
 * upstream's JSON-RPC response verbatim, application errors included, with status 200.
 * Gateway-side failures are JSON-RPC error envelopes with the status of their kind.</p>
 */
public class MCPProxyApi {

  private MCPProxyApi() {
  }

  public static void setRouter(Router parentRouter, MCPProxyGateway gateway) {
    parentRouter.post("/mcp/proxy/:serverId").handler(ctx -> handleProxy(ctx, gateway));

    parentRouter.post("/mcp/servers/:serverId/connect").handler(ctx -> {
      String serverId = ctx.pathParam("serverId");
      gateway.connectServer(serverId)
        .onSuccess(connected -> respond(ctx, 200, new JsonObject()
          .put("serverId", serverId)
          .put("success", connected)
          .put("status", gateway.getServerStatus(serverId))))
        .onFailure(err -> respondError(ctx, err, null));
    });

    parentRouter.post("/mcp/servers/:serverId/disconnect").handler(ctx -> {
      String serverId = ctx.pathParam("serverId");
      gateway.disconnectServer(serverId)
        .onSuccess(v -> respond(ctx, 200, new JsonObject()
          .put("serverId", serverId)
          .put("success", true)))
        .onFailure(err -> respondError(ctx, err, null));
    });

    parentRouter.post("/mcp/servers/:serverId/ping").handler(ctx -> {
      String serverId = ctx.pathParam("serverId");
      if (!gateway.getConnections().isManaged(serverId)) {
        respondError(ctx, new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId), null);
        return;
      }
      gateway.pingServer(serverId)
        .onSuccess(result -> respond(ctx, 200, result.put("serverId", serverId)));
    });
  }

  private static void handleProxy(RoutingContext ctx, MCPProxyGateway gateway) {
    String serverId = ctx.pathParam("serverId");

    JsonObject request;
    try {
      request = ctx.body().asJsonObject();
    } catch (DecodeException e) {
      request = null;
    }
    if (request == null || !(request.getValue("method") instanceof String)) {
      Object id = request != null ? request.getValue("id") : null;
      respond(ctx, 400, MCPResponse.error(id, MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request: missing method").toJson());
      return;
    }
    if (request.getValue("id") == null) {
      request.put("id", gateway.nextHttpRequestId());
    }
    Object requestId = request.getValue("id");

    boolean viaHttp = GatewayConfig.HTTP_UPSTREAM_HTTP.equals(gateway.getConfig().getHttpUpstreamMode());
    Future<JsonObject> result = viaHttp
      ? gateway.forwardHttp(serverId, request)
      : gateway.forwardRequest(serverId, request, null);

    result
      .onSuccess(response -> respond(ctx, 200, response))
      .onFailure(err -> respondError(ctx, err, requestId));
  }

  private static void respondError(RoutingContext ctx, Throwable err, Object requestId) {
    if (err instanceof MCPGatewayException) {
      MCPGatewayException gatewayError = (MCPGatewayException) err;
      respond(ctx, gatewayError.getKind().httpStatus(), gatewayError.toJsonRpc(requestId));
      return;
    }
    if (err instanceof MCPHttpUpstreamClient.UpstreamHttpException) {
      MCPHttpUpstreamClient.UpstreamHttpException httpError = (MCPHttpUpstreamClient.UpstreamHttpException) err;
      respond(ctx, httpError.getStatusCode(), MCPResponse.error(requestId, MCPResponse.ErrorCodes.SERVER_ERROR,
        "MCP server error", httpError.getBody()).toJson());
      return;
    }
    if (err instanceof MCPHttpUpstreamClient.NoResponseException) {
      respond(ctx, 504, MCPResponse.error(requestId, MCPResponse.ErrorCodes.SERVER_ERROR,
        "MCP server timeout or no response").toJson());
      return;
    }
    LogUtil.logError(ctx.vertx(), "Proxy request failed", err, "MCPProxyApi", "Proxy", "HTTP");
    ctx.fail(500, err);
  }

  private static void respond(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader("content-type", "application/json")
      .setStatusCode(status)
      .end(body.encode());
  }
}
