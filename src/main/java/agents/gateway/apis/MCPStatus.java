package agents.gateway.apis;

import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.services.MCPProxyGatewayVerticle;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;

/**
 * Read-side HTTP endpoints: server status, tools and metrics.
 * Each route asks the gateway verticle over the event bus.
 */
public class MCPStatus {

  private MCPStatus() {
  }

  /**
   * Configure the router with the status endpoints
   * @param parentRouter The parent router to attach to
   */
  public static void setRouter(Router parentRouter, Vertx vertx) {
    // Every server with circuit health
    parentRouter.get("/mcp/status").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.STATUS, new JsonObject()));

    parentRouter.get("/mcp/servers").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.STATUS, new JsonObject()));

    parentRouter.get("/mcp/servers/:serverId").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.STATUS, serverBody(ctx)));

    parentRouter.get("/mcp/servers/:serverId/tools").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.TOOLS, serverBody(ctx)));

    parentRouter.get("/mcp/metrics").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.METRICS, new JsonObject()));

    parentRouter.get("/mcp/servers/:serverId/metrics").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.METRICS, serverBody(ctx)));

    parentRouter.post("/mcp/metrics/reset").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.METRICS_RESET, new JsonObject()));

    parentRouter.post("/mcp/servers/:serverId/metrics/reset").handler(ctx ->
      relay(vertx, ctx, MCPProxyGatewayVerticle.METRICS_RESET, serverBody(ctx)));
  }

  private static JsonObject serverBody(RoutingContext ctx) {
    return new JsonObject().put("serverId", ctx.pathParam("serverId"));
  }

  private static void relay(Vertx vertx, RoutingContext ctx, String address, JsonObject body) {
    vertx.eventBus().<JsonObject>request(address, body)
      .onSuccess(reply -> ctx.response()
        .putHeader("content-type", "application/json")
        .setStatusCode(200)
        .end(reply.body().encode()))
      .onFailure(err -> {
        int code = err instanceof ReplyException ? ((ReplyException) err).failureCode() : MCPResponse.ErrorCodes.INTERNAL_ERROR;
        ctx.response()
          .putHeader("content-type", "application/json")
          .setStatusCode(httpStatusFor(code))
          .end(MCPResponse.error(null, code, String.valueOf(err.getMessage())).toJson().encode());
      });
  }

  /**
   * HTTP status for a gateway JSON-RPC error code; 503 when the gateway did not answer.
   */
  static int httpStatusFor(int code) {
    for (MCPGatewayException.Kind kind : MCPGatewayException.Kind.values()) {
      if (kind != MCPGatewayException.Kind.UPSTREAM_ERROR && kind.code() == code) {
        return kind.httpStatus();
      }
    }
    return 503;
  }
}
