package agents.gateway.services;

import agents.gateway.apis.MCPProxyApi;
import agents.gateway.apis.MCPStatus;
import agents.gateway.apis.ProxyClientSocketHandler;
import agents.gateway.config.GatewayConfig;
import agents.gateway.mcp.base.MCPResponse;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;
import io.vertx.ext.web.handler.ErrorHandler;

import java.util.HashSet;
import java.util.Set;

/**
 * HTTP front door of the gateway.
 * Serves the proxy and status endpoints and accepts internal WebSocket clients on
 * {@value #WEBSOCKET_PATH}.
 */
public class MCPRouterService extends AbstractVerticle {

    public static final String READY_ADDRESS = "mcp.router.ready";
    public static final String WEBSOCKET_PATH = "/ws/mcp-proxy";

    private final MCPProxyGateway gateway;
    private final GatewayConfig config;

    private Router mainRouter;
    private HttpServer httpServer;
    private int actualPort;

    public MCPRouterService(MCPProxyGateway gateway, GatewayConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);

        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> {
            ctx.response()
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("status", "healthy")
                    .put("circuitsHealthy", gateway.getBreakers().isHealthy())
                    .put("timestamp", System.currentTimeMillis())
                    .toString());
        });

        MCPStatus.setRouter(mainRouter, vertx);
        MCPProxyApi.setRouter(mainRouter, gateway);

        HttpServerOptions options = new HttpServerOptions()
            .setPort(config.getHttpPort())
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true)
            .setMaxWebSocketMessageSize(config.getMaxMessageSize());

        ProxyClientSocketHandler sockets = new ProxyClientSocketHandler(vertx, gateway);
        httpServer = vertx.createHttpServer(options);

        httpServer
            .webSocketHandler(ws -> {
                if (!WEBSOCKET_PATH.equals(ws.path())) {
                    ws.close((short) 1008, "Unknown path");
                    return;
                }
                sockets.handle(ws);
            })
            .requestHandler(mainRouter)
            .listen(result -> {
                if (result.succeeded()) {
                    actualPort = result.result().actualPort();
                    LogUtil.logInfo(vertx, "MCPRouterService started on port " + actualPort, "MCPRouterService", "Start", "HTTP");

                    vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                        .put("port", actualPort)
                        .put("address", "localhost")
                        .put("timestamp", System.currentTimeMillis()));

                    startPromise.complete();
                } else {
                    LogUtil.logError(vertx, "Failed to start MCPRouterService", result.cause(), "MCPRouterService", "Start", "HTTP");
                    startPromise.fail(result.cause());
                }
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigin("*")
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create()
            .setBodyLimit(config.getHttpBodyLimit()));

        mainRouter.route("/mcp/*").handler(ctx -> {
            ctx.response().putHeader("content-type", "application/json");
            ctx.next();
        });

        mainRouter.route().failureHandler(ErrorHandler.create(vertx));

        // Anything that escapes a /mcp handler still answers as JSON-RPC
        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode();

            if (statusCode == -1) {
                statusCode = 500;
            }
            if (failure != null) {
                LogUtil.logError(vertx, "Unhandled failure on " + ctx.request().path(), failure, "MCPRouterService", "Failure", "HTTP");
            }

            JsonObject error = MCPResponse.error(null, MCPResponse.ErrorCodes.INTERNAL_ERROR,
                failure != null ? String.valueOf(failure.getMessage()) : "Unknown error").toJson();

            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(error.encode());
        });
    }

    /**
     * Port the server is bound to; differs from the configured one when that was 0.
     */
    public int getActualPort() {
        return actualPort;
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (httpServer != null) {
            httpServer.close(result -> {
                if (result.succeeded()) {
                    LogUtil.logDetail(vertx, "MCPRouterService stopped", "MCPRouterService", "Stop", "HTTP");
                    stopPromise.complete();
                } else {
                    LogUtil.logError(vertx, "Failed to stop MCPRouterService", result.cause(), "MCPRouterService", "Stop", "HTTP");
                    stopPromise.fail(result.cause());
                }
            });
        } else {
            stopPromise.complete();
        }
    }
}
