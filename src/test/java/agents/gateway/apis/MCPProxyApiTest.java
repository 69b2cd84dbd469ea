package agents.gateway.apis;

import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.InMemoryServerDirectory;
import agents.gateway.directory.InMemoryToolCatalog;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.mcp.resilience.CircuitBreaker;
import agents.gateway.services.MCPProxyGateway;
import agents.gateway.services.MCPProxyGatewayVerticle;
import agents.gateway.services.MCPRouterService;
import agents.gateway.support.MockTransportFactory;
import agents.gateway.support.TestServers;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@ExtendWith(VertxExtension.class)
public class MCPProxyApiTest {

    private MockTransportFactory transports;
    private MCPProxyGateway gateway;
    private WebClient client;
    private int port;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        GatewayConfig config = TestServers.config().setHttpPort(0);
        transports = new MockTransportFactory().echo();
        InMemoryServerDirectory directory = new InMemoryServerDirectory(vertx).seed(config.getServers());
        gateway = new MCPProxyGateway(vertx, config, directory, new InMemoryToolCatalog(), event -> { },
            transports, System::currentTimeMillis);
        MCPRouterService http = new MCPRouterService(gateway, config);
        client = WebClient.create(vertx);

        vertx.deployVerticle(new MCPProxyGatewayVerticle(gateway))
            .compose(id -> vertx.deployVerticle(http))
            .onComplete(testContext.succeeding(id -> {
                port = http.getActualPort();
                testContext.completeNow();
            }));
    }

    private Future<HttpResponse<Buffer>> post(String path, String body) {
        return client.post(port, "localhost", path)
            .putHeader("content-type", "application/json")
            .sendBuffer(Buffer.buffer(body));
    }

    @Test
    @DisplayName("A request to a connected server comes back with the upstream's result")
    void proxiesToConnectedServer(VertxTestContext testContext) {
        post("/mcp/proxy/r1", TestServers.runTool(7, "echo").encode())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonObject body = response.bodyAsJsonObject();
                Assertions.assertEquals(7, body.getInteger("id"));
                Assertions.assertEquals("echo", body.getJsonObject("result").getJsonObject("echo").getString("tool_name"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A request without an id is given one")
    void assignsMissingId(VertxTestContext testContext) {
        JsonObject request = TestServers.runTool(null, "echo");
        request.remove("id");

        post("/mcp/proxy/r1", request.encode())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertTrue(response.bodyAsJsonObject().getString("id").startsWith("http_"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("An inactive server answers 502 with NOT_CONNECTED")
    void notConnected(VertxTestContext testContext) {
        post("/mcp/proxy/r2", TestServers.runTool(1, "echo").encode())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(502, response.statusCode());
                JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                Assertions.assertEquals(MCPGatewayException.Kind.NOT_CONNECTED.code(), error.getInteger("code"));
                Assertions.assertEquals(1, response.bodyAsJsonObject().getInteger("id"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("An unknown server answers 404")
    void unknownServer(VertxTestContext testContext) {
        post("/mcp/proxy/nowhere", TestServers.runTool(1, "echo").encode())
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(404, response.statusCode());
                Assertions.assertEquals(MCPGatewayException.Kind.UNKNOWN_SERVER.code(),
                    response.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Malformed bodies answer 400 with an invalid request error")
    void malformedBody(VertxTestContext testContext) {
        post("/mcp/proxy/r1", "{ not json")
            .compose(response -> {
                Assertions.assertEquals(400, response.statusCode());
                Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_REQUEST,
                    response.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                return post("/mcp/proxy/r1", "{\"id\":3,\"params\":{}}");
            })
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(400, response.statusCode());
                Assertions.assertEquals(3, response.bodyAsJsonObject().getInteger("id"));
                Assertions.assertEquals(0, transports.latest().getWritten().stream()
                    .filter(frame -> Integer.valueOf(3).equals(frame.getValue("id"))).count());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("An open circuit answers 503 without touching the upstream")
    void circuitOpen(VertxTestContext testContext) {
        CircuitBreaker breaker = gateway.getBreakers().forServer("r1");
        Future<Void> tripped = Future.succeededFuture();
        for (int i = 0; i < breaker.getOptions().getFailureThreshold(); i++) {
            tripped = tripped.compose(v -> breaker.<Void>execute(() -> Future.failedFuture(
                new MCPGatewayException(MCPGatewayException.Kind.TIMEOUT, "Request timeout"))).otherwiseEmpty());
        }
        int writtenBefore = transports.latest().getWritten().size();

        tripped
            .compose(v -> post("/mcp/proxy/r1", TestServers.runTool(9, "echo").encode()))
            .compose(response -> {
                Assertions.assertEquals(503, response.statusCode());
                Assertions.assertEquals(MCPGatewayException.Kind.CIRCUIT_OPEN.code(),
                    response.bodyAsJsonObject().getJsonObject("error").getInteger("code"));
                Assertions.assertEquals(writtenBefore, transports.latest().getWritten().size());
                return client.get(port, "localhost", "/mcp/servers/r1").send();
            })
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertEquals("open", response.bodyAsJsonObject().getString("circuit"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Status lists every server and unknown ones are 404")
    void statusEndpoints(VertxTestContext testContext) {
        client.get(port, "localhost", "/mcp/status").send()
            .compose(response -> {
                Assertions.assertEquals(200, response.statusCode());
                JsonObject body = response.bodyAsJsonObject();
                Assertions.assertEquals(2, body.getJsonArray("servers").size());
                Assertions.assertEquals("connected", body.getJsonArray("servers").getJsonObject(0).getString("status"));
                Assertions.assertEquals("disconnected", body.getJsonArray("servers").getJsonObject(1).getString("status"));
                return client.get(port, "localhost", "/mcp/servers/nowhere").send();
            })
            .compose(response -> {
                Assertions.assertEquals(404, response.statusCode());
                return client.get(port, "localhost", "/health").send();
            })
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertTrue(response.bodyAsJsonObject().getBoolean("circuitsHealthy"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Disconnect and connect through the control endpoints")
    void connectionControls(VertxTestContext testContext) {
        post("/mcp/servers/r1/disconnect", "{}")
            .compose(response -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertNull(gateway.getConnections().getConnection("r1"));
                return post("/mcp/proxy/r1", TestServers.runTool(2, "echo").encode());
            })
            .compose(response -> {
                Assertions.assertEquals(502, response.statusCode());
                return post("/mcp/servers/r1/connect", "{}");
            })
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(200, response.statusCode());
                Assertions.assertTrue(response.bodyAsJsonObject().getBoolean("success"));
                Assertions.assertEquals(2, transports.openCount());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("WebSocket clients get a snapshot on connect and answers to their requests")
    void webSocketClient(Vertx vertx, VertxTestContext testContext) {
        vertx.createHttpClient().webSocket(port, "localhost", MCPRouterService.WEBSOCKET_PATH)
            .compose(ws -> {
                Promise<JsonObject> snapshot = Promise.promise();
                Promise<JsonObject> answer = Promise.promise();
                ws.textMessageHandler(text -> {
                    JsonObject message = new JsonObject(text);
                    if ("serverStatus".equals(message.getString("type"))) {
                        snapshot.tryComplete(message);
                    } else if ("mcpResponse".equals(message.getString("type"))) {
                        answer.tryComplete(message);
                    }
                });
                return snapshot.future().compose(status -> {
                    Assertions.assertEquals(2, status.getJsonArray("servers").size());
                    return send(ws, new JsonObject()
                        .put("type", "mcpRequest")
                        .put("serverId", "r1")
                        .put("requestId", "ws-1")
                        .put("request", TestServers.runTool("ws-1", "echo")));
                }).compose(v -> answer.future());
            })
            .onComplete(testContext.succeeding(answer -> testContext.verify(() -> {
                Assertions.assertEquals("r1", answer.getString("serverId"));
                Assertions.assertEquals("ws-1", answer.getString("requestId"));
                Assertions.assertEquals("ws-1", answer.getJsonObject("data").getString("id"));
                Assertions.assertNotNull(answer.getLong("latency"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("WebSocket messages without a serverId are answered with an invalid request error")
    void webSocketRequiresServerId(Vertx vertx, VertxTestContext testContext) {
        List<JsonObject> errors = new CopyOnWriteArrayList<>();
        Promise<Void> bothAnswered = Promise.promise();

        vertx.createHttpClient().webSocket(port, "localhost", MCPRouterService.WEBSOCKET_PATH)
            .compose(ws -> {
                ws.textMessageHandler(text -> {
                    JsonObject message = new JsonObject(text);
                    if ("error".equals(message.getString("type"))) {
                        errors.add(message);
                        if (errors.size() == 2) {
                            bothAnswered.tryComplete();
                        }
                    }
                });
                return send(ws, new JsonObject()
                    .put("type", "mcpRequest")
                    .put("requestId", "x1")
                    .put("request", TestServers.runTool("x1", "echo")))
                    .compose(v -> send(ws, new JsonObject().put("type", "connectServer")));
            })
            .compose(v -> bothAnswered.future())
            .onComplete(testContext.succeeding(v -> testContext.verify(() -> {
                for (JsonObject error : errors) {
                    Assertions.assertEquals(MCPResponse.ErrorCodes.INVALID_REQUEST, error.getJsonObject("error").getInteger("code"));
                }
                Assertions.assertEquals("x1", errors.get(0).getString("requestId"));
                Assertions.assertEquals(0, transports.latest().getWritten().stream()
                    .filter(frame -> "x1".equals(frame.getValue("id"))).count());
                Assertions.assertEquals(1, transports.openCount());
                testContext.completeNow();
            })));
    }

    private static Future<Void> send(WebSocket ws, JsonObject message) {
        return ws.writeTextMessage(message.encode());
    }
}
