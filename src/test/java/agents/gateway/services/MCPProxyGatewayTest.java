package agents.gateway.services;

import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.EventBusAuditSink;
import agents.gateway.directory.InMemoryServerDirectory;
import agents.gateway.directory.InMemoryToolCatalog;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.discovery.MCPToolDiscoveryService;
import agents.gateway.support.RecordingCaller;
import agents.gateway.support.TestServers;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The assembled gateway against the simulated backend, driven through its facade and
 * through the event bus API.
 */
@ExtendWith(VertxExtension.class)
public class MCPProxyGatewayTest {

    private InMemoryServerDirectory directory;
    private MCPProxyGateway gateway;
    private Future<JsonObject> discovered;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        GatewayConfig config = TestServers.config().setTransportMode(GatewayConfig.TRANSPORT_SIMULATED);
        directory = new InMemoryServerDirectory(vertx).seed(config.getServers());
        gateway = new MCPProxyGateway(vertx, config, directory, new InMemoryToolCatalog(), new EventBusAuditSink(vertx));

        Promise<JsonObject> toolsUpdated = Promise.promise();
        vertx.eventBus().<JsonObject>consumer(MCPToolDiscoveryService.TOOLS_UPDATED_ADDRESS, msg -> toolsUpdated.tryComplete(msg.body()));
        discovered = toolsUpdated.future();

        vertx.deployVerticle(new MCPProxyGatewayVerticle(gateway))
            .onComplete(testContext.succeedingThenComplete());
    }

    private static JsonObject tool(Object id, String name, JsonObject arguments) {
        return new JsonObject()
            .put("jsonrpc", "2.0")
            .put("id", id)
            .put("method", "tools/call")
            .put("params", new JsonObject().put("name", name).put("arguments", arguments));
    }

    @Test
    @DisplayName("Simulated tools are discovered and still listed from the catalog once disconnected")
    void toolsFromLiveListAndCatalog(VertxTestContext testContext) {
        discovered
            .compose(event -> {
                Assertions.assertEquals("r1", event.getString("serverId"));
                return gateway.getTools("r1");
            })
            .compose(live -> {
                Assertions.assertEquals(2, live.size());
                return gateway.disconnectServer("r1");
            })
            .compose(v -> gateway.getTools("r1"))
            .onComplete(testContext.succeeding(fromCatalog -> testContext.verify(() -> {
                Assertions.assertEquals(2, fromCatalog.size());
                Assertions.assertEquals("mock.echo", fromCatalog.getJsonObject(0).getString("name"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A generating tool streams its chunks before the final result")
    void streamsChunks(VertxTestContext testContext) {
        List<JsonObject> chunks = new CopyOnWriteArrayList<>();
        JsonObject request = tool("gen-1", "mock.generate", new JsonObject().put("prompt", "hi").put("max_tokens", 3));

        gateway.forwardRequest("r1", request, new RecordingCaller("caller"), chunks::add)
            .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
                Assertions.assertEquals(3, chunks.size());
                Assertions.assertEquals("mcpStreamChunk", chunks.get(0).getString("type"));
                Assertions.assertEquals("token1 token2 token3", response.getJsonObject("result").getString("text"));
                Assertions.assertEquals(1L, gateway.getServerMetrics("r1").getJsonObject("tools")
                    .getJsonObject("mock.generate").getLong("successfulRequests"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Forwarding over the event bus replies with the upstream envelope, errors included")
    void forwardOverEventBus(Vertx vertx, VertxTestContext testContext) {
        JsonObject echo = new JsonObject()
            .put("serverId", "r1")
            .put("request", tool(1, "mock.echo", new JsonObject().put("message", "hello")));
        JsonObject missing = new JsonObject()
            .put("serverId", "r1")
            .put("request", tool(2, "mock.missing", new JsonObject()));

        vertx.eventBus().<JsonObject>request(MCPProxyGatewayVerticle.FORWARD, echo)
            .compose(reply -> {
                Assertions.assertEquals("hello", reply.body().getJsonObject("result").getString("content"));
                return vertx.eventBus().<JsonObject>request(MCPProxyGatewayVerticle.FORWARD, missing);
            })
            .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                Assertions.assertEquals(2, reply.body().getInteger("id"));
                Assertions.assertEquals(MCPResponse.ErrorCodes.METHOD_NOT_FOUND,
                    reply.body().getJsonObject("error").getInteger("code"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Event bus failures carry the JSON-RPC code of the error")
    void eventBusFailureCodes(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().request(MCPProxyGatewayVerticle.STATUS, new JsonObject().put("serverId", "nowhere"))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertTrue(err instanceof ReplyException);
                Assertions.assertEquals(MCPResponse.ErrorCodes.UNKNOWN_SERVER, ((ReplyException) err).failureCode());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Metrics for a server nobody manages are refused and leave no record behind")
    void metricsForUnknownServer(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().request(MCPProxyGatewayVerticle.METRICS, new JsonObject().put("serverId", "ghost"))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertTrue(err instanceof ReplyException);
                Assertions.assertEquals(MCPResponse.ErrorCodes.UNKNOWN_SERVER, ((ReplyException) err).failureCode());
                Assertions.assertFalse(gateway.getAllMetrics().containsKey("ghost"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A subscribed address receives a snapshot right away and again on changes")
    void statusSubscription(Vertx vertx, VertxTestContext testContext) {
        List<JsonObject> pushed = new CopyOnWriteArrayList<>();
        Promise<JsonObject> afterDisconnect = Promise.promise();
        vertx.eventBus().<JsonObject>consumer("test.status", msg -> {
            pushed.add(msg.body());
            JsonArray servers = msg.body().getJsonArray("servers");
            if (pushed.size() > 1 && "disconnected".equals(servers.getJsonObject(0).getString("status"))) {
                afterDisconnect.tryComplete(msg.body());
            }
        });

        vertx.eventBus().<JsonObject>request(MCPProxyGatewayVerticle.SUBSCRIBE, new JsonObject().put("address", "test.status"))
            .compose(reply -> {
                Assertions.assertTrue(reply.body().getBoolean("subscribed"));
                return gateway.disconnectServer("r1");
            })
            .compose(v -> afterDisconnect.future())
            .onComplete(testContext.succeeding(status -> testContext.verify(() -> {
                Assertions.assertEquals("serverStatus", pushed.get(0).getString("type"));
                Assertions.assertEquals("connected", pushed.get(0).getJsonArray("servers").getJsonObject(0).getString("status"));
                Assertions.assertEquals("r1", status.getJsonArray("servers").getJsonObject(0).getString("serverId"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A subscriber gets the current snapshot as soon as it subscribes")
    void snapshotOnSubscribe(VertxTestContext testContext) {
        RecordingCaller subscriber = new RecordingCaller("watcher");

        gateway.subscribeStatus(subscriber);

        subscriber.nextOfType("serverStatus").onComplete(testContext.succeeding(status -> testContext.verify(() -> {
            JsonArray servers = status.getJsonArray("servers");
            Assertions.assertEquals(2, servers.size());
            Assertions.assertEquals("r1", servers.getJsonObject(0).getString("serverId"));
            Assertions.assertEquals("closed", servers.getJsonObject(0).getString("circuit"));
            Assertions.assertEquals("r2", servers.getJsonObject(1).getString("serverId"));
            Assertions.assertFalse(servers.getJsonObject(1).getBoolean("active"));
            testContext.completeNow();
        })));
    }

    @Test
    @DisplayName("Removing a server from the directory drops its connection and status")
    void removalFromDirectory(Vertx vertx, VertxTestContext testContext) {
        Promise<Void> removed = Promise.promise();
        vertx.eventBus().<JsonObject>consumer(MCPConnectionManager.STATE_ADDRESS, msg -> {
            if (MCPConnectionManager.STATE_REMOVED.equals(msg.body().getString("state"))) {
                removed.tryComplete();
            }
        });

        directory.removeServer("r1");

        removed.future()
            .compose(v -> gateway.getTools("r1"))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertNull(gateway.getServerStatus("r1"));
                Assertions.assertEquals(1, gateway.getServerStatuses().size());
                testContext.completeNow();
            })));
    }
}
