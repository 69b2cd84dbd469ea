package agents.gateway.mcp.discovery;

import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.InMemoryServerDirectory;
import agents.gateway.directory.InMemoryToolCatalog;
import agents.gateway.mcp.base.MCPTool;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.metrics.MCPMetricsRegistry;
import agents.gateway.mcp.resilience.CircuitBreakerRegistry;
import agents.gateway.mcp.routing.MCPRequestRouter;
import agents.gateway.mcp.routing.SubscriberRegistry;
import agents.gateway.support.MockTransportFactory;
import agents.gateway.support.TestServers;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@ExtendWith(VertxExtension.class)
public class MCPToolDiscoveryServiceTest {

    private static final JsonObject ECHO_SCHEMA = new JsonObject()
        .put("type", "object")
        .put("properties", new JsonObject().put("message", new JsonObject().put("type", "string")));

    private MockTransportFactory transports;
    private MCPConnectionManager connections;
    private InMemoryToolCatalog catalog;
    private List<JsonObject> audits;
    private MCPToolDiscoveryService discovery;

    @BeforeEach
    void setUp(Vertx vertx) {
        GatewayConfig config = TestServers.config();
        transports = new MockTransportFactory();
        InMemoryServerDirectory directory = new InMemoryServerDirectory(vertx).seed(config.getServers());
        connections = new MCPConnectionManager(vertx, directory, transports, config);
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(vertx, config.getBreakerOptions());
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, config.getMetricsReportEvery());
        MCPRequestRouter router = new MCPRequestRouter(vertx, connections, breakers, metrics, new SubscriberRegistry(vertx), config);
        router.start();

        catalog = new InMemoryToolCatalog();
        audits = new CopyOnWriteArrayList<>();
        discovery = new MCPToolDiscoveryService(vertx, connections, router, catalog, audits::add, config);
    }

    private static MCPTool tool(String name, String description, JsonObject schema) {
        return new MCPTool("r1", name, description, schema);
    }

    private void answerDiscover(JsonArray tools) {
        transports.script((transport, frame) -> {
            if ("mcp.discover".equals(frame.getString("method"))) {
                transport.receive(TestServers.result(frame.getValue("id"), new JsonObject().put("tools", tools)));
            }
        });
    }

    @Test
    @DisplayName("A new connection is discovered and its tools land in the catalog")
    void discoversOnConnect(Vertx vertx, VertxTestContext testContext) {
        answerDiscover(new JsonArray().add(new JsonObject()
            .put("name", "echo")
            .put("description", "Echo back the message")
            .put("inputSchema", ECHO_SCHEMA)));

        vertx.eventBus().<JsonObject>consumer(MCPToolDiscoveryService.TOOLS_UPDATED_ADDRESS, msg -> testContext.verify(() -> {
            Assertions.assertEquals("r1", msg.body().getString("serverId"));
            Assertions.assertEquals(1, connections.getConnection("r1").getTools().size());
            catalog.listTools("r1").onComplete(testContext.succeeding(tools -> testContext.verify(() -> {
                Assertions.assertEquals(1, tools.size());
                Assertions.assertEquals(ECHO_SCHEMA, tools.get(0).getSchema());
                testContext.completeNow();
            })));
        }));

        discovery.start();
        connections.start();
    }

    @Test
    @DisplayName("Later discoveries insert new tools and keep known ones unchanged")
    void syncInsertsOnlyNewTools(VertxTestContext testContext) {
        MCPTool echo = tool("echo", "Echo back the message", ECHO_SCHEMA);
        MCPTool echoWithoutDescription = tool("echo", "", ECHO_SCHEMA);
        MCPTool gen = tool("gen", "Generate text", new JsonObject().put("type", "object"));

        discovery.sync("r1", Collections.singletonList(echo))
            .compose(first -> {
                Assertions.assertEquals(Collections.singletonList("echo"), first.getInserted());
                return discovery.sync("r1", Arrays.asList(echoWithoutDescription, gen));
            })
            .compose(second -> {
                Assertions.assertEquals(Collections.singletonList("gen"), second.getInserted());
                Assertions.assertEquals(Collections.singletonList("echo"), second.getUnchanged());
                Assertions.assertTrue(second.getUpdated().isEmpty());
                return catalog.listTools("r1");
            })
            .onComplete(testContext.succeeding(tools -> testContext.verify(() -> {
                Assertions.assertEquals(2, tools.size());
                MCPTool stored = tools.stream().filter(t -> t.getName().equals("echo")).findFirst().orElseThrow();
                Assertions.assertEquals("Echo back the message", stored.getDescription());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Syncing the same list twice writes nothing the second time")
    void syncIsIdempotent(VertxTestContext testContext) {
        List<MCPTool> tools = Arrays.asList(
            tool("echo", "Echo back the message", ECHO_SCHEMA),
            tool("gen", "Generate text", new JsonObject()));

        discovery.sync("r1", tools)
            .compose(first -> discovery.sync("r1", tools))
            .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
                Assertions.assertFalse(second.hasChanges());
                Assertions.assertEquals(2, second.getUnchanged().size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A changed schema updates the catalog; tools missing from a discovery stay")
    void schemaChangeUpdates(VertxTestContext testContext) {
        JsonObject newSchema = ECHO_SCHEMA.copy().put("required", new JsonArray().add("message"));

        discovery.sync("r1", Arrays.asList(tool("echo", "Echo", ECHO_SCHEMA), tool("gen", "Generate", new JsonObject())))
            .compose(first -> discovery.sync("r1", Collections.singletonList(tool("echo", "Echo", newSchema))))
            .compose(second -> {
                Assertions.assertEquals(Collections.singletonList("echo"), second.getUpdated());
                return catalog.listTools("r1");
            })
            .onComplete(testContext.succeeding(tools -> testContext.verify(() -> {
                Assertions.assertEquals(2, tools.size());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A failed discovery is audited and leaves the connection up")
    void failedDiscoveryIsAudited(VertxTestContext testContext) {
        transports.script((transport, frame) ->
            transport.receive(TestServers.error(frame.getValue("id"), -32601, "Method not found")));

        connections.start()
            .compose(v -> discovery.discover("r1", connections.getConnection("r1").getConnectionId()))
            .onComplete(testContext.failing(err -> testContext.verify(() -> {
                Assertions.assertEquals(1, audits.size());
                Assertions.assertEquals("tool_discovery_failed", audits.get(0).getString("type"));
                Assertions.assertEquals("r1", audits.get(0).getString("serverId"));
                Assertions.assertNotNull(connections.getConnection("r1"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Discovery entries without a name are skipped")
    void parseSkipsNamelessEntries() {
        JsonObject result = new JsonObject().put("tools", new JsonArray()
            .add(new JsonObject().put("name", "echo"))
            .add(new JsonObject().put("description", "no name"))
            .add("not an object"));

        List<MCPTool> tools = discovery.parseTools("r1", result);

        Assertions.assertEquals(1, tools.size());
        Assertions.assertEquals("echo", tools.get(0).getName());
    }
}
