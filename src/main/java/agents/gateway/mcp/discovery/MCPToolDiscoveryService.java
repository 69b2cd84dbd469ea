package agents.gateway.mcp.discovery;

import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.AuditSink;
import agents.gateway.directory.ToolCatalog;
import agents.gateway.mcp.base.MCPRequest;
import agents.gateway.mcp.base.MCPTool;
import agents.gateway.mcp.connection.ConnectionState;
import agents.gateway.mcp.connection.MCPConnectionManager;
import agents.gateway.mcp.connection.MCPUpstreamConnection;
import agents.gateway.mcp.routing.MCPRequestRouter;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static agents.gateway.Driver.logLevel;

/**
 * Runs {@code mcp.discover} each time a connection comes up and syncs the result
 * into the tool catalog.
 *
 * <p>Sync rules: new names are inserted; known names are written only when the
 * description or schema changed, an empty description keeping the catalog's;
 * names missing from the new list stay in the catalog.</p>
 */
public class MCPToolDiscoveryService {

    public static final String TOOLS_UPDATED_ADDRESS = "mcp.tools.updated";

    private final Vertx vertx;
    private final MCPConnectionManager connections;
    private final MCPRequestRouter router;
    private final ToolCatalog catalog;
    private final AuditSink audit;
    private final GatewayConfig config;
    private MessageConsumer<JsonObject> stateConsumer;

    public MCPToolDiscoveryService(Vertx vertx, MCPConnectionManager connections, MCPRequestRouter router,
                                   ToolCatalog catalog, AuditSink audit, GatewayConfig config) {
        this.vertx = vertx;
        this.connections = connections;
        this.router = router;
        this.catalog = catalog;
        this.audit = audit;
        this.config = config;
    }

    public void start() {
        stateConsumer = vertx.eventBus().consumer(MCPConnectionManager.STATE_ADDRESS, msg -> {
            JsonObject event = msg.body();
            String connectionId = event.getString("connectionId");
            if (ConnectionState.CONNECTED.wireName().equals(event.getString("state")) && connectionId != null) {
                discover(event.getString("serverId"), connectionId);
            }
        });
    }

    public void stop() {
        if (stateConsumer != null) {
            stateConsumer.unregister();
            stateConsumer = null;
        }
    }

    /**
     * Discover and sync. A failure leaves the connection up with its previous tool list.
     */
    public Future<ToolSyncResult> discover(String serverId, String connectionId) {
        if (logLevel >= 2) vertx.eventBus().publish("log", "Discovering tools on " + serverId + ",2,MCPToolDiscoveryService,Discover,Tools");

        return router.call(serverId, MCPRequest.DISCOVER, new JsonObject(), config.getDiscoveryTimeoutMs())
            .compose(response -> {
                List<MCPTool> tools = parseTools(serverId, response.getValue("result"));

                MCPUpstreamConnection connection = connections.getConnection(serverId);
                if (connection != null && connection.getConnectionId().equals(connectionId)) {
                    connection.setTools(tools);
                } else if (logLevel >= 2) {
                    vertx.eventBus().publish("log", "Discovery result for replaced connection on " + serverId + " not applied to live list,2,MCPToolDiscoveryService,Discover,Tools");
                }
                return sync(serverId, tools);
            })
            .onSuccess(result -> {
                if (logLevel >= 1) vertx.eventBus().publish("log", "Tools discovered for " + serverId + ": " + result.getToolCount() + " tools (" + result.getInserted().size() + " new; " + result.getUpdated().size() + " updated),1,MCPToolDiscoveryService,Discover,Tools");
                vertx.eventBus().publish(TOOLS_UPDATED_ADDRESS, result.toJson()
                    .put("connectionId", connectionId)
                    .put("timestamp", System.currentTimeMillis()));
            })
            .onFailure(err -> {
                vertx.eventBus().publish("log", "Tool discovery failed for " + serverId + ": " + err.getMessage() + ",0,MCPToolDiscoveryService,Discover,Discovery");
                audit.emit(new JsonObject()
                    .put("type", "tool_discovery_failed")
                    .put("serverId", serverId)
                    .put("connectionId", connectionId)
                    .put("error", err.getMessage()));
            });
    }

    List<MCPTool> parseTools(String serverId, Object result) {
        List<MCPTool> tools = new ArrayList<>();
        JsonArray entries = null;
        if (result instanceof JsonObject) {
            Object raw = ((JsonObject) result).getValue("tools");
            entries = raw instanceof JsonArray ? (JsonArray) raw : null;
        } else if (result instanceof JsonArray) {
            entries = (JsonArray) result;
        }
        if (entries == null) {
            return tools;
        }
        for (Object entry : entries) {
            if (!(entry instanceof JsonObject) || !(((JsonObject) entry).getValue("name") instanceof String)) {
                if (logLevel >= 1) vertx.eventBus().publish("log", "Protocol error from " + serverId + ": tool entry without a name skipped,1,MCPToolDiscoveryService,Parse,Protocol");
                continue;
            }
            tools.add(MCPTool.fromJson(serverId, (JsonObject) entry));
        }
        return tools;
    }

    /**
     * Diff the discovered tools against the catalog and write only what changed.
     */
    public Future<ToolSyncResult> sync(String serverId, List<MCPTool> discovered) {
        return catalog.listTools(serverId).compose(existing -> {
            Map<String, MCPTool> known = new HashMap<>();
            existing.forEach(tool -> known.put(tool.getName(), tool));

            ToolSyncResult result = new ToolSyncResult(serverId);
            List<Future<Void>> writes = new ArrayList<>();
            for (MCPTool tool : discovered) {
                MCPTool current = known.get(tool.getName());
                if (current == null) {
                    result.inserted(tool.getName());
                    writes.add(catalog.upsertTool(serverId, tool));
                    continue;
                }
                MCPTool candidate = tool.getDescription() == null || tool.getDescription().isEmpty()
                    ? tool.withDescription(current.getDescription())
                    : tool;
                if (candidate.sameDefinition(current)) {
                    result.unchanged(tool.getName());
                } else {
                    result.updated(tool.getName());
                    writes.add(catalog.upsertTool(serverId, candidate));
                }
            }
            return Future.all(writes).map(result);
        });
    }
}
