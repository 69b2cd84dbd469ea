package agents.gateway.directory;

import agents.gateway.mcp.base.MCPTool;
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool catalog held in memory. Tools are never deleted.
 */
public class InMemoryToolCatalog implements ToolCatalog {

    private final Map<String, Map<String, MCPTool>> toolsByServer = new ConcurrentHashMap<>();

    @Override
    public Future<Void> upsertTool(String serverId, MCPTool tool) {
        Map<String, MCPTool> tools = toolsByServer.computeIfAbsent(serverId, id -> new LinkedHashMap<>());
        synchronized (tools) {
            tools.put(tool.getName(), tool);
        }
        return Future.succeededFuture();
    }

    @Override
    public Future<List<MCPTool>> listTools(String serverId) {
        Map<String, MCPTool> tools = toolsByServer.get(serverId);
        if (tools == null) {
            return Future.succeededFuture(new ArrayList<>());
        }
        synchronized (tools) {
            return Future.succeededFuture(new ArrayList<>(tools.values()));
        }
    }
}
