package agents.gateway.directory;

import agents.gateway.mcp.base.MCPTool;
import io.vertx.core.Future;

import java.util.List;

/**
 * Durable store of discovered tool definitions, keyed by server and tool name.
 */
public interface ToolCatalog {

    Future<Void> upsertTool(String serverId, MCPTool tool);

    Future<List<MCPTool>> listTools(String serverId);
}
