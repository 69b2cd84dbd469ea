package agents.gateway.mcp.base;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Represents an MCP tool definition with name, description, and parameter schema,
 * as exposed by one upstream server.
 */
public class MCPTool {

    private final String serverId;
    private final String name;
    private final String description;
    private final JsonObject schema;

    public MCPTool(String serverId, String name, String description, JsonObject schema) {
        this.serverId = serverId;
        this.name = name;
        this.description = description;
        this.schema = schema;
    }

    public String getServerId() {
        return serverId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getSchema() {
        return schema;
    }

    /**
     * Copy of this tool with another description, used when a discovery result omits it.
     */
    public MCPTool withDescription(String newDescription) {
        return new MCPTool(serverId, name, newDescription, schema);
    }

    /**
     * True when description and schema match; the name and owner are assumed equal.
     */
    public boolean sameDefinition(MCPTool other) {
        return other != null
            && Objects.equals(description, other.description)
            && Objects.equals(schema, other.schema);
    }

    /**
     * Convert to JSON format for MCP protocol
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("schema", schema)
            .put("serverId", serverId);
    }

    /**
     * Create from a discovery entry. Accepts {@code inputSchema} as an alias of {@code schema}.
     */
    public static MCPTool fromJson(String serverId, JsonObject json) {
        Object rawSchema = json.containsKey("schema") ? json.getValue("schema") : json.getValue("inputSchema");
        return new MCPTool(
            serverId,
            json.getString("name"),
            json.getString("description"),
            rawSchema instanceof JsonObject ? (JsonObject) rawSchema : new JsonObject()
        );
    }

    @Override
    public String toString() {
        return "MCPTool{server='" + serverId + "', name='" + name + "', description='" + description + "'}";
    }
}
