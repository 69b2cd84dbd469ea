package agents.gateway.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents a JSON-RPC request in MCP protocol format.
 * A request without an id is a notification and expects no response.
 */
public class MCPRequest {

    public static final String TOOL_INVOCATION = "mcp.run_tool";
    public static final String TOOLS_CALL = "tools/call";
    public static final String DISCOVER = "mcp.discover";
    public static final String PING = "mcp.ping";
    public static final String CHUNK = "mcp.chunk";

    private final String jsonrpc = "2.0";
    private final Object id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(Object id, String method, JsonObject params) {
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    /**
     * The raw id value, a string or a number. Null for notifications.
     */
    public Object getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    public boolean isNotification() {
        return id == null;
    }

    /**
     * Key used to match this request with its response on a shared transport.
     */
    public String correlationKey() {
        return id == null ? null : String.valueOf(id);
    }

    /**
     * Name of the tool this request invokes, or null when it is not a tool invocation.
     * Understands both the gateway's {@code mcp.run_tool} and the standard {@code tools/call}.
     */
    public String toolName() {
        if (params == null) {
            return null;
        }
        if (TOOL_INVOCATION.equals(method)) {
            return params.getString("tool_name");
        }
        if (TOOLS_CALL.equals(method)) {
            return params.getString("name");
        }
        return null;
    }

    /**
     * Convert to JSON for transmission
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("method", method);

        if (id != null) {
            json.put("id", id);
        }
        if (params != null) {
            json.put("params", params);
        }

        return json;
    }

    /**
     * Create from incoming JSON. Non-object params are ignored here; callers that
     * forward the request keep the original JSON.
     */
    public static MCPRequest fromJson(JsonObject json) {
        Object rawParams = json.getValue("params");
        return new MCPRequest(
            json.getValue("id"),
            json.getString("method"),
            rawParams instanceof JsonObject ? (JsonObject) rawParams : null
        );
    }

    /**
     * Validate the request format
     */
    public boolean isValid() {
        return method != null && !method.isEmpty()
            && (id == null || id instanceof String || id instanceof Number);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
