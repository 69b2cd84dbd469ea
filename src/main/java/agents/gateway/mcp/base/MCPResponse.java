package agents.gateway.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Represents a JSON-RPC response in MCP protocol format.
 * Can be either a success response with result or an error response.
 * The result may be any JSON value, including null.
 */
public class MCPResponse {

    private final String jsonrpc = "2.0";
    private final Object id;
    private final Object result;
    private final JsonObject error;
    private final boolean hasResult;

    private MCPResponse(Object id, Object result, JsonObject error, boolean hasResult) {
        this.id = id;
        this.result = result;
        this.error = error;
        this.hasResult = hasResult;
    }

    /**
     * Create a success response
     */
    public static MCPResponse success(Object id, Object result) {
        return new MCPResponse(id, result, null, true);
    }

    /**
     * Create an error response
     */
    public static MCPResponse error(Object id, int code, String message) {
        return error(id, code, message, null);
    }

    /**
     * Create an error response with additional data
     */
    public static MCPResponse error(Object id, int code, String message, Object data) {
        JsonObject error = new JsonObject()
            .put("code", code)
            .put("message", message);
        if (data != null) {
            error.put("data", data);
        }
        return new MCPResponse(id, null, error, false);
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public Object getId() {
        return id;
    }

    public Object getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isSuccess() {
        return hasResult && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Convert to JSON for transmission
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id);

        if (isError()) {
            json.put("error", error);
        } else {
            json.put("result", result);
        }

        return json;
    }

    /**
     * Create from incoming JSON
     */
    public static MCPResponse fromJson(JsonObject json) {
        Object rawError = json.getValue("error");
        JsonObject error = rawError instanceof JsonObject
            ? (JsonObject) rawError
            : (rawError != null ? new JsonObject().put("code", ErrorCodes.INTERNAL_ERROR).put("message", String.valueOf(rawError)) : null);
        return new MCPResponse(json.getValue("id"), json.getValue("result"), error, json.containsKey("result"));
    }

    /**
     * True when the JSON object has the shape of a response: an id plus a result or error member.
     */
    public static boolean isResponse(JsonObject json) {
        return json.getValue("id") != null && (json.containsKey("result") || json.containsKey("error"));
    }

    @Override
    public String toString() {
        if (isError()) {
            return "MCPResponse{id='" + id + "', error=" + error + "}";
        } else {
            return "MCPResponse{id='" + id + "', result=" + result + "}";
        }
    }

    // Standard JSON-RPC error codes plus the gateway's -32000 range
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;

        public static final int SERVER_ERROR = -32000;
        public static final int NOT_CONNECTED = -32001;
        public static final int CIRCUIT_OPEN = -32002;
        public static final int TIMEOUT = -32003;
        public static final int CONNECTION_CLOSED = -32004;
        public static final int TOO_MANY_PENDING = -32005;
        public static final int DUPLICATE_REQUEST_ID = -32006;
        public static final int UNKNOWN_SERVER = -32007;
    }
}
