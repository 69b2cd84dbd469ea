package agents.gateway.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * Failure raised by the gateway for a single proxied call.
 * The {@link Kind} tells callers apart connectivity problems, backpressure,
 * timeouts and application errors returned by the upstream server.
 */
public class MCPGatewayException extends RuntimeException {

    public enum Kind {
        NOT_CONNECTED(MCPResponse.ErrorCodes.NOT_CONNECTED, 502),
        CIRCUIT_OPEN(MCPResponse.ErrorCodes.CIRCUIT_OPEN, 503),
        TIMEOUT(MCPResponse.ErrorCodes.TIMEOUT, 504),
        CONNECTION_CLOSED(MCPResponse.ErrorCodes.CONNECTION_CLOSED, 502),
        TOO_MANY_PENDING(MCPResponse.ErrorCodes.TOO_MANY_PENDING, 503),
        DUPLICATE_REQUEST_ID(MCPResponse.ErrorCodes.DUPLICATE_REQUEST_ID, 409),
        UNKNOWN_SERVER(MCPResponse.ErrorCodes.UNKNOWN_SERVER, 404),
        UPSTREAM_ERROR(MCPResponse.ErrorCodes.SERVER_ERROR, 200),
        INVALID_REQUEST(MCPResponse.ErrorCodes.INVALID_REQUEST, 400),
        PROTOCOL_ERROR(MCPResponse.ErrorCodes.PARSE_ERROR, 502);

        private final int code;
        private final int httpStatus;

        Kind(int code, int httpStatus) {
            this.code = code;
            this.httpStatus = httpStatus;
        }

        public int code() {
            return code;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final Kind kind;
    private final MCPResponse upstreamResponse;

    public MCPGatewayException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public MCPGatewayException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private MCPGatewayException(Kind kind, String message, MCPResponse upstreamResponse, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.upstreamResponse = upstreamResponse;
    }

    /**
     * Wraps a well-formed JSON-RPC error response returned by the upstream server.
     */
    public static MCPGatewayException upstreamError(MCPResponse response) {
        JsonObject error = response.getError();
        String message = error != null ? error.getString("message", "Upstream error") : "Upstream error";
        return new MCPGatewayException(Kind.UPSTREAM_ERROR, message, response, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The verbatim upstream response for {@link Kind#UPSTREAM_ERROR}, null otherwise.
     */
    public MCPResponse getUpstreamResponse() {
        return upstreamResponse;
    }

    public int getCode() {
        if (upstreamResponse != null && upstreamResponse.getError() != null) {
            return upstreamResponse.getError().getInteger("code", kind.code());
        }
        return kind.code();
    }

    /**
     * Render as a JSON-RPC response. Upstream errors are passed through unmodified.
     */
    public JsonObject toJsonRpc(Object requestId) {
        if (upstreamResponse != null) {
            return upstreamResponse.toJson();
        }
        return MCPResponse.error(requestId, kind.code(), getMessage()).toJson();
    }

    public static boolean is(Throwable error, Kind kind) {
        return error instanceof MCPGatewayException && ((MCPGatewayException) error).kind == kind;
    }
}
