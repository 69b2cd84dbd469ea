package agents.gateway.mcp.connection;

import agents.gateway.mcp.base.CallerHandle;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;

/**
 * One outstanding request on a connection, waiting for its terminal reply.
 */
public class PendingRequest {

    private final String key;
    private final Object requestId;
    private final CallerHandle caller;
    private final long startTime;
    private final String toolName;
    private final Handler<JsonObject> chunkHandler;
    private final Promise<JsonObject> promise = Promise.promise();

    public PendingRequest(Object requestId, CallerHandle caller, long startTime, String toolName,
                          Handler<JsonObject> chunkHandler) {
        this.key = keyOf(requestId);
        this.requestId = requestId;
        this.caller = caller;
        this.startTime = startTime;
        this.toolName = toolName;
        this.chunkHandler = chunkHandler;
    }

    /**
     * Correlation key of a JSON-RPC id. The JSON type is part of the key, so {@code 42} and
     * {@code "42"} are different requests; numbers compare by value.
     *
     * @return null for a null id
     */
    public static String keyOf(Object id) {
        if (id == null) {
            return null;
        }
        if (id instanceof Number) {
            Number number = (Number) id;
            double value = number.doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 9.0e15) {
                return "n:" + number.longValue();
            }
            return "n:" + value;
        }
        return "s:" + id;
    }

    public String getKey() {
        return key;
    }

    public Object getRequestId() {
        return requestId;
    }

    public CallerHandle getCaller() {
        return caller;
    }

    public long getStartTime() {
        return startTime;
    }

    public String getToolName() {
        return toolName;
    }

    public Handler<JsonObject> getChunkHandler() {
        return chunkHandler;
    }

    public Future<JsonObject> future() {
        return promise.future();
    }

    public boolean complete(JsonObject response) {
        return promise.tryComplete(response);
    }

    public boolean fail(Throwable cause) {
        return promise.tryFail(cause);
    }

    public boolean isDone() {
        return promise.future().isComplete();
    }
}
