package agents.gateway.mcp.connection;

import agents.gateway.mcp.base.MCPGatewayException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded correlation table of one connection, keyed by {@link PendingRequest#keyOf(Object)}.
 * Once closed it resolves everything outstanding and admits nothing new.
 */
public class PendingRequests {

    private final int maxPending;
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private boolean closed = false;

    public PendingRequests(int maxPending) {
        this.maxPending = maxPending;
    }

    /**
     * @throws MCPGatewayException DUPLICATE_REQUEST_ID, TOO_MANY_PENDING or CONNECTION_CLOSED
     */
    public synchronized void register(PendingRequest request) {
        if (closed) {
            throw new MCPGatewayException(MCPGatewayException.Kind.CONNECTION_CLOSED, "Connection closed");
        }
        if (pending.containsKey(request.getKey())) {
            throw new MCPGatewayException(MCPGatewayException.Kind.DUPLICATE_REQUEST_ID,
                "Request id " + request.getRequestId() + " is already in flight");
        }
        if (pending.size() >= maxPending) {
            throw new MCPGatewayException(MCPGatewayException.Kind.TOO_MANY_PENDING,
                "Too many pending requests (" + maxPending + ")");
        }
        pending.put(request.getKey(), request);
    }

    public PendingRequest get(Object requestId) {
        String key = PendingRequest.keyOf(requestId);
        return key == null ? null : pending.get(key);
    }

    public boolean contains(Object requestId) {
        String key = PendingRequest.keyOf(requestId);
        return key != null && pending.containsKey(key);
    }

    public PendingRequest removeById(Object requestId) {
        String key = PendingRequest.keyOf(requestId);
        return key == null ? null : pending.remove(key);
    }

    /**
     * Remove the entry only if it is still this request; a newer request may reuse the id.
     */
    public boolean remove(PendingRequest request) {
        return pending.remove(request.getKey(), request);
    }

    public int size() {
        return pending.size();
    }

    public int getMaxPending() {
        return maxPending;
    }

    /**
     * Resolve every outstanding request with CONNECTION_CLOSED.
     *
     * @return number of requests resolved
     */
    public int closeAll(String reason) {
        List<PendingRequest> orphans;
        synchronized (this) {
            closed = true;
            orphans = new ArrayList<>(pending.values());
            pending.clear();
        }
        for (PendingRequest orphan : orphans) {
            orphan.fail(new MCPGatewayException(MCPGatewayException.Kind.CONNECTION_CLOSED,
                reason != null ? reason : "Connection closed"));
        }
        return orphans.size();
    }
}
