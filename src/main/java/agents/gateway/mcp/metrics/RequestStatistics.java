package agents.gateway.mcp.metrics;

import io.vertx.core.json.JsonObject;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one server or one tool. Only ever incremented, except by {@link #reset()}.
 */
public class RequestStatistics {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong successfulRequests = new AtomicLong(0);
    private final AtomicLong failedRequests = new AtomicLong(0);
    private final AtomicLong rejectedRequests = new AtomicLong(0);
    private final AtomicLong totalLatency = new AtomicLong(0);
    private final AtomicLong lastUsed = new AtomicLong(0);

    void recordRequest() {
        totalRequests.incrementAndGet();
        lastUsed.set(System.currentTimeMillis());
    }

    void recordOutcome(boolean success, long latency) {
        if (success) {
            successfulRequests.incrementAndGet();
        } else {
            failedRequests.incrementAndGet();
        }
        totalLatency.addAndGet(Math.max(0, latency));
    }

    void recordRejected() {
        rejectedRequests.incrementAndGet();
    }

    void reset() {
        totalRequests.set(0);
        successfulRequests.set(0);
        failedRequests.set(0);
        rejectedRequests.set(0);
        totalLatency.set(0);
        lastUsed.set(0);
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getSuccessfulRequests() {
        return successfulRequests.get();
    }

    public long getFailedRequests() {
        return failedRequests.get();
    }

    public long getRejectedRequests() {
        return rejectedRequests.get();
    }

    public long getTotalLatency() {
        return totalLatency.get();
    }

    public long getAverageLatency() {
        long total = totalRequests.get();
        return total > 0 ? Math.round((double) totalLatency.get() / total) : 0;
    }

    /**
     * Percent of requests that succeeded, rounded.
     */
    public long getSuccessRate() {
        long total = totalRequests.get();
        return total > 0 ? Math.round((double) successfulRequests.get() / total * 100) : 0;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("totalRequests", totalRequests.get())
            .put("successfulRequests", successfulRequests.get())
            .put("failedRequests", failedRequests.get())
            .put("rejectedRequests", rejectedRequests.get())
            .put("totalLatency", totalLatency.get())
            .put("averageLatency", getAverageLatency())
            .put("successRate", getSuccessRate())
            .put("lastUsed", lastUsed.get());
    }
}
