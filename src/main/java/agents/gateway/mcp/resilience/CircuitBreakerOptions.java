package agents.gateway.mcp.resilience;

import io.vertx.core.json.JsonObject;

/**
 * Thresholds and timers for a {@link CircuitBreaker}.
 */
public class CircuitBreakerOptions {

    private int failureThreshold = 5;
    private long resetTimeoutMs = 30_000;
    private int halfOpenSuccessThreshold = 2;
    private long callTimeoutMs = 10_000;

    public CircuitBreakerOptions() {
    }

    public CircuitBreakerOptions(CircuitBreakerOptions other) {
        this.failureThreshold = other.failureThreshold;
        this.resetTimeoutMs = other.resetTimeoutMs;
        this.halfOpenSuccessThreshold = other.halfOpenSuccessThreshold;
        this.callTimeoutMs = other.callTimeoutMs;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public CircuitBreakerOptions setFailureThreshold(int failureThreshold) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        return this;
    }

    public long getResetTimeoutMs() {
        return resetTimeoutMs;
    }

    public CircuitBreakerOptions setResetTimeoutMs(long resetTimeoutMs) {
        this.resetTimeoutMs = resetTimeoutMs;
        return this;
    }

    public int getHalfOpenSuccessThreshold() {
        return halfOpenSuccessThreshold;
    }

    public CircuitBreakerOptions setHalfOpenSuccessThreshold(int halfOpenSuccessThreshold) {
        if (halfOpenSuccessThreshold < 1) {
            throw new IllegalArgumentException("halfOpenSuccessThreshold must be at least 1");
        }
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
        return this;
    }

    /**
     * Default per-call timeout; zero or less disables it.
     */
    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public CircuitBreakerOptions setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
        return this;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("failureThreshold", failureThreshold)
            .put("resetTimeoutMs", resetTimeoutMs)
            .put("halfOpenSuccessThreshold", halfOpenSuccessThreshold)
            .put("callTimeoutMs", callTimeoutMs);
    }
}
