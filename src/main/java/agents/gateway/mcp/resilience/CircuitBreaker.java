package agents.gateway.mcp.resilience;

import agents.gateway.mcp.base.MCPGatewayException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static agents.gateway.Driver.logLevel;

/**
 * Failure isolation for one upstream transport.
 *
 * <p>CLOSED lets calls through and counts consecutive failures. Reaching the
 * threshold opens the circuit; while OPEN every call is rejected without running.
 * Once the reset timeout has elapsed the next look at the state moves it to
 * HALF_OPEN, where enough consecutive successes close it again and any failure
 * reopens it.</p>
 *
 * <p>Timeouts always count as failures. Other errors are classified by the
 * failure predicate; errors it rejects count as neither success nor failure.</p>
 */
public class CircuitBreaker {

    public static final String STATE_ADDRESS = "mcp.circuit.state";
    private static final int RESPONSE_TIME_SAMPLES = 100;

    private final String name;
    private final Vertx vertx;
    private final CircuitBreakerOptions options;
    private final LongSupplier clock;
    private volatile Predicate<Throwable> failurePredicate = error -> true;

    // Guarded by this
    private CircuitState state = CircuitState.CLOSED;
    private int failureCount = 0;
    private int successCount = 0;
    private long openedAt = 0;

    // Statistics, guarded by this
    private long totalRequests = 0;
    private long successfulRequests = 0;
    private long failedRequests = 0;
    private long rejectedRequests = 0;
    private long lastFailureTime = 0;
    private long lastSuccessTime = 0;
    private long lastStateChange;
    private final Deque<Long> responseTimes = new ArrayDeque<>();

    public CircuitBreaker(String name, Vertx vertx, CircuitBreakerOptions options) {
        this(name, vertx, options, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, Vertx vertx, CircuitBreakerOptions options, LongSupplier clock) {
        this.name = name;
        this.vertx = vertx;
        this.options = new CircuitBreakerOptions(options);
        this.clock = clock;
        this.lastStateChange = clock.getAsLong();
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerOptions getOptions() {
        return options;
    }

    public CircuitBreaker setFailurePredicate(Predicate<Throwable> failurePredicate) {
        this.failurePredicate = failurePredicate;
        return this;
    }

    /**
     * Current state. An OPEN circuit whose reset timeout has elapsed reports (and becomes) HALF_OPEN.
     */
    public synchronized CircuitState getState() {
        checkResetTimeout();
        return state;
    }

    public <T> Future<T> execute(Supplier<Future<T>> operation) {
        return execute(operation, options.getCallTimeoutMs());
    }

    /**
     * Run the operation under the breaker.
     *
     * @param operation supplies the call's future; invoked only when the circuit admits the call
     * @param timeoutMs per-call timeout, zero or less for none
     * @return the operation's outcome, or a CIRCUIT_OPEN or TIMEOUT {@link MCPGatewayException}
     */
    public <T> Future<T> execute(Supplier<Future<T>> operation, long timeoutMs) {
        if (!admit()) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.CIRCUIT_OPEN,
                "Circuit breaker " + name + " is open; server temporarily unavailable"));
        }

        long start = clock.getAsLong();
        Promise<T> promise = Promise.promise();

        long timerId = -1;
        if (timeoutMs > 0) {
            timerId = vertx.setTimer(timeoutMs, id -> {
                MCPGatewayException timeout = new MCPGatewayException(MCPGatewayException.Kind.TIMEOUT,
                    "Operation timed out after " + timeoutMs + "ms");
                if (promise.tryFail(timeout)) {
                    recordFailure(start);
                }
            });
        }

        Future<T> result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }

        long timer = timerId;
        result.onComplete(ar -> {
            if (timer >= 0) {
                vertx.cancelTimer(timer);
            }
            if (ar.succeeded()) {
                if (promise.tryComplete(ar.result())) {
                    recordSuccess(start);
                }
            } else if (promise.tryFail(ar.cause())) {
                if (failurePredicate.test(ar.cause())) {
                    recordFailure(start);
                } else {
                    recordResponseTime(start);
                }
            }
        });

        return promise.future();
    }

    /**
     * Force the circuit closed and clear the counters.
     */
    public synchronized void reset() {
        failureCount = 0;
        successCount = 0;
        transitionTo(CircuitState.CLOSED, "manual reset");
    }

    public synchronized JsonObject getStats() {
        checkResetTimeout();
        double averageResponseTime = responseTimes.stream().mapToLong(Long::longValue).average().orElse(0);
        return new JsonObject()
            .put("name", name)
            .put("state", state.wireName())
            .put("failureCount", failureCount)
            .put("successCount", successCount)
            .put("totalRequests", totalRequests)
            .put("successfulRequests", successfulRequests)
            .put("failedRequests", failedRequests)
            .put("rejectedRequests", rejectedRequests)
            .put("lastFailureTime", lastFailureTime)
            .put("lastSuccessTime", lastSuccessTime)
            .put("lastStateChange", lastStateChange)
            .put("averageResponseTime", Math.round(averageResponseTime));
    }

    private synchronized boolean admit() {
        checkResetTimeout();
        if (state == CircuitState.OPEN) {
            rejectedRequests++;
            if (logLevel >= 3) vertx.eventBus().publish("log", "Circuit " + name + " rejected call while open,3,CircuitBreaker,Execute,Resilience");
            return false;
        }
        totalRequests++;
        return true;
    }

    private synchronized void recordSuccess(long start) {
        successfulRequests++;
        lastSuccessTime = clock.getAsLong();
        addResponseTime(lastSuccessTime - start);

        if (state == CircuitState.HALF_OPEN) {
            successCount++;
            if (successCount >= options.getHalfOpenSuccessThreshold()) {
                String reason = successCount + " consecutive successes while half-open";
                failureCount = 0;
                successCount = 0;
                transitionTo(CircuitState.CLOSED, reason);
            }
        } else {
            failureCount = 0;
        }
    }

    private synchronized void recordFailure(long start) {
        failedRequests++;
        lastFailureTime = clock.getAsLong();
        addResponseTime(lastFailureTime - start);

        if (state == CircuitState.HALF_OPEN) {
            failureCount = 0;
            successCount = 0;
            openedAt = lastFailureTime;
            transitionTo(CircuitState.OPEN, "failure while half-open");
            return;
        }

        failureCount++;
        if (state == CircuitState.CLOSED && failureCount >= options.getFailureThreshold()) {
            successCount = 0;
            openedAt = lastFailureTime;
            transitionTo(CircuitState.OPEN, failureCount + " consecutive failures");
        }
    }

    private synchronized void recordResponseTime(long start) {
        addResponseTime(clock.getAsLong() - start);
    }

    private void addResponseTime(long elapsed) {
        responseTimes.addLast(elapsed);
        if (responseTimes.size() > RESPONSE_TIME_SAMPLES) {
            responseTimes.removeFirst();
        }
    }

    private void checkResetTimeout() {
        if (state == CircuitState.OPEN && clock.getAsLong() - openedAt >= options.getResetTimeoutMs()) {
            successCount = 0;
            transitionTo(CircuitState.HALF_OPEN, "reset timeout elapsed");
        }
    }

    private void transitionTo(CircuitState next, String reason) {
        CircuitState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        lastStateChange = clock.getAsLong();

        int level = next == CircuitState.OPEN ? 0 : 1;
        if (logLevel >= level) vertx.eventBus().publish("log", "Circuit " + name + " " + previous.wireName() + " -> " + next.wireName() + " (" + reason + ")," + level + ",CircuitBreaker,StateChange,Resilience");

        vertx.eventBus().publish(STATE_ADDRESS, new JsonObject()
            .put("name", name)
            .put("from", previous.wireName())
            .put("to", next.wireName())
            .put("reason", reason)
            .put("timestamp", lastStateChange));
    }
}
