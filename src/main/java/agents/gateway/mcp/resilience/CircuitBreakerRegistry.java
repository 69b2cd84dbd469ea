package agents.gateway.mcp.resilience;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Lazily created breakers, one per upstream server and transport.
 */
public class CircuitBreakerRegistry {

    private static final String SERVER_PREFIX = "mcp-server-";
    private static final String HTTP_PREFIX = "mcp-server-http-";

    private final Vertx vertx;
    private final CircuitBreakerOptions options;
    private final LongSupplier clock;
    private final Predicate<Throwable> failurePredicate;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(Vertx vertx, CircuitBreakerOptions options) {
        this(vertx, options, System::currentTimeMillis, error -> true);
    }

    public CircuitBreakerRegistry(Vertx vertx, CircuitBreakerOptions options, LongSupplier clock,
                                  Predicate<Throwable> failurePredicate) {
        this.vertx = vertx;
        this.options = options;
        this.clock = clock;
        this.failurePredicate = failurePredicate;
    }

    public static String serverBreakerName(String serverId) {
        return SERVER_PREFIX + serverId;
    }

    public static String httpBreakerName(String serverId) {
        return HTTP_PREFIX + serverId;
    }

    /**
     * Breaker guarding calls over the server's live connection.
     */
    public CircuitBreaker forServer(String serverId) {
        return getOrCreate(serverBreakerName(serverId));
    }

    /**
     * Breaker guarding the HTTP fallback path to the server.
     */
    public CircuitBreaker forHttpServer(String serverId) {
        return getOrCreate(httpBreakerName(serverId));
    }

    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, key ->
            new CircuitBreaker(key, vertx, options, clock).setFailurePredicate(failurePredicate));
    }

    public CircuitBreaker get(String name) {
        return breakers.get(name);
    }

    /**
     * State of the server's connection breaker, "closed" when none was created yet.
     */
    public String serverState(String serverId) {
        CircuitBreaker breaker = breakers.get(serverBreakerName(serverId));
        return breaker == null ? CircuitState.CLOSED.wireName() : breaker.getState().wireName();
    }

    public void remove(String serverId) {
        breakers.remove(serverBreakerName(serverId));
        breakers.remove(httpBreakerName(serverId));
    }

    public boolean isHealthy() {
        return breakers.values().stream().allMatch(b -> b.getState() == CircuitState.CLOSED);
    }

    public JsonObject getAllStats() {
        JsonObject stats = new JsonObject();
        breakers.forEach((name, breaker) -> stats.put(name, breaker.getStats()));
        return stats;
    }

    public JsonObject getHealth() {
        return new JsonObject()
            .put("healthy", isHealthy())
            .put("breakers", getAllStats());
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
