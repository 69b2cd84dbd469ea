package agents.gateway.mcp.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half-open");

    private final String wireName;

    CircuitState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
