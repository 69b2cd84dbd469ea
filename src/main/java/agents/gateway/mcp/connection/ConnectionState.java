package agents.gateway.mcp.connection;

/**
 * Lifecycle of one upstream connection.
 */
public enum ConnectionState {
    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    CLOSING("closing");

    private final String wireName;

    ConnectionState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
