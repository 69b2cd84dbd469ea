package agents.gateway.mcp.connection;

import io.vertx.core.json.JsonObject;

import java.net.URI;
import java.util.Objects;

/**
 * An externally hosted MCP tool server as recorded in the server directory.
 * The connection status fields are derived by the gateway and written back through the directory.
 */
public class UpstreamServer {

    private final String id;
    private final String name;
    private final String url;
    private final String credentialRef;
    private final String protocolVersion;
    private final boolean active;

    private final String connectionStatus;
    private final String lastError;
    private final Long lastConnected;

    public UpstreamServer(String id, String name, String url, String credentialRef, String protocolVersion, boolean active) {
        this(id, name, url, credentialRef, protocolVersion, active, ConnectionState.DISCONNECTED.wireName(), null, null);
    }

    private UpstreamServer(String id, String name, String url, String credentialRef, String protocolVersion, boolean active,
                           String connectionStatus, String lastError, Long lastConnected) {
        this.id = id;
        this.name = name;
        this.url = url;
        this.credentialRef = credentialRef;
        this.protocolVersion = protocolVersion;
        this.active = active;
        this.connectionStatus = connectionStatus;
        this.lastError = lastError;
        this.lastConnected = lastConnected;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public String getCredentialRef() {
        return credentialRef;
    }

    public String getProtocolVersion() {
        return protocolVersion;
    }

    public boolean isActive() {
        return active;
    }

    public String getConnectionStatus() {
        return connectionStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public Long getLastConnected() {
        return lastConnected;
    }

    public UpstreamServer withActive(boolean newActive) {
        return new UpstreamServer(id, name, url, credentialRef, protocolVersion, newActive,
            connectionStatus, lastError, lastConnected);
    }

    public UpstreamServer withStatus(String status, String error, Long connectedAt) {
        return new UpstreamServer(id, name, url, credentialRef, protocolVersion, active,
            status, error, connectedAt != null ? connectedAt : lastConnected);
    }

    /**
     * True when a live connection opened for {@code other} would be reachable the same way.
     */
    public boolean sameEndpoint(UpstreamServer other) {
        return other != null
            && Objects.equals(url, other.url)
            && Objects.equals(credentialRef, other.credentialRef);
    }

    /**
     * WebSocket endpoint: https maps to wss, anything else to ws, on the server's host and port.
     * A URL that already uses ws or wss keeps its scheme.
     */
    public String webSocketUri(String path) {
        URI uri = URI.create(url);
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase();
        String wsScheme = scheme.equals("https") || scheme.equals("wss") ? "wss" : "ws";
        return wsScheme + "://" + uri.getRawAuthority() + path;
    }

    /**
     * HTTP endpoint used by the fallback POST path.
     */
    public String httpUri(String path) {
        URI uri = URI.create(url);
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase();
        String httpScheme = scheme.equals("https") || scheme.equals("wss") ? "https" : "http";
        return httpScheme + "://" + uri.getRawAuthority() + path;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("url", url)
            .put("credentialRef", credentialRef)
            .put("protocolVersion", protocolVersion)
            .put("active", active)
            .put("connectionStatus", connectionStatus)
            .put("lastError", lastError)
            .put("lastConnected", lastConnected);
    }

    public static UpstreamServer fromJson(JsonObject json) {
        String id = json.getValue("id") == null ? null : String.valueOf(json.getValue("id"));
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Server entry is missing an id");
        }
        String url = json.getString("url");
        if (url == null || url.isEmpty()) {
            throw new IllegalArgumentException("Server " + id + " is missing a url");
        }
        return new UpstreamServer(
            id,
            json.getString("name", id),
            url,
            json.getString("credentialRef", json.getString("apiKey")),
            json.getString("protocolVersion", "2024-11-05"),
            json.getBoolean("active", true),
            json.getString("connectionStatus", ConnectionState.DISCONNECTED.wireName()),
            json.getString("lastError"),
            json.getLong("lastConnected")
        );
    }

    @Override
    public String toString() {
        return "UpstreamServer{id='" + id + "', name='" + name + "', url='" + url + "', active=" + active + "}";
    }
}
