package agents.gateway.directory;

import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static agents.gateway.Driver.logLevel;

/**
 * Server directory held in memory, seeded from the {@code servers} section of the configuration.
 * Mutations announce themselves on {@link ServerDirectory#CHANGED_ADDRESS}.
 */
public class InMemoryServerDirectory implements ServerDirectory {

    private final Vertx vertx;
    private final Map<String, UpstreamServer> servers = new LinkedHashMap<>();

    public InMemoryServerDirectory(Vertx vertx) {
        this.vertx = vertx;
    }

    /**
     * Seed without announcing; invalid entries are logged and skipped.
     */
    public InMemoryServerDirectory seed(JsonArray entries) {
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.getValue(i);
            if (!(entry instanceof JsonObject)) {
                continue;
            }
            try {
                UpstreamServer server = UpstreamServer.fromJson((JsonObject) entry);
                synchronized (servers) {
                    servers.put(server.getId(), server);
                }
            } catch (IllegalArgumentException e) {
                vertx.eventBus().publish("log", "Skipping invalid server entry: " + e.getMessage() + ",0,InMemoryServerDirectory,Seed,Directory");
            }
        }
        if (logLevel >= 2) vertx.eventBus().publish("log", "Server directory seeded with " + size() + " servers,2,InMemoryServerDirectory,Seed,Directory");
        return this;
    }

    @Override
    public Future<List<UpstreamServer>> listServers() {
        synchronized (servers) {
            return Future.succeededFuture(new ArrayList<>(servers.values()));
        }
    }

    @Override
    public Future<UpstreamServer> getServer(String serverId) {
        synchronized (servers) {
            return Future.succeededFuture(servers.get(serverId));
        }
    }

    @Override
    public Future<Void> recordConnectionStatus(String serverId, String status, String lastError, Long lastConnected) {
        synchronized (servers) {
            UpstreamServer server = servers.get(serverId);
            if (server == null) {
                return Future.failedFuture(new IllegalArgumentException("Unknown server " + serverId));
            }
            servers.put(serverId, server.withStatus(status, lastError, lastConnected));
        }
        return Future.succeededFuture();
    }

    /**
     * Add or replace a server and announce it.
     */
    public Future<Void> putServer(UpstreamServer server) {
        boolean existed;
        synchronized (servers) {
            UpstreamServer previous = servers.get(server.getId());
            existed = previous != null;
            if (existed) {
                server = server.withStatus(previous.getConnectionStatus(), previous.getLastError(), previous.getLastConnected());
            }
            servers.put(server.getId(), server);
        }
        announce(existed ? "updated" : "added", server.getId());
        return Future.succeededFuture();
    }

    public Future<Void> removeServer(String serverId) {
        UpstreamServer removed;
        synchronized (servers) {
            removed = servers.remove(serverId);
        }
        if (removed != null) {
            announce("removed", serverId);
        }
        return Future.succeededFuture();
    }

    public int size() {
        synchronized (servers) {
            return servers.size();
        }
    }

    private void announce(String action, String serverId) {
        vertx.eventBus().publish(CHANGED_ADDRESS, new JsonObject()
            .put("action", action)
            .put("serverId", serverId)
            .put("timestamp", System.currentTimeMillis()));
    }
}
