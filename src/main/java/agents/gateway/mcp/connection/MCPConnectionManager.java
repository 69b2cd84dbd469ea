package agents.gateway.mcp.connection;

import agents.gateway.config.CredentialResolver;
import agents.gateway.config.GatewayConfig;
import agents.gateway.directory.ServerDirectory;
import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.transport.TransportFactory;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static agents.gateway.Driver.logLevel;

/**
 * Owns one long-lived connection per upstream server.
 *
 * <p>Each server has a record guarded by its own lock; nothing locks across servers.
 * A record holds the live connection (a deployed {@link MCPUpstreamConnection}), the
 * in-flight connect attempt, the pending reconnect timer and the backoff counter.</p>
 *
 * <p>Every state change is written back to the {@link ServerDirectory} and published on
 * {@link #STATE_ADDRESS}; a {@code connected} event is what triggers tool discovery.</p>
 */
public class MCPConnectionManager {

    public static final String STATE_ADDRESS = "mcp.connection.state";
    public static final String STATE_REMOVED = "removed";

    private final Vertx vertx;
    private final ServerDirectory directory;
    private final TransportFactory transportFactory;
    private final GatewayConfig config;
    private final Map<String, ManagedServer> servers = new ConcurrentHashMap<>();

    private long sweepTimerId = -1;
    private MessageConsumer<JsonObject> directoryConsumer;

    static class ManagedServer {
        UpstreamServer server;
        MCPUpstreamConnection connection;
        String deploymentId;
        Future<Boolean> connecting;
        long reconnectTimerId = -1;
        int attempts = 0;
        boolean suspended = false;
        boolean removed = false;
        ConnectionState status = ConnectionState.DISCONNECTED;
        String lastError;
        Long lastConnected;

        ManagedServer(UpstreamServer server) {
            this.server = server;
        }
    }

    public MCPConnectionManager(Vertx vertx, ServerDirectory directory, TransportFactory transportFactory, GatewayConfig config) {
        this.vertx = vertx;
        this.directory = directory;
        this.transportFactory = transportFactory;
        this.config = config;
    }

    /**
     * Load the directory, connect active servers, start the health sweep and follow directory changes.
     * Completes once every initial attempt has settled; individual failures do not fail it.
     */
    public Future<Void> start() {
        directoryConsumer = vertx.eventBus().consumer(ServerDirectory.CHANGED_ADDRESS, msg -> onDirectoryChanged(msg.body()));

        sweepTimerId = vertx.setPeriodic(config.getHealthCheckIntervalMs(), id -> healthSweep());

        return directory.listServers().compose(list -> {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (UpstreamServer server : list) {
                ManagedServer managed = new ManagedServer(server);
                servers.put(server.getId(), managed);
                if (server.isActive()) {
                    attempts.add(attemptConnect(managed));
                }
            }
            if (logLevel >= 1) vertx.eventBus().publish("log", "Connection manager started with " + list.size() + " servers,1,MCPConnectionManager,Start,Connection");
            return Future.join(attempts).<Void>mapEmpty().otherwiseEmpty();
        });
    }

    /**
     * Cancel all timers and close every connection. Outstanding requests resolve with CONNECTION_CLOSED.
     */
    public Future<Void> stop() {
        if (sweepTimerId >= 0) {
            vertx.cancelTimer(sweepTimerId);
            sweepTimerId = -1;
        }
        if (directoryConsumer != null) {
            directoryConsumer.unregister();
            directoryConsumer = null;
        }

        List<Future<Void>> closing = new ArrayList<>();
        for (ManagedServer managed : servers.values()) {
            String deploymentId;
            synchronized (managed) {
                managed.suspended = true;
                cancelReconnect(managed);
                deploymentId = managed.deploymentId;
                managed.connection = null;
                managed.deploymentId = null;
                managed.status = ConnectionState.DISCONNECTED;
            }
            if (deploymentId != null) {
                closing.add(undeploy(deploymentId));
            }
        }
        if (logLevel >= 1) vertx.eventBus().publish("log", "Connection manager stopping; closing " + closing.size() + " connections,1,MCPConnectionManager,Stop,Connection");
        return Future.join(closing).<Void>mapEmpty().otherwiseEmpty();
    }

    /**
     * Explicit connect. Clears a previous explicit disconnect. A connect already in
     * flight is returned as is.
     *
     * @return true when the connection opened, false when the attempt failed
     */
    public Future<Boolean> connect(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId));
        }
        synchronized (managed) {
            managed.suspended = false;
        }
        return attemptConnect(managed);
    }

    private Future<Boolean> attemptConnect(ManagedServer managed) {
        Promise<Boolean> promise;
        String oldDeployment;
        synchronized (managed) {
            if (managed.connecting != null) {
                return managed.connecting;
            }
            cancelReconnect(managed);
            promise = Promise.promise();
            managed.connecting = promise.future();
            oldDeployment = managed.deploymentId;
            managed.connection = null;
            managed.deploymentId = null;
            managed.status = ConnectionState.CONNECTING;
        }
        publishState(managed, null);

        // The old socket is gone before a new one is attempted
        Future<Void> teardown = oldDeployment != null ? undeploy(oldDeployment) : Future.succeededFuture();

        teardown.compose(v -> {
            UpstreamServer server;
            synchronized (managed) {
                server = managed.server;
            }
            MCPUpstreamConnection connection = new MCPUpstreamConnection(
                server,
                CredentialResolver.resolve(server.getCredentialRef()),
                transportFactory,
                config.getMaxPendingPerConnection(),
                config.getConnectTimeoutMs(),
                this::onConnectionClosed);
            return vertx.deployVerticle(connection).map(deploymentId -> {
                boolean keep;
                synchronized (managed) {
                    keep = !managed.suspended && !managed.removed;
                    if (keep) {
                        managed.connection = connection;
                        managed.deploymentId = deploymentId;
                        managed.status = ConnectionState.CONNECTED;
                        managed.lastError = null;
                        managed.lastConnected = connection.getLastConnected();
                        managed.attempts = 0;
                    }
                    managed.connecting = null;
                }
                if (!keep) {
                    // Disconnected or removed while the attempt was running
                    undeploy(deploymentId);
                    return false;
                }
                writeBack(managed);
                publishState(managed, connection.getConnectionId());
                return true;
            });
        }).recover(err -> {
            boolean reconnect;
            synchronized (managed) {
                managed.connecting = null;
                managed.status = ConnectionState.DISCONNECTED;
                managed.lastError = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
                reconnect = managed.server.isActive() && !managed.suspended && !managed.removed;
            }
            if (logLevel >= 1) vertx.eventBus().publish("log", "Connect to " + managed.server.getId() + " failed: " + managed.lastError + ",1,MCPConnectionManager,Connect,Connection");
            writeBack(managed);
            publishState(managed, null);
            if (reconnect) {
                scheduleReconnect(managed);
            }
            return Future.succeededFuture(false);
        }).onComplete(promise);

        return promise.future();
    }

    /**
     * Explicit close. Cancels any scheduled reconnect and keeps the health sweep away
     * from this server until the next explicit connect or directory update.
     */
    public Future<Void> disconnect(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.UNKNOWN_SERVER, "Unknown server " + serverId));
        }
        String deploymentId;
        synchronized (managed) {
            managed.suspended = true;
            cancelReconnect(managed);
            deploymentId = managed.deploymentId;
            managed.connection = null;
            managed.deploymentId = null;
            managed.attempts = 0;
            managed.status = ConnectionState.DISCONNECTED;
        }
        if (logLevel >= 1) vertx.eventBus().publish("log", "Disconnecting MCP server " + serverId + ",1,MCPConnectionManager,Disconnect,Connection");
        Future<Void> closed = deploymentId != null ? undeploy(deploymentId) : Future.succeededFuture();
        return closed.onComplete(ar -> {
            writeBack(managed);
            publishState(managed, null);
        });
    }

    /**
     * Write a raw frame to the server's live connection. No queueing across reconnects.
     */
    public Future<Void> send(String serverId, String frame) {
        MCPUpstreamConnection connection = getConnection(serverId);
        if (connection == null) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.NOT_CONNECTED,
                "Server " + serverId + " not connected"));
        }
        return connection.send(frame);
    }

    private void onConnectionClosed(MCPUpstreamConnection connection, boolean explicit, String reason) {
        ManagedServer managed = servers.get(connection.getServerId());
        if (managed == null) {
            return;
        }
        String deploymentId;
        boolean reconnect;
        synchronized (managed) {
            if (managed.connection != connection) {
                return;
            }
            deploymentId = managed.deploymentId;
            managed.connection = null;
            managed.deploymentId = null;
            managed.status = ConnectionState.DISCONNECTED;
            managed.lastError = reason;
            reconnect = !explicit && managed.server.isActive() && !managed.suspended && !managed.removed;
        }
        if (deploymentId != null) {
            undeploy(deploymentId);
        }
        writeBack(managed);
        publishState(managed, null);
        if (reconnect) {
            scheduleReconnect(managed);
        }
    }

    /**
     * At most one reconnect is ever scheduled per server.
     */
    private void scheduleReconnect(ManagedServer managed) {
        long delay;
        synchronized (managed) {
            if (managed.reconnectTimerId >= 0 || managed.connecting != null || managed.connection != null) {
                return;
            }
            delay = backoffDelay(managed.attempts);
            managed.attempts++;
            managed.reconnectTimerId = vertx.setTimer(delay, id -> {
                synchronized (managed) {
                    managed.reconnectTimerId = -1;
                    if (managed.suspended || managed.removed || !managed.server.isActive()) {
                        return;
                    }
                }
                attemptConnect(managed);
            });
        }
        if (logLevel >= 2) vertx.eventBus().publish("log", "Reconnect to " + managed.server.getId() + " scheduled in " + delay + "ms,2,MCPConnectionManager,Reconnect,Connection");
    }

    long backoffDelay(int attempts) {
        long base = config.getReconnectBaseDelayMs();
        long max = config.getReconnectMaxDelayMs();
        long delay = base;
        for (int i = 0; i < attempts && delay < max; i++) {
            delay *= 2;
        }
        return Math.min(delay, max);
    }

    private void cancelReconnect(ManagedServer managed) {
        if (managed.reconnectTimerId >= 0) {
            vertx.cancelTimer(managed.reconnectTimerId);
            managed.reconnectTimerId = -1;
        }
    }

    /**
     * Reconnect active servers that are down with nothing pending, and force a reconnect
     * of connections whose transport closed without us noticing. Safe to run any time.
     */
    public void healthSweep() {
        for (ManagedServer managed : servers.values()) {
            boolean connect = false;
            synchronized (managed) {
                if (managed.removed || managed.suspended || !managed.server.isActive()) {
                    continue;
                }
                if (managed.connecting != null || managed.reconnectTimerId >= 0) {
                    continue;
                }
                if (managed.connection == null) {
                    connect = true;
                } else if (!managed.connection.isTransportOpen()) {
                    if (logLevel >= 1) vertx.eventBus().publish("log", "Stale connection to " + managed.server.getId() + " - forcing reconnect,1,MCPConnectionManager,HealthCheck,Connection");
                    connect = true;
                }
            }
            if (connect) {
                attemptConnect(managed);
            }
        }
    }

    private void onDirectoryChanged(JsonObject change) {
        if (change == null) {
            return;
        }
        String action = change.getString("action", "updated");
        String serverId = change.getValue("serverId") == null ? null : String.valueOf(change.getValue("serverId"));
        if (serverId == null) {
            return;
        }
        if ("removed".equals(action)) {
            removeServer(serverId);
            return;
        }
        directory.getServer(serverId).onComplete(ar -> {
            if (ar.failed()) {
                vertx.eventBus().publish("log", "Failed to read server " + serverId + " from directory: " + ar.cause().getMessage() + ",0,MCPConnectionManager,Directory,Connection");
                return;
            }
            if (ar.result() == null) {
                removeServer(serverId);
            } else {
                applyServer(ar.result());
            }
        });
    }

    /**
     * Add a server or apply an updated record to a managed one.
     */
    public Future<Boolean> applyServer(UpstreamServer updated) {
        ManagedServer fresh = new ManagedServer(updated);
        ManagedServer existing = servers.putIfAbsent(updated.getId(), fresh);
        if (existing == null) {
            if (logLevel >= 1) vertx.eventBus().publish("log", "Added MCP server " + updated.getId() + " (" + updated.getUrl() + "),1,MCPConnectionManager,Directory,Connection");
            publishState(fresh, null);
            return updated.isActive() ? attemptConnect(fresh) : Future.succeededFuture(false);
        }

        boolean endpointChanged;
        boolean wasActive;
        boolean connected;
        synchronized (existing) {
            UpstreamServer previous = existing.server;
            existing.server = updated;
            existing.suspended = false;
            endpointChanged = !previous.sameEndpoint(updated);
            wasActive = previous.isActive();
            connected = existing.connection != null;
        }
        if (logLevel >= 2) vertx.eventBus().publish("log", "Updated MCP server " + updated.getId() + ",2,MCPConnectionManager,Directory,Connection");

        if (!updated.isActive()) {
            if (wasActive || connected) {
                return disconnect(updated.getId()).map(false);
            }
            return Future.succeededFuture(false);
        }
        if (endpointChanged || !wasActive || !connected) {
            return attemptConnect(existing);
        }
        publishState(existing, null);
        return Future.succeededFuture(true);
    }

    public Future<Void> removeServer(String serverId) {
        ManagedServer managed = serverId != null ? servers.remove(serverId) : null;
        if (managed == null) {
            return Future.succeededFuture();
        }
        String deploymentId;
        synchronized (managed) {
            managed.removed = true;
            cancelReconnect(managed);
            deploymentId = managed.deploymentId;
            managed.connection = null;
            managed.deploymentId = null;
            managed.status = ConnectionState.DISCONNECTED;
        }
        if (logLevel >= 1) vertx.eventBus().publish("log", "Removed MCP server " + serverId + ",1,MCPConnectionManager,Directory,Connection");
        vertx.eventBus().publish(STATE_ADDRESS, new JsonObject()
            .put("serverId", serverId)
            .put("state", STATE_REMOVED)
            .put("timestamp", System.currentTimeMillis()));
        return deploymentId != null ? undeploy(deploymentId) : Future.succeededFuture();
    }

    private Future<Void> undeploy(String deploymentId) {
        return vertx.undeploy(deploymentId).recover(err -> {
            // Already undeployed
            return Future.succeededFuture();
        });
    }

    private void writeBack(ManagedServer managed) {
        String serverId;
        String status;
        String lastError;
        Long lastConnected;
        synchronized (managed) {
            if (managed.removed) {
                return;
            }
            serverId = managed.server.getId();
            status = managed.status.wireName();
            lastError = managed.lastError;
            lastConnected = managed.lastConnected;
        }
        directory.recordConnectionStatus(serverId, status, lastError, lastConnected).onFailure(err ->
            vertx.eventBus().publish("log", "Failed to record status of " + serverId + ": " + err.getMessage() + ",0,MCPConnectionManager,WriteBack,Directory"));
    }

    private void publishState(ManagedServer managed, String connectionId) {
        JsonObject event;
        synchronized (managed) {
            event = new JsonObject()
                .put("serverId", managed.server.getId())
                .put("state", managed.status.wireName())
                .put("connectionId", connectionId)
                .put("lastError", managed.lastError)
                .put("lastConnected", managed.lastConnected)
                .put("timestamp", System.currentTimeMillis());
        }
        vertx.eventBus().publish(STATE_ADDRESS, event);
    }

    /**
     * The server's live connection, or null when it has none.
     */
    public MCPUpstreamConnection getConnection(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return null;
        }
        synchronized (managed) {
            MCPUpstreamConnection connection = managed.connection;
            return connection != null && connection.isConnected() ? connection : null;
        }
    }

    public boolean isManaged(String serverId) {
        return managed(serverId) != null;
    }

    private ManagedServer managed(String serverId) {
        return serverId != null ? servers.get(serverId) : null;
    }

    public Set<String> serverIds() {
        return servers.keySet();
    }

    public UpstreamServer getServer(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return null;
        }
        synchronized (managed) {
            return managed.server;
        }
    }

    public boolean isReconnectScheduled(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return false;
        }
        synchronized (managed) {
            return managed.reconnectTimerId >= 0;
        }
    }

    /**
     * Connection fields of one server for status reporting.
     */
    public JsonObject describe(String serverId) {
        ManagedServer managed = managed(serverId);
        if (managed == null) {
            return null;
        }
        synchronized (managed) {
            MCPUpstreamConnection connection = managed.connection;
            return new JsonObject()
                .put("serverId", managed.server.getId())
                .put("name", managed.server.getName())
                .put("url", managed.server.getUrl())
                .put("active", managed.server.isActive())
                .put("status", managed.status.wireName())
                .put("toolCount", connection != null ? connection.getTools().size() : 0)
                .put("pendingRequests", connection != null ? connection.getPending().size() : 0)
                .put("lastConnected", managed.lastConnected)
                .put("lastError", managed.lastError)
                .put("reconnectScheduled", managed.reconnectTimerId >= 0);
        }
    }
}
