package agents.gateway.mcp.connection;

import agents.gateway.mcp.base.MCPGatewayException;
import agents.gateway.mcp.base.MCPTool;
import agents.gateway.mcp.transport.TransportFactory;
import agents.gateway.mcp.transport.UpstreamTransport;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static agents.gateway.Driver.logLevel;

/**
 * One live transport to one upstream server, deployed as its own verticle so the
 * socket is read and written only from this verticle's context.
 *
 * <p>The reader parses every frame and publishes it on {@link #INBOUND_ADDRESS};
 * unparseable frames are logged and dropped without stopping the reader. Writes are
 * funnelled through {@link #send(String)}, which hops onto this context.</p>
 *
 * <p>A connection is never reused: the manager deploys a new one (with a fresh
 * connection id) for every attempt.</p>
 */
public class MCPUpstreamConnection extends AbstractVerticle {

    public static final String INBOUND_ADDRESS = "mcp.upstream.inbound";

    /**
     * Notified once when the connection ends.
     */
    @FunctionalInterface
    public interface CloseListener {
        void onClosed(MCPUpstreamConnection connection, boolean explicit, String reason);
    }

    private final UpstreamServer server;
    private final String credential;
    private final TransportFactory transportFactory;
    private final long connectTimeoutMs;
    private final CloseListener closeListener;
    private final String connectionId = UUID.randomUUID().toString();
    private final PendingRequests pending;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String lastError;
    private volatile long lastConnected;
    private volatile List<MCPTool> tools = Collections.emptyList();

    private Context context;
    private UpstreamTransport transport;
    private boolean closeHandled = false;

    public MCPUpstreamConnection(UpstreamServer server, String credential, TransportFactory transportFactory,
                                 int maxPending, long connectTimeoutMs, CloseListener closeListener) {
        this.server = server;
        this.credential = credential;
        this.transportFactory = transportFactory;
        this.connectTimeoutMs = connectTimeoutMs;
        this.closeListener = closeListener;
        this.pending = new PendingRequests(maxPending);
    }

    @Override
    public void start(Promise<Void> startPromise) {
        context = vertx.getOrCreateContext();
        state = ConnectionState.CONNECTING;

        if (logLevel >= 2) vertx.eventBus().publish("log", "Connecting to MCP server " + server.getId() + " at " + server.getUrl() + ",2,MCPUpstreamConnection,Connect,Connection");

        long timer = vertx.setTimer(connectTimeoutMs, id -> {
            if (startPromise.tryFail(new MCPGatewayException(MCPGatewayException.Kind.TIMEOUT, "Connection timeout"))) {
                state = ConnectionState.DISCONNECTED;
                lastError = "Connection timeout";
            }
        });

        Future<UpstreamTransport> opening;
        try {
            opening = transportFactory.open(vertx, server, credential);
        } catch (RuntimeException e) {
            opening = Future.failedFuture(e);
        }

        opening.onComplete(ar -> {
            vertx.cancelTimer(timer);
            if (ar.failed()) {
                String message = ar.cause().getMessage() != null ? ar.cause().getMessage() : ar.cause().getClass().getSimpleName();
                if (startPromise.tryFail(ar.cause())) {
                    state = ConnectionState.DISCONNECTED;
                    lastError = message;
                    if (logLevel >= 1) vertx.eventBus().publish("log", "Failed to connect to MCP server " + server.getId() + ": " + message + ",1,MCPUpstreamConnection,Connect,Connection");
                }
                return;
            }

            UpstreamTransport opened = ar.result();
            if (startPromise.future().isComplete()) {
                // Timed out while the handshake was still running
                opened.close();
                return;
            }

            transport = opened;
            transport.messageHandler(this::onFrame);
            transport.exceptionHandler(err -> {
                lastError = err.getMessage();
                if (logLevel >= 1) vertx.eventBus().publish("log", "Transport error on " + server.getId() + ": " + err.getMessage() + ",1,MCPUpstreamConnection,Read,Connection");
            });
            transport.closeHandler(v -> handleClose(false, lastError != null ? lastError : "Connection closed by upstream"));

            state = ConnectionState.CONNECTED;
            lastError = null;
            lastConnected = System.currentTimeMillis();
            if (logLevel >= 1) vertx.eventBus().publish("log", "Connected to MCP server " + server.getId() + " (" + connectionId + "),1,MCPUpstreamConnection,Connect,Connection");
            startPromise.complete();
        });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        UpstreamTransport current = transport;
        handleClose(true, "Connection closed");
        if (current != null && current.isOpen()) {
            current.close().onComplete(ar -> stopPromise.complete());
        } else {
            stopPromise.complete();
        }
    }

    private void onFrame(String frame) {
        Object parsed;
        try {
            parsed = Json.decodeValue(frame);
        } catch (DecodeException e) {
            if (logLevel >= 1) vertx.eventBus().publish("log", "Protocol error from " + server.getId() + ": unparseable frame dropped,1,MCPUpstreamConnection,Read,Protocol");
            return;
        }
        if (!(parsed instanceof JsonObject)) {
            if (logLevel >= 1) vertx.eventBus().publish("log", "Protocol error from " + server.getId() + ": non-object frame dropped,1,MCPUpstreamConnection,Read,Protocol");
            return;
        }
        if (logLevel >= 4) vertx.eventBus().publish("log", "Inbound from " + server.getId() + ": " + frame + ",4,MCPUpstreamConnection,Read,Data");

        vertx.eventBus().publish(INBOUND_ADDRESS, new JsonObject()
            .put("serverId", server.getId())
            .put("connectionId", connectionId)
            .put("message", parsed));
    }

    /**
     * Runs once per connection: resolves every outstanding request and notifies the manager.
     */
    private void handleClose(boolean explicit, String reason) {
        synchronized (this) {
            if (closeHandled) {
                return;
            }
            closeHandled = true;
        }
        boolean wasConnected = state == ConnectionState.CONNECTED;
        state = explicit ? ConnectionState.CLOSING : ConnectionState.DISCONNECTED;
        if (!explicit) {
            lastError = reason;
        }

        int orphans = pending.closeAll(reason);
        if (logLevel >= 1) vertx.eventBus().publish("log", "Connection to " + server.getId() + " closed (" + reason + "); " + orphans + " pending requests resolved,1,MCPUpstreamConnection,Close,Connection");

        state = ConnectionState.DISCONNECTED;
        if (wasConnected && closeListener != null) {
            closeListener.onClosed(this, explicit, reason);
        }
    }

    /**
     * Write one frame through this connection's single writer.
     */
    public Future<Void> send(String frame) {
        UpstreamTransport current = transport;
        if (state != ConnectionState.CONNECTED || current == null || !current.isOpen()) {
            return Future.failedFuture(new MCPGatewayException(MCPGatewayException.Kind.NOT_CONNECTED,
                "Server " + server.getId() + " not connected"));
        }
        Promise<Void> promise = Promise.promise();
        context.runOnContext(v -> {
            if (!current.isOpen()) {
                promise.fail(new MCPGatewayException(MCPGatewayException.Kind.NOT_CONNECTED,
                    "Server " + server.getId() + " not connected"));
                return;
            }
            if (logLevel >= 4) vertx.eventBus().publish("log", "Outbound to " + server.getId() + ": " + frame + ",4,MCPUpstreamConnection,Write,Data");
            current.write(frame).onComplete(promise);
        });
        return promise.future();
    }

    public UpstreamServer getServer() {
        return server;
    }

    public String getServerId() {
        return server.getId();
    }

    public String getConnectionId() {
        return connectionId;
    }

    public PendingRequests getPending() {
        return pending;
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    /**
     * True when the transport is usable. A connection marked connected whose
     * transport reports closed is stale and needs a forced reconnect.
     */
    public boolean isTransportOpen() {
        UpstreamTransport current = transport;
        return current != null && current.isOpen();
    }

    public String getLastError() {
        return lastError;
    }

    public long getLastConnected() {
        return lastConnected;
    }

    public List<MCPTool> getTools() {
        return tools;
    }

    public void setTools(List<MCPTool> tools) {
        this.tools = Collections.unmodifiableList(tools);
    }
}
