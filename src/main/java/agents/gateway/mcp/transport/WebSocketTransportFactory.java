package agents.gateway.mcp.transport;

import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;

import static agents.gateway.Driver.logLevel;

/**
 * JSON-RPC over WebSocket at {@code ws(s)://host[:port]/mcp} with a bearer credential.
 * Each transport owns its own client so closing one connection releases everything it holds.
 */
public class WebSocketTransportFactory implements TransportFactory {

    private final String path;
    private final int connectTimeoutMs;
    private final int maxMessageSize;

    public WebSocketTransportFactory(String path, long connectTimeoutMs, int maxMessageSize) {
        this.path = path;
        this.connectTimeoutMs = (int) connectTimeoutMs;
        this.maxMessageSize = maxMessageSize;
    }

    @Override
    public Future<UpstreamTransport> open(Vertx vertx, UpstreamServer server, String credential) {
        String uri;
        try {
            uri = server.webSocketUri(path);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new IllegalArgumentException("Invalid server url " + server.getUrl() + ": " + e.getMessage(), e));
        }

        WebSocketClientOptions clientOptions = new WebSocketClientOptions();
        clientOptions.setConnectTimeout(connectTimeoutMs);
        clientOptions.setMaxMessageSize(maxMessageSize);
        clientOptions.setMaxFrameSize(Math.min(maxMessageSize, 65536));
        WebSocketClient client = vertx.createWebSocketClient(clientOptions);

        WebSocketConnectOptions connectOptions = new WebSocketConnectOptions();
        connectOptions.setAbsoluteURI(uri);
        connectOptions.addHeader("Authorization", "Bearer " + (credential != null ? credential : ""));

        if (logLevel >= 3) vertx.eventBus().publish("log", "Opening WebSocket to " + uri + " for server " + server.getId() + ",3,WebSocketTransportFactory,Connect,Transport");

        return client.connect(connectOptions)
            .<UpstreamTransport>map(socket -> new WebSocketTransport(client, socket))
            .onFailure(err -> client.close());
    }

    static class WebSocketTransport implements UpstreamTransport {

        private final WebSocketClient client;
        private final WebSocket socket;
        private volatile boolean open = true;
        private Handler<Void> closeHandler;

        WebSocketTransport(WebSocketClient client, WebSocket socket) {
            this.client = client;
            this.socket = socket;
            socket.closeHandler(v -> {
                open = false;
                client.close();
                if (closeHandler != null) {
                    closeHandler.handle(null);
                }
            });
        }

        @Override
        public Future<Void> write(String frame) {
            if (!open || socket.isClosed()) {
                return Future.failedFuture(new IllegalStateException("WebSocket is closed"));
            }
            return socket.writeTextMessage(frame);
        }

        @Override
        public UpstreamTransport messageHandler(Handler<String> handler) {
            socket.textMessageHandler(handler);
            return this;
        }

        @Override
        public UpstreamTransport closeHandler(Handler<Void> handler) {
            this.closeHandler = handler;
            return this;
        }

        @Override
        public UpstreamTransport exceptionHandler(Handler<Throwable> handler) {
            socket.exceptionHandler(handler);
            return this;
        }

        @Override
        public boolean isOpen() {
            return open && !socket.isClosed();
        }

        @Override
        public Future<Void> close() {
            if (!open) {
                return Future.succeededFuture();
            }
            return socket.close();
        }
    }
}
