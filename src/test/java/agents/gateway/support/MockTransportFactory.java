package agents.gateway.support;

import agents.gateway.mcp.connection.UpstreamServer;
import agents.gateway.mcp.transport.TransportFactory;
import agents.gateway.mcp.transport.UpstreamTransport;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted in-memory upstream. Every opened transport records the frames written to it
 * and hands each one to the current {@link Script}, which may answer through
 * {@link MockTransport#receive(JsonObject)}.
 */
public class MockTransportFactory implements TransportFactory {

    @FunctionalInterface
    public interface Script {
        void onWrite(MockTransport transport, JsonObject frame);
    }

    private final List<MockTransport> opened = new CopyOnWriteArrayList<>();
    private volatile Script script = (transport, frame) -> { };
    private volatile boolean refuseConnections = false;

    public MockTransportFactory script(Script script) {
        this.script = script;
        return this;
    }

    /**
     * Answers every request with {@code {result: {echo: params}}} and ignores notifications.
     */
    public MockTransportFactory echo() {
        return script((transport, frame) -> {
            if (frame.getValue("id") != null) {
                transport.receive(new JsonObject()
                    .put("jsonrpc", "2.0")
                    .put("id", frame.getValue("id"))
                    .put("result", new JsonObject().put("echo", frame.getValue("params"))));
            }
        });
    }

    public MockTransportFactory refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
        return this;
    }

    @Override
    public Future<UpstreamTransport> open(Vertx vertx, UpstreamServer server, String credential) {
        if (refuseConnections) {
            return Future.failedFuture(new IllegalStateException("Connection refused"));
        }
        MockTransport transport = new MockTransport(vertx.getOrCreateContext(), server.getId());
        opened.add(transport);
        return Future.succeededFuture(transport);
    }

    public int openCount() {
        return opened.size();
    }

    public MockTransport latest() {
        return opened.isEmpty() ? null : opened.get(opened.size() - 1);
    }

    public class MockTransport implements UpstreamTransport {

        private final Context context;
        private final String serverId;
        private final List<JsonObject> written = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;
        private volatile boolean failWrites = false;
        private Handler<String> messageHandler = frame -> { };
        private Handler<Void> closeHandler = v -> { };

        MockTransport(Context context, String serverId) {
            this.context = context;
            this.serverId = serverId;
        }

        @Override
        public Future<Void> write(String frame) {
            if (!open) {
                return Future.failedFuture(new IllegalStateException("Transport closed"));
            }
            if (failWrites) {
                return Future.failedFuture(new IllegalStateException("Write failed"));
            }
            JsonObject json = new JsonObject(frame);
            written.add(json);
            script.onWrite(this, json);
            return Future.succeededFuture();
        }

        /**
         * Deliver a frame from the upstream on the transport's context.
         */
        public void receive(JsonObject message) {
            receiveRaw(message.encode());
        }

        public void receiveRaw(String frame) {
            context.runOnContext(v -> {
                if (open) {
                    messageHandler.handle(frame);
                }
            });
        }

        /**
         * The upstream goes away without a close handshake.
         */
        public void drop() {
            context.runOnContext(v -> closeNow());
        }

        /**
         * The socket dies and nobody is told.
         */
        public void goStale() {
            open = false;
        }

        private void closeNow() {
            if (open) {
                open = false;
                closeHandler.handle(null);
            }
        }

        /**
         * Completes once {@code count} frames have been written.
         */
        public Future<Void> awaitWrites(Vertx vertx, int count) {
            Promise<Void> promise = Promise.promise();
            if (written.size() >= count) {
                promise.complete();
                return promise.future();
            }
            vertx.setPeriodic(5, id -> {
                if (written.size() >= count) {
                    vertx.cancelTimer(id);
                    promise.tryComplete();
                }
            });
            return promise.future();
        }

        public void setFailWrites(boolean failWrites) {
            this.failWrites = failWrites;
        }

        public List<JsonObject> getWritten() {
            return written;
        }

        public String getServerId() {
            return serverId;
        }

        @Override
        public UpstreamTransport messageHandler(Handler<String> handler) {
            this.messageHandler = handler;
            return this;
        }

        @Override
        public UpstreamTransport closeHandler(Handler<Void> handler) {
            this.closeHandler = handler;
            return this;
        }

        @Override
        public UpstreamTransport exceptionHandler(Handler<Throwable> handler) {
            return this;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public Future<Void> close() {
            context.runOnContext(v -> closeNow());
            return Future.succeededFuture();
        }
    }
}
