package agents.gateway.mcp.transport;

import agents.gateway.mcp.base.MCPRequest;
import agents.gateway.mcp.base.MCPResponse;
import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import static agents.gateway.Driver.logLevel;

/**
 * In-process fake MCP backend for development runs.
 * Every server connected through it exposes {@code mock.echo} and {@code mock.generate};
 * {@code mock.generate} streams its output as {@code mcp.chunk} notifications before the final result.
 */
public class SimulatedTransportFactory implements TransportFactory {

    private final long latencyMs;

    public SimulatedTransportFactory() {
        this(5);
    }

    public SimulatedTransportFactory(long latencyMs) {
        this.latencyMs = Math.max(1, latencyMs);
    }

    @Override
    public Future<UpstreamTransport> open(Vertx vertx, UpstreamServer server, String credential) {
        if (logLevel >= 2) vertx.eventBus().publish("log", "Simulating connection to MCP server " + server.getId() + ",2,SimulatedTransportFactory,Connect,Transport");
        return Future.succeededFuture(new SimulatedTransport(vertx, latencyMs));
    }

    static JsonArray mockTools() {
        return new JsonArray()
            .add(new JsonObject()
                .put("name", "mock.echo")
                .put("description", "Echo back the input")
                .put("schema", new JsonObject()
                    .put("type", "object")
                    .put("properties", new JsonObject()
                        .put("message", new JsonObject()
                            .put("type", "string")
                            .put("description", "Message to echo")))
                    .put("required", new JsonArray().add("message"))))
            .add(new JsonObject()
                .put("name", "mock.generate")
                .put("description", "Generate text based on prompt")
                .put("schema", new JsonObject()
                    .put("type", "object")
                    .put("properties", new JsonObject()
                        .put("prompt", new JsonObject()
                            .put("type", "string")
                            .put("description", "Prompt for generation"))
                        .put("max_tokens", new JsonObject()
                            .put("type", "integer")
                            .put("description", "Maximum tokens to generate")
                            .put("default", 100)))
                    .put("required", new JsonArray().add("prompt"))));
    }

    static class SimulatedTransport implements UpstreamTransport {

        private final Vertx vertx;
        private final long latencyMs;
        private volatile boolean open = true;
        private Handler<String> messageHandler;
        private Handler<Void> closeHandler;

        SimulatedTransport(Vertx vertx, long latencyMs) {
            this.vertx = vertx;
            this.latencyMs = latencyMs;
        }

        @Override
        public Future<Void> write(String frame) {
            if (!open) {
                return Future.failedFuture(new IllegalStateException("Simulated transport is closed"));
            }
            JsonObject json;
            try {
                json = new JsonObject(frame);
            } catch (DecodeException e) {
                return Future.succeededFuture();
            }
            MCPRequest request = MCPRequest.fromJson(json);
            if (!request.isNotification()) {
                respond(request);
            }
            return Future.succeededFuture();
        }

        private void respond(MCPRequest request) {
            Object id = request.getId();
            String method = request.getMethod() == null ? "" : request.getMethod();
            switch (method) {
                case MCPRequest.DISCOVER:
                    emit(MCPResponse.success(id, new JsonObject().put("tools", mockTools())).toJson(), latencyMs);
                    break;
                case MCPRequest.PING:
                    emit(MCPResponse.success(id, new JsonObject().put("pong", true)).toJson(), latencyMs);
                    break;
                case MCPRequest.TOOL_INVOCATION:
                case MCPRequest.TOOLS_CALL:
                    runTool(request);
                    break;
                default:
                    emit(MCPResponse.error(id, MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method).toJson(), latencyMs);
            }
        }

        private void runTool(MCPRequest request) {
            Object id = request.getId();
            String tool = request.toolName();
            JsonObject arguments = request.getParams() == null ? new JsonObject()
                : request.getParams().getJsonObject("arguments", new JsonObject());

            if ("mock.echo".equals(tool)) {
                emit(MCPResponse.success(id, new JsonObject().put("content", arguments.getValue("message"))).toJson(), latencyMs);
            } else if ("mock.generate".equals(tool)) {
                String prompt = arguments.getString("prompt", "");
                int maxTokens = Math.max(1, Math.min(arguments.getInteger("max_tokens", 3), 20));
                StringBuilder text = new StringBuilder();
                for (int i = 1; i <= maxTokens; i++) {
                    String token = (i == 1 ? "" : " ") + "token" + i;
                    text.append(token);
                    emit(new JsonObject()
                        .put("jsonrpc", "2.0")
                        .put("method", MCPRequest.CHUNK)
                        .put("params", new JsonObject()
                            .put("request_id", id)
                            .put("chunk", new JsonObject().put("index", i - 1).put("text", token))), latencyMs * i);
                }
                emit(MCPResponse.success(id, new JsonObject()
                    .put("prompt", prompt)
                    .put("text", text.toString())
                    .put("tokens", maxTokens)).toJson(), latencyMs * (maxTokens + 1));
            } else {
                emit(MCPResponse.error(id, MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + tool).toJson(), latencyMs);
            }
        }

        private void emit(JsonObject message, long delayMs) {
            vertx.setTimer(delayMs, t -> {
                Handler<String> handler = messageHandler;
                if (open && handler != null) {
                    handler.handle(message.encode());
                }
            });
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
            if (open) {
                open = false;
                if (closeHandler != null) {
                    closeHandler.handle(null);
                }
            }
            return Future.succeededFuture();
        }
    }
}
