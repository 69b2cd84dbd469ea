package agents.gateway.mcp.transport;

import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import static agents.gateway.Driver.logLevel;

/**
 * HTTP POST fallback to an upstream's {@code /mcp} endpoint, one JSON-RPC exchange per request.
 */
public class MCPHttpUpstreamClient {

    private final Vertx vertx;
    private final WebClient webClient;
    private final String path;
    private final long timeoutMs;

    /**
     * The upstream answered with a non-2xx status.
     */
    public static class UpstreamHttpException extends RuntimeException {
        private final int statusCode;
        private final String body;

        public UpstreamHttpException(int statusCode, String body) {
            super("MCP server error: HTTP " + statusCode);
            this.statusCode = statusCode;
            this.body = body;
        }

        public int getStatusCode() {
            return statusCode;
        }

        public String getBody() {
            return body;
        }
    }

    /**
     * The request was sent but no usable response came back.
     */
    public static class NoResponseException extends RuntimeException {
        public NoResponseException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public MCPHttpUpstreamClient(Vertx vertx, String path, long connectTimeoutMs, long timeoutMs) {
        this.vertx = vertx;
        this.path = path;
        this.timeoutMs = timeoutMs;

        WebClientOptions options = new WebClientOptions()
            .setConnectTimeout((int) connectTimeoutMs)
            .setIdleTimeout(60);

        this.webClient = WebClient.create(vertx, options);
    }

    /**
     * POST the request and return the upstream's JSON-RPC response body.
     */
    public Future<JsonObject> post(UpstreamServer server, String credential, JsonObject request) {
        Promise<JsonObject> promise = Promise.promise();
        String uri = server.httpUri(path);

        webClient.postAbs(uri)
            .putHeader("Content-Type", "application/json")
            .putHeader("Authorization", "Bearer " + (credential != null ? credential : ""))
            .putHeader("MCP-Protocol-Version", server.getProtocolVersion())
            .timeout(timeoutMs)
            .sendJsonObject(request, ar -> {
                if (ar.failed()) {
                    if (logLevel >= 2) vertx.eventBus().publish("log", "HTTP upstream " + server.getId() + " gave no response: " + ar.cause().getMessage() + ",2,MCPHttpUpstreamClient,Post,Transport");
                    promise.fail(new NoResponseException("MCP server timeout or no response", ar.cause()));
                    return;
                }

                HttpResponse<Buffer> response = ar.result();
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    promise.fail(new UpstreamHttpException(response.statusCode(), response.bodyAsString()));
                    return;
                }

                try {
                    JsonObject body = response.bodyAsJsonObject();
                    if (body == null) {
                        promise.fail(new NoResponseException("MCP server returned an empty body", null));
                    } else {
                        promise.complete(body);
                    }
                } catch (DecodeException e) {
                    promise.fail(new NoResponseException("MCP server returned malformed JSON", e));
                }
            });

        return promise.future();
    }

    public void close() {
        webClient.close();
    }
}
