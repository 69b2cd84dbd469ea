package agents.gateway.mcp.transport;

import io.vertx.core.Future;
import io.vertx.core.Handler;

/**
 * A bidirectional text-frame channel to one upstream MCP server.
 * Handlers are invoked on the context that opened the transport.
 */
public interface UpstreamTransport {

    /**
     * Write one JSON-RPC frame. Fails when the transport is closed.
     */
    Future<Void> write(String frame);

    UpstreamTransport messageHandler(Handler<String> handler);

    /**
     * Invoked once when the channel closes, whoever closed it.
     */
    UpstreamTransport closeHandler(Handler<Void> handler);

    UpstreamTransport exceptionHandler(Handler<Throwable> handler);

    boolean isOpen();

    Future<Void> close();
}
