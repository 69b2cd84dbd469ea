package agents.gateway.mcp.transport;

import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Opens transports to upstream servers. Called from the context that will own the transport.
 */
public interface TransportFactory {

    /**
     * @param credential resolved bearer credential, may be null
     */
    Future<UpstreamTransport> open(Vertx vertx, UpstreamServer server, String credential);
}
