package agents.gateway.directory;

import agents.gateway.mcp.connection.UpstreamServer;
import io.vertx.core.Future;

import java.util.List;

/**
 * Durable store of upstream server records. The gateway reads records and writes
 * back only the derived connection fields.
 */
public interface ServerDirectory {

    /**
     * Address on which directory changes are announced: {@code {action, serverId}} with
     * action {@code added}, {@code updated} or {@code removed}.
     */
    String CHANGED_ADDRESS = "mcp.directory.changed";

    Future<List<UpstreamServer>> listServers();

    /**
     * @return the server, or null when no such record exists
     */
    Future<UpstreamServer> getServer(String serverId);

    Future<Void> recordConnectionStatus(String serverId, String status, String lastError, Long lastConnected);
}
