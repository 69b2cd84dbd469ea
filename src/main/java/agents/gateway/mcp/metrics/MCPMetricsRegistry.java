package agents.gateway.mcp.metrics;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static agents.gateway.Driver.logLevel;

/**
 * Request metrics per upstream server and, nested, per tool.
 * Every {@code reportEvery} recorded outcomes a {@code mcp.metrics.updated} event is published.
 * Only a recorded request or rejection creates a server's record; reads and late outcomes never do.
 */
public class MCPMetricsRegistry {

    public static final String UPDATED_ADDRESS = "mcp.metrics.updated";

    private final Vertx vertx;
    private final int reportEvery;
    private final Map<String, ServerEntry> servers = new ConcurrentHashMap<>();
    private final AtomicLong outcomes = new AtomicLong(0);

    private static class ServerEntry {
        final RequestStatistics stats = new RequestStatistics();
        final Map<String, RequestStatistics> tools = new ConcurrentHashMap<>();

        RequestStatistics tool(String toolName) {
            return tools.computeIfAbsent(toolName, name -> new RequestStatistics());
        }

        JsonObject toJson(String serverId) {
            JsonObject perTool = new JsonObject();
            tools.forEach((name, toolStats) -> perTool.put(name, toolStats.toJson()));
            return stats.toJson()
                .put("serverId", serverId)
                .put("tools", perTool);
        }
    }

    public MCPMetricsRegistry(Vertx vertx, int reportEvery) {
        this.vertx = vertx;
        this.reportEvery = Math.max(1, reportEvery);
    }

    private ServerEntry server(String serverId) {
        return servers.computeIfAbsent(serverId, id -> new ServerEntry());
    }

    /**
     * An accepted request; {@code toolName} is null for anything but a tool invocation.
     */
    public void recordRequest(String serverId, String toolName) {
        ServerEntry entry = server(serverId);
        entry.stats.recordRequest();
        if (toolName != null) {
            entry.tool(toolName).recordRequest();
        }
    }

    public void recordOutcome(String serverId, String toolName, boolean success, long latency) {
        ServerEntry entry = servers.get(serverId);
        if (entry == null) {
            return;
        }
        entry.stats.recordOutcome(success, latency);
        if (toolName != null) {
            entry.tool(toolName).recordOutcome(success, latency);
        }

        if (outcomes.incrementAndGet() % reportEvery == 0) {
            if (logLevel >= 3) vertx.eventBus().publish("log", "Metrics reporting boundary reached,3,MCPMetricsRegistry,Report,Metrics");
            vertx.eventBus().publish(UPDATED_ADDRESS, new JsonObject()
                .put("serverId", serverId)
                .put("metrics", entry.toJson(serverId))
                .put("timestamp", System.currentTimeMillis()));
        }
    }

    /**
     * A request refused because the server's circuit was open.
     */
    public void recordRejected(String serverId, String toolName) {
        ServerEntry entry = server(serverId);
        entry.stats.recordRejected();
        if (toolName != null) {
            entry.tool(toolName).recordRejected();
        }
    }

    /**
     * @return the server's counters, or an empty record when nothing was recorded for it
     */
    public RequestStatistics getServerStatistics(String serverId) {
        ServerEntry entry = servers.get(serverId);
        return entry == null ? new RequestStatistics() : entry.stats;
    }

    public RequestStatistics getToolStatistics(String serverId, String toolName) {
        ServerEntry entry = servers.get(serverId);
        return entry == null ? null : entry.tools.get(toolName);
    }

    public JsonObject getServerMetrics(String serverId) {
        ServerEntry entry = servers.get(serverId);
        return (entry == null ? new ServerEntry() : entry).toJson(serverId);
    }

    public boolean hasServer(String serverId) {
        return servers.containsKey(serverId);
    }

    public JsonObject getAllMetrics() {
        JsonObject all = new JsonObject();
        servers.forEach((id, entry) -> all.put(id, entry.toJson(id)));
        return all;
    }

    public void reset(String serverId) {
        ServerEntry entry = servers.get(serverId);
        if (entry != null) {
            entry.stats.reset();
            entry.tools.clear();
        }
        if (logLevel >= 2) vertx.eventBus().publish("log", "Metrics reset for " + serverId + ",2,MCPMetricsRegistry,Reset,Metrics");
    }

    public void resetAll() {
        servers.keySet().forEach(this::reset);
    }

    public void remove(String serverId) {
        servers.remove(serverId);
    }
}
