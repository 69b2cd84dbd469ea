package agents.gateway.mcp.metrics;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(VertxExtension.class)
public class MCPMetricsRegistryTest {

    @Test
    @DisplayName("Average latency and success rate are rounded over all requests")
    void averagesAreRounded(Vertx vertx) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 100);
        for (int i = 0; i < 3; i++) {
            metrics.recordRequest("r1", "echo");
        }
        metrics.recordOutcome("r1", "echo", true, 10);
        metrics.recordOutcome("r1", "echo", true, 10);
        metrics.recordOutcome("r1", "echo", false, 11);

        RequestStatistics server = metrics.getServerStatistics("r1");
        Assertions.assertEquals(3, server.getTotalRequests());
        Assertions.assertEquals(2, server.getSuccessfulRequests());
        Assertions.assertEquals(1, server.getFailedRequests());
        Assertions.assertEquals(10, server.getAverageLatency());
        Assertions.assertEquals(67, server.getSuccessRate());

        RequestStatistics tool = metrics.getToolStatistics("r1", "echo");
        Assertions.assertEquals(3, tool.getTotalRequests());
        Assertions.assertEquals(31, tool.getTotalLatency());
    }

    @Test
    @DisplayName("Requests without a tool count for the server only; rejections are separate")
    void nonToolRequestsAndRejections(Vertx vertx) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 100);
        metrics.recordRequest("r1", null);
        metrics.recordOutcome("r1", null, true, 5);
        metrics.recordRejected("r1", "echo");

        JsonObject json = metrics.getServerMetrics("r1");
        Assertions.assertEquals(1L, json.getLong("totalRequests"));
        Assertions.assertEquals(1L, json.getLong("rejectedRequests"));
        Assertions.assertEquals(100L, json.getLong("successRate"));
        Assertions.assertEquals(1L, json.getJsonObject("tools").getJsonObject("echo").getLong("rejectedRequests"));
        Assertions.assertEquals(0L, json.getJsonObject("tools").getJsonObject("echo").getLong("totalRequests"));
    }

    @Test
    @DisplayName("An empty record reports zeros")
    void emptyRecordReportsZeros(Vertx vertx) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 100);

        RequestStatistics stats = metrics.getServerStatistics("r1");

        Assertions.assertEquals(0, stats.getAverageLatency());
        Assertions.assertEquals(0, stats.getSuccessRate());
        Assertions.assertNull(metrics.getToolStatistics("r1", "echo"));
    }

    @Test
    @DisplayName("Reset clears one server, or every server")
    void resetClears(Vertx vertx) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 100);
        metrics.recordRequest("r1", "echo");
        metrics.recordRequest("r2", null);

        metrics.reset("r1");
        Assertions.assertEquals(0, metrics.getServerStatistics("r1").getTotalRequests());
        Assertions.assertNull(metrics.getToolStatistics("r1", "echo"));
        Assertions.assertEquals(1, metrics.getServerStatistics("r2").getTotalRequests());

        metrics.resetAll();
        Assertions.assertEquals(0, metrics.getServerStatistics("r2").getTotalRequests());
    }

    @Test
    @DisplayName("Reading an unknown server or a late outcome after removal creates no record")
    void readsAndLateOutcomesCreateNothing(Vertx vertx) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 100);

        JsonObject ghost = metrics.getServerMetrics("ghost");
        Assertions.assertEquals(0L, ghost.getLong("totalRequests"));
        Assertions.assertEquals(0, metrics.getServerStatistics("ghost").getTotalRequests());
        Assertions.assertFalse(metrics.hasServer("ghost"));

        metrics.recordRequest("r1", "echo");
        metrics.remove("r1");
        metrics.recordOutcome("r1", "echo", true, 5);

        Assertions.assertFalse(metrics.hasServer("r1"));
        Assertions.assertTrue(metrics.getAllMetrics().isEmpty());
    }

    @Test
    @DisplayName("An update event is published every reporting interval")
    void publishesEveryInterval(Vertx vertx, VertxTestContext testContext) {
        MCPMetricsRegistry metrics = new MCPMetricsRegistry(vertx, 2);

        vertx.eventBus().<JsonObject>consumer(MCPMetricsRegistry.UPDATED_ADDRESS, msg -> testContext.verify(() -> {
            Assertions.assertEquals("r1", msg.body().getString("serverId"));
            Assertions.assertEquals(2L, msg.body().getJsonObject("metrics").getLong("successfulRequests"));
            testContext.completeNow();
        }));

        metrics.recordRequest("r1", null);
        metrics.recordOutcome("r1", null, true, 1);
        metrics.recordRequest("r1", null);
        metrics.recordOutcome("r1", null, true, 1);
    }
}
