package agents.gateway.config;

import agents.gateway.mcp.resilience.CircuitBreakerOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Typed view over the gateway configuration document.
 * Every timeout and interval the gateway uses is a knob here; missing keys fall back to the defaults below.
 */
public class GatewayConfig {

    public static final String TRANSPORT_WEBSOCKET = "websocket";
    public static final String TRANSPORT_SIMULATED = "simulated";
    public static final String HTTP_UPSTREAM_CONNECTION = "connection";
    public static final String HTTP_UPSTREAM_HTTP = "http";

    private int httpPort = 8080;
    private long httpBodyLimit = 1024 * 1024;  // 1MB

    private String transportMode = TRANSPORT_WEBSOCKET;
    private String upstreamPath = "/mcp";
    private int maxMessageSize = 64 * 1024 * 16;

    private long connectTimeoutMs = 10_000;
    private long requestTimeoutMs = 60_000;
    private long pingTimeoutMs = 5_000;
    private long discoveryTimeoutMs = 10_000;
    private long httpUpstreamTimeoutMs = 30_000;

    private long healthCheckIntervalMs = 30_000;
    private long reconnectBaseDelayMs = 5_000;
    private long reconnectMaxDelayMs = 60_000;
    private int maxPendingPerConnection = 256;

    private CircuitBreakerOptions breakerOptions = new CircuitBreakerOptions();
    private boolean countApplicationErrors = true;

    private int metricsReportEvery = 10;
    private long statusIntervalMs = 60_000;
    private String httpUpstreamMode = HTTP_UPSTREAM_CONNECTION;

    private String logDirectory = "./data/gateway/logs";
    private long logFlushIntervalMs = 20_000;
    private long logRotateIntervalMs = 86_400_000L;
    private int logMaxHistoricFiles = 12;
    private int logLevel = 3;

    private JsonArray servers = new JsonArray();

    public static GatewayConfig defaults() {
        return new GatewayConfig();
    }

    public static GatewayConfig fromJson(JsonObject json) {
        GatewayConfig config = new GatewayConfig();
        if (json == null) {
            return config;
        }

        JsonObject http = json.getJsonObject("http", new JsonObject());
        config.httpPort = http.getInteger("port", config.httpPort);
        config.httpBodyLimit = http.getLong("bodyLimit", config.httpBodyLimit);
        config.httpUpstreamMode = http.getString("upstream", config.httpUpstreamMode);

        JsonObject transport = json.getJsonObject("transport", new JsonObject());
        config.transportMode = transport.getString("mode", config.transportMode);
        config.upstreamPath = transport.getString("path", config.upstreamPath);
        config.maxMessageSize = transport.getInteger("maxMessageSize", config.maxMessageSize);
        config.connectTimeoutMs = transport.getLong("connectTimeoutMs", config.connectTimeoutMs);
        config.httpUpstreamTimeoutMs = transport.getLong("httpTimeoutMs", config.httpUpstreamTimeoutMs);

        JsonObject requests = json.getJsonObject("requests", new JsonObject());
        config.requestTimeoutMs = requests.getLong("timeoutMs", config.requestTimeoutMs);
        config.pingTimeoutMs = requests.getLong("pingTimeoutMs", config.pingTimeoutMs);
        config.discoveryTimeoutMs = requests.getLong("discoveryTimeoutMs", config.discoveryTimeoutMs);
        config.maxPendingPerConnection = requests.getInteger("maxPendingPerConnection", config.maxPendingPerConnection);

        JsonObject connections = json.getJsonObject("connections", new JsonObject());
        config.healthCheckIntervalMs = connections.getLong("healthCheckIntervalMs", config.healthCheckIntervalMs);
        config.reconnectBaseDelayMs = connections.getLong("reconnectBaseDelayMs", config.reconnectBaseDelayMs);
        config.reconnectMaxDelayMs = connections.getLong("reconnectMaxDelayMs", config.reconnectMaxDelayMs);

        JsonObject breaker = json.getJsonObject("circuitBreaker", new JsonObject());
        config.breakerOptions = new CircuitBreakerOptions()
            .setFailureThreshold(breaker.getInteger("failureThreshold", 5))
            .setResetTimeoutMs(breaker.getLong("resetTimeoutMs", 30_000L))
            .setHalfOpenSuccessThreshold(breaker.getInteger("halfOpenSuccessThreshold", 2))
            .setCallTimeoutMs(breaker.getLong("callTimeoutMs", 10_000L));
        config.countApplicationErrors = breaker.getBoolean("countApplicationErrors", config.countApplicationErrors);

        JsonObject status = json.getJsonObject("status", new JsonObject());
        config.metricsReportEvery = status.getInteger("metricsReportEvery", config.metricsReportEvery);
        config.statusIntervalMs = status.getLong("intervalMs", config.statusIntervalMs);

        JsonObject logging = json.getJsonObject("logging", new JsonObject());
        config.logDirectory = logging.getString("directory", config.logDirectory);
        config.logFlushIntervalMs = logging.getLong("flushIntervalMs", config.logFlushIntervalMs);
        config.logRotateIntervalMs = logging.getLong("rotateIntervalMs", config.logRotateIntervalMs);
        config.logMaxHistoricFiles = logging.getInteger("maxHistoricFiles", config.logMaxHistoricFiles);
        config.logLevel = logging.getInteger("level", config.logLevel);

        config.servers = json.getJsonArray("servers", new JsonArray());
        return config;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("http", new JsonObject()
                .put("port", httpPort)
                .put("bodyLimit", httpBodyLimit)
                .put("upstream", httpUpstreamMode))
            .put("transport", new JsonObject()
                .put("mode", transportMode)
                .put("path", upstreamPath)
                .put("maxMessageSize", maxMessageSize)
                .put("connectTimeoutMs", connectTimeoutMs)
                .put("httpTimeoutMs", httpUpstreamTimeoutMs))
            .put("requests", new JsonObject()
                .put("timeoutMs", requestTimeoutMs)
                .put("pingTimeoutMs", pingTimeoutMs)
                .put("discoveryTimeoutMs", discoveryTimeoutMs)
                .put("maxPendingPerConnection", maxPendingPerConnection))
            .put("connections", new JsonObject()
                .put("healthCheckIntervalMs", healthCheckIntervalMs)
                .put("reconnectBaseDelayMs", reconnectBaseDelayMs)
                .put("reconnectMaxDelayMs", reconnectMaxDelayMs))
            .put("circuitBreaker", breakerOptions.toJson()
                .put("countApplicationErrors", countApplicationErrors))
            .put("status", new JsonObject()
                .put("metricsReportEvery", metricsReportEvery)
                .put("intervalMs", statusIntervalMs))
            .put("logging", new JsonObject()
                .put("directory", logDirectory)
                .put("flushIntervalMs", logFlushIntervalMs)
                .put("rotateIntervalMs", logRotateIntervalMs)
                .put("maxHistoricFiles", logMaxHistoricFiles)
                .put("level", logLevel))
            .put("servers", servers.copy());
    }

    public int getHttpPort() {
        return httpPort;
    }

    public GatewayConfig setHttpPort(int httpPort) {
        this.httpPort = httpPort;
        return this;
    }

    public long getHttpBodyLimit() {
        return httpBodyLimit;
    }

    public String getTransportMode() {
        return transportMode;
    }

    public GatewayConfig setTransportMode(String transportMode) {
        this.transportMode = transportMode;
        return this;
    }

    public String getUpstreamPath() {
        return upstreamPath;
    }

    public int getMaxMessageSize() {
        return maxMessageSize;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public GatewayConfig setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        return this;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public GatewayConfig setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
        return this;
    }

    public long getPingTimeoutMs() {
        return pingTimeoutMs;
    }

    public GatewayConfig setPingTimeoutMs(long pingTimeoutMs) {
        this.pingTimeoutMs = pingTimeoutMs;
        return this;
    }

    public long getDiscoveryTimeoutMs() {
        return discoveryTimeoutMs;
    }

    public GatewayConfig setDiscoveryTimeoutMs(long discoveryTimeoutMs) {
        this.discoveryTimeoutMs = discoveryTimeoutMs;
        return this;
    }

    public long getHttpUpstreamTimeoutMs() {
        return httpUpstreamTimeoutMs;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public GatewayConfig setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
        return this;
    }

    public long getReconnectBaseDelayMs() {
        return reconnectBaseDelayMs;
    }

    public GatewayConfig setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
        this.reconnectBaseDelayMs = reconnectBaseDelayMs;
        return this;
    }

    public long getReconnectMaxDelayMs() {
        return reconnectMaxDelayMs;
    }

    public GatewayConfig setReconnectMaxDelayMs(long reconnectMaxDelayMs) {
        this.reconnectMaxDelayMs = reconnectMaxDelayMs;
        return this;
    }

    public int getMaxPendingPerConnection() {
        return maxPendingPerConnection;
    }

    public GatewayConfig setMaxPendingPerConnection(int maxPendingPerConnection) {
        this.maxPendingPerConnection = maxPendingPerConnection;
        return this;
    }

    public CircuitBreakerOptions getBreakerOptions() {
        return breakerOptions;
    }

    public GatewayConfig setBreakerOptions(CircuitBreakerOptions breakerOptions) {
        this.breakerOptions = breakerOptions;
        return this;
    }

    public boolean isCountApplicationErrors() {
        return countApplicationErrors;
    }

    public GatewayConfig setCountApplicationErrors(boolean countApplicationErrors) {
        this.countApplicationErrors = countApplicationErrors;
        return this;
    }

    public int getMetricsReportEvery() {
        return metricsReportEvery;
    }

    public GatewayConfig setMetricsReportEvery(int metricsReportEvery) {
        this.metricsReportEvery = metricsReportEvery;
        return this;
    }

    public long getStatusIntervalMs() {
        return statusIntervalMs;
    }

    public GatewayConfig setStatusIntervalMs(long statusIntervalMs) {
        this.statusIntervalMs = statusIntervalMs;
        return this;
    }

    public String getHttpUpstreamMode() {
        return httpUpstreamMode;
    }

    public GatewayConfig setHttpUpstreamMode(String httpUpstreamMode) {
        this.httpUpstreamMode = httpUpstreamMode;
        return this;
    }

    public String getLogDirectory() {
        return logDirectory;
    }

    public GatewayConfig setLogDirectory(String logDirectory) {
        this.logDirectory = logDirectory;
        return this;
    }

    public long getLogFlushIntervalMs() {
        return logFlushIntervalMs;
    }

    public long getLogRotateIntervalMs() {
        return logRotateIntervalMs;
    }

    public int getLogMaxHistoricFiles() {
        return logMaxHistoricFiles;
    }

    public int getLogLevel() {
        return logLevel;
    }

    public GatewayConfig setLogLevel(int logLevel) {
        this.logLevel = logLevel;
        return this;
    }

    public JsonArray getServers() {
        return servers;
    }

    public GatewayConfig setServers(JsonArray servers) {
        this.servers = servers;
        return this;
    }
}
