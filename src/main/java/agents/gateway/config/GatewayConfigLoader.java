package agents.gateway.config;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import java.util.function.Function;

/**
 * Loads gateway configuration from file or environment.
 * Order: the file named by GATEWAY_CONFIG_PATH, else the {@code gateway-config.json}
 * classpath resource, else built-in defaults. Environment overrides are applied last.
 */
public class GatewayConfigLoader {

    public static final String CONFIG_ENV_VAR = "GATEWAY_CONFIG_PATH";
    public static final String DEFAULT_CONFIG_RESOURCE = "gateway-config.json";

    private final Vertx vertx;
    private final Function<String, String> env;
    private GatewayConfig cachedConfig;

    public GatewayConfigLoader(Vertx vertx) {
        this(vertx, CredentialResolver::getConfigValue);
    }

    public GatewayConfigLoader(Vertx vertx, Function<String, String> env) {
        this.vertx = vertx;
        this.env = env;
    }

    /**
     * Load configuration; a missing or unreadable file falls back to defaults, never fails.
     */
    public Future<GatewayConfig> loadConfig() {
        if (cachedConfig != null) {
            return Future.succeededFuture(cachedConfig);
        }

        Promise<GatewayConfig> promise = Promise.promise();

        String configPath = env.apply(CONFIG_ENV_VAR);
        if (configPath == null) {
            configPath = DEFAULT_CONFIG_RESOURCE;
        }
        final String finalConfigPath = configPath;

        // Relative paths fall back to the classpath through the Vert.x file resolver
        vertx.fileSystem().exists(finalConfigPath).onComplete(exists -> {
            if (exists.failed() || !exists.result()) {
                vertx.eventBus().publish("log", "Gateway config not found at " + finalConfigPath + " - using defaults,1,GatewayConfigLoader,Config,System");
                cachedConfig = mergeWithEnvironment(GatewayConfig.defaults().toJson());
                promise.complete(cachedConfig);
                return;
            }

            vertx.fileSystem().readFile(finalConfigPath, ar -> {
                if (ar.succeeded()) {
                    try {
                        JsonObject json = new JsonObject(ar.result());
                        cachedConfig = mergeWithEnvironment(json);
                        vertx.eventBus().publish("log", "Loaded gateway configuration from " + finalConfigPath + ",1,GatewayConfigLoader,Config,System");
                    } catch (DecodeException e) {
                        vertx.eventBus().publish("log", "Failed to parse gateway config " + finalConfigPath + ": " + e.getMessage() + ",0,GatewayConfigLoader,Config,System");
                        cachedConfig = mergeWithEnvironment(GatewayConfig.defaults().toJson());
                    }
                } else {
                    vertx.eventBus().publish("log", "Failed to read gateway config: " + ar.cause().getMessage() + ",0,GatewayConfigLoader,Config,System");
                    cachedConfig = mergeWithEnvironment(GatewayConfig.defaults().toJson());
                }
                promise.complete(cachedConfig);
            });
        });

        return promise.future();
    }

    /**
     * Apply environment variable overrides on top of the parsed document.
     */
    GatewayConfig mergeWithEnvironment(JsonObject json) {
        GatewayConfig config = GatewayConfig.fromJson(json);

        String port = env.apply("GATEWAY_HTTP_PORT");
        if (port != null) {
            try {
                config.setHttpPort(Integer.parseInt(port));
            } catch (NumberFormatException e) {
                vertx.eventBus().publish("log", "Ignoring invalid GATEWAY_HTTP_PORT: " + port + ",0,GatewayConfigLoader,Config,System");
            }
        }

        String transportMode = env.apply("GATEWAY_TRANSPORT_MODE");
        if (transportMode != null) {
            config.setTransportMode(transportMode.toLowerCase());
        }

        String logLevel = env.apply("GATEWAY_LOG_LEVEL");
        if (logLevel != null) {
            try {
                config.setLogLevel(Integer.parseInt(logLevel));
            } catch (NumberFormatException e) {
                vertx.eventBus().publish("log", "Ignoring invalid GATEWAY_LOG_LEVEL: " + logLevel + ",0,GatewayConfigLoader,Config,System");
            }
        }

        String logDir = env.apply("GATEWAY_LOG_DIR");
        if (logDir != null) {
            config.setLogDirectory(logDir);
        }

        return config;
    }
}
