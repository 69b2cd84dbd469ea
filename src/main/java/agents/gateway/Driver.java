package agents.gateway;

import agents.gateway.config.GatewayConfig;
import agents.gateway.config.GatewayConfigLoader;
import agents.gateway.directory.EventBusAuditSink;
import agents.gateway.directory.InMemoryServerDirectory;
import agents.gateway.directory.InMemoryToolCatalog;
import agents.gateway.services.Logger;
import agents.gateway.services.MCPProxyGateway;
import agents.gateway.services.MCPProxyGatewayVerticle;
import agents.gateway.services.MCPRouterService;
import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

public class Driver {
  public static int logLevel = 3; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx;

  // Track component readiness via events
  private boolean routerReady = false;
  private boolean gatewayReady = false;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private final GatewayConfig config;

  private Driver(GatewayConfig config) {
    this.config = config;
  }

  /**
   * Captures log messages to emergency buffer or publishes directly if logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0); // Remove oldest entry
        }
        emergencyLogBuffer.add(message);
      }
    } else {
      vertx.eventBus().publish("log", message);
    }
  }

  private static void flushEmergencyBuffer() {
    synchronized (emergencyLogBuffer) {
      for (String entry : emergencyLogBuffer) {
        vertx.eventBus().publish("log", entry);
      }
      emergencyLogBuffer.clear();
    }
  }

  public static void main(String[] args) {
    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(4)
        .setEventLoopPoolSize(2)
    );

    captureOrPublishLog("=== MCP Proxy Gateway Starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    // .env.local first so credential references and config overrides can see it
    loadEnvironment();

    new GatewayConfigLoader(vertx).loadConfig().onComplete(ar -> {
      GatewayConfig config = ar.succeeded() ? ar.result() : GatewayConfig.defaults();
      logLevel = config.getLogLevel();

      // Deploy Logger FIRST before anything else
      System.out.println("Deploying Logger as first component...");
      vertx.deployVerticle(new Logger(config), res -> {
        if (res.succeeded()) {
          loggerReady = true;
          flushEmergencyBuffer();
          captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
          new Driver(config).doIt();
        } else {
          System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
          System.err.println("Cannot continue without logging capability");
          System.exit(1);
        }
      });
    });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      if (loggerReady) {
        vertx.eventBus().publish(Logger.FLUSH_ADDRESS, "shutdown");
      }
    }));
  }

  private static void loadEnvironment() {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()  // accessible via System.getProperty()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Config");
    } catch (Exception e) {
      // Not fatal; the process environment still applies
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage() + ",1,Driver,StartUp,Config");
      System.err.println("Warning: Could not load .env.local file: " + e.getMessage());
    }
  }

  private void doIt() {
    if (logLevel >= 1) captureOrPublishLog("Driver initialization starting on port " + config.getHttpPort() + " with " + config.getTransportMode() + " transport,1,Driver,StartUp,System");

    setupReadinessListeners();

    InMemoryServerDirectory directory = new InMemoryServerDirectory(vertx).seed(config.getServers());

    MCPProxyGateway gateway = new MCPProxyGateway(vertx, config, directory, new InMemoryToolCatalog(), new EventBusAuditSink(vertx));

    // Gateway first so the HTTP routes find a running gateway
    vertx.deployVerticle(new MCPProxyGatewayVerticle(gateway), res -> {
      if (res.succeeded()) {
        if (logLevel >= 3) captureOrPublishLog("MCPProxyGatewayVerticle deployed,3,Driver,StartUp,Gateway");
        deployRouter(gateway);
      } else {
        captureOrPublishLog("MCPProxyGatewayVerticle deployment failed: " + res.cause().getMessage() + ",0,Driver,System,System");
        System.err.println("Fatal error - cannot continue without the gateway");
      }
    });
  }

  private void deployRouter(MCPProxyGateway gateway) {
    vertx.deployVerticle(new MCPRouterService(gateway, config), res -> {
      if (res.succeeded()) {
        if (logLevel >= 3) captureOrPublishLog("MCPRouterService deployed,3,Driver,StartUp,HTTP");
      } else {
        captureOrPublishLog("MCPRouterService deployment failed: " + res.cause().getMessage() + ",0,Driver,System,System");
        System.err.println("Fatal error - cannot continue without router");
      }
    });
  }

  private void setupReadinessListeners() {
    vertx.eventBus().consumer(MCPRouterService.READY_ADDRESS, msg -> {
      routerReady = true;
      if (logLevel >= 1) captureOrPublishLog("HTTP router ready on port " + ((JsonObject) msg.body()).getInteger("port") + ",1,Driver,StartUp,HTTP");
      checkSystemReady();
    });

    vertx.eventBus().consumer(MCPProxyGatewayVerticle.READY_ADDRESS, msg -> {
      gatewayReady = true;
      if (logLevel >= 1) captureOrPublishLog("Gateway ready,1,Driver,StartUp,Gateway");
      checkSystemReady();
    });
  }

  private void checkSystemReady() {
    if (routerReady && gatewayReady) {
      System.out.println("MCP Proxy Gateway fully ready on port " + config.getHttpPort());
      if (logLevel >= 1) captureOrPublishLog("All components ready,1,Driver,StartUp,System");
      vertx.eventBus().publish("system.fully.ready", new JsonObject()
          .put("port", config.getHttpPort())
          .put("timestamp", System.currentTimeMillis()));
    }
  }
}
