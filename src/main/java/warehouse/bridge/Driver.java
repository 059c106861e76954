package warehouse.bridge;

import io.github.cdimascio.dotenv.Dotenv;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConfigurationException;
import warehouse.bridge.config.ConnectionSettings;
import warehouse.bridge.config.ServiceConfiguration;
import warehouse.bridge.dispatch.ToolDispatcher;
import warehouse.bridge.mcp.servers.WarehouseToolServer;
import warehouse.bridge.policy.StatementClassifier;
import warehouse.bridge.services.CortexAPIService;
import warehouse.bridge.services.Logger;
import warehouse.bridge.services.MCPRouterService;
import warehouse.bridge.session.AuthenticationMode;
import warehouse.bridge.session.KeyPairCredentials;
import warehouse.bridge.session.SessionManager;
import warehouse.bridge.session.SnowflakeBackend;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class Driver {
  public static int logLevel = 2; // 0=errors, 1=info, 2=detail, 3=debug, 4=data
  public static Vertx vertx;

  private static final String LOGS_PATH = "./logs";
  private static final long EVICTION_INTERVAL_MS = 60_000;

  // Emergency log buffer - captures logs before Logger is ready
  private static final int EMERGENCY_BUFFER_SIZE = 500;
  private static final List<String> emergencyLogBuffer = Collections.synchronizedList(new LinkedList<>());
  private static volatile boolean loggerReady = false;

  private SessionManager sessionManager;
  private CortexAPIService cortex;

  /**
   * Captures log messages to the emergency buffer, or publishes them once the logger is ready.
   * Keeps the last EMERGENCY_BUFFER_SIZE entries.
   */
  public static void captureOrPublishLog(String message) {
    if (!loggerReady || vertx == null) {
      synchronized (emergencyLogBuffer) {
        if (emergencyLogBuffer.size() >= EMERGENCY_BUFFER_SIZE) {
          emergencyLogBuffer.remove(0);
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
    captureOrPublishLog("=== Warehouse bridge starting ===,1,Driver,System,System");
    captureOrPublishLog("Java version: " + System.getProperty("java.version") + ",2,Driver,System,System");
    captureOrPublishLog("Working directory: " + System.getProperty("user.dir") + ",2,Driver,System,System");

    vertx = Vertx.vertx(new VertxOptions()
        .setWorkerPoolSize(16)
        .setEventLoopPoolSize(2));

    // Deploy Logger FIRST before anything else
    vertx.deployVerticle(new Logger(LOGS_PATH), res -> {
      if (res.succeeded()) {
        loggerReady = true;
        flushEmergencyBuffer();
        captureOrPublishLog("Logger ready - emergency buffer flushed,2,Logger,System,System");
        loadEnvironmentAndStart(args);
      } else {
        System.err.println("FATAL: Logger deployment failed: " + res.cause().getMessage());
        System.exit(1);
      }
    });
  }

  private static void loadEnvironmentAndStart(String[] args) {
    try {
      Dotenv.configure()
          .filename(".env.local")
          .systemProperties()  // accessible via System.getProperty()
          .ignoreIfMissing()
          .load();
      captureOrPublishLog("Loaded environment configuration from .env.local,3,Driver,StartUp,Configuration");
    } catch (Exception e) {
      // Not fatal, the process environment may carry everything
      captureOrPublishLog("Could not load .env.local file: " + e.getMessage() + ",0,Driver,StartUp,Configuration");
    }

    Driver me = new Driver();
    try {
      me.doIt(args);
    } catch (ConfigurationException e) {
      captureOrPublishLog("Configuration error: " + e.getMessage() + ",0,Driver,StartUp,Configuration");
      System.err.println("Configuration error: " + e.getMessage());
      shutdownAndExit(1);
    }
  }

  private void doIt(String[] args) {
    ConnectionSettings settings = ConnectionSettings.fromEnvironment();
    String configFile = args.length > 0 ? args[0] : getRequiredEnv(ServiceConfiguration.SERVICE_CONFIG_FILE);
    ServiceConfiguration configuration = ServiceConfiguration.load(Paths.get(configFile));

    if (logLevel >= 1) captureOrPublishLog("Loaded " + configuration.getCatalog().size() + " services from "
        + configFile + "; permitted statement types: " + configuration.getPolicy().toJson().encode()
        .replace(",", ";") + ",1,Driver,StartUp,Configuration");

    KeyPairCredentials keyPair = settings.getAuthenticationMode() == AuthenticationMode.KEY_PAIR
        ? KeyPairCredentials.load(settings.getPrivateKeyFile(), settings.getPrivateKeyPassphrase())
        : null;

    sessionManager = new SessionManager(vertx, new SnowflakeBackend(vertx, settings, keyPair), settings);
    cortex = CortexAPIService.create(vertx, settings, keyPair);
    ToolDispatcher dispatcher = new ToolDispatcher(vertx, configuration.getCatalog(), configuration.getPolicy(),
        new StatementClassifier(), sessionManager, cortex);

    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "warehouse-bridge-shutdown"));

    vertx.executeBlocking(() -> {
      sessionManager.initialize();
      return null;
    }, false)
        .compose(v -> deployMCPRouter())
        .compose(v -> vertx.deployVerticle(new WarehouseToolServer(dispatcher, this::connectionInfo)))
        .onSuccess(id -> {
          vertx.setPeriodic(EVICTION_INTERVAL_MS, timer -> vertx.executeBlocking(sessionManager::evictIdle, false));
          captureOrPublishLog("=== Warehouse bridge started ===,1,Driver,System,System");
        })
        .onFailure(err -> {
          captureOrPublishLog("Startup failed: " + err.getMessage() + ",0,Driver,StartUp,System");
          System.err.println("Fatal error - startup failed: " + err.getMessage());
          shutdownAndExit(1);
        });
  }

  private Future<Void> deployMCPRouter() {
    int port = MCPRouterService.DEFAULT_PORT;
    String configured = getEnv(MCPRouterService.HTTP_PORT);
    if (configured != null) {
      try {
        port = Integer.parseInt(configured.trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid " + MCPRouterService.HTTP_PORT + " value: '" + configured + "'");
      }
    }
    if (logLevel >= 1) captureOrPublishLog("Deploying MCP Router Service on port " + port + ",1,Driver,StartUp,MCP");
    return vertx.deployVerticle(new MCPRouterService(port, this::health)).mapEmpty();
  }

  private JsonObject connectionInfo() {
    return sessionManager.getSettings().toRedactedJson()
        .put("pool", sessionManager.statistics());
  }

  private JsonObject health() {
    return new JsonObject().put("pool", sessionManager.statistics());
  }

  private void shutdown() {
    if (sessionManager != null) {
      sessionManager.close();
    }
    if (cortex != null) {
      cortex.close();
    }
    if (vertx != null) {
      // let the Logger write out what is buffered
      vertx.eventBus().request(Logger.FLUSH_ADDRESS, "shutdown")
          .toCompletionStage().toCompletableFuture()
          .orTimeout(2, TimeUnit.SECONDS)
          .exceptionally(e -> null)
          .join();
    }
  }

  private static void shutdownAndExit(int status) {
    if (vertx != null) {
      vertx.eventBus().request(Logger.FLUSH_ADDRESS, "exit")
          .onComplete(ar -> System.exit(status));
    } else {
      System.exit(status);
    }
  }

  static String getEnv(String key) {
    String value = System.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      value = System.getenv(key);
    }
    return value == null || value.trim().isEmpty() ? null : value;
  }

  static String getRequiredEnv(String key) {
    String value = getEnv(key);
    if (value == null) {
      throw new ConfigurationException("Required environment variable " + key + " is not set");
    }
    return value;
  }
}
