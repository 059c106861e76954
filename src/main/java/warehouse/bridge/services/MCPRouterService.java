package warehouse.bridge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.CorsHandler;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * HTTP front door. Owns the server and mounts the sub-routers MCP servers register.
 * Routers registered before this verticle starts are mounted once it does.
 */
public class MCPRouterService extends AbstractVerticle {

    public static final String HTTP_PORT = "MCP_HTTP_PORT";
    public static final int DEFAULT_PORT = 8080;
    public static final String READY_ADDRESS = "mcp.router.ready";

    private static final Map<String, Router> pendingRouters = new ConcurrentHashMap<>();
    private static volatile MCPRouterService instance;

    private final int port;
    private final Supplier<JsonObject> healthDetails;
    private Router mainRouter;
    private HttpServer httpServer;

    /**
     * @param port listening port; 0 picks a free one
     * @param healthDetails extra fields for <code>/health</code>, may be null
     */
    public MCPRouterService(int port, Supplier<JsonObject> healthDetails) {
        this.port = port;
        this.healthDetails = healthDetails;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        mainRouter = Router.router(vertx);
        addGlobalHandlers();

        mainRouter.get("/health").handler(ctx -> {
            JsonObject health = new JsonObject()
                .put("status", "healthy")
                .put("timestamp", System.currentTimeMillis());
            if (healthDetails != null) {
                health.mergeIn(healthDetails.get());
            }
            ctx.response()
                .putHeader("content-type", "application/json")
                .end(health.encode());
        });

        instance = this;
        mountRegisteredRouters();

        HttpServerOptions options = new HttpServerOptions()
            .setPort(port)
            .setCompressionSupported(true)
            .setHandle100ContinueAutomatically(true);

        httpServer = vertx.createHttpServer(options);
        httpServer
            .requestHandler(mainRouter)
            .listen()
            .onComplete(result -> {
                if (result.succeeded()) {
                    LogUtil.logInfo(vertx, "MCPRouterService started on port " + result.result().actualPort(),
                        "MCPRouterService", "StartUp", "HTTP");
                    vertx.eventBus().publish(READY_ADDRESS, new JsonObject()
                        .put("port", result.result().actualPort())
                        .put("timestamp", System.currentTimeMillis()));
                    startPromise.complete();
                } else {
                    LogUtil.logError(vertx, "Failed to start MCPRouterService on port " + port, result.cause(),
                        "MCPRouterService", "StartUp", "HTTP");
                    startPromise.fail(result.cause());
                }
            });
    }

    private void addGlobalHandlers() {
        Set<String> allowedHeaders = new HashSet<>();
        allowedHeaders.add("content-type");
        allowedHeaders.add("authorization");

        Set<HttpMethod> allowedMethods = new HashSet<>();
        allowedMethods.add(HttpMethod.GET);
        allowedMethods.add(HttpMethod.POST);
        allowedMethods.add(HttpMethod.OPTIONS);

        mainRouter.route().handler(CorsHandler.create()
            .addOrigins(Arrays.asList("*"))
            .allowedHeaders(allowedHeaders)
            .allowedMethods(allowedMethods));

        mainRouter.route().handler(BodyHandler.create()
            .setBodyLimit(10 * 1024 * 1024)); // 10MB limit

        // Anything that escapes an MCP handler still answers in JSON-RPC shape
        mainRouter.route("/mcp/*").failureHandler(ctx -> {
            Throwable failure = ctx.failure();
            int statusCode = ctx.statusCode() == -1 ? 500 : ctx.statusCode();
            if (failure != null) {
                LogUtil.logError(vertx, "Unhandled failure on " + ctx.request().path(), failure,
                    "MCPRouterService", "Request", "HTTP");
            }
            JsonObject error = new JsonObject()
                .put("jsonrpc", "2.0")
                .putNull("id")
                .put("error", new JsonObject()
                    .put("code", -32603)
                    .put("message", failure != null ? failure.getMessage() : "HTTP " + statusCode));
            ctx.response()
                .setStatusCode(statusCode)
                .putHeader("content-type", "application/json")
                .end(error.encode());
        });
    }

    /**
     * Mount <code>subRouter</code> under <code>path</code>, now or once the service has started.
     */
    public static void registerRouter(String path, Router subRouter) {
        MCPRouterService current = instance;
        if (current != null && current.mainRouter != null) {
            current.mountRouter(path, subRouter);
        } else {
            pendingRouters.put(path, subRouter);
        }
    }

    private void mountRouter(String path, Router subRouter) {
        mainRouter.route(path + "/*").subRouter(subRouter);
        LogUtil.logDetail(vertx, "Mounted router at path: " + path, "MCPRouterService", "StartUp", "HTTP");
    }

    private void mountRegisteredRouters() {
        for (Map.Entry<String, Router> entry : pendingRouters.entrySet()) {
            mountRouter(entry.getKey(), entry.getValue());
        }
        pendingRouters.clear();
    }

    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (instance == this) {
            instance = null;
        }
        if (httpServer == null) {
            stopPromise.complete();
            return;
        }
        httpServer.close().onComplete(result -> {
            if (result.succeeded()) {
                LogUtil.logInfo(vertx, "MCPRouterService stopped", "MCPRouterService", "Shutdown", "HTTP");
                stopPromise.complete();
            } else {
                stopPromise.fail(result.cause());
            }
        });
    }
}
