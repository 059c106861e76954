package warehouse.bridge.mcp.base;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import warehouse.bridge.services.LogUtil;
import warehouse.bridge.services.MCPRouterService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for MCP servers.
 * Implements the JSON-RPC endpoints <code>tools/list</code>, <code>tools/call</code>,
 * <code>resources/list</code>, <code>resources/read</code> and <code>notifications/cancelled</code>
 * and mounts them on the shared {@link MCPRouterService}.
 */
public abstract class MCPServerBase extends AbstractVerticle {

    protected Router router;
    protected final Map<String, MCPTool> tools = new LinkedHashMap<>();
    protected final String serverName;
    protected final String serverPath;

    protected MCPServerBase(String serverName, String serverPath) {
        this.serverName = serverName;
        this.serverPath = serverPath;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        router = Router.router(vertx);

        router.post("/tools/list").handler(this::handleToolsList);
        router.post("/tools/call").handler(this::handleToolCall);
        router.post("/resources/list").handler(this::handleResourcesList);
        router.post("/resources/read").handler(this::handleResourceRead);
        router.post("/notifications/cancelled").handler(this::handleCancelled);

        try {
            initializeTools();
        } catch (RuntimeException e) {
            LogUtil.logError(vertx, serverName + " failed to initialize tools", e, serverName, "StartUp", "MCP");
            startPromise.fail(e);
            return;
        }

        MCPRouterService.registerRouter(serverPath, router);
        LogUtil.logDetail(vertx, serverName + " registered router at path: " + serverPath, serverName, "StartUp", "MCP");

        onServerReady();
        startPromise.complete();
    }

    /**
     * Register the tools this server exposes.
     */
    protected abstract void initializeTools();

    /**
     * Execute a registered tool and answer the request through {@link #sendSuccess} or {@link #sendError}.
     */
    protected abstract void executeTool(RoutingContext ctx, MCPRequest request, String toolName, JsonObject arguments);

    /**
     * Resources exposed through <code>resources/list</code>. None by default.
     */
    protected JsonArray listResources() {
        return new JsonArray();
    }

    /**
     * Contents of one resource, or a failed future if the URI is unknown.
     */
    protected Future<JsonObject> readResource(String uri) {
        return Future.failedFuture(new IllegalArgumentException("Unknown resource: " + uri));
    }

    /**
     * Abandon the in-flight call started by the request with the given id.
     */
    protected void cancelRequest(String requestId) {
        // no cancellable work by default
    }

    protected void onServerReady() {
        // Default: no additional action
    }

    protected void registerTool(MCPTool tool) {
        tools.put(tool.getName(), tool);
        LogUtil.logDebug(vertx, serverName + " registered tool: " + tool.getName(), serverName, "StartUp", "MCP");
    }

    private MCPRequest parseRequest(RoutingContext ctx) {
        JsonObject body;
        try {
            body = ctx.body().asJsonObject();
        } catch (DecodeException e) {
            sendError(ctx, null, MCPResponse.ErrorCodes.PARSE_ERROR, "Request body is not valid JSON");
            return null;
        }
        if (body == null) {
            sendError(ctx, null, MCPResponse.ErrorCodes.INVALID_REQUEST, "Missing request body");
            return null;
        }
        MCPRequest request = MCPRequest.fromJson(body);
        if (!request.isValid()) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_REQUEST, "Invalid request format");
            return null;
        }
        return request;
    }

    private void handleToolsList(RoutingContext ctx) {
        MCPRequest request = parseRequest(ctx);
        if (request == null) {
            return;
        }
        JsonArray toolsArray = new JsonArray();
        for (MCPTool tool : tools.values()) {
            toolsArray.add(tool.toJson());
        }
        sendSuccess(ctx, request.getId(), new JsonObject().put("tools", toolsArray));
    }

    private void handleToolCall(RoutingContext ctx) {
        MCPRequest request = parseRequest(ctx);
        if (request == null) {
            return;
        }
        try {
            JsonObject params = request.getParams();
            String toolName = params.getString("name");
            Object arguments = params.getValue("arguments");

            if (toolName == null) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing tool name");
                return;
            }
            if (arguments != null && !(arguments instanceof JsonObject)) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Tool arguments must be an object");
                return;
            }
            if (!tools.containsKey(toolName)) {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.METHOD_NOT_FOUND, "Tool not found: " + toolName);
                return;
            }

            executeTool(ctx, request, toolName, arguments == null ? new JsonObject() : (JsonObject) arguments);
        } catch (RuntimeException e) {
            LogUtil.logError(vertx, "Error handling tools/call", e, serverName, "ToolCall", "MCP");
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error: " + e.getMessage());
        }
    }

    private void handleResourcesList(RoutingContext ctx) {
        MCPRequest request = parseRequest(ctx);
        if (request == null) {
            return;
        }
        sendSuccess(ctx, request.getId(), new JsonObject().put("resources", listResources()));
    }

    private void handleResourceRead(RoutingContext ctx) {
        MCPRequest request = parseRequest(ctx);
        if (request == null) {
            return;
        }
        String uri = request.getParams().getString("uri");
        if (uri == null) {
            sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INVALID_PARAMS, "Missing resource uri");
            return;
        }
        readResource(uri).onComplete(ar -> {
            if (ar.succeeded()) {
                JsonObject contents = new JsonObject()
                    .put("uri", uri)
                    .put("mimeType", "application/json")
                    .put("text", ar.result().encodePrettily());
                sendSuccess(ctx, request.getId(), new JsonObject().put("contents", new JsonArray().add(contents)));
            } else {
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.RESOURCE_NOT_FOUND, ar.cause().getMessage());
            }
        });
    }

    // Notifications carry no id and get no JSON-RPC response body
    private void handleCancelled(RoutingContext ctx) {
        Object requestId = null;
        try {
            JsonObject body = ctx.body().asJsonObject();
            if (body != null) {
                requestId = body.getJsonObject("params", new JsonObject()).getValue("requestId");
            }
        } catch (DecodeException | ClassCastException e) {
            LogUtil.logDebug(vertx, "Ignoring malformed cancellation: " + e.getMessage(), serverName, "Cancel", "MCP");
        }
        if (requestId != null) {
            LogUtil.logDetail(vertx, "Cancellation requested for " + requestId, serverName, "Cancel", "MCP");
            cancelRequest(String.valueOf(requestId));
        }
        ctx.response().setStatusCode(202).end();
    }

    protected void sendSuccess(RoutingContext ctx, Object requestId, JsonObject result) {
        if (ctx.response().ended()) {
            return;
        }
        ctx.response()
            .putHeader("content-type", "application/json")
            .end(MCPResponse.success(requestId, result).toJson().encode());
    }

    protected void sendError(RoutingContext ctx, Object requestId, int code, String message) {
        sendError(ctx, requestId, code, message, null);
    }

    protected void sendError(RoutingContext ctx, Object requestId, int code, String message, JsonObject data) {
        if (ctx.response().ended()) {
            return;
        }
        ctx.response()
            .putHeader("content-type", "application/json")
            .setStatusCode(400)
            .end(MCPResponse.error(requestId, code, message, data).toJson().encode());
    }
}
