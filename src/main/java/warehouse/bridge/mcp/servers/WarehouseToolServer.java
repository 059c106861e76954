package warehouse.bridge.mcp.servers;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import warehouse.bridge.dispatch.ToolDispatcher;
import warehouse.bridge.dispatch.ToolInvocationRequest;
import warehouse.bridge.mcp.base.MCPRequest;
import warehouse.bridge.mcp.base.MCPResponse;
import warehouse.bridge.mcp.base.MCPServerBase;
import warehouse.bridge.mcp.base.MCPTool;
import warehouse.bridge.services.LogUtil;

import java.util.function.Supplier;

/**
 * MCP server exposing every catalog tool at <code>/mcp/servers/warehouse</code>.
 * Tool failures are answered as results with <code>isError</code> set; only an unknown tool
 * is a JSON-RPC error.
 */
public class WarehouseToolServer extends MCPServerBase {

    public static final String SERVER_PATH = "/mcp/servers/warehouse";

    static final String CONNECTION_INFO_URI = "warehouse://connection-info";
    static final String QUERY_EXAMPLES_URI = "warehouse://query-examples";

    private final ToolDispatcher dispatcher;
    private final Supplier<JsonObject> connectionInfo;

    /**
     * @param connectionInfo connection details without secrets, served as a resource
     */
    public WarehouseToolServer(ToolDispatcher dispatcher, Supplier<JsonObject> connectionInfo) {
        super("WarehouseToolServer", SERVER_PATH);
        this.dispatcher = dispatcher;
        this.connectionInfo = connectionInfo;
    }

    @Override
    protected void initializeTools() {
        for (MCPTool tool : dispatcher.tools()) {
            registerTool(tool);
        }
        LogUtil.logInfo(vertx, "Registered " + tools.size() + " warehouse tools", serverName, "StartUp", "MCP");
    }

    @Override
    protected void executeTool(RoutingContext ctx, MCPRequest request, String toolName, JsonObject arguments) {
        ToolInvocationRequest invocation = new ToolInvocationRequest(request.getIdAsString(), toolName, arguments);
        dispatcher.invoke(invocation).onComplete(ar -> {
            if (ar.failed()) {
                LogUtil.logError(vertx, "Dispatcher failed for " + toolName, ar.cause(), serverName, "ToolCall", "MCP");
                sendError(ctx, request.getId(), MCPResponse.ErrorCodes.INTERNAL_ERROR, "Internal server error");
                return;
            }
            sendSuccess(ctx, request.getId(), ar.result().toMcpResult());
        });
    }

    @Override
    protected void cancelRequest(String requestId) {
        if (!dispatcher.cancel(requestId)) {
            LogUtil.logDebug(vertx, "Nothing running for " + requestId, serverName, "Cancel", "MCP");
        }
    }

    @Override
    protected JsonArray listResources() {
        return new JsonArray()
            .add(new JsonObject()
                .put("uri", CONNECTION_INFO_URI)
                .put("name", "Connection information")
                .put("description", "Warehouse connection parameters, without secrets")
                .put("mimeType", "application/json"))
            .add(new JsonObject()
                .put("uri", QUERY_EXAMPLES_URI)
                .put("name", "Query examples")
                .put("description", "Example statements for common warehouse operations")
                .put("mimeType", "application/json"));
    }

    @Override
    protected Future<JsonObject> readResource(String uri) {
        switch (uri) {
            case CONNECTION_INFO_URI:
                return Future.succeededFuture(connectionInfo.get());
            case QUERY_EXAMPLES_URI:
                return Future.succeededFuture(queryExamples());
            default:
                return super.readResource(uri);
        }
    }

    static JsonObject queryExamples() {
        return new JsonObject().put("examples", new JsonArray()
            .add(example("Show warehouses", "SHOW WAREHOUSES"))
            .add(example("Current database and schema", "SELECT CURRENT_DATABASE(), CURRENT_SCHEMA()"))
            .add(example("List tables in the current schema", "SHOW TABLES"))
            .add(example("Sample rows", "SELECT * FROM table_name LIMIT 10"))
            .add(example("Table DDL", "SELECT GET_DDL('TABLE', 'database.schema.table_name')"))
            .add(example("Grants of the current role", "SHOW GRANTS")));
    }

    private static JsonObject example(String description, String statement) {
        return new JsonObject().put("description", description).put("statement", statement);
    }
}
