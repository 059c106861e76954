package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonObject;

import java.util.UUID;

/**
 * A named tool call with its arguments. The request id is the handle used for cancellation.
 */
public final class ToolInvocationRequest {

    private final String requestId;
    private final String toolName;
    private final JsonObject arguments;

    public ToolInvocationRequest(String requestId, String toolName, JsonObject arguments) {
        this.requestId = requestId != null ? requestId : UUID.randomUUID().toString();
        this.toolName = toolName;
        this.arguments = arguments != null ? arguments : new JsonObject();
    }

    public static ToolInvocationRequest of(String toolName, JsonObject arguments) {
        return new ToolInvocationRequest(null, toolName, arguments);
    }

    public String getRequestId() {
        return requestId;
    }

    public String getToolName() {
        return toolName;
    }

    public JsonObject getArguments() {
        return arguments;
    }

    /**
     * Raw SQL of a query-manager call, if any.
     */
    public String getStatement() {
        Object statement = arguments.getValue("statement");
        return statement instanceof String ? (String) statement : null;
    }

    @Override
    public String toString() {
        return "ToolInvocationRequest{id='" + requestId + "', tool='" + toolName + "'}";
    }
}
