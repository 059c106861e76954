package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.policy.StatementCategory;

/**
 * Outcome of one invocation: a payload on success, an error descriptor
 * <code>{kind, message, category?}</code> on failure.
 */
public final class ToolInvocationResult {

    private final String requestId;
    private final String toolName;
    private final boolean success;
    private final JsonObject payload;
    private final ErrorKind errorKind;
    private final String errorMessage;
    private final StatementCategory category;
    private final long durationMillis;

    private ToolInvocationResult(String requestId, String toolName, boolean success, JsonObject payload,
                                 ErrorKind errorKind, String errorMessage, StatementCategory category,
                                 long durationMillis) {
        this.requestId = requestId;
        this.toolName = toolName;
        this.success = success;
        this.payload = payload;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.category = category;
        this.durationMillis = durationMillis;
    }

    public static ToolInvocationResult success(ToolInvocationRequest request, JsonObject payload, long durationMillis) {
        return new ToolInvocationResult(request.getRequestId(), request.getToolName(), true, payload,
            null, null, null, durationMillis);
    }

    public static ToolInvocationResult failure(ToolInvocationRequest request, ErrorKind kind, String message,
                                               StatementCategory category, long durationMillis) {
        return new ToolInvocationResult(request.getRequestId(), request.getToolName(), false, null,
            kind, message, category, durationMillis);
    }

    public static ToolInvocationResult failure(ToolInvocationRequest request, ToolInvocationException error,
                                               long durationMillis) {
        return failure(request, error.getKind(), error.getMessage(), error.getCategory(), durationMillis);
    }

    public String getRequestId() {
        return requestId;
    }

    public String getToolName() {
        return toolName;
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonObject getPayload() {
        return payload;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public StatementCategory getCategory() {
        return category;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public JsonObject errorDescriptor() {
        if (success) {
            return null;
        }
        JsonObject error = new JsonObject()
            .put("kind", errorKind.getLabel())
            .put("message", errorMessage);
        if (category != null) {
            error.put("category", category.getConfigName());
        }
        return error;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("requestId", requestId)
            .put("tool", toolName)
            .put("success", success)
            .put("durationMillis", durationMillis);
        if (success) {
            json.put("payload", payload);
        } else {
            json.put("error", errorDescriptor());
        }
        return json;
    }

    /**
     * The MCP <code>tools/call</code> result: one text content entry plus the structured data,
     * with <code>isError</code> set on failure.
     */
    public JsonObject toMcpResult() {
        String text = success
            ? payload.encodePrettily()
            : errorKind.getLabel() + ": " + errorMessage;
        JsonObject structured = success ? payload : new JsonObject().put("error", errorDescriptor());
        return new JsonObject()
            .put("content", new JsonArray().add(new JsonObject().put("type", "text").put("text", text)))
            .put("structuredContent", structured)
            .put("isError", !success);
    }

    @Override
    public String toString() {
        return "ToolInvocationResult" + toJson().encode();
    }
}
