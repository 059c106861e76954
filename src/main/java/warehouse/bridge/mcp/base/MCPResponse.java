package warehouse.bridge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC 2.0 response carrying either a result or an error object.
 */
public class MCPResponse {

    private static final String JSONRPC = "2.0";

    private final Object id;
    private final JsonObject result;
    private final JsonObject error;

    private MCPResponse(Object id, JsonObject result, JsonObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static MCPResponse success(Object id, JsonObject result) {
        return new MCPResponse(id, result, null);
    }

    public static MCPResponse error(Object id, int code, String message) {
        return error(id, code, message, null);
    }

    public static MCPResponse error(Object id, int code, String message, JsonObject data) {
        JsonObject error = new JsonObject()
            .put("code", code)
            .put("message", message);
        if (data != null) {
            error.put("data", data);
        }
        return new MCPResponse(id, null, error);
    }

    public Object getId() {
        return id;
    }

    public JsonObject getResult() {
        return result;
    }

    public JsonObject getError() {
        return error;
    }

    public boolean isSuccess() {
        return result != null && error == null;
    }

    public boolean isError() {
        return error != null;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", JSONRPC)
            .put("id", id);
        if (isSuccess()) {
            json.put("result", result);
        } else if (isError()) {
            json.put("error", error);
        }
        return json;
    }

    public static MCPResponse fromJson(JsonObject json) {
        return new MCPResponse(json.getValue("id"), json.getJsonObject("result"), json.getJsonObject("error"));
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "MCPResponse{id='" + id + "', result=" + result + "}";
        }
        return "MCPResponse{id='" + id + "', error=" + error + "}";
    }

    // Standard JSON-RPC error codes
    public static class ErrorCodes {
        public static final int PARSE_ERROR = -32700;
        public static final int INVALID_REQUEST = -32600;
        public static final int METHOD_NOT_FOUND = -32601;
        public static final int INVALID_PARAMS = -32602;
        public static final int INTERNAL_ERROR = -32603;
        public static final int RESOURCE_NOT_FOUND = -32002;
    }
}
