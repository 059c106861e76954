package warehouse.bridge.mcp.base;

import io.vertx.core.json.JsonObject;

/**
 * A JSON-RPC 2.0 request. The id may be a string or a number and is echoed back unchanged.
 */
public class MCPRequest {

    private final String jsonrpc;
    private final Object id;
    private final String method;
    private final JsonObject params;

    public MCPRequest(String jsonrpc, Object id, String method, JsonObject params) {
        this.jsonrpc = jsonrpc;
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public String getJsonrpc() {
        return jsonrpc;
    }

    public Object getId() {
        return id;
    }

    public String getIdAsString() {
        return id == null ? null : String.valueOf(id);
    }

    public String getMethod() {
        return method;
    }

    public JsonObject getParams() {
        return params;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
            .put("jsonrpc", jsonrpc)
            .put("id", id)
            .put("method", method);
        if (params != null && !params.isEmpty()) {
            json.put("params", params);
        }
        return json;
    }

    /**
     * Create from incoming JSON. A missing <code>jsonrpc</code> member is tolerated as 2.0.
     */
    public static MCPRequest fromJson(JsonObject json) {
        Object params = json.getValue("params");
        return new MCPRequest(
            json.getString("jsonrpc", "2.0"),
            json.getValue("id"),
            json.getString("method"),
            params instanceof JsonObject ? (JsonObject) params : new JsonObject()
        );
    }

    public boolean isValid() {
        boolean idValid = id instanceof Number || (id instanceof String && !((String) id).isEmpty());
        return idValid && "2.0".equals(jsonrpc);
    }

    @Override
    public String toString() {
        return "MCPRequest{id='" + id + "', method='" + method + "', params=" + params + "}";
    }
}
