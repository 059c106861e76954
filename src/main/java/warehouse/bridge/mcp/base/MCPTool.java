package warehouse.bridge.mcp.base;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * An MCP tool definition: name, description and the JSON schema of its arguments.
 * The input schema doubles as the parameter contract the dispatcher validates against.
 */
public class MCPTool {

    private final String name;
    private final String description;
    private final JsonObject inputSchema;

    public MCPTool(String name, String description, JsonObject inputSchema) {
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public JsonObject getInputSchema() {
        return inputSchema;
    }

    public JsonObject getProperties() {
        return inputSchema.getJsonObject("properties", new JsonObject());
    }

    public List<String> getRequiredParameters() {
        List<String> required = new ArrayList<>();
        JsonArray array = inputSchema.getJsonArray("required", new JsonArray());
        for (int i = 0; i < array.size(); i++) {
            required.add(array.getString(i));
        }
        return required;
    }

    /**
     * Convert to JSON format for MCP protocol
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("inputSchema", inputSchema.copy());
    }

    public static MCPTool fromJson(JsonObject json) {
        return new MCPTool(
            json.getString("name"),
            json.getString("description"),
            json.getJsonObject("inputSchema", new JsonObject().put("type", "object"))
        );
    }

    @Override
    public String toString() {
        return "MCPTool{name='" + name + "', description='" + description + "'}";
    }
}
