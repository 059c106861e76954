package warehouse.bridge.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.mcp.base.MCPTool;

import java.util.Collections;
import java.util.List;

/**
 * A Cortex Search service in a given database and schema.
 * The configured limit is both the default and the maximum result count a caller may request.
 */
public final class SearchServiceDefinition extends ServiceDefinition {

    public static final int DEFAULT_LIMIT = 10;

    private final String database;
    private final String schema;
    private final List<String> columns;
    private final int limit;

    public SearchServiceDefinition(String name, String description, String database, String schema,
                                   List<String> columns, int limit) {
        super(name, description, ServiceKind.SEARCH);
        this.database = database;
        this.schema = schema;
        this.columns = columns == null ? Collections.emptyList() : List.copyOf(columns);
        this.limit = limit;
    }

    public String getDatabase() {
        return database;
    }

    public String getSchema() {
        return schema;
    }

    /**
     * Columns a caller may request; empty means any column.
     */
    public List<String> getColumns() {
        return columns;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public List<MCPTool> getTools() {
        JsonObject properties = new JsonObject()
            .put("query", ToolSchemas.string("Search text"))
            .put("columns", ToolSchemas.stringArray("Columns to return", columns))
            .put("filter", new JsonObject().put("type", "object")
                .put("description", "Cortex Search filter, e.g. {\"@eq\": {\"region\": \"EMEA\"}}"))
            .put("limit", ToolSchemas.integer("Maximum number of results", 1, limit));
        return List.of(new MCPTool(getName(), getDescription(), ToolSchemas.object(properties, "query")));
    }

    @Override
    public JsonObject toJson() {
        return super.toJson()
            .put("database_name", database)
            .put("schema_name", schema)
            .put("columns", new JsonArray(columns))
            .put("limit", limit);
    }
}
