package warehouse.bridge.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.mcp.base.MCPTool;

import java.util.Arrays;
import java.util.List;

/**
 * Input schemas of the fixed tools and small builders for the configured ones.
 * The dispatcher validates arguments against exactly these schemas.
 */
public final class ToolSchemas {

    public static final String RUN_QUERY = "run_snowflake_query";

    public static final String CREATE_OBJECT = "create_object";
    public static final String DROP_OBJECT = "drop_object";
    public static final String CREATE_OR_ALTER_OBJECT = "create_or_alter_object";
    public static final String DESCRIBE_OBJECT = "describe_object";
    public static final String LIST_OBJECTS = "list_objects";

    public static final String LIST_SEMANTIC_VIEWS = "list_semantic_views";
    public static final String DESCRIBE_SEMANTIC_VIEW = "describe_semantic_view";
    public static final String SHOW_SEMANTIC_DIMENSIONS = "show_semantic_dimensions";
    public static final String SHOW_SEMANTIC_METRICS = "show_semantic_metrics";
    public static final String GET_SEMANTIC_VIEW_DDL = "get_semantic_view_ddl";
    public static final String QUERY_SEMANTIC_VIEW = "query_semantic_view";

    private ToolSchemas() {
    }

    static JsonObject string(String description) {
        return new JsonObject().put("type", "string").put("description", description);
    }

    static JsonObject integer(String description, Integer minimum, Integer maximum) {
        JsonObject property = new JsonObject().put("type", "integer").put("description", description);
        if (minimum != null) {
            property.put("minimum", minimum);
        }
        if (maximum != null) {
            property.put("maximum", maximum);
        }
        return property;
    }

    static JsonObject bool(String description) {
        return new JsonObject().put("type", "boolean").put("description", description);
    }

    static JsonObject stringArray(String description, List<String> allowed) {
        JsonObject items = new JsonObject().put("type", "string");
        if (allowed != null && !allowed.isEmpty()) {
            items.put("enum", new JsonArray(allowed));
        }
        return new JsonObject().put("type", "array").put("description", description).put("items", items);
    }

    static JsonObject object(JsonObject properties, String... required) {
        return new JsonObject()
            .put("type", "object")
            .put("properties", properties)
            .put("required", new JsonArray(Arrays.asList(required)))
            .put("additionalProperties", false);
    }

    /**
     * Optional per-call session parameters accepted by every SQL-backed tool.
     */
    static JsonObject withSessionParameters(JsonObject properties) {
        return properties
            .put("warehouse", string("Warehouse to run on instead of the default"))
            .put("database", string("Database to use for the session"))
            .put("schema", string("Schema to use for the session"))
            .put("role", string("Role to assume for the session"))
            .put("query_tag", string("Query tag recorded with the statement"));
    }

    private static JsonObject objectTypeProperty() {
        JsonArray names = new JsonArray();
        for (ObjectType type : ObjectType.values()) {
            names.add(type.getArgumentName());
        }
        return string("Kind of object").put("enum", names);
    }

    private static JsonObject containerProperties() {
        return new JsonObject()
            .put("object_type", objectTypeProperty())
            .put("database_name", string("Database containing the object, for schema-level objects"))
            .put("schema_name", string("Schema containing the object, for schema-level objects"));
    }

    /* ---------- query manager ---------- */

    static List<MCPTool> queryManagerTools() {
        JsonObject properties = withSessionParameters(new JsonObject()
            .put("statement", string("A single SQL statement"))
            .put("limit", integer("Maximum number of rows returned by a SELECT", 1, Integer.MAX_VALUE)));
        return List.of(new MCPTool(RUN_QUERY,
            "Run one SQL statement. The statement is classified and must be permitted by the configured policy.",
            object(properties, "statement")));
    }

    /* ---------- object manager ---------- */

    static List<MCPTool> objectManagerTools() {
        JsonObject column = object(new JsonObject()
            .put("name", string("Column name"))
            .put("type", string("Column data type, e.g. VARCHAR(100) or NUMBER(10,2)"))
            .put("nullable", bool("Whether the column accepts NULL (default true)"))
            .put("default", string("Default value expression"))
            .put("comment", string("Column comment")), "name", "type");

        JsonObject createProperties = withSessionParameters(containerProperties()
            .put("name", string("Object name"))
            .put("columns", new JsonObject().put("type", "array").put("description", "Columns of a table")
                .put("items", column))
            .put("query", string("Defining SELECT of a view"))
            .put("comment", string("Object comment"))
            .put("properties", new JsonObject().put("type", "object")
                .put("description", "Additional object properties, e.g. {\"WAREHOUSE_SIZE\": \"XSMALL\"}")));

        JsonObject create = createProperties.copy()
            .put("or_replace", bool("Replace an existing object of the same name"))
            .put("if_not_exists", bool("Do nothing if the object already exists"));

        JsonObject drop = withSessionParameters(containerProperties()
            .put("name", string("Object name"))
            .put("if_exists", bool("Do nothing if the object does not exist"))
            .put("cascade", bool("Drop dependent objects as well")));

        JsonObject describe = withSessionParameters(containerProperties()
            .put("name", string("Object name")));

        JsonObject list = withSessionParameters(containerProperties()
            .put("like", string("Name pattern using SQL LIKE wildcards")));

        return List.of(
            new MCPTool(CREATE_OBJECT, "Create a database object.", object(create, "object_type", "name")),
            new MCPTool(DROP_OBJECT, "Drop a database object.", object(drop, "object_type", "name")),
            new MCPTool(CREATE_OR_ALTER_OBJECT, "Create an object, or alter it to match the given definition.",
                object(createProperties, "object_type", "name")),
            new MCPTool(DESCRIBE_OBJECT, "Describe a database object.", object(describe, "object_type", "name")),
            new MCPTool(LIST_OBJECTS, "List objects of one kind, optionally filtered by a name pattern.",
                object(list, "object_type")));
    }

    /* ---------- semantic manager ---------- */

    static List<MCPTool> semanticManagerTools() {
        JsonObject scope = new JsonObject()
            .put("database_name", string("Database of the semantic view"))
            .put("schema_name", string("Schema of the semantic view"));

        JsonObject listViews = withSessionParameters(scope.copy()
            .put("like", string("Name pattern using SQL LIKE wildcards")));

        JsonObject oneView = withSessionParameters(scope.copy()
            .put("view_name", string("Semantic view name")));

        JsonObject members = withSessionParameters(scope.copy()
            .put("view_name", string("Semantic view name; all views in scope when omitted"))
            .put("like", string("Name pattern using SQL LIKE wildcards")));

        JsonObject query = withSessionParameters(scope.copy()
            .put("view_name", string("Semantic view name"))
            .put("dimensions", stringArray("Dimensions to group by, e.g. customer.region", null))
            .put("metrics", stringArray("Metrics to compute, e.g. orders.total_revenue", null))
            .put("where", string("Filter condition over dimensions"))
            .put("order_by", stringArray("Result columns to order by, optionally followed by ASC or DESC", null))
            .put("limit", integer("Maximum number of rows", 1, Integer.MAX_VALUE)));

        return List.of(
            new MCPTool(LIST_SEMANTIC_VIEWS, "List semantic views.", object(listViews)),
            new MCPTool(DESCRIBE_SEMANTIC_VIEW, "Describe the tables, dimensions and metrics of a semantic view.",
                object(oneView.copy(), "database_name", "schema_name", "view_name")),
            new MCPTool(SHOW_SEMANTIC_DIMENSIONS, "List the dimensions of semantic views.", object(members)),
            new MCPTool(SHOW_SEMANTIC_METRICS, "List the metrics of semantic views.", object(members.copy())),
            new MCPTool(GET_SEMANTIC_VIEW_DDL, "Return the DDL of a semantic view.",
                object(oneView.copy(), "database_name", "schema_name", "view_name")),
            new MCPTool(QUERY_SEMANTIC_VIEW, "Query a semantic view by dimensions and metrics.",
                object(query, "database_name", "schema_name", "view_name")));
    }
}
