package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.catalog.ToolSchemas;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates semantic-manager tool calls into statements over semantic views.
 */
public class SemanticStatementBuilder {

    public String build(String toolName, JsonObject arguments) {
        switch (toolName) {
            case ToolSchemas.LIST_SEMANTIC_VIEWS:
                return "SHOW SEMANTIC VIEWS" + like(arguments) + scope(arguments, false);
            case ToolSchemas.DESCRIBE_SEMANTIC_VIEW:
                return "DESCRIBE SEMANTIC VIEW " + viewName(arguments);
            case ToolSchemas.SHOW_SEMANTIC_DIMENSIONS:
                return "SHOW SEMANTIC DIMENSIONS" + like(arguments) + scope(arguments, true);
            case ToolSchemas.SHOW_SEMANTIC_METRICS:
                return "SHOW SEMANTIC METRICS" + like(arguments) + scope(arguments, true);
            case ToolSchemas.GET_SEMANTIC_VIEW_DDL:
                return "SELECT GET_DDL('SEMANTIC_VIEW', " + SqlIdentifiers.literal(viewName(arguments)) + ", TRUE)";
            case ToolSchemas.QUERY_SEMANTIC_VIEW:
                return query(arguments);
            default:
                throw ToolInvocationException.notFound("Unknown semantic-manager tool: " + toolName);
        }
    }

    private static String viewName(JsonObject arguments) {
        return SqlIdentifiers.qualified(arguments.getString("database_name"), arguments.getString("schema_name"),
            arguments.getString("view_name"));
    }

    private static String like(JsonObject arguments) {
        String pattern = arguments.getString("like");
        return pattern == null ? "" : " LIKE " + SqlIdentifiers.literal(pattern);
    }

    // Narrowest scope the arguments name: a view, a schema, a database or the whole account
    private static String scope(JsonObject arguments, boolean viewAllowed) {
        String database = arguments.getString("database_name");
        String schema = arguments.getString("schema_name");
        String view = viewAllowed ? arguments.getString("view_name") : null;
        if (view != null) {
            if (database == null || schema == null) {
                throw ToolInvocationException.validation("database_name and schema_name are required with view_name");
            }
            return " IN SEMANTIC VIEW " + SqlIdentifiers.qualified(database, schema, view);
        }
        if (schema != null) {
            return " IN SCHEMA " + SqlIdentifiers.qualified(database, schema);
        }
        if (database != null) {
            return " IN DATABASE " + SqlIdentifiers.identifier(database);
        }
        return "";
    }

    private static String query(JsonObject arguments) {
        List<String> dimensions = members(arguments.getJsonArray("dimensions"));
        List<String> metrics = members(arguments.getJsonArray("metrics"));
        if (dimensions.isEmpty() && metrics.isEmpty()) {
            throw ToolInvocationException.validation("At least one dimension or metric is required");
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM SEMANTIC_VIEW(\n    ").append(viewName(arguments));
        if (!dimensions.isEmpty()) {
            sql.append("\n    DIMENSIONS ").append(String.join(", ", dimensions));
        }
        if (!metrics.isEmpty()) {
            sql.append("\n    METRICS ").append(String.join(", ", metrics));
        }
        String where = arguments.getString("where");
        if (where != null && !where.trim().isEmpty()) {
            sql.append("\n    WHERE ").append(where.trim());
        }
        sql.append("\n)");

        JsonArray orderBy = arguments.getJsonArray("order_by");
        if (orderBy != null && !orderBy.isEmpty()) {
            List<String> keys = new ArrayList<>();
            for (int i = 0; i < orderBy.size(); i++) {
                keys.add(orderKey(orderBy.getString(i)));
            }
            sql.append(" ORDER BY ").append(String.join(", ", keys));
        }
        Object limit = arguments.getValue("limit");
        if (limit instanceof Number) {
            sql.append(" LIMIT ").append(((Number) limit).longValue());
        }
        return sql.toString();
    }

    private static List<String> members(JsonArray names) {
        List<String> members = new ArrayList<>();
        if (names == null) {
            return members;
        }
        for (int i = 0; i < names.size(); i++) {
            members.add(SqlIdentifiers.qualified(names.getString(i).split("\\.")));
        }
        return members;
    }

    private static String orderKey(String key) {
        String[] parts = key.trim().split("\\s+");
        if (parts.length == 1) {
            return SqlIdentifiers.identifier(parts[0]);
        }
        String direction = parts[1].toUpperCase(Locale.ROOT);
        if (parts.length > 2 || !(direction.equals("ASC") || direction.equals("DESC"))) {
            throw ToolInvocationException.validation("Invalid order_by entry: " + key);
        }
        return SqlIdentifiers.identifier(parts[0]) + " " + direction;
    }
}
