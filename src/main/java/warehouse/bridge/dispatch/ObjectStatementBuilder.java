package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.catalog.ObjectType;
import warehouse.bridge.catalog.ToolSchemas;
import warehouse.bridge.policy.StatementCategory;
import warehouse.bridge.policy.StatementClassifier;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Translates object-manager tool calls into DDL and metadata statements.
 * Arguments must already have passed {@link ParameterValidator}.
 */
public class ObjectStatementBuilder {

    private static final Pattern DATA_TYPE = Pattern.compile(
        "^[A-Za-z][A-Za-z0-9_]*(\\s+[A-Za-z][A-Za-z0-9_]*)*(\\s*\\(\\s*\\d+(\\s*,\\s*\\d+)?\\s*\\))?$");
    private static final Set<ObjectType> CASCADING = EnumSet.of(ObjectType.DATABASE, ObjectType.SCHEMA, ObjectType.TABLE);

    private final StatementClassifier classifier;

    public ObjectStatementBuilder(StatementClassifier classifier) {
        this.classifier = classifier;
    }

    public String build(String toolName, JsonObject arguments) {
        ObjectType type = ObjectType.fromArgument(arguments.getString("object_type"));
        if (type == null) {
            throw ToolInvocationException.validation("Unknown object_type: " + arguments.getString("object_type"));
        }
        switch (toolName) {
            case ToolSchemas.CREATE_OBJECT:
                return create(type, arguments, false);
            case ToolSchemas.CREATE_OR_ALTER_OBJECT:
                return create(type, arguments, true);
            case ToolSchemas.DROP_OBJECT:
                return drop(type, arguments);
            case ToolSchemas.DESCRIBE_OBJECT:
                return "DESCRIBE " + type.getKeyword() + " " + objectName(type, arguments);
            case ToolSchemas.LIST_OBJECTS:
                return list(type, arguments);
            default:
                throw ToolInvocationException.notFound("Unknown object-manager tool: " + toolName);
        }
    }

    private String create(ObjectType type, JsonObject arguments, boolean orAlter) {
        boolean orReplace = ParameterValidator.booleanArgument(arguments, "or_replace");
        boolean ifNotExists = ParameterValidator.booleanArgument(arguments, "if_not_exists");
        if (orReplace && ifNotExists) {
            throw ToolInvocationException.validation("or_replace and if_not_exists cannot both be set");
        }

        StringBuilder sql = new StringBuilder("CREATE ");
        if (orAlter) {
            sql.append("OR ALTER ");
        } else if (orReplace) {
            sql.append("OR REPLACE ");
        }
        sql.append(type.getKeyword()).append(' ');
        if (ifNotExists) {
            sql.append("IF NOT EXISTS ");
        }
        sql.append(objectName(type, arguments));

        JsonArray columns = arguments.getJsonArray("columns");
        String query = arguments.getString("query");
        JsonObject properties = arguments.getJsonObject("properties");
        String comment = arguments.getString("comment");

        if (type == ObjectType.TABLE) {
            if (columns == null || columns.isEmpty()) {
                throw ToolInvocationException.validation("A table needs at least one column");
            }
            sql.append(" (\n").append(columnDefinitions(columns)).append("\n)");
        } else if (columns != null) {
            throw ToolInvocationException.validation("columns only apply to tables");
        }
        if (type != ObjectType.VIEW && query != null) {
            throw ToolInvocationException.validation("query only applies to views");
        }

        if (properties != null) {
            if (type == ObjectType.VIEW) {
                throw ToolInvocationException.validation("properties are not supported for views");
            }
            for (String key : properties.fieldNames()) {
                sql.append(' ').append(propertyName(key)).append(" = ").append(propertyValue(key, properties.getValue(key)));
            }
        }
        if (comment != null) {
            sql.append(" COMMENT = ").append(SqlIdentifiers.literal(comment));
        }

        if (type == ObjectType.VIEW) {
            if (query == null || query.trim().isEmpty()) {
                throw ToolInvocationException.validation("A view needs a defining query");
            }
            List<String> statements = classifier.split(query);
            if (statements.size() != 1 || classifier.classify(statements.get(0)) != StatementCategory.SELECT) {
                throw ToolInvocationException.validation("The query of a view must be a single SELECT statement");
            }
            sql.append(" AS\n").append(statements.get(0));
        }
        return sql.toString();
    }

    private String drop(ObjectType type, JsonObject arguments) {
        StringBuilder sql = new StringBuilder("DROP ").append(type.getKeyword()).append(' ');
        if (ParameterValidator.booleanArgument(arguments, "if_exists")) {
            sql.append("IF EXISTS ");
        }
        sql.append(objectName(type, arguments));
        if (ParameterValidator.booleanArgument(arguments, "cascade")) {
            if (!CASCADING.contains(type)) {
                throw ToolInvocationException.validation("cascade does not apply to " + type.getArgumentName());
            }
            sql.append(" CASCADE");
        }
        return sql.toString();
    }

    private String list(ObjectType type, JsonObject arguments) {
        StringBuilder sql = new StringBuilder("SHOW ").append(type.getPluralKeyword());
        String like = arguments.getString("like");
        if (like != null) {
            sql.append(" LIKE ").append(SqlIdentifiers.literal(like));
        }
        String database = arguments.getString("database_name");
        String schema = arguments.getString("schema_name");
        switch (type.getScope()) {
            case ACCOUNT:
                rejectContainer(type, database, schema);
                break;
            case DATABASE:
                if (schema != null) {
                    throw ToolInvocationException.validation("schema_name does not apply when listing "
                        + type.getPluralKeyword().toLowerCase(Locale.ROOT));
                }
                if (database != null) {
                    sql.append(" IN DATABASE ").append(SqlIdentifiers.identifier(database));
                }
                break;
            case SCHEMA:
                if (schema != null) {
                    sql.append(" IN SCHEMA ").append(SqlIdentifiers.qualified(database, schema));
                } else if (database != null) {
                    sql.append(" IN DATABASE ").append(SqlIdentifiers.identifier(database));
                }
                break;
            default:
                break;
        }
        return sql.toString();
    }

    /**
     * Fully qualified name of the object, according to where objects of its type live.
     */
    String objectName(ObjectType type, JsonObject arguments) {
        String name = arguments.getString("name");
        String database = arguments.getString("database_name");
        String schema = arguments.getString("schema_name");
        switch (type.getScope()) {
            case ACCOUNT:
                rejectContainer(type, database, schema);
                return SqlIdentifiers.identifier(name);
            case DATABASE:
                if (schema != null) {
                    throw ToolInvocationException.validation("schema_name does not apply to a schema; use name");
                }
                return SqlIdentifiers.qualified(database, name);
            default:
                if (database != null && schema == null) {
                    throw ToolInvocationException.validation("schema_name is required when database_name is given for a "
                        + type.getArgumentName());
                }
                return SqlIdentifiers.qualified(database, schema, name);
        }
    }

    private static void rejectContainer(ObjectType type, String database, String schema) {
        if (database != null || schema != null) {
            throw ToolInvocationException.validation(type.getArgumentName()
                + " is an account-level object; database_name and schema_name do not apply");
        }
    }

    private static String columnDefinitions(JsonArray columns) {
        List<String> definitions = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            JsonObject column = columns.getJsonObject(i);
            String dataType = column.getString("type").trim();
            if (!DATA_TYPE.matcher(dataType).matches()) {
                throw ToolInvocationException.validation("Column '" + column.getString("name")
                    + "' has an invalid data type: " + dataType);
            }
            StringBuilder definition = new StringBuilder("    ")
                .append(SqlIdentifiers.identifier(column.getString("name")))
                .append(' ').append(dataType.toUpperCase(Locale.ROOT));
            if (Boolean.FALSE.equals(column.getValue("nullable"))) {
                definition.append(" NOT NULL");
            }
            String defaultValue = column.getString("default");
            if (defaultValue != null && !defaultValue.trim().isEmpty()) {
                definition.append(" DEFAULT ").append(defaultValue.trim());
            }
            String comment = column.getString("comment");
            if (comment != null) {
                definition.append(" COMMENT ").append(SqlIdentifiers.literal(comment));
            }
            definitions.add(definition.toString());
        }
        return String.join(",\n", definitions);
    }

    private static String propertyName(String key) {
        if (!SqlIdentifiers.isPlainIdentifier(key)) {
            throw ToolInvocationException.validation("Invalid property name: " + key);
        }
        return key.toUpperCase(Locale.ROOT);
    }

    private static String propertyValue(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "TRUE" : "FALSE";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof String) {
            return SqlIdentifiers.literal((String) value);
        }
        throw ToolInvocationException.validation("Property '" + key + "' must be a string, number or boolean");
    }
}
