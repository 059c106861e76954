package warehouse.bridge.session;

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Per-lease session parameters: warehouse, database, schema, role and query tag.
 * Null means "not requested".
 */
public final class SessionParameters {

    public static final SessionParameters NONE = new SessionParameters(null, null, null, null, null);

    private final String warehouse;
    private final String database;
    private final String schema;
    private final String role;
    private final String queryTag;

    public SessionParameters(String warehouse, String database, String schema, String role, String queryTag) {
        this.warehouse = blankToNull(warehouse);
        this.database = blankToNull(database);
        this.schema = blankToNull(schema);
        this.role = blankToNull(role);
        this.queryTag = blankToNull(queryTag);
    }

    /**
     * Read the optional session arguments of a tool call.
     */
    public static SessionParameters fromArguments(JsonObject arguments) {
        if (arguments == null) {
            return NONE;
        }
        return new SessionParameters(
            arguments.getString("warehouse"),
            arguments.getString("database"),
            arguments.getString("schema"),
            arguments.getString("role"),
            arguments.getString("query_tag"));
    }

    /**
     * Values of this instance, falling back to <code>defaults</code> field by field.
     */
    public SessionParameters withDefaults(SessionParameters defaults) {
        return new SessionParameters(
            warehouse != null ? warehouse : defaults.warehouse,
            database != null ? database : defaults.database,
            schema != null ? schema : defaults.schema,
            role != null ? role : defaults.role,
            queryTag != null ? queryTag : defaults.queryTag);
    }

    public SessionParameters withQueryTag(String tag) {
        return new SessionParameters(warehouse, database, schema, role, tag);
    }

    /**
     * Whether a connection currently configured with <code>this</code> can be re-targeted to
     * <code>target</code>. A warehouse, database, schema or role that is set here but absent
     * from the target cannot be unset in place; the query tag always can.
     */
    public boolean canBeRetargetedTo(SessionParameters target) {
        return coveredBy(warehouse, target.warehouse)
            && coveredBy(database, target.database)
            && coveredBy(schema, target.schema)
            && coveredBy(role, target.role);
    }

    private static boolean coveredBy(String current, String target) {
        return current == null || target != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    public String getWarehouse() {
        return warehouse;
    }

    public String getDatabase() {
        return database;
    }

    public String getSchema() {
        return schema;
    }

    public String getRole() {
        return role;
    }

    public String getQueryTag() {
        return queryTag;
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("warehouse", warehouse)
            .put("database", database)
            .put("schema", schema)
            .put("role", role)
            .put("query_tag", queryTag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionParameters)) return false;
        SessionParameters that = (SessionParameters) o;
        return Objects.equals(warehouse, that.warehouse)
            && Objects.equals(database, that.database)
            && Objects.equals(schema, that.schema)
            && Objects.equals(role, that.role)
            && Objects.equals(queryTag, that.queryTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(warehouse, database, schema, role, queryTag);
    }

    @Override
    public String toString() {
        return "SessionParameters" + toJson().encode();
    }
}
