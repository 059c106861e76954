package warehouse.bridge.policy;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable allow/deny mapping from statement category to boolean.
 * Categories missing from the configuration are denied.
 */
public final class PermissionPolicy {

    private final Map<StatementCategory, Boolean> permissions;

    private PermissionPolicy(Map<StatementCategory, Boolean> permissions) {
        EnumMap<StatementCategory, Boolean> total = new EnumMap<>(StatementCategory.class);
        for (StatementCategory category : StatementCategory.values()) {
            total.put(category, Boolean.TRUE.equals(permissions.get(category)));
        }
        this.permissions = Collections.unmodifiableMap(total);
    }

    public static PermissionPolicy of(Map<StatementCategory, Boolean> permissions) {
        return new PermissionPolicy(permissions);
    }

    public static PermissionPolicy denyAll() {
        return new PermissionPolicy(Map.of());
    }

    /**
     * Build the policy from the <code>sql_statement_permissions</code> section.
     * Accepts either a list of single-entry objects (<code>- Select: true</code>) or one object.
     *
     * @param section the raw section, a JsonArray, a JsonObject or null
     * @throws ConfigurationException on an unknown category, a non-boolean value or a
     *         category listed twice
     */
    public static PermissionPolicy fromConfig(Object section) {
        EnumMap<StatementCategory, Boolean> parsed = new EnumMap<>(StatementCategory.class);
        if (section == null) {
            return new PermissionPolicy(parsed);
        }
        if (section instanceof JsonObject) {
            addEntries(parsed, (JsonObject) section);
        } else if (section instanceof JsonArray) {
            JsonArray entries = (JsonArray) section;
            for (int i = 0; i < entries.size(); i++) {
                Object entry = entries.getValue(i);
                if (!(entry instanceof JsonObject)) {
                    throw new ConfigurationException(
                        "sql_statement_permissions[" + i + "] must be a mapping of category to boolean");
                }
                addEntries(parsed, (JsonObject) entry);
            }
        } else {
            throw new ConfigurationException(
                "sql_statement_permissions must be a list or a mapping, got: " + section.getClass().getSimpleName());
        }
        return new PermissionPolicy(parsed);
    }

    private static void addEntries(Map<StatementCategory, Boolean> parsed, JsonObject entries) {
        for (String key : entries.fieldNames()) {
            StatementCategory category = StatementCategory.fromConfigName(key);
            if (category == null) {
                throw new ConfigurationException("Unrecognized statement category in permissions: '" + key + "'");
            }
            Object value = entries.getValue(key);
            if (!(value instanceof Boolean)) {
                throw new ConfigurationException(
                    "Permission for '" + key + "' must be true or false, got: " + value);
            }
            if (parsed.containsKey(category)) {
                throw new ConfigurationException("Permission for '" + key + "' is declared more than once");
            }
            parsed.put(category, (Boolean) value);
        }
    }

    public boolean isAllowed(StatementCategory category) {
        return category != null && permissions.get(category);
    }

    public Map<StatementCategory, Boolean> asMap() {
        return permissions;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        permissions.forEach((category, allowed) -> json.put(category.getConfigName(), allowed));
        return json;
    }

    @Override
    public String toString() {
        return "PermissionPolicy" + toJson().encode();
    }
}
