package warehouse.bridge.catalog;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConfigurationException;
import warehouse.bridge.dispatch.ToolInvocationException;
import warehouse.bridge.mcp.base.MCPTool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of declared services, resolved by tool name.
 *
 * <p>Loading is all-or-nothing: every problem in the configuration is collected and reported in
 * one {@link ConfigurationException}, and no catalog is produced. Tool names are unique across
 * the whole catalog, including the fixed names contributed by the manager toggles.</p>
 */
public final class ServiceCatalog {

    private static final Set<String> SEARCH_KEYS =
        Set.of("service_name", "description", "database_name", "schema_name", "columns", "limit");
    private static final Set<String> ANALYST_KEYS = Set.of("service_name", "description", "semantic_model");

    private final List<ServiceDefinition> definitions;
    private final Map<String, ServiceDefinition> definitionsByTool;
    private final Map<String, MCPTool> toolsByName;

    private ServiceCatalog(List<ServiceDefinition> definitions) {
        Map<String, ServiceDefinition> byTool = new LinkedHashMap<>();
        Map<String, MCPTool> tools = new LinkedHashMap<>();
        for (ServiceDefinition definition : definitions) {
            for (MCPTool tool : definition.getTools()) {
                byTool.put(tool.getName(), definition);
                tools.put(tool.getName(), tool);
            }
        }
        this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        this.definitionsByTool = Collections.unmodifiableMap(byTool);
        this.toolsByName = Collections.unmodifiableMap(tools);
    }

    /**
     * Build a catalog directly from definitions.
     * @throws ConfigurationException if two tools share a name
     */
    public static ServiceCatalog of(List<ServiceDefinition> definitions) {
        List<String> problems = new ArrayList<>();
        checkUniqueToolNames(definitions, problems);
        failIfAny(problems);
        return new ServiceCatalog(definitions);
    }

    /**
     * Parse the <code>search_services</code>, <code>analyst_services</code> and
     * <code>other_services</code> sections.
     *
     * @throws ConfigurationException describing every invalid entry
     */
    public static ServiceCatalog load(JsonObject configuration) {
        List<String> problems = new ArrayList<>();
        List<ServiceDefinition> definitions = new ArrayList<>();

        for (Entry entry : entries(configuration, ServiceKind.SEARCH.getConfigKey(), problems)) {
            ServiceDefinition definition = parseSearch(entry.body, entry.where, problems);
            if (definition != null) {
                definitions.add(definition);
            }
        }
        for (Entry entry : entries(configuration, ServiceKind.ANALYST.getConfigKey(), problems)) {
            ServiceDefinition definition = parseAnalyst(entry.body, entry.where, problems);
            if (definition != null) {
                definitions.add(definition);
            }
        }
        definitions.addAll(parseToggles(configuration.getValue("other_services"), problems));

        checkUniqueToolNames(definitions, problems);
        failIfAny(problems);
        return new ServiceCatalog(definitions);
    }

    // One list item of a service section and its position for error messages
    private static final class Entry {
        private final String where;
        private final JsonObject body;

        private Entry(String where, JsonObject body) {
            this.where = where;
            this.body = body;
        }
    }

    private static List<Entry> entries(JsonObject configuration, String section, List<String> problems) {
        Object raw = configuration.getValue(section);
        List<Entry> entries = new ArrayList<>();
        if (raw == null) {
            return entries;
        }
        if (!(raw instanceof JsonArray)) {
            problems.add(section + " must be a list");
            return entries;
        }
        JsonArray array = (JsonArray) raw;
        for (int i = 0; i < array.size(); i++) {
            Object entry = array.getValue(i);
            if (entry instanceof JsonObject) {
                entries.add(new Entry(section + "[" + i + "]", (JsonObject) entry));
            } else {
                problems.add(section + "[" + i + "] must be a mapping");
            }
        }
        return entries;
    }

    private static SearchServiceDefinition parseSearch(JsonObject entry, String where, List<String> problems) {
        int before = problems.size();
        checkKeys(entry, SEARCH_KEYS, where, problems);
        String name = requiredString(entry, "service_name", where, problems);
        String description = requiredString(entry, "description", where, problems);
        String database = requiredString(entry, "database_name", where, problems);
        String schema = requiredString(entry, "schema_name", where, problems);

        List<String> columns = new ArrayList<>();
        Object rawColumns = entry.getValue("columns");
        if (rawColumns != null) {
            if (rawColumns instanceof JsonArray) {
                for (Object column : (JsonArray) rawColumns) {
                    if (column instanceof String && !((String) column).trim().isEmpty()) {
                        columns.add(((String) column).trim());
                    } else {
                        problems.add(where + ".columns must contain only non-empty strings");
                        break;
                    }
                }
            } else {
                problems.add(where + ".columns must be a list");
            }
        }

        int limit = SearchServiceDefinition.DEFAULT_LIMIT;
        Object rawLimit = entry.getValue("limit");
        if (rawLimit != null) {
            if ((rawLimit instanceof Integer || rawLimit instanceof Long) && ((Number) rawLimit).longValue() > 0
                && ((Number) rawLimit).longValue() <= Integer.MAX_VALUE) {
                limit = ((Number) rawLimit).intValue();
            } else {
                problems.add(where + ".limit must be a positive integer, got: " + rawLimit);
            }
        }

        if (problems.size() > before) {
            return null;
        }
        return new SearchServiceDefinition(name, description, database, schema, columns, limit);
    }

    private static AnalystServiceDefinition parseAnalyst(JsonObject entry, String where, List<String> problems) {
        int before = problems.size();
        checkKeys(entry, ANALYST_KEYS, where, problems);
        String name = requiredString(entry, "service_name", where, problems);
        String description = requiredString(entry, "description", where, problems);
        String model = requiredString(entry, "semantic_model", where, problems);
        if (problems.size() > before) {
            return null;
        }
        try {
            return AnalystServiceDefinition.of(name, description, model);
        } catch (ConfigurationException e) {
            problems.add(where + ": " + e.getMessage());
            return null;
        }
    }

    private static List<ServiceDefinition> parseToggles(Object raw, List<String> problems) {
        List<ServiceDefinition> toggles = new ArrayList<>();
        if (raw == null) {
            return toggles;
        }
        if (!(raw instanceof JsonObject)) {
            problems.add("other_services must be a mapping of manager name to true/false");
            return toggles;
        }
        JsonObject section = (JsonObject) raw;
        for (String key : section.fieldNames()) {
            ServiceKind kind = toggleKind(key);
            if (kind == null) {
                problems.add("other_services." + key + " is not a known manager"
                    + " (expected object_manager, query_manager or semantic_manager)");
                continue;
            }
            Object enabled = section.getValue(key);
            if (!(enabled instanceof Boolean)) {
                problems.add("other_services." + key + " must be true or false, got: " + enabled);
            } else if ((Boolean) enabled) {
                toggles.add(ManagerToggleDefinition.forKind(kind));
            }
        }
        return toggles;
    }

    private static ServiceKind toggleKind(String key) {
        for (ServiceKind kind : ServiceKind.values()) {
            if (kind.isSqlBacked() && kind.getConfigKey().equals(key)) {
                return kind;
            }
        }
        return null;
    }

    private static void checkKeys(JsonObject entry, Set<String> allowed, String where, List<String> problems) {
        for (String key : entry.fieldNames()) {
            if (!allowed.contains(key)) {
                problems.add(where + " has unknown field '" + key + "'");
            }
        }
    }

    private static String requiredString(JsonObject entry, String key, String where, List<String> problems) {
        Object value = entry.getValue(key);
        if (!(value instanceof String) || ((String) value).trim().isEmpty()) {
            problems.add(where + "." + key + " is required and must be a non-empty string");
            return null;
        }
        return ((String) value).trim();
    }

    private static void checkUniqueToolNames(List<ServiceDefinition> definitions, List<String> problems) {
        Map<String, ServiceDefinition> seen = new LinkedHashMap<>();
        for (ServiceDefinition definition : definitions) {
            for (MCPTool tool : definition.getTools()) {
                ServiceDefinition previous = seen.putIfAbsent(tool.getName(), definition);
                if (previous != null) {
                    problems.add("Duplicate tool name '" + tool.getName() + "' declared by " + previous.getKind().getConfigKey()
                        + " and " + definition.getKind().getConfigKey());
                }
            }
        }
    }

    private static void failIfAny(List<String> problems) {
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid service configuration: " + String.join("; ", problems));
        }
    }

    /**
     * @throws ToolInvocationException with kind NotFound if no service exposes the tool
     */
    public ServiceDefinition resolve(String toolName) {
        ServiceDefinition definition = toolName == null ? null : definitionsByTool.get(toolName);
        if (definition == null) {
            throw ToolInvocationException.notFound("Unknown tool: " + toolName);
        }
        return definition;
    }

    public MCPTool getTool(String toolName) {
        MCPTool tool = toolName == null ? null : toolsByName.get(toolName);
        if (tool == null) {
            throw ToolInvocationException.notFound("Unknown tool: " + toolName);
        }
        return tool;
    }

    public List<MCPTool> tools() {
        return new ArrayList<>(toolsByName.values());
    }

    public List<ServiceDefinition> definitions() {
        return definitions;
    }

    public boolean isEnabled(ServiceKind kind) {
        return definitions.stream().anyMatch(definition -> definition.getKind() == kind);
    }

    public int size() {
        return toolsByName.size();
    }

    public JsonObject toJson() {
        JsonArray services = new JsonArray();
        definitions.forEach(definition -> services.add(definition.toJson()));
        return new JsonObject()
            .put("services", services)
            .put("tools", new JsonArray(new ArrayList<>(toolsByName.keySet())));
    }
}
