package warehouse.bridge.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import warehouse.bridge.catalog.ServiceCatalog;
import warehouse.bridge.policy.PermissionPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The service configuration file: the catalog plus the statement permission policy.
 * Both are built together and either both load or neither does.
 */
public final class ServiceConfiguration {

    public static final String SERVICE_CONFIG_FILE = "SERVICE_CONFIG_FILE";

    private static final Set<String> TOP_LEVEL_KEYS =
        Set.of("search_services", "analyst_services", "other_services", "sql_statement_permissions");

    private final ServiceCatalog catalog;
    private final PermissionPolicy policy;

    public ServiceConfiguration(ServiceCatalog catalog, PermissionPolicy policy) {
        this.catalog = catalog;
        this.policy = policy;
    }

    public static ServiceConfiguration load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read service configuration " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse YAML. Duplicate keys are rejected by the parser.
     * @throws ConfigurationException on malformed YAML or an invalid entry
     */
    public static ServiceConfiguration load(InputStream in, String sourceDescription) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document;
        try {
            document = yaml.load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Unable to parse service configuration " + sourceDescription + ": "
                + e.getMessage(), e);
        }
        if (document == null) {
            throw new ConfigurationException("Service configuration " + sourceDescription + " is empty");
        }
        Object json = toJson(document);
        if (!(json instanceof JsonObject)) {
            throw new ConfigurationException("Service configuration " + sourceDescription + " must be a mapping");
        }
        return fromJson((JsonObject) json);
    }

    public static ServiceConfiguration fromJson(JsonObject configuration) {
        for (String key : configuration.fieldNames()) {
            if (!TOP_LEVEL_KEYS.contains(key)) {
                throw new ConfigurationException("Unknown section in service configuration: '" + key + "'");
            }
        }
        ServiceCatalog catalog = ServiceCatalog.load(configuration);
        PermissionPolicy policy = PermissionPolicy.fromConfig(configuration.getValue("sql_statement_permissions"));
        return new ServiceConfiguration(catalog, policy);
    }

    // SnakeYAML yields maps, lists and scalars; keep them JSON-compatible
    static Object toJson(Object value) {
        if (value instanceof Map) {
            JsonObject object = new JsonObject();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                object.put(String.valueOf(entry.getKey()), toJson(entry.getValue()));
            }
            return object;
        }
        if (value instanceof List) {
            JsonArray array = new JsonArray();
            for (Object item : (List<?>) value) {
                array.add(toJson(item));
            }
            return array;
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().toString();
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }

    public ServiceCatalog getCatalog() {
        return catalog;
    }

    public PermissionPolicy getPolicy() {
        return policy;
    }
}
