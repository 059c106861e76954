package warehouse.bridge.catalog;

import io.vertx.core.json.JsonObject;
import warehouse.bridge.mcp.base.MCPTool;

import java.util.List;

/**
 * One declared service. Immutable once loaded.
 * Search and analyst services expose a single tool named after the service; the manager
 * toggles expose a fixed set of tools.
 */
public abstract class ServiceDefinition {

    private final String name;
    private final String description;
    private final ServiceKind kind;

    protected ServiceDefinition(String name, String description, ServiceKind kind) {
        this.name = name;
        this.description = description;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public ServiceKind getKind() {
        return kind;
    }

    /**
     * The tools this definition contributes to the catalog.
     */
    public abstract List<MCPTool> getTools();

    public JsonObject toJson() {
        return new JsonObject()
            .put("name", name)
            .put("description", description)
            .put("kind", kind.getConfigKey());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
