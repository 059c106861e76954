package warehouse.bridge.catalog;

import warehouse.bridge.mcp.base.MCPTool;

import java.util.List;

/**
 * An enabled manager from <code>other_services</code>, contributing its fixed tool set.
 */
public final class ManagerToggleDefinition extends ServiceDefinition {

    private final List<MCPTool> tools;

    private ManagerToggleDefinition(ServiceKind kind, String description, List<MCPTool> tools) {
        super(kind.getConfigKey(), description, kind);
        this.tools = tools;
    }

    public static ManagerToggleDefinition queryManager() {
        return new ManagerToggleDefinition(ServiceKind.QUERY_MANAGER,
            "Policy-gated execution of SQL statements", ToolSchemas.queryManagerTools());
    }

    public static ManagerToggleDefinition objectManager() {
        return new ManagerToggleDefinition(ServiceKind.OBJECT_MANAGER,
            "Create, drop, describe and list database objects", ToolSchemas.objectManagerTools());
    }

    public static ManagerToggleDefinition semanticManager() {
        return new ManagerToggleDefinition(ServiceKind.SEMANTIC_MANAGER,
            "Discover and query semantic views", ToolSchemas.semanticManagerTools());
    }

    static ManagerToggleDefinition forKind(ServiceKind kind) {
        switch (kind) {
            case QUERY_MANAGER:
                return queryManager();
            case OBJECT_MANAGER:
                return objectManager();
            case SEMANTIC_MANAGER:
                return semanticManager();
            default:
                throw new IllegalArgumentException(kind + " is not a manager toggle");
        }
    }

    @Override
    public List<MCPTool> getTools() {
        return tools;
    }
}
