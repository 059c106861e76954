package warehouse.bridge.catalog;

/**
 * The closed set of service definition variants.
 */
public enum ServiceKind {
    SEARCH("search_services"),
    ANALYST("analyst_services"),
    OBJECT_MANAGER("object_manager"),
    QUERY_MANAGER("query_manager"),
    SEMANTIC_MANAGER("semantic_manager");

    private final String configKey;

    ServiceKind(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Section (or toggle) name in the service configuration file.
     */
    public String getConfigKey() {
        return configKey;
    }

    public boolean isSqlBacked() {
        return this == OBJECT_MANAGER || this == QUERY_MANAGER || this == SEMANTIC_MANAGER;
    }
}
