package warehouse.bridge.policy;

/**
 * Coarse classification of a SQL statement's intent.
 * The config name is the key used under <code>sql_statement_permissions</code>.
 */
public enum StatementCategory {
    SELECT("Select"),
    DESCRIBE("Describe"),
    INSERT("Insert"),
    UPDATE("Update"),
    DELETE("Delete"),
    MERGE("Merge"),
    TRUNCATE_TABLE("TruncateTable"),
    CREATE("Create"),
    ALTER("Alter"),
    DROP("Drop"),
    TRANSACTION("Transaction"),
    COMMIT("Commit"),
    ROLLBACK("Rollback"),
    USE("Use"),
    COMMAND("Command"),
    COMMENT("Comment"),
    UNKNOWN("Unknown");

    private final String configName;

    StatementCategory(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Finds a category by its configuration name, ignoring case.
     * @return the matching category, or null if the name is not recognized
     */
    public static StatementCategory fromConfigName(String name) {
        if (name == null) {
            return null;
        }
        for (StatementCategory category : values()) {
            if (category.configName.equalsIgnoreCase(name.trim())) {
                return category;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return configName;
    }
}
