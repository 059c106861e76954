package warehouse.bridge.catalog;

import java.util.Locale;

/**
 * Object kinds the object-manager tools can create, drop, describe and list.
 */
public enum ObjectType {
    DATABASE("DATABASE", "DATABASES", Scope.ACCOUNT),
    SCHEMA("SCHEMA", "SCHEMAS", Scope.DATABASE),
    TABLE("TABLE", "TABLES", Scope.SCHEMA),
    VIEW("VIEW", "VIEWS", Scope.SCHEMA),
    WAREHOUSE("WAREHOUSE", "WAREHOUSES", Scope.ACCOUNT),
    ROLE("ROLE", "ROLES", Scope.ACCOUNT),
    STAGE("STAGE", "STAGES", Scope.SCHEMA),
    USER("USER", "USERS", Scope.ACCOUNT),
    COMPUTE_POOL("COMPUTE POOL", "COMPUTE POOLS", Scope.ACCOUNT),
    IMAGE_REPOSITORY("IMAGE REPOSITORY", "IMAGE REPOSITORIES", Scope.SCHEMA);

    /**
     * Where an object of this type lives, which decides how its name is qualified.
     */
    public enum Scope {
        ACCOUNT,
        DATABASE,
        SCHEMA
    }

    private final String keyword;
    private final String pluralKeyword;
    private final Scope scope;

    ObjectType(String keyword, String pluralKeyword, Scope scope) {
        this.keyword = keyword;
        this.pluralKeyword = pluralKeyword;
        this.scope = scope;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getPluralKeyword() {
        return pluralKeyword;
    }

    public Scope getScope() {
        return scope;
    }

    /**
     * Lower-case name used in tool arguments, e.g. <code>compute_pool</code>.
     */
    public String getArgumentName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ObjectType fromArgument(String value) {
        if (value == null) {
            return null;
        }
        for (ObjectType type : values()) {
            if (type.getArgumentName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
