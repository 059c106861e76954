package warehouse.bridge.config;

import io.vertx.core.json.JsonObject;
import warehouse.bridge.session.AuthenticationMode;
import warehouse.bridge.session.SessionParameters;

import java.util.function.Function;

/**
 * Warehouse connection, pool and timeout settings.
 *
 * <p>Loaded once at startup from system properties (populated from <code>.env.local</code>) or
 * environment variables. Exactly one authentication mode must be configured.</p>
 */
public final class ConnectionSettings {

    public static final String ACCOUNT = "SNOWFLAKE_ACCOUNT";
    public static final String USER = "SNOWFLAKE_USER";
    public static final String PASSWORD = "SNOWFLAKE_PASSWORD";
    public static final String PRIVATE_KEY_FILE = "SNOWFLAKE_PRIVATE_KEY_FILE";
    public static final String PRIVATE_KEY_FILE_PWD = "SNOWFLAKE_PRIVATE_KEY_FILE_PWD";
    public static final String HOST = "SNOWFLAKE_HOST";
    public static final String WAREHOUSE = "SNOWFLAKE_WAREHOUSE";
    public static final String DATABASE = "SNOWFLAKE_DATABASE";
    public static final String SCHEMA = "SNOWFLAKE_SCHEMA";
    public static final String ROLE = "SNOWFLAKE_ROLE";
    public static final String POOL_MIN_SIZE = "SNOWFLAKE_POOL_MIN_SIZE";
    public static final String POOL_MAX_SIZE = "SNOWFLAKE_POOL_MAX_SIZE";
    public static final String POOL_IDLE_TIMEOUT_SECONDS = "SNOWFLAKE_POOL_IDLE_TIMEOUT_SECONDS";
    public static final String POOL_ACQUIRE_TIMEOUT_MS = "SNOWFLAKE_POOL_ACQUIRE_TIMEOUT_MS";
    public static final String QUERY_TIMEOUT_SECONDS = "SNOWFLAKE_QUERY_TIMEOUT_SECONDS";
    public static final String MAX_ROWS = "SNOWFLAKE_MAX_ROWS";
    public static final String CORTEX_TIMEOUT_MS = "CORTEX_REQUEST_TIMEOUT_MS";

    private final String account;
    private final String user;
    private final AuthenticationMode authenticationMode;
    private final String password;
    private final String privateKeyFile;
    private final String privateKeyPassphrase;
    private final String host;
    private final SessionParameters defaults;
    private final int minPoolSize;
    private final int maxPoolSize;
    private final long idleTimeoutSeconds;
    private final long acquireTimeoutMillis;
    private final int queryTimeoutSeconds;
    private final int maxRows;
    private final long cortexTimeoutMillis;

    private ConnectionSettings(Builder builder) {
        this.account = builder.account;
        this.user = builder.user;
        this.password = builder.password;
        this.privateKeyFile = builder.privateKeyFile;
        this.privateKeyPassphrase = builder.privateKeyPassphrase;
        this.host = builder.host != null ? builder.host : account + ".snowflakecomputing.com";
        this.defaults = builder.defaults;
        this.minPoolSize = builder.minPoolSize;
        this.maxPoolSize = builder.maxPoolSize;
        this.idleTimeoutSeconds = builder.idleTimeoutSeconds;
        this.acquireTimeoutMillis = builder.acquireTimeoutMillis;
        this.queryTimeoutSeconds = builder.queryTimeoutSeconds;
        this.maxRows = builder.maxRows;
        this.cortexTimeoutMillis = builder.cortexTimeoutMillis;

        if (account == null || user == null) {
            throw new ConfigurationException("Required configuration '" + (account == null ? ACCOUNT : USER) + "' is not set");
        }
        if (password != null && privateKeyFile != null) {
            throw new ConfigurationException(
                "Both " + PASSWORD + " and " + PRIVATE_KEY_FILE + " are set; configure exactly one authentication mode");
        }
        if (password == null && privateKeyFile == null) {
            throw new ConfigurationException(
                "No credentials configured; set " + PASSWORD + " or " + PRIVATE_KEY_FILE);
        }
        if (privateKeyPassphrase != null && privateKeyFile == null) {
            throw new ConfigurationException(PRIVATE_KEY_FILE_PWD + " is set without " + PRIVATE_KEY_FILE);
        }
        this.authenticationMode = password != null ? AuthenticationMode.PASSWORD : AuthenticationMode.KEY_PAIR;

        if (maxPoolSize < 1) {
            throw new ConfigurationException(POOL_MAX_SIZE + " must be at least 1, got " + maxPoolSize);
        }
        if (minPoolSize < 0 || minPoolSize > maxPoolSize) {
            throw new ConfigurationException(
                POOL_MIN_SIZE + " must be between 0 and " + POOL_MAX_SIZE + " (" + maxPoolSize + "), got " + minPoolSize);
        }
        if (acquireTimeoutMillis <= 0 || idleTimeoutSeconds <= 0 || cortexTimeoutMillis <= 0) {
            throw new ConfigurationException("Pool and request timeouts must be positive");
        }
        if (queryTimeoutSeconds < 0 || maxRows < 0) {
            throw new ConfigurationException(QUERY_TIMEOUT_SECONDS + " and " + MAX_ROWS + " must not be negative");
        }
    }

    /**
     * Read settings from system properties first, then environment variables.
     */
    public static ConnectionSettings fromEnvironment() {
        return fromLookup(key -> {
            String value = System.getProperty(key);
            if (value == null || value.trim().isEmpty()) {
                value = System.getenv(key);
            }
            return value;
        });
    }

    public static ConnectionSettings fromLookup(Function<String, String> lookup) {
        Function<String, String> clean = key -> {
            String value = lookup.apply(key);
            return value == null || value.trim().isEmpty() ? null : value.trim();
        };
        Builder builder = builder()
            .account(clean.apply(ACCOUNT))
            .user(clean.apply(USER))
            .password(clean.apply(PASSWORD))
            .privateKeyFile(clean.apply(PRIVATE_KEY_FILE))
            .privateKeyPassphrase(clean.apply(PRIVATE_KEY_FILE_PWD))
            .host(clean.apply(HOST))
            .defaults(new SessionParameters(
                clean.apply(WAREHOUSE), clean.apply(DATABASE), clean.apply(SCHEMA), clean.apply(ROLE), null))
            .minPoolSize(intValue(clean, POOL_MIN_SIZE, 1))
            .maxPoolSize(intValue(clean, POOL_MAX_SIZE, 8))
            .idleTimeoutSeconds(intValue(clean, POOL_IDLE_TIMEOUT_SECONDS, 300))
            .acquireTimeoutMillis(intValue(clean, POOL_ACQUIRE_TIMEOUT_MS, 30_000))
            .queryTimeoutSeconds(intValue(clean, QUERY_TIMEOUT_SECONDS, 120))
            .maxRows(intValue(clean, MAX_ROWS, 10_000))
            .cortexTimeoutMillis(intValue(clean, CORTEX_TIMEOUT_MS, 60_000));
        return builder.build();
    }

    private static int intValue(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: '" + value + "'. Must be a whole number.");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAccount() {
        return account;
    }

    public String getUser() {
        return user;
    }

    public AuthenticationMode getAuthenticationMode() {
        return authenticationMode;
    }

    public String getPassword() {
        return password;
    }

    public String getPrivateKeyFile() {
        return privateKeyFile;
    }

    public String getPrivateKeyPassphrase() {
        return privateKeyPassphrase;
    }

    public String getHost() {
        return host;
    }

    public SessionParameters getDefaults() {
        return defaults;
    }

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public long getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public long getAcquireTimeoutMillis() {
        return acquireTimeoutMillis;
    }

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public long getCortexTimeoutMillis() {
        return cortexTimeoutMillis;
    }

    /**
     * Connection description with secrets removed.
     */
    public JsonObject toRedactedJson() {
        return new JsonObject()
            .put("account", account)
            .put("user", user)
            .put("host", host)
            .put("authenticationMode", authenticationMode.name())
            .put("defaults", defaults.toJson())
            .put("minPoolSize", minPoolSize)
            .put("maxPoolSize", maxPoolSize)
            .put("queryTimeoutSeconds", queryTimeoutSeconds)
            .put("maxRows", maxRows);
    }

    public static final class Builder {
        private String account;
        private String user;
        private String password;
        private String privateKeyFile;
        private String privateKeyPassphrase;
        private String host;
        private SessionParameters defaults = SessionParameters.NONE;
        private int minPoolSize = 1;
        private int maxPoolSize = 8;
        private long idleTimeoutSeconds = 300;
        private long acquireTimeoutMillis = 30_000;
        private int queryTimeoutSeconds = 120;
        private int maxRows = 10_000;
        private long cortexTimeoutMillis = 60_000;

        private Builder() {
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder privateKeyFile(String privateKeyFile) {
            this.privateKeyFile = privateKeyFile;
            return this;
        }

        public Builder privateKeyPassphrase(String privateKeyPassphrase) {
            this.privateKeyPassphrase = privateKeyPassphrase;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder defaults(SessionParameters defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder minPoolSize(int minPoolSize) {
            this.minPoolSize = minPoolSize;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder idleTimeoutSeconds(long idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
            return this;
        }

        public Builder acquireTimeoutMillis(long acquireTimeoutMillis) {
            this.acquireTimeoutMillis = acquireTimeoutMillis;
            return this;
        }

        public Builder queryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
            return this;
        }

        public Builder maxRows(int maxRows) {
            this.maxRows = maxRows;
            return this;
        }

        public Builder cortexTimeoutMillis(long cortexTimeoutMillis) {
            this.cortexTimeoutMillis = cortexTimeoutMillis;
            return this;
        }

        public ConnectionSettings build() {
            return new ConnectionSettings(this);
        }
    }
}
