package warehouse.bridge.session;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConnectionSettings;
import warehouse.bridge.dispatch.SqlIdentifiers;
import warehouse.bridge.services.LogUtil;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Snowflake JDBC backend. Authenticates with a password/token or an RSA key pair and opens
 * each connection with the default warehouse, database, schema and role.
 */
public class SnowflakeBackend implements WarehouseBackend {

    private static final String DRIVER_CLASS = "net.snowflake.client.jdbc.SnowflakeDriver";

    private final Vertx vertx;
    private final ConnectionSettings settings;
    private final KeyPairCredentials keyPair;
    private final String jdbcUrl;

    public SnowflakeBackend(Vertx vertx, ConnectionSettings settings, KeyPairCredentials keyPair) {
        this.vertx = vertx;
        this.settings = settings;
        this.keyPair = keyPair;
        this.jdbcUrl = "jdbc:snowflake://" + settings.getHost() + "/";

        try {
            Class.forName(DRIVER_CLASS);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Snowflake JDBC driver not found", e);
        }
    }

    @Override
    public BackendConnection authenticate() throws SQLException {
        Properties props = new Properties();
        props.put("user", settings.getUser());
        props.put("account", settings.getAccount());
        if (settings.getAuthenticationMode() == AuthenticationMode.KEY_PAIR) {
            props.put("privateKey", keyPair.getPrivateKey());
        } else {
            props.put("password", settings.getPassword());
        }

        SessionParameters defaults = settings.getDefaults();
        putIfPresent(props, "warehouse", defaults.getWarehouse());
        putIfPresent(props, "db", defaults.getDatabase());
        putIfPresent(props, "schema", defaults.getSchema());
        putIfPresent(props, "role", defaults.getRole());

        props.put("application", "warehouse_mcp_bridge");
        // Arrow results need --add-opens on JDK 17; JSON does not
        props.put("JDBC_QUERY_RESULT_FORMAT", "JSON");
        props.put("CLIENT_SESSION_KEEP_ALIVE", "true");
        props.put("loginTimeout", "30");

        LogUtil.logDetail(vertx, "Opening Snowflake connection to " + settings.getHost() + " as " + settings.getUser()
            + " (" + settings.getAuthenticationMode() + ")", "SnowflakeBackend", "Connection", "Attempt");
        return new JdbcBackendConnection(vertx, DriverManager.getConnection(jdbcUrl, props));
    }

    private static void putIfPresent(Properties props, String key, String value) {
        if (value != null) {
            props.put(key, value);
        }
    }

    @Override
    public String describe() {
        return settings.getAccount() + " (" + settings.getHost() + ") as " + settings.getUser();
    }

    /**
     * One JDBC connection. The statement in flight is remembered so it can be cancelled.
     */
    static final class JdbcBackendConnection implements BackendConnection {

        private final Vertx vertx;
        private final Connection connection;
        private volatile Statement current;

        JdbcBackendConnection(Vertx vertx, Connection connection) {
            this.vertx = vertx;
            this.connection = connection;
        }

        @Override
        public void applySessionParameters(SessionParameters parameters) throws SQLException {
            try (Statement stmt = connection.createStatement()) {
                if (parameters.getRole() != null) {
                    stmt.execute("USE ROLE " + SqlIdentifiers.identifier(parameters.getRole()));
                }
                if (parameters.getWarehouse() != null) {
                    stmt.execute("USE WAREHOUSE " + SqlIdentifiers.identifier(parameters.getWarehouse()));
                }
                if (parameters.getDatabase() != null) {
                    stmt.execute("USE DATABASE " + SqlIdentifiers.identifier(parameters.getDatabase()));
                }
                if (parameters.getSchema() != null) {
                    stmt.execute("USE SCHEMA " + SqlIdentifiers.identifier(parameters.getSchema()));
                }
                if (parameters.getQueryTag() != null) {
                    stmt.execute("ALTER SESSION SET QUERY_TAG = " + SqlIdentifiers.literal(parameters.getQueryTag()));
                } else {
                    stmt.execute("ALTER SESSION UNSET QUERY_TAG");
                }
            }
        }

        @Override
        public QueryResult execute(String statement, int timeoutSeconds, int maxRows) throws SQLException {
            try (Statement stmt = connection.createStatement()) {
                current = stmt;
                if (timeoutSeconds > 0) {
                    stmt.setQueryTimeout(timeoutSeconds);
                }
                if (maxRows > 0) {
                    stmt.setMaxRows(maxRows);
                }
                if (stmt.execute(statement)) {
                    try (ResultSet rs = stmt.getResultSet()) {
                        return toQueryResult(rs);
                    }
                }
                return QueryResult.updateCount(stmt.getLargeUpdateCount());
            } finally {
                current = null;
            }
        }

        @Override
        public void cancel() {
            Statement running = current;
            if (running == null) {
                return;
            }
            try {
                running.cancel();
            } catch (SQLException e) {
                LogUtil.logError(vertx, "Failed to cancel running statement", e, "SnowflakeBackend", "Cancel", "Database");
            }
        }

        @Override
        public boolean isValid(int timeoutSeconds) {
            try {
                return connection.isValid(timeoutSeconds);
            } catch (SQLException e) {
                LogUtil.logDebug(vertx, "Connection validation failed: " + e.getMessage(),
                    "SnowflakeBackend", "Validate", "Database");
                return false;
            }
        }

        @Override
        public void close() {
            try {
                connection.close();
            } catch (SQLException e) {
                LogUtil.logError(vertx, "Failed to close connection", e, "SnowflakeBackend", "Close", "Database");
            }
        }

        private static QueryResult toQueryResult(ResultSet rs) throws SQLException {
            ResultSetMetaData metaData = rs.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<String> labels = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                labels.add(metaData.getColumnLabel(i));
            }
            List<String> columns = uniqueColumnNames(labels);

            JsonArray rows = new JsonArray();
            while (rs.next()) {
                JsonObject row = new JsonObject();
                for (int i = 1; i <= columnCount; i++) {
                    putValue(row, columns.get(i - 1), rs.getObject(i));
                }
                rows.add(row);
            }
            return QueryResult.rows(columns, rows);
        }

        /**
         * Row keys for the given column labels. A repeated label gets a <code>_2</code>,
         * <code>_3</code>... suffix so no value overwrites another.
         */
        static List<String> uniqueColumnNames(List<String> labels) {
            Set<String> taken = new HashSet<>(labels);
            Set<String> used = new HashSet<>();
            List<String> names = new ArrayList<>(labels.size());
            for (String label : labels) {
                String name = label;
                int suffix = 2;
                while (!used.add(name)) {
                    do {
                        name = label + "_" + suffix++;
                    } while (taken.contains(name));
                }
                names.add(name);
            }
            return names;
        }

        static void putValue(JsonObject row, String column, Object value) {
            if (value == null) {
                row.putNull(column);
            } else if (value instanceof BigDecimal) {
                // integral values that fit a long stay numeric; anything else keeps every digit as text
                BigDecimal decimal = (BigDecimal) value;
                BigDecimal integral = decimal.scale() < 0 ? decimal.setScale(0) : decimal;
                if (integral.scale() == 0 && integral.unscaledValue().bitLength() < 64) {
                    row.put(column, integral.longValueExact());
                } else {
                    row.put(column, decimal.toPlainString());
                }
            } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                row.put(column, ((Number) value).longValue());
            } else if (value instanceof Number) {
                row.put(column, ((Number) value).doubleValue());
            } else if (value instanceof Boolean) {
                row.put(column, (Boolean) value);
            } else if (value instanceof Timestamp) {
                row.put(column, ((Timestamp) value).toInstant().toString());
            } else if (value instanceof Date) {
                row.put(column, ((Date) value).toLocalDate().toString());
            } else if (value instanceof Time) {
                row.put(column, ((Time) value).toLocalTime().toString());
            } else if (value instanceof byte[]) {
                row.put(column, (byte[]) value);
            } else {
                row.put(column, value.toString());
            }
        }
    }
}
