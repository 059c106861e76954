package warehouse.bridge.config;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import warehouse.bridge.session.AuthenticationMode;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionSettingsTest {

    private static Map<String, String> baseEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put(ConnectionSettings.ACCOUNT, "myorg-acct");
        env.put(ConnectionSettings.USER, "BRIDGE");
        return env;
    }

    @Test
    void testPasswordModeWithDefaults() {
        Map<String, String> env = baseEnvironment();
        env.put(ConnectionSettings.PASSWORD, "hunter2");
        env.put(ConnectionSettings.WAREHOUSE, "COMPUTE_WH");
        env.put(ConnectionSettings.SCHEMA, "  ");

        ConnectionSettings settings = ConnectionSettings.fromLookup(env::get);

        assertEquals(AuthenticationMode.PASSWORD, settings.getAuthenticationMode());
        assertEquals("myorg-acct.snowflakecomputing.com", settings.getHost());
        assertEquals("COMPUTE_WH", settings.getDefaults().getWarehouse());
        assertNull(settings.getDefaults().getSchema());
        assertEquals(1, settings.getMinPoolSize());
        assertEquals(8, settings.getMaxPoolSize());
        assertEquals(30_000, settings.getAcquireTimeoutMillis());
    }

    @Test
    void testKeyPairMode() {
        Map<String, String> env = baseEnvironment();
        env.put(ConnectionSettings.PRIVATE_KEY_FILE, "/keys/rsa_key.p8");
        env.put(ConnectionSettings.PRIVATE_KEY_FILE_PWD, "pass");
        env.put(ConnectionSettings.HOST, "myorg-acct.privatelink.snowflakecomputing.com");

        ConnectionSettings settings = ConnectionSettings.fromLookup(env::get);

        assertEquals(AuthenticationMode.KEY_PAIR, settings.getAuthenticationMode());
        assertEquals("/keys/rsa_key.p8", settings.getPrivateKeyFile());
        assertEquals("myorg-acct.privatelink.snowflakecomputing.com", settings.getHost());
    }

    @Test
    void testExactlyOneCredentialIsRequired() {
        Map<String, String> none = baseEnvironment();
        assertThrows(ConfigurationException.class, () -> ConnectionSettings.fromLookup(none::get));

        Map<String, String> both = baseEnvironment();
        both.put(ConnectionSettings.PASSWORD, "x");
        both.put(ConnectionSettings.PRIVATE_KEY_FILE, "/k.p8");
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> ConnectionSettings.fromLookup(both::get));
        assertTrue(e.getMessage().contains("exactly one"));

        Map<String, String> orphanPassphrase = baseEnvironment();
        orphanPassphrase.put(ConnectionSettings.PASSWORD, "x");
        orphanPassphrase.put(ConnectionSettings.PRIVATE_KEY_FILE_PWD, "pass");
        assertThrows(ConfigurationException.class, () -> ConnectionSettings.fromLookup(orphanPassphrase::get));
    }

    @Test
    void testMissingAccountFailsFast() {
        Map<String, String> env = new HashMap<>();
        env.put(ConnectionSettings.USER, "BRIDGE");
        env.put(ConnectionSettings.PASSWORD, "x");

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> ConnectionSettings.fromLookup(env::get));
        assertTrue(e.getMessage().contains(ConnectionSettings.ACCOUNT));
    }

    @Test
    void testInvalidPoolSettings() {
        Map<String, String> env = baseEnvironment();
        env.put(ConnectionSettings.PASSWORD, "x");
        env.put(ConnectionSettings.POOL_MAX_SIZE, "many");
        assertThrows(ConfigurationException.class, () -> ConnectionSettings.fromLookup(env::get));

        env.put(ConnectionSettings.POOL_MAX_SIZE, "2");
        env.put(ConnectionSettings.POOL_MIN_SIZE, "3");
        assertThrows(ConfigurationException.class, () -> ConnectionSettings.fromLookup(env::get));

        env.put(ConnectionSettings.POOL_MIN_SIZE, "0");
        env.put(ConnectionSettings.POOL_MAX_SIZE, "0");
        assertThrows(ConfigurationException.class, () -> ConnectionSettings.fromLookup(env::get));
    }

    @Test
    void testRedactedJsonHasNoSecrets() {
        Map<String, String> env = baseEnvironment();
        env.put(ConnectionSettings.PASSWORD, "hunter2");

        JsonObject json = ConnectionSettings.fromLookup(env::get).toRedactedJson();

        assertEquals("myorg-acct", json.getString("account"));
        assertEquals("PASSWORD", json.getString("authenticationMode"));
        assertFalse(json.encode().contains("hunter2"));
    }
}
