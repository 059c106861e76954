package warehouse.bridge.session;

/**
 * How the bridge authenticates against the warehouse. Fixed at startup.
 */
public enum AuthenticationMode {
    /** User name plus password or programmatic access token */
    PASSWORD,
    /** User name plus RSA private key, optionally encrypted with a passphrase */
    KEY_PAIR
}
