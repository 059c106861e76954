package warehouse.bridge.session;

import java.sql.SQLException;

/**
 * Opens authenticated warehouse connections. The credentials are fixed when the backend is
 * built; every connection starts with the default session parameters.
 */
public interface WarehouseBackend {

    BackendConnection authenticate() throws SQLException;

    /**
     * Short description for logs and the connection-info resource. Must not contain secrets.
     */
    String describe();
}
