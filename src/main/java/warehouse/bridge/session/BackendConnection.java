package warehouse.bridge.session;

import java.sql.SQLException;

/**
 * One authenticated connection to the warehouse.
 * Implementations need not be thread-safe apart from {@link #cancel()}, which may be called
 * from another thread while {@link #execute} is running.
 */
public interface BackendConnection extends AutoCloseable {

    /**
     * Apply every non-null parameter; a null query tag unsets the tag.
     */
    void applySessionParameters(SessionParameters parameters) throws SQLException;

    /**
     * Execute one statement.
     * @param timeoutSeconds statement timeout, 0 for none
     * @param maxRows row cap, 0 for none
     */
    QueryResult execute(String statement, int timeoutSeconds, int maxRows) throws SQLException;

    /**
     * Abandon the statement in flight, if any.
     */
    void cancel();

    boolean isValid(int timeoutSeconds);

    @Override
    void close();
}
