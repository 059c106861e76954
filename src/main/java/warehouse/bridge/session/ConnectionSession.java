package warehouse.bridge.session;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A pooled backend connection leased to exactly one invocation at a time.
 * Tracks the parameters last applied to it and whether it may go back to the pool.
 */
public final class ConnectionSession {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final BackendConnection connection;
    private final AtomicBoolean leased = new AtomicBoolean(false);
    private volatile SessionParameters appliedParameters;
    private volatile boolean broken;
    private volatile boolean cancelled;
    private volatile long lastReleasedAt;

    ConnectionSession(BackendConnection connection, SessionParameters initialParameters) {
        this.id = SEQUENCE.incrementAndGet();
        this.connection = connection;
        this.appliedParameters = initialParameters;
        this.lastReleasedAt = System.currentTimeMillis();
    }

    void apply(SessionParameters parameters) throws SQLException {
        try {
            connection.applySessionParameters(parameters);
        } catch (SQLException | RuntimeException e) {
            broken = true;
            throw e;
        }
        appliedParameters = parameters;
    }

    QueryResult execute(String statement, int timeoutSeconds, int maxRows) throws SQLException {
        try {
            return connection.execute(statement, timeoutSeconds, maxRows);
        } catch (SQLException | RuntimeException e) {
            broken = true;
            throw e;
        }
    }

    /**
     * Abandon the statement in flight. The session is never reused afterwards.
     */
    public void cancel() {
        cancelled = true;
        broken = true;
        connection.cancel();
    }

    boolean markLeased() {
        return leased.compareAndSet(false, true);
    }

    boolean markReturned() {
        if (leased.compareAndSet(true, false)) {
            lastReleasedAt = System.currentTimeMillis();
            return true;
        }
        return false;
    }

    void markBroken() {
        broken = true;
    }

    void closeQuietly() {
        connection.close();
    }

    boolean isValid(int timeoutSeconds) {
        return !broken && connection.isValid(timeoutSeconds);
    }

    public long getId() {
        return id;
    }

    public SessionParameters getAppliedParameters() {
        return appliedParameters;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isLeased() {
        return leased.get();
    }

    long getLastReleasedAt() {
        return lastReleasedAt;
    }

    @Override
    public String toString() {
        return "ConnectionSession{id=" + id + ", broken=" + broken + ", parameters=" + appliedParameters + "}";
    }
}
