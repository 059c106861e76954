package warehouse.bridge.session;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.config.ConnectionSettings;
import warehouse.bridge.dispatch.ErrorKind;
import warehouse.bridge.dispatch.ToolInvocationException;
import warehouse.bridge.services.LogUtil;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of warehouse sessions.
 *
 * <p>A semaphore with <code>maxPoolSize</code> permits bounds the number of leased sessions;
 * idle sessions wait in a deque. A new connection is opened only when no idle session can be
 * re-targeted, so the number of open connections never exceeds the maximum. Every lease
 * re-applies its parameters. Sessions that failed, timed out or were cancelled are closed
 * instead of being returned.</p>
 *
 * <p>All methods are blocking; call them from a worker thread.</p>
 */
public class SessionManager implements AutoCloseable {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final Vertx vertx;
    private final WarehouseBackend backend;
    private final ConnectionSettings settings;
    private final Semaphore leases;
    private final LinkedBlockingDeque<ConnectionSession> idle = new LinkedBlockingDeque<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    private volatile boolean closed;

    public SessionManager(Vertx vertx, WarehouseBackend backend, ConnectionSettings settings) {
        this.vertx = vertx;
        this.backend = backend;
        this.settings = settings;
        this.leases = new Semaphore(settings.getMaxPoolSize(), true);
    }

    /**
     * Open the minimum number of connections up front.
     * @throws ToolInvocationException with {@link ErrorKind#BACKEND_ERROR} if authentication fails
     */
    public void initialize() {
        LogUtil.logInfo(vertx, "Initializing session pool for " + backend.describe()
            + " (min=" + settings.getMinPoolSize() + ", max=" + settings.getMaxPoolSize()
            + ", auth=" + settings.getAuthenticationMode() + ")", "SessionManager", "StartUp", "Database");
        while (openConnections.get() < settings.getMinPoolSize()) {
            idle.offerLast(open());
        }
    }

    /**
     * Lease a session configured with <code>requested</code> merged over the default parameters.
     *
     * @throws ToolInvocationException {@link ErrorKind#RESOURCE_EXHAUSTED} if no session frees up
     *         within the acquire timeout, {@link ErrorKind#BACKEND_ERROR} if a connection cannot be
     *         opened or configured
     */
    public ConnectionSession acquire(SessionParameters requested) {
        if (closed) {
            throw new ToolInvocationException(ErrorKind.RESOURCE_EXHAUSTED, "Session manager is closed");
        }
        SessionParameters effective = requested.withDefaults(settings.getDefaults());

        try {
            if (!leases.tryAcquire(settings.getAcquireTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                LogUtil.logError(vertx, "Session pool exhausted after " + settings.getAcquireTimeoutMillis()
                    + "ms (max=" + settings.getMaxPoolSize() + ")", "SessionManager", "Acquire", "Pool");
                throw new ToolInvocationException(ErrorKind.RESOURCE_EXHAUSTED,
                    "Timed out after " + settings.getAcquireTimeoutMillis() + "ms waiting for a warehouse session; all "
                        + settings.getMaxPoolSize() + " sessions are in use");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(ErrorKind.RESOURCE_EXHAUSTED,
                "Interrupted while waiting for a warehouse session", e);
        }

        ConnectionSession session = null;
        try {
            session = takeIdle(effective);
            if (session == null) {
                session = open();
            }
            session.markLeased();
            session.apply(effective);
            LogUtil.logDebug(vertx, "Leased session " + session.getId() + " with " + effective,
                "SessionManager", "Acquire", "Pool");
            return session;
        } catch (SQLException e) {
            discardAfterFailedLease(session);
            throw ToolInvocationException.backend("Failed to apply session parameters: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            discardAfterFailedLease(session);
            throw e;
        }
    }

    private void discardAfterFailedLease(ConnectionSession session) {
        if (session != null) {
            session.markBroken();
            release(session);
        } else {
            leases.release();
        }
    }

    /**
     * Execute one statement on a leased session. Any failure marks the session broken so that
     * {@link #release} closes it.
     *
     * @throws ToolInvocationException with {@link ErrorKind#BACKEND_ERROR}
     */
    public QueryResult execute(ConnectionSession session, String statement) {
        if (!session.isLeased()) {
            throw new ToolInvocationException(ErrorKind.INTERNAL_ERROR,
                "Session " + session.getId() + " is not leased");
        }
        if (session.isCancelled()) {
            throw ToolInvocationException.backend("Statement was cancelled", null);
        }
        long started = System.currentTimeMillis();
        try {
            QueryResult result = session.execute(statement, settings.getQueryTimeoutSeconds(), settings.getMaxRows());
            LogUtil.logDetail(vertx, "Statement on session " + session.getId() + " completed in "
                + (System.currentTimeMillis() - started) + "ms", "SessionManager", "Execute", "Database");
            return result;
        } catch (SQLTimeoutException e) {
            LogUtil.logError(vertx, "Statement timed out on session " + session.getId(), e,
                "SessionManager", "Execute", "Database");
            throw ToolInvocationException.backend(
                "Statement timed out after " + settings.getQueryTimeoutSeconds() + "s", e);
        } catch (SQLException e) {
            if (session.isCancelled()) {
                throw ToolInvocationException.backend("Statement was cancelled", e);
            }
            LogUtil.logError(vertx, "Statement failed on session " + session.getId(), e,
                "SessionManager", "Execute", "Database");
            throw ToolInvocationException.backend("Statement execution failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            session.markBroken();
            throw ToolInvocationException.backend("Statement execution failed: " + e.getMessage(), e);
        }
    }

    /**
     * Return a session to the pool, or close it if it is broken. Releasing twice is a no-op.
     */
    public void release(ConnectionSession session) {
        if (!session.markReturned()) {
            LogUtil.logDebug(vertx, "Ignoring release of session " + session.getId() + " that is not leased",
                "SessionManager", "Release", "Pool");
            return;
        }
        try {
            if (session.isBroken() || closed) {
                closeSession(session);
                LogUtil.logDetail(vertx, "Discarded session " + session.getId(), "SessionManager", "Release", "Pool");
            } else {
                idle.offerFirst(session);
            }
        } finally {
            leases.release();
        }
    }

    /**
     * Close a leased session instead of returning it.
     */
    public void discard(ConnectionSession session) {
        session.markBroken();
        release(session);
    }

    /**
     * Close idle sessions unused for longer than the idle timeout, keeping the minimum size.
     * @return number of sessions closed
     */
    public int evictIdle() {
        long cutoff = System.currentTimeMillis() - settings.getIdleTimeoutSeconds() * 1000L;
        int evicted = 0;
        Iterator<ConnectionSession> iterator = idle.descendingIterator();
        while (iterator.hasNext() && openConnections.get() > settings.getMinPoolSize()) {
            ConnectionSession session = iterator.next();
            if (session.getLastReleasedAt() < cutoff && idle.removeFirstOccurrence(session)) {
                closeSession(session);
                evicted++;
            }
        }
        if (evicted > 0) {
            LogUtil.logDetail(vertx, "Evicted " + evicted + " idle sessions", "SessionManager", "Evict", "Pool");
        }
        return evicted;
    }

    public JsonObject statistics() {
        int open = openConnections.get();
        int idleCount = idle.size();
        return new JsonObject()
            .put("authenticationMode", settings.getAuthenticationMode().name())
            .put("minPoolSize", settings.getMinPoolSize())
            .put("maxPoolSize", settings.getMaxPoolSize())
            .put("openConnections", open)
            .put("idleConnections", idleCount)
            .put("leasedConnections", settings.getMaxPoolSize() - leases.availablePermits())
            .put("closed", closed);
    }

    public ConnectionSettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        closed = true;
        List<ConnectionSession> drained = new ArrayList<>();
        idle.drainTo(drained);
        drained.forEach(this::closeSession);
        LogUtil.logInfo(vertx, "Session pool closed (" + drained.size() + " idle sessions closed)",
            "SessionManager", "Shutdown", "Pool");
    }

    // Take an idle session that can carry the requested parameters; close the ones that cannot
    private ConnectionSession takeIdle(SessionParameters effective) {
        long cutoff = System.currentTimeMillis() - settings.getIdleTimeoutSeconds() * 1000L;
        ConnectionSession candidate;
        while ((candidate = idle.pollFirst()) != null) {
            if (candidate.getLastReleasedAt() < cutoff) {
                closeSession(candidate);
            } else if (!candidate.getAppliedParameters().canBeRetargetedTo(effective)) {
                LogUtil.logDebug(vertx, "Session " + candidate.getId() + " carries " + candidate.getAppliedParameters()
                    + " which cannot be reset to " + effective + "; replacing it", "SessionManager", "Acquire", "Pool");
                closeSession(candidate);
            } else if (!candidate.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                closeSession(candidate);
            } else {
                return candidate;
            }
        }
        return null;
    }

    private ConnectionSession open() {
        try {
            BackendConnection connection = backend.authenticate();
            openConnections.incrementAndGet();
            ConnectionSession session = new ConnectionSession(connection, settings.getDefaults());
            LogUtil.logDetail(vertx, "Opened session " + session.getId() + " (" + openConnections.get() + " open)",
                "SessionManager", "Open", "Pool");
            return session;
        } catch (SQLException e) {
            LogUtil.logError(vertx, "Authentication against " + backend.describe() + " failed", e,
                "SessionManager", "Open", "Database");
            throw ToolInvocationException.backend("Could not open a warehouse connection: " + e.getMessage(), e);
        }
    }

    private void closeSession(ConnectionSession session) {
        session.closeQuietly();
        openConnections.decrementAndGet();
    }
}
