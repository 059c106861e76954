package warehouse.bridge.dispatch;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import warehouse.bridge.catalog.AnalystServiceDefinition;
import warehouse.bridge.catalog.SearchServiceDefinition;
import warehouse.bridge.catalog.ServiceCatalog;
import warehouse.bridge.catalog.ServiceDefinition;
import warehouse.bridge.mcp.base.MCPTool;
import warehouse.bridge.policy.PermissionPolicy;
import warehouse.bridge.policy.StatementCategory;
import warehouse.bridge.policy.StatementClassifier;
import warehouse.bridge.services.CortexAPIService;
import warehouse.bridge.services.LogUtil;
import warehouse.bridge.session.ConnectionSession;
import warehouse.bridge.session.QueryResult;
import warehouse.bridge.session.SessionManager;
import warehouse.bridge.session.SessionParameters;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves named tool calls against the catalog and runs them.
 *
 * <p>Every SQL-producing tool funnels into one gate: the text must be a single statement, its
 * category must be permitted by the policy, and only then is a session leased. Search and analyst
 * tools call Cortex directly. Whatever happens, {@link #invoke} completes with a
 * {@link ToolInvocationResult}; its future never fails.</p>
 */
public class ToolDispatcher {

    // Statements that can leave state behind on the connection; their session is not pooled again
    private static final Set<StatementCategory> SESSION_ALTERING = EnumSet.of(
        StatementCategory.USE, StatementCategory.ALTER, StatementCategory.COMMAND,
        StatementCategory.TRANSACTION, StatementCategory.UNKNOWN);

    private final Vertx vertx;
    private final ServiceCatalog catalog;
    private final PermissionPolicy policy;
    private final StatementClassifier classifier;
    private final SessionManager sessionManager;
    private final CortexAPIService cortex;
    private final ObjectStatementBuilder objectStatements;
    private final SemanticStatementBuilder semanticStatements;
    private final Map<String, ConnectionSession> inFlight = new ConcurrentHashMap<>();

    public ToolDispatcher(Vertx vertx, ServiceCatalog catalog, PermissionPolicy policy, StatementClassifier classifier,
                          SessionManager sessionManager, CortexAPIService cortex) {
        this.vertx = vertx;
        this.catalog = catalog;
        this.policy = policy;
        this.classifier = classifier;
        this.sessionManager = sessionManager;
        this.cortex = cortex;
        this.objectStatements = new ObjectStatementBuilder(classifier);
        this.semanticStatements = new SemanticStatementBuilder();
    }

    public List<MCPTool> tools() {
        return catalog.tools();
    }

    public Future<ToolInvocationResult> invoke(ToolInvocationRequest request) {
        long started = System.currentTimeMillis();
        Future<JsonObject> outcome;
        try {
            ServiceDefinition definition = catalog.resolve(request.getToolName());
            ParameterValidator.validate(catalog.getTool(request.getToolName()), request.getArguments());
            outcome = dispatch(definition, request);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }

        return outcome
            .map(payload -> {
                long elapsed = System.currentTimeMillis() - started;
                LogUtil.logDetail(vertx, "Tool " + request.getToolName() + " (" + request.getRequestId()
                    + ") succeeded in " + elapsed + "ms", "ToolDispatcher", "Invoke", "Tool");
                return ToolInvocationResult.success(request, payload, elapsed);
            })
            .otherwise(error -> toFailure(request, error, System.currentTimeMillis() - started));
    }

    private Future<JsonObject> dispatch(ServiceDefinition definition, ToolInvocationRequest request) {
        JsonObject arguments = request.getArguments();
        switch (definition.getKind()) {
            case SEARCH:
                return search((SearchServiceDefinition) definition, arguments);
            case ANALYST:
                return cortex.analyze((AnalystServiceDefinition) definition, arguments.getString("query"));
            case QUERY_MANAGER:
                return runGated(request, request.getStatement(),
                    ParameterValidator.intArgument(arguments, "limit", 0));
            case OBJECT_MANAGER:
                return runGated(request, objectStatements.build(request.getToolName(), arguments), 0);
            case SEMANTIC_MANAGER:
                return runGated(request, semanticStatements.build(request.getToolName(), arguments), 0);
            default:
                throw new ToolInvocationException(ErrorKind.INTERNAL_ERROR,
                    "No handler for service kind " + definition.getKind());
        }
    }

    private Future<JsonObject> search(SearchServiceDefinition service, JsonObject arguments) {
        List<String> columns = new ArrayList<>();
        JsonArray requested = arguments.getJsonArray("columns");
        if (requested != null) {
            for (int i = 0; i < requested.size(); i++) {
                columns.add(requested.getString(i));
            }
        }
        int limit = ParameterValidator.intArgument(arguments, "limit", service.getLimit());
        return cortex.search(service, arguments.getString("query"), columns, arguments.getJsonObject("filter"), limit);
    }

    private Future<JsonObject> runGated(ToolInvocationRequest request, String sql, int rowLimit) {
        return vertx.executeBlocking(() -> executeGated(request, sql, rowLimit), false);
    }

    /**
     * Split, classify, check the policy, then lease a session and execute. Runs on a worker thread.
     */
    JsonObject executeGated(ToolInvocationRequest request, String sql, int rowLimit) {
        List<String> statements = classifier.split(sql);
        if (statements.isEmpty()) {
            throw ToolInvocationException.validation("Statement is empty");
        }
        if (statements.size() > 1) {
            throw ToolInvocationException.validation("Exactly one statement per call is allowed, got "
                + statements.size());
        }
        String statement = statements.get(0);
        StatementCategory category = classifier.classify(statement);
        if (!policy.isAllowed(category)) {
            LogUtil.logInfo(vertx, "Denied " + category + " statement for tool " + request.getToolName()
                + " (" + request.getRequestId() + ")", "ToolDispatcher", "Policy", "Security");
            throw ToolInvocationException.policyDenied(category);
        }
        if (rowLimit > 0 && category == StatementCategory.SELECT) {
            statement = withRowLimit(statement, rowLimit);
        }

        SessionParameters parameters = SessionParameters.fromArguments(request.getArguments());
        if (parameters.getQueryTag() == null) {
            parameters = parameters.withQueryTag(defaultQueryTag(request.getToolName()));
        }

        ConnectionSession session = sessionManager.acquire(parameters);
        inFlight.put(request.getRequestId(), session);
        try {
            LogUtil.logDebug(vertx, "Executing " + category + " on session " + session.getId() + " for "
                + request.getRequestId(), "ToolDispatcher", "Execute", "Database");
            QueryResult result = sessionManager.execute(session, statement);
            return result.toJson()
                .put("category", category.getConfigName())
                .put("statement", statement);
        } finally {
            inFlight.remove(request.getRequestId(), session);
            if (SESSION_ALTERING.contains(category)) {
                LogUtil.logDebug(vertx, "Discarding session " + session.getId() + " after " + category + " statement",
                    "ToolDispatcher", "Execute", "Pool");
                sessionManager.discard(session);
            } else {
                sessionManager.release(session);
            }
        }
    }

    /**
     * Wrap a query so the row limit applies to its outer result. The closing parenthesis goes on
     * its own line so a trailing line comment cannot swallow it.
     */
    static String withRowLimit(String statement, int rowLimit) {
        return "SELECT * FROM (\n" + statement + "\n) LIMIT " + rowLimit;
    }

    static String defaultQueryTag(String toolName) {
        return new JsonObject().put("origin", "warehouse-bridge").put("tool", toolName).encode();
    }

    /**
     * Abandon the backend statement of an in-flight invocation. Its session is discarded.
     * @return whether a running statement was found
     */
    public boolean cancel(String requestId) {
        ConnectionSession session = inFlight.get(requestId);
        if (session == null) {
            return false;
        }
        LogUtil.logInfo(vertx, "Cancelling " + requestId + " on session " + session.getId(),
            "ToolDispatcher", "Cancel", "Database");
        session.cancel();
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private ToolInvocationResult toFailure(ToolInvocationRequest request, Throwable error, long elapsed) {
        if (error instanceof ToolInvocationException) {
            ToolInvocationException failure = (ToolInvocationException) error;
            LogUtil.logDetail(vertx, "Tool " + request.getToolName() + " (" + request.getRequestId() + ") failed with "
                + failure.getKind() + ": " + failure.getMessage(), "ToolDispatcher", "Invoke", "Tool");
            return ToolInvocationResult.failure(request, failure, elapsed);
        }
        LogUtil.logError(vertx, "Unexpected failure in tool " + request.getToolName(), error,
            "ToolDispatcher", "Invoke", "Tool");
        return ToolInvocationResult.failure(request, ErrorKind.INTERNAL_ERROR,
            "Unexpected error: " + error.getMessage(), null, elapsed);
    }
}
