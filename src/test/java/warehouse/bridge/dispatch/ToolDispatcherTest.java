package warehouse.bridge.dispatch;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import warehouse.bridge.catalog.AnalystServiceDefinition;
import warehouse.bridge.catalog.ManagerToggleDefinition;
import warehouse.bridge.catalog.SearchServiceDefinition;
import warehouse.bridge.catalog.ServiceCatalog;
import warehouse.bridge.catalog.ToolSchemas;
import warehouse.bridge.config.ConnectionSettings;
import warehouse.bridge.policy.PermissionPolicy;
import warehouse.bridge.policy.StatementCategory;
import warehouse.bridge.policy.StatementClassifier;
import warehouse.bridge.services.CortexAPIService;
import warehouse.bridge.session.FakeWarehouseBackend;
import warehouse.bridge.session.SessionManager;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class ToolDispatcherTest {

    private final AtomicInteger cortexCalls = new AtomicInteger();
    private FakeWarehouseBackend backend;
    private SessionManager sessionManager;
    private CortexAPIService cortex;
    private HttpServer cortexServer;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        backend = new FakeWarehouseBackend();
        sessionManager = new SessionManager(vertx, backend, ConnectionSettings.builder()
            .account("test_account")
            .user("bridge")
            .password("secret")
            .minPoolSize(0)
            .maxPoolSize(2)
            .acquireTimeoutMillis(1_000)
            .build());

        ServiceCatalog catalog = ServiceCatalog.of(List.of(
            new SearchServiceDefinition("docs", "Product docs", "DOCS", "PUBLIC", List.of("TITLE", "BODY"), 5),
            AnalystServiceDefinition.of("revenue", "Revenue analyst", "@SALES.ANALYTICS.MODELS/revenue.yaml"),
            AnalystServiceDefinition.of("churn", "Churn analyst", "@SALES.ANALYTICS.MODELS/missing.yaml"),
            ManagerToggleDefinition.queryManager(),
            ManagerToggleDefinition.objectManager(),
            ManagerToggleDefinition.semanticManager()));

        PermissionPolicy policy = PermissionPolicy.of(Map.of(
            StatementCategory.SELECT, true,
            StatementCategory.DESCRIBE, true,
            StatementCategory.CREATE, true,
            StatementCategory.COMMAND, true,
            StatementCategory.USE, true,
            StatementCategory.DROP, false));

        vertx.createHttpServer()
            .requestHandler(this::handleCortex)
            .listen(0)
            .onComplete(testContext.succeeding(server -> {
                cortexServer = server;
                cortex = new CortexAPIService(vertx, "localhost", server.actualPort(), false,
                    CortexAPIService.Credentials.programmaticAccessToken("test-token"), 2_000);
                dispatcher = new ToolDispatcher(vertx, catalog, policy, new StatementClassifier(), sessionManager, cortex);
                testContext.completeNow();
            }));
    }

    @AfterEach
    void tearDown() {
        sessionManager.close();
        cortex.close();
        cortexServer.close();
    }

    private void handleCortex(HttpServerRequest request) {
        cortexCalls.incrementAndGet();
        request.body().onSuccess(buffer -> {
            JsonObject body = buffer.toJsonObject();
            if (request.path().endsWith("/cortex-search-services/docs:query")) {
                request.response().putHeader("content-type", "application/json").end(new JsonObject()
                    .put("results", new JsonArray().add(new JsonObject().put("TITLE", "Refund policy")))
                    .put("request_id", "search-1").encode());
            } else if (request.path().equals("/api/v2/cortex/analyst/message")
                && !body.getString("semantic_model_file", "").contains("missing")) {
                request.response().putHeader("content-type", "application/json").end(new JsonObject()
                    .put("message", new JsonObject().put("content", new JsonArray()
                        .add(new JsonObject().put("type", "text").put("text", "Revenue by quarter"))
                        .add(new JsonObject().put("type", "sql").put("statement", "SELECT 1"))))
                    .put("request_id", "analyst-1").encode());
            } else {
                request.response().setStatusCode(404).end(new JsonObject().put("message", "not found").encode());
            }
        });
    }

    private Future<ToolInvocationResult> invoke(String tool, JsonObject arguments) {
        return dispatcher.invoke(ToolInvocationRequest.of(tool, arguments));
    }

    private static JsonObject query(String statement) {
        return new JsonObject().put("statement", statement);
    }

    @Test
    @DisplayName("A permitted SELECT runs and returns rows")
    void testPermittedSelect(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT 1")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertEquals("Select", result.getPayload().getString("category"));
                assertEquals(1, result.getPayload().getInteger("rowCount"));
                assertEquals(List.of("SELECT 1"), backend.executed);
                assertEquals(0, dispatcher.inFlightCount());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A denied statement never reaches the backend")
    void testDeniedDropNeverReachesBackend(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("DROP TABLE X")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertFalse(result.isSuccess());
                assertEquals(ErrorKind.POLICY_DENIED, result.getErrorKind());
                assertEquals(StatementCategory.DROP, result.getCategory());
                assertEquals("Drop", result.errorDescriptor().getString("category"));
                assertEquals(0, backend.executeCount());
                assertEquals(0, backend.authentications.get());
                testContext.completeNow();
            })));
    }

    @Test
    void testUnknownCategoryIsDenied(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("FROBNICATE ALL THE THINGS")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.POLICY_DENIED, result.getErrorKind());
                assertEquals(StatementCategory.UNKNOWN, result.getCategory());
                assertEquals(0, backend.executeCount());
                testContext.completeNow();
            })));
    }

    @Test
    void testMultipleStatementsAreRejected(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT 1; SELECT 2")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.VALIDATION_ERROR, result.getErrorKind());
                assertTrue(result.getErrorMessage().contains("got 2"));
                assertEquals(0, backend.executeCount());
                testContext.completeNow();
            })));
    }

    @Test
    void testCommentOnlyStatementIsEmpty(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("-- nothing to run")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.VALIDATION_ERROR, result.getErrorKind());
                assertEquals("Statement is empty", result.getErrorMessage());
                testContext.completeNow();
            })));
    }

    @Test
    void testUnknownTool(VertxTestContext testContext) {
        invoke("drop_everything", new JsonObject()).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
                assertTrue(result.toMcpResult().getBoolean("isError"));
                testContext.completeNow();
            })));
    }

    @Test
    void testRowLimitWrapsSelect(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT * FROM ORDERS").put("limit", 10))
            .compose(first -> invoke(ToolSchemas.RUN_QUERY, query("SELECT * FROM ORDERS LIMIT 3").put("limit", 10)))
            .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
                assertEquals(List.of(
                    "SELECT * FROM (\nSELECT * FROM ORDERS\n) LIMIT 10",
                    "SELECT * FROM (\nSELECT * FROM ORDERS LIMIT 3\n) LIMIT 10"), backend.executed);
                assertEquals("SELECT * FROM (\nSELECT * FROM ORDERS LIMIT 3\n) LIMIT 10",
                    second.getPayload().getString("statement"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A trailing line comment never swallows the row limit")
    void testRowLimitAfterTrailingComment(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT * FROM ORDERS -- every order").put("limit", 5))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertEquals(List.of("SELECT * FROM (\nSELECT * FROM ORDERS -- every order\n) LIMIT 5"),
                    backend.executed);
                testContext.completeNow();
            })));
    }

    @Test
    void testRowLimitIgnoredForOtherCategories(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("DESCRIBE TABLE ORDERS").put("limit", 5))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(List.of("DESCRIBE TABLE ORDERS"), backend.executed);
                testContext.completeNow();
            })));
    }

    @Test
    void testOversizedRowLimitIsRejected(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT * FROM ORDERS").put("limit", 4_294_967_296L))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(ErrorKind.VALIDATION_ERROR, result.getErrorKind());
                assertEquals(0, backend.executeCount());
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("A statement that changes session state retires its session")
    void testSessionStateNeverLeaks(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("USE SCHEMA STAGING"))
            .compose(first -> {
                assertTrue(first.isSuccess(), String.valueOf(first.errorDescriptor()));
                return invoke(ToolSchemas.RUN_QUERY, query("SELECT 1"));
            })
            .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
                assertTrue(second.isSuccess(), String.valueOf(second.errorDescriptor()));
                assertEquals(List.of("USE SCHEMA STAGING", "SELECT 1"), backend.executed);
                assertEquals(2, backend.connections.size());
                assertTrue(backend.connections.get(0).closed);
                assertFalse(backend.connections.get(1).closed);
                assertEquals(1, sessionManager.statistics().getInteger("idleConnections"));
                testContext.completeNow();
            })));
    }

    @Test
    void testSessionArgumentsAndDefaultQueryTag(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT 1").put("warehouse", "ADHOC_WH").put("schema", "PUBLIC")
            .put("database", "SALES"))
            .compose(first -> invoke(ToolSchemas.RUN_QUERY, query("SELECT 2").put("query_tag", "nightly-report")))
            .onComplete(testContext.succeeding(second -> testContext.verify(() -> {
                assertEquals(2, backend.connections.size());
                FakeWarehouseBackend.FakeConnection first = backend.connections.get(0);
                assertEquals("ADHOC_WH", first.applied.get(0).getWarehouse());
                assertEquals(ToolDispatcher.defaultQueryTag(ToolSchemas.RUN_QUERY), first.applied.get(0).getQueryTag());
                assertEquals("nightly-report", backend.connections.get(1).lastApplied().getQueryTag());
                assertNull(backend.connections.get(1).lastApplied().getSchema());
                testContext.completeNow();
            })));
    }

    @Test
    void testBackendFailureIsReported(VertxTestContext testContext) {
        invoke(ToolSchemas.RUN_QUERY, query("SELECT FAIL")).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.BACKEND_ERROR, result.getErrorKind());
                assertTrue(backend.connections.get(0).closed);
                assertEquals(0, sessionManager.statistics().getInteger("leasedConnections"));
                testContext.completeNow();
            })));
    }

    @Test
    void testCreateObjectIsGatedAsCreate(VertxTestContext testContext) {
        JsonObject table = new JsonObject()
            .put("object_type", "table")
            .put("database_name", "SALES")
            .put("schema_name", "PUBLIC")
            .put("name", "ORDERS")
            .put("columns", new JsonArray().add(new JsonObject().put("name", "ID").put("type", "NUMBER")));

        invoke(ToolSchemas.CREATE_OBJECT, table).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertEquals("Create", result.getPayload().getString("category"));
                assertTrue(backend.executed.get(0).startsWith("CREATE TABLE SALES.PUBLIC.ORDERS"));
                testContext.completeNow();
            })));
    }

    @Test
    void testDropObjectIsGatedAsDrop(VertxTestContext testContext) {
        JsonObject drop = new JsonObject().put("object_type", "warehouse").put("name", "REPORTING_WH");
        invoke(ToolSchemas.DROP_OBJECT, drop).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertEquals(ErrorKind.POLICY_DENIED, result.getErrorKind());
                assertEquals(0, backend.executeCount());
                testContext.completeNow();
            })));
    }

    @Test
    void testSemanticQuery(VertxTestContext testContext) {
        JsonObject args = new JsonObject()
            .put("database_name", "SALES")
            .put("schema_name", "ANALYTICS")
            .put("view_name", "REVENUE")
            .put("metrics", new JsonArray().add("orders.total"));
        invoke(ToolSchemas.QUERY_SEMANTIC_VIEW, args).onComplete(testContext.succeeding(result ->
            testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertTrue(backend.executed.get(0).startsWith("SELECT * FROM SEMANTIC_VIEW("));
                testContext.completeNow();
            })));
    }

    @Test
    void testInvalidArgumentsNeverReachServices(VertxTestContext testContext) {
        invoke("docs", new JsonObject().put("query", "refunds").put("limit", 6))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(ErrorKind.VALIDATION_ERROR, result.getErrorKind());
                assertEquals(0, cortexCalls.get());
                testContext.completeNow();
            })));
    }

    @Test
    void testSearch(VertxTestContext testContext) {
        invoke("docs", new JsonObject().put("query", "refunds").put("columns", new JsonArray().add("TITLE")))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertEquals(1, result.getPayload().getInteger("resultCount"));
                assertEquals("Refund policy", result.getPayload().getJsonArray("results").getJsonObject(0).getString("TITLE"));
                assertEquals(0, backend.executeCount());
                testContext.completeNow();
            })));
    }

    @Test
    void testAnalyst(VertxTestContext testContext) {
        invoke("revenue", new JsonObject().put("query", "Revenue by quarter?"))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertTrue(result.isSuccess(), String.valueOf(result.errorDescriptor()));
                assertEquals("SELECT 1", result.getPayload().getString("sql"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("An analyst whose semantic model does not resolve yields NotFound")
    void testAnalystMissingModel(VertxTestContext testContext) {
        invoke("churn", new JsonObject().put("query", "Who churned?"))
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
                assertTrue(result.getErrorMessage().contains("missing.yaml"));
                testContext.completeNow();
            })));
    }

    @Test
    void testCancelInFlightStatement(VertxTestContext testContext) throws InterruptedException {
        ToolInvocationRequest request = new ToolInvocationRequest("call-7", ToolSchemas.RUN_QUERY, query("CALL BLOCK()"));
        Future<ToolInvocationResult> running = dispatcher.invoke(request);

        assertTrue(backend.blocked.await(5, TimeUnit.SECONDS));
        assertEquals(1, dispatcher.inFlightCount());
        assertFalse(dispatcher.cancel("call-8"));
        assertTrue(dispatcher.cancel("call-7"));

        running.onComplete(testContext.succeeding(result -> testContext.verify(() -> {
            assertEquals(ErrorKind.BACKEND_ERROR, result.getErrorKind());
            assertEquals("Statement was cancelled", result.getErrorMessage());
            assertEquals("call-7", result.getRequestId());
            assertEquals(0, dispatcher.inFlightCount());
            assertTrue(backend.connections.get(0).closed);
            testContext.completeNow();
        })));
    }
}
