package warehouse.bridge.services;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import warehouse.bridge.catalog.AnalystServiceDefinition;
import warehouse.bridge.catalog.SearchServiceDefinition;
import warehouse.bridge.dispatch.ErrorKind;
import warehouse.bridge.dispatch.ToolInvocationException;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class CortexAPIServiceTest {

    private static final SearchServiceDefinition DOCS =
        new SearchServiceDefinition("docs", "Product docs", "DOCS", "PUBLIC", List.of("TITLE"), 10);

    private final AtomicReference<HttpServerRequest> lastRequest = new AtomicReference<>();
    private final AtomicReference<JsonObject> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile JsonObject reply = new JsonObject();
    private volatile boolean silent;
    private HttpServer server;
    private CortexAPIService cortex;

    @BeforeEach
    void setUp(Vertx vertx, VertxTestContext testContext) {
        vertx.createHttpServer()
            .requestHandler(request -> request.body().onSuccess(buffer -> {
                lastRequest.set(request);
                lastBody.set(buffer.toJsonObject());
                if (silent) {
                    return;
                }
                request.response()
                    .setStatusCode(status)
                    .putHeader("content-type", "application/json")
                    .end(reply.encode());
            }))
            .listen(0)
            .onComplete(testContext.succeeding(started -> {
                server = started;
                cortex = new CortexAPIService(vertx, "localhost", started.actualPort(), false,
                    CortexAPIService.Credentials.programmaticAccessToken("pat-123"), 500);
                testContext.completeNow();
            }));
    }

    @AfterEach
    void tearDown() {
        cortex.close();
        server.close();
    }

    @Test
    void testSearchSendsQueryAndReturnsResults(VertxTestContext testContext) {
        reply = new JsonObject()
            .put("results", new JsonArray().add(new JsonObject().put("TITLE", "Refunds")).add(new JsonObject().put("TITLE", "Returns")))
            .put("request_id", "req-42");

        cortex.search(DOCS, "refund window", List.of("TITLE"), new JsonObject().put("@eq", new JsonObject().put("LANG", "en")), 3)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                HttpServerRequest request = lastRequest.get();
                assertEquals("/api/v2/databases/DOCS/schemas/PUBLIC/cortex-search-services/docs:query", request.path());
                assertEquals("Bearer pat-123", request.getHeader("Authorization"));
                assertEquals("PROGRAMMATIC_ACCESS_TOKEN", request.getHeader("X-Snowflake-Authorization-Token-Type"));

                JsonObject body = lastBody.get();
                assertEquals("refund window", body.getString("query"));
                assertEquals(3, body.getInteger("limit"));
                assertEquals(new JsonArray().add("TITLE"), body.getJsonArray("columns"));
                assertTrue(body.containsKey("filter"));

                assertEquals(2, result.getInteger("resultCount"));
                assertEquals("req-42", result.getString("requestId"));
                assertEquals("docs", result.getString("service"));
                testContext.completeNow();
            })));
    }

    @Test
    void testSearchOmitsEmptyColumnsAndFilter(VertxTestContext testContext) {
        reply = new JsonObject().put("results", new JsonArray());

        cortex.search(DOCS, "anything", List.of(), null, 10)
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertFalse(lastBody.get().containsKey("columns"));
                assertFalse(lastBody.get().containsKey("filter"));
                assertEquals(0, result.getInteger("resultCount"));
                testContext.completeNow();
            })));
    }

    @Test
    void testAnalystSendsStageFileReference(VertxTestContext testContext) {
        reply = new JsonObject().put("message", new JsonObject().put("content", new JsonArray()
            .add(new JsonObject().put("type", "text").put("text", "This is our interpretation"))
            .add(new JsonObject().put("type", "sql").put("statement", "SELECT SUM(AMOUNT) FROM ORDERS"))));
        AnalystServiceDefinition analyst = AnalystServiceDefinition.of("revenue", "Revenue", "@DB.SC.STAGE/revenue.yaml");

        cortex.analyze(analyst, "Total revenue?")
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals(CortexAPIService.ANALYST_PATH, lastRequest.get().path());
                JsonObject body = lastBody.get();
                assertEquals("@DB.SC.STAGE/revenue.yaml", body.getString("semantic_model_file"));
                assertFalse(body.containsKey("semantic_view"));
                assertEquals("Total revenue?", body.getJsonArray("messages").getJsonObject(0)
                    .getJsonArray("content").getJsonObject(0).getString("text"));
                assertEquals("SELECT SUM(AMOUNT) FROM ORDERS", result.getString("sql"));
                testContext.completeNow();
            })));
    }

    @Test
    void testAnalystSendsSemanticViewReference(VertxTestContext testContext) {
        reply = new JsonObject().put("message", new JsonObject().put("content", new JsonArray()));
        AnalystServiceDefinition analyst = AnalystServiceDefinition.of("revenue", "Revenue", "SALES.ANALYTICS.REVENUE");

        cortex.analyze(analyst, "Total revenue?")
            .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                assertEquals("SALES.ANALYTICS.REVENUE", lastBody.get().getString("semantic_view"));
                assertFalse(lastBody.get().containsKey("semantic_model_file"));
                testContext.completeNow();
            })));
    }

    @Test
    void testAnalystUnresolvedModelIsNotFound(VertxTestContext testContext) {
        status = 404;
        reply = new JsonObject().put("message", "Semantic model file does not exist");
        AnalystServiceDefinition analyst = AnalystServiceDefinition.of("revenue", "Revenue", "@DB.SC.STAGE/gone.yaml");

        cortex.analyze(analyst, "Total revenue?")
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                ToolInvocationException failure = assertInstanceOf(ToolInvocationException.class, error);
                assertEquals(ErrorKind.NOT_FOUND, failure.getKind());
                assertTrue(failure.getMessage().contains("@DB.SC.STAGE/gone.yaml"));
                testContext.completeNow();
            })));
    }

    @Test
    void testServerErrorIsBackendError(VertxTestContext testContext) {
        status = 500;
        reply = new JsonObject().put("message", "warehouse suspended");

        cortex.search(DOCS, "refunds", List.of(), null, 5)
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                ToolInvocationException failure = assertInstanceOf(ToolInvocationException.class, error);
                assertEquals(ErrorKind.BACKEND_ERROR, failure.getKind());
                assertEquals("Cortex Search error (500): warehouse suspended", failure.getMessage());
                testContext.completeNow();
            })));
    }

    @Test
    void testSlowServiceTimesOut(VertxTestContext testContext) {
        silent = true;

        cortex.search(DOCS, "refunds", List.of(), null, 5)
            .onComplete(testContext.failing(error -> testContext.verify(() -> {
                ToolInvocationException failure = assertInstanceOf(ToolInvocationException.class, error);
                assertEquals(ErrorKind.BACKEND_ERROR, failure.getKind());
                assertTrue(failure.getMessage().contains("did not respond within 500ms"), failure.getMessage());
                testContext.completeNow();
            })));
    }

    @Test
    void testNormalizeAnalystResponse() {
        JsonObject raw = new JsonObject()
            .put("request_id", "a-1")
            .put("warnings", new JsonArray().add(new JsonObject().put("message", "model is large")))
            .put("message", new JsonObject().put("content", new JsonArray()
                .add(new JsonObject().put("type", "text").put("text", "Could you clarify?"))
                .add(new JsonObject().put("type", "suggestions").put("suggestions", new JsonArray()
                    .add("Revenue by region").add("Revenue by month")))
                .add(new JsonObject().put("type", "text").put("text", "Pick one."))));

        JsonObject normalized = CortexAPIService.normalizeAnalystResponse(
            AnalystServiceDefinition.of("revenue", "Revenue", "SALES.ANALYTICS.REVENUE"), raw);

        assertEquals("Could you clarify?\nPick one.", normalized.getString("text"));
        assertNull(normalized.getString("sql"));
        assertEquals(2, normalized.getJsonArray("suggestions").size());
        assertEquals(1, normalized.getJsonArray("warnings").size());
        assertEquals("a-1", normalized.getString("requestId"));
    }
}
