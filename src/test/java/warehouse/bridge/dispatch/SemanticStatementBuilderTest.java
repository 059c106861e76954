package warehouse.bridge.dispatch;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import warehouse.bridge.catalog.ToolSchemas;
import warehouse.bridge.policy.StatementCategory;
import warehouse.bridge.policy.StatementClassifier;

import static org.junit.jupiter.api.Assertions.*;

class SemanticStatementBuilderTest {

    private final SemanticStatementBuilder builder = new SemanticStatementBuilder();
    private final StatementClassifier classifier = new StatementClassifier();

    private static JsonObject view() {
        return new JsonObject()
            .put("database_name", "SALES")
            .put("schema_name", "ANALYTICS")
            .put("view_name", "REVENUE");
    }

    @Test
    void testListAndDescribe() {
        assertEquals("SHOW SEMANTIC VIEWS", builder.build(ToolSchemas.LIST_SEMANTIC_VIEWS, new JsonObject()));
        assertEquals("SHOW SEMANTIC VIEWS LIKE 'REV%' IN SCHEMA SALES.ANALYTICS",
            builder.build(ToolSchemas.LIST_SEMANTIC_VIEWS, new JsonObject()
                .put("database_name", "SALES").put("schema_name", "ANALYTICS").put("like", "REV%")));
        assertEquals("SHOW SEMANTIC VIEWS IN DATABASE SALES",
            builder.build(ToolSchemas.LIST_SEMANTIC_VIEWS, new JsonObject().put("database_name", "SALES")));

        String describe = builder.build(ToolSchemas.DESCRIBE_SEMANTIC_VIEW, view());
        assertEquals("DESCRIBE SEMANTIC VIEW SALES.ANALYTICS.REVENUE", describe);
        assertEquals(StatementCategory.DESCRIBE, classifier.classify(describe));
    }

    @Test
    void testDimensionsAndMetrics() {
        assertEquals("SHOW SEMANTIC DIMENSIONS IN SEMANTIC VIEW SALES.ANALYTICS.REVENUE",
            builder.build(ToolSchemas.SHOW_SEMANTIC_DIMENSIONS, view()));
        assertEquals("SHOW SEMANTIC METRICS LIKE '%revenue%' IN SCHEMA SALES.ANALYTICS",
            builder.build(ToolSchemas.SHOW_SEMANTIC_METRICS, new JsonObject()
                .put("database_name", "SALES").put("schema_name", "ANALYTICS").put("like", "%revenue%")));

        ToolInvocationException e = assertThrows(ToolInvocationException.class,
            () -> builder.build(ToolSchemas.SHOW_SEMANTIC_DIMENSIONS, new JsonObject().put("view_name", "REVENUE")));
        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
    }

    @Test
    void testDdl() {
        String sql = builder.build(ToolSchemas.GET_SEMANTIC_VIEW_DDL, view());
        assertEquals("SELECT GET_DDL('SEMANTIC_VIEW', 'SALES.ANALYTICS.REVENUE', TRUE)", sql);
        assertEquals(StatementCategory.SELECT, classifier.classify(sql));
    }

    @Test
    void testQuery() {
        JsonObject args = view()
            .put("dimensions", new JsonArray().add("customer.region"))
            .put("metrics", new JsonArray().add("orders.total_revenue").add("orders.order_count"))
            .put("where", " customer.region <> 'EMEA' ")
            .put("order_by", new JsonArray().add("total_revenue desc").add("region"))
            .put("limit", 20);

        String sql = builder.build(ToolSchemas.QUERY_SEMANTIC_VIEW, args);

        assertEquals("SELECT * FROM SEMANTIC_VIEW(\n"
            + "    SALES.ANALYTICS.REVENUE\n"
            + "    DIMENSIONS customer.region\n"
            + "    METRICS orders.total_revenue, orders.order_count\n"
            + "    WHERE customer.region <> 'EMEA'\n"
            + ") ORDER BY total_revenue DESC, region LIMIT 20", sql);
        assertEquals(StatementCategory.SELECT, classifier.classify(sql));
    }

    @Test
    void testQueryNeedsDimensionOrMetric() {
        ToolInvocationException e = assertThrows(ToolInvocationException.class,
            () -> builder.build(ToolSchemas.QUERY_SEMANTIC_VIEW, view()));
        assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());

        assertThrows(ToolInvocationException.class, () -> builder.build(ToolSchemas.QUERY_SEMANTIC_VIEW,
            view().put("metrics", new JsonArray().add("m")).put("order_by", new JsonArray().add("m sideways"))));
    }
}
