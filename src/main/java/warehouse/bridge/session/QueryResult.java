package warehouse.bridge.session;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Normalized outcome of one executed statement: either rows or an update count.
 */
public final class QueryResult {

    private final List<String> columns;
    private final JsonArray rows;
    private final long updateCount;

    private QueryResult(List<String> columns, JsonArray rows, long updateCount) {
        this.columns = columns;
        this.rows = rows;
        this.updateCount = updateCount;
    }

    public static QueryResult rows(List<String> columns, JsonArray rows) {
        return new QueryResult(List.copyOf(columns), rows, -1);
    }

    public static QueryResult updateCount(long updateCount) {
        return new QueryResult(List.of(), new JsonArray(), updateCount);
    }

    public List<String> getColumns() {
        return columns;
    }

    public JsonArray getRows() {
        return rows;
    }

    public boolean hasRows() {
        return updateCount < 0;
    }

    public long getUpdateCount() {
        return updateCount;
    }

    public JsonObject toJson() {
        if (!hasRows()) {
            return new JsonObject()
                .put("updateCount", updateCount)
                .put("message", "Statement executed successfully. Rows affected: " + updateCount);
        }
        return new JsonObject()
            .put("columns", new JsonArray(columns))
            .put("rows", rows)
            .put("rowCount", rows.size());
    }
}
