package warehouse.bridge.services;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import warehouse.bridge.catalog.AnalystServiceDefinition;
import warehouse.bridge.catalog.SearchServiceDefinition;
import warehouse.bridge.config.ConnectionSettings;
import warehouse.bridge.dispatch.ToolInvocationException;
import warehouse.bridge.session.AuthenticationMode;
import warehouse.bridge.session.KeyPairCredentials;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static warehouse.bridge.Driver.logLevel;

/**
 * Client for the Cortex Search and Cortex Analyst REST endpoints.
 * Every request carries its own timeout; failures come back as {@link ToolInvocationException}s.
 */
public class CortexAPIService {

    static final String ANALYST_PATH = "/api/v2/cortex/analyst/message";

    private final Vertx vertx;
    private final WebClient webClient;
    private final String host;
    private final int port;
    private final Credentials credentials;
    private final long timeoutMillis;

    public CortexAPIService(Vertx vertx, String host, int port, boolean ssl, Credentials credentials, long timeoutMillis) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.credentials = credentials;
        this.timeoutMillis = timeoutMillis;

        WebClientOptions options = new WebClientOptions()
            .setUserAgent("warehouse-mcp-bridge/1.0")
            .setConnectTimeout(5000)
            .setSsl(ssl)
            .setTrustAll(false);
        this.webClient = WebClient.create(vertx, options);
    }

    /**
     * Client for the account in <code>settings</code>, authenticating the same way the JDBC sessions do.
     */
    public static CortexAPIService create(Vertx vertx, ConnectionSettings settings, KeyPairCredentials keyPair) {
        Credentials credentials = settings.getAuthenticationMode() == AuthenticationMode.KEY_PAIR
            ? Credentials.keyPair(keyPair, settings.getAccount(), settings.getUser())
            : Credentials.programmaticAccessToken(settings.getPassword());
        LogUtil.logDetail(vertx, "Cortex client for https://" + settings.getHost() + " (timeout "
            + settings.getCortexTimeoutMillis() + "ms)", "CortexAPIService", "StartUp", "Configuration");
        return new CortexAPIService(vertx, settings.getHost(), 443, true, credentials, settings.getCortexTimeoutMillis());
    }

    /**
     * Query a Cortex Search service.
     * @param columns columns to return, or empty for the service defaults
     * @param filter search filter, may be null
     */
    public Future<JsonObject> search(SearchServiceDefinition service, String query, List<String> columns,
                                     JsonObject filter, int limit) {
        String path = "/api/v2/databases/" + encode(service.getDatabase())
            + "/schemas/" + encode(service.getSchema())
            + "/cortex-search-services/" + encode(service.getName()) + ":query";

        JsonObject body = new JsonObject()
            .put("query", query)
            .put("limit", limit);
        if (columns != null && !columns.isEmpty()) {
            body.put("columns", new JsonArray(columns));
        }
        if (filter != null && !filter.isEmpty()) {
            body.put("filter", filter);
        }

        return post(path, body, "Search").compose(response -> {
            if (response.statusCode() == 404) {
                return Future.failedFuture(ToolInvocationException.notFound(
                    "Search service " + service.getDatabase() + "." + service.getSchema() + "." + service.getName()
                        + " does not exist or is not authorized"));
            }
            if (response.statusCode() / 100 != 2) {
                return Future.failedFuture(httpFailure("Cortex Search", response));
            }
            JsonObject json = bodyAsJson(response);
            JsonArray results = json.getJsonArray("results", new JsonArray());
            return Future.succeededFuture(new JsonObject()
                .put("service", service.getName())
                .put("results", results)
                .put("resultCount", results.size())
                .put("requestId", json.getString("request_id")));
        });
    }

    /**
     * Ask a Cortex Analyst service a question. A model reference that does not resolve
     * yields a NotFound failure.
     */
    public Future<JsonObject> analyze(AnalystServiceDefinition service, String question) {
        JsonObject message = new JsonObject()
            .put("role", "user")
            .put("content", new JsonArray().add(new JsonObject().put("type", "text").put("text", question)));
        JsonObject body = new JsonObject().put("messages", new JsonArray().add(message));
        if (service.getReferenceType() == AnalystServiceDefinition.ModelReferenceType.STAGE_FILE) {
            body.put("semantic_model_file", service.getSemanticModel());
        } else {
            body.put("semantic_view", service.getSemanticModel());
        }

        return post(ANALYST_PATH, body, "Analyst").compose(response -> {
            if (response.statusCode() == 404) {
                return Future.failedFuture(ToolInvocationException.notFound(
                    "Semantic model '" + service.getSemanticModel() + "' of analyst service '" + service.getName()
                        + "' could not be resolved"));
            }
            if (response.statusCode() / 100 != 2) {
                return Future.failedFuture(httpFailure("Cortex Analyst", response));
            }
            return Future.succeededFuture(normalizeAnalystResponse(service, bodyAsJson(response)));
        });
    }

    static JsonObject normalizeAnalystResponse(AnalystServiceDefinition service, JsonObject json) {
        StringBuilder text = new StringBuilder();
        String sql = null;
        JsonArray suggestions = new JsonArray();
        JsonArray content = json.getJsonObject("message", new JsonObject()).getJsonArray("content", new JsonArray());
        for (int i = 0; i < content.size(); i++) {
            JsonObject part = content.getJsonObject(i);
            String type = part.getString("type", "");
            if ("text".equals(type)) {
                if (text.length() > 0) {
                    text.append('\n');
                }
                text.append(part.getString("text", ""));
            } else if ("sql".equals(type)) {
                sql = part.getString("statement");
            } else if ("suggestions".equals(type)) {
                suggestions.addAll(part.getJsonArray("suggestions", new JsonArray()));
            }
        }
        return new JsonObject()
            .put("service", service.getName())
            .put("text", text.toString())
            .put("sql", sql)
            .put("suggestions", suggestions)
            .put("warnings", json.getJsonArray("warnings", new JsonArray()))
            .put("requestId", json.getString("request_id"));
    }

    private Future<HttpResponse<Buffer>> post(String path, JsonObject body, String operation) {
        Promise<HttpResponse<Buffer>> promise = Promise.promise();

        HttpRequest<Buffer> request = webClient
            .post(port, host, path)
            .timeout(timeoutMillis)
            .putHeader("Authorization", "Bearer " + credentials.token())
            .putHeader("X-Snowflake-Authorization-Token-Type", credentials.tokenType())
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "application/json");

        LogUtil.logDetail(vertx, "Calling Cortex " + operation + " at " + host + path, "CortexAPIService", operation, "Request");
        if (logLevel >= LogUtil.DATA) {
            LogUtil.logData(vertx, "Cortex request body: " + body.encode(), "CortexAPIService", operation, "Request");
        }

        long started = System.currentTimeMillis();
        request.sendJsonObject(body).onComplete(ar -> {
            if (ar.succeeded()) {
                LogUtil.logDetail(vertx, "Cortex " + operation + " answered " + ar.result().statusCode() + " in "
                    + (System.currentTimeMillis() - started) + "ms", "CortexAPIService", operation, "Response");
                promise.complete(ar.result());
                return;
            }
            Throwable cause = ar.cause();
            if (cause instanceof TimeoutException || String.valueOf(cause.getMessage()).toLowerCase().contains("timeout")) {
                LogUtil.logError(vertx, "Cortex " + operation + " request timed out after " + timeoutMillis + "ms",
                    "CortexAPIService", operation, "Timeout");
                promise.fail(ToolInvocationException.backend(
                    "Cortex " + operation + " did not respond within " + timeoutMillis + "ms", cause));
            } else {
                LogUtil.logError(vertx, "Cortex " + operation + " connection failed", cause,
                    "CortexAPIService", operation, "Network");
                promise.fail(ToolInvocationException.backend(
                    "Failed to reach Cortex " + operation + ": " + cause.getMessage(), cause));
            }
        });
        return promise.future();
    }

    private ToolInvocationException httpFailure(String service, HttpResponse<Buffer> response) {
        String detail;
        try {
            JsonObject error = response.bodyAsJsonObject();
            detail = error == null ? "" : error.getString("message", error.encode());
        } catch (DecodeException e) {
            detail = response.bodyAsString();
        }
        LogUtil.logError(vertx, service + " error " + response.statusCode() + ": " + detail,
            "CortexAPIService", "Response", "Error");
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            return ToolInvocationException.backend(service + " rejected the credentials (" + response.statusCode() + "): "
                + detail, null);
        }
        return ToolInvocationException.backend(service + " error (" + response.statusCode() + "): " + detail, null);
    }

    private static JsonObject bodyAsJson(HttpResponse<Buffer> response) {
        try {
            JsonObject json = response.bodyAsJsonObject();
            return json == null ? new JsonObject() : json;
        } catch (DecodeException e) {
            throw ToolInvocationException.backend("Cortex returned a response that is not JSON", e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public void close() {
        webClient.close();
    }

    /**
     * Bearer token for the REST API: a programmatic access token, or a key-pair JWT that is
     * re-signed shortly before it expires.
     */
    public abstract static class Credentials {

        abstract String token();

        abstract String tokenType();

        public static Credentials programmaticAccessToken(String token) {
            return new Credentials() {
                @Override
                String token() {
                    return token;
                }

                @Override
                String tokenType() {
                    return "PROGRAMMATIC_ACCESS_TOKEN";
                }
            };
        }

        public static Credentials keyPair(KeyPairCredentials keyPair, String account, String user) {
            return new Credentials() {
                private static final long RENEW_AFTER_SECONDS = 3000;
                private String jwt;
                private long issuedAt;

                @Override
                synchronized String token() {
                    long now = System.currentTimeMillis() / 1000;
                    if (jwt == null || now - issuedAt > RENEW_AFTER_SECONDS) {
                        jwt = keyPair.createJwt(account, user, now);
                        issuedAt = now;
                    }
                    return jwt;
                }

                @Override
                String tokenType() {
                    return "KEYPAIR_JWT";
                }
            };
        }
    }
}
