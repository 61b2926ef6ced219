package org.carball.aql.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.cache.QueryCacheAdmin;
import org.carball.aql.cursor.Cursor;
import org.carball.aql.exception.FunctionCreateException;
import org.carball.aql.exception.FunctionDeleteException;
import org.carball.aql.exception.FunctionListException;
import org.carball.aql.exception.QueryClearException;
import org.carball.aql.exception.QueryExecuteException;
import org.carball.aql.exception.QueryExplainException;
import org.carball.aql.exception.QueryKillException;
import org.carball.aql.exception.QueryListException;
import org.carball.aql.exception.QueryTrackingGetException;
import org.carball.aql.exception.QueryTrackingSetException;
import org.carball.aql.exception.QueryValidateException;
import org.carball.aql.http.Connection;
import org.carball.aql.http.ErrorCode;
import org.carball.aql.http.Executor;
import org.carball.aql.http.HttpMethod;
import org.carball.aql.http.Request;
import org.carball.aql.model.function.FunctionCreation;
import org.carball.aql.model.function.FunctionDeletion;
import org.carball.aql.model.function.FunctionDescriptor;
import org.carball.aql.model.query.ExplainOptions;
import org.carball.aql.model.query.QueryOptions;
import org.carball.aql.model.query.QueryStatus;
import org.carball.aql.model.query.QueryValidation;
import org.carball.aql.model.query.TrackingProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Runs, inspects and manages AQL queries and user-defined functions of one database.
 */
@Slf4j
public class QueryService {

    private final Connection connection;
    private final Executor executor;

    public QueryService(Connection connection, Executor executor) {
        this.connection = connection;
        this.executor = executor;
    }

    /**
     * Returns the query results cache administration for the same database.
     */
    public QueryCacheAdmin cache() {
        return new QueryCacheAdmin(connection, executor);
    }

    /**
     * Inspects the query and returns its execution plan without running it.
     *
     * @return the optimal plan as an object, or every plan as an array when
     * {@link ExplainOptions#isAllPlans()} is set
     * @throws QueryExplainException if the server rejects the query
     */
    public JsonNode explain(String query, ExplainOptions options) {
        requireQuery(query);
        ExplainOptions explain = options == null ? ExplainOptions.defaults() : options;

        ObjectNode optionsNode = mapper().createObjectNode();
        optionsNode.put("allPlans", explain.isAllPlans());
        if (explain.getMaxPlans() != null) {
            optionsNode.put("maxNumberOfPlans", explain.getMaxPlans());
        }
        if (explain.getOptimizerRules() != null) {
            optionsNode.putObject("optimizer").set("rules", toArray(explain.getOptimizerRules()));
        }

        ObjectNode data = mapper().createObjectNode();
        data.put("query", query);
        data.set("options", optionsNode);

        Request request = Request.builder()
                .method(HttpMethod.POST)
                .endpoint("/_api/explain")
                .data(data)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryExplainException(response, request);
            }
            JsonNode body = response.getBody();
            if (body.has("plan")) {
                return body.get("plan");
            }
            return body.path("plans");
        });
    }

    public JsonNode explain(String query) {
        return explain(query, ExplainOptions.defaults());
    }

    /**
     * Parses the query and reports the collections and bind parameters it uses.
     *
     * @throws QueryValidateException if the query does not parse
     */
    public QueryValidation validate(String query) {
        requireQuery(query);
        ObjectNode data = mapper().createObjectNode();
        data.put("query", query);

        Request request = Request.builder()
                .method(HttpMethod.POST)
                .endpoint("/_api/query")
                .data(data)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryValidateException(response, request);
            }
            return mapper().convertValue(response.getBody(), QueryValidation.class);
        });
    }

    /**
     * Runs the query and returns a cursor over its results.
     * <p>
     * Inside a transaction the query is not sent to the cursor API. The request instead
     * carries an equivalent {@code db._query(...)} script, which the transaction executor
     * runs with the result fully materialized.
     *
     * @throws QueryExecuteException if the server fails to run the query
     */
    public Cursor execute(String query, QueryOptions options) {
        requireQuery(query);
        QueryOptions opts = options == null ? QueryOptions.defaults() : options;

        ObjectNode data = buildCursorPayload(query, opts);

        Request.RequestBuilder request = Request.builder()
                .method(HttpMethod.POST)
                .endpoint("/_api/cursor")
                .data(data)
                .read(opts.getReadCollections())
                .write(opts.getWriteCollections());
        if (executor.isTransaction()) {
            request.command(buildQueryCommand(query, opts, data));
        }
        Request built = request.build();

        log.debug("Executing query ({} characters, {} payload fields)", query.length(), data.size());

        return executor.execute(built, response -> {
            if (!response.isSuccess()) {
                throw new QueryExecuteException(response, built);
            }
            return new Cursor(connection, response.getBody());
        });
    }

    public Cursor execute(String query) {
        return execute(query, QueryOptions.defaults());
    }

    /**
     * Sends a kill signal to a running query. The server stops the query
     * asynchronously, so it may still be listed for a short while.
     *
     * @return true if the server accepted the kill signal
     * @throws QueryKillException if the query is unknown or cannot be killed
     */
    public boolean kill(String queryId) {
        if (queryId == null || queryId.isBlank()) {
            throw new IllegalArgumentException("Query ID must not be blank");
        }
        Request request = Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/query/" + queryId)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryKillException(response, request);
            }
            log.info("Kill signal accepted for query {}", queryId);
            return true;
        });
    }

    /**
     * Lists the queries currently running in the database.
     */
    public List<QueryStatus> queries() {
        return listQueries("/_api/query/current");
    }

    /**
     * Lists the queries kept in the slow query log.
     */
    public List<QueryStatus> slowQueries() {
        return listQueries("/_api/query/slow");
    }

    public boolean clearSlowQueries() {
        Request request = Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/query/slow")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryClearException(response, request);
            }
            return true;
        });
    }

    public TrackingProperties tracking() {
        Request request = Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/query/properties")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryTrackingGetException(response, request);
            }
            return mapper().convertValue(response.getBody(), TrackingProperties.class);
        });
    }

    /**
     * Updates the query tracking settings. Only the non-null fields of {@code update}
     * are sent; the server keeps its current value for the rest.
     *
     * @return the complete settings after the update
     */
    public TrackingProperties setTracking(TrackingProperties update) {
        JsonNode data = update == null
                ? mapper().createObjectNode()
                : mapper().valueToTree(update);

        Request request = Request.builder()
                .method(HttpMethod.PUT)
                .endpoint("/_api/query/properties")
                .data(data)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryTrackingSetException(response, request);
            }
            return mapper().convertValue(response.getBody(), TrackingProperties.class);
        });
    }

    /**
     * Lists the user-defined functions of the database.
     */
    public List<FunctionDescriptor> functions() {
        Request request = Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/aqlfunction")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new FunctionListException(response, request);
            }
            List<FunctionDescriptor> functions = new ArrayList<>();
            JsonNode result = response.getBody().path("result");
            for (JsonNode item : result) {
                functions.add(mapper().convertValue(item, FunctionDescriptor.class));
            }
            return functions;
        });
    }

    /**
     * Creates a user-defined function, replacing an existing one of the same name.
     *
     * @param name fully qualified name, namespaces separated by {@code ::}
     * @param code JavaScript source of the function
     */
    public FunctionCreation createFunction(String name, String code) {
        requireFunctionName(name);
        ObjectNode data = mapper().createObjectNode();
        data.put("name", name);
        data.put("code", code);

        Request request = Request.builder()
                .method(HttpMethod.POST)
                .endpoint("/_api/aqlfunction")
                .data(data)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new FunctionCreateException(response, request);
            }
            return new FunctionCreation(response.getBody().path("isNewlyCreated").asBoolean(false));
        });
    }

    /**
     * Deletes a user-defined function, or with {@code group} every function whose name
     * starts with the given namespace.
     *
     * @param ignoreMissing return an empty result instead of failing when the server
     *                      does not know the function
     * @return the number of deleted functions, or empty if nothing was found and
     * {@code ignoreMissing} was set
     * @throws FunctionDeleteException if the delete fails
     */
    public Optional<FunctionDeletion> deleteFunction(String name, boolean group, boolean ignoreMissing) {
        requireFunctionName(name);
        Request request = Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/aqlfunction/" + name)
                .param("group", Boolean.toString(group))
                .build();

        return executor.execute(request, response -> {
            if (response.getKnownErrorCode() == ErrorCode.QUERY_FUNCTION_NOT_FOUND && ignoreMissing) {
                log.warn("Function {} not found, nothing deleted", name);
                return Optional.empty();
            }
            if (!response.isSuccess()) {
                throw new FunctionDeleteException(response, request);
            }
            return Optional.of(new FunctionDeletion(response.getBody().path("deletedCount").asInt()));
        });
    }

    public Optional<FunctionDeletion> deleteFunction(String name) {
        return deleteFunction(name, false, false);
    }

    ObjectNode buildCursorPayload(String query, QueryOptions opts) {
        ObjectNode data = mapper().createObjectNode();
        data.put("query", query);
        data.put("count", Boolean.TRUE.equals(opts.getCount()));
        if (opts.getBatchSize() != null) {
            data.put("batchSize", opts.getBatchSize());
        }
        if (opts.getTtl() != null) {
            data.put("ttl", opts.getTtl());
        }
        if (opts.getBindVars() != null) {
            data.set("bindVars", mapper().valueToTree(opts.getBindVars()));
        }
        if (opts.getCache() != null) {
            data.put("cache", opts.getCache());
        }
        // zero is meaningful here, so the limit is sent even when falsy
        data.put("memoryLimit", opts.getMemoryLimit() == null ? 0L : opts.getMemoryLimit());

        ObjectNode options = mapper().createObjectNode();
        if (opts.getFullCount() != null) {
            options.put("fullCount", opts.getFullCount());
        }
        if (opts.getMaxPlans() != null) {
            options.put("maxNumberOfPlans", opts.getMaxPlans());
        }
        if (opts.getOptimizerRules() != null) {
            options.putObject("optimizer").set("rules", toArray(opts.getOptimizerRules()));
        }
        if (opts.getFailOnWarning() != null) {
            options.put("failOnWarning", opts.getFailOnWarning());
        }
        if (opts.getProfile() != null) {
            options.put("profile", opts.getProfile());
        }
        if (opts.getMaxTransactionSize() != null) {
            options.put("maxTransactionSize", opts.getMaxTransactionSize());
        }
        if (opts.getMaxWarningCount() != null) {
            options.put("maxWarningCount", opts.getMaxWarningCount());
        }
        if (opts.getIntermediateCommitCount() != null) {
            options.put("intermediateCommitCount", opts.getIntermediateCommitCount());
        }
        if (opts.getIntermediateCommitSize() != null) {
            options.put("intermediateCommitSize", opts.getIntermediateCommitSize());
        }
        if (opts.getSatelliteSyncWait() != null) {
            options.put("satelliteSyncWait", opts.getSatelliteSyncWait());
        }

        // The server reads these both nested and at the top level; send both.
        if (!options.isEmpty()) {
            data.set("options", options.deepCopy());
            data.setAll(options);
        }
        return data;
    }

    String buildQueryCommand(String query, QueryOptions opts, ObjectNode data) {
        return String.format("db._query(%s, %s, %s).toArray()",
                connection.toJson(query),
                connection.toJson(opts.getBindVars()),
                connection.toJson(data));
    }

    private List<QueryStatus> listQueries(String endpoint) {
        Request request = Request.builder()
                .method(HttpMethod.GET)
                .endpoint(endpoint)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new QueryListException(response, request);
            }
            List<QueryStatus> queries = new ArrayList<>();
            for (JsonNode item : response.getBody()) {
                queries.add(mapper().convertValue(item, QueryStatus.class));
            }
            return queries;
        });
    }

    private ArrayNode toArray(Collection<String> values) {
        ArrayNode array = mapper().createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private ObjectMapper mapper() {
        return connection.getObjectMapper();
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
    }

    private static void requireFunctionName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
    }

    @Override
    public String toString() {
        return "QueryService[" + connection.getDatabaseName() + "]";
    }
}
