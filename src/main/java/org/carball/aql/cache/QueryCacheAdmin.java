package org.carball.aql.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.exception.CacheClearException;
import org.carball.aql.exception.CacheConfigureException;
import org.carball.aql.exception.CacheEntriesException;
import org.carball.aql.exception.CachePropertiesException;
import org.carball.aql.http.Connection;
import org.carball.aql.http.Executor;
import org.carball.aql.http.HttpMethod;
import org.carball.aql.http.Request;
import org.carball.aql.model.cache.CacheProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and changes the settings of the AQL query results cache and manages its entries.
 */
@Slf4j
public class QueryCacheAdmin {

    private final Connection connection;
    private final Executor executor;

    public QueryCacheAdmin(Connection connection, Executor executor) {
        this.connection = connection;
        this.executor = executor;
    }

    public CacheProperties properties() {
        Request request = Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/query-cache/properties")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new CachePropertiesException(response, request);
            }
            return connection.getObjectMapper().convertValue(response.getBody(), CacheProperties.class);
        });
    }

    /**
     * Changes the cache settings. Fields left {@code null} in {@code update} are not
     * sent and keep their current value.
     *
     * @return the settings in effect after the change
     */
    public CacheProperties configure(CacheProperties update) {
        JsonNode data = update == null
                ? connection.getObjectMapper().createObjectNode()
                : connection.getObjectMapper().valueToTree(update);

        Request request = Request.builder()
                .method(HttpMethod.PUT)
                .endpoint("/_api/query-cache/properties")
                .data(data)
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new CacheConfigureException(response, request);
            }
            CacheProperties properties = connection.getObjectMapper()
                    .convertValue(response.getBody(), CacheProperties.class);
            log.info("Query cache configured: mode={}, limit={}", properties.getMode(), properties.getLimit());
            return properties;
        });
    }

    /**
     * Lists the cached query results, as reported by the server.
     */
    public List<JsonNode> entries() {
        Request request = Request.builder()
                .method(HttpMethod.GET)
                .endpoint("/_api/query-cache/entries")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new CacheEntriesException(response, request);
            }
            List<JsonNode> entries = new ArrayList<>();
            response.getBody().forEach(entries::add);
            return entries;
        });
    }

    public boolean clear() {
        Request request = Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/query-cache")
                .build();

        return executor.execute(request, response -> {
            if (!response.isSuccess()) {
                throw new CacheClearException(response, request);
            }
            return true;
        });
    }

    @Override
    public String toString() {
        return "QueryCacheAdmin[" + connection.getDatabaseName() + "]";
    }
}
