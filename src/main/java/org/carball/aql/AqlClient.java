package org.carball.aql;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.cache.QueryCacheAdmin;
import org.carball.aql.config.ClientConfig;
import org.carball.aql.http.Connection;
import org.carball.aql.http.HttpExecutor;
import org.carball.aql.http.TransactionExecutor;
import org.carball.aql.query.QueryService;

import java.io.Closeable;
import java.util.Collection;

/**
 * Entry point of the client. Owns the connection to one database and hands out the
 * query and query cache APIs on top of it.
 */
@Slf4j
public class AqlClient implements Closeable {

    @Getter
    private final ClientConfig config;

    private final Connection connection;

    public AqlClient(ClientConfig config) {
        this(config, null);
    }

    AqlClient(ClientConfig config, Connection connection) {
        config.validate();
        this.config = config;
        this.connection = connection != null ? connection : new Connection(config);
        log.info("AQL client ready: {}", config.getConfigurationSummary());
    }

    /**
     * Query API sending each call directly to the server.
     */
    public QueryService query() {
        return new QueryService(connection, new HttpExecutor(connection));
    }

    public QueryCacheAdmin queryCache() {
        return new QueryCacheAdmin(connection, new HttpExecutor(connection));
    }

    /**
     * Query API whose queries run as server-side transactions locking the given
     * collections, in addition to any collections declared per query.
     * <p>
     * Each {@code execute} call is committed as its own {@code POST /_api/transaction};
     * two queries run through the returned service are not atomic together. Calls other
     * than {@code execute} are rejected with a {@code TransactionModeException}.
     */
    public QueryService transaction(Collection<String> readCollections, Collection<String> writeCollections) {
        return new QueryService(connection, new TransactionExecutor(
                connection, readCollections, writeCollections, config.getTransactionLockTimeout()));
    }

    @Override
    public void close() {
        connection.close();
        log.info("AQL client closed for database {}", connection.getDatabaseName());
    }
}
