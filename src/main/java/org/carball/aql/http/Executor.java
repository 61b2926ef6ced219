package org.carball.aql.http;

/**
 * Dispatches requests built by the API wrappers. Implementations decide how a request
 * reaches the server: as a direct HTTP call or as a script inside a transaction.
 */
public interface Executor {

    <T> T execute(Request request, ResponseHandler<T> handler);

    /**
     * Whether requests are being redirected into a server-side transaction. Wrappers
     * attach a {@link Request#getCommand() script} to their requests when this is true.
     */
    default boolean isTransaction() {
        return false;
    }
}
