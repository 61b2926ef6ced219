package org.carball.aql.http;

/**
 * Sends each request straight to the server over the connection.
 */
public class HttpExecutor implements Executor {

    private final Connection connection;

    public HttpExecutor(Connection connection) {
        this.connection = connection;
    }

    @Override
    public <T> T execute(Request request, ResponseHandler<T> handler) {
        return handler.handle(connection.send(request));
    }
}
