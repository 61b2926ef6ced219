package org.carball.aql.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.exception.TransactionModeException;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs requests as server-side JavaScript transactions instead of direct HTTP calls.
 * <p>
 * Every request must carry a {@link Request#getCommand() script}. The script is wrapped
 * in a transaction action and posted to {@code /_api/transaction}, locking the
 * collections declared for the transaction plus those declared on the request. The
 * script's return value is handed to the response handler as a finished cursor body,
 * so wrappers parse it exactly as they parse a direct cursor response.
 */
@Slf4j
public class TransactionExecutor implements Executor {

    private static final String TRANSACTION_ENDPOINT = "/_api/transaction";

    private final Connection connection;

    @Getter
    private final List<String> readCollections;

    @Getter
    private final List<String> writeCollections;

    private final Duration lockTimeout;

    public TransactionExecutor(Connection connection,
                               Collection<String> readCollections,
                               Collection<String> writeCollections,
                               Duration lockTimeout) {
        this.connection = connection;
        this.readCollections = readCollections == null ? List.of() : List.copyOf(readCollections);
        this.writeCollections = writeCollections == null ? List.of() : List.copyOf(writeCollections);
        this.lockTimeout = lockTimeout == null ? Duration.ZERO : lockTimeout;
    }

    @Override
    public boolean isTransaction() {
        return true;
    }

    @Override
    public <T> T execute(Request request, ResponseHandler<T> handler) {
        if (!request.hasCommand()) {
            throw new TransactionModeException(
                    "Request " + request.getMethod() + " " + request.getEndpoint() + " cannot run inside a transaction");
        }

        Request transaction = buildTransactionRequest(request);
        log.debug("Running {} {} as a transaction (read={}, write={})",
                request.getMethod(), request.getEndpoint(),
                transaction.getData().path("collections").path("read"),
                transaction.getData().path("collections").path("write"));

        Response response = connection.send(transaction);
        if (!response.isSuccess()) {
            return handler.handle(response);
        }
        return handler.handle(response.toBuilder()
                .body(toCursorBody(response.getBody().path("result")))
                .build());
    }

    Request buildTransactionRequest(Request request) {
        ObjectNode data = connection.getObjectMapper().createObjectNode();

        ObjectNode collections = data.putObject("collections");
        ArrayNode read = collections.putArray("read");
        merge(readCollections, request.getRead()).forEach(read::add);
        ArrayNode write = collections.putArray("write");
        merge(writeCollections, request.getWrite()).forEach(write::add);

        data.put("action", "function () { var db = require('internal').db; return "
                + request.getCommand() + "; }");
        if (!lockTimeout.isZero()) {
            data.put("lockTimeout", lockTimeout.toSeconds());
        }

        return Request.builder()
                .method(HttpMethod.POST)
                .endpoint(TRANSACTION_ENDPOINT)
                .data(data)
                .build();
    }

    private JsonNode toCursorBody(JsonNode result) {
        ObjectNode body = connection.getObjectMapper().createObjectNode();
        if (result.isArray()) {
            body.set("result", result);
            body.put("count", result.size());
        } else {
            ArrayNode single = body.putArray("result");
            if (!result.isMissingNode() && !result.isNull()) {
                single.add(result);
            }
            body.put("count", single.size());
        }
        body.put("hasMore", false);
        body.put("cached", false);
        return body;
    }

    private static Set<String> merge(List<String> declared, List<String> requested) {
        Set<String> names = new LinkedHashSet<>(declared);
        if (requested != null) {
            names.addAll(requested);
        }
        return names;
    }
}
