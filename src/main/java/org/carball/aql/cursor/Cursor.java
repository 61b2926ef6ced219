package org.carball.aql.cursor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.aql.exception.CursorCloseException;
import org.carball.aql.exception.CursorNextException;
import org.carball.aql.http.Connection;
import org.carball.aql.http.ErrorCode;
import org.carball.aql.http.HttpMethod;
import org.carball.aql.http.Request;
import org.carball.aql.http.Response;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates over the documents of a query result, fetching further batches from the
 * server while it reports more results.
 */
@Slf4j
public class Cursor implements Iterator<JsonNode>, AutoCloseable {

    private final Connection connection;
    private final Deque<JsonNode> batch = new ArrayDeque<>();

    @Getter
    private final String id;

    @Getter
    private final Integer count;

    @Getter
    private final boolean cached;

    private boolean hasMore;
    private JsonNode extra = MissingNode.getInstance();

    public Cursor(Connection connection, JsonNode body) {
        this.connection = connection;
        this.id = body.hasNonNull("id") ? body.get("id").asText() : null;
        this.count = body.hasNonNull("count") ? body.get("count").asInt() : null;
        this.cached = body.path("cached").asBoolean(false);
        update(body);
    }

    @Override
    public boolean hasNext() {
        if (!batch.isEmpty()) {
            return true;
        }
        if (hasMore) {
            fetch();
        }
        return !batch.isEmpty();
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Cursor has no more results");
        }
        return batch.poll();
    }

    /**
     * Drains the cursor into a list, fetching every remaining batch.
     */
    public List<JsonNode> toList() {
        List<JsonNode> results = new ArrayList<>();
        while (hasNext()) {
            results.add(next());
        }
        return results;
    }

    /**
     * Whether the server holds more batches for this cursor.
     */
    public boolean hasMore() {
        return hasMore;
    }

    /**
     * Number of documents fetched but not yet returned by {@link #next()}.
     */
    public int batchSize() {
        return batch.size();
    }

    public JsonNode getStatistics() {
        return extra.path("stats");
    }

    public JsonNode getProfile() {
        return extra.path("profile");
    }

    public List<JsonNode> getWarnings() {
        List<JsonNode> warnings = new ArrayList<>();
        extra.path("warnings").forEach(warnings::add);
        return warnings;
    }

    /**
     * Matched document count before the last LIMIT, when the query asked for a full count.
     */
    public Long getFullCount() {
        JsonNode fullCount = getStatistics().get("fullCount");
        return fullCount == null || fullCount.isNull() ? null : fullCount.asLong();
    }

    /**
     * Deletes the cursor on the server, ignoring a cursor the server already dropped.
     */
    @Override
    public void close() {
        close(true);
    }

    /**
     * Deletes the cursor on the server if it still holds results.
     *
     * @return true if the server cursor was deleted, false if there was nothing to delete
     * or the server no longer knew the cursor and {@code ignoreMissing} was set
     */
    public boolean close(boolean ignoreMissing) {
        if (id == null || !hasMore) {
            return false;
        }
        Request request = Request.builder()
                .method(HttpMethod.DELETE)
                .endpoint("/_api/cursor/" + id)
                .build();
        Response response = connection.send(request);
        if (response.getKnownErrorCode() == ErrorCode.CURSOR_NOT_FOUND && ignoreMissing) {
            hasMore = false;
            return false;
        }
        if (!response.isSuccess()) {
            throw new CursorCloseException(response, request);
        }
        hasMore = false;
        batch.clear();
        log.debug("Closed cursor {}", id);
        return true;
    }

    private void fetch() {
        if (id == null) {
            hasMore = false;
            return;
        }
        Request request = Request.builder()
                .method(HttpMethod.PUT)
                .endpoint("/_api/cursor/" + id)
                .build();
        Response response = connection.send(request);
        if (!response.isSuccess()) {
            throw new CursorNextException(response, request);
        }
        update(response.getBody());
        log.trace("Fetched {} more results for cursor {}", batch.size(), id);
    }

    private void update(JsonNode body) {
        body.path("result").forEach(batch::add);
        hasMore = body.path("hasMore").asBoolean(false);
        // follow-up batches usually omit extra; keep the stats of the first one
        if (body.has("extra")) {
            extra = body.get("extra");
        }
    }
}
